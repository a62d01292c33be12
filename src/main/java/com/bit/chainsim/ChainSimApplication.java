package com.bit.chainsim;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.chainsim")
public class ChainSimApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChainSimApplication.class, args);
        log.info("区块链网络模拟器已启动");
    }
}
