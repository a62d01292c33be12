package com.bit.chainsim.api;

import com.bit.chainsim.config.SimulationProperties;
import com.bit.chainsim.result.Result;
import com.bit.chainsim.service.SimulationService;
import com.bit.chainsim.sim.LedgerSnapshot;
import com.bit.chainsim.stats.ChainSummary;
import com.bit.chainsim.structure.run.RunOverview;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/simulation")
public class SimulationApi {

    @Autowired
    private SimulationService simulationService;

    /**
     * 提交参数运行一次模拟，不带请求体时使用默认配置
     * @param properties simulation.* 同名参数
     * @return 运行概要，含 runId
     */
    @PostMapping("/run")
    public Result<RunOverview> run(@RequestBody(required = false) SimulationProperties properties) {
        return simulationService.run(properties);
    }

    /**
     * 各节点最终账本快照
     */
    @GetMapping("/{runId}/snapshot")
    public Result<List<LedgerSnapshot>> snapshot(@PathVariable("runId") String runId) {
        return simulationService.snapshot(runId);
    }

    @GetMapping("/{runId}/stats")
    public Result<ChainSummary> stats(@PathVariable("runId") String runId,
                                      @RequestParam(value = "k", defaultValue = "0") int k) {
        return simulationService.stats(runId, k);
    }

    /**
     * 单行文本形式的完整轨迹
     */
    @GetMapping("/{runId}/trace")
    public Result<List<String>> trace(@PathVariable("runId") String runId) {
        return simulationService.trace(runId);
    }

}
