package com.bit.chainsim.service.impl;

import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.config.SimulationProperties;
import com.bit.chainsim.exception.ConfigurationException;
import com.bit.chainsim.exception.ErrorType;
import com.bit.chainsim.exception.SimulationException;
import com.bit.chainsim.result.Result;
import com.bit.chainsim.service.SimulationService;
import com.bit.chainsim.sim.LedgerSnapshot;
import com.bit.chainsim.sim.SimulationDriver;
import com.bit.chainsim.sim.SimulationResult;
import com.bit.chainsim.stats.ChainStatistics;
import com.bit.chainsim.stats.ChainSummary;
import com.bit.chainsim.structure.run.RunOverview;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class SimulationServiceImpl implements SimulationService {

    @Autowired
    private SimulationProperties defaultProperties;

    // 最近的运行结果，过期后需要重新运行
    private final Cache<String, SimulationResult> results = Caffeine.newBuilder()
            .maximumSize(64)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .recordStats()
            .build();

    private final AtomicLong runCounter = new AtomicLong();

    /**
     * 运行一次模拟并缓存结果
     * @param properties 请求参数，为空时使用默认配置
     * @return 运行概要
     */
    @Override
    public Result<RunOverview> run(SimulationProperties properties) {
        SimulationProperties source = properties == null ? defaultProperties : properties;
        try {
            SimulationConfig config = source.toConfig();
            long start = System.currentTimeMillis();
            SimulationResult result = new SimulationDriver(config).seed().run();
            String runId = "run-" + runCounter.incrementAndGet();
            results.put(runId, result);
            log.info("{} 完成，耗时{}ms，终止原因 {}", runId, System.currentTimeMillis() - start, result.getHaltReason());
            return Result.ok(RunOverview.of(runId, result));
        } catch (ConfigurationException e) {
            log.warn("模拟配置无效: {}", e.getMessage());
            return Result.badRequest(e.getMessage());
        } catch (SimulationException e) {
            log.error("模拟运行失败，类型 {}", e.getErrorType(), e);
            return Result.error(e.getMessage());
        }
    }

    @Override
    public Result<List<LedgerSnapshot>> snapshot(String runId) {
        try {
            return Result.ok(new ArrayList<>(require(runId).getSnapshots().values()));
        } catch (SimulationException e) {
            return Result.notFound(e.getMessage());
        }
    }

    @Override
    public Result<ChainSummary> stats(String runId, int k) {
        if (k < 0) {
            return Result.badRequest("k 不能为负: " + k);
        }
        try {
            return Result.ok(ChainStatistics.summarize(require(runId), k));
        } catch (SimulationException e) {
            return Result.notFound(e.getMessage());
        }
    }

    @Override
    public Result<List<String>> trace(String runId) {
        try {
            return Result.ok(require(runId).traceLines());
        } catch (SimulationException e) {
            return Result.notFound(e.getMessage());
        }
    }

    @Override
    public Optional<SimulationResult> find(String runId) {
        return Optional.ofNullable(results.getIfPresent(runId));
    }

    private SimulationResult require(String runId) {
        SimulationResult result = results.getIfPresent(runId);
        if (result == null) {
            throw new SimulationException(ErrorType.RUN_NOT_FOUND, runId);
        }
        return result;
    }
}
