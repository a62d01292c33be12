package com.bit.chainsim.service;

import com.bit.chainsim.config.SimulationProperties;
import com.bit.chainsim.result.Result;
import com.bit.chainsim.sim.LedgerSnapshot;
import com.bit.chainsim.sim.SimulationResult;
import com.bit.chainsim.stats.ChainSummary;
import com.bit.chainsim.structure.run.RunOverview;

import java.util.List;
import java.util.Optional;

public interface SimulationService {

    /**
     * 运行一次模拟，properties 为空时使用 application.yml 中的默认配置
     */
    Result<RunOverview> run(SimulationProperties properties);

    Result<List<LedgerSnapshot>> snapshot(String runId);

    Result<ChainSummary> stats(String runId, int k);

    Result<List<String>> trace(String runId);

    Optional<SimulationResult> find(String runId);
}
