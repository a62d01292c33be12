package com.bit.chainsim.stats;

import com.bit.chainsim.config.LatencyDistribution;
import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.sim.SimulationDriver;
import com.bit.chainsim.sim.SimulationResult;
import com.bit.chainsim.topology.TopologyKind;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class ChainStatisticsTest {

    private static SimulationDriver ring() {
        SimulationConfig config = SimulationConfig.builder()
                .topologyKind(TopologyKind.RING)
                .nodeCount(5)
                .latencyDistribution(LatencyDistribution.fixed(1.0))
                .minerCount(0)
                .maxTime(50)
                .build();
        return new SimulationDriver(config)
                .scheduleForcedTrial(0, 0.0)
                .scheduleForcedTrial(2, 0.0);
    }

    @Test
    void summarizesResolvedFork() {
        SimulationResult result = ring().scheduleForcedTrial(3, 5.0).run();
        ChainSummary summary = ChainStatistics.summarize(result, 0);
        log.info("统计摘要: {}", summary);

        assertEquals(3, summary.getBlocksMined());
        assertEquals(1, summary.getForkCount());
        assertEquals(1, summary.getStaleBlocks());
        assertEquals(2, summary.getCanonicalHeight());
        assertEquals(1, summary.getDistinctHeads());

        assertEquals(12, summary.getPropagationSamples());
        assertEquals(1.5, summary.getPropagationMean(), 1e-9);
        assertEquals(1.5, summary.getPropagationMedian(), 1e-9);
        assertEquals(2.0, summary.getPropagationP90(), 1e-9);
        assertEquals(2.0, summary.getPropagationMax(), 1e-9);

        assertTrue(summary.isConverged());
        assertEquals(7.0, summary.getConvergenceTime(), 1e-9);
    }

    @Test
    void deeperConvergenceDepthToleratesShallowForks() {
        SimulationResult result = ring().scheduleForcedTrial(3, 5.0).run();
        assertEquals(7.0, ChainStatistics.convergenceTime(result, 1), 1e-9);
        assertEquals(0.0, ChainStatistics.convergenceTime(result, 2), 1e-9);
    }

    @Test
    void unresolvedForkNeverConvergesAtDepthZero() {
        SimulationResult result = ring().run();
        ChainSummary summary = ChainStatistics.summarize(result, 0);
        assertFalse(summary.isConverged());
        assertNull(summary.getConvergenceTime());
        assertEquals(2, summary.getDistinctHeads());
        // 3个节点持有先出的区块
        assertEquals(result.snapshot(0).getHeadId(), summary.getCanonicalHead());
        assertEquals(1, summary.getStaleBlocks());

        assertEquals(0.0, ChainStatistics.convergenceTime(result, 1), 1e-9);
    }

    @Test
    void rejectsNegativeDepth() {
        SimulationResult result = ring().run();
        assertThrows(IllegalArgumentException.class, () -> ChainStatistics.summarize(result, -1));
    }
}
