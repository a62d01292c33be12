package com.bit.chainsim.sim;

import com.bit.chainsim.config.LatencyDistribution;
import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.consensus.ConsensusKind;
import com.bit.chainsim.exception.ConfigurationException;
import com.bit.chainsim.structure.trace.TraceKind;
import com.bit.chainsim.structure.trace.TraceRecord;
import com.bit.chainsim.topology.TopologyKind;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bit.chainsim.sim.SimulationScenarioTest.records;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class SimulationDriverTest {

    private static SimulationConfig.SimulationConfigBuilder randomNetwork() {
        return SimulationConfig.builder()
                .topologyKind(TopologyKind.FULLY_CONNECTED)
                .nodeCount(8)
                .latencyDistribution(LatencyDistribution.exponential(0.4, 0.05))
                .jitter(true)
                .jitterStart(true)
                .miningProbability(0.05)
                .seed(2024L);
    }

    private static SimulationResult run(SimulationConfig config) {
        return new SimulationDriver(config).seed().run();
    }

    @Test
    void identicalSeedsProduceIdenticalTraces() {
        SimulationConfig config = randomNetwork().maxTime(80).build();
        List<String> first = run(config).traceLines();
        List<String> second = run(config).traceLines();
        assertTrue(first.size() > 0);
        assertEquals(first, second);

        List<String> other = run(config.toBuilder().seed(2025L).build()).traceLines();
        assertNotEquals(first, other);
    }

    @Test
    void blockHorizonDrainsPropagationAndReplicatesEverywhere() {
        for (ConsensusKind consensus : ConsensusKind.values()) {
            SimulationConfig config = randomNetwork().consensus(consensus).maxBlocks(15).build();
            SimulationDriver driver = new SimulationDriver(config).seed();
            SimulationResult result = driver.run();
            log.info("{}: 终止 {}，t={}，出块 {}", consensus, result.getHaltReason(), result.getEndTime(),
                    result.getBlocksMined());

            assertEquals(HaltReason.BLOCK_HORIZON, result.getHaltReason());
            assertEquals(15, result.getBlocksMined());
            assertEquals(0, result.getRejectedBlocks());
            assertEquals(0, result.getOrphanedBlocks());
            assertEquals(16, result.getBlocks().size());
            for (LedgerSnapshot snapshot : result.getSnapshots().values()) {
                assertEquals(16, snapshot.getBlocksSeen().size());
                assertEquals(0, snapshot.getPendingCount());
                assertTrue(driver.node(snapshot.getNodeId()).getView().isClosedUnderAncestry());
            }
        }
    }

    @Test
    void timeHorizonStopsBeforeLaterEvents() {
        SimulationResult result = run(randomNetwork().maxTime(30).build());
        assertEquals(HaltReason.TIME_HORIZON, result.getHaltReason());
        assertTrue(result.getEndTime() <= 30);
        for (TraceRecord record : result.getTrace()) {
            assertTrue(record.getTimestamp() <= 30);
        }
    }

    @Test
    void traceTimestampsAreNonDecreasing() {
        SimulationResult result = run(randomNetwork().maxTime(60).build());
        double last = 0;
        for (TraceRecord record : result.getTrace()) {
            assertTrue(record.getTimestamp() >= last);
            last = record.getTimestamp();
        }
    }

    @Test
    void eventBudgetHaltsRun() {
        SimulationResult result = run(randomNetwork().maxTime(1000).maxEvents(50).build());
        assertEquals(HaltReason.EVENT_BUDGET, result.getHaltReason());
        assertEquals(50, result.getDispatchedEvents());
    }

    @Test
    void minerSubsetLimitsProducers() {
        SimulationResult result = run(randomNetwork().minerCount(2).maxBlocks(10).build());
        for (TraceRecord mined : records(result, TraceKind.MINED)) {
            assertTrue(mined.getNodeId() < 2);
        }
    }

    @Test
    void dropsAreTracedAndBufferedBlocksRequestParents() {
        SimulationConfig config = randomNetwork()
                .topologyKind(TopologyKind.RING)
                .dropRate(0.2)
                .ancestorRequestTtl(3)
                .maxTime(150)
                .build();
        SimulationDriver driver = new SimulationDriver(config).seed();
        SimulationResult result = driver.run();

        assertTrue(result.getDroppedMessages() > 0);
        assertEquals(result.getDroppedMessages(), records(result, TraceKind.DROPPED).size());
        for (int nodeId : result.getSnapshots().keySet()) {
            long buffered = records(result, TraceKind.BUFFERED).stream().filter(r -> r.getNodeId() == nodeId).count();
            long requested = records(result, TraceKind.REQUESTED).stream().filter(r -> r.getNodeId() == nodeId).count();
            if (buffered > 0) {
                assertTrue(requested > 0, "节点 " + nodeId + " 缓冲了区块却没有请求祖先");
            }
            assertTrue(driver.node(nodeId).getView().isClosedUnderAncestry());
        }
        assertEquals(result.getOrphanedBlocks(), records(result, TraceKind.ORPHAN_UNRESOLVED).size());
    }

    @Test
    void periodicForkChecksStopAtTimeHorizon() {
        SimulationConfig config = SimulationConfig.builder()
                .nodeCount(4)
                .latencyDistribution(LatencyDistribution.fixed(1.0))
                .minerCount(0)
                .forkCheckInterval(2.0)
                .maxTime(10)
                .build();
        SimulationResult result = new SimulationDriver(config).seed().scheduleForcedTrial(0, 0).run();

        List<TraceRecord> checks = records(result, TraceKind.FORK_CHECK);
        assertEquals(20, checks.size());
        for (TraceRecord check : checks) {
            assertEquals("tips=1", check.getDetail());
            assertEquals(1, check.getHeadHeight());
        }
        assertEquals(HaltReason.TIME_HORIZON, result.getHaltReason());
    }

    @Test
    void invalidConfigurationFailsBeforeStart() {
        assertThrows(ConfigurationException.class, () -> new SimulationDriver(SimulationConfig.builder().build()));
        assertThrows(ConfigurationException.class,
                () -> new SimulationDriver(SimulationConfig.builder().nodeCount(0).maxBlocks(1).build()));
        assertThrows(ConfigurationException.class,
                () -> new SimulationDriver(SimulationConfig.builder().dropRate(1.0).maxBlocks(1).build()));
    }

    @Test
    void driverRunsOnlyOnce() {
        SimulationDriver driver = new SimulationDriver(randomNetwork().maxTime(5).build()).seed();
        driver.run();
        assertThrows(IllegalStateException.class, driver::run);
        assertThrows(IllegalStateException.class, driver::seed);
    }
}
