package com.bit.chainsim.sim;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.config.LatencyDistribution;
import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.consensus.TieBreak;
import com.bit.chainsim.structure.trace.TraceKind;
import com.bit.chainsim.structure.trace.TraceRecord;
import com.bit.chainsim.topology.TopologyKind;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 固定延迟、手动出块的确定性场景
 */
@Slf4j
public class SimulationScenarioTest {

    private static SimulationConfig scripted(TopologyKind kind, int nodes, TieBreak tieBreak) {
        return SimulationConfig.builder()
                .topologyKind(kind)
                .nodeCount(nodes)
                .latencyDistribution(LatencyDistribution.fixed(1.0))
                .minerCount(0)
                .tieBreak(tieBreak)
                .maxTime(50)
                .build();
    }

    static List<TraceRecord> records(SimulationResult result, TraceKind kind) {
        return result.getTrace().stream().filter(r -> r.getKind() == kind).collect(Collectors.toList());
    }

    static BlockHash minedBy(SimulationResult result, int nodeId) {
        return records(result, TraceKind.MINED).stream()
                .filter(r -> r.getNodeId() == nodeId)
                .findFirst()
                .orElseThrow(() -> new AssertionError("节点 " + nodeId + " 没有出块"))
                .getBlockId();
    }

    @Test
    void singleBlockReachesFullyConnectedNetworkInOneHop() {
        SimulationResult result = new SimulationDriver(scripted(TopologyKind.FULLY_CONNECTED, 4, TieBreak.FIRST_SEEN))
                .scheduleForcedTrial(0, 0.0)
                .run();

        BlockHash block = minedBy(result, 0);
        assertEquals(1, result.getBlocksMined());
        assertEquals(HaltReason.QUEUE_EXHAUSTED, result.getHaltReason());
        for (LedgerSnapshot snapshot : result.getSnapshots().values()) {
            assertTrue(snapshot.hasSeen(block));
            assertTrue(snapshot.getArrivalTimes().get(block) <= 1.0);
            assertEquals(block, snapshot.getHeadId());
            assertEquals(1, snapshot.getHeadHeight());
        }
        assertEquals(3, records(result, TraceKind.ACCEPTED).size());
        // 3个接收节点各向另外两个节点转发一次
        assertEquals(6, result.getDuplicateDeliveries());
    }

    @Test
    void ringForkResolvesWithNextBlock() {
        SimulationResult result = new SimulationDriver(scripted(TopologyKind.RING, 5, TieBreak.FIRST_SEEN))
                .scheduleForcedTrial(0, 0.0)
                .scheduleForcedTrial(2, 0.0)
                .scheduleForcedTrial(3, 5.0)
                .run();

        BlockHash a = minedBy(result, 0);
        BlockHash b = minedBy(result, 2);
        BlockHash c = minedBy(result, 3);
        assertNotEquals(a, b);

        // t=5 之前各节点的链头按先到先得分成两派
        Map<Integer, BlockHash> headsBeforeC = new HashMap<>();
        for (TraceRecord record : result.getTrace()) {
            if (record.getTimestamp() < 5.0 && record.getHeadId() != null) {
                headsBeforeC.put(record.getNodeId(), record.getHeadId());
            }
        }
        log.info("分叉期间的链头: {}", headsBeforeC);
        assertEquals(a, headsBeforeC.get(0));
        assertEquals(a, headsBeforeC.get(1));
        assertEquals(b, headsBeforeC.get(2));
        assertEquals(b, headsBeforeC.get(3));
        assertEquals(a, headsBeforeC.get(4));

        assertEquals(1, result.distinctHeads().size());
        for (LedgerSnapshot snapshot : result.getSnapshots().values()) {
            assertEquals(c, snapshot.getHeadId());
            assertEquals(2, snapshot.getHeadHeight());
            assertTrue(snapshot.hasSeen(a) && snapshot.hasSeen(b));
            assertEquals(2, snapshot.getTips().size());
        }
    }

    @Test
    void ringForkResolvesByLowestIdWithoutNextBlock() {
        SimulationResult result = new SimulationDriver(scripted(TopologyKind.RING, 5, TieBreak.LOWEST_ID))
                .scheduleForcedTrial(0, 0.0)
                .scheduleForcedTrial(2, 0.0)
                .run();

        BlockHash a = minedBy(result, 0);
        BlockHash b = minedBy(result, 2);
        BlockHash lower = a.compareTo(b) < 0 ? a : b;
        assertEquals(1, result.distinctHeads().size());
        assertEquals(lower, result.distinctHeads().iterator().next());
    }

    @Test
    void forkPersistsUnderFirstSeenWithoutNextBlock() {
        SimulationResult result = new SimulationDriver(scripted(TopologyKind.RING, 5, TieBreak.FIRST_SEEN))
                .scheduleForcedTrial(0, 0.0)
                .scheduleForcedTrial(2, 0.0)
                .run();
        assertEquals(2, result.distinctHeads().size());
        for (LedgerSnapshot snapshot : result.getSnapshots().values()) {
            assertEquals(3, snapshot.getBlocksSeen().size());
        }
    }
}
