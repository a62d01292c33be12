package com.bit.chainsim.structure.run;

import com.bit.chainsim.consensus.ConsensusKind;
import com.bit.chainsim.sim.HaltReason;
import com.bit.chainsim.sim.SimulationResult;
import com.bit.chainsim.topology.TopologyKind;
import lombok.Builder;
import lombok.Value;

/**
 * 接口返回的运行概要
 */
@Value
@Builder
public class RunOverview {

    String runId;

    long seed;

    int nodeCount;

    TopologyKind topology;

    ConsensusKind consensus;

    HaltReason haltReason;

    double endTime;

    long dispatchedEvents;

    long blocksMined;

    long rejectedBlocks;

    long droppedMessages;

    long orphanedBlocks;

    int distinctHeads;

    public static RunOverview of(String runId, SimulationResult result) {
        return RunOverview.builder()
                .runId(runId)
                .seed(result.getConfig().getSeed())
                .nodeCount(result.getSnapshots().size())
                .topology(result.getTopologyKind())
                .consensus(result.getConfig().getConsensus())
                .haltReason(result.getHaltReason())
                .endTime(result.getEndTime())
                .dispatchedEvents(result.getDispatchedEvents())
                .blocksMined(result.getBlocksMined())
                .rejectedBlocks(result.getRejectedBlocks())
                .droppedMessages(result.getDroppedMessages())
                .orphanedBlocks(result.getOrphanedBlocks())
                .distinctHeads(result.distinctHeads().size())
                .build();
    }
}
