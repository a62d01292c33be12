package com.bit.chainsim.sim;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.node.NodeState;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 模拟结束时单个节点账本视图的只读快照
 */
@Value
@Builder
public class LedgerSnapshot {

    int nodeId;

    NodeState state;

    BlockHash headId;

    long headHeight;

    /** 按到达顺序，含创世区块 */
    List<BlockHash> blocksSeen;

    /** 区块ID → 本节点收到的模拟时间 */
    Map<BlockHash, Double> arrivalTimes;

    List<BlockHash> tips;

    int pendingCount;

    public boolean hasSeen(BlockHash blockId) {
        return arrivalTimes.containsKey(blockId);
    }
}
