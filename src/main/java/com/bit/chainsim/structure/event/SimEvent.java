package com.bit.chainsim.structure.event;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.structure.block.Block;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 模拟事件：按kind区分，携带目标节点与载荷
 * 由驱动器或节点在调度时创建，被事件队列恰好消费一次
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SimEvent {

    public static final int NO_NODE = -1;

    EventKind kind;

    /** 目标节点 */
    int target;

    /** BLOCK_ARRIVAL 的区块 */
    Block block;

    /** BLOCK_ARRIVAL / BLOCK_REQUEST 的发送方，本地产生时为 NO_NODE */
    int sender;

    /** MINE_ATTEMPT 的试验令牌 */
    MiningTrial trial;

    /** BLOCK_REQUEST 请求的区块ID */
    BlockHash requestedId;

    /** BLOCK_REQUEST 的发起节点 */
    int origin;

    /** BLOCK_REQUEST 剩余跳数 */
    int ttl;

    public static SimEvent mineAttempt(int target, MiningTrial trial) {
        return new SimEvent(EventKind.MINE_ATTEMPT, target, null, NO_NODE, trial, null, NO_NODE, 0);
    }

    public static SimEvent blockArrival(int target, Block block, int sender) {
        return new SimEvent(EventKind.BLOCK_ARRIVAL, target, block, sender, null, null, NO_NODE, 0);
    }

    public static SimEvent forkCheck(int target) {
        return new SimEvent(EventKind.FORK_CHECK, target, null, NO_NODE, null, null, NO_NODE, 0);
    }

    public static SimEvent blockRequest(int target, BlockHash requestedId, int sender, int origin, int ttl) {
        return new SimEvent(EventKind.BLOCK_REQUEST, target, null, sender, null, requestedId, origin, ttl);
    }
}
