package com.bit.chainsim.structure.event;

public enum EventKind {
    /** 出块尝试（PoW挖矿试验 / PoS插槽抽签） */
    MINE_ATTEMPT,
    /** 区块经链路延迟到达目标节点 */
    BLOCK_ARRIVAL,
    /** 周期性重新评估链头并记录分叉情况 */
    FORK_CHECK,
    /** 向邻居请求缺失的祖先区块（带TTL） */
    BLOCK_REQUEST
}
