package com.bit.chainsim.structure.trace;

public enum TraceKind {
    /** 本节点出块并写入自身账本 */
    MINED,
    /** 收到的区块校验通过并写入账本 */
    ACCEPTED,
    /** 父区块缺失，进入待处理缓冲区 */
    BUFFERED,
    /** 共识校验失败，丢弃且不转发 */
    REJECTED,
    /** 链路丢包 */
    DROPPED,
    /** 周期性链头检查，detail为叶子数 */
    FORK_CHECK,
    /** 发出缺失祖先请求 */
    REQUESTED,
    /** 模拟结束时仍缺少祖先的区块 */
    ORPHAN_UNRESOLVED
}
