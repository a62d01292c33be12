package com.bit.chainsim.node;

/**
 * 节点状态，只是数据状态，不会阻塞事件循环
 */
public enum NodeState {
    /** 不出块也没有待补的祖先 */
    IDLE,
    /** 自主出块节点，出块尚未停止 */
    MINING,
    /** 缓冲区中有等待父区块的区块 */
    AWAITING_ANCESTOR
}
