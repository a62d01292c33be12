package com.bit.chainsim.sim;

/**
 * 模拟终止原因
 */
public enum HaltReason {
    /** 事件队列为空 */
    QUEUE_EXHAUSTED,
    /** 下一事件晚于 maxTime */
    TIME_HORIZON,
    /** 达到出块上限且剩余传播已排空 */
    BLOCK_HORIZON,
    /** 分发事件数达到 maxEvents */
    EVENT_BUDGET
}
