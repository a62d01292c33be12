package com.bit.chainsim.event;

import com.bit.chainsim.structure.event.ScheduledEvent;
import com.bit.chainsim.structure.event.SimEvent;

/**
 * 离散事件调度器：按 (模拟时间, 插入序号) 严格排序
 * 不提供取消操作，过期事件在分发时以幂等空操作处理
 */
public interface EventQueue {

    /**
     * 插入事件，O(log n)
     * @param atTime 模拟时间（非负、非NaN）
     * @param event  事件
     * @return 分配的插入序号
     */
    long schedule(double atTime, SimEvent event);

    /**
     * 取出 (time, sequence) 最小的事件
     * @throws com.bit.chainsim.exception.EmptyQueueException 队列为空时
     */
    ScheduledEvent popNext();

    /**
     * 下一事件的时间，队列为空时返回 Double.POSITIVE_INFINITY
     */
    double peekTime();

    boolean isEmpty();

    int size();
}
