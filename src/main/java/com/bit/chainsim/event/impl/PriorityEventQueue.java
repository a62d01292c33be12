package com.bit.chainsim.event.impl;

import com.bit.chainsim.event.EventQueue;
import com.bit.chainsim.exception.EmptyQueueException;
import com.bit.chainsim.structure.event.ScheduledEvent;
import com.bit.chainsim.structure.event.SimEvent;

import java.util.PriorityQueue;

/**
 * 基于二叉堆的事件队列，单线程使用
 */
public class PriorityEventQueue implements EventQueue {

    private final PriorityQueue<ScheduledEvent> heap = new PriorityQueue<>();

    // 单调递增的插入计数器
    private long nextSequence = 0;

    @Override
    public long schedule(double atTime, SimEvent event) {
        if (Double.isNaN(atTime) || atTime < 0) {
            throw new IllegalArgumentException("非法的调度时间: " + atTime);
        }
        if (event == null) {
            throw new IllegalArgumentException("事件不能为空");
        }
        long sequence = nextSequence++;
        heap.add(new ScheduledEvent(atTime, sequence, event));
        return sequence;
    }

    @Override
    public ScheduledEvent popNext() {
        ScheduledEvent next = heap.poll();
        if (next == null) {
            throw new EmptyQueueException();
        }
        return next;
    }

    @Override
    public double peekTime() {
        ScheduledEvent head = heap.peek();
        return head == null ? Double.POSITIVE_INFINITY : head.getTime();
    }

    @Override
    public boolean isEmpty() {
        return heap.isEmpty();
    }

    @Override
    public int size() {
        return heap.size();
    }
}
