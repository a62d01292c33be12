package com.bit.chainsim.structure.event;

import lombok.Value;

/**
 * 队列中的事件条目，按 (time, sequence) 排序
 */
@Value
public class ScheduledEvent implements Comparable<ScheduledEvent> {

    double time;

    /** 插入序号，同一时刻的事件按插入顺序出队 */
    long sequence;

    SimEvent event;

    @Override
    public int compareTo(ScheduledEvent other) {
        int byTime = Double.compare(time, other.time);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }
}
