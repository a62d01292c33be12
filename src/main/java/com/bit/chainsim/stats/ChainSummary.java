package com.bit.chainsim.stats;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.sim.HaltReason;
import lombok.Builder;
import lombok.Value;

/**
 * 一次运行的统计摘要
 */
@Value
@Builder
public class ChainSummary {

    HaltReason haltReason;

    double endTime;

    long blocksMined;

    /** 有两个及以上子区块的父区块数 */
    long forkCount;

    /** 不在参考主链上的区块数（不含创世区块） */
    long staleBlocks;

    /** 参考主链的链头：持有节点最多者，其次高度最高者，再次ID最小者 */
    BlockHash canonicalHead;

    long canonicalHeight;

    int distinctHeads;

    /** 非出块节点接受区块的次数，即传播样本数 */
    long propagationSamples;

    double propagationMean;

    double propagationMedian;

    double propagationP90;

    double propagationMax;

    /** 收敛判定深度 K */
    int convergenceDepth;

    /** 从该时刻起直到运行结束始终收敛，未收敛时为 null */
    Double convergenceTime;

    long rejectedBlocks;

    long droppedMessages;

    long duplicateDeliveries;

    long orphanedBlocks;

    public boolean isConverged() {
        return convergenceTime != null;
    }
}
