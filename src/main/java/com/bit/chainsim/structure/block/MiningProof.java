package com.bit.chainsim.structure.block;

import lombok.Value;

/**
 * 出块证明（逻辑令牌，不是真实的哈希难题）
 * roll：出块时的均匀随机抽样 [0,1)
 * threshold：出块者按算力/质押份额应得的成功概率
 * slot：PoS为出块资格插槽号；PoW/GHOST为尝试序号
 */
@Value
public class MiningProof {

    double roll;

    double threshold;

    long slot;

    /**
     * 脚本化的强制出块令牌，抽样值固定为0
     */
    public static MiningProof forced(double threshold, long slot) {
        return new MiningProof(0.0, threshold, slot);
    }

    public boolean isSuccessful() {
        return roll < threshold;
    }
}
