package com.bit.chainsim.structure.event;

/**
 * 出块尝试携带的试验令牌
 */
public enum MiningTrial {
    /** 按权重随机抽样 */
    RANDOM,
    /** 脚本化强制成功（场景测试用） */
    FORCED
}
