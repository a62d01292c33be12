package com.bit.chainsim.consensus;

/**
 * 候选链头等高（或子树等重）时的决胜规则
 */
public enum TieBreak {
    /** 本节点最先收到者优先 */
    FIRST_SEEN,
    /** 区块ID字典序最小者优先，全网一致 */
    LOWEST_ID
}
