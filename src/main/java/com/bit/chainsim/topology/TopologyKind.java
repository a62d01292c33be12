package com.bit.chainsim.topology;

public enum TopologyKind {
    /** Erdős–Rényi 随机图 */
    RANDOM,
    RING,
    /** 节点0为中心 */
    STAR,
    FULLY_CONNECTED
}
