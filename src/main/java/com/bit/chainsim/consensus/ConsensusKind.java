package com.bit.chainsim.consensus;

public enum ConsensusKind {
    /** 工作量证明 + 最长链 */
    POW,
    /** 权益证明，按质押加权的插槽抽签 */
    POS,
    /** 最重子树（GHOST） */
    GHOST
}
