package com.bit.chainsim.node;

import com.bit.chainsim.structure.block.Block;
import lombok.Value;

/**
 * 等待父区块的缓冲条目，记下发送方以便接受后转发时跳过它
 */
@Value
public class PendingBlock {

    Block block;

    int sender;
}
