package com.bit.chainsim.ledger;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.structure.block.Block;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 区块内容仓库（单次运行内共享，只追加）
 * 区块首次通过校验即归此处所有，各节点账本视图只持有同一实例的引用
 */
public class BlockStore {

    private final Map<BlockHash, Block> blocks = new LinkedHashMap<>();

    public BlockStore() {
        Block genesis = Block.genesis();
        blocks.put(genesis.getId(), genesis);
    }

    /**
     * 写入区块并返回规范实例：内容相同（ID相同）的区块只保留第一份
     */
    public Block intern(Block block) {
        Block existing = blocks.putIfAbsent(block.getId(), block);
        return existing == null ? block : existing;
    }

    public Block get(BlockHash id) {
        return blocks.get(id);
    }

    public boolean contains(BlockHash id) {
        return blocks.containsKey(id);
    }

    public int size() {
        return blocks.size();
    }

    /**
     * 按首次写入顺序返回全部区块
     */
    public Collection<Block> all() {
        return Collections.unmodifiableCollection(blocks.values());
    }
}
