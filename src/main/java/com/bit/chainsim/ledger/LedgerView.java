package com.bit.chainsim.ledger;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.structure.block.Block;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * 单个节点观察到的账本视图：区块ID → 条目，外加当前规范链头
 * 不变式：任何写入的区块，其父区块已在本视图中（无悬空祖先）
 * 子树权重（含自身）在写入时沿祖先链增量维护
 */
public class LedgerView {

    private final int ownerId;

    private final Block genesis;

    private final ToDoubleFunction<Block> weigher;

    // 插入顺序即到达顺序
    private final Map<BlockHash, Entry> entries = new LinkedHashMap<>();

    private BlockHash head;

    private long nextArrival = 0;

    public LedgerView(int ownerId, Block genesis, ToDoubleFunction<Block> weigher) {
        Preconditions.checkArgument(genesis.isGenesis(), "根区块必须是创世区块");
        this.ownerId = ownerId;
        this.genesis = genesis;
        this.weigher = weigher;
        entries.put(genesis.getId(), new Entry(genesis, nextArrival++, 0.0, weigher.applyAsDouble(genesis)));
        this.head = genesis.getId();
    }

    /**
     * 写入一个已校验的区块
     * @throws IllegalStateException 父区块缺失或区块已存在
     */
    public void insert(Block block, double arrivalTime) {
        if (block.isGenesis()) {
            throw new IllegalStateException("创世区块不能重复写入");
        }
        if (entries.containsKey(block.getId())) {
            throw new IllegalStateException("区块已存在: " + block.getId().shortHex());
        }
        Entry parent = entries.get(block.getParentId());
        if (parent == null) {
            throw new IllegalStateException("父区块缺失: " + block.getParentId().shortHex()
                    + "，节点 " + ownerId + " 不允许悬空祖先");
        }
        double weight = weigher.applyAsDouble(block);
        entries.put(block.getId(), new Entry(block, nextArrival++, arrivalTime, weight));
        parent.children.add(block.getId());

        // 沿祖先链累加子树权重
        Entry cursor = parent;
        while (cursor != null) {
            cursor.subtreeWeight += weight;
            cursor = cursor.block.isGenesis() ? null : entries.get(cursor.block.getParentId());
        }
    }

    public boolean contains(BlockHash id) {
        return entries.containsKey(id);
    }

    public Block get(BlockHash id) {
        Entry entry = entries.get(id);
        return entry == null ? null : entry.block;
    }

    public Block getGenesis() {
        return genesis;
    }

    public int getOwnerId() {
        return ownerId;
    }

    public BlockHash getHead() {
        return head;
    }

    public Block getHeadBlock() {
        return entries.get(head).block;
    }

    /**
     * 提交共识引擎选出的链头，只有节点自身调用
     */
    public void setHead(BlockHash newHead) {
        Preconditions.checkArgument(entries.containsKey(newHead), "链头必须在本视图中: %s", newHead);
        this.head = newHead;
    }

    /**
     * 本节点收到该区块的序号，越小越早；创世区块为0
     */
    public long arrivalOrder(BlockHash id) {
        return entry(id).arrivalSeq;
    }

    public double arrivalTime(BlockHash id) {
        return entry(id).arrivalTime;
    }

    /**
     * 子区块ID，按到达顺序
     */
    public List<BlockHash> children(BlockHash id) {
        return Collections.unmodifiableList(entry(id).children);
    }

    /**
     * 以该区块为根的子树总权重（含自身）
     */
    public double subtreeWeight(BlockHash id) {
        return entry(id).subtreeWeight;
    }

    public int size() {
        return entries.size();
    }

    /**
     * 按到达顺序返回全部区块
     */
    public List<Block> blocks() {
        List<Block> blocks = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            blocks.add(entry.block);
        }
        return blocks;
    }

    /**
     * 没有子区块的叶子，数量大于1说明本视图中存在分叉
     */
    public List<Block> tips() {
        List<Block> tips = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.children.isEmpty()) {
                tips.add(entry.block);
            }
        }
        return tips;
    }

    /**
     * 检查无悬空祖先不变式：从任意区块都能回溯到创世区块
     */
    public boolean isClosedUnderAncestry() {
        for (Entry entry : entries.values()) {
            if (!entry.block.isGenesis() && !entries.containsKey(entry.block.getParentId())) {
                return false;
            }
        }
        return true;
    }

    private Entry entry(BlockHash id) {
        Entry entry = entries.get(id);
        Preconditions.checkArgument(entry != null, "区块不在节点 %s 的视图中: %s", ownerId, id);
        return entry;
    }

    private static final class Entry {
        private final Block block;
        private final long arrivalSeq;
        private final double arrivalTime;
        private final List<BlockHash> children = new ArrayList<>(2);
        private double subtreeWeight;

        private Entry(Block block, long arrivalSeq, double arrivalTime, double weight) {
            this.block = block;
            this.arrivalSeq = arrivalSeq;
            this.arrivalTime = arrivalTime;
            this.subtreeWeight = weight;
        }
    }
}
