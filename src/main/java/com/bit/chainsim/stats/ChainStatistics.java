package com.bit.chainsim.stats;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.sim.LedgerSnapshot;
import com.bit.chainsim.sim.SimulationResult;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.trace.TraceKind;
import com.bit.chainsim.structure.trace.TraceRecord;
import com.google.common.base.Preconditions;
import com.google.common.math.Quantiles;
import com.google.common.math.Stats;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 只根据轨迹和最终快照计算统计量，不接触引擎
 */
public final class ChainStatistics {

    private ChainStatistics() {
    }

    /**
     * @param result 一次运行的输出
     * @param k      收敛判定深度：所有链头在各自下方 K 个区块以内有公共祖先即视为收敛
     */
    public static ChainSummary summarize(SimulationResult result, int k) {
        Preconditions.checkArgument(k >= 0, "收敛深度不能为负: %s", k);
        Map<BlockHash, Block> blocks = result.getBlocks();

        BlockHash canonical = canonicalHead(result);
        List<Double> latencies = propagationLatencies(result);
        Stats stats = latencies.isEmpty() ? null : Stats.of(latencies);

        return ChainSummary.builder()
                .haltReason(result.getHaltReason())
                .endTime(result.getEndTime())
                .blocksMined(result.getBlocksMined())
                .forkCount(forkCount(blocks))
                .staleBlocks(staleBlocks(blocks, canonical))
                .canonicalHead(canonical)
                .canonicalHeight(blocks.get(canonical).getHeight())
                .distinctHeads(result.distinctHeads().size())
                .propagationSamples(latencies.size())
                .propagationMean(stats == null ? 0 : stats.mean())
                .propagationMedian(latencies.isEmpty() ? 0 : Quantiles.median().compute(latencies))
                .propagationP90(latencies.isEmpty() ? 0 : Quantiles.percentiles().index(90).compute(latencies))
                .propagationMax(stats == null ? 0 : stats.max())
                .convergenceDepth(k)
                .convergenceTime(convergenceTime(result, k))
                .rejectedBlocks(result.getRejectedBlocks())
                .droppedMessages(result.getDroppedMessages())
                .duplicateDeliveries(result.getDuplicateDeliveries())
                .orphanedBlocks(result.getOrphanedBlocks())
                .build();
    }

    /**
     * 在所有节点视图的并集中，子区块数 >= 2 的父区块个数
     */
    public static long forkCount(Map<BlockHash, Block> blocks) {
        Map<BlockHash, Integer> childCounts = new HashMap<>();
        for (Block block : blocks.values()) {
            if (!block.isGenesis()) {
                childCounts.merge(block.getParentId(), 1, Integer::sum);
            }
        }
        return childCounts.values().stream().filter(count -> count >= 2).count();
    }

    /**
     * 不在 head 所在链上的非创世区块数
     */
    public static long staleBlocks(Map<BlockHash, Block> blocks, BlockHash head) {
        Set<BlockHash> mainChain = new HashSet<>();
        Block cursor = blocks.get(head);
        while (cursor != null) {
            mainChain.add(cursor.getId());
            cursor = cursor.isGenesis() ? null : blocks.get(cursor.getParentId());
        }
        long stale = 0;
        for (Block block : blocks.values()) {
            if (!block.isGenesis() && !mainChain.contains(block.getId())) {
                stale++;
            }
        }
        return stale;
    }

    /**
     * 非出块节点接受区块的时间减去区块创建时间
     */
    public static List<Double> propagationLatencies(SimulationResult result) {
        List<Double> latencies = new ArrayList<>();
        for (TraceRecord record : result.getTrace()) {
            if (record.getKind() != TraceKind.ACCEPTED) {
                continue;
            }
            Block block = result.block(record.getBlockId());
            if (block != null && block.getCreator() != record.getNodeId()) {
                latencies.add(record.getTimestamp() - block.getTimestamp());
            }
        }
        return latencies;
    }

    static BlockHash canonicalHead(SimulationResult result) {
        Map<BlockHash, Integer> holders = new HashMap<>();
        for (LedgerSnapshot snapshot : result.getSnapshots().values()) {
            holders.merge(snapshot.getHeadId(), 1, Integer::sum);
        }
        BlockHash best = null;
        for (Map.Entry<BlockHash, Integer> entry : holders.entrySet()) {
            if (best == null || isBetterHead(result, entry.getKey(), entry.getValue(), best, holders.get(best))) {
                best = entry.getKey();
            }
        }
        return best;
    }

    private static boolean isBetterHead(SimulationResult result, BlockHash candidate, int candidateHolders,
                                        BlockHash incumbent, int incumbentHolders) {
        if (candidateHolders != incumbentHolders) {
            return candidateHolders > incumbentHolders;
        }
        long candidateHeight = result.block(candidate).getHeight();
        long incumbentHeight = result.block(incumbent).getHeight();
        if (candidateHeight != incumbentHeight) {
            return candidateHeight > incumbentHeight;
        }
        return candidate.compareTo(incumbent) < 0;
    }

    /**
     * 按轨迹重放各节点链头，返回此后一直保持收敛的最早时刻
     */
    public static Double convergenceTime(SimulationResult result, int k) {
        Map<BlockHash, Block> blocks = result.getBlocks();
        BlockHash genesis = Block.genesis().getId();
        Map<Integer, BlockHash> heads = new HashMap<>();
        for (int nodeId : result.getSnapshots().keySet()) {
            heads.put(nodeId, genesis);
        }

        Double convergedSince = 0.0;
        for (TraceRecord record : result.getTrace()) {
            if (record.getHeadId() == null || record.getHeadId().equals(heads.get(record.getNodeId()))) {
                continue;
            }
            heads.put(record.getNodeId(), record.getHeadId());
            if (!isConverged(blocks, heads.values(), k)) {
                convergedSince = null;
            } else if (convergedSince == null) {
                convergedSince = record.getTimestamp();
            }
        }
        return convergedSince;
    }

    /**
     * 是否存在一个公共祖先，距每个链头都不超过 k 个区块
     */
    static boolean isConverged(Map<BlockHash, Block> blocks, Iterable<BlockHash> heads, int k) {
        long maxHeight = 0;
        long minHeight = Long.MAX_VALUE;
        for (BlockHash head : heads) {
            long height = blocks.get(head).getHeight();
            maxHeight = Math.max(maxHeight, height);
            minHeight = Math.min(minHeight, height);
        }
        long level = Math.max(0, maxHeight - k);
        if (level > minHeight) {
            return false;
        }
        BlockHash common = null;
        for (BlockHash head : heads) {
            BlockHash ancestor = ancestorAt(blocks, head, level);
            if (common == null) {
                common = ancestor;
            } else if (!common.equals(ancestor)) {
                return false;
            }
        }
        return true;
    }

    private static BlockHash ancestorAt(Map<BlockHash, Block> blocks, BlockHash head, long height) {
        Block cursor = blocks.get(head);
        while (cursor.getHeight() > height) {
            cursor = blocks.get(cursor.getParentId());
        }
        return cursor.getId();
    }
}
