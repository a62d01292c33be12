package com.bit.chainsim.consensus.impl;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.consensus.ConsensusEngine;
import com.bit.chainsim.consensus.TieBreak;
import com.bit.chainsim.consensus.WeightTable;
import com.bit.chainsim.ledger.LedgerView;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.block.MiningProof;
import com.bit.chainsim.structure.event.MiningTrial;

import java.util.Optional;
import java.util.Random;

/**
 * 三种共识共用的结构校验、出块试验与决胜规则
 */
public abstract class AbstractConsensusEngine implements ConsensusEngine {

    private static final double THRESHOLD_TOLERANCE = 1e-12;

    protected final WeightTable weights;

    protected final double miningProbability;

    protected final double miningInterval;

    protected final TieBreak tieBreak;

    protected AbstractConsensusEngine(WeightTable weights, double miningProbability,
                                      double miningInterval, TieBreak tieBreak) {
        this.weights = weights;
        this.miningProbability = miningProbability;
        this.miningInterval = miningInterval;
        this.tieBreak = tieBreak;
    }

    /**
     * 节点单次试验的成功概率：均匀权重下等于 miningProbability，按份额线性缩放，上限为1
     */
    public double thresholdFor(int nodeId) {
        return Math.min(1.0, miningProbability * weights.size() * weights.shareOf(nodeId));
    }

    /**
     * 模拟时间所在的插槽（尝试序号）
     */
    public long slotAt(double time) {
        return (long) Math.floor(time / miningInterval);
    }

    @Override
    public String rejectionReason(Block block, LedgerView view) {
        if (block == null) {
            return "区块为空";
        }
        if (block.isGenesis()) {
            return "创世区块不能作为新区块写入";
        }
        if (!block.hasConsistentId()) {
            return "区块ID与内容不符";
        }
        Block parent = view.get(block.getParentId());
        if (parent == null) {
            return "父区块不在账本中";
        }
        if (block.getHeight() != parent.getHeight() + 1) {
            return "高度应为 " + (parent.getHeight() + 1) + "，实际 " + block.getHeight();
        }
        if (block.getTimestamp() < parent.getTimestamp()) {
            return "时间戳早于父区块";
        }
        if (!weights.contains(block.getCreator())) {
            return "未知的出块节点 " + block.getCreator();
        }
        MiningProof proof = block.getProof();
        if (proof == null) {
            return "缺少出块证明";
        }
        if (Math.abs(proof.getThreshold() - thresholdFor(block.getCreator())) > THRESHOLD_TOLERANCE) {
            return "出块证明阈值与出块节点份额不符";
        }
        if (!proof.isSuccessful()) {
            return "出块试验未成功";
        }
        if (Math.abs(block.getWeight() - creditedWeight(block.getCreator())) > THRESHOLD_TOLERANCE) {
            return "区块权重与出块节点应得权重不符";
        }
        return protocolRejectionReason(block, parent);
    }

    /**
     * 协议特有的校验，有效时返回 null
     */
    protected String protocolRejectionReason(Block block, Block parent) {
        return null;
    }

    /**
     * 协议特有的出块资格，默认总是具备
     */
    protected boolean isEligible(int nodeId, Block head, long slot) {
        return true;
    }

    @Override
    public Optional<MiningProof> attemptTrial(int nodeId, Block head, double now, MiningTrial trial, Random rng) {
        long slot = slotAt(now);
        if (!isEligible(nodeId, head, slot)) {
            return Optional.empty();
        }
        double threshold = thresholdFor(nodeId);
        // 权重为0的节点任何试验都不会成功
        if (threshold <= 0) {
            return Optional.empty();
        }
        if (trial == MiningTrial.FORCED) {
            return Optional.of(MiningProof.forced(threshold, slot));
        }
        MiningProof proof = new MiningProof(rng.nextDouble(), threshold, slot);
        return proof.isSuccessful() ? Optional.of(proof) : Optional.empty();
    }

    @Override
    public double weightOf(Block block) {
        return block.getWeight();
    }

    /**
     * 最长链规则：高度最大者胜，等高时按决胜规则
     */
    protected BlockHash deepestBlock(LedgerView view) {
        Block best = view.getGenesis();
        // blocks() 按到达顺序，等高时保留先到者即为 FIRST_SEEN
        for (Block candidate : view.blocks()) {
            if (candidate.getHeight() > best.getHeight()
                    || (candidate.getHeight() == best.getHeight() && prefers(view, candidate.getId(), best.getId()))) {
                best = candidate;
            }
        }
        return best.getId();
    }

    /**
     * 两个同等条件的候选中，candidate 是否优于 incumbent
     */
    protected boolean prefers(LedgerView view, BlockHash candidate, BlockHash incumbent) {
        if (candidate.equals(incumbent)) {
            return false;
        }
        switch (tieBreak) {
            case LOWEST_ID:
                return candidate.compareTo(incumbent) < 0;
            case FIRST_SEEN:
            default:
                return view.arrivalOrder(candidate) < view.arrivalOrder(incumbent);
        }
    }
}
