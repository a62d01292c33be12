package com.bit.chainsim.consensus.impl;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.consensus.ConsensusKind;
import com.bit.chainsim.consensus.TieBreak;
import com.bit.chainsim.consensus.WeightTable;
import com.bit.chainsim.ledger.LedgerView;
import com.bit.chainsim.structure.block.Block;

/**
 * PoS：每个插槽按质押份额抽签，区块高度按获得资格的插槽递增
 * 链头选择沿用最长链规则
 */
public class ProofOfStakeEngine extends AbstractConsensusEngine {

    public ProofOfStakeEngine(WeightTable weights, double miningProbability,
                              double slotDuration, TieBreak tieBreak) {
        super(weights, miningProbability, slotDuration, tieBreak);
    }

    @Override
    public ConsensusKind kind() {
        return ConsensusKind.POS;
    }

    @Override
    public BlockHash selectHead(LedgerView view) {
        return deepestBlock(view);
    }

    @Override
    public double creditedWeight(int nodeId) {
        return weights.shareOf(nodeId);
    }

    @Override
    protected boolean isEligible(int nodeId, Block head, long slot) {
        // 同一插槽内不能在链头之上重复出块
        return slot > head.getSlot();
    }

    @Override
    protected String protocolRejectionReason(Block block, Block parent) {
        long expectedSlot = slotAt(block.getTimestamp());
        if (block.getSlot() != expectedSlot) {
            return "插槽号 " + block.getSlot() + " 与出块时间对应的插槽 " + expectedSlot + " 不符";
        }
        if (block.getSlot() <= parent.getSlot()) {
            return "插槽号必须大于父区块插槽 " + parent.getSlot();
        }
        return null;
    }
}
