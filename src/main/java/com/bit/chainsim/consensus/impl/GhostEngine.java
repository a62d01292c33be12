package com.bit.chainsim.consensus.impl;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.consensus.ConsensusKind;
import com.bit.chainsim.consensus.TieBreak;
import com.bit.chainsim.consensus.WeightTable;
import com.bit.chainsim.ledger.LedgerView;

import java.util.List;

/**
 * GHOST：从创世区块出发，在每个分叉点选择子树总权重（含子节点自身及全部后代）最大的子区块
 * 有效性规则与 PoW 相同
 */
public class GhostEngine extends AbstractConsensusEngine {

    public GhostEngine(WeightTable weights, double miningProbability,
                       double miningInterval, TieBreak tieBreak) {
        super(weights, miningProbability, miningInterval, tieBreak);
    }

    @Override
    public ConsensusKind kind() {
        return ConsensusKind.GHOST;
    }

    @Override
    public BlockHash selectHead(LedgerView view) {
        BlockHash current = view.getGenesis().getId();
        List<BlockHash> children = view.children(current);
        while (!children.isEmpty()) {
            BlockHash best = children.get(0);
            for (int i = 1; i < children.size(); i++) {
                BlockHash candidate = children.get(i);
                int byWeight = Double.compare(view.subtreeWeight(candidate), view.subtreeWeight(best));
                if (byWeight > 0 || (byWeight == 0 && prefers(view, candidate, best))) {
                    best = candidate;
                }
            }
            current = best;
            children = view.children(current);
        }
        return current;
    }

    @Override
    public double creditedWeight(int nodeId) {
        return 1.0;
    }
}
