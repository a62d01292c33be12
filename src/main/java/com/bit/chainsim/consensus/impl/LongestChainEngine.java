package com.bit.chainsim.consensus.impl;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.consensus.ConsensusKind;
import com.bit.chainsim.consensus.TieBreak;
import com.bit.chainsim.consensus.WeightTable;
import com.bit.chainsim.ledger.LedgerView;

/**
 * PoW 最长链：每次成功的挖矿试验记1个工作量单位
 */
public class LongestChainEngine extends AbstractConsensusEngine {

    public LongestChainEngine(WeightTable weights, double miningProbability,
                              double miningInterval, TieBreak tieBreak) {
        super(weights, miningProbability, miningInterval, tieBreak);
    }

    @Override
    public ConsensusKind kind() {
        return ConsensusKind.POW;
    }

    @Override
    public BlockHash selectHead(LedgerView view) {
        return deepestBlock(view);
    }

    @Override
    public double creditedWeight(int nodeId) {
        return 1.0;
    }
}
