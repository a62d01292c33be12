package com.bit.chainsim.consensus;

import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.consensus.impl.GhostEngine;
import com.bit.chainsim.consensus.impl.LongestChainEngine;
import com.bit.chainsim.consensus.impl.ProofOfStakeEngine;
import com.bit.chainsim.exception.ConfigurationException;

/**
 * 共识引擎工厂，按 {@link ConsensusKind} 穷举分发
 */
public final class ConsensusEngines {

    private ConsensusEngines() {
    }

    public static ConsensusEngine create(SimulationConfig config, WeightTable weights) {
        if (weights.size() != config.getNodeCount()) {
            throw new ConfigurationException("权重表大小 " + weights.size() + " 与节点数 " + config.getNodeCount() + " 不一致");
        }
        return create(config.getConsensus(), weights, config.getMiningProbability(),
                config.getMiningInterval(), config.getTieBreak());
    }

    public static ConsensusEngine create(ConsensusKind kind, WeightTable weights, double miningProbability,
                                         double miningInterval, TieBreak tieBreak) {
        if (kind == null) {
            throw new ConfigurationException("共识类型不能为空");
        }
        switch (kind) {
            case POW:
                return new LongestChainEngine(weights, miningProbability, miningInterval, tieBreak);
            case POS:
                return new ProofOfStakeEngine(weights, miningProbability, miningInterval, tieBreak);
            case GHOST:
                return new GhostEngine(weights, miningProbability, miningInterval, tieBreak);
            default:
                throw new ConfigurationException("不支持的共识类型: " + kind);
        }
    }
}
