package com.bit.chainsim.config;

import com.bit.chainsim.exception.ConfigurationException;

import java.util.List;
import java.util.Random;

/**
 * 节点共识权重（算力或质押）分布
 */
@FunctionalInterface
public interface WeightDistribution {

    double weightOf(int nodeId, int nodeCount, Random rng);

    static WeightDistribution uniform() {
        return (nodeId, nodeCount, rng) -> 1.0;
    }

    /**
     * (0, 1] 均匀随机权重
     */
    static WeightDistribution random() {
        return (nodeId, nodeCount, rng) -> 1.0 - rng.nextDouble();
    }

    /**
     * 显式指定每个节点的权重，长度必须覆盖全部节点
     */
    static WeightDistribution explicit(List<Double> weights) {
        List<Double> copy = List.copyOf(weights);
        return (nodeId, nodeCount, rng) -> {
            if (copy.size() < nodeCount) {
                throw new ConfigurationException("显式权重数量 " + copy.size() + " 少于节点数 " + nodeCount);
            }
            return copy.get(nodeId);
        };
    }
}
