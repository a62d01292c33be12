package com.bit.chainsim.consensus;

import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.exception.ConfigurationException;
import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.Random;

/**
 * 各节点的共识权重（PoW为算力，PoS为质押）及其归一化份额
 */
public class WeightTable {

    private final double[] weights;

    private final double total;

    private WeightTable(double[] weights) {
        double sum = 0;
        for (int i = 0; i < weights.length; i++) {
            double w = weights[i];
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                throw new ConfigurationException("节点 " + i + " 的权重非法: " + w);
            }
            sum += w;
        }
        if (!(sum > 0)) {
            throw new ConfigurationException("全网权重之和必须为正数");
        }
        this.weights = weights;
        this.total = sum;
    }

    public static WeightTable of(double... weights) {
        Preconditions.checkArgument(weights.length > 0, "权重表不能为空");
        return new WeightTable(Arrays.copyOf(weights, weights.length));
    }

    /**
     * 按配置的权重分布为每个节点抽取权重
     */
    public static WeightTable from(SimulationConfig config, Random rng) {
        double[] weights = new double[config.getNodeCount()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = config.getWeightDistribution().weightOf(i, weights.length, rng);
        }
        return new WeightTable(weights);
    }

    public int size() {
        return weights.length;
    }

    public double weightOf(int nodeId) {
        return weights[nodeId];
    }

    /**
     * 该节点占全网权重的比例
     */
    public double shareOf(int nodeId) {
        return weights[nodeId] / total;
    }

    public double getTotal() {
        return total;
    }

    public boolean contains(int nodeId) {
        return nodeId >= 0 && nodeId < weights.length;
    }
}
