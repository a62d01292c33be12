package com.bit.chainsim.config;

import com.bit.chainsim.consensus.ConsensusKind;
import com.bit.chainsim.consensus.TieBreak;
import com.bit.chainsim.exception.ConfigurationException;
import com.bit.chainsim.topology.TopologyKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * application.yml 中 simulation.* 配置项
 * 也作为 REST 接口提交模拟参数的请求体
 */
@Data
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {

    private TopologyKind topology = TopologyKind.FULLY_CONNECTED;
    private int nodeCount = 4;
    private double edgeProbability = 0;
    private int expectedPeers = 3;

    private ConsensusKind consensus = ConsensusKind.POW;
    private TieBreak tieBreak = TieBreak.FIRST_SEEN;

    private WeightPreset weightDistribution = WeightPreset.UNIFORM;
    private List<Double> weights = new ArrayList<>();//EXPLICIT 时使用

    private LatencyPreset latencyDistribution = LatencyPreset.UNIFORM;
    private double latencyMin = 0.1;
    private double latencyMax = 0.5;
    private double latencyMean = 0.3;//EXPONENTIAL 时使用，latencyMin作为下限
    private boolean jitter = false;

    private Double maxTime;
    private long maxBlocks = 0;
    private long seed = 42L;

    private double miningProbability = 0.1;
    private double miningInterval = 1.0;
    private boolean jitterStart = false;
    private int minerCount = -1;

    private double dropRate = 0;
    private int ancestorRequestTtl = 0;
    private double forkCheckInterval = 0;
    private long maxEvents = 10_000_000L;

    public enum WeightPreset {
        UNIFORM, RANDOM, EXPLICIT
    }

    public enum LatencyPreset {
        FIXED, UNIFORM, EXPONENTIAL
    }

    /**
     * 转换为引擎使用的不可变配置并校验
     */
    public SimulationConfig toConfig() {
        SimulationConfig config = SimulationConfig.builder()
                .topologyKind(topology)
                .nodeCount(nodeCount)
                .edgeProbability(edgeProbability)
                .expectedPeers(expectedPeers)
                .consensus(consensus)
                .tieBreak(tieBreak)
                .weightDistribution(toWeightDistribution())
                .latencyDistribution(toLatencyDistribution())
                .jitter(jitter)
                .maxTime(maxTime == null ? Double.POSITIVE_INFINITY : maxTime)
                .maxBlocks(maxBlocks)
                .seed(seed)
                .miningProbability(miningProbability)
                .miningInterval(miningInterval)
                .jitterStart(jitterStart)
                .minerCount(minerCount)
                .dropRate(dropRate)
                .ancestorRequestTtl(ancestorRequestTtl)
                .forkCheckInterval(forkCheckInterval)
                .maxEvents(maxEvents)
                .build();
        config.validate();
        return config;
    }

    private WeightDistribution toWeightDistribution() {
        if (weightDistribution == null) {
            throw new ConfigurationException("weightDistribution 不能为空");
        }
        switch (weightDistribution) {
            case RANDOM:
                return WeightDistribution.random();
            case EXPLICIT:
                if (weights == null || weights.size() < nodeCount) {
                    throw new ConfigurationException("EXPLICIT 权重需要为每个节点提供一个值");
                }
                for (Double w : weights) {
                    if (w == null || !(w > 0)) {
                        throw new ConfigurationException("权重必须为正数: " + weights);
                    }
                }
                return WeightDistribution.explicit(weights);
            case UNIFORM:
            default:
                return WeightDistribution.uniform();
        }
    }

    private LatencyDistribution toLatencyDistribution() {
        if (latencyDistribution == null) {
            throw new ConfigurationException("latencyDistribution 不能为空");
        }
        if (latencyMin < 0 || latencyMax < latencyMin) {
            throw new ConfigurationException("延迟区间非法: [" + latencyMin + ", " + latencyMax + "]");
        }
        switch (latencyDistribution) {
            case FIXED:
                return LatencyDistribution.fixed(latencyMin);
            case EXPONENTIAL:
                if (!(latencyMean > 0)) {
                    throw new ConfigurationException("指数延迟均值必须为正数: " + latencyMean);
                }
                return LatencyDistribution.exponential(latencyMean, latencyMin);
            case UNIFORM:
            default:
                return LatencyDistribution.uniform(latencyMin, latencyMax);
        }
    }
}
