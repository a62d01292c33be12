package com.bit.chainsim.config;

import com.bit.chainsim.consensus.ConsensusKind;
import com.bit.chainsim.consensus.TieBreak;
import com.bit.chainsim.exception.ConfigurationException;
import com.bit.chainsim.topology.TopologyKind;
import lombok.Builder;
import lombok.Value;

/**
 * 单次模拟运行的不可变配置
 * 给定 {seed, 拓扑参数, 共识参数} 即可完全复现一次运行
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {

    @Builder.Default
    TopologyKind topologyKind = TopologyKind.FULLY_CONNECTED;

    @Builder.Default
    int nodeCount = 4;

    /**
     * 随机拓扑的连边概率，0 表示按 expectedPeers / nodeCount 推导
     */
    @Builder.Default
    double edgeProbability = 0;

    @Builder.Default
    int expectedPeers = 3;

    @Builder.Default
    ConsensusKind consensus = ConsensusKind.POW;

    @Builder.Default
    WeightDistribution weightDistribution = WeightDistribution.uniform();

    @Builder.Default
    LatencyDistribution latencyDistribution = LatencyDistribution.uniform(0.1, 0.5);

    /**
     * false：每条有向链路在构建时抽样一次并固定；true：每条消息重新抽样
     */
    @Builder.Default
    boolean jitter = false;

    /** 模拟时间上限，正无穷表示不限 */
    @Builder.Default
    double maxTime = Double.POSITIVE_INFINITY;

    /** 出块总数上限，0 表示不限 */
    @Builder.Default
    long maxBlocks = 0;

    @Builder.Default
    long seed = 42L;

    /** 均匀权重下单次出块尝试的成功概率 */
    @Builder.Default
    double miningProbability = 0.1;

    /** 出块尝试间隔，PoS下即插槽时长 */
    @Builder.Default
    double miningInterval = 1.0;

    /** 首次出块尝试是否在 [0, miningInterval) 内随机错开 */
    @Builder.Default
    boolean jitterStart = false;

    /** 自主出块的节点数（按ID从小到大），-1 表示全部 */
    @Builder.Default
    int minerCount = -1;

    @Builder.Default
    TieBreak tieBreak = TieBreak.FIRST_SEEN;

    /** 单条消息的丢包概率 */
    @Builder.Default
    double dropRate = 0;

    /** 缺失祖先请求的TTL，0 表示只等待洪泛送达 */
    @Builder.Default
    int ancestorRequestTtl = 0;

    /** 周期性链头检查间隔，0 表示关闭 */
    @Builder.Default
    double forkCheckInterval = 0;

    /** 分发事件数的安全上限 */
    @Builder.Default
    long maxEvents = 10_000_000L;

    /**
     * 运行前的参数校验
     * @throws ConfigurationException 任一参数非法
     */
    public void validate() {
        if (topologyKind == null || consensus == null || tieBreak == null) {
            throw new ConfigurationException("拓扑类型、共识类型和决胜规则不能为空");
        }
        if (weightDistribution == null || latencyDistribution == null) {
            throw new ConfigurationException("权重分布和延迟分布不能为空");
        }
        if (nodeCount < 1) {
            throw new ConfigurationException("节点数必须 >= 1，当前: " + nodeCount);
        }
        if (topologyKind == TopologyKind.RING && nodeCount < 3) {
            throw new ConfigurationException("环形拓扑至少需要3个节点，当前: " + nodeCount);
        }
        if (edgeProbability < 0 || edgeProbability > 1) {
            throw new ConfigurationException("连边概率必须在 [0, 1] 内，当前: " + edgeProbability);
        }
        if (edgeProbability == 0 && expectedPeers < 1) {
            throw new ConfigurationException("expectedPeers 必须 >= 1，当前: " + expectedPeers);
        }
        if (Double.isNaN(maxTime) || maxTime <= 0) {
            throw new ConfigurationException("maxTime 必须为正数，当前: " + maxTime);
        }
        if (maxBlocks < 0) {
            throw new ConfigurationException("maxBlocks 不能为负，当前: " + maxBlocks);
        }
        if (Double.isInfinite(maxTime) && maxBlocks == 0) {
            throw new ConfigurationException("必须至少配置一个终止条件（maxTime 或 maxBlocks）");
        }
        if (!(miningProbability > 0) || miningProbability > 1) {
            throw new ConfigurationException("出块概率必须在 (0, 1] 内，当前: " + miningProbability);
        }
        if (!(miningInterval > 0)) {
            throw new ConfigurationException("出块间隔必须为正数，当前: " + miningInterval);
        }
        if (minerCount < -1 || minerCount > nodeCount) {
            throw new ConfigurationException("minerCount 必须在 [-1, nodeCount] 内，当前: " + minerCount);
        }
        if (dropRate < 0 || dropRate >= 1) {
            throw new ConfigurationException("丢包率必须在 [0, 1) 内，当前: " + dropRate);
        }
        if (ancestorRequestTtl < 0) {
            throw new ConfigurationException("ancestorRequestTtl 不能为负，当前: " + ancestorRequestTtl);
        }
        if (forkCheckInterval < 0) {
            throw new ConfigurationException("forkCheckInterval 不能为负，当前: " + forkCheckInterval);
        }
        if (maxEvents < 1) {
            throw new ConfigurationException("maxEvents 必须 >= 1，当前: " + maxEvents);
        }
    }

    /**
     * 随机拓扑实际使用的连边概率
     */
    public double effectiveEdgeProbability() {
        if (edgeProbability > 0) {
            return edgeProbability;
        }
        return Math.min(1.0, (double) expectedPeers / nodeCount);
    }

    public boolean isMiner(int nodeId) {
        return minerCount < 0 || nodeId < minerCount;
    }
}
