package com.bit.chainsim.topology;

import com.bit.chainsim.config.LatencyDistribution;
import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.exception.ConfigurationException;
import com.bit.chainsim.exception.DisconnectedTopologyException;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * 按拓扑类型构建邻居图，并为每条有向链路抽样延迟
 * 随机、环形、星形、全连接最终都归约为同一种邻居表表示
 */
@Slf4j
public final class TopologyBuilder {

    private TopologyBuilder() {
    }

    public static NetworkTopology build(SimulationConfig config, Random rng) {
        List<Integer> nodeIds = new ArrayList<>(config.getNodeCount());
        for (int i = 0; i < config.getNodeCount(); i++) {
            nodeIds.add(i);
        }
        return build(config.getTopologyKind(), nodeIds, config.effectiveEdgeProbability(),
                config.getLatencyDistribution(), config.isJitter(), rng);
    }

    /**
     * @param kind                拓扑类型
     * @param nodeIds             节点ID（不可重复）
     * @param edgeProbability     随机拓扑的连边概率，其它类型忽略
     * @param latencyDistribution 链路延迟分布
     * @param jitter              是否每条消息重新抽样延迟
     * @param rng                 本次运行的随机源
     * @throws ConfigurationException        参数非法
     * @throws DisconnectedTopologyException 构建结果不连通
     */
    public static NetworkTopology build(TopologyKind kind, List<Integer> nodeIds, double edgeProbability,
                                        LatencyDistribution latencyDistribution, boolean jitter, Random rng) {
        validate(kind, nodeIds, edgeProbability, latencyDistribution);
        List<Integer> ordered = new ArrayList<>(new TreeSet<>(nodeIds));

        MutableGraph<Integer> graph = GraphBuilder.undirected()
                .allowsSelfLoops(false)
                .nodeOrder(ElementOrder.insertion())
                .expectedNodeCount(ordered.size())
                .build();
        ordered.forEach(graph::addNode);

        switch (kind) {
            case FULLY_CONNECTED:
                for (int i = 0; i < ordered.size(); i++) {
                    for (int j = i + 1; j < ordered.size(); j++) {
                        graph.putEdge(ordered.get(i), ordered.get(j));
                    }
                }
                break;
            case STAR:
                int hub = ordered.get(0);
                for (int i = 1; i < ordered.size(); i++) {
                    graph.putEdge(hub, ordered.get(i));
                }
                break;
            case RING:
                for (int i = 0; i < ordered.size(); i++) {
                    graph.putEdge(ordered.get(i), ordered.get((i + 1) % ordered.size()));
                }
                break;
            case RANDOM:
                for (int i = 0; i < ordered.size(); i++) {
                    for (int j = i + 1; j < ordered.size(); j++) {
                        if (rng.nextDouble() < edgeProbability) {
                            graph.putEdge(ordered.get(i), ordered.get(j));
                        }
                    }
                }
                break;
            default:
                throw new ConfigurationException("不支持的拓扑类型: " + kind);
        }

        // 可达性检查
        int reachable = Graphs.reachableNodes(graph, ordered.get(0)).size();
        if (reachable != ordered.size()) {
            log.warn("拓扑不连通：kind={}, 可达 {}/{}", kind, reachable, ordered.size());
            throw new DisconnectedTopologyException(reachable, ordered.size());
        }

        ImmutableSortedMap.Builder<Integer, ImmutableSortedMap<Integer, Double>> links = ImmutableSortedMap.naturalOrder();
        for (int a : ordered) {
            ImmutableSortedMap.Builder<Integer, Double> neighbors = ImmutableSortedMap.naturalOrder();
            for (int b : new TreeSet<>(graph.adjacentNodes(a))) {
                double latency = latencyDistribution.sample(rng);
                if (Double.isNaN(latency) || latency < 0) {
                    throw new ConfigurationException("延迟分布产生了非法值: " + latency);
                }
                neighbors.put(b, latency);
            }
            links.put(a, neighbors.build());
        }

        NetworkTopology topology = new NetworkTopology(kind, links.build(), latencyDistribution, jitter);
        log.debug("拓扑构建完成: {}", topology);
        return topology;
    }

    private static void validate(TopologyKind kind, List<Integer> nodeIds, double edgeProbability,
                                 LatencyDistribution latencyDistribution) {
        if (kind == null) {
            throw new ConfigurationException("拓扑类型不能为空");
        }
        if (nodeIds == null || nodeIds.isEmpty()) {
            throw new ConfigurationException("节点列表不能为空");
        }
        if (new TreeSet<>(nodeIds).size() != nodeIds.size()) {
            throw new ConfigurationException("节点ID重复: " + nodeIds);
        }
        if (kind == TopologyKind.RING && nodeIds.size() < 3) {
            throw new ConfigurationException("环形拓扑至少需要3个节点，当前: " + nodeIds.size());
        }
        if (kind == TopologyKind.RANDOM && (!(edgeProbability > 0) || edgeProbability > 1)) {
            throw new ConfigurationException("随机拓扑连边概率必须在 (0, 1] 内，当前: " + edgeProbability);
        }
        if (latencyDistribution == null) {
            throw new ConfigurationException("延迟分布不能为空");
        }
    }
}
