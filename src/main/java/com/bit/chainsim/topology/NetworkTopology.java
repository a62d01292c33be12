package com.bit.chainsim.topology;

import com.bit.chainsim.config.LatencyDistribution;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * 构建完成的网络拓扑：节点ID → (邻居 → 单向延迟)
 * 邻居按ID有序，保证遍历顺序确定
 */
public class NetworkTopology {

    private final TopologyKind kind;

    private final ImmutableSortedMap<Integer, ImmutableSortedMap<Integer, Double>> links;

    private final LatencyDistribution latencyDistribution;

    private final boolean jitter;

    NetworkTopology(TopologyKind kind,
                    ImmutableSortedMap<Integer, ImmutableSortedMap<Integer, Double>> links,
                    LatencyDistribution latencyDistribution,
                    boolean jitter) {
        this.kind = kind;
        this.links = links;
        this.latencyDistribution = latencyDistribution;
        this.jitter = jitter;
    }

    public TopologyKind getKind() {
        return kind;
    }

    public boolean isJitter() {
        return jitter;
    }

    public ImmutableSortedSet<Integer> nodeIds() {
        return links.keySet();
    }

    public int size() {
        return links.size();
    }

    public ImmutableSortedSet<Integer> neighbors(int nodeId) {
        return linksOf(nodeId).keySet();
    }

    public boolean areNeighbors(int a, int b) {
        return links.containsKey(a) && links.get(a).containsKey(b);
    }

    /**
     * 节点a向邻居b转发区块时的固定单向延迟（构建时抽样）
     */
    public double latency(int a, int b) {
        Double latency = linksOf(a).get(b);
        Preconditions.checkArgument(latency != null, "节点 %s 与 %s 不相邻", a, b);
        return latency;
    }

    /**
     * 单条消息实际使用的延迟：开启抖动时每条消息重新抽样，否则返回固定链路延迟
     */
    public double sampleLatency(int a, int b, Random rng) {
        double fixed = latency(a, b);
        if (!jitter) {
            return fixed;
        }
        return Math.max(0.0, latencyDistribution.sample(rng));
    }

    /**
     * 无向边数
     */
    public int edgeCount() {
        int directed = 0;
        for (ImmutableSortedMap<Integer, Double> neighbors : links.values()) {
            directed += neighbors.size();
        }
        return directed / 2;
    }

    public double maxLatency() {
        double max = 0;
        for (ImmutableSortedMap<Integer, Double> neighbors : links.values()) {
            for (double latency : neighbors.values()) {
                max = Math.max(max, latency);
            }
        }
        return max;
    }

    /**
     * 以跳数计的网络直径（全源BFS）
     */
    public int diameter() {
        int diameter = 0;
        for (int source : links.keySet()) {
            for (int hops : hopDistances(source).values()) {
                diameter = Math.max(diameter, hops);
            }
        }
        return diameter;
    }

    public Map<Integer, Integer> hopDistances(int source) {
        Map<Integer, Integer> distances = new HashMap<>();
        Deque<Integer> frontier = new ArrayDeque<>();
        distances.put(source, 0);
        frontier.add(source);
        while (!frontier.isEmpty()) {
            int current = frontier.poll();
            int next = distances.get(current) + 1;
            for (int neighbor : neighbors(current)) {
                if (!distances.containsKey(neighbor)) {
                    distances.put(neighbor, next);
                    frontier.add(neighbor);
                }
            }
        }
        return distances;
    }

    private ImmutableSortedMap<Integer, Double> linksOf(int nodeId) {
        ImmutableSortedMap<Integer, Double> neighbors = links.get(nodeId);
        Preconditions.checkArgument(neighbors != null, "未知节点: %s", nodeId);
        return neighbors;
    }

    @Override
    public String toString() {
        return "NetworkTopology{" + kind + ", nodes=" + size() + ", edges=" + edgeCount() + '}';
    }
}
