package com.bit.chainsim.config;

import java.util.Random;

/**
 * 单向链路延迟分布：每次调用从给定随机源抽取一个延迟
 */
@FunctionalInterface
public interface LatencyDistribution {

    double sample(Random rng);

    static LatencyDistribution fixed(double latency) {
        return rng -> latency;
    }

    /**
     * [min, max) 均匀分布，min == max 时退化为固定延迟
     */
    static LatencyDistribution uniform(double min, double max) {
        if (min == max) {
            return fixed(min);
        }
        return rng -> min + (max - min) * rng.nextDouble();
    }

    /**
     * 指数分布，附加一个最小延迟下限
     */
    static LatencyDistribution exponential(double mean, double floor) {
        return rng -> floor - mean * Math.log(1.0 - rng.nextDouble());
    }
}
