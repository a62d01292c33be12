package com.bit.chainsim.sim;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.consensus.ConsensusEngine;
import com.bit.chainsim.consensus.WeightTable;
import com.bit.chainsim.event.EventQueue;
import com.bit.chainsim.ledger.BlockStore;
import com.bit.chainsim.ledger.LedgerView;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.event.SimEvent;
import com.bit.chainsim.structure.trace.TraceKind;
import com.bit.chainsim.structure.trace.TraceRecord;
import com.bit.chainsim.topology.NetworkTopology;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 单次模拟运行的全局状态：时钟、事件队列、随机源、区块仓库、轨迹
 * 显式传给每个组件操作，同一进程内的多次运行互不干扰
 */
@Slf4j
@Getter
public class SimulationContext {

    private final SimulationConfig config;

    private final Random rng;

    private final EventQueue queue;

    private final BlockStore store;

    private final NetworkTopology topology;

    private final WeightTable weights;

    private final ConsensusEngine engine;

    @Getter(lombok.AccessLevel.NONE)
    private final List<TraceRecord> trace = new ArrayList<>();

    /** 当前模拟时间，只在出队时推进 */
    private double now = 0;

    private long blocksMined = 0;
    private long rejectedBlocks = 0;
    private long droppedMessages = 0;
    private long duplicateDeliveries = 0;
    private long dispatchedEvents = 0;

    /** 达到出块上限后不再产生新区块，只排空剩余传播 */
    private boolean productionStopped = false;

    public SimulationContext(SimulationConfig config, Random rng, EventQueue queue, BlockStore store,
                             NetworkTopology topology, WeightTable weights, ConsensusEngine engine) {
        this.config = config;
        this.rng = rng;
        this.queue = queue;
        this.store = store;
        this.topology = topology;
        this.weights = weights;
        this.engine = engine;
    }

    /**
     * 在绝对时间调度事件，不允许早于当前时钟
     */
    public void schedule(double atTime, SimEvent event) {
        if (atTime < now) {
            throw new IllegalStateException("不能调度过去的事件: at=" + atTime + ", now=" + now);
        }
        queue.schedule(atTime, event);
    }

    public void scheduleAfter(double delay, SimEvent event) {
        schedule(now + delay, event);
    }

    void advanceTo(double time) {
        if (time < now) {
            throw new IllegalStateException("模拟时钟不能倒退: " + time + " < " + now);
        }
        now = time;
        dispatchedEvents++;
    }

    /**
     * 沿链路 from → to 发送区块，按链路延迟调度到达事件
     * @return false 表示消息被丢弃
     */
    public boolean sendBlock(int from, int to, Block block) {
        if (isDropped()) {
            droppedMessages++;
            record(from, TraceKind.DROPPED, block, null, "to=" + to);
            return false;
        }
        double latency = topology.sampleLatency(from, to, rng);
        scheduleAfter(latency, SimEvent.blockArrival(to, block, from));
        return true;
    }

    /**
     * 沿链路 from → to 转发缺失祖先请求
     */
    public boolean sendRequest(int from, int to, BlockHash requestedId, int origin, int ttl) {
        if (isDropped()) {
            droppedMessages++;
            record(from, TraceKind.DROPPED, null, null, "request " + requestedId.shortHex() + " to=" + to);
            return false;
        }
        double latency = topology.sampleLatency(from, to, rng);
        scheduleAfter(latency, SimEvent.blockRequest(to, requestedId, from, origin, ttl));
        return true;
    }

    private boolean isDropped() {
        double dropRate = config.getDropRate();
        return dropRate > 0 && rng.nextDouble() < dropRate;
    }

    /**
     * 追加一条轨迹记录，链头取自给定视图（可为空）
     */
    public TraceRecord record(int nodeId, TraceKind kind, Block block, LedgerView view, String detail) {
        Block head = view == null ? null : view.getHeadBlock();
        TraceRecord record = TraceRecord.builder()
                .seq(trace.size())
                .timestamp(now)
                .nodeId(nodeId)
                .kind(kind)
                .blockId(block == null ? null : block.getId())
                .parentId(block == null ? null : block.getParentId())
                .blockHeight(block == null ? -1 : block.getHeight())
                .headId(head == null ? null : head.getId())
                .headHeight(head == null ? -1 : head.getHeight())
                .detail(detail)
                .build();
        trace.add(record);
        return record;
    }

    public void onBlockMined() {
        blocksMined++;
        long maxBlocks = config.getMaxBlocks();
        if (maxBlocks > 0 && blocksMined >= maxBlocks && !productionStopped) {
            productionStopped = true;
            log.info("已达到出块上限 {}，停止出块，t={}", maxBlocks, now);
        }
    }

    public void onRejected() {
        rejectedBlocks++;
    }

    public void onDuplicate() {
        duplicateDeliveries++;
    }

    public boolean isProductionOpen() {
        return !productionStopped;
    }

    /**
     * 周期性事件是否继续调度：仍在出块，或存在有限的时间上限
     */
    public boolean keepsPeriodicEvents() {
        return isProductionOpen() || !Double.isInfinite(config.getMaxTime());
    }

    public List<TraceRecord> getTrace() {
        return Collections.unmodifiableList(trace);
    }
}
