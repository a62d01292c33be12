package com.bit.chainsim.sim;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.consensus.ConsensusEngine;
import com.bit.chainsim.consensus.ConsensusEngines;
import com.bit.chainsim.consensus.WeightTable;
import com.bit.chainsim.event.impl.PriorityEventQueue;
import com.bit.chainsim.ledger.BlockStore;
import com.bit.chainsim.ledger.LedgerView;
import com.bit.chainsim.node.NodeAgent;
import com.bit.chainsim.node.PendingBlock;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.event.MiningTrial;
import com.bit.chainsim.structure.event.ScheduledEvent;
import com.bit.chainsim.structure.event.SimEvent;
import com.bit.chainsim.structure.trace.TraceKind;
import com.bit.chainsim.topology.NetworkTopology;
import com.bit.chainsim.topology.TopologyBuilder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 模拟驱动器：按配置构建拓扑、权重、共识引擎与节点，然后运行事件循环直到终止条件
 * 每个实例只能运行一次，运行之间没有共享状态
 */
@Slf4j
public class SimulationDriver {

    private final SimulationConfig config;

    private final SimulationContext ctx;

    private final NetworkTopology topology;

    private final Map<Integer, NodeAgent> nodes = new LinkedHashMap<>();

    private boolean seeded = false;

    private boolean finished = false;

    /**
     * @throws com.bit.chainsim.exception.ConfigurationException        配置非法
     * @throws com.bit.chainsim.exception.DisconnectedTopologyException 拓扑不连通
     */
    public SimulationDriver(SimulationConfig config) {
        config.validate();
        this.config = config;
        Random rng = new Random(config.getSeed());
        this.topology = TopologyBuilder.build(config, rng);
        WeightTable weights = WeightTable.from(config, rng);
        ConsensusEngine engine = ConsensusEngines.create(config, weights);
        BlockStore store = new BlockStore();
        this.ctx = new SimulationContext(config, rng, new PriorityEventQueue(), store, topology, weights, engine);

        for (int nodeId : topology.nodeIds()) {
            LedgerView view = new LedgerView(nodeId, Block.genesis(), engine::weightOf);
            nodes.put(nodeId, new NodeAgent(nodeId, topology.neighbors(nodeId), view, engine, config.isMiner(nodeId)));
        }
        log.info("模拟初始化完成：{} 个节点，拓扑 {}，{} 条边，共识 {}，seed={}",
                nodes.size(), topology.getKind(), topology.edgeCount(), engine.kind(), config.getSeed());
    }

    /**
     * 为每个自主出块节点调度首次出块尝试，并按需调度周期性链头检查
     */
    public SimulationDriver seed() {
        Preconditions.checkState(!seeded, "模拟已经初始化过事件");
        seeded = true;
        double interval = config.getMiningInterval();
        for (NodeAgent node : nodes.values()) {
            if (node.isMiner()) {
                double start = config.isJitterStart() ? ctx.getRng().nextDouble() * interval : 0.0;
                ctx.schedule(start, SimEvent.mineAttempt(node.getId(), MiningTrial.RANDOM));
            }
        }
        if (config.getForkCheckInterval() > 0) {
            for (int nodeId : nodes.keySet()) {
                ctx.schedule(config.getForkCheckInterval(), SimEvent.forkCheck(nodeId));
            }
        }
        return this;
    }

    /**
     * 场景脚本：在指定时间让节点进行一次必定成功的出块试验
     */
    public SimulationDriver scheduleForcedTrial(int nodeId, double time) {
        checkNode(nodeId);
        ctx.schedule(time, SimEvent.mineAttempt(nodeId, MiningTrial.FORCED));
        return this;
    }

    /**
     * 场景脚本：直接向节点投递一个区块（可以是畸形区块），sender 可为 {@link SimEvent#NO_NODE}
     */
    public SimulationDriver injectArrival(int nodeId, Block block, int sender, double time) {
        checkNode(nodeId);
        Preconditions.checkArgument(block != null, "投递的区块不能为空");
        ctx.schedule(time, SimEvent.blockArrival(nodeId, block, sender));
        return this;
    }

    public SimulationResult run() {
        Preconditions.checkState(!finished, "每个驱动器只能运行一次");
        finished = true;
        log.info("模拟开始：maxTime={}, maxBlocks={}, 初始事件 {}", config.getMaxTime(), config.getMaxBlocks(),
                ctx.getQueue().size());

        HaltReason reason;
        while (true) {
            if (ctx.getQueue().isEmpty()) {
                reason = ctx.isProductionOpen() ? HaltReason.QUEUE_EXHAUSTED : HaltReason.BLOCK_HORIZON;
                break;
            }
            if (ctx.getQueue().peekTime() > config.getMaxTime()) {
                reason = HaltReason.TIME_HORIZON;
                break;
            }
            if (ctx.getDispatchedEvents() >= config.getMaxEvents()) {
                reason = HaltReason.EVENT_BUDGET;
                log.warn("分发事件数达到上限 {}，提前终止", config.getMaxEvents());
                break;
            }
            ScheduledEvent next = ctx.getQueue().popNext();
            ctx.advanceTo(next.getTime());
            SimEvent event = next.getEvent();
            nodes.get(event.getTarget()).handle(event, ctx);
        }

        long orphaned = reportOrphans();
        SimulationResult result = collect(reason, orphaned);
        log.info("模拟结束：{}，t={}，事件 {}，出块 {}，拒绝 {}，丢弃 {}，未解决孤块 {}，最终链头 {} 个",
                reason, ctx.getNow(), ctx.getDispatchedEvents(), ctx.getBlocksMined(), ctx.getRejectedBlocks(),
                ctx.getDroppedMessages(), orphaned, result.distinctHeads().size());
        return result;
    }

    private long reportOrphans() {
        long orphaned = 0;
        for (NodeAgent node : nodes.values()) {
            for (PendingBlock pending : node.pendingBlocks()) {
                ctx.record(node.getId(), TraceKind.ORPHAN_UNRESOLVED, pending.getBlock(), node.getView(),
                        "from=" + pending.getSender());
                orphaned++;
            }
        }
        if (orphaned > 0) {
            log.warn("模拟结束时仍有 {} 个区块缺少祖先", orphaned);
        }
        return orphaned;
    }

    private SimulationResult collect(HaltReason reason, long orphaned) {
        ImmutableSortedMap.Builder<Integer, LedgerSnapshot> snapshots = ImmutableSortedMap.naturalOrder();
        for (NodeAgent node : nodes.values()) {
            snapshots.put(node.getId(), snapshotOf(node));
        }
        ImmutableMap.Builder<BlockHash, Block> blocks = ImmutableMap.builder();
        for (Block block : ctx.getStore().all()) {
            blocks.put(block.getId(), block);
        }
        return SimulationResult.builder()
                .config(config)
                .haltReason(reason)
                .endTime(ctx.getNow())
                .dispatchedEvents(ctx.getDispatchedEvents())
                .blocksMined(ctx.getBlocksMined())
                .rejectedBlocks(ctx.getRejectedBlocks())
                .droppedMessages(ctx.getDroppedMessages())
                .duplicateDeliveries(ctx.getDuplicateDeliveries())
                .orphanedBlocks(orphaned)
                .trace(ImmutableList.copyOf(ctx.getTrace()))
                .snapshots(snapshots.build())
                .blocks(blocks.build())
                .topologyKind(topology.getKind())
                .edgeCount(topology.edgeCount())
                .diameter(topology.diameter())
                .build();
    }

    private LedgerSnapshot snapshotOf(NodeAgent node) {
        LedgerView view = node.getView();
        List<Block> seen = view.blocks();
        ImmutableList.Builder<BlockHash> ids = ImmutableList.builder();
        ImmutableMap.Builder<BlockHash, Double> arrivals = ImmutableMap.builder();
        for (Block block : seen) {
            ids.add(block.getId());
            arrivals.put(block.getId(), view.arrivalTime(block.getId()));
        }
        ImmutableList.Builder<BlockHash> tips = ImmutableList.builder();
        for (Block tip : view.tips()) {
            tips.add(tip.getId());
        }
        return LedgerSnapshot.builder()
                .nodeId(node.getId())
                .state(node.getState(ctx))
                .headId(view.getHead())
                .headHeight(view.getHeadBlock().getHeight())
                .blocksSeen(ids.build())
                .arrivalTimes(arrivals.build())
                .tips(tips.build())
                .pendingCount(node.pendingBlocks().size())
                .build();
    }

    private void checkNode(int nodeId) {
        Preconditions.checkArgument(nodes.containsKey(nodeId), "未知节点: %s", nodeId);
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public NetworkTopology getTopology() {
        return topology;
    }

    /**
     * 运行中或运行后查看节点（测试与场景脚本使用）
     */
    public NodeAgent node(int nodeId) {
        checkNode(nodeId);
        return nodes.get(nodeId);
    }
}
