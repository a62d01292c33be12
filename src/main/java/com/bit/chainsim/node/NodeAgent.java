package com.bit.chainsim.node;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.consensus.ConsensusEngine;
import com.bit.chainsim.ledger.LedgerView;
import com.bit.chainsim.sim.SimulationContext;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.block.MiningProof;
import com.bit.chainsim.structure.event.MiningTrial;
import com.bit.chainsim.structure.event.SimEvent;
import com.bit.chainsim.structure.trace.TraceKind;
import com.google.common.collect.ImmutableSortedSet;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 网络中的一个节点：出块、校验、洪泛转发，并在父区块到达前缓冲孤块
 * 每个区块只转发一次，转发给除发送方之外的全部邻居
 */
@Slf4j
public class NodeAgent {

    private final int id;

    private final ImmutableSortedSet<Integer> neighbors;

    private final LedgerView view;

    private final ConsensusEngine engine;

    /** 是否自主出块（周期性随机试验） */
    private final boolean miner;

    /** 父区块ID → 等待它的区块，按到达顺序 */
    private final Map<BlockHash, List<PendingBlock>> pending = new LinkedHashMap<>();

    private final Set<BlockHash> pendingIds = new HashSet<>();

    private final Set<BlockHash> rejected = new HashSet<>();

    /** 已发出请求的缺失父区块 */
    private final Set<BlockHash> requestedParents = new HashSet<>();

    /** 已处理过的 (发起节点, 区块) 请求 */
    private final Set<String> seenRequests = new HashSet<>();

    private long minedCount = 0;

    public NodeAgent(int id, ImmutableSortedSet<Integer> neighbors, LedgerView view,
                     ConsensusEngine engine, boolean miner) {
        this.id = id;
        this.neighbors = neighbors;
        this.view = view;
        this.engine = engine;
        this.miner = miner;
    }

    /**
     * 处理一个以本节点为目标的事件
     */
    public void handle(SimEvent event, SimulationContext ctx) {
        switch (event.getKind()) {
            case MINE_ATTEMPT:
                onMineAttempt(event.getTrial(), ctx);
                break;
            case BLOCK_ARRIVAL:
                onBlockArrival(event.getBlock(), event.getSender(), ctx);
                break;
            case FORK_CHECK:
                onForkCheck(ctx);
                break;
            case BLOCK_REQUEST:
                onBlockRequest(event, ctx);
                break;
            default:
                throw new IllegalStateException("未知事件类型: " + event.getKind());
        }
    }

    private void onMineAttempt(MiningTrial trial, SimulationContext ctx) {
        if (!ctx.isProductionOpen()) {
            return;
        }
        Block head = view.getHeadBlock();
        Optional<MiningProof> proof = engine.attemptTrial(id, head, ctx.getNow(), trial, ctx.getRng());
        if (proof.isPresent()) {
            byte[] payload = ("node-" + id + "#" + minedCount).getBytes(StandardCharsets.UTF_8);
            Block block = Block.create(head, id, ctx.getNow(), engine.creditedWeight(id), proof.get(), payload);
            block = ctx.getStore().intern(block);
            minedCount++;
            view.insert(block, ctx.getNow());
            refreshHead(ctx);
            ctx.record(id, TraceKind.MINED, block, view, null);
            ctx.onBlockMined();
            log.debug("节点 {} 出块 {}，高度 {}，t={}", id, block.getId().shortHex(), block.getHeight(), ctx.getNow());
            forward(block, SimEvent.NO_NODE, ctx);
        }
        if (trial == MiningTrial.RANDOM && miner && ctx.isProductionOpen()) {
            ctx.scheduleAfter(ctx.getConfig().getMiningInterval(), SimEvent.mineAttempt(id, MiningTrial.RANDOM));
        }
    }

    private void onBlockArrival(Block block, int sender, SimulationContext ctx) {
        BlockHash blockId = block.getId();
        if (view.contains(blockId) || pendingIds.contains(blockId) || rejected.contains(blockId)) {
            ctx.onDuplicate();
            return;
        }
        // 没有父区块的只能是创世区块，不进入缓冲区
        if (block.isGenesis()) {
            reject(block, engine.rejectionReason(block, view), ctx);
            return;
        }
        if (rejected.contains(block.getParentId())) {
            reject(block, "父区块已被拒绝", ctx);
            return;
        }
        if (!view.contains(block.getParentId())) {
            buffer(block, sender, ctx);
            return;
        }
        admit(new PendingBlock(block, sender), ctx);
    }

    /**
     * 校验并写入区块，随后依次处理缓冲区中等待它的后代
     */
    private void admit(PendingBlock first, SimulationContext ctx) {
        Deque<PendingBlock> work = new ArrayDeque<>();
        work.add(first);
        while (!work.isEmpty()) {
            PendingBlock next = work.poll();
            Block block = next.getBlock();
            String reason = engine.rejectionReason(block, view);
            if (reason != null) {
                reject(block, reason, ctx);
                continue;
            }
            Block canonical = ctx.getStore().intern(block);
            view.insert(canonical, ctx.getNow());
            refreshHead(ctx);
            ctx.record(id, TraceKind.ACCEPTED, canonical, view, "from=" + next.getSender());
            forward(canonical, next.getSender(), ctx);

            List<PendingBlock> waiting = pending.remove(canonical.getId());
            if (waiting != null) {
                for (PendingBlock child : waiting) {
                    pendingIds.remove(child.getBlock().getId());
                    work.add(child);
                }
            }
        }
    }

    private void reject(Block block, String reason, SimulationContext ctx) {
        Deque<Block> work = new ArrayDeque<>();
        work.add(block);
        String detail = reason;
        while (!work.isEmpty()) {
            Block next = work.poll();
            rejected.add(next.getId());
            ctx.onRejected();
            ctx.record(id, TraceKind.REJECTED, next, view, detail);
            log.debug("节点 {} 拒绝区块 {}: {}", id, next.getId().shortHex(), detail);
            List<PendingBlock> waiting = pending.remove(next.getId());
            if (waiting != null) {
                for (PendingBlock child : waiting) {
                    pendingIds.remove(child.getBlock().getId());
                    work.add(child.getBlock());
                }
            }
            detail = "父区块已被拒绝";
        }
    }

    private void buffer(Block block, int sender, SimulationContext ctx) {
        BlockHash parentId = block.getParentId();
        pending.computeIfAbsent(parentId, k -> new ArrayList<>()).add(new PendingBlock(block, sender));
        pendingIds.add(block.getId());
        ctx.record(id, TraceKind.BUFFERED, block, view, "missing=" + parentId.shortHex());

        int ttl = ctx.getConfig().getAncestorRequestTtl();
        // 父区块已在缓冲区中时不再请求
        if (ttl > 0 && !pendingIds.contains(parentId) && requestedParents.add(parentId)) {
            seenRequests.add(requestKey(id, parentId));
            for (int neighbor : neighbors) {
                ctx.sendRequest(id, neighbor, parentId, id, ttl);
            }
            ctx.record(id, TraceKind.REQUESTED, block, view, "parent=" + parentId.shortHex() + ",ttl=" + ttl);
        }
    }

    private void onBlockRequest(SimEvent event, SimulationContext ctx) {
        if (!seenRequests.add(requestKey(event.getOrigin(), event.getRequestedId()))) {
            return;
        }
        Block block = view.get(event.getRequestedId());
        if (block != null) {
            // 应答沿请求来路返回，中间节点收到后按正常洪泛继续转发
            ctx.sendBlock(id, event.getSender(), block);
            return;
        }
        if (event.getTtl() > 1) {
            for (int neighbor : neighbors) {
                if (neighbor != event.getSender()) {
                    ctx.sendRequest(id, neighbor, event.getRequestedId(), event.getOrigin(), event.getTtl() - 1);
                }
            }
        }
    }

    private void onForkCheck(SimulationContext ctx) {
        refreshHead(ctx);
        ctx.record(id, TraceKind.FORK_CHECK, null, view, "tips=" + view.tips().size());
        double interval = ctx.getConfig().getForkCheckInterval();
        if (interval > 0 && ctx.keepsPeriodicEvents()) {
            ctx.scheduleAfter(interval, SimEvent.forkCheck(id));
        }
    }

    private void forward(Block block, int except, SimulationContext ctx) {
        for (int neighbor : neighbors) {
            if (neighbor != except) {
                ctx.sendBlock(id, neighbor, block);
            }
        }
    }

    private void refreshHead(SimulationContext ctx) {
        BlockHash selected = engine.selectHead(view);
        if (selected.equals(view.getHead())) {
            return;
        }
        Block previous = view.getHeadBlock();
        view.setHead(selected);
        if (!previous.getId().equals(view.getHeadBlock().getParentId())) {
            log.debug("节点 {} 链头重组 {} -> {}，t={}", id, previous.getId().shortHex(), selected.shortHex(), ctx.getNow());
        }
    }

    private static String requestKey(int origin, BlockHash blockId) {
        return origin + ":" + blockId.toHex();
    }

    public int getId() {
        return id;
    }

    public LedgerView getView() {
        return view;
    }

    public ImmutableSortedSet<Integer> getNeighbors() {
        return neighbors;
    }

    public boolean isMiner() {
        return miner;
    }

    public NodeState getState(SimulationContext ctx) {
        if (!pending.isEmpty()) {
            return NodeState.AWAITING_ANCESTOR;
        }
        return miner && ctx.isProductionOpen() ? NodeState.MINING : NodeState.IDLE;
    }

    /**
     * 仍在缓冲区中的区块，按父区块分组的到达顺序
     */
    public List<PendingBlock> pendingBlocks() {
        List<PendingBlock> all = new ArrayList<>();
        for (List<PendingBlock> waiting : pending.values()) {
            all.addAll(waiting);
        }
        return Collections.unmodifiableList(all);
    }
}
