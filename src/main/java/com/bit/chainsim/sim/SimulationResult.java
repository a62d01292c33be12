package com.bit.chainsim.sim;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.config.SimulationConfig;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.trace.TraceRecord;
import com.bit.chainsim.topology.TopologyKind;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 一次运行的全部输出：轨迹、各节点快照、计数器
 * 外部统计/可视化组件只读取本对象，不回写引擎
 */
@Value
@Builder
public class SimulationResult {

    SimulationConfig config;

    HaltReason haltReason;

    /** 最后分发事件的模拟时间 */
    double endTime;

    long dispatchedEvents;

    long blocksMined;

    long rejectedBlocks;

    long droppedMessages;

    long duplicateDeliveries;

    long orphanedBlocks;

    List<TraceRecord> trace;

    /** 节点ID → 快照，按ID有序 */
    Map<Integer, LedgerSnapshot> snapshots;

    /** 全部通过校验的区块，按首次写入顺序 */
    Map<BlockHash, Block> blocks;

    TopologyKind topologyKind;

    int edgeCount;

    int diameter;

    public LedgerSnapshot snapshot(int nodeId) {
        return snapshots.get(nodeId);
    }

    public Block block(BlockHash id) {
        return blocks.get(id);
    }

    /**
     * 各节点最终链头的去重集合
     */
    public Set<BlockHash> distinctHeads() {
        Set<BlockHash> heads = new TreeSet<>();
        for (LedgerSnapshot snapshot : snapshots.values()) {
            heads.add(snapshot.getHeadId());
        }
        return heads;
    }

    public List<String> traceLines() {
        List<String> lines = new ArrayList<>(trace.size());
        for (TraceRecord record : trace) {
            lines.add(record.toLine());
        }
        return lines;
    }
}
