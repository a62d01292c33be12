package com.bit.chainsim.structure.trace;

import com.bit.chainsim.common.BlockHash;
import lombok.Builder;
import lombok.Value;

/**
 * 事件轨迹记录（只追加），供外部统计/绘图组件消费
 */
@Value
@Builder
public class TraceRecord {

    long seq;

    double timestamp;

    int nodeId;

    TraceKind kind;

    BlockHash blockId;

    BlockHash parentId;

    /** 记录所涉区块的高度，无区块时为 -1 */
    long blockHeight;

    /** 记录产生后该节点的链头 */
    BlockHash headId;

    long headHeight;

    /** 附加说明（拒绝原因、叶子数、目标节点等） */
    String detail;

    /**
     * 固定格式的单行文本，用于比对两次运行是否逐字节一致
     */
    public String toLine() {
        return seq + "|" + timestamp + "|" + nodeId + "|" + kind
                + "|" + (blockId == null ? "-" : blockId.toHex())
                + "|" + (parentId == null ? "-" : parentId.toHex())
                + "|" + blockHeight
                + "|" + (headId == null ? "-" : headId.toHex())
                + "|" + headHeight
                + "|" + (detail == null ? "" : detail);
    }
}
