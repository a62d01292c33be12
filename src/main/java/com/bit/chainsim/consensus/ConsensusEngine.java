package com.bit.chainsim.consensus;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.ledger.LedgerView;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.block.MiningProof;
import com.bit.chainsim.structure.event.MiningTrial;

import java.util.Optional;
import java.util.Random;

/**
 * 可插拔的分叉选择与有效性规则
 * 变体集合封闭（见 {@link ConsensusKind}），由 {@link ConsensusEngines} 创建
 */
public interface ConsensusEngine {

    ConsensusKind kind();

    /**
     * 校验区块在给定账本视图下是否有效
     */
    default boolean validate(Block block, LedgerView view) {
        return rejectionReason(block, view) == null;
    }

    /**
     * 返回区块无效的原因，有效时返回 null
     */
    String rejectionReason(Block block, LedgerView view);

    /**
     * 选出视图的规范链头，不修改账本，由调用方提交
     */
    BlockHash selectHead(LedgerView view);

    /**
     * 区块在分叉选择中计入的权重
     */
    double weightOf(Block block);

    /**
     * 节点出块时记入区块的权重
     */
    double creditedWeight(int nodeId);

    /**
     * 在当前链头之上进行一次出块试验
     * @return 成功时返回出块证明，失败或不具备出块资格时为空
     */
    Optional<MiningProof> attemptTrial(int nodeId, Block head, double now, MiningTrial trial, Random rng);
}
