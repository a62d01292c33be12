package com.bit.chainsim.structure.block;

import com.bit.chainsim.common.BlockHash;
import com.bit.chainsim.util.Sha;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 模拟区块：创建后不可变，ID由内容派生（SHA-256）
 * 所有节点的账本视图共享同一个Block实例，只持有引用
 */
@Getter
@EqualsAndHashCode(of = "id")
public final class Block {

    public static final int GENESIS_CREATOR = -1;

    /**
     * 创世区块的插槽号，任何PoS区块的slot都必须大于它
     */
    public static final long GENESIS_SLOT = -1;

    private static final Block GENESIS = new Block(null, GENESIS_CREATOR, 0.0, 0, 0.0, null, new byte[0]);

    /** 内容哈希 */
    private final BlockHash id;

    /** 父区块哈希，仅创世区块为null */
    private final BlockHash parentId;

    /** 出块节点ID，创世区块为-1 */
    private final int creator;

    /** 出块时的模拟时间 */
    private final double timestamp;

    /** 距创世区块的高度 */
    private final long height;

    /** 出块时记入的权重（算力或质押，取决于协议） */
    private final double weight;

    /** 出块证明，创世区块为null */
    private final MiningProof proof;

    @Getter(lombok.AccessLevel.NONE)
    private final byte[] payload;

    private Block(BlockHash parentId, int creator, double timestamp, long height,
                  double weight, MiningProof proof, byte[] payload) {
        this.parentId = parentId;
        this.creator = creator;
        this.timestamp = timestamp;
        this.height = height;
        this.weight = weight;
        this.proof = proof;
        this.payload = payload == null ? new byte[0] : Arrays.copyOf(payload, payload.length);
        this.id = computeId(parentId, creator, timestamp, height, weight, proof, this.payload);
    }

    public static Block genesis() {
        return GENESIS;
    }

    /**
     * 在父区块之上创建新区块，高度为父高度+1
     */
    public static Block create(Block parent, int creator, double timestamp, double weight,
                               MiningProof proof, byte[] payload) {
        return new Block(parent.getId(), creator, timestamp, parent.getHeight() + 1, weight, proof, payload);
    }

    /**
     * 按任意字段构造区块（用于构造畸形区块或离线重建）
     */
    public static Block of(BlockHash parentId, int creator, double timestamp, long height,
                           double weight, MiningProof proof, byte[] payload) {
        return new Block(parentId, creator, timestamp, height, weight, proof, payload);
    }

    public boolean isGenesis() {
        return parentId == null;
    }

    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    /**
     * PoS插槽号，创世区块或无证明时为 GENESIS_SLOT
     */
    public long getSlot() {
        return proof == null ? GENESIS_SLOT : proof.getSlot();
    }

    /**
     * 重新计算内容哈希并与ID比对
     */
    public boolean hasConsistentId() {
        return id.equals(computeId(parentId, creator, timestamp, height, weight, proof, payload));
    }

    private static BlockHash computeId(BlockHash parentId, int creator, double timestamp, long height,
                                       double weight, MiningProof proof, byte[] payload) {
        ByteBuffer buffer = ByteBuffer.allocate(BlockHash.HASH_LENGTH + 4 + 8 * 3 + 1 + 8 * 3 + payload.length);
        buffer.put(parentId == null ? new byte[BlockHash.HASH_LENGTH] : parentId.getBytes());
        buffer.putInt(creator);
        buffer.putLong(Double.doubleToLongBits(timestamp));
        buffer.putLong(height);
        buffer.putLong(Double.doubleToLongBits(weight));
        if (proof == null) {
            buffer.put((byte) 0);
            buffer.putLong(0).putLong(0).putLong(0);
        } else {
            buffer.put((byte) 1);
            buffer.putLong(Double.doubleToLongBits(proof.getRoll()));
            buffer.putLong(Double.doubleToLongBits(proof.getThreshold()));
            buffer.putLong(proof.getSlot());
        }
        buffer.put(payload);
        return BlockHash.fromBytes(Sha.applySHA256(buffer.array()));
    }

    @Override
    public String toString() {
        return "Block{" + id.shortHex()
                + ", parent=" + (parentId == null ? "-" : parentId.shortHex())
                + ", creator=" + creator
                + ", height=" + height
                + ", t=" + timestamp + '}';
    }
}
