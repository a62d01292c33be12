package com.bit.chainsim.common;

/**
 * 区块哈希（32字节），由区块内容派生，标识一个区块的唯一ID
 */
public class BlockHash extends ByteHash32 {

    public BlockHash(byte[] value) {
        super(value);
    }

    public static BlockHash fromBytes(byte[] bytes) {
        return new BlockHash(bytes);
    }

    public static BlockHash fromHex(String hex) {
        return new BlockHash(hexToBytes(hex));
    }
}
