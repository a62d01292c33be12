package com.bit.chainsim.common;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 32字节哈希的通用基类，封装共同逻辑（长度校验、不可变性、转换方法等）
 * 具体哈希类型（如区块哈希）应继承此类
 */
@EqualsAndHashCode(of = "value")
public abstract class ByteHash32 implements Serializable, Comparable<ByteHash32> {
    public static final int HASH_LENGTH = 32;
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    // 存储32字节哈希数据（私有且不可变）
    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    @Getter(AccessLevel.PROTECTED)
    private final String hexValue;

    /**
     * 构造方法，由子类调用，强制校验长度
     * @param value 32字节哈希的原始字节数组
     * @throws IllegalArgumentException 若长度不符
     */
    protected ByteHash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH);
        this.hexValue = toHexInternal(this.value);
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    /**
     * 转换为十六进制字符串（使用缓存值），JSON中也以此形式输出
     */
    @JsonValue
    public String toHex() {
        return hexValue;
    }

    /**
     * 日志用短格式：前8位十六进制
     */
    public String shortHex() {
        return hexValue.substring(0, 8);
    }

    /**
     * 按无符号字节字典序比较，与十六进制字符串顺序一致
     */
    @Override
    public int compareTo(ByteHash32 other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return hexValue;
    }

    private String toHexInternal(byte[] bytes) {
        StringBuilder sb = new StringBuilder(HASH_LENGTH * 2);
        for (byte b : bytes) {
            sb.append(HEX_CHARS[(b >>> 4) & 0x0F]);
            sb.append(HEX_CHARS[b & 0x0F]);
        }
        return sb.toString();
    }

    /**
     * 十六进制字符串转字节数组（供子类fromHex调用）
     */
    protected static byte[] hexToBytes(String hex) {
        if (hex == null || hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException("Invalid hex string length for 32-byte hash");
        }
        byte[] bytes = new byte[HASH_LENGTH];
        for (int i = 0; i < HASH_LENGTH; i++) {
            int high = Character.digit(hex.charAt(i * 2), 16);
            int low = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("Invalid hex character in: " + hex);
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return bytes;
    }
}
