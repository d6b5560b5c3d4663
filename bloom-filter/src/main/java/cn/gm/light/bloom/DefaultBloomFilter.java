package cn.gm.light.bloom;

import cn.gm.light.bloom.hash.HashFunction64;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 默认布隆过滤器实现
 * 1. 位数组按 MSB 优先每字节8位打包，内存布局与序列化格式一致
 * 2. 哈希函数无状态，摘要在锁外计算，锁只保护位数组
 * 3. 位只会从0变成1，只有 unmarshalBinary 会整体替换
 * @date 2025/3/8 20:45:02
 */
@Slf4j
public class DefaultBloomFilter implements BloomFilter {

    private static final int MAX_STRING_CAPACITY = Integer.MAX_VALUE - 8;

    private final List<HashFunction64> hashFunctions;
    private final ReentrantLock lock = new ReentrantLock();
    // 长度 = bitSize / 8
    private byte[] bits;

    /**
     * @param size          已经向上取整到8的倍数的位数
     * @param hashFunctions 按顺序使用的哈希函数，可以为空
     */
    public DefaultBloomFilter(int size, List<? extends HashFunction64> hashFunctions) {
        Preconditions.checkArgument(size >= 0 && size % 8 == 0, "size must be a non-negative multiple of 8: %s", size);
        this.hashFunctions = ImmutableList.copyOf(hashFunctions);
        this.bits = new byte[size / 8];
        log.debug("Created bloom filter, bits: {}, hash functions: {}", size, this.hashFunctions.size());
    }

    @Override
    public void insert(byte[] element) {
        long[] digests = digests(element);
        lock.lock();
        try {
            long size = bits.length * 8L;
            if (size == 0) {
                return;
            }
            for (long digest : digests) {
                long bitIndex = index(digest, size);
                bits[(int) (bitIndex >>> 3)] |= (byte) (0x80 >>> (bitIndex & 7));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean search(byte[] element) {
        long[] digests = digests(element);
        lock.lock();
        try {
            long size = bits.length * 8L;
            // 没有位或者没有哈希函数时永远不会命中
            if (size == 0 || digests.length == 0) {
                return false;
            }
            for (long digest : digests) {
                long bitIndex = index(digest, size);
                if ((bits[(int) (bitIndex >>> 3)] & (0x80 >>> (bitIndex & 7))) == 0) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public byte[] marshalBinary() {
        lock.lock();
        try {
            return bits.clone();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void unmarshalBinary(byte[] data) {
        byte[] replacement = data.clone();
        lock.lock();
        try {
            if (replacement.length != bits.length) {
                log.debug("Bit array resized by unmarshal: {} -> {}", bits.length * 8L, replacement.length * 8L);
            }
            bits = replacement;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long bitSize() {
        lock.lock();
        try {
            return bits.length * 8L;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long cardinality() {
        lock.lock();
        try {
            long count = 0;
            for (byte b : bits) {
                count += Integer.bitCount(b & 0xff);
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int hashCount() {
        return hashFunctions.size();
    }

    public List<HashFunction64> getHashFunctions() {
        return hashFunctions;
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            // String 最多容纳 Integer.MAX_VALUE - 8 个字符
            StringBuilder sb = new StringBuilder((int) Math.min(bits.length * 8L, MAX_STRING_CAPACITY));
            for (byte b : bits) {
                for (int j = 0; j < 8; j++) {
                    sb.append((b & (0x80 >>> j)) != 0 ? '1' : '0');
                }
            }
            return sb.toString();
        } finally {
            lock.unlock();
        }
    }

    private long[] digests(byte[] element) {
        long[] digests = new long[hashFunctions.size()];
        for (int i = 0; i < digests.length; i++) {
            digests[i] = hashFunctions.get(i).digest(element);
        }
        return digests;
    }

    // 摘要按无符号数取模，位数最多 2^34，必须用 long
    private static long index(long digest, long size) {
        return Long.remainderUnsigned(digest, size);
    }
}
