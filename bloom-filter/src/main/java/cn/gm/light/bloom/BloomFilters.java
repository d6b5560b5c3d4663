package cn.gm.light.bloom;

import cn.gm.light.bloom.config.BloomFilterConfig;
import cn.gm.light.bloom.entity.FilterSnapshot;
import cn.gm.light.bloom.exception.BloomFilterException;
import cn.gm.light.bloom.hash.Hash64;
import cn.gm.light.bloom.hash.HashAlgorithm;
import cn.gm.light.bloom.hash.HashFunction64;
import cn.gm.light.bloom.hash.StatefulHashFunction;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器的构造入口
 * 1. basic：默认四个哈希函数（FNV-1、FNV-1a、CRC-64 ISO、CRC-64 ECMA）
 * 2. custom：调用方提供任意数量的哈希函数
 * 3. fromConfig / snapshot / restore：配置与 JSON 快照
 * 位数统一向上取整到8的倍数
 * @date 2025/3/9 11:32:08
 */
@Slf4j
public final class BloomFilters {

    public static final List<HashAlgorithm> DEFAULT_ALGORITHMS = ImmutableList.of(
            HashAlgorithm.FNV1_64,
            HashAlgorithm.FNV1A_64,
            HashAlgorithm.CRC64_ISO,
            HashAlgorithm.CRC64_ECMA);

    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    private BloomFilters() {
    }

    public static BloomFilter basic(int size) {
        return new DefaultBloomFilter(roundSize(size), DEFAULT_ALGORITHMS);
    }

    // 有状态的哈希函数，每个实例包装一次，同一实例在过滤器间共享也是安全的
    public static BloomFilter custom(int size, Hash64... hashers) {
        List<HashFunction64> functions = new ArrayList<>(hashers.length);
        for (Hash64 hasher : hashers) {
            functions.add(new StatefulHashFunction(hasher));
        }
        return new DefaultBloomFilter(roundSize(size), functions);
    }

    public static BloomFilter custom(int size, List<? extends HashFunction64> functions) {
        return new DefaultBloomFilter(roundSize(size), functions);
    }

    public static BloomFilter fromConfig(BloomFilterConfig config) {
        Preconditions.checkNotNull(config, "config");
        if (config.getSize() < 0) {
            log.warn("Rejecting bloom filter config with negative size: {}", config.getSize());
            throw BloomFilterException.badConfig("size must not be negative: " + config.getSize());
        }
        List<String> names = config.getHashAlgorithms();
        if (names == null || names.isEmpty()) {
            return basic(config.getSize());
        }
        return custom(config.getSize(), resolve(names));
    }

    /**
     * 生成 JSON 快照，只支持全部由 {@link HashAlgorithm} 构成的过滤器
     */
    public static String snapshot(BloomFilter filter) {
        if (!(filter instanceof DefaultBloomFilter)) {
            throw BloomFilterException.badSnapshot("unsupported filter type: " + filter.getClass().getName(), null);
        }
        List<String> names = new ArrayList<>();
        for (HashFunction64 function : ((DefaultBloomFilter) filter).getHashFunctions()) {
            if (!(function instanceof HashAlgorithm)) {
                log.warn("Cannot snapshot bloom filter with unnamed hash function: {}", function);
                throw BloomFilterException.badSnapshot("hash function has no registered name: " + function, null);
            }
            names.add(((HashAlgorithm) function).name());
        }
        // 先取位数组再算长度，和并发的 unmarshal 保持一致
        byte[] bits = filter.marshalBinary();
        FilterSnapshot snapshot = FilterSnapshot.builder()
                .bitSize(bits.length * 8L)
                .hashAlgorithms(names)
                .bits(BASE64.encode(bits))
                .build();
        return JSON.toJSONString(snapshot);
    }

    public static BloomFilter restore(String json) {
        FilterSnapshot snapshot;
        byte[] bits;
        try {
            snapshot = JSON.parseObject(json, FilterSnapshot.class);
            if (snapshot == null) {
                throw BloomFilterException.badSnapshot("empty snapshot", null);
            }
            bits = BASE64.decode(snapshot.getBits() == null ? "" : snapshot.getBits());
        } catch (JSONException | IllegalArgumentException e) {
            log.warn("Failed to parse bloom filter snapshot", e);
            throw BloomFilterException.badSnapshot("malformed snapshot", e);
        }
        if (bits.length * 8L != snapshot.getBitSize()) {
            log.warn("Snapshot bit size {} does not match payload of {} bits", snapshot.getBitSize(), bits.length * 8L);
            throw BloomFilterException.badSnapshot("bit size mismatch: " + snapshot.getBitSize(), null);
        }
        List<String> names = snapshot.getHashAlgorithms() == null ? List.of() : snapshot.getHashAlgorithms();
        BloomFilter filter = custom(0, resolve(names));
        filter.unmarshalBinary(bits);
        return filter;
    }

    /**
     * 向上取整到8的倍数：0 -> 0，10 -> 16，100 -> 104，104 -> 104
     */
    public static int roundSize(int size) {
        Preconditions.checkArgument(size >= 0, "size must not be negative: %s", size);
        Preconditions.checkArgument(size <= Integer.MAX_VALUE - 7, "size too large: %s", size);
        return (size + 7) / 8 * 8;
    }

    private static List<HashAlgorithm> resolve(List<String> names) {
        List<HashAlgorithm> algorithms = new ArrayList<>(names.size());
        for (String name : names) {
            HashAlgorithm algorithm = HashAlgorithm.lookup(name).orElseThrow(() -> {
                log.warn("Unknown hash algorithm: {}", name);
                return BloomFilterException.badConfig("unknown hash algorithm: " + name);
            });
            algorithms.add(algorithm);
        }
        return algorithms;
    }
}
