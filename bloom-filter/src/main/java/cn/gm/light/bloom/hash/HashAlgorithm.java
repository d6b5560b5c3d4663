package cn.gm.light.bloom.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.util.Locale;
import java.util.Optional;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 内置的具名哈希算法（无状态），名字用于配置和快照
 * @date 2025/3/9 10:20:51
 */
public enum HashAlgorithm implements HashFunction64 {
    FNV1_64 {
        @Override
        public long digest(byte[] data) {
            return Fnv64.fnv1(data);
        }
    },
    FNV1A_64 {
        @Override
        public long digest(byte[] data) {
            return Fnv64.fnv1a(data);
        }
    },
    CRC64_ISO {
        @Override
        public long digest(byte[] data) {
            return Crc64.iso(data);
        }
    },
    CRC64_ECMA {
        @Override
        public long digest(byte[] data) {
            return Crc64.ecma(data);
        }
    },
    MURMUR3_64 {
        @Override
        public long digest(byte[] data) {
            // 取 128 位结果的低 64 位
            return MURMUR3.hashBytes(data).asLong();
        }
    };

    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    // 大小写不敏感，'-' 视作 '_'
    public static Optional<HashAlgorithm> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}
