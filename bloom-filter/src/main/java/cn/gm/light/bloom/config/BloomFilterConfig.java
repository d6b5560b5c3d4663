package cn.gm.light.bloom.config;

import lombok.Data;

import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器配置
 * @date 2025/3/9 11:20:47
 */
@Data
public class BloomFilterConfig {
    // 期望的位数，实际会向上取整到8的倍数
    private int size;

    // 哈希算法名（见 HashAlgorithm），为空时使用默认的四个
    private List<String> hashAlgorithms;
}
