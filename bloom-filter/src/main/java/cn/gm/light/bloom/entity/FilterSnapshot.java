package cn.gm.light.bloom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器快照：位数组 + 哈希算法名，JSON 格式持久化
 * @date 2025/3/9 14:02:11
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterSnapshot implements Serializable {
    private static final long serialVersionUID = 1L;

    private long bitSize;

    private List<String> hashAlgorithms;

    // marshalBinary 的结果，Base64 编码
    private String bits;
}
