package cn.gm.light.bloom.hash;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 无状态的64位哈希函数，过滤器只依赖这个类型，计算摘要不需要持有过滤器的锁
 * @date 2025/3/8 20:40:12
 */
@FunctionalInterface
public interface HashFunction64 {

    /**
     * 计算摘要，返回值按无符号64位整数解释
     */
    long digest(byte[] data);
}
