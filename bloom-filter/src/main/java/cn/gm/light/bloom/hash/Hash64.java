package cn.gm.light.bloom.hash;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 可插拔的64位哈希函数（有状态，增量写入）
 * 使用方式：update 若干次 -> sum64 取摘要 -> reset 回到初始状态
 * 实例本身不是线程安全的，交给过滤器时会被 {@link StatefulHashFunction} 包装
 * @date 2025/3/8 20:31:33
 */
public interface Hash64 {

    // 追加写入一段数据
    void update(byte[] data, int offset, int length);

    default void update(byte[] data) {
        update(data, 0, data.length);
    }

    // 取当前累积数据的64位摘要（不改变状态）
    long sum64();

    // 恢复到初始状态
    void reset();
}
