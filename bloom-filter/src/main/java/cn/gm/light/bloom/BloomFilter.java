package cn.gm.light.bloom;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 布隆过滤器，所有方法线程安全且不会抛出异常
 * @date 2025/3/8 20:31:33
 */
public interface BloomFilter {

    // 添加单个元素
    void insert(byte[] element);

    // 批量添加元素
    default void insertAll(Iterable<byte[]> elements) {
        for (byte[] element : elements) {
            insert(element);
        }
    }

    /**
     * 检查元素是否可能存在
     *
     * @return false 表示一定不存在，true 表示可能存在
     */
    boolean search(byte[] element);

    /**
     * 位数组按 MSB 优先打包成字节，长度为 bitSize / 8
     */
    byte[] marshalBinary();

    /**
     * 用 data 整体替换位数组，替换后 bitSize 为 data.length * 8，哈希函数不变
     */
    void unmarshalBinary(byte[] data);

    // 位数组长度，总是8的倍数；unmarshal 之后可能超过 int 范围
    long bitSize();

    // 已置位的数量
    long cardinality();

    int hashCount();

    /**
     * 每一位输出 '1' 或 '0'，长度等于 bitSize
     */
    @Override
    String toString();
}
