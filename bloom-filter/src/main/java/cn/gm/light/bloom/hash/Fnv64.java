package cn.gm.light.bloom.hash;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 64位 FNV-1 / FNV-1a
 * FNV-1 : 先乘质数再异或
 * FNV-1a: 先异或再乘质数
 * @date 2025/3/9 09:12:40
 */
public final class Fnv64 implements Hash64 {

    static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    static final long PRIME = 0x100000001b3L;

    private final boolean alternate;
    private long state = OFFSET_BASIS;

    private Fnv64(boolean alternate) {
        this.alternate = alternate;
    }

    public static Fnv64 newFnv1() {
        return new Fnv64(false);
    }

    public static Fnv64 newFnv1a() {
        return new Fnv64(true);
    }

    @Override
    public void update(byte[] data, int offset, int length) {
        state = alternate ? mix1a(state, data, offset, length) : mix1(state, data, offset, length);
    }

    @Override
    public long sum64() {
        return state;
    }

    @Override
    public void reset() {
        state = OFFSET_BASIS;
    }

    public static long fnv1(byte[] data) {
        return mix1(OFFSET_BASIS, data, 0, data.length);
    }

    public static long fnv1a(byte[] data) {
        return mix1a(OFFSET_BASIS, data, 0, data.length);
    }

    private static long mix1(long h, byte[] data, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            h *= PRIME;
            h ^= data[i] & 0xff;
        }
        return h;
    }

    private static long mix1a(long h, byte[] data, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            h ^= data[i] & 0xff;
            h *= PRIME;
        }
        return h;
    }
}
