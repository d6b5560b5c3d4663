package cn.gm.light.bloom.hash;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description CRC-64（反射实现，初始值与结果异或值均为全1）
 * ISO : x^64 + x^4 + x^3 + x + 1
 * ECMA: ECMA-182（与 CRC-64/XZ 一致）
 * @date 2025/3/9 09:40:05
 */
public final class Crc64 implements Hash64 {

    // 反射形式的多项式
    public static final long ISO_POLY = 0xD800000000000000L;
    public static final long ECMA_POLY = 0xC96C5795D7870F42L;

    private static final long[] ISO_TABLE = makeTable(ISO_POLY);
    private static final long[] ECMA_TABLE = makeTable(ECMA_POLY);

    private final long[] table;
    // 保存的是已经取反后的结果，0 即初始状态
    private long crc;

    private Crc64(long[] table) {
        this.table = table;
    }

    public static Crc64 newIso() {
        return new Crc64(ISO_TABLE);
    }

    public static Crc64 newEcma() {
        return new Crc64(ECMA_TABLE);
    }

    public static Crc64 newCustom(long reflectedPoly) {
        return new Crc64(makeTable(reflectedPoly));
    }

    @Override
    public void update(byte[] data, int offset, int length) {
        crc = update(table, crc, data, offset, length);
    }

    @Override
    public long sum64() {
        return crc;
    }

    @Override
    public void reset() {
        crc = 0L;
    }

    public static long iso(byte[] data) {
        return update(ISO_TABLE, 0L, data, 0, data.length);
    }

    public static long ecma(byte[] data) {
        return update(ECMA_TABLE, 0L, data, 0, data.length);
    }

    static long[] makeTable(long poly) {
        long[] t = new long[256];
        for (int i = 0; i < 256; i++) {
            long c = i;
            for (int j = 0; j < 8; j++) {
                if ((c & 1) == 1) {
                    c = (c >>> 1) ^ poly;
                } else {
                    c >>>= 1;
                }
            }
            t[i] = c;
        }
        return t;
    }

    private static long update(long[] table, long crc, byte[] data, int offset, int length) {
        crc = ~crc;
        for (int i = offset; i < offset + length; i++) {
            crc = table[(int) ((crc ^ data[i]) & 0xff)] ^ (crc >>> 8);
        }
        return ~crc;
    }
}
