package cn.gm.light.bloom.exception;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 配置、快照处理失败时抛出；过滤器本身的读写操作不会抛出
 * @date 2025/3/9 11:05:33
 */
public class BloomFilterException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    // 配置非法
    public static final int BAD_CONFIG = 400;
    // 快照无法解析或无法生成
    public static final int BAD_SNAPSHOT = 422;

    private final int code;

    public BloomFilterException(int code, String message) {
        super(message);
        this.code = code;
    }

    // 带异常根源的构造方法
    public BloomFilterException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static BloomFilterException badConfig(String message) {
        return new BloomFilterException(BAD_CONFIG, message);
    }

    public static BloomFilterException badSnapshot(String message, Throwable cause) {
        return new BloomFilterException(BAD_SNAPSHOT, message, cause);
    }

    public int getCode() {
        return code;
    }
}
