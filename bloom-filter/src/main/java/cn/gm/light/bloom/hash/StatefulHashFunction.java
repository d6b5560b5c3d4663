package cn.gm.light.bloom.hash;

import com.google.common.base.Preconditions;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 把有状态的 {@link Hash64} 适配成 {@link HashFunction64}
 * update -> sum64 -> reset 三步在 hasher 实例上串行执行，多个线程共享同一个实例也不会互相污染
 * @date 2025/3/9 10:02:17
 */
public final class StatefulHashFunction implements HashFunction64 {

    private final Hash64 hasher;

    public StatefulHashFunction(Hash64 hasher) {
        this.hasher = Preconditions.checkNotNull(hasher, "hasher");
    }

    @Override
    public long digest(byte[] data) {
        synchronized (hasher) {
            try {
                hasher.update(data);
                return hasher.sum64();
            } finally {
                hasher.reset();
            }
        }
    }

    public Hash64 getHasher() {
        return hasher;
    }

    @Override
    public String toString() {
        return "StatefulHashFunction(" + hasher.getClass().getSimpleName() + ")";
    }
}
