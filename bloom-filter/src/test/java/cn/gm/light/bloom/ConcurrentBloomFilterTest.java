package cn.gm.light.bloom;

import cn.gm.light.bloom.hash.Crc64;
import cn.gm.light.bloom.hash.Fnv64;
import cn.gm.light.bloom.hash.HashAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 多线程共享同一个过滤器，结束后位数组应与串行写入完全一致
 * @date 2025/3/10 09:31:55
 */
@Slf4j
public class ConcurrentBloomFilterTest {

    private static final int THREADS = 8;
    private static final int KEYS_PER_THREAD = 2000;

    private static byte[] key(int thread, int i) {
        return ("t" + thread + "-key" + i).getBytes(StandardCharsets.UTF_8);
    }

    private void runConcurrently(BloomFilter filter) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < THREADS; t++) {
                final int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < KEYS_PER_THREAD; i++) {
                        byte[] key = key(thread, i);
                        filter.insert(key);
                        // 自己刚写入的一定能查到
                        if (!filter.search(key)) {
                            throw new AssertionError("false negative for " + new String(key, StandardCharsets.UTF_8));
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static BloomFilter sequential(BloomFilter filter) {
        for (int t = 0; t < THREADS; t++) {
            for (int i = 0; i < KEYS_PER_THREAD; i++) {
                filter.insert(key(t, i));
            }
        }
        return filter;
    }

    @Test
    public void testConcurrentInsertAndSearch() throws Exception {
        BloomFilter shared = BloomFilters.basic(1 << 16);
        runConcurrently(shared);

        for (int t = 0; t < THREADS; t++) {
            for (int i = 0; i < KEYS_PER_THREAD; i++) {
                Assertions.assertTrue(shared.search(key(t, i)));
            }
        }
        Assertions.assertEquals(sequential(BloomFilters.basic(1 << 16)).toString(), shared.toString());
    }

    @Test
    public void testConcurrentStatefulHashers() throws Exception {
        BloomFilter shared = BloomFilters.custom(1 << 16, Fnv64.newFnv1a(), Crc64.newIso());
        runConcurrently(shared);

        BloomFilter expected = sequential(
                BloomFilters.custom(1 << 16, List.of(HashAlgorithm.FNV1A_64, HashAlgorithm.CRC64_ISO)));
        log.info("set bits: {}", shared.cardinality());
        Assertions.assertEquals(expected.toString(), shared.toString());
    }
}
