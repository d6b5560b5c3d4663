package cn.gm.light.bloom.benchmark;

import cn.gm.light.bloom.BloomFilter;
import cn.gm.light.bloom.BloomFilters;
import lombok.extern.slf4j.Slf4j;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 默认过滤器的并发读写吞吐
 * @date 2025/3/10 16:18:40
 */
@BenchmarkMode(Mode.Throughput)          // 测试吞吐量（ops/ms）
@OutputTimeUnit(TimeUnit.MILLISECONDS)   // 输出时间单位
@Warmup(iterations = 3, time = 5)       // 预热3轮，每轮5秒
@Measurement(iterations = 5, time = 10) // 正式测试5轮，每轮10秒
@Threads(16)
@Fork(1)                                // 单进程测试
@State(Scope.Benchmark)
@Slf4j
public class BloomFilterBenchmark {

    // 位数组大小（参数化测试）
    @Param({"1048576", "16777216"})
    public int bitSize;

    // 过滤器实例（线程共享）
    private BloomFilter bloomFilter;

    // 预生成的键
    private byte[][] testKeys;

    @Setup(Level.Trial)
    public void setup() {
        bloomFilter = BloomFilters.basic(bitSize);
        int dataSize = 100_000;
        testKeys = new byte[dataSize][];
        for (int i = 0; i < dataSize; i++) {
            testKeys[i] = ("key" + i).getBytes(StandardCharsets.UTF_8);
        }
        // 预先写入一半，读的时候一半命中一半不命中
        for (int i = 0; i < dataSize / 2; i++) {
            bloomFilter.insert(testKeys[i]);
        }
        log.info("Benchmark filter ready, bits: {}, set: {}", bloomFilter.bitSize(), bloomFilter.cardinality());
    }

    private byte[] getRandomTestKey() {
        return testKeys[ThreadLocalRandom.current().nextInt(testKeys.length)];
    }

    @Benchmark
    public void insertThroughput(Blackhole blackhole) {
        byte[] key = getRandomTestKey();
        bloomFilter.insert(key);
        blackhole.consume(key);
    }

    @Benchmark
    public void searchThroughput(Blackhole blackhole) {
        blackhole.consume(bloomFilter.search(getRandomTestKey()));
    }
}
