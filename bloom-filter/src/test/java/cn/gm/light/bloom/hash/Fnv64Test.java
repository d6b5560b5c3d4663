package cn.gm.light.bloom.hash;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

public class Fnv64Test {

    private static final byte[] HELLO = "Hello, world!".getBytes(StandardCharsets.UTF_8);

    @Test
    public void testKnownAnswers() {
        Assertions.assertEquals(0x6519bd6389aaa166L, Fnv64.fnv1(HELLO));
        Assertions.assertEquals(0x38d1334144987bf4L, Fnv64.fnv1a(HELLO));
        // 空输入即 offset basis
        Assertions.assertEquals(0xcbf29ce484222325L, Fnv64.fnv1(new byte[0]));
        Assertions.assertEquals(0xcbf29ce484222325L, Fnv64.fnv1a(new byte[0]));
    }

    @Test
    public void testIncrementalUpdate() {
        Fnv64 hasher = Fnv64.newFnv1a();
        hasher.update(HELLO, 0, 5);
        hasher.update(HELLO, 5, HELLO.length - 5);
        Assertions.assertEquals(Fnv64.fnv1a(HELLO), hasher.sum64());
        // sum64 不改变状态
        Assertions.assertEquals(Fnv64.fnv1a(HELLO), hasher.sum64());
    }

    @Test
    public void testReset() {
        Fnv64 hasher = Fnv64.newFnv1();
        hasher.update(HELLO);
        hasher.reset();
        Assertions.assertEquals(Fnv64.OFFSET_BASIS, hasher.sum64());
        hasher.update(HELLO);
        Assertions.assertEquals(0x6519bd6389aaa166L, hasher.sum64());
    }
}
