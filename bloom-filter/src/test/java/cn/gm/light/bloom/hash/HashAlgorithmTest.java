package cn.gm.light.bloom.hash;

import com.google.common.hash.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

public class HashAlgorithmTest {

    private static final byte[] DATA = "Hello, world!".getBytes(StandardCharsets.UTF_8);

    @Test
    public void testDelegates() {
        Assertions.assertEquals(Fnv64.fnv1(DATA), HashAlgorithm.FNV1_64.digest(DATA));
        Assertions.assertEquals(Fnv64.fnv1a(DATA), HashAlgorithm.FNV1A_64.digest(DATA));
        Assertions.assertEquals(Crc64.iso(DATA), HashAlgorithm.CRC64_ISO.digest(DATA));
        Assertions.assertEquals(Crc64.ecma(DATA), HashAlgorithm.CRC64_ECMA.digest(DATA));
        Assertions.assertEquals(Hashing.murmur3_128().hashBytes(DATA).asLong(), HashAlgorithm.MURMUR3_64.digest(DATA));
    }

    @Test
    public void testLookup() {
        Assertions.assertEquals(Optional.of(HashAlgorithm.CRC64_ECMA), HashAlgorithm.lookup("crc64-ecma"));
        Assertions.assertEquals(Optional.of(HashAlgorithm.FNV1A_64), HashAlgorithm.lookup(" FNV1A_64 "));
        Assertions.assertEquals(Optional.empty(), HashAlgorithm.lookup("md5"));
        Assertions.assertEquals(Optional.empty(), HashAlgorithm.lookup(null));
    }
}
