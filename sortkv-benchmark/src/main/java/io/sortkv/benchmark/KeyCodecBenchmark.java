package io.sortkv.benchmark;

import io.sortkv.codec.KeyCodecs;
import io.sortkv.codec.tuple.Tuple3;
import io.sortkv.codec.tuple.Tuple3Codec;
import io.sortkv.common.ByteArray;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
public class KeyCodecBenchmark {

    private static final int KEY_COUNT = 1024;

    private final Tuple3Codec<Integer, Long, String> composite =
        KeyCodecs.tuple(KeyCodecs.uint16(), KeyCodecs.int64(), KeyCodecs.greedyString());

    private long[] ids;
    private Tuple3<Integer, Long, String>[] keys;
    private ByteArray[] encodedIds;
    private ByteArray[] encodedKeys;

    @SuppressWarnings("unchecked")
    @Setup(Level.Trial)
    public void setup() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        ids = new long[KEY_COUNT];
        keys = new Tuple3[KEY_COUNT];
        encodedIds = new ByteArray[KEY_COUNT];
        encodedKeys = new ByteArray[KEY_COUNT];

        for (int i = 0; i < KEY_COUNT; i++) {
            ids[i] = random.nextLong();
            keys[i] = Tuple3.of(random.nextInt(1 << 16), random.nextLong(), "user/" + random.nextInt(100_000));
            encodedIds[i] = KeyCodecs.int64().encode(ids[i]);
            encodedKeys[i] = composite.encode(keys[i]);
        }
    }

    @Benchmark
    public ByteArray encodeInt64() {
        return KeyCodecs.int64().encode(ids[ThreadLocalRandom.current().nextInt(KEY_COUNT)]);
    }

    @Benchmark
    public Long decodeInt64() {
        return KeyCodecs.int64().decode(encodedIds[ThreadLocalRandom.current().nextInt(KEY_COUNT)]).value();
    }

    @Benchmark
    public ByteArray encodeComposite() {
        return composite.encode(keys[ThreadLocalRandom.current().nextInt(KEY_COUNT)]);
    }

    @Benchmark
    public void decodeComposite(Blackhole bh) {
        bh.consume(composite.decode(encodedKeys[ThreadLocalRandom.current().nextInt(KEY_COUNT)]).value());
    }
}
