package io.sortkv.benchmark;

import io.sortkv.codec.KeyCodec;
import io.sortkv.codec.KeyCodecs;
import io.sortkv.common.ByteArray;
import io.sortkv.common.CloseableIterator;
import io.sortkv.common.Range;
import io.sortkv.record.ReadResult;
import io.sortkv.record.RecordEntry;
import io.sortkv.record.RecordMapper;
import io.sortkv.record.RecordTable;
import io.sortkv.storage.InMemoryStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class RecordScanBenchmark {

    private static final int RECORD_COUNT = 100_000;
    private static final int VALUE_SIZE = 100;

    record Row(long id, ByteArray payload) {}

    private static final RecordMapper<Row, Long> MAPPER = new RecordMapper<>() {
        @Override
        public KeyCodec<Long> keyCodec() {
            return KeyCodecs.uint64();
        }

        @Override
        public RecordEntry<Long> encode(Row row) {
            return new RecordEntry<>(row.id(), row.payload());
        }

        @Override
        public Row decode(Long id, ByteArray value) {
            return new Row(id, value);
        }
    };

    private InMemoryStore store;
    private RecordTable<Row, Long> table;

    @Setup(Level.Trial)
    public void setup() {
        store = new InMemoryStore();
        table = RecordTable.of(MAPPER);

        byte[] valueBytes = new byte[VALUE_SIZE];
        ThreadLocalRandom.current().nextBytes(valueBytes);
        ByteArray value = ByteArray.wrap(valueBytes);

        for (long i = 0; i < RECORD_COUNT; i++) {
            table.persist(store, new Row(i, value));
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long scanFull() {
        long count = 0;
        try (CloseableIterator<ReadResult<Row>> it = table.scan(store)) {
            while (it.hasNext()) {
                it.next();
                count++;
            }
        }
        return count;
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    @OperationsPerInvocation(100)
    public void scanRange100(Blackhole bh) {
        long start = ThreadLocalRandom.current().nextInt(RECORD_COUNT - 100);
        try (CloseableIterator<ReadResult<Row>> it = table.scanRange(store, Range.closedOpen(start, start + 100))) {
            it.forEachRemaining(bh::consume);
        }
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public void fetch(Blackhole bh) {
        long id = ThreadLocalRandom.current().nextInt(RECORD_COUNT);
        bh.consume(table.fetch(store, id));
    }
}
