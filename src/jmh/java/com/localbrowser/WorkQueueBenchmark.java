package com.localbrowser;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordCollection;
import com.localbrowser.record.RecordRef;
import com.localbrowser.record.SequenceName;
import com.localbrowser.worker.WorkQueue;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 队列与序列区间计算的性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms512m", "-Xmx512m"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class WorkQueueBenchmark {

    @State(Scope.Thread)
    public static class QueueState {
        List<RecordRef> refs;
        List<Integer> frames;

        @Setup
        public void setup() {
            // 一个目录加载 10000 条记录
            List<Record> records = new ArrayList<>();
            for (int i = 0; i < 10_000; i++) {
                records.add(Record.file(Path.of("media", "file" + i + ".png")));
            }
            RecordCollection collection = new RecordCollection("benchmark");
            collection.reset(records);
            refs = collection.refs();

            frames = new ArrayList<>();
            for (int frame = 1; frame <= 5_000; frame++) {
                if (frame % 97 != 0) {
                    frames.add(frame);
                }
            }
        }
    }

    @Benchmark
    public int submitAndDrain(QueueState state) {
        WorkQueue queue = new WorkQueue("benchmark");
        for (RecordRef ref : state.refs) {
            queue.submitIfAbsent(ref);
        }
        for (int i = 0; i < state.refs.size(); i += 100) {
            queue.submit(state.refs.get(i), true);
        }
        int drained = 0;
        while (queue.dequeue().isPresent()) {
            drained++;
        }
        return drained;
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public String rangeString(QueueState state) {
        return SequenceName.rangeString(state.frames, 4);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(WorkQueueBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
