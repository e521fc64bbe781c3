package me.sunmisc.dynarray;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@Threads(1)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@BenchmarkMode(Mode.Throughput)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 4, time = 1)
@Fork(1)
@State(Scope.Thread)
public class DynamicArrayBench {

    @Param({"1", "16"})
    int floor;

    @Param({"1024"})
    int count;

    DynamicArray<Integer> filled;
    List<Integer> filledList;

    @Benchmark
    public int appendThenDrainArray() {
        final DynamicArray<Integer> array = new DynamicArray<>(floor);
        for (int i = 0; i < count; ++i) {
            array.append(i);
        }
        while (!array.isEmpty()) {
            array.removeLast();
        }
        return array.capacity();
    }

    @Benchmark
    public int appendThenDrainList() {
        final List<Integer> list = new ArrayList<>(floor);
        for (int i = 0; i < count; ++i) {
            list.add(i);
        }
        while (!list.isEmpty()) {
            list.remove(list.size() - 1);
        }
        return list.size();
    }

    @Benchmark
    public int insertFrontArray() {
        final DynamicArray<Integer> array = new DynamicArray<>(floor);
        for (int i = 0; i < count; ++i) {
            array.insertAt(0, i);
        }
        return array.size();
    }

    @Benchmark
    public int insertFrontList() {
        final List<Integer> list = new ArrayList<>(floor);
        for (int i = 0; i < count; ++i) {
            list.add(0, i);
        }
        return list.size();
    }

    @Benchmark
    public Integer readArray() {
        return filled.getAt(ThreadLocalRandom.current().nextInt(count));
    }

    @Benchmark
    public Integer readList() {
        return filledList.get(ThreadLocalRandom.current().nextInt(count));
    }

    @Setup
    public void prepare() {
        filled = new DynamicArray<>(floor);
        filledList = new ArrayList<>(floor);
        for (int i = 0; i < count; ++i) {
            filled.append(i);
            filledList.add(i);
        }
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(DynamicArrayBench.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
