package com.bitflag.benchmark;

import com.bitflag.core.FlagSet;
import com.bitflag.core.Flags;
import com.bitflag.error.FlagsException;
import com.bitflag.text.FlagsParser;
import com.bitflag.text.FlagsWriter;
import com.bitflag.types.BitsType;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
public class FlagsBenchmark {

    private static final int FLAG_COUNT = 32;

    private FlagSet<Integer> flagSet;

    // Every named flag set, plus a few unknown bits for the mixed case
    private Flags<Integer> allNamed;
    private Flags<Integer> sparse;
    private Flags<Integer> withUnknown;

    private String allNamedText;
    private String sparseText;
    private String withUnknownText;

    @Setup
    public void setup() {
        var builder = FlagSet.builder("Bench", BitsType.U32);
        for (int i = 0; i < FLAG_COUNT - 4; i++) {
            builder.flag("FLAG_" + i, 1L << i);
        }
        builder.flagOf("LOW_NIBBLE", "FLAG_0", "FLAG_1", "FLAG_2", "FLAG_3");
        flagSet = builder.build();

        allNamed = flagSet.all();
        sparse = flagSet.fromBitsRetain(0x0101_0101);
        withUnknown = flagSet.fromBitsRetain(0xF000_00FF);

        allNamedText = FlagsWriter.toText(allNamed);
        sparseText = FlagsWriter.toText(sparse);
        withUnknownText = FlagsWriter.toText(withUnknown);
    }

    @Benchmark
    public void iterateAllNamed(Blackhole bh) {
        for (var flag : allNamed) {
            bh.consume(flag);
        }
    }

    @Benchmark
    public void iterateSparse(Blackhole bh) {
        for (var flag : sparse) {
            bh.consume(flag);
        }
    }

    @Benchmark
    public String writeAllNamed() {
        return FlagsWriter.toText(allNamed);
    }

    @Benchmark
    public String writeWithUnknown() {
        return FlagsWriter.toText(withUnknown);
    }

    @Benchmark
    public String writeStrictWithUnknown() {
        return FlagsWriter.toTextStrict(withUnknown);
    }

    @Benchmark
    public Flags<Integer> parseAllNamed() throws FlagsException {
        return FlagsParser.fromText(flagSet, allNamedText);
    }

    @Benchmark
    public Flags<Integer> parseSparse() throws FlagsException {
        return FlagsParser.fromText(flagSet, sparseText);
    }

    @Benchmark
    public Flags<Integer> parseWithUnknown() throws FlagsException {
        return FlagsParser.fromText(flagSet, withUnknownText);
    }

    @Benchmark
    public Flags<Integer> lookupByName() {
        return flagSet.flag("FLAG_17");
    }

    public static void main(String[] args) throws RunnerException {
        var opt = new OptionsBuilder()
                .include(FlagsBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
