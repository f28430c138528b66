package com.textmetrics;

import com.textmetrics.analysis.MetricsRecord;
import com.textmetrics.analysis.TextMetricsEngine;
import com.textmetrics.lexicon.LexiconLoader;
import com.textmetrics.lexicon.LexiconSet;
import com.textmetrics.config.EngineConfig;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 文本分析吞吐量基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TextMetricsBenchmark {

    @State(Scope.Thread)
    public static class AnalysisState {
        TextMetricsEngine engine;
        LexiconSet lexicons;
        String shortText;
        String longText;

        @Setup
        public void setup() {
            engine = new TextMetricsEngine();
            lexicons = new LexiconLoader().loadDefaults(EngineConfig.defaults());
            shortText = generateParagraph(0);

            StringBuilder builder = new StringBuilder();
            // 约 1000 段，模拟一篇长文章
            for (int i = 0; i < 1000; i++) {
                builder.append(generateParagraph(i)).append('\n');
            }
            longText = builder.toString();
        }

        private String generateParagraph(int index) {
            return "Paragraph " + index + " describes a wonderful product. "
                + "The customers were disappointed by the delayed shipping, but the support team was helpful! "
                + "Is this sophisticated documentation readable enough? "
                + "We recommend it to our colleagues.";
        }
    }

    @Benchmark
    public MetricsRecord analyzeShortText(AnalysisState state) {
        return state.engine.analyze(state.shortText, state.lexicons);
    }

    @Benchmark
    public MetricsRecord analyzeLongText(AnalysisState state) {
        return state.engine.analyze(state.longText, state.lexicons);
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
            .include(TextMetricsBenchmark.class.getSimpleName())
            .build();
        new Runner(options).run();
    }
}
