package com.textmetrics.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.textmetrics.analysis.AnalysisReport;
import com.textmetrics.analysis.MetricsRecord;
import com.textmetrics.analysis.TextMetricsEngine;
import com.textmetrics.config.Constants;
import com.textmetrics.config.EngineConfig;
import com.textmetrics.lexicon.Lexicon;
import com.textmetrics.lexicon.LexiconLoadException;
import com.textmetrics.lexicon.LexiconLoader;
import com.textmetrics.lexicon.LexiconSet;
import com.textmetrics.source.DirectTextSource;
import com.textmetrics.source.FileTextSource;
import com.textmetrics.source.InvalidInputException;
import com.textmetrics.source.TextSource;
import com.textmetrics.source.UrlTextSource;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "textmetrics",
    description = "📝 基于词表的文本情感与可读性分析",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.AnalyzeSubcommand.class,
        MainCommand.LexiconsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_LEXICON_FAILURE = 2;

    @Option(names = {"--positive"}, description = "正面词表文件（默认使用内置词表）")
    private Path positiveWords;

    @Option(names = {"--negative"}, description = "负面词表文件（默认使用内置词表）")
    private Path negativeWords;

    @Option(names = {"--stopwords"}, description = "停用词表文件（默认使用内置词表）")
    private Path stopWords;

    @Option(names = {"--charsets"}, description = "词表解码顺序，逗号分隔（默认 UTF-8,ISO-8859-1）", split = ",")
    private List<String> charsets;

    private LexiconLoader lexiconLoader;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📝 基于词表的文本情感与可读性分析");
        System.out.println("使用 --help 查看帮助信息");
        return EXIT_OK;
    }

    EngineConfig buildConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setPositiveWordsPath(positiveWords);
        config.setNegativeWordsPath(negativeWords);
        config.setStopWordsPath(stopWords);
        if (charsets != null && !charsets.isEmpty()) {
            config.setLexiconCharsets(charsets);
        }
        return config;
    }

    LexiconLoader lexiconLoader(EngineConfig config) {
        if (lexiconLoader == null) {
            try {
                lexiconLoader = new LexiconLoader(config.getLexiconCharsets());
            } catch (IllegalArgumentException unsupported) {
                throw new LexiconLoadException("不支持的词表编码", String.valueOf(config.getLexiconCharsets()), unsupported);
            }
        }
        return lexiconLoader;
    }

    private int resolveMaxLength(int rawMaxLength) {
        if (rawMaxLength <= 0) {
            System.err.printf("⚠️ 非法长度上限 %d，已回退为默认值 %d%n", rawMaxLength, Constants.MAX_TEXT_LENGTH);
            return Constants.MAX_TEXT_LENGTH;
        }
        return rawMaxLength;
    }

    private String sanitizeText(String rawText, int maxLength) {
        if (rawText.length() > maxLength) {
            throw new InvalidInputException("文本长度超过限制（最大 " + maxLength + " 字符）", "请缩短文本或调大 --max-length");
        }
        return rawText;
    }

    private static int reportInvalidInput(InvalidInputException exception) {
        System.err.println("❌ 输入无效: " + exception.getMessage());
        if (exception.getSuggestion() != null) {
            System.err.println("💡 " + exception.getSuggestion());
        }
        return EXIT_INVALID_INPUT;
    }

    private static int reportLexiconFailure(LexiconLoadException exception) {
        System.err.println("❌ 词表加载失败: " + exception.getMessage());
        System.err.println("💡 请检查词表文件路径与编码");
        return EXIT_LEXICON_FAILURE;
    }

    @Command(name = "analyze", description = "🔎 分析文本、文件或网页")
    static class AnalyzeSubcommand implements Callable<Integer> {

        @Option(names = {"-t", "--text"}, description = "直接输入的文本")
        private String text;

        @Option(names = {"--file"}, description = "UTF-8 文本文件路径")
        private Path file;

        @Option(names = {"-u", "--url"}, description = "要抓取的网页地址")
        private String url;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--max-length"}, description = "允许的最大字符数", defaultValue = "1000000")
        private int maxLength;

        @Option(names = {"--timeout"}, description = "网页抓取超时（毫秒）", defaultValue = "10000")
        private int timeoutMillis;

        @ParentCommand
        private MainCommand main;

        private final TextMetricsEngine engine = new TextMetricsEngine();

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.buildConfig();
                config.setMaxTextLength(main.resolveMaxLength(maxLength));
                config.setFetchTimeoutMillis(timeoutMillis);

                LexiconSet lexicons = main.lexiconLoader(config).loadDefaults(config);
                TextSource source = resolveSource(config);
                String safeText = main.sanitizeText(source.readText(), config.getMaxTextLength());

                long start = System.currentTimeMillis();
                MetricsRecord metrics = engine.analyze(safeText, lexicons);
                long elapsed = System.currentTimeMillis() - start;
                AnalysisReport report = new AnalysisReport(source.describe(), Instant.now(), elapsed, metrics);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(report);
                } else {
                    printTextResult(report);
                }
                return EXIT_OK;
            } catch (InvalidInputException invalidInput) {
                return reportInvalidInput(invalidInput);
            } catch (LexiconLoadException lexiconFailure) {
                return reportLexiconFailure(lexiconFailure);
            } catch (IOException exception) {
                System.err.println("❌ 输出结果失败: " + exception.getMessage());
                return EXIT_INVALID_INPUT;
            }
        }

        private TextSource resolveSource(EngineConfig config) {
            int provided = (text != null ? 1 : 0) + (file != null ? 1 : 0) + (url != null ? 1 : 0);
            if (provided != 1) {
                throw new InvalidInputException("需要且只能指定一种输入", "请使用 --text、--file 或 --url 之一");
            }
            if (file != null) {
                return new FileTextSource(file);
            }
            if (url != null) {
                return new UrlTextSource(url, config.getFetchTimeoutMillis(), config.getUserAgent());
            }
            return new DirectTextSource(text);
        }

        private void printTextResult(AnalysisReport report) {
            MetricsRecord metrics = report.metrics();
            System.out.println("📄 来源: " + report.source());
            System.out.println("─────────────────────────────────");
            System.out.println("💬 情感");
            System.out.printf("   倾向: %s%n", metrics.sentimentLabel());
            System.out.printf("   正面词数: %d%n", metrics.positiveScore());
            System.out.printf("   负面词数: %d%n", metrics.negativeScore());
            System.out.printf("   极性: %.4f%n", metrics.polarityScore());
            System.out.printf("   主观性: %.4f%n", metrics.subjectivityScore());
            System.out.println("📖 可读性");
            System.out.printf("   Fog 指数: %.4f%n", metrics.fogIndex());
            System.out.printf("   句子数: %d%n", metrics.sentenceCount());
            System.out.printf("   平均句长: %.4f%n", metrics.averageSentenceLength());
            System.out.printf("   复杂词比例: %.2f%%%n", metrics.percentageComplexWords());
            System.out.printf("   复杂词数: %d%n", metrics.complexWordCount());
            System.out.println("🔤 词汇");
            System.out.printf("   词数: %d%n", metrics.wordCount());
            System.out.printf("   停用词数: %d%n", metrics.stopWordCount());
            System.out.printf("   平均词长: %.4f%n", metrics.averageWordLength());
            System.out.printf("   平均音节数: %.4f%n", metrics.syllablesPerWord());
            System.out.printf("   人称代词数: %d%n", metrics.personalPronounCount());
            System.out.println();
            System.out.println("📊 用时 " + report.elapsedMs() + "ms");
        }

        private void printJsonResult(AnalysisReport report) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }
    }

    @Command(name = "lexicons", description = "📚 查看已加载的词表")
    static class LexiconsSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.buildConfig();
                LexiconSet lexicons = main.lexiconLoader(config).loadDefaults(config);

                System.out.println("📚 词表状态");
                System.out.println("═══════════");
                printLexicon("➕ 正面词", lexicons.positive());
                printLexicon("➖ 负面词", lexicons.negative());
                printLexicon("🚫 停用词", lexicons.stopWords());
                return EXIT_OK;
            } catch (LexiconLoadException lexiconFailure) {
                return reportLexiconFailure(lexiconFailure);
            }
        }

        private void printLexicon(String label, Lexicon lexicon) {
            System.out.printf("%s: %d 个 (%s)%n", label, lexicon.size(), lexicon.source());
        }
    }
}
