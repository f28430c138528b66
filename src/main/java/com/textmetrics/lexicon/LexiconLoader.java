package com.textmetrics.lexicon;

import com.textmetrics.config.Constants;
import com.textmetrics.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 词表加载器：按编码顺序依次尝试解码，首个成功者生效，结果按来源缓存。
 */
public class LexiconLoader {
    private static final Logger logger = LoggerFactory.getLogger(LexiconLoader.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String COMMENT_PREFIX = ";";
    private static final char ANNOTATION_SEPARATOR = '|';

    private final List<Charset> charsets;
    private final Map<String, Lexicon> cache = new ConcurrentHashMap<>();

    public LexiconLoader() {
        this(Constants.LEXICON_CHARSETS);
    }

    public LexiconLoader(List<String> charsetNames) {
        if (charsetNames == null || charsetNames.isEmpty()) {
            throw new IllegalArgumentException("至少需要一种词表编码");
        }
        List<Charset> resolved = new ArrayList<>();
        for (String charsetName : charsetNames) {
            resolved.add(Charset.forName(charsetName));
        }
        this.charsets = List.copyOf(resolved);
    }

    /**
     * 从文件加载词表。同一路径只读取一次。
     */
    public Lexicon load(Path path) {
        String source = path.toAbsolutePath().normalize().toString();
        return cache.computeIfAbsent(source, key -> decode(key, readFile(path, key)));
    }

    /**
     * 从类路径资源加载词表。
     */
    public Lexicon loadResource(String resourceName) {
        String source = "classpath:" + resourceName;
        return cache.computeIfAbsent(source, key -> decode(key, readResource(resourceName, key)));
    }

    /**
     * 按配置加载三个词表，未配置路径的使用内置资源。
     */
    public LexiconSet loadDefaults(EngineConfig config) {
        Lexicon positive = loadConfigured(config.getPositiveWordsPath(), Constants.POSITIVE_WORDS_RESOURCE);
        Lexicon negative = loadConfigured(config.getNegativeWordsPath(), Constants.NEGATIVE_WORDS_RESOURCE);
        Lexicon stopWords = loadConfigured(config.getStopWordsPath(), Constants.STOP_WORDS_RESOURCE);
        return new LexiconSet(positive, negative, stopWords);
    }

    public int cachedCount() {
        return cache.size();
    }

    Lexicon decode(String source, byte[] content) {
        for (int index = 0; index < charsets.size(); index++) {
            Charset charset = charsets.get(index);
            try {
                String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
                Lexicon lexicon = new Lexicon(source, parseWords(text));
                if (index > 0) {
                    logger.warn("词表 {} 使用回退编码 {} 解码", source, charset.name());
                }
                logger.info("已加载词表 {}，共 {} 个词", source, lexicon.size());
                return lexicon;
            } catch (CharacterCodingException codingException) {
                logger.debug("词表 {} 无法按 {} 解码: {}", source, charset.name(), codingException.getMessage());
            }
        }
        throw new LexiconLoadException("词表在所有候选编码下均无法解码 " + charsets, source);
    }

    /**
     * 每行一个词；跳过空行与 ; 注释行，| 之后的注解被丢弃。
     */
    static Set<String> parseWords(String content) {
        Set<String> words = new HashSet<>();
        if (content == null || content.isEmpty()) {
            return words;
        }
        String body = content.charAt(0) == BYTE_ORDER_MARK ? content.substring(1) : content;
        for (String line : body.split("\\R")) {
            String candidate = line;
            int separatorIndex = candidate.indexOf(ANNOTATION_SEPARATOR);
            if (separatorIndex >= 0) {
                candidate = candidate.substring(0, separatorIndex);
            }
            candidate = candidate.trim();
            if (candidate.isEmpty() || candidate.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            words.add(candidate.toLowerCase(Locale.ROOT));
        }
        return words;
    }

    private Lexicon loadConfigured(Path configuredPath, String fallbackResource) {
        return configuredPath == null ? loadResource(fallbackResource) : load(configuredPath);
    }

    private byte[] readFile(Path path, String source) {
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException missingException) {
            throw new LexiconLoadException("词表文件不存在", source, missingException);
        } catch (IOException ioException) {
            throw new LexiconLoadException("读取词表失败", source, ioException);
        }
    }

    private byte[] readResource(String resourceName, String source) {
        ClassLoader classLoader = LexiconLoader.class.getClassLoader();
        try (InputStream inputStream = classLoader.getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new LexiconLoadException("找不到词表资源", source);
            }
            return inputStream.readAllBytes();
        } catch (IOException ioException) {
            throw new LexiconLoadException("读取词表资源失败", source, ioException);
        }
    }
}
