package com.textmetrics.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 文本来源测试
 */
class TextSourceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("直接输入：返回原文")
    void testDirectText() {
        DirectTextSource source = new DirectTextSource("Hello there.");

        assertEquals("Hello there.", source.readText());
        assertEquals("text", source.describe());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\t"})
    @DisplayName("直接输入：空文本无效")
    void testDirectTextBlank(String text) {
        InvalidInputException exception = assertThrows(InvalidInputException.class,
            () -> new DirectTextSource(text).readText());
        assertEquals("请输入要分析的文本", exception.getSuggestion());
        assertThrows(InvalidInputException.class, () -> new DirectTextSource(null).readText());
    }

    @Test
    @DisplayName("文件输入：读取 UTF-8 文本")
    void testFileText() throws IOException {
        Path file = tempDir.resolve("article.txt");
        Files.writeString(file, "Naïve readers love it.", StandardCharsets.UTF_8);

        FileTextSource source = new FileTextSource(file);

        assertEquals("Naïve readers love it.", source.readText());
        assertEquals(file.toString(), source.describe());
    }

    @Test
    @DisplayName("文件输入：缺失或为空时无效")
    void testFileTextInvalid() throws IOException {
        Path emptyFile = tempDir.resolve("empty.txt");
        Files.writeString(emptyFile, "  \n");

        assertThrows(InvalidInputException.class, () -> new FileTextSource(tempDir.resolve("missing.txt")).readText());
        assertThrows(InvalidInputException.class, () -> new FileTextSource(emptyFile).readText());
    }

    @Test
    @DisplayName("文件输入：非 UTF-8 内容无效")
    void testFileTextMalformed() throws IOException {
        Path latin1File = tempDir.resolve("latin1.txt");
        Files.write(latin1File, "café".getBytes(StandardCharsets.ISO_8859_1));

        assertThrows(InvalidInputException.class, () -> new FileTextSource(latin1File).readText());
    }

    @Test
    @DisplayName("网址校验：接受 http 与 https")
    void testValidateAcceptsHttpUrls() {
        URI uri = UrlTextSource.validate(" https://example.com/page?q=1 ");

        assertEquals("example.com", uri.getHost());
        assertEquals("http", UrlTextSource.validate("HTTP://example.com").getScheme().toLowerCase());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a url", "ftp://example.com/file", "example.com", "http:///path"})
    @DisplayName("网址校验：拒绝格式错误或不支持的协议")
    void testValidateRejectsInvalidUrls(String url) {
        assertThrows(InvalidInputException.class, () -> UrlTextSource.validate(url));
        assertThrows(InvalidInputException.class, () -> UrlTextSource.validate(null));
    }

    @Test
    @DisplayName("网址不可达时抛出 InvalidInputException")
    void testUnreachableUrl() {
        UrlTextSource source = new UrlTextSource("http://127.0.0.1:1/", 2000, null);

        InvalidInputException exception = assertThrows(InvalidInputException.class, source::readText);
        assertNotNull(exception.getCause());
        assertEquals("http://127.0.0.1:1/", source.describe());
    }
}
