package com.textmetrics.source;

import com.textmetrics.config.Constants;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * 抓取网页并提取正文文本。仅接受 http/https，非文本内容类型视为无效输入。
 */
public class UrlTextSource implements TextSource {
    private static final Logger logger = LoggerFactory.getLogger(UrlTextSource.class);

    private final String url;
    private final int timeoutMillis;
    private final String userAgent;
    private final HtmlTextExtractor extractor;

    public UrlTextSource(String url) {
        this(url, Constants.FETCH_TIMEOUT_MILLIS, Constants.DEFAULT_USER_AGENT);
    }

    public UrlTextSource(String url, int timeoutMillis, String userAgent) {
        this.url = url;
        this.timeoutMillis = timeoutMillis > 0 ? timeoutMillis : Constants.FETCH_TIMEOUT_MILLIS;
        this.userAgent = userAgent == null || userAgent.isBlank() ? Constants.DEFAULT_USER_AGENT : userAgent;
        this.extractor = new HtmlTextExtractor();
    }

    @Override
    public String readText() {
        URI target = validate(url);
        Document document;
        try {
            document = Jsoup.connect(target.toString())
                .userAgent(userAgent)
                .timeout(timeoutMillis)
                .get();
        } catch (HttpStatusException statusException) {
            logger.warn("抓取失败: {} 返回 HTTP {}", target, statusException.getStatusCode());
            throw new InvalidInputException("抓取网页失败，HTTP 状态码 " + statusException.getStatusCode(),
                "请确认网址可以公开访问", statusException);
        } catch (UnsupportedMimeTypeException mimeException) {
            logger.warn("抓取失败: {} 内容类型为 {}", target, mimeException.getMimeType());
            throw new InvalidInputException("网页内容类型不是文本: " + mimeException.getMimeType(),
                "请提供 HTML 或纯文本页面", mimeException);
        } catch (IOException ioException) {
            logger.warn("抓取失败: {} - {}", target, ioException.getMessage());
            throw new InvalidInputException("无法访问网址: " + target, "请检查网络连接与网址", ioException);
        }

        String text = extractor.extract(document);
        if (text.isBlank()) {
            throw new InvalidInputException("网页中没有可分析的文本: " + target, "请确认页面包含正文内容");
        }
        return text;
    }

    @Override
    public String describe() {
        return url;
    }

    static URI validate(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new InvalidInputException("网址为空", "请输入网址");
        }
        URI uri;
        try {
            uri = new URI(rawUrl.trim());
        } catch (URISyntaxException syntaxException) {
            throw new InvalidInputException("网址格式错误: " + rawUrl, "请输入形如 https://example.com 的网址", syntaxException);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidInputException("不支持的网址协议: " + rawUrl, "仅支持 http 与 https");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new InvalidInputException("网址缺少主机名: " + rawUrl, "请输入形如 https://example.com 的网址");
        }
        return uri;
    }
}
