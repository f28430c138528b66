package com.textmetrics.source;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 从 HTML 中提取纯文本：移除脚本与样式，每个文本节点一行，行内空白折叠。
 */
public class HtmlTextExtractor {

    private static final String NON_CONTENT_SELECTOR = "script, style, noscript, template";

    public String extract(Document document) {
        if (document == null) {
            return "";
        }
        document.select(NON_CONTENT_SELECTOR).remove();

        List<String> lines = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    String line = textNode.text().trim();
                    if (!line.isEmpty()) {
                        lines.add(line);
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
            }
        }, document);
        return String.join("\n", lines);
    }
}
