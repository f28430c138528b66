package com.textmetrics.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class FileTextSource implements TextSource {
    private final Path path;

    public FileTextSource(Path path) {
        this.path = path;
    }

    @Override
    public String readText() {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException missingException) {
            throw new InvalidInputException("文件不存在: " + path, "请检查文件路径", missingException);
        } catch (IOException ioException) {
            throw new InvalidInputException("读取文件失败: " + path, "请确认文件为 UTF-8 编码的纯文本", ioException);
        }
        if (content.isBlank()) {
            throw new InvalidInputException("文件内容为空: " + path, "请提供包含正文的文件");
        }
        return content;
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
