package com.smerag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;

public class TextDocumentLoader implements DocumentLoader {
    private static final Parser MARKDOWN_PARSER = Parser.builder().build();
    private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();

    private final List<String> extensions;

    public TextDocumentLoader(List<String> extensions) {
        this.extensions = extensions;
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    @Override
    public List<String> load(Path path) throws DocumentLoadException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentLoadException(path, "unreadable text file", e);
        }
        if (isMarkdown(path)) {
            content = renderMarkdown(content);
        }
        return List.of(content);
    }

    static String renderMarkdown(String markdown) {
        return TEXT_RENDERER.render(MARKDOWN_PARSER.parse(markdown));
    }

    private static boolean isMarkdown(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".md") || fileName.endsWith(".markdown");
    }
}
