package com.smerag.ingest;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DocumentLoaders {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoaders.class);

    private final List<DocumentLoader> loaders;

    public DocumentLoaders(List<DocumentLoader> loaders) {
        this.loaders = List.copyOf(loaders);
    }

    public static DocumentLoaders defaults() {
        List<DocumentLoader> all = new ArrayList<>();
        all.add(new PdfDocumentLoader());
        all.add(new TikaDocumentLoader(List.of(".docx", ".pptx")));
        all.add(new TextDocumentLoader(List.of(".txt", ".md")));
        return new DocumentLoaders(all);
    }

    public boolean supports(Path path) {
        return loaderFor(path).isPresent();
    }

    public List<SourceDocument> load(Path path, String docId, String subject, Instant timestamp)
            throws DocumentLoadException {
        DocumentLoader loader = loaderFor(path)
                .orElseThrow(() -> new DocumentLoadException(path, "unsupported file format", null));
        List<String> texts = loader.load(path);
        String filePath = CorpusScanner.key(path);
        String source = path.getFileName().toString();
        List<SourceDocument> documents = new ArrayList<>(texts.size());
        for (int seq = 0; seq < texts.size(); seq++) {
            documents.add(new SourceDocument(docId, subject, source, filePath, seq, timestamp,
                    TextNormalizer.normalize(texts.get(seq))));
        }
        log.info("Loaded {} documents from {}", documents.size(), source);
        return documents;
    }

    private Optional<DocumentLoader> loaderFor(Path path) {
        return loaders.stream().filter(loader -> loader.supports(path)).findFirst();
    }
}
