package com.smerag.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CorpusScanner {
    private static final Logger log = LoggerFactory.getLogger(CorpusScanner.class);
    private static final int BUFFER_SIZE = 65536;

    private final Predicate<Path> supported;

    public CorpusScanner(Predicate<Path> supported) {
        this.supported = supported;
    }

    public Map<String, String> scan(Path root) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(supported)
                    .sorted()
                    .toList();
        }
        Map<String, String> hashes = new TreeMap<>();
        for (Path file : files) {
            hashes.put(key(file), fingerprint(file));
        }
        log.info("Scanned {} supported files under {}", hashes.size(), root);
        return hashes;
    }

    public static String key(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    public static String fingerprint(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException e) {
            log.warn("Could not hash file {}: {}. Returning empty hash.", path, e.getMessage());
            return SourceFile.UNREADABLE_HASH;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
