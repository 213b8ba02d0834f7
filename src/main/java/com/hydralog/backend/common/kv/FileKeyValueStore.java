package com.hydralog.backend.common.kv;

import lombok.Getter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One file per key under a base directory. Writes go to a temp file first and are moved into place.
 */
@Getter
public class FileKeyValueStore implements KeyValueStore {

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";

    private final Path baseDir;

    public FileKeyValueStore(String baseDir) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> get(String key) throws IOException {
        Path path = resolve(key);
        if (!Files.exists(path)) return Optional.empty();
        return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    }

    @Override
    public void put(String key, String value) throws IOException {
        Path path = resolve(key);
        Files.createDirectories(baseDir);
        Path tmp = Files.createTempFile(baseDir, key, ".tmp");
        Files.writeString(tmp, value, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void delete(String key) throws IOException {
        Files.deleteIfExists(resolve(key));
    }

    @Override
    public List<String> keysWithPrefix(String prefix) throws IOException {
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(baseDir)) return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(baseDir, prefix + "*" + SUFFIX)) {
            for (Path p : ds) {
                String name = p.getFileName().toString();
                out.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        }
        return out;
    }

    private Path resolve(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("INVALID_KEY: " + key);
        }
        Path p = baseDir.resolve(key + SUFFIX).normalize();
        if (!p.startsWith(baseDir)) throw new SecurityException("Path traversal detected: " + key);
        return p;
    }
}
