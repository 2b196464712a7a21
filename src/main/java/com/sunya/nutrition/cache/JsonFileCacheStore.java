package com.sunya.nutrition.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunya.nutrition.model.NutritionRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.stream.Stream;

/**
 * One JSON document per cache key under {@code baseDir}. The file name is a hash of the key;
 * the key itself is stored inside the document.
 */
@Slf4j
@Getter
public class JsonFileCacheStore implements CacheStore {

    static final String FILE_PREFIX = "nutrition_cache_";
    private static final String FILE_SUFFIX = ".json";

    private final Path baseDir;
    private final ObjectMapper om;

    public JsonFileCacheStore(Path baseDir, ObjectMapper om) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.om = om;
    }

    public record PersistedEntry(String key, NutritionRecord record, Instant cachedAt, long ttlMillis) {}

    @Override
    public Map<String, CacheEntry> loadAll() throws IOException {
        Map<String, CacheEntry> out = new HashMap<>();
        if (!Files.isDirectory(baseDir)) return out;

        try (Stream<Path> files = Files.list(baseDir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                String fn = p.getFileName().toString();
                if (!fn.startsWith(FILE_PREFIX) || !fn.endsWith(FILE_SUFFIX)) continue;
                try {
                    PersistedEntry pe = om.readValue(p.toFile(), PersistedEntry.class);
                    if (pe.key() == null || pe.record() == null || pe.cachedAt() == null) {
                        log.warn("nutrition_cache unreadable entry dropped file={}", fn);
                        Files.deleteIfExists(p);
                        continue;
                    }
                    out.put(pe.key(), new CacheEntry(pe.record(), pe.cachedAt(), Duration.ofMillis(pe.ttlMillis())));
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("nutrition_cache corrupt entry dropped file={} err={}", fn, e.toString());
                    Files.deleteIfExists(p);
                }
            }
        }
        return out;
    }

    @Override
    public void save(String key, CacheEntry entry) throws IOException {
        Files.createDirectories(baseDir);
        Path target = resolve(key);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");

        byte[] json = om.writeValueAsBytes(
                new PersistedEntry(key, entry.record(), entry.cachedAt(), entry.ttl().toMillis()));
        Files.write(tmp, json, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void delete(String key) throws IOException {
        Files.deleteIfExists(resolve(key));
    }

    @Override
    public void clear() throws IOException {
        if (!Files.isDirectory(baseDir)) return;
        try (Stream<Path> files = Files.list(baseDir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (p.getFileName().toString().startsWith(FILE_PREFIX)) Files.deleteIfExists(p);
            }
        }
    }

    Path resolve(String key) {
        Path p = baseDir.resolve(FILE_PREFIX + sha256(key) + FILE_SUFFIX).normalize();
        if (!p.startsWith(baseDir)) throw new SecurityException("Invalid cache key");
        return p;
    }

    private static String sha256(String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
