package com.agenticanalytics.cache;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class CacheFileStore {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public List<CacheEntry> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        if (Files.size(path) == 0L) {
            return new ArrayList<>();
        }
        List<CacheEntry> entries = objectMapper.readValue(path.toFile(), new TypeReference<List<CacheEntry>>() {
        });
        return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
    }

    public void save(Path path, List<CacheEntry> entries) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), entries);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
