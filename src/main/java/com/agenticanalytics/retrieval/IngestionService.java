package com.agenticanalytics.retrieval;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);
    private final VectorIndex index;
    private final ObjectMapper mapper = new ObjectMapper();

    public IngestionService(VectorIndex index) {
        this.index = index;
    }

    public IngestionReport ingest(Path documentsPath, Path snapshotPath, boolean clearExisting, String traceId)
            throws IOException {
        long start = System.nanoTime();
        List<DocumentInput> inputs = readDocuments(documentsPath);
        List<String> errors = new ArrayList<>();

        int ingested = 0;
        try {
            ingested = clearExisting
                    ? index.replaceDocuments(inputs, traceId)
                    : index.addDocuments(inputs, traceId);
        } catch (DuplicateDocumentIdException | DimensionMismatchException e) {
            errors.add(e.getMessage());
            log.warn("Ingestion of {} rejected: {}", documentsPath, e.getMessage());
        }
        if (errors.isEmpty() && (ingested > 0 || clearExisting)) {
            index.save(snapshotPath);
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.info("Ingested documents={} total={} durationMs={} source={}",
                ingested, index.count(), durationMs, documentsPath);
        return new IngestionReport(ingested, index.count(), durationMs, List.copyOf(errors));
    }

    List<DocumentInput> readDocuments(Path documentsPath) throws IOException {
        if (!Files.exists(documentsPath)) {
            throw new IOException("Documents file not found: " + documentsPath);
        }
        List<DocumentInput> inputs = mapper.readValue(documentsPath.toFile(), new TypeReference<List<DocumentInput>>() {
        });
        return inputs == null ? List.of() : inputs;
    }
}
