package com.agenticanalytics.retrieval;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agenticanalytics.observability.OperationType;
import com.agenticanalytics.observability.TelemetryEmitter;
import com.agenticanalytics.observability.TelemetrySink;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * In-memory vector index persisted as a single JSON snapshot.
 *
 * <p>Documents keep their insertion position; every mutation rebuilds the search
 * backend under the write lock so searches never see a half-built structure.
 * Rebuild cost is linear in corpus size.
 */
public class LocalJsonVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorIndex.class);
    private static final int OVERFETCH_FACTOR = 3;

    private final EmbeddingService embeddingService;
    private final SearchBackend backend;
    private final TelemetryEmitter telemetry;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<Document> documents = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private int dimension;

    public LocalJsonVectorIndex(EmbeddingService embeddingService) {
        this(embeddingService, "auto", TelemetrySink.noop());
    }

    public LocalJsonVectorIndex(EmbeddingService embeddingService, String backendName, TelemetrySink telemetrySink) {
        this.embeddingService = embeddingService;
        this.backend = createBackend(backendName);
        this.telemetry = new TelemetryEmitter(telemetrySink);
    }

    @Override
    public int addDocuments(List<DocumentInput> inputs, String traceId) {
        if (inputs == null || inputs.isEmpty()) {
            return 0;
        }
        long start = System.nanoTime();
        rejectDuplicates(inputs, true);
        List<Document> prepared = prepare(inputs, traceId);

        lock.writeLock().lock();
        try {
            // the corpus may have changed while embedding ran outside the lock
            rejectDuplicates(inputs, true);
            dimension = checkDimension(prepared, dimension);
            append(prepared);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Indexed {} documents, corpus size={}", prepared.size(), count());
        telemetry.emit(OperationType.RETRIEVAL, start, traceId,
                Map.of("action", "add_documents", "count", prepared.size()));
        return prepared.size();
    }

    @Override
    public int replaceDocuments(List<DocumentInput> inputs, String traceId) {
        List<DocumentInput> batch = inputs == null ? List.of() : inputs;
        long start = System.nanoTime();
        rejectDuplicates(batch, false);
        List<Document> prepared = prepare(batch, traceId);
        int newDimension = checkDimension(prepared, 0);

        lock.writeLock().lock();
        try {
            documents.clear();
            positions.clear();
            dimension = newDimension;
            append(prepared);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Replaced corpus with {} documents", prepared.size());
        telemetry.emit(OperationType.RETRIEVAL, start, traceId,
                Map.of("action", "replace_documents", "count", prepared.size()));
        return prepared.size();
    }

    @Override
    public List<SearchResult> search(String query, int topK, Map<String, ?> filter, String traceId) {
        requirePositive(topK);
        long start = System.nanoTime();
        List<SearchResult> results;
        if (count() == 0) {
            results = List.of();
        } else {
            float[] queryVector = embeddingService.embed(List.of(query == null ? "" : query), traceId).get(0);
            results = search(queryVector, topK, filter);
        }
        telemetry.emit(OperationType.RETRIEVAL, start, traceId, Map.of(
                "action", "search",
                "query_length", query == null ? 0 : query.length(),
                "top_k", topK,
                "results", results.size()));
        return results;
    }

    @Override
    public List<SearchResult> search(float[] queryVector, int topK, Map<String, ?> filter) {
        requirePositive(topK);
        lock.readLock().lock();
        try {
            if (documents.isEmpty()) {
                return List.of();
            }
            if (queryVector.length != dimension) {
                throw new DimensionMismatchException(dimension, queryVector.length);
            }
            float[] normalizedQuery = Vectors.normalized(queryVector);
            List<ScoredPosition> hits = filter == null || filter.isEmpty()
                    ? backend.topK(normalizedQuery, Math.min(topK, documents.size()), null)
                    : filteredTopK(normalizedQuery, topK, filter);
            List<SearchResult> results = new ArrayList<>(hits.size());
            for (ScoredPosition hit : hits) {
                Document document = documents.get(hit.position());
                results.add(new SearchResult(document.id(), document.content(), hit.score(), document.metadata()));
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean deleteDocument(String id) {
        lock.writeLock().lock();
        try {
            Integer position = positions.remove(id);
            if (position == null) {
                return false;
            }
            documents.remove((int) position);
            positions.clear();
            for (int i = 0; i < documents.size(); i++) {
                positions.put(documents.get(i).id(), i);
            }
            if (documents.isEmpty()) {
                dimension = 0;
            }
            backend.rebuild(documents);
            log.debug("Deleted document {}, corpus size={}", id, documents.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Document> getDocument(String id) {
        lock.readLock().lock();
        try {
            Integer position = positions.get(id);
            if (position == null) {
                return Optional.empty();
            }
            Document document = documents.get(position);
            return Optional.of(new Document(document.id(), document.content(), document.embedding().clone(),
                    document.metadata()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save(Path path) throws IOException {
        IndexSnapshot snapshot;
        lock.readLock().lock();
        try {
            List<IndexSnapshot.SnapshotDocument> rows = new ArrayList<>(documents.size());
            for (Document document : documents) {
                rows.add(new IndexSnapshot.SnapshotDocument(document.id(), document.content(), document.embedding(),
                        document.metadata()));
            }
            snapshot = new IndexSnapshot(IndexSnapshot.CURRENT_FORMAT, dimension, rows, new LinkedHashMap<>(positions));
        } finally {
            lock.readLock().unlock();
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), snapshot);
            moveIntoPlace(temp, path);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Saved index snapshot {} documents={}", path, snapshot.documents().size());
    }

    @Override
    public boolean load(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.debug("No index snapshot at {}", path);
            return false;
        }
        IndexSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(path.toFile(), IndexSnapshot.class);
        } catch (JacksonException | IllegalArgumentException e) {
            throw new CorruptSnapshotException(path, e);
        }
        List<Document> restored = validate(path, snapshot);

        lock.writeLock().lock();
        try {
            documents.clear();
            positions.clear();
            for (Document document : restored) {
                positions.put(document.id(), documents.size());
                documents.add(document);
            }
            dimension = restored.isEmpty() ? 0 : snapshot.dimension();
            backend.rebuild(documents);
        } finally {
            lock.writeLock().unlock();
        }
        if (snapshot.formatVersion() > IndexSnapshot.CURRENT_FORMAT) {
            log.warn("Index snapshot {} has newer format {}; unknown fields ignored", path, snapshot.formatVersion());
        }
        log.info("Loaded index snapshot {} documents={} dimension={} backend={}",
                path, restored.size(), dimension, backend.name());
        return true;
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return documents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            documents.clear();
            positions.clear();
            dimension = 0;
            backend.rebuild(documents);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int dimension() {
        lock.readLock().lock();
        try {
            return dimension;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String backendName() {
        return backend.name();
    }

    private List<ScoredPosition> filteredTopK(float[] normalizedQuery, int topK, Map<String, ?> filter) {
        if (backend.supportsNativeFiltering()) {
            return backend.topK(normalizedQuery, Math.min(topK, documents.size()),
                    position -> documents.get(position).metadata().matches(filter));
        }
        // over-fetch and filter afterwards, widening until enough matches or the corpus is exhausted
        int corpus = documents.size();
        int fetch = (int) Math.min(corpus, (long) topK * OVERFETCH_FACTOR);
        while (true) {
            List<ScoredPosition> matched = new ArrayList<>();
            for (ScoredPosition candidate : backend.topK(normalizedQuery, fetch, null)) {
                if (documents.get(candidate.position()).metadata().matches(filter)) {
                    matched.add(candidate);
                    if (matched.size() == topK) {
                        return matched;
                    }
                }
            }
            if (fetch >= corpus) {
                return matched;
            }
            fetch = (int) Math.min(corpus, (long) fetch * 2);
        }
    }

    private void rejectDuplicates(List<DocumentInput> inputs, boolean againstCorpus) {
        Set<String> seen = new HashSet<>();
        lock.readLock().lock();
        try {
            for (DocumentInput input : inputs) {
                if (!seen.add(input.id()) || (againstCorpus && positions.containsKey(input.id()))) {
                    throw new DuplicateDocumentIdException(input.id());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Document> prepare(List<DocumentInput> inputs, String traceId) {
        List<String> toEmbed = new ArrayList<>();
        for (DocumentInput input : inputs) {
            if (!input.hasEmbedding()) {
                toEmbed.add(input.content());
            }
        }
        List<float[]> embedded = toEmbed.isEmpty() ? List.of() : embeddingService.embed(toEmbed, traceId);

        List<Document> prepared = new ArrayList<>(inputs.size());
        int next = 0;
        for (DocumentInput input : inputs) {
            float[] vector = input.hasEmbedding() ? input.embedding().clone() : embedded.get(next++);
            prepared.add(new Document(input.id(), input.content(), vector, input.metadata()));
        }
        return prepared;
    }

    // returns the corpus dimension after accepting the batch; 0 means not fixed yet
    private static int checkDimension(List<Document> prepared, int current) {
        if (prepared.isEmpty()) {
            return current;
        }
        int expected = current == 0 ? prepared.get(0).embedding().length : current;
        for (Document document : prepared) {
            if (document.embedding().length != expected) {
                throw new DimensionMismatchException(expected, document.embedding().length);
            }
        }
        return expected;
    }

    private void append(List<Document> prepared) {
        for (Document document : prepared) {
            positions.put(document.id(), documents.size());
            documents.add(document);
        }
        backend.rebuild(documents);
    }

    private static List<Document> validate(Path path, IndexSnapshot snapshot) throws CorruptSnapshotException {
        if (snapshot == null || snapshot.documents() == null) {
            throw new CorruptSnapshotException(path, "missing document table");
        }
        List<IndexSnapshot.SnapshotDocument> rows = snapshot.documents();
        Map<String, Integer> mapping = snapshot.positions();
        if (mapping != null && mapping.size() != rows.size()) {
            throw new CorruptSnapshotException(path, "position mapping has " + mapping.size()
                    + " entries for " + rows.size() + " documents");
        }
        if (!rows.isEmpty() && snapshot.dimension() <= 0) {
            throw new CorruptSnapshotException(path, "invalid dimension " + snapshot.dimension());
        }
        List<Document> restored = new ArrayList<>(rows.size());
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            IndexSnapshot.SnapshotDocument row = rows.get(i);
            if (row == null || row.id() == null || row.id().isBlank()) {
                throw new CorruptSnapshotException(path, "document at position " + i + " has no id");
            }
            if (!ids.add(row.id())) {
                throw new CorruptSnapshotException(path, "duplicate document id " + row.id());
            }
            if (row.embedding() == null || row.embedding().length != snapshot.dimension()) {
                throw new CorruptSnapshotException(path, "document " + row.id() + " vector does not have dimension "
                        + snapshot.dimension());
            }
            if (mapping != null && !Integer.valueOf(i).equals(mapping.get(row.id()))) {
                throw new CorruptSnapshotException(path, "position mapping disagrees for document " + row.id());
            }
            restored.add(new Document(row.id(), row.content(), row.embedding(), row.metadata()));
        }
        return restored;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void requirePositive(int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
    }

    static SearchBackend createBackend(String name) {
        String normalized = name == null ? "auto" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "exact" -> new ExactSearchBackend();
            case "inner-product", "auto" -> new InnerProductSearchBackend();
            default -> throw new IllegalArgumentException("Unknown index backend: " + name);
        };
    }
}
