package com.agenticanalytics.retrieval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface VectorIndex {
    int addDocuments(List<DocumentInput> documents, String traceId);

    default int addDocuments(List<DocumentInput> documents) {
        return addDocuments(documents, null);
    }

    /**
     * Swaps the whole corpus for {@code documents} in one step. The batch is
     * embedded and validated before anything is removed, so a rejected batch
     * leaves the current corpus in place.
     */
    int replaceDocuments(List<DocumentInput> documents, String traceId);

    List<SearchResult> search(String query, int topK, Map<String, ?> filter, String traceId);

    default List<SearchResult> search(String query, int topK) {
        return search(query, topK, null, null);
    }

    List<SearchResult> search(float[] queryVector, int topK, Map<String, ?> filter);

    boolean deleteDocument(String id);

    Optional<Document> getDocument(String id);

    void save(Path path) throws IOException;

    /**
     * Replaces the in-memory corpus with the snapshot at {@code path}.
     *
     * @return false when no snapshot exists
     * @throws CorruptSnapshotException when the file exists but cannot be restored
     */
    boolean load(Path path) throws IOException;

    int count();

    void clear();

    int dimension();
}
