package com.agenticanalytics.retrieval;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Metadata attached to an indexed document: a closed set of known optional
 * fields plus one extension map of scalar attributes.
 *
 * <p>Every field is addressable by key for filtering and grouping. Known keys are
 * {@value #CHUNK_TYPE}, {@value #TABLE_NAME}, {@value #COLUMN_NAME} and
 * {@value #SOURCE}; any other key resolves against the attributes. The chunk
 * type keeps the label the chunker wrote; {@link #chunkType()} only classifies it.
 */
public final class ChunkMetadata {
    public static final String CHUNK_TYPE = "chunk_type";
    public static final String TABLE_NAME = "table_name";
    public static final String COLUMN_NAME = "column_name";
    public static final String SOURCE = "source";

    private static final ChunkMetadata EMPTY = new ChunkMetadata((String) null, null, null, null, Map.of());

    private final String chunkType;
    private final String tableName;
    private final String columnName;
    private final String source;
    private final Map<String, Object> attributes;

    public ChunkMetadata(ChunkType chunkType, String tableName, String columnName, String source,
            Map<String, Object> attributes) {
        this(chunkType == null ? null : chunkType.value(), tableName, columnName, source, attributes);
    }

    private ChunkMetadata(String chunkType, String tableName, String columnName, String source,
            Map<String, Object> attributes) {
        this.chunkType = chunkType;
        this.tableName = tableName;
        this.columnName = columnName;
        this.source = source;
        Map<String, Object> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                requireScalar(key, value);
                copy.put(key, value);
            });
        }
        this.attributes = Collections.unmodifiableMap(copy);
    }

    public static ChunkMetadata empty() {
        return EMPTY;
    }

    public static ChunkMetadata ofType(ChunkType chunkType) {
        return new ChunkMetadata(chunkType, null, null, null, Map.of());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ChunkMetadata fromMap(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> extra = new LinkedHashMap<>(values);
        Object type = extra.remove(CHUNK_TYPE);
        Object table = extra.remove(TABLE_NAME);
        Object column = extra.remove(COLUMN_NAME);
        Object src = extra.remove(SOURCE);
        return new ChunkMetadata(
                typeLabel(type),
                table == null ? null : table.toString(),
                column == null ? null : column.toString(),
                src == null ? null : src.toString(),
                extra);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (chunkType != null) {
            out.put(CHUNK_TYPE, chunkType);
        }
        if (tableName != null) {
            out.put(TABLE_NAME, tableName);
        }
        if (columnName != null) {
            out.put(COLUMN_NAME, columnName);
        }
        if (source != null) {
            out.put(SOURCE, source);
        }
        out.putAll(attributes);
        return out;
    }

    public Object get(String key) {
        return switch (key) {
            case CHUNK_TYPE -> chunkType;
            case TABLE_NAME -> tableName;
            case COLUMN_NAME -> columnName;
            case SOURCE -> source;
            default -> attributes.get(key);
        };
    }

    public boolean matches(Map<String, ?> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, ?> entry : filter.entrySet()) {
            Object actual = get(entry.getKey());
            if (actual == null || !scalarEquals(actual, entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    public ChunkMetadata withAttributes(Map<String, Object> additional) {
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.putAll(additional);
        return new ChunkMetadata(chunkType, tableName, columnName, source, merged);
    }

    public ChunkType chunkType() {
        return chunkType == null ? null : ChunkType.fromValue(chunkType);
    }

    public String chunkTypeLabel() {
        return chunkType;
    }

    public String tableName() {
        return tableName;
    }

    public String columnName() {
        return columnName;
    }

    public String source() {
        return source;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    private static boolean scalarEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            if (!Double.isFinite(a.doubleValue()) || !Double.isFinite(e.doubleValue())) {
                return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
            }
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(e.toString())) == 0;
        }
        if (expected instanceof ChunkType type) {
            return actual instanceof String label && ChunkType.fromValue(label) == type;
        }
        return Objects.equals(actual, expected);
    }

    private static String typeLabel(Object type) {
        if (type == null) {
            return null;
        }
        return type instanceof ChunkType known ? known.value() : type.toString();
    }

    private static void requireScalar(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return;
        }
        throw new IllegalArgumentException("Metadata attribute '" + key + "' must be a scalar, got "
                + value.getClass().getSimpleName());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ChunkMetadata that)) {
            return false;
        }
        return Objects.equals(chunkType, that.chunkType)
                && Objects.equals(tableName, that.tableName)
                && Objects.equals(columnName, that.columnName)
                && Objects.equals(source, that.source)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkType, tableName, columnName, source, attributes);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
