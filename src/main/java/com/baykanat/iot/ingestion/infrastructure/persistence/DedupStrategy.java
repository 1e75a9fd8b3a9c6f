package com.baykanat.iot.ingestion.infrastructure.persistence;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Batch insert'in çakışma davranışı: dedup yok (MQTT) veya verilen unique key üzerinde
 * ON CONFLICT DO NOTHING (HTTP, app_id + msg_id).
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DedupStrategy {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final DedupStrategy NONE = new DedupStrategy(List.of());

    private final List<String> keyColumns;

    private DedupStrategy(List<String> keyColumns) {
        this.keyColumns = keyColumns;
    }

    public static DedupStrategy none() {
        return NONE;
    }

    /** Kolon adları SQL'e doğrudan yazıldığı için identifier kontrolünden geçer. */
    public static DedupStrategy keyed(List<String> keyColumns) {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new IllegalArgumentException("keyed dedup needs at least one key column");
        }
        List<String> columns = keyColumns.stream().map(String::trim).toList();
        for (String column : columns) {
            if (!IDENTIFIER.matcher(column).matches()) {
                throw new IllegalArgumentException("invalid conflict key column: '" + column + "'");
            }
        }
        return new DedupStrategy(columns);
    }

    /** Konfigürasyondan: boş liste → none. */
    public static DedupStrategy fromConflictKey(List<String> keyColumns) {
        return keyColumns == null || keyColumns.isEmpty() ? none() : keyed(keyColumns);
    }

    public boolean isKeyed() {
        return !keyColumns.isEmpty();
    }

    /** INSERT'e eklenecek ON CONFLICT cümlesi; dedup yoksa boş string. */
    public String conflictClause() {
        if (!isKeyed()) {
            return "";
        }
        return "ON CONFLICT (" + String.join(", ", keyColumns) + ") DO NOTHING";
    }
}
