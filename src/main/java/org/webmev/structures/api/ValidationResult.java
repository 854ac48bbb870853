package org.webmev.structures.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.webmev.structures.shared.JsonSupport;

/**
 * Outcome of an {@link OperationValidator} call (usable by the CLI and embedding apps).
 */
public record ValidationResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    public ValidationResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ValidationResult success(Map<String, Object> metadata, Instant startedAt) {
        return new ValidationResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static ValidationResult failure(Map<String, Object> error, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("error", error);
        return new ValidationResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        return JsonSupport.writePretty(toSerializableMap());
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
