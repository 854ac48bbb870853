package org.webmev.structures.error;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception carrying the failure kind and the key path (outermost first) at which
 * a data structure failed validation.
 */
public final class DataStructureException extends RuntimeException {
    private final ErrorKind kind;
    private final String detail;
    private final List<String> path;

    public DataStructureException(ErrorKind kind, String detail) {
        this(kind, detail, List.of());
    }

    private DataStructureException(ErrorKind kind, String detail, List<String> path) {
        super(render(detail, path));
        this.kind = kind;
        this.detail = detail;
        this.path = List.copyOf(path);
    }

    public static DataStructureException nullValue(String detail) {
        return new DataStructureException(ErrorKind.NULL_VALUE, detail);
    }

    public static DataStructureException invalidValue(String detail) {
        return new DataStructureException(ErrorKind.INVALID_VALUE, detail);
    }

    public static DataStructureException missingParameter(String detail) {
        return new DataStructureException(ErrorKind.MISSING_PARAMETER, detail);
    }

    public static DataStructureException invalidParameter(String detail) {
        return new DataStructureException(ErrorKind.INVALID_PARAMETER, detail);
    }

    public static DataStructureException structure(String detail) {
        return new DataStructureException(ErrorKind.STRUCTURE, detail);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Message without the key path prefix.
     */
    public String detail() {
        return detail;
    }

    public List<String> path() {
        return path;
    }

    /**
     * Returns a copy of this exception with {@code key} prepended to its path. The kind is unchanged.
     */
    public DataStructureException withContext(String key) {
        var prefixed = new ArrayList<String>(path.size() + 1);
        prefixed.add(key);
        prefixed.addAll(path);
        var wrapped = new DataStructureException(kind, detail, prefixed);
        wrapped.setStackTrace(getStackTrace());
        return wrapped;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", kind.code());
        map.put("message", detail);
        if (!path.isEmpty()) {
            map.put("path", String.join(".", path));
        }
        return map;
    }

    private static String render(String detail, List<String> path) {
        if (path.isEmpty()) {
            return detail;
        }
        return String.join(".", path) + ": " + detail;
    }
}
