package ai.attackframework.tools.bulkloader.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record of a {@link Dataset}: field names to scalar or nested values, in column order.
 *
 * <p>Values may be {@code null} (an empty cell). The mapping is unmodifiable.</p>
 */
public final class Row {

    private final Map<String, Object> fields;

    private Row(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /** Copies {@code fields}, keeping its iteration order. */
    public static Row of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        return new Row(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /** Unmodifiable, ordered view of all fields. */
    public Map<String, Object> fields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
