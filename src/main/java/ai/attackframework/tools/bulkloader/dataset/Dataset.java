package ai.attackframework.tools.bulkloader.dataset;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, immutable sequence of {@link Row}s loaded in memory.
 */
public final class Dataset implements Iterable<Row> {

    private final List<Row> rows;

    private Dataset(List<Row> rows) {
        this.rows = List.copyOf(rows);
    }

    public static Dataset of(List<Row> rows) {
        Objects.requireNonNull(rows, "rows");
        return new Dataset(rows);
    }

    /** Builds a dataset from plain maps, one row per map, in list order. */
    public static Dataset fromMaps(List<? extends Map<String, ?>> maps) {
        Objects.requireNonNull(maps, "maps");
        List<Row> out = new ArrayList<>(maps.size());
        for (Map<String, ?> m : maps) {
            out.add(Row.of(m));
        }
        return new Dataset(out);
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }
}
