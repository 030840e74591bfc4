package ai.attackframework.tools.bulkloader.dataset;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Turns dataset rows into {@link Document}s lazily.
 *
 * <p>The returned iterator is single-pass and holds no copy of the produced documents; call
 * {@link #generate(String, Dataset, String)} again to start over.</p>
 */
public final class DocumentGenerator {

    private DocumentGenerator() {}

    /**
     * Yields one document per row, in dataset order.
     *
     * @param collection target index name
     * @param dataset    source rows
     * @param idField    field whose value becomes the document id
     * @return lazy iterator; {@link Iterator#next()} throws {@link IllegalArgumentException}
     *         when a row has no value for {@code idField}
     */
    public static Iterator<Document> generate(String collection, Dataset dataset, String idField) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(idField, "idField");
        Iterator<Row> rows = dataset.iterator();

        return new Iterator<>() {
            private int position = 0;

            @Override
            public boolean hasNext() {
                return rows.hasNext();
            }

            @Override
            public Document next() {
                if (!rows.hasNext()) {
                    throw new NoSuchElementException();
                }
                Row row = rows.next();
                int rowIndex = position++;
                return toDocument(collection, row, idField, rowIndex);
            }
        };
    }

    static Document toDocument(String collection, Row row, String idField, int rowIndex) {
        Object id = row.get(idField);
        if (id == null) {
            throw new IllegalArgumentException(
                    "Row " + rowIndex + " has no value for id field '" + idField + "'");
        }
        return new Document(collection, String.valueOf(id), row.fields());
    }
}
