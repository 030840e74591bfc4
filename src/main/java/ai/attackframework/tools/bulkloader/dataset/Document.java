package ai.attackframework.tools.bulkloader.dataset;

import java.util.Map;
import java.util.Objects;

/**
 * A row prepared for indexing.
 *
 * @param collection target index name
 * @param id         document id ({@code _id}); the stringified identifier field of the row
 * @param body       document source ({@code _source}); the full row
 */
public record Document(String collection, String id, Map<String, Object> body) {

    public Document {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(body, "body");
    }
}
