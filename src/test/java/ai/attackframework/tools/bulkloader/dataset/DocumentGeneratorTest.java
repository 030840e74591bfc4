package ai.attackframework.tools.bulkloader.dataset;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentGeneratorTest {

    private static Map<String, Object> row(Object sno, String name) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("SNo", sno);
        m.put("name", name);
        return m;
    }

    private static List<Document> drain(Iterator<Document> it) {
        List<Document> out = new ArrayList<>();
        it.forEachRemaining(out::add);
        return out;
    }

    @Test
    void twoRows_produceDocumentsKeyedByStringifiedId() {
        Dataset dataset = Dataset.fromMaps(List.of(row(1, "a"), row(2, "b")));

        List<Document> docs = drain(DocumentGenerator.generate("test", dataset, "SNo"));

        assertThat(docs).hasSize(2);
        assertThat(docs).extracting(Document::collection).containsOnly("test");
        assertThat(docs).extracting(Document::id).containsExactly("1", "2");
        assertThat(docs.get(0).body()).isEqualTo(Map.of("SNo", 1, "name", "a"));
        assertThat(docs.get(1).body()).isEqualTo(Map.of("SNo", 2, "name", "b"));
    }

    @Test
    void body_keepsEveryFieldInColumnOrder() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("SNo", 7L);
        m.put("ObservationDate", "01/22/2020");
        m.put("Province", null);
        m.put("Confirmed", 1.0);
        m.put("tags", List.of("x", "y"));
        Dataset dataset = Dataset.fromMaps(List.of(m));

        Document doc = DocumentGenerator.generate("covid", dataset, "SNo").next();

        assertThat(doc.id()).isEqualTo("7");
        assertThat(doc.body()).containsExactlyEntriesOf(m);
    }

    @Test
    void countMatchesDataset_andIdsFollowRowOrder() {
        List<Map<String, Object>> maps = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            maps.add(row(i * 3, "n" + i));
        }
        Dataset dataset = Dataset.fromMaps(maps);

        List<Document> docs = drain(DocumentGenerator.generate("c", dataset, "SNo"));

        assertThat(docs).hasSize(dataset.size());
        for (int i = 0; i < docs.size(); i++) {
            assertThat(docs.get(i).id()).isEqualTo(String.valueOf(dataset.rows().get(i).get("SNo")));
        }
    }

    @Test
    void iterator_isSinglePass_andRegenerationStartsOver() {
        Dataset dataset = Dataset.fromMaps(List.of(row(1, "a"), row(2, "b")));

        Iterator<Document> first = DocumentGenerator.generate("test", dataset, "SNo");
        drain(first);
        assertThat(first.hasNext()).isFalse();
        assertThatThrownBy(first::next).isInstanceOf(NoSuchElementException.class);

        assertThat(drain(DocumentGenerator.generate("test", dataset, "SNo"))).hasSize(2);
    }

    @Test
    void missingIdField_failsLazilyAtThatRow() {
        Map<String, Object> noId = new LinkedHashMap<>();
        noId.put("name", "orphan");
        Dataset dataset = Dataset.fromMaps(List.of(row(1, "a"), noId));

        Iterator<Document> it = DocumentGenerator.generate("test", dataset, "SNo");

        assertThat(it.next().id()).isEqualTo("1");
        assertThatThrownBy(it::next)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Row 1")
                .hasMessageContaining("SNo");
    }

    @Test
    void emptyDataset_yieldsNothing() {
        assertThat(DocumentGenerator.generate("test", Dataset.of(List.of()), "SNo").hasNext()).isFalse();
    }
}
