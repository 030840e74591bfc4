package ai.attackframework.tools.bulkloader;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;
import jakarta.json.stream.JsonParser;
import org.opensearch.client.json.JsonpMapper;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.mapping.TypeMapping;
import org.opensearch.client.opensearch.core.InfoResponse;
import org.opensearch.client.opensearch.indices.CreateIndexRequest;
import org.opensearch.client.opensearch.indices.CreateIndexResponse;
import org.opensearch.client.opensearch.indices.DeleteIndexRequest;
import org.opensearch.client.opensearch.indices.DeleteIndexResponse;
import org.opensearch.client.opensearch.indices.ExistsRequest;
import org.opensearch.client.opensearch.indices.IndexSettings;
import org.opensearch.client.transport.OpenSearchTransport;

import ai.attackframework.tools.bulkloader.confirm.ConfirmationPolicy;
import ai.attackframework.tools.bulkloader.confirm.ConsoleConfirmation;
import ai.attackframework.tools.bulkloader.dataset.Dataset;
import ai.attackframework.tools.bulkloader.dataset.Document;
import ai.attackframework.tools.bulkloader.dataset.DocumentGenerator;
import ai.attackframework.tools.bulkloader.utils.Logger;
import ai.attackframework.tools.bulkloader.utils.config.LoaderConfig;
import ai.attackframework.tools.bulkloader.utils.opensearch.BulkInsertSummary;
import ai.attackframework.tools.bulkloader.utils.opensearch.OpenSearchConnector;
import ai.attackframework.tools.bulkloader.utils.opensearch.OpenSearchLogFormat;
import ai.attackframework.tools.bulkloader.utils.opensearch.ParallelBulkIndexer;

/**
 * Loads tabular datasets into OpenSearch and manages the target indices.
 *
 * <p>One instance owns one client session for its lifetime; {@link #close()} releases it.
 * Engine errors propagate unchanged, except during {@link #bulkInsert(String, Dataset, String)}
 * where per-document and per-batch failures are logged and summarized instead.</p>
 */
public class BulkLoader implements AutoCloseable {

    static final int NUMBER_OF_SHARDS = 1;
    static final int NUMBER_OF_REPLICAS = 1;

    private static final String SETTINGS_JSON =
            "{\"number_of_shards\":\"" + NUMBER_OF_SHARDS + "\",\"number_of_replicas\":\"" + NUMBER_OF_REPLICAS + "\"}";

    private static final ObjectMapper SCHEMA_MAPPER = new ObjectMapper();

    private final OpenSearchClient client;
    private final LoaderConfig config;
    private final ConfirmationPolicy confirmation;

    /**
     * Wraps an existing client. The loader takes ownership and closes its transport on {@link #close()}.
     */
    public BulkLoader(OpenSearchClient client, LoaderConfig config, ConfirmationPolicy confirmation) {
        this.client = Objects.requireNonNull(client, "client");
        this.config = Objects.requireNonNull(config, "config");
        this.confirmation = Objects.requireNonNull(confirmation, "confirmation");
    }

    /** Connects with operator confirmation on the system console for deletions. */
    public static BulkLoader connect(LoaderConfig config) throws IOException {
        return connect(config, ConsoleConfirmation.systemConsole());
    }

    /**
     * Builds a client for {@code config} and checks the cluster answers before returning.
     *
     * @throws IOException when the cluster cannot be reached
     * @throws org.opensearch.client.opensearch._types.OpenSearchException when the cluster rejects the request (e.g. bad credentials)
     * @throws ai.attackframework.tools.bulkloader.utils.opensearch.OpenSearchClientBuildException when the client cannot be built
     */
    public static BulkLoader connect(LoaderConfig config, ConfirmationPolicy confirmation) throws IOException {
        OpenSearchClient client = OpenSearchConnector.buildClient(config);
        try {
            Logger.logDebug("[OpenSearch] Request:\n" + OpenSearchLogFormat.indentRaw(
                    OpenSearchLogFormat.buildRawRequest(config.url(), "GET", "/", "")));
            InfoResponse info = client.info();
            Logger.logInfo("[OpenSearch] Connected to " + config.url() + " ("
                    + info.version().distribution() + " " + info.version().number() + ")");
        } catch (IOException | RuntimeException e) {
            Logger.logError("[OpenSearch] Connection failed for " + config.url() + ": "
                    + OpenSearchLogFormat.conciseRootCause(e));
            closeQuietly(client._transport(), e);
            throw e;
        }
        return new BulkLoader(client, config, confirmation);
    }

    /**
     * Lazily converts rows to documents for {@code collection}; see {@link DocumentGenerator}.
     */
    public Iterator<Document> generateDocuments(String collection, Dataset dataset, String idField) {
        return DocumentGenerator.generate(requireName(collection), dataset, idField);
    }

    /**
     * Indexes every row of {@code dataset} as a document whose id is the row's {@code idField} value.
     *
     * <p>Blocks until all bulk requests finish. Documents the engine does not report as created
     * (including overwrites of a duplicate id) and failed requests are logged, not thrown.</p>
     *
     * @throws IllegalArgumentException when a row has no {@code idField} value
     */
    public BulkInsertSummary bulkInsert(String collection, Dataset dataset, String idField) {
        String name = requireName(collection);
        Logger.logInfo("[BulkInsert] Inserting " + dataset.size() + " rows into " + name + " keyed by " + idField);
        ParallelBulkIndexer indexer = new ParallelBulkIndexer(client, config.url(),
                config.threadCount(), config.chunkSize(), config.queueSize());
        return indexer.index(generateDocuments(name, dataset, idField));
    }

    /**
     * Creates {@code name} with one shard, one replica and the given mapping.
     *
     * @param schema mapping body, e.g. {@code {"properties": {"SNo": {"type": "long"}}}}
     * @return whether the engine acknowledged the creation
     * @throws org.opensearch.client.opensearch._types.OpenSearchException when the index already exists
     */
    public boolean createCollection(String name, Map<String, Object> schema) throws IOException {
        Objects.requireNonNull(schema, "schema");
        String json;
        try {
            json = SCHEMA_MAPPER.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schema cannot be serialized to JSON", e);
        }
        return createCollection(name, json);
    }

    /** Same as {@link #createCollection(String, Map)} with the mapping given as JSON text. */
    public boolean createCollection(String name, String schemaJson) throws IOException {
        String index = requireName(name);
        Objects.requireNonNull(schemaJson, "schemaJson");
        Logger.logInfo("Attempting to create index: " + index);

        // Local mapper for static JSON content (avoid touching client transport).
        JsonpMapper mapper = new JacksonJsonpMapper();

        IndexSettings settings;
        try (JsonParser settingsParser = Json.createParser(new StringReader(SETTINGS_JSON))) {
            settings = IndexSettings._DESERIALIZER.deserialize(settingsParser, mapper);
        }

        TypeMapping mappings;
        try (JsonParser mappingsParser = Json.createParser(new StringReader(schemaJson))) {
            mappings = TypeMapping._DESERIALIZER.deserialize(mappingsParser, mapper);
        }

        CreateIndexRequest request = new CreateIndexRequest.Builder()
                .index(index)
                .settings(settings)
                .mappings(mappings)
                .build();

        Logger.logDebug("[OpenSearch] Request:\n" + OpenSearchLogFormat.indentRaw(OpenSearchLogFormat.buildRawRequest(
                config.url(), "PUT", "/" + index,
                "{\"settings\":" + SETTINGS_JSON + ",\"mappings\":" + schemaJson + "}")));

        try {
            CreateIndexResponse response = client.indices().create(request);
            Logger.logInfo("Index creation acknowledged: " + response.acknowledged());
            return response.acknowledged();
        } catch (IOException | RuntimeException e) {
            Logger.logError("Exception while creating index: " + index + ": " + OpenSearchLogFormat.conciseRootCause(e));
            throw e;
        }
    }

    /**
     * Creates {@code name} from a classpath JSON file holding either a bare mapping or an object
     * with a {@code "mappings"} member. Settings in the file are ignored.
     *
     * @throws IOException when the resource is missing or not a JSON object
     */
    public boolean createCollectionFromResource(String name, String resourcePath) throws IOException {
        Objects.requireNonNull(resourcePath, "resourcePath");
        Logger.logInfo("Using mapping file: " + resourcePath);

        String jsonBody;
        try (InputStream is = BulkLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                String reason = "Mapping file not found: " + resourcePath;
                Logger.logError(reason);
                throw new IOException(reason);
            }
            jsonBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }

        JsonObject root;
        try (JsonReader reader = Json.createReader(new StringReader(jsonBody))) {
            root = reader.readObject();
        } catch (RuntimeException e) {
            throw new IOException("Mapping file is not a JSON object: " + resourcePath, e);
        }

        JsonObject mappingsJson = root.containsKey("mappings") ? root.getJsonObject("mappings") : root;
        return createCollection(name, mappingsJson.toString());
    }

    /** Whether index {@code name} exists. */
    public boolean collectionExists(String name) throws IOException {
        String index = requireName(name);
        boolean exists = client.indices().exists(ExistsRequest.of(b -> b.index(index))).value();
        Logger.logDebug("[OpenSearch] Index " + index + (exists ? " exists" : " does not exist"));
        return exists;
    }

    /**
     * Deletes index {@code name} after the confirmation policy agrees.
     *
     * @return {@code false} when declined (nothing is deleted), {@code true} once deleted
     */
    public boolean deleteCollection(String name) throws IOException {
        String index = requireName(name);
        boolean confirmed = confirmation.confirm(
                "WARNING: Being asked to delete " + index + ", is this correct? (y/n) ");
        if (!confirmed) {
            Logger.logInfo("Interrupted deletion of " + index + ".");
            return false;
        }

        Logger.logDebug("[OpenSearch] Request:\n" + OpenSearchLogFormat.indentRaw(
                OpenSearchLogFormat.buildRawRequest(config.url(), "DELETE", "/" + index, "")));
        DeleteIndexResponse response = client.indices().delete(DeleteIndexRequest.of(b -> b.index(index)));
        Logger.logInfo("Index deletion acknowledged for " + index + ": " + response.acknowledged());
        return true;
    }

    public LoaderConfig config() {
        return config;
    }

    OpenSearchClient client() {
        return client;
    }

    /** Closes the client transport. */
    @Override
    public void close() throws IOException {
        OpenSearchTransport transport = client._transport();
        if (transport != null) {
            transport.close();
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Index name must not be blank");
        }
        return name;
    }

    private static void closeQuietly(OpenSearchTransport transport, Exception primary) {
        if (transport == null) return;
        try {
            transport.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
