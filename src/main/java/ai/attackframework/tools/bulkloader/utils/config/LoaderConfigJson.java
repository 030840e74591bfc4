package ai.attackframework.tools.bulkloader.utils.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON marshaling for {@link LoaderConfig}.
 *
 * <p>Shape:</p>
 * <pre>
 * {
 *   "url": "https://localhost:9200",
 *   "username": "elastic",
 *   "password": "...",
 *   "caCert": "/path/to/ca.crt",
 *   "verifyHostname": true,
 *   "bulk": { "threadCount": 4, "chunkSize": 500, "queueSize": 4 }
 * }
 * </pre>
 * Absent fields take the defaults in {@link ConfigKeys}. The password is read but never written.
 */
public final class LoaderConfigJson {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, false); // compact output

    private LoaderConfigJson() { }

    /** Dedicated runtime exception for config JSON errors. */
    public static final class ConfigJsonException extends RuntimeException {
        public ConfigJsonException(String message, Throwable cause) { super(message, cause); }
    }

    /** Reads and parses a UTF-8 JSON config file. */
    public static LoaderConfig read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Parses config JSON.
     *
     * @throws IOException              when the text is not valid JSON
     * @throws IllegalArgumentException when a value is out of range
     */
    public static LoaderConfig parse(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Config JSON must be an object");
        }
        JsonNode bulk = root.path(ConfigKeys.JSON_BULK);

        String cert = text(root, ConfigKeys.JSON_CA_CERT, "");
        return new LoaderConfig(
                text(root, ConfigKeys.JSON_URL, ConfigKeys.DEFAULT_URL),
                text(root, ConfigKeys.JSON_USERNAME, ConfigKeys.DEFAULT_USERNAME),
                text(root, ConfigKeys.JSON_PASSWORD, ""),
                cert.isBlank() ? null : Path.of(cert),
                root.path(ConfigKeys.JSON_VERIFY_HOSTNAME).asBoolean(true),
                bulk.path(ConfigKeys.JSON_THREAD_COUNT).asInt(ConfigKeys.DEFAULT_THREAD_COUNT),
                bulk.path(ConfigKeys.JSON_CHUNK_SIZE).asInt(ConfigKeys.DEFAULT_CHUNK_SIZE),
                bulk.path(ConfigKeys.JSON_QUEUE_SIZE).asInt(ConfigKeys.DEFAULT_QUEUE_SIZE));
    }

    /** Builds compact JSON for the given config, omitting the password. */
    public static String build(LoaderConfig config) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(ConfigKeys.JSON_URL, config.url());
        root.put(ConfigKeys.JSON_USERNAME, config.username());
        if (config.caCertPath() != null) {
            root.put(ConfigKeys.JSON_CA_CERT, config.caCertPath().toString());
        }
        root.put(ConfigKeys.JSON_VERIFY_HOSTNAME, config.verifyHostname());

        ObjectNode bulk = root.putObject(ConfigKeys.JSON_BULK);
        bulk.put(ConfigKeys.JSON_THREAD_COUNT, config.threadCount());
        bulk.put(ConfigKeys.JSON_CHUNK_SIZE, config.chunkSize());
        bulk.put(ConfigKeys.JSON_QUEUE_SIZE, config.queueSize());

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ConfigJsonException("JSON serialization error", e);
        }
    }

    private static String text(JsonNode root, String field, String fallback) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return fallback;
        String v = n.asText();
        return v.isBlank() ? fallback : v;
    }
}
