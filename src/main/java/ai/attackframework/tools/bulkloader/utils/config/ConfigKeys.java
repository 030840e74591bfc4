package ai.attackframework.tools.bulkloader.utils.config;

/**
 * Shared keys for environment variables and JSON config fields.
 *
 * <p>Centralizing avoids drift in literals between the environment loader, JSON mapper, and tests.</p>
 */
public final class ConfigKeys {
    private ConfigKeys() {}

    // Environment variables
    public static final String ENV_URL             = "OPENSEARCH_URL";
    public static final String ENV_USERNAME        = "OPENSEARCH_USERNAME";
    public static final String ENV_PASSWORD        = "OPENSEARCH_PASSWORD";
    public static final String ENV_CA_CERT         = "OPENSEARCH_CA_CERT";
    public static final String ENV_VERIFY_HOSTNAME = "OPENSEARCH_VERIFY_HOSTNAME";
    public static final String ENV_THREAD_COUNT    = "BULK_THREAD_COUNT";
    public static final String ENV_CHUNK_SIZE      = "BULK_CHUNK_SIZE";
    public static final String ENV_QUEUE_SIZE      = "BULK_QUEUE_SIZE";

    // Older Elasticsearch-style names, read only when the OPENSEARCH_* key is unset
    public static final String ENV_LEGACY_USERNAME = "ELASTIC_USERNAME";
    public static final String ENV_LEGACY_PASSWORD = "ELASTIC_PASSWORD";
    public static final String ENV_LEGACY_CA_CERT  = "ELASTIC_CERT";

    // JSON fields
    public static final String JSON_URL             = "url";
    public static final String JSON_USERNAME        = "username";
    public static final String JSON_PASSWORD        = "password";
    public static final String JSON_CA_CERT         = "caCert";
    public static final String JSON_VERIFY_HOSTNAME = "verifyHostname";
    public static final String JSON_BULK            = "bulk";
    public static final String JSON_THREAD_COUNT    = "threadCount";
    public static final String JSON_CHUNK_SIZE      = "chunkSize";
    public static final String JSON_QUEUE_SIZE      = "queueSize";

    // Defaults
    public static final String DEFAULT_URL      = "https://localhost:9200";
    public static final String DEFAULT_USERNAME = "elastic";
    public static final int DEFAULT_THREAD_COUNT = 4;
    public static final int DEFAULT_CHUNK_SIZE   = 500;
    public static final int DEFAULT_QUEUE_SIZE   = 4;
}
