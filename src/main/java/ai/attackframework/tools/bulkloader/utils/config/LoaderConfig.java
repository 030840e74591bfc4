package ai.attackframework.tools.bulkloader.utils.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable connection and bulk-submission settings for a {@code BulkLoader}.
 *
 * <p>Built once at process start, from the environment or a JSON file, and passed to the
 * loader's constructor.</p>
 *
 * @param url            engine base URL, e.g. {@code https://localhost:9200}
 * @param username       basic-auth user
 * @param password       basic-auth password; may be empty for unsecured clusters
 * @param caCertPath     PEM CA certificate used to verify the server; {@code null} uses the JVM trust store
 * @param verifyHostname whether the server certificate's host name must match {@code url}
 * @param threadCount    bulk worker threads
 * @param chunkSize      documents per bulk request
 * @param queueSize      chunks that may wait for a free worker
 */
public record LoaderConfig(
        String url,
        String username,
        String password,
        Path caCertPath,
        boolean verifyHostname,
        int threadCount,
        int chunkSize,
        int queueSize) {

    public LoaderConfig {
        url = safe(url);
        if (url.isEmpty()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        username = safe(username);
        password = password == null ? "" : password;
        requirePositive(threadCount, "threadCount");
        requirePositive(chunkSize, "chunkSize");
        if (queueSize < 0) {
            throw new IllegalArgumentException("queueSize must not be negative: " + queueSize);
        }
    }

    /** Defaults for a local secured cluster; credentials still need to be supplied. */
    public static LoaderConfig defaults(String username, String password) {
        return new LoaderConfig(ConfigKeys.DEFAULT_URL, username, password, null, true,
                ConfigKeys.DEFAULT_THREAD_COUNT, ConfigKeys.DEFAULT_CHUNK_SIZE, ConfigKeys.DEFAULT_QUEUE_SIZE);
    }

    /** Reads settings from the process environment. */
    public static LoaderConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads settings from the given variables (see {@link ConfigKeys}); absent keys take defaults.
     * Credentials and the CA certificate fall back to the {@code ELASTIC_*} names when the
     * {@code OPENSEARCH_*} key is absent or blank.
     *
     * @throws IllegalArgumentException when a numeric value cannot be parsed or is out of range
     */
    public static LoaderConfig fromEnvironment(Map<String, String> env) {
        String cert = safe(firstSet(env, ConfigKeys.ENV_CA_CERT, ConfigKeys.ENV_LEGACY_CA_CERT));
        String user = safe(firstSet(env, ConfigKeys.ENV_USERNAME, ConfigKeys.ENV_LEGACY_USERNAME));
        return new LoaderConfig(
                orDefault(env.get(ConfigKeys.ENV_URL), ConfigKeys.DEFAULT_URL),
                user.isEmpty() ? ConfigKeys.DEFAULT_USERNAME : user,
                firstSet(env, ConfigKeys.ENV_PASSWORD, ConfigKeys.ENV_LEGACY_PASSWORD),
                cert.isEmpty() ? null : Path.of(cert),
                parseBoolean(env.get(ConfigKeys.ENV_VERIFY_HOSTNAME), true),
                parseInt(env, ConfigKeys.ENV_THREAD_COUNT, ConfigKeys.DEFAULT_THREAD_COUNT),
                parseInt(env, ConfigKeys.ENV_CHUNK_SIZE, ConfigKeys.DEFAULT_CHUNK_SIZE),
                parseInt(env, ConfigKeys.ENV_QUEUE_SIZE, ConfigKeys.DEFAULT_QUEUE_SIZE));
    }

    /** Password-free rendering for logs. */
    @Override
    public String toString() {
        return "LoaderConfig[url=" + url + ", username=" + username
                + ", caCertPath=" + caCertPath + ", verifyHostname=" + verifyHostname
                + ", threadCount=" + threadCount + ", chunkSize=" + chunkSize
                + ", queueSize=" + queueSize + "]";
    }

    private static String firstSet(Map<String, String> env, String key, String legacyKey) {
        String value = env.get(key);
        return value == null || value.isBlank() ? env.get(legacyKey) : value;
    }

    private static int parseInt(Map<String, String> env, String key, int fallback) {
        String raw = safe(env.get(key));
        if (raw.isEmpty()) return fallback;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
    }

    private static boolean parseBoolean(String raw, boolean fallback) {
        String v = safe(raw).toLowerCase(Locale.ROOT);
        if (v.isEmpty()) return fallback;
        return !(v.equals("false") || v.equals("0") || v.equals("no"));
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static String orDefault(String value, String fallback) {
        String v = safe(value);
        return v.isEmpty() ? fallback : v;
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
