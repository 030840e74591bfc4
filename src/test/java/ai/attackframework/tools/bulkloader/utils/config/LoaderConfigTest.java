package ai.attackframework.tools.bulkloader.utils.config;

import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoaderConfigTest {

    @Test
    void fromEnvironment_emptyEnv_usesDefaults() {
        LoaderConfig cfg = LoaderConfig.fromEnvironment(Map.of());

        assertThat(cfg.url()).isEqualTo("https://localhost:9200");
        assertThat(cfg.username()).isEqualTo("elastic");
        assertThat(cfg.password()).isEmpty();
        assertThat(cfg.caCertPath()).isNull();
        assertThat(cfg.verifyHostname()).isTrue();
        assertThat(cfg.threadCount()).isEqualTo(4);
        assertThat(cfg.chunkSize()).isEqualTo(500);
        assertThat(cfg.queueSize()).isEqualTo(4);
    }

    @Test
    void fromEnvironment_readsEveryKey() {
        LoaderConfig cfg = LoaderConfig.fromEnvironment(Map.of(
                ConfigKeys.ENV_URL, " https://search.internal:9201 ",
                ConfigKeys.ENV_USERNAME, "loader",
                ConfigKeys.ENV_PASSWORD, "s3cret",
                ConfigKeys.ENV_CA_CERT, "/etc/certs/http_ca.crt",
                ConfigKeys.ENV_VERIFY_HOSTNAME, "false",
                ConfigKeys.ENV_THREAD_COUNT, "8",
                ConfigKeys.ENV_CHUNK_SIZE, "1000",
                ConfigKeys.ENV_QUEUE_SIZE, "0"));

        assertThat(cfg.url()).isEqualTo("https://search.internal:9201");
        assertThat(cfg.username()).isEqualTo("loader");
        assertThat(cfg.password()).isEqualTo("s3cret");
        assertThat(cfg.caCertPath()).isEqualTo(Path.of("/etc/certs/http_ca.crt"));
        assertThat(cfg.verifyHostname()).isFalse();
        assertThat(cfg.threadCount()).isEqualTo(8);
        assertThat(cfg.chunkSize()).isEqualTo(1000);
        assertThat(cfg.queueSize()).isZero();
    }

    @Test
    void fromEnvironment_fallsBackToElasticNames() {
        LoaderConfig cfg = LoaderConfig.fromEnvironment(Map.of(
                ConfigKeys.ENV_LEGACY_USERNAME, "legacy-user",
                ConfigKeys.ENV_LEGACY_PASSWORD, "legacy-pass",
                ConfigKeys.ENV_LEGACY_CA_CERT, "/certs/ca.crt",
                ConfigKeys.ENV_USERNAME, " "));

        assertThat(cfg.username()).isEqualTo("legacy-user");
        assertThat(cfg.password()).isEqualTo("legacy-pass");
        assertThat(cfg.caCertPath()).isEqualTo(Path.of("/certs/ca.crt"));
    }

    @Test
    void fromEnvironment_opensearchNamesWinOverElasticNames() {
        LoaderConfig cfg = LoaderConfig.fromEnvironment(Map.of(
                ConfigKeys.ENV_USERNAME, "loader",
                ConfigKeys.ENV_LEGACY_USERNAME, "legacy-user",
                ConfigKeys.ENV_PASSWORD, "s3cret",
                ConfigKeys.ENV_LEGACY_PASSWORD, "legacy-pass",
                ConfigKeys.ENV_CA_CERT, "/etc/certs/http_ca.crt",
                ConfigKeys.ENV_LEGACY_CA_CERT, "/certs/ca.crt"));

        assertThat(cfg.username()).isEqualTo("loader");
        assertThat(cfg.password()).isEqualTo("s3cret");
        assertThat(cfg.caCertPath()).isEqualTo(Path.of("/etc/certs/http_ca.crt"));
    }

    @Test
    void fromEnvironment_rejectsNonNumericSizes() {
        assertThatThrownBy(() -> LoaderConfig.fromEnvironment(Map.of(ConfigKeys.ENV_CHUNK_SIZE, "lots")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigKeys.ENV_CHUNK_SIZE);
    }

    @Test
    void constructor_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new LoaderConfig(" ", "u", "p", null, true, 4, 500, 4))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LoaderConfig("https://h:9200", "u", "p", null, true, 0, 500, 4))
                .hasMessageContaining("threadCount");
        assertThatThrownBy(() -> new LoaderConfig("https://h:9200", "u", "p", null, true, 4, -1, 4))
                .hasMessageContaining("chunkSize");
        assertThatThrownBy(() -> new LoaderConfig("https://h:9200", "u", "p", null, true, 4, 500, -1))
                .hasMessageContaining("queueSize");
    }

    @Test
    void toString_neverContainsPassword() {
        LoaderConfig cfg = LoaderConfig.defaults("elastic", "hunter2");
        assertThat(cfg.toString()).doesNotContain("hunter2").contains("elastic");
    }
}
