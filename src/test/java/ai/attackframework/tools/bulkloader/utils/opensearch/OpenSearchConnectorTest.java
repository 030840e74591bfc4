package ai.attackframework.tools.bulkloader.utils.opensearch;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.NoSuchFileException;
import java.security.GeneralSecurityException;

import javax.net.ssl.SSLContext;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opensearch.client.opensearch.OpenSearchClient;

import ai.attackframework.tools.bulkloader.utils.config.LoaderConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenSearchConnectorTest {

    private static LoaderConfig config(String url, Path caCert) {
        return new LoaderConfig(url, "elastic", "changeme", caCert, true, 2, 100, 2);
    }

    private static Path testCa() throws URISyntaxException {
        return Path.of(OpenSearchConnectorTest.class.getResource("/certs/test-ca.pem").toURI());
    }

    @Test
    void buildClient_withCaCertificate_doesNotConnect() throws Exception {
        OpenSearchClient client = OpenSearchConnector.buildClient(config("https://127.0.0.1:1", testCa()));
        try {
            assertThat(client).isNotNull();
        } finally {
            client._transport().close();
        }
    }

    @Test
    void buildClient_urlWithoutScheme_throwsBuildException() {
        assertThatThrownBy(() -> OpenSearchConnector.buildClient(config("localhost:9200", null)))
                .isInstanceOf(OpenSearchClientBuildException.class)
                .hasMessageContaining("localhost:9200");
    }

    @Test
    void buildClient_missingCertificate_throwsBuildException(@TempDir Path dir) {
        Path missing = dir.resolve("nope.crt");
        assertThatThrownBy(() -> OpenSearchConnector.buildClient(config("https://localhost:9200", missing)))
                .isInstanceOf(OpenSearchClientBuildException.class)
                .hasCauseInstanceOf(NoSuchFileException.class);
    }

    @Test
    void sslContext_loadsPemTrustAnchor() throws Exception {
        SSLContext ctx = OpenSearchConnector.sslContext(testCa());
        assertThat(ctx).isNotNull();
        assertThat(ctx.getProtocol()).isNotBlank();
    }

    @Test
    void sslContext_rejectsFileWithoutCertificates(@TempDir Path dir) throws IOException {
        Path empty = dir.resolve("empty.pem");
        Files.writeString(empty, "", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> OpenSearchConnector.sslContext(empty))
                .isInstanceOf(GeneralSecurityException.class);
    }
}
