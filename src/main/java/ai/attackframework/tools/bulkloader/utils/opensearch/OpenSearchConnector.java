package ai.attackframework.tools.bulkloader.utils.opensearch;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;

import javax.net.ssl.SSLContext;

import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManager;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.ClientTlsStrategyBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.nio.ssl.TlsStrategy;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.ssl.SSLContexts;
import org.opensearch.client.json.JsonpMapper;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.transport.OpenSearchTransport;
import org.opensearch.client.transport.httpclient5.ApacheHttpClient5TransportBuilder;

import ai.attackframework.tools.bulkloader.utils.Logger;
import ai.attackframework.tools.bulkloader.utils.config.LoaderConfig;

/**
 * Factory for OpenSearch clients.
 *
 * <p>Ownership:
 * Each call builds a new client with its own connection pool. The caller owns it and closes
 * its transport when done.</p>
 */
public final class OpenSearchConnector {

    private OpenSearchConnector() {
        throw new AssertionError("No instances");
    }

    /**
     * Builds a client for {@code config}: basic auth when a username is set, and TLS trust
     * anchored on {@code config.caCertPath()} when present.
     *
     * @return unconnected client; the first request opens connections
     * @throws OpenSearchClientBuildException when the URL or certificate is unusable
     */
    public static OpenSearchClient buildClient(LoaderConfig config) {
        try {
            URI uri = URI.create(config.url());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL needs a scheme and host: " + config.url());
            }
            HttpHost host = new HttpHost(uri.getScheme(), uri.getHost(), uri.getPort());
            JsonpMapper mapper = new JacksonJsonpMapper();

            BasicCredentialsProvider credentials = new BasicCredentialsProvider();
            if (!config.username().isEmpty()) {
                credentials.setCredentials(new AuthScope(host),
                        new UsernamePasswordCredentials(config.username(), config.password().toCharArray()));
            }

            ClientTlsStrategyBuilder tls = ClientTlsStrategyBuilder.create()
                    .setSslContext(sslContext(config.caCertPath()));
            if (!config.verifyHostname()) {
                tls.setHostnameVerifier(NoopHostnameVerifier.INSTANCE);
            }
            TlsStrategy tlsStrategy = tls.build();

            // one connection per worker plus one for admin calls
            int maxConnections = config.threadCount() + 1;
            PoolingAsyncClientConnectionManager connectionManager = PoolingAsyncClientConnectionManagerBuilder.create()
                    .setTlsStrategy(tlsStrategy)
                    .setMaxConnTotal(maxConnections)
                    .setMaxConnPerRoute(maxConnections)
                    .build();

            OpenSearchTransport transport = ApacheHttpClient5TransportBuilder
                    .builder(host)
                    .setMapper(mapper)
                    .setHttpClientConfigCallback(httpClientBuilder -> httpClientBuilder
                            .setDefaultCredentialsProvider(credentials)
                            .setConnectionManager(connectionManager))
                    .build();

            Logger.logDebug("[OpenSearch] Built client for " + config);
            return new OpenSearchClient(transport);
        } catch (Exception e) {
            throw new OpenSearchClientBuildException("Failed to build OpenSearch client for " + config.url(), e);
        }
    }

    /** Trust store holding every certificate in the PEM file; the JVM default when {@code caCert} is null. */
    static SSLContext sslContext(Path caCert) throws GeneralSecurityException, IOException {
        if (caCert == null) {
            return SSLContexts.createSystemDefault();
        }
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        try (InputStream is = Files.newInputStream(caCert)) {
            Collection<? extends Certificate> certs = factory.generateCertificates(is);
            if (certs.isEmpty()) {
                throw new GeneralSecurityException("No certificates found in " + caCert);
            }
            int i = 0;
            for (Certificate cert : certs) {
                trustStore.setCertificateEntry("ca-" + i++, cert);
            }
        }
        return SSLContextBuilder.create()
                .loadTrustMaterial(trustStore, null)
                .build();
    }
}
