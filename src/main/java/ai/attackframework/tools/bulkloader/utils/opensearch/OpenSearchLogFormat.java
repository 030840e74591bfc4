package ai.attackframework.tools.bulkloader.utils.opensearch;

import java.net.URI;

/**
 * Shared formatting for OpenSearch request logging (create, delete, bulk).
 * Produces one log entry per request, with indented raw content.
 */
public final class OpenSearchLogFormat {

    private static final int MAX_REASON_LENGTH = 300;

    private OpenSearchLogFormat() {}

    /** Builds a log-friendly raw HTTP request string (request line, Host, optional Content-Type and body). */
    public static String buildRawRequest(String baseUrl, String method, String path, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(" ").append(path).append(" HTTP/1.1");
        String host = hostHeader(baseUrl);
        if (!host.isEmpty()) {
            sb.append("\nHost: ").append(host);
        }
        if (body != null && !body.isEmpty()) {
            sb.append("\nContent-Type: application/json\n\n").append(body);
        }
        return sb.toString();
    }

    /** Prefixes each line so a multi-line request aligns under its log entry. */
    public static String indentRaw(String raw) {
        if (raw == null || raw.isEmpty()) return raw;
        return "  " + raw.replace("\n", "\n  ");
    }

    /** Compact root-cause message on one line, capped in length. */
    public static String conciseRootCause(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null) c = c.getCause();
        String msg = c.getMessage();
        if (msg == null || msg.isBlank()) msg = c.getClass().getSimpleName();
        msg = msg.replaceAll("[\\r\\n]+", " ").trim();
        if (msg.length() > MAX_REASON_LENGTH) msg = msg.substring(0, MAX_REASON_LENGTH);
        return msg;
    }

    private static String hostHeader(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) return "";
        try {
            URI uri = URI.create(baseUrl.trim());
            String host = uri.getHost() != null ? uri.getHost() : "";
            int defaultPort = "https".equals(uri.getScheme()) ? 443 : 80;
            if (!host.isEmpty() && uri.getPort() > 0 && uri.getPort() != defaultPort) {
                host = host + ":" + uri.getPort();
            }
            return host;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
