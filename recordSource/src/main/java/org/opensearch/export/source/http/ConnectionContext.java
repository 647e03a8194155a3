package org.opensearch.export.source.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Everything needed to reach a search cluster over HTTP: its base URI, whether certificate
 * validation is skipped, and optional basic-auth credentials.
 */
@Getter
@ToString(exclude = "password")
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final String username;
    private final String password;
    private final boolean compressionSupported;

    @Builder
    private ConnectionContext(String url, boolean insecure, String username, String password,
                              boolean compressionSupported) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("A cluster URL must be provided");
        }
        try {
            this.uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid cluster URL: " + url, e);
        }
        if ("http".equalsIgnoreCase(uri.getScheme())) {
            this.protocol = Protocol.HTTP;
        } else if ("https".equalsIgnoreCase(uri.getScheme())) {
            this.protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("URL scheme must be http or https: " + url);
        }
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("Both username and password must be provided");
        }
        this.insecure = insecure;
        this.username = username;
        this.password = password;
        this.compressionSupported = compressionSupported;
    }

    public boolean hasBasicAuth() {
        return username != null;
    }
}
