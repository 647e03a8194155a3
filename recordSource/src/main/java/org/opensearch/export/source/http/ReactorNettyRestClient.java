package org.opensearch.export.source.http;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Rest client over a Reactor Netty connection pool. Closing it disposes the pool.
 */
public class ReactorNettyRestClient extends AbstractRestClient {
    private final ConnectionProvider connectionProvider;

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections size of the connection pool; 0 or less for Reactor Netty's default pool
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections) {
        this(connectionContext, maxConnections > 0
            ? ConnectionProvider.create("DatafileExport", maxConnections)
            : null);
    }

    private ReactorNettyRestClient(ConnectionContext connectionContext, ConnectionProvider connectionProvider) {
        super(connectionContext, createAdapter(connectionContext, connectionProvider));
        this.connectionProvider = connectionProvider;
    }

    @Override
    public void close() {
        if (connectionProvider != null) {
            connectionProvider.dispose();
        }
    }

    private static ReactorNettyAdapter createAdapter(ConnectionContext connectionContext,
                                                     ConnectionProvider connectionProvider) {
        var httpClient = (connectionProvider == null ? HttpClient.create() : HttpClient.create(connectionProvider))
            .baseUrl(connectionContext.getUri().toString())
            .disableRetry(false) // one immediate retry on connection reset
            .keepAlive(true);

        if (ConnectionContext.Protocol.HTTPS.equals(connectionContext.getProtocol())) {
            var sslProvider = connectionContext.isInsecure()
                ? getInsecureSslProvider()
                : SslProvider.defaultClientProvider();
            httpClient = httpClient.secure(sslProvider);
        }

        return new ReactorNettyAdapter(connectionContext, httpClient);
    }

    private static SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }
}
