package com.coursesync.source;

import com.coursesync.config.SyncSettings;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.jboss.logging.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Owns the shared HTTP client and hands out {@link HttpRangeSource}s bound to it.
 */
@ApplicationScoped
public class HttpSourceFactory {

    private static final Logger LOG = Logger.getLogger(HttpSourceFactory.class);

    private final OkHttpClient client;

    @Inject
    public HttpSourceFactory(SyncSettings settings) {
        this(buildClient(settings));
    }

    public HttpSourceFactory(OkHttpClient client) {
        this.client = client;
    }

    static OkHttpClient buildClient(SyncSettings settings) {
        SyncSettings.Http http = settings.http();
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(settings.maxWorkers() * 2, 5, TimeUnit.MINUTES))
                .connectTimeout(http.connectTimeout())
                .readTimeout(http.readTimeout())
                .followRedirects(true)
                .retryOnConnectionFailure(true)
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header("User-Agent", http.userAgent())
                        .build()))
                .build();
    }

    public HttpRangeSource open(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("URL must be HTTP or HTTPS: " + url);
        }
        return new HttpRangeSource(client, parsed);
    }

    @PreDestroy
    void close() {
        LOG.debug("Shutting down HTTP client");
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
