package feed.reader.app.config;

import feed.reader.app.service.RemoteAddressGuard;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared outbound HTTP client for feed fetching and discovery.
 * Redirects are followed by the fetcher itself so every hop passes the address guard,
 * and host resolution goes through the guard so connections only reach allowed addresses.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient feedHttpClient(RemoteAddressGuard addressGuard) {
        return new OkHttpClient.Builder()
                .dns(addressGuard)
                .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(20, TimeUnit.SECONDS)
                .followRedirects(false)
                .followSslRedirects(false)
                .retryOnConnectionFailure(false)
                .build();
    }
}
