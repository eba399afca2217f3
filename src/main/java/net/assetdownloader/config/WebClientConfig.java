/**
 * Configuration for WebClient
 * - Defines the builder used for remote asset fetches
 * - Applies timeouts, redirects and a browser-like User-Agent
 */
package net.assetdownloader.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Configures the WebClient builder shared by the asset fetch client
 * - Follows redirects, since many asset hosts serve images behind CDNs
 * - Buffers whole responses up to the configured in-memory limit
 */
@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout from {@code downloader.http.connect-timeout}
     * - Read, write and response timeouts from {@code downloader.http.timeout}
     *
     * @param properties downloader settings
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(DownloaderProperties properties) {
        DownloaderProperties.Http http = properties.getHttp();
        long timeoutMillis = http.getTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(http.getTimeout());

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(http.getMaxInMemorySize()))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
