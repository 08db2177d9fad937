package com.charthost.chart.config;

import com.charthost.chart.client.ChartFetcher;
import com.charthost.chart.client.FinvizChartClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Value("${chart.fetch.base-url:https://finviz.com}")
    private String baseUrl;

    @Value("${chart.fetch.timeout-ms:30000}")
    private long timeoutMs;

    @Value("${chart.storage.staging-directory:${java.io.tmpdir}/chart-staging}")
    private String stagingDirectory;

    @Bean
    public WebClient chartProviderWebClient(WebClient.Builder builder) {
        int connectMs = (int) Math.min(timeoutMs, 10_000L);
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMs)
            .responseTimeout(Duration.ofMillis(timeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ChartFetcher chartFetcher(WebClient chartProviderWebClient) {
        return new FinvizChartClient(chartProviderWebClient, Path.of(stagingDirectory), Duration.ofMillis(timeoutMs));
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
