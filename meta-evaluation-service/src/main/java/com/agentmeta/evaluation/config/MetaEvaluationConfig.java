package com.agentmeta.evaluation.config;

import com.agentmeta.common.synthetic.SeededSyntheticEstimator;
import com.agentmeta.common.synthetic.SyntheticEstimator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
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

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class MetaEvaluationConfig {

    public static final String PERFORMANCE_ESTIMATOR = "performanceEstimator";
    public static final String RANKING_ESTIMATOR     = "rankingEstimator";

    @Value("${services.market-data.base-url:http://localhost:8080}")
    private String marketDataBaseUrl;

    @Value("${meta-evaluation.external-call-timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${meta-evaluation.synthetic-seed:42}")
    private long syntheticSeed;

    @Bean
    public WebClient marketDataClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(marketDataBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Fixed seed so synthetic placeholders are reproducible across restarts. */
    @Bean(PERFORMANCE_ESTIMATOR)
    public SyntheticEstimator performanceEstimator() {
        return SeededSyntheticEstimator.forStream(syntheticSeed, "performance");
    }

    @Bean(RANKING_ESTIMATOR)
    public SyntheticEstimator rankingEstimator() {
        return SeededSyntheticEstimator.forStream(syntheticSeed, "ranking");
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                LoggerFactory.getLogger(MetaEvaluationConfig.class)
                    .debug("Market data server error. status={}", clientResponse.statusCode());
                return Mono.error(new RuntimeException("Market data server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }
}
