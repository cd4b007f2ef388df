package github.sarthakdev143.frame_factory.config;

import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(RendererProperties.class)
public class RendererConfig {

    private static final int CONNECT_TIMEOUT_MILLIS = 15_000;
    private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024;

    @Bean("frameWorkerWebClient")
    public WebClient frameWorkerWebClient(RendererProperties properties) {
        // Asset lists can carry inline data URLs, so the default 256KB buffer is too small.
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(properties.getRequestTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

        return WebClient.builder()
                .baseUrl(properties.getWorkerBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .build();
    }

    @Bean("renderTaskExecutor")
    public ThreadPoolTaskExecutor renderTaskExecutor(RendererProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getJobThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("render-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
