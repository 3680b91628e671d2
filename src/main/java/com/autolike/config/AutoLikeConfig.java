package com.autolike.config;

import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AutoLikeProperties.class)
public class AutoLikeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared client for request/response calls. The stream builds its own
     * connector without a response timeout.
     */
    @Bean
    public WebClient twitterWebClient(WebClient.Builder builder, AutoLikeProperties properties) {
        AutoLikeProperties.Twitter twitter = properties.getTwitter();
        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) twitter.getConnectTimeout().toMillis())
                .responseTimeout(twitter.getReadTimeout());

        return builder
                .clientConnector(new ReactorClientHttpConnector(http))
                .baseUrl(twitter.getApiBaseUrl())
                .build();
    }

    @Bean
    public WebClient twitterStreamWebClient(WebClient.Builder builder, AutoLikeProperties properties) {
        AutoLikeProperties.Twitter twitter = properties.getTwitter();
        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) twitter.getConnectTimeout().toMillis());

        return builder
                .clientConnector(new ReactorClientHttpConnector(http))
                .baseUrl(twitter.getApiBaseUrl())
                .build();
    }

    /**
     * Runs one fan-out cycle per event. When the queue is full new events are
     * rejected instead of blocking the caller.
     */
    @Bean
    public ThreadPoolTaskExecutor eventExecutor(AutoLikeProperties properties) {
        AutoLikeProperties.Fanout fanout = properties.getFanout();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fanout.getEventConcurrency());
        executor.setMaxPoolSize(fanout.getEventConcurrency());
        executor.setQueueCapacity(fanout.getEventQueueCapacity());
        executor.setThreadNamePrefix("fanout-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Runs the refresh and like calls of individual subscribers.
     */
    @Bean
    public ThreadPoolTaskExecutor subscriberExecutor(AutoLikeProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFanout().getSubscriberConcurrency());
        executor.setMaxPoolSize(properties.getFanout().getSubscriberConcurrency());
        executor.setThreadNamePrefix("fanout-subscriber-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
