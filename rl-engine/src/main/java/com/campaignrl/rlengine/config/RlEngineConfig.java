package com.campaignrl.rlengine.config;

import com.campaignrl.common.qlearning.QLearningConfig;
import com.campaignrl.common.qlearning.QLearningEngine;
import com.campaignrl.rlengine.publisher.LearningEventPublisher;
import com.campaignrl.rlengine.publisher.LoggingLearningEventPublisher;
import com.campaignrl.rlengine.publisher.RestLearningEventPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class RlEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(RlEngineConfig.class);

    @Value("${rl.learning.learning-rate:0.1}")
    private double learningRate;

    @Value("${rl.learning.discount-factor:0.95}")
    private double discountFactor;

    @Value("${rl.learning.exploration-rate:0.15}")
    private double explorationRate;

    @Value("${rl.buffer.active-capacity:25}")
    private int activeCapacity;

    @Value("${rl.buffer.history-capacity:1000}")
    private int historyCapacity;

    @Value("${rl.buffer.auto-process-threshold:15}")
    private int autoProcessThreshold;

    @Value("${rl.buffer.history-retention:PT72H}")
    private Duration historyRetention;

    @Value("${rl.notifications.enabled:true}")
    private boolean notificationsEnabled;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Bean
    public QLearningConfig qLearningConfig() {
        QLearningConfig config = new QLearningConfig(learningRate, discountFactor, explorationRate,
            activeCapacity, historyCapacity, autoProcessThreshold, historyRetention);
        log.info("Q-Learning configured. alpha={} gamma={} epsilon={} active={} history={} threshold={} retention={}",
                 learningRate, discountFactor, explorationRate, activeCapacity, historyCapacity,
                 autoProcessThreshold, historyRetention);
        if (!config.autoProcessEnabled()) {
            log.warn("Auto-process threshold exceeds active capacity; batches only run on force_process");
        }
        return config;
    }

    @Bean
    public QLearningEngine qLearningEngine(QLearningConfig qLearningConfig) {
        return new QLearningEngine(qLearningConfig);
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public LearningEventPublisher learningEventPublisher(WebClient notificationClient) {
        if (!notificationsEnabled) {
            log.info("Notifications disabled, learning events are only logged");
            return new LoggingLearningEventPublisher();
        }
        return new RestLearningEventPublisher(notificationClient);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
