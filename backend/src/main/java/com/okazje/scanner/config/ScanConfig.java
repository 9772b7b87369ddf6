package com.okazje.scanner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.okazje.scanner.scan.classify.ChatModelListingClassifier;
import com.okazje.scanner.scan.classify.ClassifierException;
import com.okazje.scanner.scan.classify.ListingClassifier;
import com.okazje.scanner.scan.classify.ListingPromptBuilder;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
public class ScanConfig {
    private static final Logger log = LoggerFactory.getLogger(ScanConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(4);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ListingClassifier listingClassifier(ScannerProperties properties, ListingPromptBuilder promptBuilder) {
        ScannerProperties.Classifier classifier = properties.getClassifier();
        if (classifier.getApiKey().isBlank()) {
            log.warn("No classifier API key configured, listing analysis is disabled");
            return listing -> {
                throw new ClassifierException("ANTHROPIC_API_KEY is not configured");
            };
        }
        AnthropicChatModel model = AnthropicChatModel.builder()
            .apiKey(classifier.getApiKey())
            .modelName(classifier.getModel())
            .maxTokens(classifier.getMaxTokens())
            .timeout(Duration.ofSeconds(classifier.getTimeoutSeconds()))
            .build();
        return new ChatModelListingClassifier(model, promptBuilder);
    }
}
