package com.bountyscope.core.advisory;

import com.bountyscope.core.config.ConfigurationException;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.persistence.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the {@link AdvisoryClient} only when {@code bounty.advisory.enabled=true}.
 * Without it the gate and the triage scorer run on local rules and neutral scores.
 */
@Configuration
public class AdvisoryConfig {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryConfig.class);

    @Bean
    @ConditionalOnProperty(name = "bounty.advisory.enabled", havingValue = "true")
    public AdvisoryClient advisoryClient(ObjectProvider<ChatClient.Builder> chatClientBuilder,
                                         AdvisoryProperties properties,
                                         ScanStore store,
                                         BountyscopeMetrics metrics,
                                         @Value("${spring.ai.openai.api-key:}") String apiKey,
                                         @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(
                    "bounty.advisory.enabled=true but no API key is configured (set BOUNTY_ADVISORY_API_KEY)");
        }
        ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
        if (builder == null) {
            throw new ConfigurationException(
                    "bounty.advisory.enabled=true but no chat model is active (set BOUNTY_ADVISORY_MODEL=openai)");
        }
        log.info("Advisory service enabled, base-url: {}", baseUrl);
        return new AdvisoryClient(builder, properties, store, metrics);
    }
}
