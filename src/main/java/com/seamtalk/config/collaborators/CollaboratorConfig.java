package com.seamtalk.config.collaborators;

import com.seamtalk.service.speech.DashScopeSpeechProvider;
import com.seamtalk.service.translation.DoubaoTranslationProvider;
import com.seamtalk.util.RestClients;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Providers behind the relay's translation and speech REST endpoints. Each gets its own
 * {@link org.springframework.web.client.RestClient} bounded by the configured timeout.
 */
@Configuration
public class CollaboratorConfig {

    private static final Logger LOG = LogManager.getLogger(CollaboratorConfig.class);

    @Bean
    public DoubaoTranslationProvider translationProvider(CollaboratorProperties properties) {
        CollaboratorProperties.Translation props = properties.getTranslation();
        if (!props.hasApiKey()) {
            LOG.warn("{} is not set; /api/v1/translate/text will answer 500", props.keyVariable());
        }
        return new DoubaoTranslationProvider(props, RestClients.withTimeout(props.getTimeout()));
    }

    @Bean
    public DashScopeSpeechProvider speechProvider(CollaboratorProperties properties) {
        CollaboratorProperties.Speech props = properties.getSpeech();
        if (!props.hasApiKey()) {
            LOG.warn("{} is not set; /api/v1/tts will answer 500", props.keyVariable());
        }
        return new DashScopeSpeechProvider(props, RestClients.withTimeout(props.getTimeout()));
    }
}
