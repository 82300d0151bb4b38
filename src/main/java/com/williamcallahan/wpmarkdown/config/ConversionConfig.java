package com.williamcallahan.wpmarkdown.config;

import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeRegistry;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the conversion pipeline's configurable collaborators.
 */
@Configuration
public class ConversionConfig {
    private static final Logger log = LoggerFactory.getLogger(ConversionConfig.class);

    @Bean
    public ShortcodeRegistry shortcodeRegistry(AppProperties appProperties) {
        ShortcodeRegistry registry = appProperties.getShortcodes().toRegistry();
        log.info("Recognizing shortcodes: {}", registry.names());
        return registry;
    }

    /**
     * Source of the prefixes that make clashing attachment file names unique.
     */
    @Bean
    public Random attachmentNameRandom() {
        return new Random();
    }
}
