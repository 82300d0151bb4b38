package com.williamcallahan.wpmarkdown.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private ExportConfig export = new ExportConfig();
    private ShortcodeConfig shortcodes = new ShortcodeConfig();

    /**
     * Validates every configuration section once binding completes.
     */
    @PostConstruct
    public void validateConfiguration() {
        export.validateConfiguration();
        shortcodes.validateConfiguration();
    }

    public ExportConfig getExport() {
        return export;
    }

    public void setExport(ExportConfig export) {
        this.export = export;
    }

    public ShortcodeConfig getShortcodes() {
        return shortcodes;
    }

    public void setShortcodes(ShortcodeConfig shortcodes) {
        this.shortcodes = shortcodes;
    }
}
