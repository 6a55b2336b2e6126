package com.sopgenerator.core.renderer;

import com.sopgenerator.core.config.SopConfig.StyleSettings;

import java.nio.file.Path;
import java.util.Map;

/**
 * Context provided to renderers during execution.
 *
 * @param templatePath Word template to fill, or null for the built-in template
 * @param style styling of synthesized content
 * @param settings renderer-specific settings
 */
public record RenderContext(
    Path templatePath,
    StyleSettings style,
    Map<String, String> settings
) {
    /**
     * Compact constructor with defaults.
     */
    public RenderContext {
        if (style == null) {
            style = StyleSettings.defaults();
        }
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Creates a context that uses the built-in template and default styling.
     *
     * @return default context
     */
    public static RenderContext defaults() {
        return new RenderContext(null, null, null);
    }

    /**
     * Returns true if a custom template was supplied.
     *
     * @return true when a template path is set
     */
    public boolean hasTemplate() {
        return templatePath != null;
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
