package com.sopgenerator.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Looks up {@link DocumentRenderer} implementations via ServiceLoader.
 */
public final class DocumentRenderers {

    public static final String DEFAULT_RENDERER = "docx";

    private static final Logger log = LoggerFactory.getLogger(DocumentRenderers.class);

    private DocumentRenderers() {
        // Utility class
    }

    /**
     * Returns all registered renderers.
     *
     * @return renderers in discovery order
     */
    public static List<DocumentRenderer> available() {
        log.debug("Discovering document renderers via ServiceLoader");
        List<DocumentRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(DocumentRenderer.class).forEach(renderers::add);
        log.debug("Discovered {} document renderers", renderers.size());
        return renderers;
    }

    /**
     * Finds a renderer by id.
     *
     * @param id renderer id, e.g. {@code docx}
     * @return matching renderer
     * @throws IllegalArgumentException if no renderer has this id
     */
    public static DocumentRenderer find(String id) {
        return available().stream()
            .filter(renderer -> renderer.getId().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown renderer: " + id));
    }
}
