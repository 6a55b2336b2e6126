package com.sopgenerator.core.synthesis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Fixed list of known abbreviations, bundled as {@code glossary.yaml}.
 *
 * @param terms glossary entries
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Glossary(@JsonProperty("terms") List<GlossaryEntry> terms) {

    public static final String RESOURCE = "/glossary.yaml";

    private static final Logger log = LoggerFactory.getLogger(Glossary.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public Glossary {
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    /**
     * Loads the bundled glossary.
     *
     * @return bundled glossary
     * @throws UncheckedIOException if the resource is missing or unreadable
     */
    public static Glossary load() {
        try (InputStream in = Glossary.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Glossary resource not found: " + RESOURCE));
            }
            Glossary glossary = YAML_MAPPER.readValue(in, Glossary.class);
            log.debug("Loaded {} glossary terms", glossary.terms().size());
            return glossary;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read glossary " + RESOURCE, e);
        }
    }

    /**
     * Looks up a term, ignoring case.
     *
     * @param term abbreviation
     * @return matching entry, if any
     */
    public Optional<GlossaryEntry> lookup(String term) {
        return terms.stream()
            .filter(entry -> entry.term().equalsIgnoreCase(term))
            .findFirst();
    }

    /**
     * Returns the terms listed in every document.
     *
     * @return always-included entries in glossary order
     */
    public List<GlossaryEntry> alwaysIncluded() {
        return terms.stream().filter(GlossaryEntry::always).toList();
    }
}
