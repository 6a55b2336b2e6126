package com.sopgenerator.core.parser;

/**
 * Interface for parsers that turn diagram markup into a {@link com.sopgenerator.core.model.ProcessGraph}.
 *
 * <p>Parsers are pure transformations: they read the markup, build an immutable graph and
 * report recoverable findings as warnings. Markup that cannot be read at all fails with
 * {@link com.sopgenerator.core.exception.MalformedDiagramException}; readable markup that
 * lacks required structure fails with
 * {@link com.sopgenerator.core.exception.DiagramStructureException}.
 *
 * @see BpmnDiagramParser
 */
public interface DiagramParser {

    /**
     * Returns unique identifier for this parser (e.g., "bpmn").
     *
     * @return parser identifier
     */
    String getId();

    /**
     * Parses diagram markup.
     *
     * @param markup raw diagram markup
     * @return parsed graph with warnings
     * @throws com.sopgenerator.core.exception.MalformedDiagramException if the markup is unreadable
     * @throws com.sopgenerator.core.exception.DiagramStructureException if required structure is missing
     */
    ParseResult parse(String markup);
}
