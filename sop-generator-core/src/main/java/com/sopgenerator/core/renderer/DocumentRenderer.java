package com.sopgenerator.core.renderer;

import com.sopgenerator.core.model.DocumentContext;

/**
 * Interface for renderers that turn a {@link DocumentContext} into a document.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). The {@code docx}
 * renderer produces the Guideline V2 Word document; other renderers produce previews.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class TextDocumentRenderer implements DocumentRenderer {
 *     @Override
 *     public String getId() {
 *         return "text";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "txt";
 *     }
 *
 *     @Override
 *     public GeneratedDocument render(DocumentContext document, RenderContext context) {
 *         String text = document.steps().stream().map(Step::text).collect(Collectors.joining("\n"));
 *         return GeneratedDocument.of("sop.txt", text.getBytes(UTF_8), "text/plain", List.of());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sopgenerator.core.renderer.DocumentRenderer}
 *
 * @see RenderContext
 * @see GeneratedDocument
 */
public interface DocumentRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for selecting the renderer on the command line. Should be lowercase
     * (e.g., "docx", "markdown").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns the extension of the files this renderer produces, without the dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Renders a document.
     *
     * <p>Implementations must not modify the template source and must not keep state between
     * calls. Recoverable template problems are reported as warnings on the result.
     *
     * @param document content to render
     * @param context template, style and settings
     * @return the rendered document
     * @throws com.sopgenerator.core.exception.DocumentRenderException if the document cannot be produced
     */
    GeneratedDocument render(DocumentContext document, RenderContext context);
}
