package com.sopgenerator.core.renderer;

import com.sopgenerator.core.model.PipelineWarning;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Represents a rendered document.
 *
 * @param fileName suggested file name (e.g., "Purchase Request.docx")
 * @param content document bytes
 * @param contentType MIME type of the content
 * @param warnings warnings of every pipeline stage, rendering included
 */
public record GeneratedDocument(
    String fileName,
    byte[] content,
    String contentType,
    List<PipelineWarning> warnings
) {
    public static final String DOCX_CONTENT_TYPE =
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    public static final String MARKDOWN_CONTENT_TYPE = "text/markdown";

    /**
     * Compact constructor with validation.
     */
    public GeneratedDocument {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        content = content.clone();
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    /**
     * Returns the size of the document in bytes.
     *
     * @return content length
     */
    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeneratedDocument other)) {
            return false;
        }
        return fileName.equals(other.fileName)
            && Arrays.equals(content, other.content)
            && Objects.equals(contentType, other.contentType)
            && warnings.equals(other.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, Arrays.hashCode(content), contentType, warnings);
    }

    @Override
    public String toString() {
        return "GeneratedDocument[fileName=" + fileName + ", size=" + content.length
            + ", contentType=" + contentType + ", warnings=" + warnings.size() + "]";
    }
}
