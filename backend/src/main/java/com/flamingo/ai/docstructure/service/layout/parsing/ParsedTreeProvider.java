package com.flamingo.ai.docstructure.service.layout.parsing;

import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import java.io.InputStream;

/**
 * Turns a raw document byte-stream into the parsed element tree consumed by the layout model
 * builder.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * document-processing threads. A provider only parses; it does not build layout or chunks.
 */
public interface ParsedTreeProvider {

  /**
   * Parses the given document stream.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param documentId document identifier, used for error reporting
   * @param inputStream raw document bytes
   * @param mimeType MIME type of the document (e.g. {@code application/pdf})
   * @return root of the parsed element tree
   * @throws com.flamingo.ai.docstructure.exception.ParsedTreeException if no tree can be produced
   */
  ParsedNode parse(String documentId, InputStream inputStream, String mimeType);

  /**
   * Returns {@code true} if this provider can handle the given MIME type.
   *
   * @param mimeType document MIME type
   * @return {@code true} if supported
   */
  boolean supports(String mimeType);
}
