package com.flamingo.ai.docstructure.service.pipeline;

import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import java.util.List;

/**
 * One document handed to the pipeline.
 *
 * @param documentId caller's document id, used as the chunk id prefix
 * @param root root of the parsed tree; may be null for a document with no content
 * @param images images supplied outside the tree (for example extracted by the parser)
 */
public record DocumentRequest(String documentId, ParsedNode root, List<ImageAsset> images) {

  public DocumentRequest {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    images = images == null ? List.of() : List.copyOf(images);
  }

  public DocumentRequest(String documentId, ParsedNode root) {
    this(documentId, root, List.of());
  }
}
