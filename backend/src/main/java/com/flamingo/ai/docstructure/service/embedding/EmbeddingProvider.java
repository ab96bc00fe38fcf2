package com.flamingo.ai.docstructure.service.embedding;

import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import java.util.Optional;

/**
 * Embedding collaborator. A failed or impossible lookup is {@link Optional#empty()}, never an
 * exception the pipeline has to handle.
 */
public interface EmbeddingProvider {

  Optional<float[]> embedText(String text);

  Optional<float[]> embedImage(ImageAsset image);

  /** Whether this provider can produce embeddings at all. */
  default boolean isAvailable() {
    return true;
  }
}
