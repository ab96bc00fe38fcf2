package com.flamingo.ai.docstructure.service.embedding;

import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Provider used when embeddings are switched off; the pipeline then runs on its fallbacks. */
@Component
@ConditionalOnProperty(name = "structure.embedding.enabled", havingValue = "false")
public class DisabledEmbeddingProvider implements EmbeddingProvider {

  @Override
  public Optional<float[]> embedText(String text) {
    return Optional.empty();
  }

  @Override
  public Optional<float[]> embedImage(ImageAsset image) {
    return Optional.empty();
  }

  @Override
  public boolean isAvailable() {
    return false;
  }
}
