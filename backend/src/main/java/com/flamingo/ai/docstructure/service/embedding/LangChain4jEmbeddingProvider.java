package com.flamingo.ai.docstructure.service.embedding;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}.
 *
 * <p>Images are embedded through their caption or alt text in the same space as the document
 * text; an image without either has no embedding.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
    name = "structure.embedding.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final StructureConfig structureConfig;

  /**
   * Embeds a text span.
   *
   * @param text the text
   * @return the vector, or empty for blank text or a failed call
   */
  @Override
  @Timed(value = "embedding.embedText", description = "Time to embed a text span")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedTextFallback")
  @Retry(name = "embedding")
  public Optional<float[]> embedText(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(embed(text, "text"));
  }

  /**
   * Embeds an image through its descriptive text.
   *
   * @param image the image
   * @return the vector, or empty when the image has no caption or alt text
   */
  @Override
  @Timed(value = "embedding.embedImage", description = "Time to embed an image description")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedImageFallback")
  @Retry(name = "embedding")
  public Optional<float[]> embedImage(ImageAsset image) {
    String text = image.descriptiveText();
    if (text.isBlank()) {
      log.debug("Image {} has no caption or alt text, no embedding", image.id());
      return Optional.empty();
    }
    return Optional.of(embed(text, "image"));
  }

  private float[] embed(String text, String type) {
    int maxChars = structureConfig.getEmbedding().getMaxChars();
    String input = text;
    if (input.length() > maxChars) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          maxChars);
      input = input.substring(0, maxChars);
    }

    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return response.content().vector();
  }

  @SuppressWarnings("unused")
  private Optional<float[]> embedTextFallback(String text, Throwable t) {
    log.warn("Text embedding unavailable: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "text").increment();
    return Optional.empty();
  }

  @SuppressWarnings("unused")
  private Optional<float[]> embedImageFallback(ImageAsset image, Throwable t) {
    log.warn("Embedding unavailable for image {}: {}", image.id(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "image").increment();
    return Optional.empty();
  }
}
