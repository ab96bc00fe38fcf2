package com.flamingo.ai.docstructure.service.embedding;

import com.flamingo.ai.docstructure.service.chunking.LayoutChunk;
import com.flamingo.ai.docstructure.service.classification.TextUnit;
import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Attaches embeddings to units, images and chunks.
 *
 * <p>Lookups fan out over the embedding executor and are joined before the method returns, so
 * callers always see a complete list in the original order. Items that already carry a vector are
 * left alone. A failed lookup leaves only that item without a vector.
 */
@Slf4j
@Component
public class EmbeddingEnricher {

  private final EmbeddingProvider embeddingProvider;
  private final Executor embeddingExecutor;

  public EmbeddingEnricher(
      EmbeddingProvider embeddingProvider,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor) {
    this.embeddingProvider = embeddingProvider;
    this.embeddingExecutor = embeddingExecutor;
  }

  public boolean isEnabled() {
    return embeddingProvider.isAvailable();
  }

  public List<TextUnit> enrichUnits(List<TextUnit> units, EmbeddingCache cache) {
    return enrich(
        units,
        TextUnit::hasEmbedding,
        unit -> lookupText(unit.text().trim(), cache),
        TextUnit::withEmbedding,
        "unit");
  }

  public List<ImageAsset> enrichImages(List<ImageAsset> images, EmbeddingCache cache) {
    return enrich(
        images,
        ImageAsset::hasEmbedding,
        image -> lookupImage(image, cache),
        ImageAsset::withEmbedding,
        "image");
  }

  public List<LayoutChunk> enrichChunks(List<LayoutChunk> chunks, EmbeddingCache cache) {
    return enrich(
        chunks,
        LayoutChunk::hasEmbedding,
        chunk -> lookupText(chunk.text(), cache),
        LayoutChunk::withEmbedding,
        "chunk");
  }

  private <T> List<T> enrich(
      List<T> items,
      Predicate<T> hasVector,
      Function<T, Optional<float[]>> lookup,
      BiFunction<T, float[], T> attach,
      String kind) {
    if (items == null || items.isEmpty()) {
      return List.of();
    }

    List<CompletableFuture<T>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      if (hasVector.test(item)) {
        futures.add(CompletableFuture.completedFuture(item));
        continue;
      }
      CompletableFuture<T> future;
      try {
        future =
            CompletableFuture.supplyAsync(() -> lookup.apply(item), embeddingExecutor)
                .handle(
                    (vector, error) -> {
                      if (error != null) {
                        log.warn("Embedding lookup failed for {}: {}", kind, error.getMessage());
                        return item;
                      }
                      if (vector == null) {
                        return item;
                      }
                      return vector.map(v -> attach.apply(item, v)).orElse(item);
                    });
      } catch (RejectedExecutionException e) {
        log.warn("Embedding executor rejected {} lookup: {}", kind, e.getMessage());
        future = CompletableFuture.completedFuture(item);
      }
      futures.add(future);
    }

    // Join barrier: the sequential passes that follow need every vector in place
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<T> enriched = new ArrayList<>(items.size());
    int embedded = 0;
    for (int i = 0; i < futures.size(); i++) {
      T result = futures.get(i).join();
      if (hasVector.test(result)) {
        embedded++;
      }
      enriched.add(result);
    }
    log.debug("Embedded {} of {} {} items", embedded, items.size(), kind);
    return enriched;
  }

  private Optional<float[]> lookupText(String text, EmbeddingCache cache) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String key = "text:" + text;
    Optional<float[]> cached = cache.get(key);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<float[]> vector = embeddingProvider.embedText(text);
    vector.ifPresent(v -> cache.put(key, v));
    return vector;
  }

  private Optional<float[]> lookupImage(ImageAsset image, EmbeddingCache cache) {
    String key = "image:" + image.descriptiveText();
    Optional<float[]> cached = cache.get(key);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<float[]> vector = embeddingProvider.embedImage(image);
    vector.ifPresent(v -> cache.put(key, v));
    return vector;
  }
}
