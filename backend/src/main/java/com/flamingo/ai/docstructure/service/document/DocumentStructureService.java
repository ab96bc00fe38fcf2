package com.flamingo.ai.docstructure.service.document;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.ParsedTreeException;
import com.flamingo.ai.docstructure.service.embedding.EmbeddingCache;
import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import com.flamingo.ai.docstructure.service.layout.parsing.ParsedTreeProvider;
import com.flamingo.ai.docstructure.service.pipeline.DocumentRequest;
import com.flamingo.ai.docstructure.service.pipeline.DocumentStructurePipeline;
import com.flamingo.ai.docstructure.service.pipeline.PipelineResult;
import com.flamingo.ai.docstructure.service.pipeline.ResultSink;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Entry point for analysing documents: parse the upload into a tree, run the structure pipeline,
 * hand the outputs to the {@link ResultSink}.
 *
 * <p>Owns the embedding cache shared by the documents it processes. Expired entries are evicted
 * before each document.
 */
@Service
@Slf4j
public class DocumentStructureService {

  private final List<ParsedTreeProvider> treeProviders;
  private final DocumentStructurePipeline pipeline;
  private final ResultSink resultSink;
  private final MeterRegistry meterRegistry;
  private final Executor documentExecutor;
  private final EmbeddingCache embeddingCache;

  public DocumentStructureService(
      List<ParsedTreeProvider> treeProviders,
      DocumentStructurePipeline pipeline,
      ResultSink resultSink,
      MeterRegistry meterRegistry,
      StructureConfig structureConfig,
      @Qualifier("documentExecutor") Executor documentExecutor) {
    this.treeProviders = treeProviders;
    this.pipeline = pipeline;
    this.resultSink = resultSink;
    this.meterRegistry = meterRegistry;
    this.documentExecutor = documentExecutor;
    this.embeddingCache =
        new EmbeddingCache(structureConfig.getEmbedding().getCacheTtl(), Clock.systemUTC());
  }

  /**
   * Parses and analyses one document.
   *
   * @param documentId the document id
   * @param inputStream raw document content; not closed here
   * @param mimeType content type used to pick the tree provider
   * @return the result; its LAYOUT stage is FAILED when the content could not be parsed
   */
  @Timed(value = "structure.document.analyze", description = "Time to analyse one document")
  public PipelineResult analyze(String documentId, InputStream inputStream, String mimeType) {
    ParsedNode root;
    try {
      root = providerFor(documentId, mimeType).parse(documentId, inputStream, mimeType);
    } catch (ParsedTreeException e) {
      log.error("Could not parse document {}: {}", documentId, e.getMessage(), e);
      PipelineResult result = pipeline.layoutFailure(documentId, e);
      record(result);
      return result;
    }
    return analyze(new DocumentRequest(documentId, root));
  }

  /**
   * Analyses a document that has already been parsed.
   *
   * @param request the parsed document and any supplied images
   * @return the pipeline result
   */
  public PipelineResult analyze(DocumentRequest request) {
    int evicted = embeddingCache.evictExpired();
    if (evicted > 0) {
      log.debug("Evicted {} expired embeddings", evicted);
    }
    PipelineResult result = pipeline.process(request, embeddingCache);
    if (result.isCancelled()) {
      log.info("Document {} cancelled, nothing stored", request.documentId());
    } else {
      handOff(result);
    }
    record(result);
    return result;
  }

  /**
   * Analyses a parsed document on the document executor.
   *
   * @param request the parsed document
   * @return future completing with the pipeline result
   */
  @Async("documentExecutor")
  public CompletableFuture<PipelineResult> analyzeAsync(DocumentRequest request) {
    return CompletableFuture.completedFuture(analyze(request));
  }

  /**
   * Analyses independent documents in parallel and waits for all of them.
   *
   * @param requests the documents
   * @return results in request order
   */
  public List<PipelineResult> analyzeAll(List<DocumentRequest> requests) {
    List<CompletableFuture<PipelineResult>> futures =
        requests.stream()
            .map(request -> CompletableFuture.supplyAsync(() -> analyze(request), documentExecutor))
            .toList();
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  /** Number of embeddings currently cached. */
  public int cachedEmbeddings() {
    return embeddingCache.size();
  }

  private ParsedTreeProvider providerFor(String documentId, String mimeType) {
    return treeProviders.stream()
        .filter(provider -> provider.supports(mimeType))
        .findFirst()
        .orElseThrow(
            () -> new ParsedTreeException(documentId, "Unsupported content type: " + mimeType));
  }

  private void handOff(PipelineResult result) {
    try {
      resultSink.store(
          result.documentId(),
          result.chunks(),
          result.associations().associations(),
          result.metrics());
    } catch (RuntimeException e) {
      log.error(
          "Result sink failed for document {}: {}", result.documentId(), e.getMessage(), e);
      meterRegistry.counter("structure.sink.failure").increment();
    }
  }

  private void record(PipelineResult result) {
    if (result.isSuccessful()) {
      meterRegistry.counter("structure.document.success").increment();
    } else {
      meterRegistry.counter("structure.document.failure").increment();
    }
  }
}
