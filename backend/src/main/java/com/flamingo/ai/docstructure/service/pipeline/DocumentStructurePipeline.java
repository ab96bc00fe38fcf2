package com.flamingo.ai.docstructure.service.pipeline;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.StageExecutionException;
import com.flamingo.ai.docstructure.service.association.AssociationReport;
import com.flamingo.ai.docstructure.service.association.AssociationTarget;
import com.flamingo.ai.docstructure.service.association.CrossModalAssociationEngine;
import com.flamingo.ai.docstructure.service.association.TargetMode;
import com.flamingo.ai.docstructure.service.boundary.BoundaryDetector;
import com.flamingo.ai.docstructure.service.boundary.BoundaryScore;
import com.flamingo.ai.docstructure.service.boundary.SemanticCluster;
import com.flamingo.ai.docstructure.service.boundary.SemanticClusterer;
import com.flamingo.ai.docstructure.service.chunking.BoundarySignal;
import com.flamingo.ai.docstructure.service.chunking.DocumentChunker;
import com.flamingo.ai.docstructure.service.chunking.LayoutChunk;
import com.flamingo.ai.docstructure.service.chunking.SizeFlag;
import com.flamingo.ai.docstructure.service.classification.ContentClassifier;
import com.flamingo.ai.docstructure.service.classification.EntityCandidate;
import com.flamingo.ai.docstructure.service.classification.TextUnit;
import com.flamingo.ai.docstructure.service.embedding.EmbeddingCache;
import com.flamingo.ai.docstructure.service.embedding.EmbeddingEnricher;
import com.flamingo.ai.docstructure.service.layout.LayoutModelBuilder;
import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import com.flamingo.ai.docstructure.service.layout.model.LayoutModel;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the structure stages for one document: layout, classification, embedding, boundary
 * detection, chunking and image association.
 *
 * <p>Each stage is isolated. A failing stage is logged, counted and reported as FAILED; later
 * stages run when their own inputs are still available and are SKIPPED otherwise. Nothing is
 * retried here. The thread's interrupt flag is checked before every stage; once set, the
 * remaining stages are SKIPPED and no partial output is handed on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStructurePipeline {

  private final LayoutModelBuilder layoutModelBuilder;
  private final ContentClassifier contentClassifier;
  private final EmbeddingEnricher embeddingEnricher;
  private final BoundaryDetector boundaryDetector;
  private final SemanticClusterer semanticClusterer;
  private final DocumentChunker documentChunker;
  private final CrossModalAssociationEngine associationEngine;
  private final StructureConfig structureConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Processes one document.
   *
   * @param request the parsed document
   * @param cache embedding cache owned by the caller; shared across that caller's documents
   * @return the result with one status per stage
   */
  @Timed(value = "structure.pipeline.process", description = "Time to run all structure stages")
  public PipelineResult process(DocumentRequest request, EmbeddingCache cache) {
    Run run = new Run(request.documentId());

    run.stage(
        PipelineStage.LAYOUT,
        () -> {
          run.layout =
              layoutModelBuilder.build(request.documentId(), request.root(), request.images());
          run.images = run.layout.images();
          return run.layout.elements().size()
              + " elements, "
              + run.layout.images().size()
              + " images";
        });

    if (run.layout == null) {
      run.skipRemaining("layout unavailable");
      return run.result();
    }

    run.stage(
        PipelineStage.CLASSIFICATION,
        () -> {
          run.units = contentClassifier.toTextUnits(run.layout);
          run.entities = contentClassifier.classifyAll(run.units);
          return run.units.size() + " units, " + run.entities.size() + " entities";
        });

    if (!embeddingEnricher.isEnabled()) {
      run.skip(PipelineStage.EMBEDDING, "embeddings disabled");
    } else if (run.units == null) {
      run.skip(PipelineStage.EMBEDDING, "text units unavailable");
    } else {
      run.stage(PipelineStage.EMBEDDING, () -> embed(run, cache));
    }

    if (run.units == null) {
      run.skip(PipelineStage.BOUNDARY, "text units unavailable");
    } else {
      run.stage(
          PipelineStage.BOUNDARY,
          () -> {
            run.boundaries = boundaryDetector.detect(run.units);
            run.clusters =
                structureConfig.getBoundary().isClusteringEnabled()
                    ? semanticClusterer.cluster(run.units)
                    : List.of();
            long entityBoundaries =
                run.boundaries.stream().filter(BoundaryScore::entityBoundary).count();
            return run.boundaries.size()
                + " boundaries ("
                + entityBoundaries
                + " entity), "
                + run.clusters.size()
                + " clusters";
          });
    }

    run.stage(
        PipelineStage.CHUNKING,
        () -> {
          BoundarySignal signal =
              run.boundaries == null
                  ? BoundarySignal.none()
                  : BoundarySignal.from(run.units, run.boundaries);
          run.chunks = documentChunker.chunk(run.layout, signal, structureConfig.getChunking());
          return run.chunks.size() + " chunks";
        });

    List<? extends AssociationTarget> targets = selectTargets(run);
    if (targets == null) {
      run.skip(PipelineStage.ASSOCIATION, "no association targets available");
    } else {
      run.stage(
          PipelineStage.ASSOCIATION,
          () -> {
            List<? extends AssociationTarget> scored = targets;
            if (scored == run.chunks && embeddingEnricher.isEnabled() && !run.images.isEmpty()) {
              run.chunks = embeddingEnricher.enrichChunks(run.chunks, cache);
              scored = run.chunks;
            }
            run.associations = associationEngine.associate(run.images, scored);
            return run.associations.associations().size()
                + " associations from "
                + run.associations.totalEvaluated()
                + " pairs";
          });
    }

    PipelineResult result = run.result();
    log.info(
        "Processed document {}: {} chunks, {} associations, quality {}, failed stages {}",
        result.documentId(),
        result.metrics().chunkCount(),
        result.metrics().associationCount(),
        String.format(Locale.ROOT, "%.3f", result.metrics().overallQuality()),
        result.failedStages());
    return result;
  }

  /**
   * Builds the result for a document whose tree could not be produced: LAYOUT failed, everything
   * else skipped.
   */
  public PipelineResult layoutFailure(String documentId, Throwable cause) {
    Run run = new Run(documentId);
    run.fail(PipelineStage.LAYOUT, cause, 0L);
    run.skipRemaining("layout unavailable");
    return run.result();
  }

  private String embed(Run run, EmbeddingCache cache) {
    run.units = embeddingEnricher.enrichUnits(run.units, cache);
    run.images = embeddingEnricher.enrichImages(run.images, cache);

    Map<String, float[]> unitVectors =
        run.units.stream()
            .filter(TextUnit::hasEmbedding)
            .collect(Collectors.toMap(TextUnit::id, TextUnit::embedding, (a, b) -> a));
    if (run.entities != null) {
      run.entities =
          run.entities.stream()
              .map(
                  entity -> {
                    float[] vector = unitVectors.get(entity.unitId());
                    return vector == null || entity.embedding() != null
                        ? entity
                        : entity.withEmbedding(vector);
                  })
              .toList();
    }
    long embeddedImages = run.images.stream().filter(ImageAsset::hasEmbedding).count();
    return unitVectors.size()
        + "/"
        + run.units.size()
        + " units, "
        + embeddedImages
        + "/"
        + run.images.size()
        + " images embedded";
  }

  /** Resolves the configured target mode against what the earlier stages produced. */
  private List<? extends AssociationTarget> selectTargets(Run run) {
    TargetMode mode = structureConfig.getAssociation().getTargetMode();
    return switch (mode) {
      case ENTITIES -> run.entities;
      case CHUNKS -> run.chunks;
      case AUTO -> {
        if (run.entities != null && !run.entities.isEmpty()) {
          yield run.entities;
        }
        yield run.chunks != null ? run.chunks : run.entities;
      }
    };
  }

  QualityMetrics metrics(
      LayoutModel layout, List<LayoutChunk> chunks, AssociationReport associations) {
    List<Double> components = new ArrayList<>();

    double layoutConfidence = 0.0;
    if (layout != null && !layout.isEmpty()) {
      layoutConfidence = layout.confidence();
      components.add(layoutConfidence);
    }

    double chunkQuality = 0.0;
    int undersized = 0;
    int oversized = 0;
    if (chunks != null && !chunks.isEmpty()) {
      chunkQuality = chunkQuality(chunks);
      components.add(chunkQuality);
      undersized = (int) chunks.stream().filter(c -> c.sizeFlag() == SizeFlag.UNDERSIZED).count();
      oversized = (int) chunks.stream().filter(c -> c.sizeFlag() == SizeFlag.OVERSIZED).count();
    }

    double associationConfidence = 0.0;
    int associationCount = 0;
    if (associations != null && !associations.associations().isEmpty()) {
      associationConfidence = associations.averageConfidence();
      associationCount = associations.associations().size();
      components.add(associationConfidence);
    }

    double overall = components.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    return new QualityMetrics(
        layoutConfidence,
        chunkQuality,
        associationConfidence,
        overall,
        chunks == null ? 0 : chunks.size(),
        associationCount,
        undersized,
        oversized);
  }

  /** {@code max(0, 1 - stddev / mean)} of the chunk sizes. */
  static double chunkQuality(List<LayoutChunk> chunks) {
    double mean = chunks.stream().mapToInt(LayoutChunk::characterCount).average().orElse(0.0);
    if (mean <= 0.0) {
      return 0.0;
    }
    double variance =
        chunks.stream()
            .mapToDouble(c -> (c.characterCount() - mean) * (c.characterCount() - mean))
            .average()
            .orElse(0.0);
    return Math.max(0.0, 1.0 - Math.sqrt(variance) / mean);
  }

  /** Mutable state of one run. Never shared between threads. */
  private final class Run {
    private final String documentId;
    private final Map<PipelineStage, StageStatus> statuses = new EnumMap<>(PipelineStage.class);
    private boolean cancelled;

    private LayoutModel layout;
    private List<ImageAsset> images = List.of();
    private List<TextUnit> units;
    private List<EntityCandidate> entities;
    private List<BoundaryScore> boundaries;
    private List<SemanticCluster> clusters;
    private List<LayoutChunk> chunks;
    private AssociationReport associations;

    private Run(String documentId) {
      this.documentId = documentId;
    }

    void stage(PipelineStage stage, Supplier<String> body) {
      if (cancelled || Thread.currentThread().isInterrupted()) {
        if (!cancelled) {
          log.info("Document {} interrupted before stage {}", documentId, stage);
        }
        cancelled = true;
        skip(stage, PipelineResult.CANCELLED);
        return;
      }
      long start = System.nanoTime();
      try {
        String summary = body.get();
        long elapsed = elapsedMillis(start);
        statuses.put(stage, StageStatus.succeeded(stage, summary, elapsed));
        log.debug("Document {} stage {} done in {} ms: {}", documentId, stage, elapsed, summary);
      } catch (RuntimeException e) {
        fail(stage, e, elapsedMillis(start));
      }
    }

    void fail(PipelineStage stage, Throwable cause, long elapsed) {
      StageExecutionException failure =
          new StageExecutionException(stage, documentId, cause.getMessage(), cause);
      log.error(
          "{} for document {}: {}",
          failure.getUserMessage(),
          documentId,
          cause.getMessage(),
          cause);
      meterRegistry
          .counter("structure.stage.failure", "stage", stage.name().toLowerCase(Locale.ROOT))
          .increment();
      statuses.put(
          stage, StageStatus.failed(stage, failure.getUserMessage() + ": " + cause, elapsed));
    }

    void skip(PipelineStage stage, String reason) {
      if (cancelled && !PipelineResult.CANCELLED.equals(reason)) {
        reason = PipelineResult.CANCELLED;
      }
      statuses.put(stage, StageStatus.skipped(stage, reason));
      log.debug("Document {} stage {} skipped: {}", documentId, stage, reason);
    }

    void skipRemaining(String reason) {
      for (PipelineStage stage : PipelineStage.values()) {
        if (!statuses.containsKey(stage)) {
          skip(stage, reason);
        }
      }
    }

    PipelineResult result() {
      skipRemaining("not reached");
      List<StageStatus> ordered = List.copyOf(statuses.values());
      if (cancelled) {
        return new PipelineResult(
            documentId, layout, null, null, null, null, null, ordered, QualityMetrics.empty());
      }
      return new PipelineResult(
          documentId,
          layout,
          entities,
          boundaries,
          clusters,
          chunks,
          associations,
          ordered,
          metrics(layout, chunks, associations));
    }
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }
}
