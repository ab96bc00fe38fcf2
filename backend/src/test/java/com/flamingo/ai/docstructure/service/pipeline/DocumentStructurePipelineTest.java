package com.flamingo.ai.docstructure.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.ParsedTreeException;
import com.flamingo.ai.docstructure.service.association.AssociationReport;
import com.flamingo.ai.docstructure.service.association.CrossModalAssociationEngine;
import com.flamingo.ai.docstructure.service.association.GreedyFanOutAssignment;
import com.flamingo.ai.docstructure.service.association.TargetMode;
import com.flamingo.ai.docstructure.service.boundary.BoundaryDetector;
import com.flamingo.ai.docstructure.service.boundary.SemanticClusterer;
import com.flamingo.ai.docstructure.service.chunking.ChunkType;
import com.flamingo.ai.docstructure.service.chunking.LayoutAwareChunker;
import com.flamingo.ai.docstructure.service.chunking.LayoutChunk;
import com.flamingo.ai.docstructure.service.chunking.SizeFlag;
import com.flamingo.ai.docstructure.service.classification.ContentClassifier;
import com.flamingo.ai.docstructure.service.classification.PayloadExtractor;
import com.flamingo.ai.docstructure.service.embedding.DisabledEmbeddingProvider;
import com.flamingo.ai.docstructure.service.embedding.EmbeddingCache;
import com.flamingo.ai.docstructure.service.embedding.EmbeddingEnricher;
import com.flamingo.ai.docstructure.service.layout.LayoutModelBuilder;
import com.flamingo.ai.docstructure.service.layout.model.BoundingBox;
import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentStructurePipeline Tests")
class DocumentStructurePipelineTest {

  private static final String CATALOG_TEXT =
      "LOUNGE CHAIR by Marta Ruiz. Dimensions: 80 x 75 x 90 cm. Available in oak and walnut,"
          + " natural or black finish. A comfortable chair designed for long afternoons.";

  private StructureConfig config;
  private SimpleMeterRegistry meterRegistry;
  private EmbeddingCache cache;

  @BeforeEach
  void setUp() {
    config = new StructureConfig();
    meterRegistry = new SimpleMeterRegistry();
    cache = new EmbeddingCache(Duration.ofHours(1), Clock.systemUTC());
  }

  private DocumentStructurePipeline pipeline(
      ContentClassifier classifier, CrossModalAssociationEngine engine) {
    return new DocumentStructurePipeline(
        new LayoutModelBuilder(config),
        classifier,
        new EmbeddingEnricher(new DisabledEmbeddingProvider(), Runnable::run),
        new BoundaryDetector(config),
        new SemanticClusterer(config),
        new LayoutAwareChunker(),
        engine,
        config,
        meterRegistry);
  }

  private DocumentStructurePipeline pipeline() {
    return pipeline(
        new ContentClassifier(config, new PayloadExtractor()),
        new CrossModalAssociationEngine(config, new GreedyFanOutAssignment()));
  }

  private static DocumentRequest catalogRequest() {
    ParsedNode body =
        ParsedNode.of(
            "body",
            Map.of(),
            List.of(
                ParsedNode.of("h1", "Lounge collection"),
                ParsedNode.of("p", CATALOG_TEXT),
                new ParsedNode("img", Map.of("alt", "Lounge chair in natural oak"), "", List.of()),
                ParsedNode.of("h2", "Care"),
                ParsedNode.of("p", "Wipe with a soft dry cloth and keep away from direct sun.")));
    return new DocumentRequest("catalog", body);
  }

  private static LayoutChunk chunk(int index, int size, SizeFlag flag) {
    String text = "x".repeat(size);
    return new LayoutChunk(
        "doc_" + index, index, "sec-1", "", ChunkType.PARAGRAPH, text, List.of("el-" + index),
        List.of(), 1, 1, BoundingBox.EMPTY, List.of(), 0.9, size, 1, 0, false, flag, null);
  }

  @Nested
  @DisplayName("Stage flow")
  class StageFlow {

    @Test
    @DisplayName("should run every stage and skip embeddings when they are disabled")
    void shouldRunEveryStage_whenEmbeddingsDisabled() {
      PipelineResult result = pipeline().process(catalogRequest(), cache);

      assertThat(result.state(PipelineStage.LAYOUT)).isEqualTo(StageState.SUCCEEDED);
      assertThat(result.state(PipelineStage.CLASSIFICATION)).isEqualTo(StageState.SUCCEEDED);
      assertThat(result.state(PipelineStage.EMBEDDING)).isEqualTo(StageState.SKIPPED);
      assertThat(result.state(PipelineStage.BOUNDARY)).isEqualTo(StageState.SUCCEEDED);
      assertThat(result.state(PipelineStage.CHUNKING)).isEqualTo(StageState.SUCCEEDED);
      assertThat(result.state(PipelineStage.ASSOCIATION)).isEqualTo(StageState.SUCCEEDED);
      assertThat(result.isSuccessful()).isTrue();
      assertThat(result.isCancelled()).isFalse();
      assertThat(result.stageStatuses())
          .extracting(StageStatus::stage)
          .containsExactly(PipelineStage.values());
    }

    @Test
    @DisplayName("should produce chunks and metrics for the document")
    void shouldProduceChunksAndMetrics() {
      PipelineResult result = pipeline().process(catalogRequest(), cache);

      assertThat(result.layout().title()).isEqualTo("Lounge collection");
      assertThat(result.chunks()).isNotEmpty();
      assertThat(result.chunks()).allSatisfy(c -> assertThat(c.id()).startsWith("catalog_"));
      assertThat(result.metrics().chunkCount()).isEqualTo(result.chunks().size());
      assertThat(result.metrics().overallQuality()).isBetween(0.0, 1.0);
      assertThat(result.metrics().layoutConfidence()).isPositive();
    }

    @Test
    @DisplayName("should keep earlier outputs when association fails")
    void shouldKeepEarlierOutputs_whenAssociationFails() {
      CrossModalAssociationEngine engine = mock(CrossModalAssociationEngine.class);
      when(engine.associate(anyList(), anyList())).thenThrow(new IllegalStateException("boom"));

      PipelineResult result =
          pipeline(new ContentClassifier(config, new PayloadExtractor()), engine)
              .process(catalogRequest(), cache);

      assertThat(result.failedStages()).containsExactly(PipelineStage.ASSOCIATION);
      assertThat(result.status(PipelineStage.ASSOCIATION))
          .hasValueSatisfying(s -> assertThat(s.message()).startsWith("Stage association failed"));
      assertThat(result.chunks()).isNotEmpty();
      assertThat(result.associations().associations()).isEmpty();
      assertThat(
              meterRegistry.counter("structure.stage.failure", "stage", "association").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip dependent stages but still chunk when classification fails")
    void shouldStillChunk_whenClassificationFails() {
      ContentClassifier classifier = mock(ContentClassifier.class);
      when(classifier.toTextUnits(any())).thenThrow(new IllegalStateException("broken"));

      PipelineResult result =
          pipeline(
                  classifier,
                  new CrossModalAssociationEngine(config, new GreedyFanOutAssignment()))
              .process(catalogRequest(), cache);

      assertThat(result.state(PipelineStage.CLASSIFICATION)).isEqualTo(StageState.FAILED);
      assertThat(result.state(PipelineStage.BOUNDARY)).isEqualTo(StageState.SKIPPED);
      assertThat(result.state(PipelineStage.CHUNKING)).isEqualTo(StageState.SUCCEEDED);
      assertThat(result.state(PipelineStage.ASSOCIATION)).isEqualTo(StageState.SUCCEEDED);
      assertThat(result.entities()).isEmpty();
      assertThat(result.chunks()).isNotEmpty();
    }

    @Test
    @DisplayName("should report a layout failure and skip everything else")
    void shouldReportLayoutFailure() {
      PipelineResult result =
          pipeline().layoutFailure("doc", new ParsedTreeException("doc", "not a document"));

      assertThat(result.failedStages()).containsExactly(PipelineStage.LAYOUT);
      assertThat(result.stageStatuses())
          .filteredOn(s -> s.stage() != PipelineStage.LAYOUT)
          .allSatisfy(
              s -> {
                assertThat(s.state()).isEqualTo(StageState.SKIPPED);
                assertThat(s.message()).isEqualTo("layout unavailable");
              });
      assertThat(result.isCancelled()).isFalse();
      assertThat(result.metrics()).isEqualTo(QualityMetrics.empty());
    }

    @Test
    @DisplayName("should skip every stage and hand on nothing when interrupted")
    void shouldSkipEveryStage_whenInterrupted() {
      PipelineResult result;
      Thread.currentThread().interrupt();
      try {
        result = pipeline().process(catalogRequest(), cache);
      } finally {
        Thread.interrupted();
      }

      assertThat(result.isCancelled()).isTrue();
      assertThat(result.isSuccessful()).isTrue();
      assertThat(result.stageStatuses())
          .allSatisfy(s -> assertThat(s.state()).isEqualTo(StageState.SKIPPED));
      assertThat(result.chunks()).isEmpty();
      assertThat(result.layout()).isNull();
    }

    @Test
    @DisplayName("should use chunks as targets in chunk mode")
    void shouldUseChunks_inChunkMode() {
      config.getAssociation().setTargetMode(TargetMode.CHUNKS);
      config.getAssociation().setOverallThreshold(0.0);

      PipelineResult result = pipeline().process(catalogRequest(), cache);

      assertThat(result.associations().associations())
          .isNotEmpty()
          .allSatisfy(a -> assertThat(a.targetId()).startsWith("catalog_"));
    }
  }

  @Nested
  @DisplayName("Quality metrics")
  class Metrics {

    @Test
    @DisplayName("should rate uniform chunk sizes as full quality")
    void shouldRateUniformSizes() {
      List<LayoutChunk> chunks =
          List.of(chunk(0, 100, SizeFlag.WITHIN_BOUNDS), chunk(1, 100, SizeFlag.WITHIN_BOUNDS));

      assertThat(DocumentStructurePipeline.chunkQuality(chunks)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should lower quality with the spread of chunk sizes")
    void shouldLowerQuality_withSpread() {
      List<LayoutChunk> chunks =
          List.of(chunk(0, 50, SizeFlag.WITHIN_BOUNDS), chunk(1, 150, SizeFlag.WITHIN_BOUNDS));

      assertThat(DocumentStructurePipeline.chunkQuality(chunks)).isEqualTo(0.5, offset(1e-9));
    }

    @Test
    @DisplayName("should average only the available components")
    void shouldAverageAvailableComponents() {
      QualityMetrics metrics =
          pipeline()
              .metrics(
                  null,
                  List.of(chunk(0, 50, SizeFlag.UNDERSIZED), chunk(1, 150, SizeFlag.OVERSIZED)),
                  AssociationReport.empty());

      assertThat(metrics.layoutConfidence()).isZero();
      assertThat(metrics.overallQuality()).isEqualTo(0.5, offset(1e-9));
      assertThat(metrics.undersizedChunks()).isEqualTo(1);
      assertThat(metrics.oversizedChunks()).isEqualTo(1);
      assertThat(metrics.chunkCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should report zero quality when nothing is available")
    void shouldReportZero_whenNothingAvailable() {
      assertThat(pipeline().metrics(null, List.of(), null).overallQuality()).isZero();
    }
  }
}
