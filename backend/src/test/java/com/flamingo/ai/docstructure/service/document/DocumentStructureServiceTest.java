package com.flamingo.ai.docstructure.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.ParsedTreeException;
import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import com.flamingo.ai.docstructure.service.layout.parsing.ParsedTreeProvider;
import com.flamingo.ai.docstructure.service.pipeline.DocumentRequest;
import com.flamingo.ai.docstructure.service.pipeline.DocumentStructurePipeline;
import com.flamingo.ai.docstructure.service.pipeline.PipelineResult;
import com.flamingo.ai.docstructure.service.pipeline.PipelineStage;
import com.flamingo.ai.docstructure.service.pipeline.QualityMetrics;
import com.flamingo.ai.docstructure.service.pipeline.ResultSink;
import com.flamingo.ai.docstructure.service.pipeline.StageStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentStructureService Tests")
class DocumentStructureServiceTest {

  private static final String HTML = "text/html";

  @Mock private ParsedTreeProvider treeProvider;
  @Mock private DocumentStructurePipeline pipeline;
  @Mock private ResultSink resultSink;

  private SimpleMeterRegistry meterRegistry;
  private DocumentStructureService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    Executor direct = Runnable::run;
    lenient().when(treeProvider.supports(HTML)).thenReturn(true);
    service =
        new DocumentStructureService(
            List.of(treeProvider),
            pipeline,
            resultSink,
            meterRegistry,
            new StructureConfig(),
            direct);
  }

  private static PipelineResult succeeded(String documentId) {
    List<StageStatus> statuses =
        Arrays.stream(PipelineStage.values())
            .map(stage -> StageStatus.succeeded(stage, "ok", 1L))
            .toList();
    return new PipelineResult(
        documentId, null, null, null, null, null, null, statuses, QualityMetrics.empty());
  }

  private static PipelineResult cancelled(String documentId) {
    List<StageStatus> statuses =
        Arrays.stream(PipelineStage.values())
            .map(stage -> StageStatus.skipped(stage, "cancelled"))
            .toList();
    return new PipelineResult(
        documentId, null, null, null, null, null, null, statuses, QualityMetrics.empty());
  }

  private static InputStream content() {
    return new ByteArrayInputStream("<p>x</p>".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("should parse, process and hand the result to the sink")
  void shouldParseProcessAndStore() {
    ParsedNode root = ParsedNode.of("body", "x");
    when(treeProvider.parse(eq("doc-1"), any(), eq(HTML))).thenReturn(root);
    when(pipeline.process(any(), any())).thenReturn(succeeded("doc-1"));

    PipelineResult result = service.analyze("doc-1", content(), HTML);

    assertThat(result.isSuccessful()).isTrue();
    ArgumentCaptor<DocumentRequest> request = ArgumentCaptor.forClass(DocumentRequest.class);
    verify(pipeline).process(request.capture(), any());
    assertThat(request.getValue().root()).isSameAs(root);
    verify(resultSink).store(eq("doc-1"), anyList(), anyList(), any());
    assertThat(meterRegistry.counter("structure.document.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should report a layout failure when the content cannot be parsed")
  void shouldReportLayoutFailure_whenParsingFails() {
    ParsedTreeException failure = new ParsedTreeException("doc-1", "corrupt");
    when(treeProvider.parse(eq("doc-1"), any(), eq(HTML))).thenThrow(failure);
    PipelineResult layoutFailed =
        new PipelineResult(
            "doc-1",
            null,
            null,
            null,
            null,
            null,
            null,
            List.of(StageStatus.failed(PipelineStage.LAYOUT, "Stage layout failed", 0L)),
            null);
    when(pipeline.layoutFailure("doc-1", failure)).thenReturn(layoutFailed);

    PipelineResult result = service.analyze("doc-1", content(), HTML);

    assertThat(result.failedStages()).containsExactly(PipelineStage.LAYOUT);
    verify(pipeline, never()).process(any(), any());
    verify(resultSink, never()).store(any(), anyList(), anyList(), any());
    assertThat(meterRegistry.counter("structure.document.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should treat an unsupported content type as a layout failure")
  void shouldFailLayout_forUnsupportedType() {
    when(pipeline.layoutFailure(eq("doc-2"), any(ParsedTreeException.class)))
        .thenReturn(succeeded("doc-2"));

    service.analyze("doc-2", content(), "application/x-unknown");

    ArgumentCaptor<Throwable> cause = ArgumentCaptor.forClass(Throwable.class);
    verify(pipeline).layoutFailure(eq("doc-2"), cause.capture());
    assertThat(cause.getValue()).hasMessageContaining("application/x-unknown");
  }

  @Test
  @DisplayName("should log and count a sink failure without failing the document")
  void shouldCountSinkFailure() {
    when(pipeline.process(any(), any())).thenReturn(succeeded("doc-1"));
    doThrow(new IllegalStateException("store down"))
        .when(resultSink)
        .store(any(), anyList(), anyList(), any());

    PipelineResult result = service.analyze(new DocumentRequest("doc-1", null));

    assertThat(result.isSuccessful()).isTrue();
    assertThat(meterRegistry.counter("structure.sink.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should not store anything for a cancelled document")
  void shouldNotStore_whenCancelled() {
    when(pipeline.process(any(), any())).thenReturn(cancelled("doc-1"));

    service.analyze(new DocumentRequest("doc-1", null));

    verify(resultSink, never()).store(any(), anyList(), anyList(), any());
  }

  @Test
  @DisplayName("should return results in request order")
  void shouldKeepRequestOrder() {
    when(pipeline.process(any(), any()))
        .thenAnswer(
            invocation -> succeeded(invocation.<DocumentRequest>getArgument(0).documentId()));

    List<PipelineResult> results =
        service.analyzeAll(
            List.of(
                new DocumentRequest("a", null),
                new DocumentRequest("b", null),
                new DocumentRequest("c", null)));

    assertThat(results).extracting(PipelineResult::documentId).containsExactly("a", "b", "c");
  }

  @Test
  @DisplayName("should complete the async variant with the result")
  void shouldCompleteAsyncVariant() {
    when(pipeline.process(any(), any())).thenReturn(succeeded("doc-1"));

    PipelineResult result = service.analyzeAsync(new DocumentRequest("doc-1", null)).join();

    assertThat(result.documentId()).isEqualTo("doc-1");
    assertThat(service.cachedEmbeddings()).isZero();
  }
}
