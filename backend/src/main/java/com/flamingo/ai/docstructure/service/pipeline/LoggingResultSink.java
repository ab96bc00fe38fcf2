package com.flamingo.ai.docstructure.service.pipeline;

import com.flamingo.ai.docstructure.service.association.Association;
import com.flamingo.ai.docstructure.service.chunking.LayoutChunk;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default sink: logs a summary of each document and keeps nothing. */
@Component
@Slf4j
public class LoggingResultSink implements ResultSink {

  @Override
  public void store(
      String documentId,
      List<LayoutChunk> chunks,
      List<Association> associations,
      QualityMetrics metrics) {
    log.info(
        "Document {}: {} chunks ({} undersized, {} oversized), {} associations, quality {}",
        documentId,
        chunks.size(),
        metrics.undersizedChunks(),
        metrics.oversizedChunks(),
        associations.size(),
        String.format("%.3f", metrics.overallQuality()));
    if (log.isDebugEnabled()) {
      for (LayoutChunk chunk : chunks) {
        log.debug(
            "  chunk {} [{}] page={} chars={} flag={}",
            chunk.id(),
            chunk.chunkType(),
            chunk.pageNumber(),
            chunk.characterCount(),
            chunk.sizeFlag());
      }
    }
  }
}
