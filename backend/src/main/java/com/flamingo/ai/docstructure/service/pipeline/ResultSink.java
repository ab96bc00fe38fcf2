package com.flamingo.ai.docstructure.service.pipeline;

import com.flamingo.ai.docstructure.service.association.Association;
import com.flamingo.ai.docstructure.service.chunking.LayoutChunk;
import java.util.List;

/** Receives the final outputs of a document for storage. */
public interface ResultSink {

  /**
   * Stores the outputs of one document.
   *
   * @param documentId the document
   * @param chunks final chunks, in order
   * @param associations assigned image associations
   * @param metrics aggregate quality metrics
   */
  void store(
      String documentId,
      List<LayoutChunk> chunks,
      List<Association> associations,
      QualityMetrics metrics);
}
