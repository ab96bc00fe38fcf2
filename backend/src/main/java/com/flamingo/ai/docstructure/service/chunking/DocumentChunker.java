package com.flamingo.ai.docstructure.service.chunking;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.layout.model.LayoutModel;
import java.util.List;

/**
 * Splits a {@link LayoutModel} into a list of {@link LayoutChunk}s.
 *
 * <p>Implementations must be stateless and safe for concurrent use. A chunker only chunks; it does
 * not classify or embed.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the layout model.
   *
   * @param layout the layout model
   * @param signal entity boundaries detected over the document's text units
   * @param config chunk sizes and policies
   * @return ordered list of chunks
   */
  List<LayoutChunk> chunk(
      LayoutModel layout, BoundarySignal signal, StructureConfig.Chunking config);
}
