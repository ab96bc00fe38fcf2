package com.flamingo.ai.docstructure.service.chunking;

import com.flamingo.ai.docstructure.service.association.AssociationTarget;
import com.flamingo.ai.docstructure.service.association.TargetKind;
import com.flamingo.ai.docstructure.service.layout.model.BoundingBox;
import java.util.ArrayList;
import java.util.List;

/**
 * A size-bounded run of elements from one section.
 *
 * @param id chunk identifier, {@code documentId + "_" + chunkIndex}
 * @param chunkIndex position in the document's chunk list
 * @param sectionId owning section
 * @param sectionTitle owning section's title (empty for the preamble)
 * @param chunkType dominant element kind
 * @param text chunk text, overlap prefix included
 * @param elementIds contributing text elements in document order
 * @param imageIds image elements that fell inside the chunk
 * @param hierarchyLevel hierarchy level of the first element
 * @param pageNumber page of the first element
 * @param boundingBox union of the element boxes
 * @param semanticTags union of element tags plus any size tag
 * @param confidence running average of element confidences
 * @param characterCount length of {@code text}
 * @param wordCount whitespace-separated words in {@code text}
 * @param overlapLength characters copied from the previous chunk
 * @param finalInSection whether this is the section's last chunk
 * @param sizeFlag size validation outcome
 * @param embedding text embedding, or {@code null}
 */
public record LayoutChunk(
    String id,
    int chunkIndex,
    String sectionId,
    String sectionTitle,
    ChunkType chunkType,
    String text,
    List<String> elementIds,
    List<String> imageIds,
    int hierarchyLevel,
    int pageNumber,
    BoundingBox boundingBox,
    List<String> semanticTags,
    double confidence,
    int characterCount,
    int wordCount,
    int overlapLength,
    boolean finalInSection,
    SizeFlag sizeFlag,
    float[] embedding)
    implements AssociationTarget {

  public LayoutChunk {
    elementIds = List.copyOf(elementIds);
    imageIds = List.copyOf(imageIds);
    semanticTags = List.copyOf(semanticTags);
  }

  /** Prefixes the chunk with the tail of its predecessor. */
  LayoutChunk withOverlap(String prefix) {
    String merged = prefix + "\n\n" + text;
    return new LayoutChunk(
        id, chunkIndex, sectionId, sectionTitle, chunkType, merged, elementIds, imageIds,
        hierarchyLevel, pageNumber, boundingBox, semanticTags, confidence, merged.length(),
        countWords(merged), prefix.length(), finalInSection, sizeFlag, embedding);
  }

  LayoutChunk withSizeFlag(SizeFlag flag, String tag) {
    List<String> tags = new ArrayList<>(semanticTags);
    if (tag != null && !tags.contains(tag)) {
      tags.add(tag);
    }
    return new LayoutChunk(
        id, chunkIndex, sectionId, sectionTitle, chunkType, text, elementIds, imageIds,
        hierarchyLevel, pageNumber, boundingBox, tags, confidence, characterCount, wordCount,
        overlapLength, finalInSection, flag, embedding);
  }

  public LayoutChunk withEmbedding(float[] vector) {
    return new LayoutChunk(
        id, chunkIndex, sectionId, sectionTitle, chunkType, text, elementIds, imageIds,
        hierarchyLevel, pageNumber, boundingBox, semanticTags, confidence, characterCount,
        wordCount, overlapLength, finalInSection, sizeFlag, vector);
  }

  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  static int countWords(String value) {
    String trimmed = value.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  @Override
  public String targetId() {
    return id;
  }

  @Override
  public TargetKind targetKind() {
    return TargetKind.CHUNK;
  }

  @Override
  public String name() {
    return sectionTitle == null || sectionTitle.isBlank() ? null : sectionTitle;
  }

  @Override
  public String description() {
    return text;
  }
}
