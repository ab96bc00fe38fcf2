package com.flamingo.ai.docstructure.service.association;

/**
 * Something an image can be associated with: a retained entity candidate or a text chunk.
 *
 * <p>The engine only reads these properties; it never inspects the concrete type.
 */
public interface AssociationTarget {

  String targetId();

  TargetKind targetKind();

  int pageNumber();

  /** Display name used for the literal name-match boost; {@code null} when the target has none. */
  String name();

  /** Free text compared against image captions and alt text. */
  String description();

  /** Text embedding, or {@code null} when none is available. */
  float[] embedding();
}
