package com.flamingo.ai.docstructure.service.layout.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A heading-rooted region of the document.
 *
 * <p>A section's level is strictly lower than the level of each of its children.
 *
 * @param id section identifier
 * @param title heading text (empty for the implicit preamble section)
 * @param level heading level (1 = H1)
 * @param headingElementId element id of the heading, or {@code null} for the preamble
 * @param pageNumber page of the heading
 * @param elementIds every element after the heading up to the next heading of equal or higher
 *     level, in document order (includes subsection headings and their content)
 * @param children nested subsections
 */
public record Section(
    String id,
    String title,
    int level,
    String headingElementId,
    int pageNumber,
    List<String> elementIds,
    List<Section> children) {

  public Section {
    elementIds = List.copyOf(elementIds);
    children = List.copyOf(children);
  }

  /**
   * Element ids that belong to this section and not to any subsection's span.
   *
   * @return own elements in document order, heading excluded
   */
  public List<String> ownElementIds() {
    Set<String> nested = new HashSet<>();
    for (Section child : children) {
      if (child.headingElementId() != null) {
        nested.add(child.headingElementId());
      }
      nested.addAll(child.elementIds());
    }
    List<String> own = new ArrayList<>();
    for (String id : elementIds) {
      if (!nested.contains(id)) {
        own.add(id);
      }
    }
    return own;
  }

  /** This section followed by all descendants, depth-first in document order. */
  public List<Section> flatten() {
    List<Section> result = new ArrayList<>();
    result.add(this);
    for (Section child : children) {
      result.addAll(child.flatten());
    }
    return result;
  }
}
