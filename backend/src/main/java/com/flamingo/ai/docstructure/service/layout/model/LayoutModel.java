package com.flamingo.ai.docstructure.service.layout.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of the layout model builder: flat element list, section tree and page metadata.
 *
 * @param documentId document identifier
 * @param title document title
 * @param elements all elements in document order
 * @param sections top-level sections
 * @param images images found in the tree plus caller-supplied images
 * @param pageCount number of distinct pages (0 for an empty document)
 * @param confidence mean element confidence (0 for an empty document)
 */
public record LayoutModel(
    String documentId,
    String title,
    List<LayoutElement> elements,
    List<Section> sections,
    List<ImageAsset> images,
    int pageCount,
    double confidence) {

  public LayoutModel {
    elements = List.copyOf(elements);
    sections = List.copyOf(sections);
    images = List.copyOf(images);
  }

  public static LayoutModel empty(String documentId, List<ImageAsset> images) {
    return new LayoutModel(
        documentId, "Untitled Document", List.of(), List.of(), images, 0, 0.0);
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  /** Index of elements by id, preserving document order. */
  public Map<String, LayoutElement> elementsById() {
    Map<String, LayoutElement> index = new LinkedHashMap<>();
    for (LayoutElement element : elements) {
      index.put(element.id(), element);
    }
    return index;
  }

  public Optional<LayoutElement> element(String id) {
    return elements.stream().filter(e -> e.id().equals(id)).findFirst();
  }

  /** All sections, depth-first in document order. */
  public List<Section> allSections() {
    List<Section> result = new ArrayList<>();
    for (Section section : sections) {
      result.addAll(section.flatten());
    }
    return result;
  }
}
