package com.flamingo.ai.docstructure.service.chunking;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.layout.model.BoundingBox;
import com.flamingo.ai.docstructure.service.layout.model.ElementKind;
import com.flamingo.ai.docstructure.service.layout.model.LayoutElement;
import com.flamingo.ai.docstructure.service.layout.model.LayoutModel;
import com.flamingo.ai.docstructure.service.layout.model.Section;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that groups layout elements into chunks aligned to section boundaries.
 *
 * <p>Sections are visited depth-first. Each section's stream is its heading followed by the
 * elements that are not part of a subsection. Elements are consumed into a running chunk until a
 * forcing rule starts a new one: the target size would be exceeded, a heading arrives while
 * hierarchy is respected, the hierarchy level jumps by more than one, a table arrives, the page
 * changes, or the previous unit ended an entity.
 *
 * <p>The chunks of a section are then normalized to the size bounds. Oversized chunks are split at
 * paragraph boundaries ({@code \n\n}), then at sentence boundaries, then by character count.
 * Undersized chunks that are not last in their section are merged into a neighbour, or borrow text
 * from their successor when no merge fits. The size budget reserves room for the overlap prefix
 * added by the post-pass, so overlap never pushes a chunk past the maximum size.
 */
@Service
@Slf4j
public class LayoutAwareChunker implements DocumentChunker {

  private static final String SEPARATOR = "\n\n";
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

  /** One element's text, or part of it when the element had to be split. */
  private record Segment(LayoutElement element, String text) {}

  /** Chunk under construction. */
  private static final class Draft {
    private final List<Segment> segments = new ArrayList<>();
    private final List<String> imageIds = new ArrayList<>();

    /** Length of the joined text. */
    int length() {
      if (segments.isEmpty()) {
        return 0;
      }
      return contentLength() + SEPARATOR.length() * (segments.size() - 1);
    }

    /** Sum of the segment lengths, separators excluded. */
    int contentLength() {
      int total = 0;
      for (Segment segment : segments) {
        total += segment.text().length();
      }
      return total;
    }

    LayoutElement first() {
      return segments.get(0).element();
    }

    static Draft concat(Draft a, Draft b) {
      Draft merged = new Draft();
      merged.segments.addAll(a.segments);
      merged.segments.addAll(b.segments);
      merged.imageIds.addAll(a.imageIds);
      merged.imageIds.addAll(b.imageIds);
      return merged;
    }
  }

  private record SectionDrafts(Section section, List<Draft> drafts) {}

  @Override
  public List<LayoutChunk> chunk(
      LayoutModel layout, BoundarySignal signal, StructureConfig.Chunking config) {
    config.validate();
    if (layout == null || layout.isEmpty()) {
      return List.of();
    }
    BoundarySignal boundaries = signal == null ? BoundarySignal.none() : signal;
    Map<String, LayoutElement> elements = layout.elementsById();
    int budget = sizeBudget(config);

    List<SectionDrafts> perSection = new ArrayList<>();
    List<String> pendingImages = new ArrayList<>();
    for (Section section : layout.allSections()) {
      List<Draft> drafts =
          group(sectionStream(section, elements), boundaries, config, pendingImages);
      if (drafts.isEmpty()) {
        continue;
      }
      perSection.add(new SectionDrafts(section, normalize(drafts, config.getMinSize(), budget)));
    }

    // Images after the last text element of the document
    if (!pendingImages.isEmpty() && !perSection.isEmpty()) {
      List<Draft> last = perSection.get(perSection.size() - 1).drafts();
      last.get(last.size() - 1).imageIds.addAll(pendingImages);
    }

    List<LayoutChunk> chunks = toChunks(layout.documentId(), perSection);
    if (config.getOverlap() > 0) {
      chunks = applyOverlap(chunks, config.getOverlap());
    }
    chunks = validate(chunks, config);

    log.debug(
        "LayoutAwareChunker produced {} chunks from {} sections of document {}",
        chunks.size(),
        perSection.size(),
        layout.documentId());
    return chunks;
  }

  // ---- grouping ----

  private List<LayoutElement> sectionStream(Section section, Map<String, LayoutElement> elements) {
    List<LayoutElement> stream = new ArrayList<>();
    if (section.headingElementId() != null && elements.containsKey(section.headingElementId())) {
      stream.add(elements.get(section.headingElementId()));
    }
    for (String id : section.ownElementIds()) {
      LayoutElement element = elements.get(id);
      if (element != null) {
        stream.add(element);
      }
    }
    return stream;
  }

  private List<Draft> group(
      List<LayoutElement> stream,
      BoundarySignal boundaries,
      StructureConfig.Chunking config,
      List<String> pendingImages) {
    List<Draft> drafts = new ArrayList<>();
    Draft current = null;
    LayoutElement previous = null;

    for (LayoutElement element : stream) {
      if (element.kind() == ElementKind.IMAGE) {
        if (current != null) {
          current.imageIds.add(element.id());
        } else {
          pendingImages.add(element.id());
        }
        continue;
      }
      if (!element.hasText()) {
        continue;
      }
      if (shouldStartNewChunk(element, current, previous, boundaries, config)) {
        current = new Draft();
        current.imageIds.addAll(pendingImages);
        pendingImages.clear();
        drafts.add(current);
      }
      current.segments.add(new Segment(element, element.text()));
      previous = element;
    }
    return drafts;
  }

  private boolean shouldStartNewChunk(
      LayoutElement element,
      Draft current,
      LayoutElement previous,
      BoundarySignal boundaries,
      StructureConfig.Chunking config) {
    if (current == null) {
      return true;
    }
    if (current.contentLength() + element.text().length() > config.getTargetSize()) {
      return true;
    }
    if (config.isRespectHierarchy() && element.isHeading()) {
      return true;
    }
    LayoutElement first = current.first();
    if (Math.abs(element.hierarchyLevel() - first.hierarchyLevel()) > 1) {
      return true;
    }
    if (element.kind() == ElementKind.TABLE) {
      return true;
    }
    if (element.pageNumber() != first.pageNumber()) {
      return true;
    }
    return config.isSplitOnEntityBoundary()
        && previous != null
        && boundaries.endsEntity(previous.id());
  }

  // ---- size normalization ----

  private int sizeBudget(StructureConfig.Chunking config) {
    int overlap = config.getOverlap();
    return overlap > 0 ? config.getMaxSize() - overlap - SEPARATOR.length() : config.getMaxSize();
  }

  private List<Draft> normalize(List<Draft> drafts, int minSize, int budget) {
    List<Draft> sized = new ArrayList<>();
    for (Draft draft : drafts) {
      if (draft.length() > budget) {
        sized.addAll(splitDraft(draft, budget));
      } else {
        sized.add(draft);
      }
    }
    mergeUndersized(sized, minSize, budget);
    return sized;
  }

  private List<Draft> splitDraft(Draft draft, int budget) {
    List<Segment> pieces = new ArrayList<>();
    for (Segment segment : draft.segments) {
      if (segment.text().length() > budget) {
        for (String part : splitText(segment.text(), budget, 0)) {
          pieces.add(new Segment(segment.element(), part));
        }
      } else {
        pieces.add(segment);
      }
    }

    List<Draft> out = new ArrayList<>();
    Draft current = new Draft();
    current.imageIds.addAll(draft.imageIds);
    out.add(current);
    for (Segment piece : pieces) {
      if (!current.segments.isEmpty()
          && current.length() + SEPARATOR.length() + piece.text().length() > budget) {
        current = new Draft();
        out.add(current);
      }
      current.segments.add(piece);
    }
    return out;
  }

  /** Splits text to pieces no longer than {@code limit}: paragraphs, then sentences, then chars. */
  private List<String> splitText(String text, int limit, int level) {
    if (text.length() <= limit) {
      return List.of(text);
    }
    String[] parts;
    String joiner;
    if (level == 0) {
      parts = PARAGRAPH_BREAK.split(text);
      joiner = SEPARATOR;
    } else if (level == 1) {
      parts = SENTENCE_BREAK.split(text);
      joiner = " ";
    } else {
      return hardSplit(text, limit);
    }
    if (parts.length < 2) {
      return splitText(text, limit, level + 1);
    }

    List<String> out = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String part : parts) {
      String trimmed = part.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      List<String> subs =
          trimmed.length() > limit ? splitText(trimmed, limit, level + 1) : List.of(trimmed);
      for (String sub : subs) {
        if (current.length() > 0 && current.length() + joiner.length() + sub.length() > limit) {
          out.add(current.toString());
          current.setLength(0);
        }
        if (current.length() > 0) {
          current.append(joiner);
        }
        current.append(sub);
      }
    }
    if (current.length() > 0) {
      out.add(current.toString());
    }
    return out;
  }

  private List<String> hardSplit(String text, int limit) {
    List<String> out = new ArrayList<>();
    String remaining = text;
    while (remaining.length() > limit) {
      int cut = remaining.lastIndexOf(' ', limit);
      if (cut < limit / 2) {
        cut = limit;
      }
      String head = remaining.substring(0, cut).trim();
      if (!head.isEmpty()) {
        out.add(head);
      }
      remaining = remaining.substring(cut).trim();
    }
    if (!remaining.isEmpty()) {
      out.add(remaining);
    }
    return out;
  }

  private void mergeUndersized(List<Draft> drafts, int minSize, int budget) {
    int i = 0;
    while (i < drafts.size() - 1) {
      Draft draft = drafts.get(i);
      if (draft.length() >= minSize) {
        i++;
        continue;
      }
      Draft next = drafts.get(i + 1);
      if (draft.length() + SEPARATOR.length() + next.length() <= budget) {
        drafts.set(i, Draft.concat(draft, next));
        drafts.remove(i + 1);
        continue;
      }
      if (i > 0) {
        Draft previous = drafts.get(i - 1);
        if (previous.length() + SEPARATOR.length() + draft.length() <= budget) {
          drafts.set(i - 1, Draft.concat(previous, draft));
          drafts.remove(i);
          continue;
        }
      }
      List<Draft> rebalanced = borrowFromSuccessor(draft, next, minSize, budget);
      drafts.remove(i + 1);
      drafts.remove(i);
      drafts.addAll(i, rebalanced);
      i++;
    }
  }

  /** Moves text from the front of {@code next} into {@code draft} until it reaches the minimum. */
  private List<Draft> borrowFromSuccessor(Draft draft, Draft next, int minSize, int budget) {
    List<Segment> combined = new ArrayList<>(draft.segments);
    combined.addAll(next.segments);

    Draft head = new Draft();
    head.imageIds.addAll(draft.imageIds);
    Draft tail = new Draft();
    tail.imageIds.addAll(next.imageIds);

    int index = 0;
    while (index < combined.size() && head.length() < minSize) {
      Segment segment = combined.get(index++);
      int separator = head.segments.isEmpty() ? 0 : SEPARATOR.length();
      if (head.length() + separator + segment.text().length() <= budget) {
        head.segments.add(segment);
        continue;
      }
      int need = minSize - head.length() - separator;
      int cut = segment.text().indexOf(' ', Math.max(1, need));
      if (cut < 0) {
        cut = Math.min(Math.max(1, need), segment.text().length());
      }
      head.segments.add(new Segment(segment.element(), segment.text().substring(0, cut).trim()));
      String rest = segment.text().substring(cut).trim();
      if (!rest.isEmpty()) {
        tail.segments.add(new Segment(segment.element(), rest));
      }
      break;
    }
    while (index < combined.size()) {
      tail.segments.add(combined.get(index++));
    }

    if (tail.segments.isEmpty()) {
      head.imageIds.addAll(tail.imageIds);
      return new ArrayList<>(List.of(head));
    }
    return new ArrayList<>(List.of(head, tail));
  }

  // ---- chunk assembly ----

  private List<LayoutChunk> toChunks(String documentId, List<SectionDrafts> perSection) {
    List<LayoutChunk> chunks = new ArrayList<>();
    for (SectionDrafts entry : perSection) {
      List<Draft> drafts = entry.drafts();
      for (int k = 0; k < drafts.size(); k++) {
        chunks.add(
            toChunk(documentId, chunks.size(), entry.section(), drafts.get(k),
                k == drafts.size() - 1));
      }
    }
    return chunks;
  }

  private LayoutChunk toChunk(
      String documentId, int index, Section section, Draft draft, boolean finalInSection) {
    Map<String, LayoutElement> distinct = new LinkedHashMap<>();
    List<String> texts = new ArrayList<>();
    for (Segment segment : draft.segments) {
      distinct.putIfAbsent(segment.element().id(), segment.element());
      texts.add(segment.text());
    }
    String text = String.join(SEPARATOR, texts);

    Set<ElementKind> kinds = new LinkedHashSet<>();
    Set<String> tags = new LinkedHashSet<>();
    BoundingBox box = BoundingBox.EMPTY;
    double confidence = 0.0;
    int n = 0;
    for (LayoutElement element : distinct.values()) {
      kinds.add(element.kind() == ElementKind.CONTAINER ? ElementKind.PARAGRAPH : element.kind());
      tags.addAll(element.semanticTags());
      box = box.merge(element.boundingBox());
      n++;
      confidence = (confidence * (n - 1) + element.confidence()) / n;
    }

    LayoutElement first = draft.first();
    return new LayoutChunk(
        documentId + "_" + index,
        index,
        section.id(),
        section.title(),
        chunkType(kinds),
        text,
        new ArrayList<>(distinct.keySet()),
        new ArrayList<>(new LinkedHashSet<>(draft.imageIds)),
        first.hierarchyLevel(),
        first.pageNumber(),
        box,
        new ArrayList<>(tags),
        confidence,
        text.length(),
        LayoutChunk.countWords(text),
        0,
        finalInSection,
        SizeFlag.WITHIN_BOUNDS,
        null);
  }

  private ChunkType chunkType(Set<ElementKind> kinds) {
    if (kinds.size() != 1) {
      return ChunkType.MIXED;
    }
    return switch (kinds.iterator().next()) {
      case HEADING -> ChunkType.HEADING;
      case TABLE -> ChunkType.TABLE;
      case LIST -> ChunkType.LIST;
      default -> ChunkType.PARAGRAPH;
    };
  }

  // ---- post-passes ----

  /** Prefixes every chunk after the first with the trailing characters of its predecessor. */
  private List<LayoutChunk> applyOverlap(List<LayoutChunk> chunks, int overlap) {
    List<LayoutChunk> out = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      if (i == 0) {
        out.add(chunks.get(i));
        continue;
      }
      String previous = chunks.get(i - 1).text();
      String tail = previous.substring(Math.max(0, previous.length() - overlap));
      out.add(chunks.get(i).withOverlap(tail));
    }
    return out;
  }

  private List<LayoutChunk> validate(List<LayoutChunk> chunks, StructureConfig.Chunking config) {
    List<LayoutChunk> out = new ArrayList<>(chunks.size());
    for (LayoutChunk chunk : chunks) {
      int size = chunk.characterCount();
      if (size < config.getMinSize()) {
        log.warn(
            "Chunk {} is undersized: {} chars (min {}){}",
            chunk.id(),
            size,
            config.getMinSize(),
            chunk.finalInSection() ? ", last in section" : "");
        out.add(chunk.withSizeFlag(SizeFlag.UNDERSIZED, "undersized"));
      } else if (size > config.getMaxSize()) {
        log.warn("Chunk {} is oversized: {} chars (max {})", chunk.id(), size,
            config.getMaxSize());
        out.add(chunk.withSizeFlag(SizeFlag.OVERSIZED, "oversized"));
      } else {
        out.add(chunk);
      }
    }
    return out;
  }
}
