package com.flamingo.ai.docstructure.service.layout;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.layout.model.BoundingBox;
import com.flamingo.ai.docstructure.service.layout.model.ElementKind;
import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import com.flamingo.ai.docstructure.service.layout.model.LayoutElement;
import com.flamingo.ai.docstructure.service.layout.model.LayoutModel;
import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import com.flamingo.ai.docstructure.service.layout.model.PositionSource;
import com.flamingo.ai.docstructure.service.layout.model.Section;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Converts a parsed element tree into a typed {@link LayoutModel}.
 *
 * <p>The tree is walked once in document order. Block-level nodes become {@link LayoutElement}s;
 * containers that hold other blocks are descended into instead. Headings then drive a second pass
 * that builds the {@link Section} tree: each heading's section spans every following element up
 * to the next heading of equal or higher level, and nests under the nearest open section with a
 * strictly lower level.
 *
 * <p>Position metadata is read from {@code data-bbox} and {@code data-page}; when absent the box is
 * estimated from the element kind and its order on the page, so a missing position never fails
 * the build.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LayoutModelBuilder {

  private static final Pattern HEADING_TAG = Pattern.compile("h([1-6])");
  private static final Pattern HEADING_CLASS = Pattern.compile("heading-([1-6])");

  private static final Set<String> SKIPPED_TAGS =
      Set.of("script", "style", "meta", "link", "noscript");

  private static final Set<String> PARAGRAPH_TAGS =
      Set.of("p", "blockquote", "pre", "figcaption", "li", "dd", "dt", "caption");

  /** Block-level wrappers. Inline tags such as {@code span} are not listed. */
  private static final Set<String> CONTAINER_TAGS =
      Set.of(
          "html", "body", "div", "section", "article", "main", "header", "footer", "aside", "nav",
          "figure", "dl");

  private static final List<String> CONTENT_KEYWORDS =
      List.of(
          "specification",
          "property",
          "material",
          "technical",
          "standard",
          "performance",
          "installation",
          "maintenance");

  private static final double DEFAULT_X = 50;
  private static final double DEFAULT_WIDTH = 500;
  private static final double PAGE_TOP = 100;
  private static final double VERTICAL_GAP = 10;

  private final StructureConfig structureConfig;

  /**
   * Builds the layout model for one document.
   *
   * @param documentId document identifier
   * @param root parsed tree root; {@code null} or an empty tree yields an empty model
   * @param suppliedImages caller-supplied images, merged with images found in the tree
   * @return the layout model
   */
  public LayoutModel build(String documentId, ParsedNode root, List<ImageAsset> suppliedImages) {
    List<ImageAsset> callerImages = suppliedImages == null ? List.of() : suppliedImages;
    if (root == null) {
      log.debug("No parsed tree for document {}, returning empty layout", documentId);
      return LayoutModel.empty(documentId, callerImages);
    }

    WalkState state = new WalkState();
    walk(root, 0, 1, false, state);

    if (state.elements.isEmpty()) {
      log.debug("Parsed tree for document {} has no layout elements", documentId);
      return LayoutModel.empty(documentId, mergeImages(state.images, callerImages));
    }

    List<Section> sections = buildSections(state.elements);
    List<ImageAsset> images = mergeImages(state.images, callerImages);

    Set<Integer> pages = new TreeSet<>();
    state.elements.forEach(e -> pages.add(e.pageNumber()));
    images.forEach(i -> pages.add(i.pageNumber()));

    double confidence =
        state.elements.stream().mapToDouble(LayoutElement::confidence).average().orElse(0.0);

    String title = resolveTitle(state);

    log.debug(
        "Layout for document {}: {} elements, {} top-level sections, {} images, {} pages",
        documentId,
        state.elements.size(),
        sections.size(),
        images.size(),
        pages.size());

    return new LayoutModel(
        documentId, title, state.elements, sections, images, pages.size(), confidence);
  }

  // ---- tree walk ----

  private void walk(
      ParsedNode node, int depth, int inheritedPage, boolean pageSet, WalkState state) {
    String tag = node.tag();
    if (SKIPPED_TAGS.contains(tag)) {
      return;
    }
    if ("head".equals(tag)) {
      // only the title is taken from the head
      node.children().stream()
          .filter(child -> "title".equals(child.tag()))
          .findFirst()
          .ifPresent(title -> captureTitle(title, state));
      return;
    }
    if ("title".equals(tag)) {
      captureTitle(node, state);
      return;
    }

    int page = inheritedPage;
    boolean explicitPage = pageSet;
    Integer dataPage = parsePage(node.attribute("data-page"));
    if (dataPage != null) {
      page = dataPage;
      explicitPage = true;
    } else if (node.hasClass("page")) {
      state.pageOrdinal++;
      page = state.pageOrdinal;
      explicitPage = true;
    } else if (!explicitPage && state.lastPage > 0) {
      page = state.lastPage;
    }

    ElementKind kind = classify(node);
    if (kind == null) {
      if (hasBlockChildren(node)) {
        if (!node.text().isBlank()) {
          emit(node, ElementKind.CONTAINER, node.text().trim(), depth, page, state);
        }
        for (ParsedNode child : node.children()) {
          walk(child, depth + 1, page, explicitPage, state);
        }
      } else {
        String text = node.textContent();
        if (!text.isBlank()) {
          emit(node, ElementKind.CONTAINER, text, depth, page, state);
        }
      }
      return;
    }

    String text = kind == ElementKind.IMAGE ? "" : node.textContent();
    if (kind != ElementKind.IMAGE && text.isBlank()) {
      return;
    }
    emit(node, kind, text, depth, page, state);
  }

  private void captureTitle(ParsedNode node, WalkState state) {
    if (state.documentTitle == null && !node.textContent().isBlank()) {
      state.documentTitle = node.textContent();
    }
  }

  /** Returns the element kind for block nodes, or {@code null} for containers and inline nodes. */
  private ElementKind classify(ParsedNode node) {
    String tag = node.tag();
    if (HEADING_TAG.matcher(tag).matches() || headingClassLevel(node) > 0) {
      return ElementKind.HEADING;
    }
    if ("img".equals(tag) || node.hasClass("material-image")) {
      return ElementKind.IMAGE;
    }
    if ("table".equals(tag) || node.hasClass("spec-table")) {
      return ElementKind.TABLE;
    }
    if ("ul".equals(tag) || "ol".equals(tag) || node.hasClass("property-list")) {
      return ElementKind.LIST;
    }
    if (PARAGRAPH_TAGS.contains(tag) || node.hasClass("paragraph") || node.hasClass("caption")) {
      return ElementKind.PARAGRAPH;
    }
    return null;
  }

  /**
   * Whether any child is a block. An inline child only counts when it wraps a block itself, so a
   * run of text with {@code span}s stays one element.
   */
  private boolean hasBlockChildren(ParsedNode node) {
    for (ParsedNode child : node.children()) {
      if (classify(child) != null
          || CONTAINER_TAGS.contains(child.tag())
          || hasBlockChildren(child)) {
        return true;
      }
    }
    return false;
  }

  private void emit(
      ParsedNode node, ElementKind kind, String text, int depth, int page, WalkState state) {
    int ordinal = state.elements.size();
    String id =
        kind == ElementKind.IMAGE ? imageId(node, state) : "el-" + ordinal;
    int headingLevel = kind == ElementKind.HEADING ? headingLevel(node) : 0;
    int hierarchy = kind == ElementKind.HEADING ? headingLevel : Math.min(depth, 6);

    BoundingBox explicitBox = parseBoundingBox(node.attribute("data-bbox"));
    BoundingBox box;
    PositionSource source;
    if (explicitBox != null) {
      box = explicitBox;
      source = PositionSource.EXPLICIT;
    } else {
      box = estimateBoundingBox(kind, headingLevel, text, page, state);
      source = PositionSource.ESTIMATED;
    }

    LayoutElement element =
        new LayoutElement(
            id,
            kind,
            node.tag(),
            node.classNames(),
            text,
            box,
            page,
            hierarchy,
            headingLevel,
            calculateConfidence(node),
            semanticTags(kind, node, text),
            source);
    state.elements.add(element);
    state.lastPage = page;

    if (kind == ElementKind.IMAGE) {
      state.images.add(
          new ImageAsset(id, page, box, null, blankToNull(node.attribute("alt")), null));
      state.pendingImage = state.images.size() - 1;
      return;
    }

    if (state.pendingImage >= 0 && isCaption(node)) {
      ImageAsset image = state.images.get(state.pendingImage);
      state.images.set(state.pendingImage, image.withCaption(text));
    }
    state.pendingImage = -1;
  }

  private boolean isCaption(ParsedNode node) {
    return "figcaption".equals(node.tag())
        || node.hasClass("caption")
        || node.hasClass("image-caption");
  }

  private String imageId(ParsedNode node, WalkState state) {
    String explicit = node.attribute("data-image-id");
    if (explicit == null || explicit.isBlank()) {
      explicit = node.attribute("id");
    }
    state.imageOrdinal++;
    if (explicit != null && !explicit.isBlank()) {
      return explicit;
    }
    return "img-" + state.imageOrdinal;
  }

  // ---- element attributes ----

  private int headingLevel(ParsedNode node) {
    Matcher tagMatcher = HEADING_TAG.matcher(node.tag());
    if (tagMatcher.matches()) {
      return Integer.parseInt(tagMatcher.group(1));
    }
    int classLevel = headingClassLevel(node);
    return classLevel > 0 ? classLevel : 1;
  }

  private int headingClassLevel(ParsedNode node) {
    for (String cls : node.classNames()) {
      Matcher matcher = HEADING_CLASS.matcher(cls);
      if (matcher.matches()) {
        return Integer.parseInt(matcher.group(1));
      }
    }
    return 0;
  }

  private double calculateConfidence(ParsedNode node) {
    StructureConfig.Layout layout = structureConfig.getLayout();
    double confidence = layout.getBaseConfidence();

    if (node.hasAttribute("data-type")) {
      confidence += layout.getTypeBonus();
    }
    if (node.hasAttribute("data-bbox")) {
      confidence += layout.getPositionBonus();
    }
    if (node.hasClass("layout-element")) {
      confidence += layout.getLayoutClassBonus();
    }
    if ("div".equals(node.tag()) && node.classNames().isEmpty()) {
      confidence -= layout.getGenericPenalty();
    }

    return Math.max(layout.getMinConfidence(), Math.min(layout.getMaxConfidence(), confidence));
  }

  private List<String> semanticTags(ElementKind kind, ParsedNode node, String text) {
    Set<String> tags = new LinkedHashSet<>();
    tags.add(kind.name().toLowerCase(Locale.ROOT));
    for (String cls : node.classNames()) {
      if (cls.length() > 2) {
        tags.add(cls);
      }
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String keyword : CONTENT_KEYWORDS) {
      if (lower.contains(keyword)) {
        tags.add(keyword);
      }
    }
    return new ArrayList<>(tags);
  }

  private BoundingBox parseBoundingBox(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String[] parts = value.split(",");
    if (parts.length != 4) {
      log.debug("Ignoring malformed data-bbox '{}'", value);
      return null;
    }
    try {
      return BoundingBox.fromCorners(
          Double.parseDouble(parts[0].trim()),
          Double.parseDouble(parts[1].trim()),
          Double.parseDouble(parts[2].trim()),
          Double.parseDouble(parts[3].trim()));
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric data-bbox '{}'", value);
      return null;
    }
  }

  private Integer parsePage(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int page = Integer.parseInt(value.trim());
      return page > 0 ? page : null;
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric data-page '{}'", value);
      return null;
    }
  }

  /** Deterministic estimate from the element kind and its order on the page. */
  private BoundingBox estimateBoundingBox(
      ElementKind kind, int headingLevel, String text, int page, WalkState state) {
    double width = DEFAULT_WIDTH;
    double height =
        switch (kind) {
          case HEADING -> 40 + (6 - headingLevel) * 5;
          case PARAGRAPH -> Math.max(30, text.length() / 80.0 * 20);
          case TABLE -> 150;
          case IMAGE -> {
            width = 200;
            yield 150;
          }
          default -> 30;
        };
    double y = state.pageCursor.getOrDefault(page, PAGE_TOP);
    state.pageCursor.put(page, y + height + VERTICAL_GAP);
    return new BoundingBox(DEFAULT_X, y, width, height);
  }

  // ---- sections ----

  /** Mutable section under construction; frozen into a {@link Section} once complete. */
  private static final class SectionBuilder {
    private final String id;
    private final String title;
    private final int level;
    private final String headingElementId;
    private final int pageNumber;
    private final List<String> elementIds = new ArrayList<>();
    private final List<SectionBuilder> children = new ArrayList<>();

    SectionBuilder(String id, String title, int level, String headingElementId, int pageNumber) {
      this.id = id;
      this.title = title;
      this.level = level;
      this.headingElementId = headingElementId;
      this.pageNumber = pageNumber;
    }

    Section freeze() {
      List<Section> frozen = new ArrayList<>();
      for (SectionBuilder child : children) {
        frozen.add(child.freeze());
      }
      return new Section(id, title, level, headingElementId, pageNumber, elementIds, frozen);
    }
  }

  private List<Section> buildSections(List<LayoutElement> elements) {
    List<SectionBuilder> topLevel = new ArrayList<>();
    Deque<SectionBuilder> open = new ArrayDeque<>();
    SectionBuilder preamble = null;
    int sectionCounter = 0;

    for (int i = 0; i < elements.size(); i++) {
      LayoutElement element = elements.get(i);

      if (!element.isHeading()) {
        if (open.isEmpty()) {
          if (preamble == null) {
            preamble =
                new SectionBuilder(
                    "sec-" + sectionCounter++, "", 1, null, element.pageNumber());
            topLevel.add(preamble);
          }
          preamble.elementIds.add(element.id());
        }
        continue;
      }

      int level = element.headingLevel();
      SectionBuilder section =
          new SectionBuilder(
              "sec-" + sectionCounter++, element.text(), level, element.id(), element.pageNumber());

      // Span: everything up to the next heading of equal or higher level
      for (int j = i + 1; j < elements.size(); j++) {
        LayoutElement next = elements.get(j);
        if (next.isHeading() && next.headingLevel() <= level) {
          break;
        }
        section.elementIds.add(next.id());
      }

      if (!open.isEmpty() && level > open.peek().level) {
        open.peek().children.add(section);
      } else {
        while (!open.isEmpty() && open.peek().level >= level) {
          open.pop();
        }
        if (open.isEmpty()) {
          topLevel.add(section);
        } else {
          open.peek().children.add(section);
        }
      }
      open.push(section);
    }

    List<Section> result = new ArrayList<>();
    for (SectionBuilder builder : topLevel) {
      result.add(builder.freeze());
    }
    return result;
  }

  // ---- helpers ----

  private String resolveTitle(WalkState state) {
    if (state.documentTitle != null) {
      return state.documentTitle;
    }
    return state.elements.stream()
        .filter(e -> e.isHeading() && e.headingLevel() == 1)
        .map(LayoutElement::text)
        .findFirst()
        .orElse("Untitled Document");
  }

  private List<ImageAsset> mergeImages(List<ImageAsset> fromTree, List<ImageAsset> supplied) {
    Map<String, ImageAsset> merged = new LinkedHashMap<>();
    for (ImageAsset image : fromTree) {
      merged.put(image.id(), image);
    }
    for (ImageAsset image : supplied) {
      merged.put(image.id(), image);
    }
    return new ArrayList<>(merged.values());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  /** Per-walk mutable state; never shared across documents. */
  private static final class WalkState {
    private final List<LayoutElement> elements = new ArrayList<>();
    private final List<ImageAsset> images = new ArrayList<>();
    private final Map<Integer, Double> pageCursor = new HashMap<>();
    private String documentTitle;
    private int pageOrdinal;
    private int imageOrdinal;
    private int lastPage;
    private int pendingImage = -1;
  }
}
