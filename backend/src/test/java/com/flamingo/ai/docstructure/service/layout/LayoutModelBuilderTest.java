package com.flamingo.ai.docstructure.service.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.layout.model.BoundingBox;
import com.flamingo.ai.docstructure.service.layout.model.ElementKind;
import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import com.flamingo.ai.docstructure.service.layout.model.LayoutElement;
import com.flamingo.ai.docstructure.service.layout.model.LayoutModel;
import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import com.flamingo.ai.docstructure.service.layout.model.PositionSource;
import com.flamingo.ai.docstructure.service.layout.model.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LayoutModelBuilder Tests")
class LayoutModelBuilderTest {

  private LayoutModelBuilder builder;

  @BeforeEach
  void setUp() {
    builder = new LayoutModelBuilder(new StructureConfig());
  }

  private static ParsedNode node(String tag, Map<String, String> attributes, String text) {
    return new ParsedNode(tag, attributes, text, List.of());
  }

  private static ParsedNode body(ParsedNode... children) {
    return ParsedNode.of("body", Map.of(), List.of(children));
  }

  private static ParsedNode catalog() {
    return body(
        node("h1", Map.of("data-page", "1"), "Catalog"),
        ParsedNode.of("p", "Intro paragraph text."),
        ParsedNode.of("h2", "Chairs"),
        ParsedNode.of("p", "Chair text"),
        node("img", Map.of("data-image-id", "chair-img", "alt", "chair photo"), ""),
        ParsedNode.of("figcaption", "The Lounge chair"),
        node("h2", Map.of("data-page", "2"), "Tables"),
        node("p", Map.of("data-bbox", "10,20,110,70"), "Table text"),
        ParsedNode.of("h1", "Appendix"));
  }

  @Test
  @DisplayName("should return empty model when tree is null")
  void shouldReturnEmptyModel_whenTreeIsNull() {
    LayoutModel model = builder.build("doc", null, List.of());

    assertThat(model.isEmpty()).isTrue();
    assertThat(model.sections()).isEmpty();
    assertThat(model.title()).isEqualTo("Untitled Document");
    assertThat(model.pageCount()).isZero();
    assertThat(model.confidence()).isZero();
  }

  @Test
  @DisplayName("should keep supplied images when tree has no elements")
  void shouldKeepSuppliedImages_whenTreeHasNoElements() {
    ImageAsset supplied = new ImageAsset("x", 1, BoundingBox.EMPTY, "caption", null, null);

    LayoutModel model = builder.build("doc", body(), List.of(supplied));

    assertThat(model.isEmpty()).isTrue();
    assertThat(model.images()).containsExactly(supplied);
  }

  @Test
  @DisplayName("should emit typed elements in document order")
  void shouldEmitTypedElements_inDocumentOrder() {
    LayoutModel model = builder.build("doc", catalog(), List.of());

    assertThat(model.elements())
        .extracting(LayoutElement::kind)
        .containsExactly(
            ElementKind.HEADING,
            ElementKind.PARAGRAPH,
            ElementKind.HEADING,
            ElementKind.PARAGRAPH,
            ElementKind.IMAGE,
            ElementKind.PARAGRAPH,
            ElementKind.HEADING,
            ElementKind.PARAGRAPH,
            ElementKind.HEADING);
    assertThat(model.elements().get(0).id()).isEqualTo("el-0");
    assertThat(model.elements().get(4).id()).isEqualTo("chair-img");
    assertThat(model.elements().get(2).headingLevel()).isEqualTo(2);
    assertThat(model.elements().get(2).hierarchyLevel()).isEqualTo(2);
    assertThat(model.elements().get(1).hierarchyLevel()).isEqualTo(1);
  }

  @Test
  @DisplayName("should nest sections by heading level")
  void shouldNestSections_byHeadingLevel() {
    LayoutModel model = builder.build("doc", catalog(), List.of());

    assertThat(model.sections()).extracting(Section::title).containsExactly("Catalog", "Appendix");
    Section catalogSection = model.sections().get(0);
    assertThat(catalogSection.children())
        .extracting(Section::title)
        .containsExactly("Chairs", "Tables");
    assertThat(catalogSection.elementIds())
        .containsExactly("el-1", "el-2", "el-3", "chair-img", "el-5", "el-6", "el-7");
    assertThat(catalogSection.ownElementIds()).containsExactly("el-1");
    assertThat(catalogSection.children().get(0).elementIds())
        .containsExactly("el-3", "chair-img", "el-5");
    assertThat(model.sections().get(1).elementIds()).isEmpty();
    assertThat(model.allSections()).hasSize(4);
  }

  @Test
  @DisplayName("should keep every child level strictly above its parent")
  void shouldKeepChildLevels_strictlyAboveParent() {
    ParsedNode tree =
        body(
            ParsedNode.of("h2", "Starts at two"),
            ParsedNode.of("h4", "Deep"),
            ParsedNode.of("h3", "Middle"),
            ParsedNode.of("h1", "Top"),
            ParsedNode.of("h3", "Under top"));

    LayoutModel model = builder.build("doc", tree, List.of());

    for (Section section : model.allSections()) {
      for (Section child : section.children()) {
        assertThat(child.level()).isGreaterThan(section.level());
      }
    }
    assertThat(model.sections()).extracting(Section::title).containsExactly("Starts at two", "Top");
    assertThat(model.sections().get(0).children())
        .extracting(Section::title)
        .containsExactly("Deep", "Middle");
  }

  @Test
  @DisplayName("should collect content before the first heading into a preamble section")
  void shouldCollectPreamble_beforeFirstHeading() {
    ParsedNode tree =
        body(ParsedNode.of("p", "Lead text."), ParsedNode.of("h1", "Title"), ParsedNode.of("p", "Body."));

    LayoutModel model = builder.build("doc", tree, List.of());

    Section preamble = model.sections().get(0);
    assertThat(preamble.title()).isEmpty();
    assertThat(preamble.headingElementId()).isNull();
    assertThat(preamble.elementIds()).containsExactly("el-0");
    assertThat(model.sections().get(1).elementIds()).containsExactly("el-2");
  }

  @Test
  @DisplayName("should resolve pages from data-page, page divs and the last seen page")
  void shouldResolvePages() {
    ParsedNode tree =
        body(
            ParsedNode.of(
                "div", Map.of("class", "page"), List.of(ParsedNode.of("p", "First page."))),
            ParsedNode.of(
                "div", Map.of("class", "page"), List.of(ParsedNode.of("p", "Second page."))),
            node("p", Map.of("data-page", "7"), "Explicit page."),
            ParsedNode.of("p", "Follows explicit page."));

    LayoutModel model = builder.build("doc", tree, List.of());

    assertThat(model.elements())
        .extracting(LayoutElement::pageNumber)
        .containsExactly(1, 2, 7, 7);
    assertThat(model.pageCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("should use explicit bounding box and estimate it otherwise")
  void shouldUseExplicitBoundingBox_andEstimateOtherwise() {
    LayoutModel model = builder.build("doc", catalog(), List.of());

    LayoutElement explicit = model.element("el-7").orElseThrow();
    assertThat(explicit.positionSource()).isEqualTo(PositionSource.EXPLICIT);
    assertThat(explicit.boundingBox()).isEqualTo(new BoundingBox(10, 20, 100, 50));

    LayoutElement estimated = model.element("el-1").orElseThrow();
    assertThat(estimated.positionSource()).isEqualTo(PositionSource.ESTIMATED);
    assertThat(estimated.boundingBox().width()).isPositive();
  }

  @Test
  @DisplayName("should fall back to an estimate when data-bbox is malformed")
  void shouldEstimate_whenBoundingBoxIsMalformed() {
    ParsedNode tree = body(node("p", Map.of("data-bbox", "1,2,three"), "Some text."));

    LayoutElement element = builder.build("doc", tree, List.of()).elements().get(0);

    assertThat(element.positionSource()).isEqualTo(PositionSource.ESTIMATED);
  }

  @Test
  @DisplayName("should adjust confidence by attributes and clamp it")
  void shouldAdjustConfidence_byAttributes() {
    ParsedNode tree =
        body(
            node(
                "p",
                Map.of("class", "layout-element", "data-type", "text", "data-bbox", "0,0,10,10"),
                "Well described."),
            node("div", Map.of(), "Generic block."),
            ParsedNode.of("p", "Plain paragraph."));

    LayoutModel model = builder.build("doc", tree, List.of());

    assertThat(model.elements().get(0).confidence()).isEqualTo(1.0);
    assertThat(model.elements().get(1).kind()).isEqualTo(ElementKind.CONTAINER);
    assertThat(model.elements().get(1).confidence()).isEqualTo(0.6, offset(1e-9));
    assertThat(model.elements().get(2).confidence()).isEqualTo(0.8);
    assertThat(model.confidence())
        .isEqualTo((1.0 + 0.6 + 0.8) / 3, offset(1e-9));
  }

  @Test
  @DisplayName("should attach a following caption and merge supplied images")
  void shouldAttachCaption_andMergeSuppliedImages() {
    ImageAsset extra = new ImageAsset("extra", 2, BoundingBox.EMPTY, null, "extra alt", null);

    LayoutModel model = builder.build("doc", catalog(), List.of(extra));

    assertThat(model.images()).extracting(ImageAsset::id).containsExactly("chair-img", "extra");
    ImageAsset chair = model.images().get(0);
    assertThat(chair.caption()).isEqualTo("The Lounge chair");
    assertThat(chair.altText()).isEqualTo("chair photo");
    assertThat(chair.descriptiveText()).isEqualTo("The Lounge chair");
    assertThat(chair.pageNumber()).isEqualTo(1);
  }

  @Test
  @DisplayName("should prefer supplied image when ids clash")
  void shouldPreferSuppliedImage_whenIdsClash() {
    ImageAsset override = new ImageAsset("chair-img", 1, BoundingBox.EMPTY, "Override", null, null);

    LayoutModel model = builder.build("doc", catalog(), List.of(override));

    assertThat(model.images()).containsExactly(override);
  }

  @Test
  @DisplayName("should take title from head, then first h1, then default")
  void shouldResolveTitle() {
    ParsedNode withHead =
        ParsedNode.of(
            "html",
            Map.of(),
            List.of(
                ParsedNode.of("head", Map.of(), List.of(ParsedNode.of("title", "Head Title"))),
                body(ParsedNode.of("h1", "Heading Title"))));
    ParsedNode withHeading = body(ParsedNode.of("h2", "Minor"), ParsedNode.of("h1", "Main"));
    ParsedNode withoutHeading = body(ParsedNode.of("p", "Only text."));

    assertThat(builder.build("a", withHead, List.of()).title()).isEqualTo("Head Title");
    assertThat(builder.build("b", withHeading, List.of()).title()).isEqualTo("Main");
    assertThat(builder.build("c", withoutHeading, List.of()).title())
        .isEqualTo("Untitled Document");
  }

  @Test
  @DisplayName("should skip scripts and styles and read heading classes")
  void shouldSkipScripts_andReadHeadingClasses() {
    ParsedNode tree =
        body(
            ParsedNode.of("script", "var x = 1;"),
            ParsedNode.of("style", "p { color: red; }"),
            node("div", Map.of("class", "heading-3"), "Class heading"),
            node("div", Map.of("class", "spec-table"), "a b c"),
            node("div", Map.of("class", "property-list"), "x y z"));

    LayoutModel model = builder.build("doc", tree, List.of());

    assertThat(model.elements())
        .extracting(LayoutElement::kind)
        .containsExactly(ElementKind.HEADING, ElementKind.TABLE, ElementKind.LIST);
    assertThat(model.elements().get(0).headingLevel()).isEqualTo(3);
  }

  @Test
  @DisplayName("should tag elements with kind, classes and content keywords")
  void shouldTagElements() {
    ParsedNode tree =
        body(node("p", Map.of("class", "spec-note"), "Technical specification of the material."));

    LayoutElement element = builder.build("doc", tree, List.of()).elements().get(0);

    assertThat(element.semanticTags())
        .contains("paragraph", "spec-note", "technical", "specification", "material");
  }

  @Test
  @DisplayName("should keep text split by inline spans as one element")
  void shouldKeepInlineRun_asOneElement() {
    ParsedNode priceLine =
        ParsedNode.of(
            "div",
            Map.of(),
            List.of(
                ParsedNode.of("#text", "Price"),
                ParsedNode.of("span", "120"),
                ParsedNode.of("#text", "EUR per square metre")));

    LayoutModel model = builder.build("doc", body(priceLine), List.of());

    assertThat(model.elements()).hasSize(1);
    assertThat(model.elements().get(0).kind()).isEqualTo(ElementKind.CONTAINER);
    assertThat(model.elements().get(0).text()).isEqualTo("Price 120 EUR per square metre");
  }

  @Test
  @DisplayName("should descend into an inline wrapper that holds a block")
  void shouldDescendIntoInlineWrapper_holdingBlock() {
    ParsedNode wrapped =
        ParsedNode.of(
            "div",
            Map.of(),
            List.of(
                ParsedNode.of(
                    "span", Map.of(), List.of(ParsedNode.of("p", "Wrapped paragraph.")))));

    LayoutModel model = builder.build("doc", body(wrapped), List.of());

    assertThat(model.elements())
        .extracting(LayoutElement::kind)
        .containsExactly(ElementKind.PARAGRAPH);
  }

  @Test
  @DisplayName("should hand out sections that cannot be changed afterwards")
  void shouldHandOutUnmodifiableSections() {
    List<String> ids = new ArrayList<>(List.of("el-1"));
    List<Section> children = new ArrayList<>();
    Section section = new Section("sec-1", "Title", 1, "el-0", 1, ids, children);
    ids.add("el-2");
    children.add(section);

    assertThat(section.elementIds()).containsExactly("el-1");
    assertThat(section.children()).isEmpty();

    Section built = builder.build("doc", catalog(), List.of()).sections().get(0);
    assertThatThrownBy(() -> built.children().add(section))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> built.elementIds().add("el-99"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
