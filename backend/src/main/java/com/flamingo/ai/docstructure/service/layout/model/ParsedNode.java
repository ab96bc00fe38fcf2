package com.flamingo.ai.docstructure.service.layout.model;

import java.util.List;
import java.util.Map;

/**
 * One node of the caller-supplied parsed element tree.
 *
 * <p>Produced by a {@link com.flamingo.ai.docstructure.service.layout.parsing.ParsedTreeProvider};
 * the pipeline never parses markup itself.
 *
 * @param tag lower-case tag name, e.g. {@code h2}, {@code p}, {@code img}
 * @param attributes element attributes ({@code class}, {@code data-page}, {@code data-bbox}, …)
 * @param text the node's own text, excluding descendants
 * @param children child nodes in document order
 */
public record ParsedNode(
    String tag, Map<String, String> attributes, String text, List<ParsedNode> children) {

  public ParsedNode {
    tag = tag == null ? "" : tag.toLowerCase();
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    text = text == null ? "" : text;
    children = children == null ? List.of() : List.copyOf(children);
  }

  /** Leaf node with text and no attributes. */
  public static ParsedNode of(String tag, String text) {
    return new ParsedNode(tag, Map.of(), text, List.of());
  }

  /** Container node with attributes and children. */
  public static ParsedNode of(
      String tag, Map<String, String> attributes, List<ParsedNode> children) {
    return new ParsedNode(tag, attributes, "", children);
  }

  public String attribute(String name) {
    return attributes.get(name);
  }

  public boolean hasAttribute(String name) {
    return attributes.containsKey(name);
  }

  /** Returns the {@code class} attribute split on whitespace. */
  public List<String> classNames() {
    String cls = attributes.get("class");
    if (cls == null || cls.isBlank()) {
      return List.of();
    }
    return List.of(cls.trim().split("\\s+"));
  }

  public boolean hasClass(String name) {
    return classNames().contains(name);
  }

  /** Concatenated text of this node and all descendants, whitespace-trimmed. */
  public String textContent() {
    StringBuilder sb = new StringBuilder();
    appendText(this, sb);
    return sb.toString().trim();
  }

  private static void appendText(ParsedNode node, StringBuilder sb) {
    if (!node.text().isBlank()) {
      if (sb.length() > 0 && !Character.isWhitespace(sb.charAt(sb.length() - 1))) {
        sb.append(' ');
      }
      sb.append(node.text().trim());
    }
    for (ParsedNode child : node.children()) {
      appendText(child, sb);
    }
  }
}
