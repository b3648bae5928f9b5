package com.flamingo.ai.pageindex.service.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pageindex.exception.DocumentProcessingException;
import com.flamingo.ai.pageindex.exception.SectionNotFoundException;
import com.flamingo.ai.pageindex.service.index.model.ChildRef;
import com.flamingo.ai.pageindex.service.index.model.DocumentTree;
import com.flamingo.ai.pageindex.service.index.model.NodeResult;
import com.flamingo.ai.pageindex.service.index.model.SectionNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, queryable tree of the sections of one document.
 *
 * <p>The index owns the top-level {@link SectionNode}s and a lookup table from identifier to node.
 * The table holds references into the same tree and is filled once, in pre-order, on construction.
 * Nothing mutates after that, so a single instance can be shared by any number of reader threads
 * without locking.
 *
 * <p>Instances come from {@link HeadingTreeBuilder#build(String, String)} or from {@link
 * #fromJson(String)}.
 */
public final class DocumentIndex {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String SUBTREE_SEPARATOR = "\n\n";
  private static final int DEFAULT_INDENT_WIDTH = 2;

  private final String docId;
  private final List<SectionNode> roots;
  private final Map<String, SectionNode> lookup;
  private final List<String> nodeIds;
  private final String title;

  DocumentIndex(String docId, List<SectionNode> roots) {
    this.docId = docId;
    this.roots = List.copyOf(roots);

    Map<String, SectionNode> table = new LinkedHashMap<>();
    for (int i = 0; i < this.roots.size(); i++) {
      register(this.roots.get(i), String.valueOf(i + 1), table);
    }
    this.lookup = Collections.unmodifiableMap(table);
    this.nodeIds = List.copyOf(table.keySet());
    this.title =
        table.values().stream()
            .filter(node -> node.depth() == 1)
            .map(SectionNode::title)
            .findFirst()
            .orElse(null);
  }

  /**
   * Adds a node and its subtree to the lookup table.
   *
   * <p>Identifiers are positional: the i-th child of {@code p} must be {@code p.i}, top-level nodes
   * are numbered from 1. This also rules out duplicates.
   */
  private void register(SectionNode node, String expectedId, Map<String, SectionNode> table) {
    if (!expectedId.equals(node.nodeId())) {
      throw invalidNode(
          "Node identifier " + node.nodeId() + " found where " + expectedId + " was expected");
    }
    if (node.title() == null) {
      throw invalidNode("Node " + expectedId + " has no title");
    }
    if (node.depth() < 1) {
      throw invalidNode("Node " + expectedId + " has invalid depth " + node.depth());
    }
    table.put(expectedId, node);
    List<SectionNode> children = node.children();
    for (int i = 0; i < children.size(); i++) {
      register(children.get(i), expectedId + "." + (i + 1), table);
    }
  }

  private DocumentProcessingException invalidNode(String message) {
    return new DocumentProcessingException(
        docId, message, "Document index contains malformed sections");
  }

  public String getDocId() {
    return docId;
  }

  /** Top-level sections in document order. */
  public List<SectionNode> getRoots() {
    return roots;
  }

  /**
   * Title of the first depth-1 section in document order.
   *
   * @return the title, or empty when the document has no depth-1 heading
   */
  public Optional<String> title() {
    return Optional.ofNullable(title);
  }

  /** Number of addressable sections. */
  public int size() {
    return lookup.size();
  }

  public boolean isEmpty() {
    return lookup.isEmpty();
  }

  public boolean containsNode(String nodeId) {
    return nodeId != null && lookup.containsKey(nodeId);
  }

  /**
   * Every identifier in pre-order: a parent precedes its descendants, siblings keep document
   * order.
   *
   * @return unmodifiable identifier list
   */
  public List<String> nodeIds() {
    return nodeIds;
  }

  /**
   * Renders the outline with the default indent of two spaces per nesting level.
   *
   * @see #outline(int)
   */
  public String outline() {
    return outline(DEFAULT_INDENT_WIDTH);
  }

  /**
   * Renders one line per section, in pre-order, as {@code [id] title} indented by nesting level:
   *
   * <pre>
   * [1] Introduction
   *   [1.1] Background
   *   [1.2] Goals
   * </pre>
   *
   * @param indentWidth spaces per nesting level below the top
   * @return the outline, empty for a document without sections
   */
  public String outline(int indentWidth) {
    if (indentWidth < 0) {
      throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
    }
    StringBuilder sb = new StringBuilder();
    for (SectionNode node : lookup.values()) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(" ".repeat(indentWidth * (node.nestingLevel() - 1)))
          .append('[')
          .append(node.nodeId())
          .append("] ")
          .append(node.title());
    }
    return sb.toString();
  }

  /**
   * Looks up one section.
   *
   * @param nodeId exact identifier, e.g. {@code 1.2}
   * @return the section with its own body text and breadcrumb
   * @throws SectionNotFoundException if no section has this identifier
   */
  public NodeResult getNode(String nodeId) {
    SectionNode node = require(nodeId);
    return new NodeResult(
        node.nodeId(), node.title(), node.text(), node.depth(), breadcrumb(node.nodeId()));
  }

  /**
   * Looks up one section and merges the body text of its whole subtree.
   *
   * <p>Bodies are concatenated in pre-order and separated by a blank line. Empty bodies are
   * skipped. For a leaf the result text equals {@link #getNode(String)}'s.
   *
   * @param nodeId exact identifier
   * @return the section with merged text
   * @throws SectionNotFoundException if no section has this identifier
   */
  public NodeResult getNodeWithChildren(String nodeId) {
    SectionNode node = require(nodeId);
    List<String> parts = new ArrayList<>();
    collectSubtreeText(node, parts);
    return new NodeResult(
        node.nodeId(),
        node.title(),
        String.join(SUBTREE_SEPARATOR, parts),
        node.depth(),
        breadcrumb(node.nodeId()));
  }

  /**
   * Lists the direct children of a section.
   *
   * @param nodeId exact identifier
   * @return children in document order, empty for a leaf
   * @throws SectionNotFoundException if no section has this identifier
   */
  public List<ChildRef> getChildren(String nodeId) {
    return require(nodeId).children().stream()
        .map(child -> new ChildRef(child.nodeId(), child.title()))
        .toList();
  }

  /** Structured projection of the whole tree, suitable for JSON serialization. */
  public DocumentTree toTree() {
    return new DocumentTree(docId, title, roots);
  }

  /**
   * Serializes the whole tree. {@link #fromJson(String)} reads it back into an equivalent index.
   *
   * @return pretty-printed JSON
   */
  public String toJson() {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree());
    } catch (JsonProcessingException e) {
      throw new DocumentProcessingException(
          docId, "Failed to serialize document index: " + e.getMessage(), e);
    }
  }

  /**
   * Rebuilds an index from the output of {@link #toJson()}.
   *
   * @param json serialized index
   * @return the restored index
   * @throws DocumentProcessingException if the JSON is malformed or lacks {@code doc_id}, or if a
   *     section has no title, a depth below 1 or an identifier that does not match its position
   */
  public static DocumentIndex fromJson(String json) {
    DocumentTree tree;
    try {
      tree = MAPPER.readValue(json, DocumentTree.class);
    } catch (JsonProcessingException e) {
      throw new DocumentProcessingException(
          null, "Failed to parse document index: " + e.getOriginalMessage(), e);
    }
    if (tree == null || tree.docId() == null || tree.docId().isBlank()) {
      throw new DocumentProcessingException(
          null, "Document index JSON has no doc_id", "Document index is missing its identifier");
    }
    return new DocumentIndex(tree.docId(), tree.nodes());
  }

  // ---- private helpers ----

  private SectionNode require(String nodeId) {
    SectionNode node = nodeId == null ? null : lookup.get(nodeId);
    if (node == null) {
      throw new SectionNotFoundException(docId, nodeId);
    }
    return node;
  }

  private List<String> breadcrumb(String nodeId) {
    String[] segments = nodeId.split("\\.");
    List<String> crumb = new ArrayList<>(segments.length);
    StringBuilder prefix = new StringBuilder();
    for (String segment : segments) {
      if (prefix.length() > 0) {
        prefix.append('.');
      }
      prefix.append(segment);
      SectionNode ancestor = lookup.get(prefix.toString());
      if (ancestor != null) {
        crumb.add(ancestor.title());
      }
    }
    return crumb;
  }

  private void collectSubtreeText(SectionNode node, List<String> parts) {
    if (!node.text().isEmpty()) {
      parts.add(node.text());
    }
    for (SectionNode child : node.children()) {
      collectSubtreeText(child, parts);
    }
  }

  @Override
  public String toString() {
    return "DocumentIndex[docId=" + docId + ", nodes=" + lookup.size() + "]";
  }
}
