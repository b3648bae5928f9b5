package com.flamingo.ai.pageindex.service.index.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One addressable section of a document: a heading plus the body text that follows it up to the
 * next heading of any level.
 *
 * <p>Instances are immutable; {@code children} is copied on construction. The identifier encodes
 * ancestry: removing its last segment yields the parent's identifier.
 *
 * @param nodeId dot-separated positional identifier, e.g. {@code 2.3.1}
 * @param title heading text without {@code #} markers
 * @param depth raw heading level (marker count), which may exceed {@link #nestingLevel()} when
 *     heading levels are skipped
 * @param text body text owned by this section only, trimmed
 * @param children direct sub-sections in document order
 */
public record SectionNode(
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("title") String title,
    @JsonProperty("depth") int depth,
    @JsonProperty("text") String text,
    @JsonProperty("children") List<SectionNode> children) {

  public SectionNode {
    text = text != null ? text : "";
    children = children != null ? List.copyOf(children) : List.of();
  }

  /** Position of this node in the tree, 1 for top-level sections. */
  @JsonIgnore
  public int nestingLevel() {
    int level = 1;
    for (int i = 0; i < nodeId.length(); i++) {
      if (nodeId.charAt(i) == '.') {
        level++;
      }
    }
    return level;
  }

  /**
   * Identifier of the parent section, or {@code null} for a top-level section.
   *
   * @return parent identifier
   */
  @JsonIgnore
  public String parentId() {
    int lastDot = nodeId.lastIndexOf('.');
    return lastDot < 0 ? null : nodeId.substring(0, lastDot);
  }
}
