package com.flamingo.ai.pageindex.service.index.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * JSON projection of a whole document index.
 *
 * <p>{@code title} is informational on import; it is recomputed from the nodes.
 *
 * @param docId caller-supplied document identifier
 * @param title title of the first depth-1 section, or {@code null}
 * @param nodes top-level sections in document order
 */
public record DocumentTree(
    @JsonProperty("doc_id") String docId,
    @JsonProperty("title") String title,
    @JsonProperty("nodes") List<SectionNode> nodes) {

  public DocumentTree {
    nodes = nodes != null ? List.copyOf(nodes) : List.of();
  }
}
