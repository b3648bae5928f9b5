package com.flamingo.ai.pageindex.service.index.model;

import java.util.List;

/**
 * Read-side view of a single section as returned by node lookups.
 *
 * @param nodeId identifier of the section
 * @param title heading text
 * @param text body text; for subtree lookups the merged text of the section and its descendants
 * @param depth raw heading level
 * @param breadcrumb titles from the top-level ancestor down to and including this section
 */
public record NodeResult(
    String nodeId, String title, String text, int depth, List<String> breadcrumb) {

  public NodeResult {
    breadcrumb = List.copyOf(breadcrumb);
  }
}
