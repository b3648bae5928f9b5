package com.flamingo.ai.pageindex.service.index;

import com.flamingo.ai.pageindex.service.index.model.SectionNode;
import com.flamingo.ai.pageindex.service.index.parsing.ContentLine;
import com.flamingo.ai.pageindex.service.index.parsing.HeadingLine;
import com.flamingo.ai.pageindex.service.index.parsing.MarkdownLine;
import com.flamingo.ai.pageindex.service.index.parsing.MarkdownLineClassifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link DocumentIndex} from heading-structured text in a single pass.
 *
 * <p>The builder keeps a stack of open sections. A heading of level {@code d} closes every open
 * section whose level is {@code >= d}; the new section then becomes a child of whatever remains on
 * top, or a new top-level section when the stack is empty. Identifiers follow tree position, not
 * raw heading level, so {@code "# A\n### B"} yields {@code 1} and {@code 1.1}.
 *
 * <p>Text before the first heading belongs to no section and is dropped. Text without any heading
 * produces a valid index with no sections.
 *
 * <p>Stateless; one instance can serve concurrent builds.
 */
@Service
@Slf4j
public class HeadingTreeBuilder {

  /**
   * Parses {@code text} into an index.
   *
   * @param docId caller-supplied document identifier, must not be blank
   * @param text raw document text; {@code null} is treated as empty
   * @return the frozen index
   */
  public DocumentIndex build(String docId, String text) {
    if (docId == null || docId.isBlank()) {
      throw new IllegalArgumentException("Document ID must not be blank");
    }

    List<OpenSection> roots = new ArrayList<>();
    Deque<OpenSection> stack = new ArrayDeque<>();
    int headings = 0;

    for (MarkdownLine line : MarkdownLineClassifier.classifyAll(text != null ? text : "")) {
      if (line instanceof HeadingLine heading) {
        while (!stack.isEmpty() && stack.peek().depth >= heading.level()) {
          stack.pop();
        }
        OpenSection parent = stack.peek();
        OpenSection section;
        if (parent == null) {
          section = new OpenSection(String.valueOf(roots.size() + 1), heading);
          roots.add(section);
        } else {
          section =
              new OpenSection(parent.nodeId + "." + (parent.children.size() + 1), heading);
          parent.children.add(section);
        }
        stack.push(section);
        headings++;
      } else if (line instanceof ContentLine content && !stack.isEmpty()) {
        stack.peek().lines.add(content.text());
      }
    }

    if (headings == 0) {
      log.warn("Document {} contains no headings; index will be empty", docId);
    }

    DocumentIndex index =
        new DocumentIndex(docId, roots.stream().map(OpenSection::freeze).toList());
    log.debug(
        "Built index for document {}: {} sections, {} top-level",
        docId,
        index.size(),
        roots.size());
    return index;
  }

  /** Mutable section used only while the builder is running. */
  private static final class OpenSection {

    private final String nodeId;
    private final String title;
    private final int depth;
    private final List<String> lines = new ArrayList<>();
    private final List<OpenSection> children = new ArrayList<>();

    private OpenSection(String nodeId, HeadingLine heading) {
      this.nodeId = nodeId;
      this.title = heading.title();
      this.depth = heading.level();
    }

    private SectionNode freeze() {
      return new SectionNode(
          nodeId,
          title,
          depth,
          String.join("\n", lines).strip(),
          children.stream().map(OpenSection::freeze).toList());
    }
  }
}
