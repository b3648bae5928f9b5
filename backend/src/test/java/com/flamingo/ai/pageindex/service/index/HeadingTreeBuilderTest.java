package com.flamingo.ai.pageindex.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pageindex.exception.SectionNotFoundException;
import com.flamingo.ai.pageindex.service.index.model.SectionNode;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HeadingTreeBuilder Tests")
class HeadingTreeBuilderTest {

  private static final String SAMPLE =
      """

      # Introduction
      Introductory text.

      ## Background
      Background details.

      ## Goals
      Goal details.

      # Methods
      Method details.

      ## Experiment
      Experiment details.
      """;

  private HeadingTreeBuilder builder;

  @BeforeEach
  void setUp() {
    builder = new HeadingTreeBuilder();
  }

  @Test
  @DisplayName("should take title from first top-level heading")
  void shouldUseFirstDepthOneHeading_asTitle() {
    DocumentIndex index = builder.build("doc1", SAMPLE);

    assertThat(index.title()).contains("Introduction");
    assertThat(index.getDocId()).isEqualTo("doc1");
  }

  @Test
  @DisplayName("should assign hierarchical identifiers in document order")
  void shouldAssignIdentifiers_inDocumentOrder() {
    DocumentIndex index = builder.build("doc1", SAMPLE);

    assertThat(index.nodeIds()).containsExactly("1", "1.1", "1.2", "2", "2.1");
    assertThat(index.getRoots()).hasSize(2);
  }

  @Test
  @DisplayName("should keep only the body between a heading and the next one")
  void shouldTrimBodyText_toOwnSection() {
    DocumentIndex index = builder.build("doc1", SAMPLE);

    assertThat(index.getNode("1").text()).isEqualTo("Introductory text.");
    assertThat(index.getNode("1.1").text()).isEqualTo("Background details.");
    assertThat(index.getNode("2.1").text()).isEqualTo("Experiment details.");
  }

  @Test
  @DisplayName("should build the canonical three-node example")
  void shouldBuildSiblings_underSingleRoot() {
    DocumentIndex index = builder.build("doc", "# A\ntext1\n## B\ntext2\n## C\ntext3");

    assertThat(index.nodeIds()).containsExactly("1", "1.1", "1.2");
    assertThat(index.getNode("1").title()).isEqualTo("A");
    assertThat(index.getNode("1.1").title()).isEqualTo("B");
    assertThat(index.getNode("1.2").title()).isEqualTo("C");
  }

  @Test
  @DisplayName("should treat a skipped heading level as one nesting step")
  void shouldNestOneLevel_whenHeadingLevelSkipped() {
    DocumentIndex index = builder.build("doc", "# A\n### B");

    assertThat(index.nodeIds()).containsExactly("1", "1.1");
    assertThat(index.getNode("1.1").depth()).isEqualTo(3);
  }

  @Test
  @DisplayName("should attach a shallower heading after a skipped level to the right parent")
  void shouldReturnToParent_afterSkippedLevel() {
    DocumentIndex index = builder.build("doc", "# A\n### B\n## C\n### D\n# E");

    assertThat(index.nodeIds()).containsExactly("1", "1.1", "1.2", "1.2.1", "2");
    assertThat(index.getNode("1.2").title()).isEqualTo("C");
    assertThat(index.getNode("1.2.1").title()).isEqualTo("D");
  }

  @Test
  @DisplayName("should make every depth-1 heading a new top-level section")
  void shouldCreateMultipleRoots_forMultipleDepthOneHeadings() {
    DocumentIndex index = builder.build("doc", "# One\n# Two\n# Three");

    assertThat(index.nodeIds()).containsExactly("1", "2", "3");
    assertThat(index.getRoots())
        .extracting(SectionNode::title)
        .containsExactly("One", "Two", "Three");
  }

  @Test
  @DisplayName("should drop content before the first heading")
  void shouldDiscardPreamble_beforeFirstHeading() {
    DocumentIndex index = builder.build("doc", "preamble line\n\n# Start\nbody");

    assertThat(index.nodeIds()).containsExactly("1");
    assertThat(index.getNode("1").text()).isEqualTo("body");
    assertThat(index.getNodeWithChildren("1").text()).doesNotContain("preamble");
  }

  @Test
  @DisplayName("should leave title absent when document starts below level one")
  void shouldHaveNoTitle_whenNoDepthOneHeading() {
    DocumentIndex index = builder.build("doc", "## Sub\n### Deeper");

    assertThat(index.title()).isEmpty();
    assertThat(index.nodeIds()).containsExactly("1", "1.1");
  }

  @Test
  @DisplayName("should take title from a later depth-1 heading when the first is deeper")
  void shouldFindDepthOneTitle_afterDeeperOpening() {
    DocumentIndex index = builder.build("doc", "## Preface\n# Main");

    assertThat(index.title()).contains("Main");
  }

  @Test
  @DisplayName("should produce an empty index when there are no headings")
  void shouldProduceEmptyIndex_whenNoHeadings() {
    DocumentIndex index = builder.build("plain", "just some text\nwith lines\n  # indented");

    assertThat(index.isEmpty()).isTrue();
    assertThat(index.nodeIds()).isEmpty();
    assertThat(index.outline()).isEmpty();
    assertThatThrownBy(() -> index.getNode("1")).isInstanceOf(SectionNotFoundException.class);
  }

  @Test
  @DisplayName("should accept empty and null text")
  void shouldProduceEmptyIndex_whenTextEmptyOrNull() {
    assertThat(builder.build("empty", "").isEmpty()).isTrue();
    assertThat(builder.build("null", null).isEmpty()).isTrue();
  }

  @Test
  @DisplayName("should reject a blank document ID")
  void shouldRejectBlankDocId() {
    assertThatThrownBy(() -> builder.build(" ", "# A"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.build(null, "# A"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should give an empty body to a heading followed directly by another")
  void shouldHaveEmptyBody_whenHeadingsAdjacent() {
    DocumentIndex index = builder.build("doc", "# A\n\n\n## B\n");

    assertThat(index.getNode("1").text()).isEmpty();
    assertThat(index.getNode("1.1").text()).isEmpty();
  }

  @Test
  @DisplayName("should keep inner blank lines of a body")
  void shouldPreserveInnerBlankLines() {
    DocumentIndex index = builder.build("doc", "# A\n\nfirst\n\nsecond\n\n");

    assertThat(index.getNode("1").text()).isEqualTo("first\n\nsecond");
  }

  @Test
  @DisplayName("should derive every identifier from its parent and number siblings from one")
  void shouldSatisfyIdentifierInvariants() {
    String markdown =
        "# A\n## A1\n### A1a\n### A1b\n## A2\n# B\n#### B-deep\n## B1\n### B1a\n# C";
    DocumentIndex index = builder.build("doc", markdown);

    assertThat(new HashSet<>(index.nodeIds())).hasSameSizeAs(index.nodeIds());
    for (String id : index.nodeIds()) {
      SectionNode node =
          index.getRoots().stream()
              .map(root -> find(root, id))
              .filter(Objects::nonNull)
              .findFirst()
              .orElseThrow();
      if (node.parentId() != null) {
        assertThat(index.containsNode(node.parentId())).isTrue();
      }
      List<SectionNode> children = node.children();
      for (int i = 0; i < children.size(); i++) {
        assertThat(children.get(i).nodeId()).isEqualTo(id + "." + (i + 1));
      }
    }
    for (int i = 0; i < index.getRoots().size(); i++) {
      assertThat(index.getRoots().get(i).nodeId()).isEqualTo(String.valueOf(i + 1));
    }
  }

  private static SectionNode find(SectionNode node, String id) {
    if (node.nodeId().equals(id)) {
      return node;
    }
    for (SectionNode child : node.children()) {
      SectionNode found = find(child, id);
      if (found != null) {
        return found;
      }
    }
    return null;
  }
}
