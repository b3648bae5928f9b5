package com.flamingo.ai.pageindex.service.index.parsing;

import java.util.List;

/**
 * Classifies raw text lines as ATX-style headings or content.
 *
 * <p>A heading starts with {@code #} in the first column; its level is the length of the leading
 * run of {@code #} characters and its title is the remainder, trimmed. No space is required after
 * the markers and the level is unbounded. A marker run with a blank remainder ({@code "##"}) is
 * content. Malformed heading markup is never rejected, it simply stays content.
 */
public final class MarkdownLineClassifier {

  private static final char MARKER = '#';

  private MarkdownLineClassifier() {}

  /**
   * Classifies a single line.
   *
   * @param line raw line without its terminator
   * @return a {@link HeadingLine} or a {@link ContentLine}
   */
  public static MarkdownLine classify(String line) {
    if (line.isEmpty() || line.charAt(0) != MARKER) {
      return new ContentLine(line);
    }
    int level = 0;
    while (level < line.length() && line.charAt(level) == MARKER) {
      level++;
    }
    String title = line.substring(level).strip();
    if (title.isEmpty()) {
      return new ContentLine(line);
    }
    return new HeadingLine(level, title);
  }

  /**
   * Splits text on {@code \n}, {@code \r\n} or {@code \r} and classifies every line.
   *
   * @param text raw document text
   * @return classified lines in input order
   */
  public static List<MarkdownLine> classifyAll(String text) {
    return text.lines().map(MarkdownLineClassifier::classify).toList();
  }
}
