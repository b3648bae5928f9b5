package com.flamingo.ai.pageindex.service.index.parsing;

/**
 * A line that opens a new section.
 *
 * @param level number of leading {@code #} markers
 * @param title heading text, trimmed
 */
public record HeadingLine(int level, String title) implements MarkdownLine {}
