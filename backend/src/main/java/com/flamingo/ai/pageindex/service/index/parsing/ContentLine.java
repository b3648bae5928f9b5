package com.flamingo.ai.pageindex.service.index.parsing;

/**
 * A line of body text, kept verbatim.
 *
 * @param text the raw line
 */
public record ContentLine(String text) implements MarkdownLine {}
