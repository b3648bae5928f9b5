package com.flamingo.ai.pageindex.service.index.parsing;

/** A classified line of input: either a {@link HeadingLine} or a {@link ContentLine}. */
public interface MarkdownLine {}
