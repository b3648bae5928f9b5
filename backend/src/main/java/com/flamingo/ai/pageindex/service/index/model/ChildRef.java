package com.flamingo.ai.pageindex.service.index.model;

/**
 * Identifier and title of a direct child section.
 *
 * @param nodeId child identifier
 * @param title child heading text
 */
public record ChildRef(String nodeId, String title) {}
