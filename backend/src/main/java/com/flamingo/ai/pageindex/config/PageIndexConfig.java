package com.flamingo.ai.pageindex.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for document indexing. */
@Configuration
@ConfigurationProperties(prefix = "pageindex")
@Getter
@Setter
public class PageIndexConfig {

  /**
   * Whether a document without any heading is rejected. When false it is registered as an index
   * with no sections.
   */
  private boolean rejectEmptyDocuments = false;

  private Outline outline = new Outline();
  private Upload upload = new Upload();

  @Getter
  @Setter
  public static class Outline {
    /** Spaces per nesting level in rendered outlines. */
    private int indentWidth = 2;
  }

  @Getter
  @Setter
  public static class Upload {
    /** Maximum accepted size of an uploaded document in bytes. */
    private long maxFileSizeBytes = 10 * 1024 * 1024L; // 10 MB
  }
}
