package com.flamingo.ai.pageindex.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for indexing a document from raw text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexDocumentRequest {

  @NotBlank(message = "Document ID is required")
  @Size(max = 255, message = "Document ID must not exceed 255 characters")
  private String docId;

  /** Markdown text; may contain no headings at all. */
  @NotNull(message = "Content is required")
  private String content;
}
