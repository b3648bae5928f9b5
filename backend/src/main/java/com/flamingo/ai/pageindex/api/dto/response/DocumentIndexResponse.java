package com.flamingo.ai.pageindex.api.dto.response;

import com.flamingo.ai.pageindex.service.index.DocumentIndex;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO summarizing a registered document index. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentIndexResponse {

  private String docId;

  /** Title of the first top-level heading, or null. */
  private String title;

  private Integer nodeCount;

  /** Creates a DocumentIndexResponse from an index. */
  public static DocumentIndexResponse fromIndex(DocumentIndex index) {
    return DocumentIndexResponse.builder()
        .docId(index.getDocId())
        .title(index.title().orElse(null))
        .nodeCount(index.size())
        .build();
  }
}
