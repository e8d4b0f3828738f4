package com.flamingo.ai.docstructure.api.dto.response;

import com.flamingo.ai.docstructure.service.structure.model.ChunkingResult;
import com.flamingo.ai.docstructure.service.structure.model.IndexRecord;
import com.flamingo.ai.docstructure.service.structure.model.Position;
import com.flamingo.ai.docstructure.service.structure.model.RecordType;
import java.util.Base64;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunked document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkingResponse {

  private String documentName;
  private Integer chunkTokenNum;
  private String delimiter;
  private String layoutRecognize;
  private Integer recordCount;
  private List<RecordResponse> records;
  private List<String> progress;

  /** One index record; the image, when present, is Base64 encoded PNG. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class RecordResponse {
    private String title;
    private RecordType type;
    private String content;
    private List<Position> positions;
    private String image;
    private String language;

    static RecordResponse from(IndexRecord record) {
      return RecordResponse.builder()
          .title(record.title())
          .type(record.type())
          .content(record.content())
          .positions(record.positions())
          .image(record.image() == null ? null : Base64.getEncoder().encodeToString(record.image()))
          .language(record.language())
          .build();
    }
  }

  /** Creates a ChunkingResponse from a chunking result and the progress messages it emitted. */
  public static ChunkingResponse fromResult(ChunkingResult result, List<String> progress) {
    List<RecordResponse> records = result.records().stream().map(RecordResponse::from).toList();
    return ChunkingResponse.builder()
        .documentName(result.documentName())
        .chunkTokenNum(result.parserConfig().chunkTokenNum())
        .delimiter(result.parserConfig().delimiter())
        .layoutRecognize(result.parserConfig().layoutRecognize())
        .recordCount(records.size())
        .records(records)
        .progress(progress)
        .build();
  }
}
