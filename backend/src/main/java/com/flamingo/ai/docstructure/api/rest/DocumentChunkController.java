package com.flamingo.ai.docstructure.api.rest;

import com.flamingo.ai.docstructure.api.dto.response.ChunkingResponse;
import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.exception.InvalidPageRangeException;
import com.flamingo.ai.docstructure.service.structure.DocumentChunkingService;
import com.flamingo.ai.docstructure.service.structure.model.ChunkRequest;
import com.flamingo.ai.docstructure.service.structure.model.ChunkingResult;
import com.flamingo.ai.docstructure.service.structure.model.DocumentSource;
import com.flamingo.ai.docstructure.service.structure.model.ParserConfig;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for chunking uploaded documents. */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
@Slf4j
public class DocumentChunkController {

  private final DocumentChunkingService documentChunkingService;
  private final StructureConfig structureConfig;

  /** Chunks an uploaded PDF or Word document. Unset options fall back to configured defaults. */
  @PostMapping(value = "/chunk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ChunkingResponse> chunkDocument(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "from_page", required = false) Integer fromPage,
      @RequestParam(value = "to_page", required = false) Integer toPage,
      @RequestParam(value = "lang", required = false) String lang,
      @RequestParam(value = "chunk_token_num", required = false) Integer chunkTokenNum,
      @RequestParam(value = "delimiter", required = false) String delimiter,
      @RequestParam(value = "layout_recognize", required = false) String layoutRecognize) {
    StructureConfig.Defaults defaults = structureConfig.getDefaults();
    String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
    int from = fromPage != null ? fromPage : defaults.getFromPage();
    int to = toPage != null ? toPage : defaults.getToPage();
    if (from < 0 || to < from) {
      throw new InvalidPageRangeException(from, to);
    }

    ParserConfig parserConfig =
        new ParserConfig(
            chunkTokenNum != null ? chunkTokenNum : defaults.getChunkTokenNum(),
            delimiter != null ? delimiter : defaults.getDelimiter(),
            layoutRecognize != null && !layoutRecognize.isBlank()
                ? layoutRecognize
                : defaults.getLayoutRecognize());
    ChunkRequest request =
        new ChunkRequest(
            DocumentSource.of(name, readBytes(name, file)),
            from,
            to,
            lang != null ? lang : defaults.getLanguage(),
            parserConfig);

    List<String> progress = new ArrayList<>();
    ChunkingResult result =
        documentChunkingService.chunk(
            request,
            (fraction, message) -> {
              log.debug("{}: {} {}", name, fraction, message);
              progress.add(message);
            });
    return ResponseEntity.ok(ChunkingResponse.fromResult(result, progress));
  }

  private static byte[] readBytes(String name, MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new DocumentProcessingException(name, "Failed to read upload: " + e.getMessage(), e);
    }
  }
}
