package com.flamingo.ai.docstructure.service.structure;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.service.structure.model.ChunkRequest;
import com.flamingo.ai.docstructure.service.structure.model.ExtractedTable;
import com.flamingo.ai.docstructure.service.structure.model.IndexRecord;
import com.flamingo.ai.docstructure.service.structure.model.QaUnit;
import com.flamingo.ai.docstructure.service.structure.model.RecordType;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;

/** Builds index records that share the document name, title and language of a request. */
final class IndexRecordFactory {

  private final String documentName;
  private final String title;
  private final String language;

  IndexRecordFactory(ChunkRequest request) {
    this.documentName = request.source().name();
    this.title = titleOf(documentName);
    this.language = request.language();
  }

  /** File name without its last extension. */
  static String titleOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  IndexRecord table(ExtractedTable table) {
    return new IndexRecord(
        documentName, title, RecordType.TABLE, table.markup(), table.positions(), null, language);
  }

  IndexRecord text(String chunk) {
    return new IndexRecord(documentName, title, RecordType.TEXT, chunk, List.of(), null, language);
  }

  IndexRecord qa(QaUnit unit) {
    if (unit.answerImage() == null) {
      return text(unit.content());
    }
    return new IndexRecord(
        documentName,
        title,
        RecordType.IMAGE,
        unit.content(),
        List.of(),
        toPng(unit.answerImage()),
        language);
  }

  private byte[] toPng(BufferedImage image) {
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, "png", out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName, "Failed to encode answer image: " + e.getMessage(), e);
    }
  }
}
