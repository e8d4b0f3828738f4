package com.flamingo.ai.docstructure.service.structure.table;

import com.flamingo.ai.docstructure.service.structure.model.ExtractedTable;
import com.flamingo.ai.docstructure.service.structure.model.TableGrid;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Converts raw table grids into self-contained HTML tables.
 *
 * <p>Consecutive cells of a row with identical text are collapsed into one cell with a {@code
 * colspan}; this is how horizontally merged cells come out of document readers, which repeat the
 * merged cell's text once per spanned column.
 */
@Component
@Slf4j
public class TableNormalizer {

  /**
   * Normalizes every table, dropping those without any text.
   *
   * @param grids tables in document order
   * @return normalized tables in the same order
   */
  public List<ExtractedTable> normalizeAll(List<TableGrid> grids) {
    List<ExtractedTable> tables = new ArrayList<>();
    for (TableGrid grid : grids) {
      normalize(grid).ifPresent(tables::add);
    }
    if (tables.size() < grids.size()) {
      log.debug("Dropped {} tables without text", grids.size() - tables.size());
    }
    return tables;
  }

  /**
   * Normalizes one table.
   *
   * @param grid raw table
   * @return the HTML table, or empty when no cell has text
   */
  public Optional<ExtractedTable> normalize(TableGrid grid) {
    boolean hasText =
        grid.rows().stream().flatMap(List::stream).anyMatch(cell -> cell != null && !cell.isBlank());
    if (!hasText) {
      return Optional.empty();
    }

    StringBuilder html = new StringBuilder("<table>");
    for (List<String> row : grid.rows()) {
      html.append("<tr>");
      int i = 0;
      while (i < row.size()) {
        String text = cellText(row.get(i));
        int span = 1;
        while (i + span < row.size() && text.equals(cellText(row.get(i + span)))) {
          span++;
        }
        String escaped = HtmlUtils.htmlEscape(text);
        if (span == 1) {
          html.append("<td>").append(escaped).append("</td>");
        } else {
          html.append("<td colspan='").append(span).append("'>").append(escaped).append("</td>");
        }
        i += span;
      }
      html.append("</tr>");
    }
    html.append("</table>");
    return Optional.of(new ExtractedTable(html.toString(), grid.positions()));
  }

  private static String cellText(String cell) {
    return cell == null ? "" : cell;
  }
}
