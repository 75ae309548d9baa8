package com.flamingo.ai.papersplit.service.analysis;

import com.flamingo.ai.papersplit.service.analysis.model.Chapter;
import com.flamingo.ai.papersplit.service.analysis.model.ChapterDetection;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns page-sorted detections into closed page ranges.
 *
 * <p>Each range runs from its detection's page up to the page before the next detection; the last
 * range runs to the end of the document. When two detections share a page, the earlier one becomes
 * a single-page range on that page and both are kept.
 */
@Component
@Slf4j
public class RangeResolver {

  /**
   * Resolves detections into chapters without output routing.
   *
   * @param detections detections sorted ascending by page
   * @param totalPages page count of the document
   * @return one chapter per detection, in the same order; empty when there are no detections
   */
  public List<Chapter> resolveRanges(List<ChapterDetection> detections, int totalPages) {
    List<Chapter> chapters = new ArrayList<>(detections.size());
    for (int i = 0; i < detections.size(); i++) {
      ChapterDetection detection = detections.get(i);
      int startPage = detection.page();
      int endPage = totalPages;

      if (i + 1 < detections.size()) {
        int nextPage = detections.get(i + 1).page();
        endPage = nextPage == startPage ? startPage : nextPage - 1;
      }

      chapters.add(Chapter.unrouted(detection.name(), detection.tag(), startPage, endPage));
    }
    log.debug("Resolved {} page ranges over {} pages", chapters.size(), totalPages);
    return chapters;
  }
}
