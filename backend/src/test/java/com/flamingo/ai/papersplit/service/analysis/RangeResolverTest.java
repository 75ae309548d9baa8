package com.flamingo.ai.papersplit.service.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.papersplit.service.analysis.model.Chapter;
import com.flamingo.ai.papersplit.service.analysis.model.ChapterDetection;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RangeResolver}. */
class RangeResolverTest {

  private final RangeResolver resolver = new RangeResolver();

  @Test
  @DisplayName("Each range should end on the page before the next detection")
  void shouldMakeRangesAdjacent() {
    List<ChapterDetection> detections =
        List.of(
            new ChapterDetection("SAP-1", "NA", 1),
            new ChapterDetection("SAP-2", "NA", 11),
            new ChapterDetection("SAP-3", "NA", 21));

    List<Chapter> chapters = resolver.resolveRanges(detections, 40);

    assertThat(chapters)
        .extracting(Chapter::chapterName, Chapter::startPage, Chapter::endPage)
        .containsExactly(tuple("SAP-1", 1, 10), tuple("SAP-2", 11, 20), tuple("SAP-3", 21, 40));
    for (int i = 0; i + 1 < chapters.size(); i++) {
      assertThat(chapters.get(i).endPage()).isEqualTo(chapters.get(i + 1).startPage() - 1);
    }
  }

  @Test
  @DisplayName("The last range should run to the final page")
  void shouldExtendLastRange_toLastPage() {
    List<Chapter> chapters =
        resolver.resolveRanges(List.of(new ChapterDetection("PP-1", "UNSOLVED", 7)), 12);

    assertThat(chapters).hasSize(1);
    assertThat(chapters.get(0).startPage()).isEqualTo(7);
    assertThat(chapters.get(0).endPage()).isEqualTo(12);
  }

  @Test
  @DisplayName("Two detections on one page should both be kept, the first as a single page")
  void shouldKeepZeroWidthCollision() {
    List<ChapterDetection> detections =
        List.of(
            new ChapterDetection("Mind Map", "NA", 5),
            new ChapterDetection("SAP-1", "NA", 5),
            new ChapterDetection("SAP-2", "NA", 9));

    List<Chapter> chapters = resolver.resolveRanges(detections, 12);

    assertThat(chapters)
        .extracting(Chapter::chapterName, Chapter::startPage, Chapter::endPage)
        .containsExactly(tuple("Mind Map", 5, 5), tuple("SAP-1", 5, 8), tuple("SAP-2", 9, 12));
  }

  @Test
  @DisplayName("Resolved chapters should carry the detection tag and no output location")
  void shouldCopyTag_andLeaveUnrouted() {
    List<ChapterDetection> detections = List.of(new ChapterDetection("SOLVED SAP-1", "SOLVED", 1));

    Chapter chapter = resolver.resolveRanges(detections, 3).get(0);

    assertThat(chapter.tag()).isEqualTo("SOLVED");
    assertThat(chapter.outputFilename()).isNull();
    assertThat(chapter.outputFolder()).isNull();
    assertThat(chapter.isRoutable()).isFalse();
  }

  @Test
  @DisplayName("No detections should resolve to no chapters")
  void shouldReturnEmpty_whenNoDetections() {
    assertThat(resolver.resolveRanges(List.of(), 10)).isEmpty();
  }
}
