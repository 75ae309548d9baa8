package com.flamingo.ai.papersplit.service.analysis;

import com.flamingo.ai.papersplit.service.analysis.model.ChapterDetection;
import com.flamingo.ai.papersplit.service.analysis.model.HeaderMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

/**
 * Finds the pages on which a new paper starts.
 *
 * <p>For every page the header text is matched against the {@link HeaderPatternSet}. When several
 * patterns match, the longest matched text wins; equal lengths fall back to pattern priority and
 * then to the earlier occurrence. A header like "Self Assessment Paper-3" therefore beats a bare
 * "Chapter 3" found in the same header.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChapterDetector {

  /** Tag used when a header carries no status token. */
  public static final String NO_TAG = "NA";

  private static final Set<String> STATUS_TAGS = Set.of("SOLVED", "UNSOLVED", "SOLUTIONS");

  private static final Comparator<HeaderMatch> BEST_MATCH_FIRST =
      Comparator.comparingInt(HeaderMatch::specificity)
          .reversed()
          .thenComparingInt(HeaderMatch::priority);

  private final PageHeaderExtractor headerExtractor;
  private final HeaderPatternSet patternSet;

  /**
   * Detects paper headers in an open PDF.
   *
   * @param document source document
   * @return detections sorted by page, unique by name and page
   */
  public List<ChapterDetection> detectChapters(PDDocument document) {
    return detectChapters(headerExtractor.extractHeaders(document));
  }

  /**
   * Detects paper headers from already extracted header texts.
   *
   * @param headersByPage header text of each page, index 0 holding page 1
   * @return detections sorted by page, unique by name and page
   */
  public List<ChapterDetection> detectChapters(List<String> headersByPage) {
    Set<ChapterDetection> unique = new LinkedHashSet<>();
    for (int i = 0; i < headersByPage.size(); i++) {
      int pageNumber = i + 1;
      Optional<HeaderMatch> best = selectBestMatch(headersByPage.get(i));
      if (best.isEmpty()) {
        continue;
      }
      String name = best.get().name();
      ChapterDetection detection = new ChapterDetection(name, extractTag(name), pageNumber);
      if (unique.add(detection)) {
        log.debug("Detected '{}' (tag={}) on page {}", name, detection.tag(), pageNumber);
      }
    }

    List<ChapterDetection> detections = new ArrayList<>(unique);
    detections.sort(Comparator.comparingInt(ChapterDetection::page));
    log.info("Detected {} paper headers in {} pages", detections.size(), headersByPage.size());
    return detections;
  }

  /**
   * Picks the most specific match within one header.
   *
   * @param headerText header text of a page
   * @return the winning match, or empty when no pattern matches
   */
  public Optional<HeaderMatch> selectBestMatch(String headerText) {
    List<HeaderMatch> matches = patternSet.findMatches(headerText);
    // List.sort is stable: equal specificity and priority keeps the earlier occurrence
    List<HeaderMatch> ordered = new ArrayList<>(matches);
    ordered.sort(BEST_MATCH_FIRST);
    return ordered.stream().findFirst();
  }

  /**
   * Returns the status tag that opens a header name, upper-cased, or {@link #NO_TAG}.
   *
   * @param name detected header name
   * @return {@code SOLVED}, {@code UNSOLVED}, {@code SOLUTIONS} or {@code NA}
   */
  static String extractTag(String name) {
    String[] tokens = name.strip().split("\\s+");
    if (tokens.length == 0) {
      return NO_TAG;
    }
    String first = tokens[0].toUpperCase(Locale.ROOT);
    return STATUS_TAGS.contains(first) ? first : NO_TAG;
  }
}
