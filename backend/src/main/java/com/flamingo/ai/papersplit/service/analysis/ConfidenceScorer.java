package com.flamingo.ai.papersplit.service.analysis;

import com.flamingo.ai.papersplit.service.analysis.model.ChapterDetection;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Heuristic confidence in a document's detected structure, for human review.
 *
 * <p>No detections scores {@value #NO_DETECTIONS_SCORE}. Otherwise the score starts at {@value
 * #BASE_SCORE}, gains {@value #DENSITY_BONUS} when more than 10% of the pages open a paper, and
 * gains {@value #ABBREVIATION_BONUS} once when any header names a known paper type. The result is
 * clamped to [{@value #MIN_SCORE}, {@value #MAX_SCORE}].
 */
@Component
public class ConfidenceScorer {

  static final int NO_DETECTIONS_SCORE = 30;
  static final int BASE_SCORE = 70;
  static final int DENSITY_BONUS = 10;
  static final int ABBREVIATION_BONUS = 5;
  static final int MIN_SCORE = 30;
  static final int MAX_SCORE = 95;

  private static final double DENSITY_THRESHOLD = 0.1;
  private static final List<String> KNOWN_TOKENS =
      List.of("SAP", "SQP", "PP", "PRACTICE", "QUESTION");

  /**
   * Scores a detection list.
   *
   * @param detections detections of one document
   * @param totalPages page count of the document
   * @return score between 30 and 95
   */
  public int score(List<ChapterDetection> detections, int totalPages) {
    if (detections.isEmpty()) {
      return NO_DETECTIONS_SCORE;
    }

    int confidence = BASE_SCORE;

    if (totalPages > 0 && (double) detections.size() / totalPages > DENSITY_THRESHOLD) {
      confidence += DENSITY_BONUS;
    }

    boolean namesKnownType =
        detections.stream()
            .map(d -> d.name().toUpperCase(Locale.ROOT))
            .anyMatch(name -> KNOWN_TOKENS.stream().anyMatch(name::contains));
    if (namesKnownType) {
      confidence += ABBREVIATION_BONUS;
    }

    return Math.max(MIN_SCORE, Math.min(confidence, MAX_SCORE));
  }
}
