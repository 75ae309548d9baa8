package com.flamingo.ai.papersplit.service.analysis;

import com.flamingo.ai.papersplit.service.analysis.model.Chapter;
import com.flamingo.ai.papersplit.service.analysis.model.Classification;
import com.flamingo.ai.papersplit.service.analysis.model.Classification.Classified;
import com.flamingo.ai.papersplit.service.analysis.model.OutputFolder;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps a detected paper to its canonical output file.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>{@code Self Assessment Paper-N} tagged {@code UNSOLVED} → {@code SAP-N.pdf} in {@code
 *       question_papers}
 *   <li>{@code Practice Paper-N} tagged {@code UNSOLVED} → {@code PP-N.pdf} in {@code
 *       question_papers}
 *   <li>{@code Question Paper-N} tagged {@code SOLVED} or {@code UNSOLVED} → {@code SQP-N.pdf} in
 *       {@code question_papers}; tagged {@code SOLUTIONS} → {@code SQP-N-SOLUTION.pdf} in {@code
 *       answer_keys}
 * </ol>
 *
 * Anything else is unclassified and never written as a separate file.
 */
@Component
@Slf4j
public class OutputClassifier {

  private static final Pattern SELF_ASSESSMENT =
      Pattern.compile("Self\\s+Assessment\\s+Paper[- ]?(\\d+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern PRACTICE =
      Pattern.compile("Practice\\s+Paper[- ]?(\\d+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern QUESTION =
      Pattern.compile("Question\\s+Paper[- ]?(\\d+)", Pattern.CASE_INSENSITIVE);

  private static final String SOLVED = "SOLVED";
  private static final String UNSOLVED = "UNSOLVED";
  private static final String SOLUTIONS = "SOLUTIONS";

  /**
   * Classifies one chapter.
   *
   * @param chapterName detected header name
   * @param tag status tag of the header
   * @return the output location, or {@link Classification#UNCLASSIFIED}
   */
  public Classification classify(String chapterName, String tag) {
    if (chapterName == null) {
      return Classification.UNCLASSIFIED;
    }

    Matcher selfAssessment = SELF_ASSESSMENT.matcher(chapterName);
    if (selfAssessment.find() && UNSOLVED.equals(tag)) {
      return new Classified(
          "SAP-" + selfAssessment.group(1) + ".pdf", OutputFolder.QUESTION_PAPERS);
    }

    Matcher practice = PRACTICE.matcher(chapterName);
    if (practice.find() && UNSOLVED.equals(tag)) {
      return new Classified("PP-" + practice.group(1) + ".pdf", OutputFolder.QUESTION_PAPERS);
    }

    Matcher question = QUESTION.matcher(chapterName);
    if (question.find()) {
      String number = question.group(1);
      if (SOLVED.equals(tag) || UNSOLVED.equals(tag)) {
        return new Classified("SQP-" + number + ".pdf", OutputFolder.QUESTION_PAPERS);
      }
      if (SOLUTIONS.equals(tag)) {
        return new Classified("SQP-" + number + "-SOLUTION.pdf", OutputFolder.ANSWER_KEYS);
      }
    }

    return Classification.UNCLASSIFIED;
  }

  /**
   * Attaches output locations to every classifiable chapter; the others are returned unchanged.
   *
   * @param chapters resolved chapters
   * @return chapters in the same order
   */
  public List<Chapter> classify(List<Chapter> chapters) {
    return chapters.stream()
        .map(
            chapter -> {
              Classification classification = classify(chapter.chapterName(), chapter.tag());
              if (!classification.isClassified()) {
                log.debug("No output rule for '{}' (tag={})", chapter.chapterName(), chapter.tag());
              }
              return chapter.withClassification(classification);
            })
        .toList();
  }
}
