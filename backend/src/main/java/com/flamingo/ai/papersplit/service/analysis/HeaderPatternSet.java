package com.flamingo.ai.papersplit.service.analysis;

import com.flamingo.ai.papersplit.service.analysis.model.HeaderMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Ordered set of structural header patterns for exam-paper compilations.
 *
 * <p>All patterns are case-insensitive and anchored at the start of a line, so a header block that
 * spans several lines can match on any of them. Whitespace inside a pattern is horizontal only
 * ({@code \h}), so a match never continues onto the next line. Most patterns accept an optional
 * status tag ({@code SOLVED}, {@code UNSOLVED}, {@code SOLUTIONS}) before the paper title.
 *
 * <p>The list order is the priority used only to break ties between matches of equal length; the
 * length of the matched text decides first (see {@link ChapterDetector}).
 */
@Component
public class HeaderPatternSet {

  private static final String TAG = "(SOLVED|UNSOLVED|SOLUTIONS)";
  private static final int FLAGS =
      Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.UNIX_LINES;

  /**
   * A named header pattern.
   *
   * @param label short description used in logs
   * @param regex compiled pattern
   * @param priority position in the set (0 = highest)
   */
  public record HeaderPattern(String label, Pattern regex, int priority) {}

  private final List<HeaderPattern> patterns;

  public HeaderPatternSet() {
    List<HeaderPattern> list = new ArrayList<>();
    add(list, "tagged-self-assessment", "^" + TAG + "\\h+Self\\h+Assessment\\h+Paper-\\d+");
    add(list, "self-assessment", "^Self\\h+Assessment\\h+Paper-\\d+");
    add(
        list,
        "sample-question",
        "^" + TAG + "?\\h*Sample\\h+Question\\h+(?:SOLVED\\h+)?Paper-\\d+");
    add(
        list,
        "practice-mock-test",
        "^" + TAG + "?\\h*(Practice|Mock|Test|Question)\\h+(Paper|Test)?-\\d+");
    add(list, "sqp", "^" + TAG + "?\\h*SQP\\h*-\\h*\\d+");
    add(list, "sap", "^" + TAG + "?\\h*SAP\\h*-\\h*\\d+");
    add(list, "pp", "^" + TAG + "?\\h*PP\\h*-\\h*\\d+");
    add(list, "mind-map-numbered", "^Mind\\h+Map\\h*-\\h*\\d+");
    add(list, "mind-map", "^Mind\\h+map");
    add(list, "on-tips", "^On\\h+tips");
    add(list, "generic", "^\\h*" + TAG + "?\\h*(chapter|unit|part)\\h*\\d+\\h*[:.\\-]?\\h*.*");
    this.patterns = List.copyOf(list);
  }

  private static void add(List<HeaderPattern> list, String label, String regex) {
    list.add(new HeaderPattern(label, Pattern.compile(regex, FLAGS), list.size()));
  }

  public List<HeaderPattern> getPatterns() {
    return patterns;
  }

  /**
   * Runs every pattern over the header text and returns all occurrences, in pattern order and then
   * in order of appearance.
   *
   * @param headerText header text of one page (may contain line breaks)
   * @return all matches; empty when nothing matches or the text is blank
   */
  public List<HeaderMatch> findMatches(String headerText) {
    if (headerText == null || headerText.isBlank()) {
      return List.of();
    }
    List<HeaderMatch> matches = new ArrayList<>();
    for (HeaderPattern pattern : patterns) {
      Matcher matcher = pattern.regex().matcher(headerText);
      while (matcher.find()) {
        HeaderMatch match = HeaderMatch.of(matcher.group(), pattern.priority());
        if (!match.name().isEmpty()) {
          matches.add(match);
        }
      }
    }
    return matches;
  }
}
