package com.flamingo.ai.papersplit.service.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Structural checks for a persisted analysis artifact before it drives a split.
 *
 * <p>Reports every problem it finds instead of stopping at the first one. Only a missing or
 * non-array {@code chapters} field makes the artifact unusable (see {@link
 * ValidationReport#isUsable()}); chapter-level problems are left to the splitter, which skips the
 * affected chapters.
 */
@Component
public class AnalysisResultValidator {

  private static final List<String> REQUIRED_FIELDS = List.of("book_title", "chapters");
  private static final List<String> REQUIRED_CHAPTER_FIELDS =
      List.of(
          "chapter_name", "tag", "chapter_start_page_number", "chapter_end_page_number");

  /**
   * Outcome of a validation run.
   *
   * @param errors human-readable problems, empty when the artifact is valid
   * @param usable whether the artifact can still be split
   */
  public record ValidationReport(List<String> errors, boolean usable) {

    public boolean isValid() {
      return errors.isEmpty();
    }

    public boolean isUsable() {
      return usable;
    }
  }

  /**
   * Validates a parsed analysis artifact.
   *
   * @param root JSON tree of the artifact
   * @return the validation report
   */
  public ValidationReport validate(JsonNode root) {
    List<String> errors = new ArrayList<>();
    if (root == null || !root.isObject()) {
      errors.add("Analysis must be a JSON object");
      return new ValidationReport(errors, false);
    }

    for (String field : REQUIRED_FIELDS) {
      if (!root.has(field)) {
        errors.add("Missing required field: " + field);
      }
    }

    JsonNode chapters = root.get("chapters");
    if (chapters == null) {
      return new ValidationReport(errors, false);
    }
    if (!chapters.isArray()) {
      errors.add("Chapters must be a list");
      return new ValidationReport(errors, false);
    }

    for (int i = 0; i < chapters.size(); i++) {
      validateChapter(i, chapters.get(i), errors);
    }
    return new ValidationReport(errors, true);
  }

  private void validateChapter(int index, JsonNode chapter, List<String> errors) {
    if (!chapter.isObject()) {
      errors.add("Chapter " + index + " must be an object");
      return;
    }
    for (String field : REQUIRED_CHAPTER_FIELDS) {
      if (!chapter.has(field)) {
        errors.add("Chapter " + index + " missing required field: " + field);
      }
    }

    JsonNode start = chapter.get("chapter_start_page_number");
    JsonNode end = chapter.get("chapter_end_page_number");
    boolean startIsInt = isInteger(start);
    boolean endIsInt = isInteger(end);
    if (isPresent(start) && !startIsInt) {
      errors.add("Chapter " + index + " start_page must be an integer");
    }
    if (isPresent(end) && !endIsInt) {
      errors.add("Chapter " + index + " end_page must be an integer");
    }
    if (startIsInt && endIsInt && start.intValue() > end.intValue()) {
      errors.add(
          String.format(
              "Chapter %d start_page (%d) > end_page (%d)",
              index, start.intValue(), end.intValue()));
    }
  }

  private static boolean isPresent(JsonNode node) {
    return node != null && !node.isNull();
  }

  private static boolean isInteger(JsonNode node) {
    return isPresent(node) && node.canConvertToInt() && node.isIntegralNumber();
  }
}
