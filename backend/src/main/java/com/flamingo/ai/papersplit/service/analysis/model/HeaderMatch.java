package com.flamingo.ai.papersplit.service.analysis.model;

/**
 * One occurrence of a header pattern inside a page's header text.
 *
 * @param name matched text, trimmed and with embedded line breaks replaced by spaces
 * @param specificity length of {@code name}; longer matches carry more information
 * @param priority position of the matching pattern in the pattern set (0 = highest priority)
 */
public record HeaderMatch(String name, int specificity, int priority) {

  public static HeaderMatch of(String matchedText, int priority) {
    String name = matchedText.strip().replace('\n', ' ');
    return new HeaderMatch(name, name.length(), priority);
  }
}
