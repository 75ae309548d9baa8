package com.flamingo.ai.papersplit.service.analysis.model;

import java.util.Arrays;
import java.util.Optional;

/** Output folders a split paper can be routed to. */
public enum OutputFolder {
  /** Question papers, solved or unsolved. */
  QUESTION_PAPERS("question_papers"),

  /** Solution sets for sample question papers. */
  ANSWER_KEYS("answer_keys");

  private final String directoryName;

  OutputFolder(String directoryName) {
    this.directoryName = directoryName;
  }

  public String getDirectoryName() {
    return directoryName;
  }

  /** Resolves the folder for a directory name as persisted in an analysis artifact. */
  public static Optional<OutputFolder> fromDirectoryName(String directoryName) {
    return Arrays.stream(values()).filter(f -> f.directoryName.equals(directoryName)).findFirst();
  }
}
