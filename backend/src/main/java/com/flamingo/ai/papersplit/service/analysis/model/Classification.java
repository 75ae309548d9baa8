package com.flamingo.ai.papersplit.service.analysis.model;

/**
 * Outcome of routing a detected chapter to an output file.
 *
 * <p>Either {@link Classified} with a target filename and folder, or {@link Unclassified} when no
 * naming rule applies. Unclassified chapters stay in the analysis but never produce a file.
 */
public interface Classification {

  Unclassified UNCLASSIFIED = new Unclassified();

  boolean isClassified();

  /**
   * A chapter routed to {@code folder/filename}.
   *
   * @param filename output file name, e.g. {@code SQP-2-SOLUTION.pdf}
   * @param folder output folder
   */
  record Classified(String filename, OutputFolder folder) implements Classification {

    @Override
    public boolean isClassified() {
      return true;
    }
  }

  /** No naming rule matched the chapter. */
  record Unclassified() implements Classification {

    @Override
    public boolean isClassified() {
      return false;
    }
  }
}
