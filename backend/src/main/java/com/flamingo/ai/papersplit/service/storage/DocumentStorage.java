package com.flamingo.ai.papersplit.service.storage;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Storage boundary for source documents, analysis artifacts and split output.
 *
 * <p>Documents are addressed by name (e.g. {@code class10-science.pdf}). Each document owns an
 * output area holding its analysis artifact and the {@code question_papers} / {@code answer_keys}
 * folders produced by splitting.
 */
public interface DocumentStorage {

  /**
   * Reads a source document.
   *
   * @param documentName name of the source document
   * @return the raw PDF bytes
   * @throws com.flamingo.ai.papersplit.exception.DocumentNotFoundException if it does not exist
   */
  byte[] readSource(String documentName);

  /**
   * Persists the analysis artifact of a document, replacing any previous one.
   *
   * @param documentName name of the source document
   * @param analysisJson serialized analysis
   * @return where the artifact was stored
   */
  Path writeAnalysis(String documentName, byte[] analysisJson);

  /**
   * Reads the analysis artifact of a document.
   *
   * @param documentName name of the source document
   * @return the serialized analysis, or empty if none was stored
   */
  Optional<byte[]> readAnalysis(String documentName);

  /**
   * Returns the directory that split output for a document is written under.
   *
   * @param documentName name of the source document
   * @return the output root; may not exist yet
   */
  Path outputRoot(String documentName);
}
