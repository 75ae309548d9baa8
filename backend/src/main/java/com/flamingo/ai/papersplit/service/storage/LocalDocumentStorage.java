package com.flamingo.ai.papersplit.service.storage;

import com.flamingo.ai.papersplit.config.SplitterConfig;
import com.flamingo.ai.papersplit.exception.DocumentNotFoundException;
import com.flamingo.ai.papersplit.exception.DocumentProcessingException;
import com.flamingo.ai.papersplit.exception.DocumentProcessingException.Stage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentStorage} on the local filesystem.
 *
 * <p>Layout under {@code splitter.storage.base-path}:
 *
 * <pre>
 * source/{name}.pdf
 * output/{name without .pdf}/analysis.json
 * output/{name without .pdf}/question_papers/*.pdf
 * output/{name without .pdf}/answer_keys/*.pdf
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalDocumentStorage implements DocumentStorage {

  private final SplitterConfig splitterConfig;

  @Override
  public byte[] readSource(String documentName) {
    Path path = sourceRoot().resolve(safeName(documentName));
    try {
      byte[] bytes = Files.readAllBytes(path);
      log.debug("Read {} bytes from {}", bytes.length, path);
      return bytes;
    } catch (NoSuchFileException e) {
      throw new DocumentNotFoundException(documentName);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName, Stage.STORAGE, "Failed to read source " + path + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Path writeAnalysis(String documentName, byte[] analysisJson) {
    Path path = analysisPath(documentName);
    try {
      Files.createDirectories(path.getParent());
      Files.write(path, analysisJson);
      log.info("Stored analysis of {} at {}", documentName, path);
      return path;
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName,
          Stage.STORAGE,
          "Failed to write analysis " + path + ": " + e.getMessage(),
          e);
    }
  }

  @Override
  public Optional<byte[]> readAnalysis(String documentName) {
    Path path = analysisPath(documentName);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName,
          Stage.STORAGE,
          "Failed to read analysis " + path + ": " + e.getMessage(),
          e);
    }
  }

  @Override
  public Path outputRoot(String documentName) {
    String name = safeName(documentName);
    String stem =
        name.toLowerCase(Locale.ROOT).endsWith(".pdf")
            ? name.substring(0, name.length() - 4)
            : name;
    SplitterConfig.Storage storage = splitterConfig.getStorage();
    return Path.of(storage.getBasePath(), storage.getOutputDir(), stem);
  }

  private Path analysisPath(String documentName) {
    return outputRoot(documentName).resolve(splitterConfig.getStorage().getAnalysisFileName());
  }

  private Path sourceRoot() {
    SplitterConfig.Storage storage = splitterConfig.getStorage();
    return Path.of(storage.getBasePath(), storage.getSourceDir());
  }

  /** Rejects names that would leave the storage root. */
  private String safeName(String documentName) {
    if (documentName == null || documentName.isBlank()) {
      throw new IllegalArgumentException("Document name must not be blank");
    }
    if (documentName.contains("..")
        || documentName.startsWith("/")
        || documentName.contains("\\")) {
      throw new IllegalArgumentException("Illegal document name: " + documentName);
    }
    return documentName;
  }
}
