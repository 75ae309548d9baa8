package com.flamingo.ai.papersplit.service.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.papersplit.exception.DocumentNotFoundException;
import com.flamingo.ai.papersplit.exception.DocumentProcessingException;
import com.flamingo.ai.papersplit.exception.DocumentProcessingException.Stage;
import com.flamingo.ai.papersplit.service.analysis.AnalysisResultMapper;
import com.flamingo.ai.papersplit.service.analysis.AnalysisResultValidator;
import com.flamingo.ai.papersplit.service.analysis.AnalysisResultValidator.ValidationReport;
import com.flamingo.ai.papersplit.service.analysis.DocumentAnalyzer;
import com.flamingo.ai.papersplit.service.analysis.model.AnalysisResult;
import com.flamingo.ai.papersplit.service.split.DocumentSplitter;
import com.flamingo.ai.papersplit.service.split.SplitUnit;
import com.flamingo.ai.papersplit.service.storage.DocumentStorage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/**
 * Orchestrates one document end to end: load, analyze, persist the analysis, then split from the
 * persisted artifact.
 *
 * <p>Splitting always reads the analysis back from storage, so a hand-edited artifact drives the
 * split exactly like a fresh one. Failures are scoped to the document being processed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaperProcessingService {

  private final DocumentStorage documentStorage;
  private final DocumentAnalyzer documentAnalyzer;
  private final DocumentSplitter documentSplitter;
  private final AnalysisResultMapper analysisResultMapper;
  private final AnalysisResultValidator analysisResultValidator;
  private final MeterRegistry meterRegistry;

  /**
   * Analyzes a source document and persists the result as its analysis artifact.
   *
   * @param documentName name of the source document in storage
   * @return the analysis result
   * @throws DocumentNotFoundException if the source does not exist
   * @throws DocumentProcessingException if the source cannot be read as a PDF or the artifact
   *     cannot be written
   */
  @Timed(value = "papers.analyze", description = "Time to analyze a composite paper")
  public AnalysisResult analyze(String documentName) {
    try {
      byte[] source = documentStorage.readSource(documentName);
      AnalysisResult result;
      try (PDDocument document = loadPdf(documentName, source, Stage.ANALYZE)) {
        result = documentAnalyzer.analyze(document);
      }
      documentStorage.writeAnalysis(documentName, serialize(documentName, result));
      meterRegistry.counter("papers_analyzed_total").increment();
      return result;
    } catch (IOException e) {
      throw failure(documentName, Stage.ANALYZE, e);
    } catch (DocumentNotFoundException e) {
      recordFailure(Stage.ANALYZE);
      throw e;
    } catch (DocumentProcessingException e) {
      recordFailure(e.getStage());
      throw e;
    }
  }

  /**
   * Splits a source document according to its persisted analysis artifact.
   *
   * @param documentName name of the source document in storage
   * @return one unit per file written
   * @throws DocumentNotFoundException if the source or its analysis does not exist
   * @throws DocumentProcessingException if the analysis is unusable or the source unreadable
   */
  @Timed(value = "papers.split", description = "Time to split a composite paper")
  public List<SplitUnit> split(String documentName) {
    try {
      AnalysisResult analysis = loadAnalysis(documentName);
      byte[] source = documentStorage.readSource(documentName);
      List<SplitUnit> units;
      try (PDDocument document = loadPdf(documentName, source, Stage.SPLIT)) {
        units =
            documentSplitter.split(document, analysis, documentStorage.outputRoot(documentName));
      }
      meterRegistry.counter("papers_split_units_total").increment(units.size());
      return units;
    } catch (IOException e) {
      throw failure(documentName, Stage.SPLIT, e);
    } catch (DocumentNotFoundException e) {
      recordFailure(Stage.SPLIT);
      throw e;
    } catch (DocumentProcessingException e) {
      recordFailure(e.getStage());
      throw e;
    }
  }

  /**
   * Analyzes and then splits a document.
   *
   * @param documentName name of the source document in storage
   * @return the analysis together with the files written
   */
  public ProcessingReport process(String documentName) {
    log.info("Processing document: {}", documentName);
    AnalysisResult analysis = analyze(documentName);
    List<SplitUnit> units = split(documentName);
    log.info(
        "Processed {}: {} chapters detected, {} files written",
        documentName,
        analysis.chapters().size(),
        units.size());
    return new ProcessingReport(documentName, analysis, units);
  }

  private AnalysisResult loadAnalysis(String documentName) {
    byte[] json =
        documentStorage
            .readAnalysis(documentName)
            .orElseThrow(
                () ->
                    new DocumentNotFoundException(
                        documentName, "No analysis found for document: " + documentName));

    JsonNode tree;
    try {
      tree = analysisResultMapper.readTree(json);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName, Stage.SPLIT, "Analysis is not valid JSON: " + e.getMessage(), e);
    }

    ValidationReport report = analysisResultValidator.validate(tree);
    if (!report.isValid()) {
      report.errors().forEach(error -> log.warn("Analysis of {}: {}", documentName, error));
    }
    if (!report.isUsable()) {
      throw new DocumentProcessingException(
          documentName, Stage.SPLIT, "Analysis has no usable chapter list");
    }

    try {
      return analysisResultMapper.fromTree(tree);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName, Stage.SPLIT, "Analysis does not match the expected layout", e);
    }
  }

  private PDDocument loadPdf(String documentName, byte[] source, Stage stage) {
    try {
      return Loader.loadPDF(source);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName, stage, "Source is not a readable PDF: " + e.getMessage(), e);
    }
  }

  private byte[] serialize(String documentName, AnalysisResult result) {
    try {
      return analysisResultMapper.toJson(result);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentName, Stage.STORAGE, "Failed to serialize analysis", e);
    }
  }

  private DocumentProcessingException failure(String documentName, Stage stage, IOException e) {
    recordFailure(stage);
    log.error("Failed to {} document {}: {}", stageTag(stage), documentName, e.getMessage());
    return new DocumentProcessingException(documentName, stage, e.getMessage(), e);
  }

  private void recordFailure(Stage stage) {
    meterRegistry.counter("papers_failures_total", "stage", stageTag(stage)).increment();
  }

  private static String stageTag(Stage stage) {
    return stage.name().toLowerCase(Locale.ROOT);
  }
}
