package com.flamingo.ai.papersplit.service.analysis;

import com.flamingo.ai.papersplit.service.analysis.model.AnalysisResult;
import com.flamingo.ai.papersplit.service.analysis.model.Chapter;
import com.flamingo.ai.papersplit.service.analysis.model.ChapterDetection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/**
 * Reconstructs the structure of a composite exam-paper PDF.
 *
 * <p>Pipeline: {@link ChapterDetector} → {@link RangeResolver} → {@link OutputClassifier} → {@link
 * ConfidenceScorer}. The result is deterministic for a given document. A document without any
 * recognizable header still produces a result, with no chapters and the minimum confidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentAnalyzer {

  private final ChapterDetector chapterDetector;
  private final RangeResolver rangeResolver;
  private final OutputClassifier outputClassifier;
  private final ConfidenceScorer confidenceScorer;
  private final BookTitleExtractor titleExtractor;

  /**
   * Analyzes an open document.
   *
   * @param document source document; not modified or closed
   * @return the analysis result
   */
  public AnalysisResult analyze(PDDocument document) {
    int totalPages = document.getNumberOfPages();
    String title = titleExtractor.extractTitle(document);

    List<ChapterDetection> detections = chapterDetector.detectChapters(document);
    List<Chapter> chapters =
        outputClassifier.classify(rangeResolver.resolveRanges(detections, totalPages));
    int confidence = confidenceScorer.score(detections, totalPages);

    long routable = chapters.stream().filter(Chapter::isRoutable).count();
    log.info(
        "Analysis of '{}' complete: {} pages, {} chapters ({} routable), confidence {}",
        title,
        totalPages,
        chapters.size(),
        routable,
        confidence);

    return new AnalysisResult(confidence, title, 1, totalPages, chapters);
  }
}
