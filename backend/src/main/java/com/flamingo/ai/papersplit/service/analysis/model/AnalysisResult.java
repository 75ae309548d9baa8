package com.flamingo.ai.papersplit.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Structure of a composite document as detected by the analyzer. This is the artifact persisted
 * between the analyze and split phases.
 *
 * @param confidenceScore heuristic confidence in the detected structure, 30 to 95
 * @param bookTitle title from document metadata or the first page
 * @param bookStartPage always 1
 * @param bookEndPage page count of the document
 * @param chapters resolved chapters in page order
 */
public record AnalysisResult(
    @JsonProperty("confidence_score") int confidenceScore,
    @JsonProperty("book_title") String bookTitle,
    @JsonProperty("book_start_page") int bookStartPage,
    @JsonProperty("book_end_page") int bookEndPage,
    @JsonProperty("chapters") List<Chapter> chapters) {}
