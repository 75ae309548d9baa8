package com.flamingo.ai.papersplit.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A resolved page range for one paper inside the composite document.
 *
 * <p>Page numbers are 1-based and inclusive. They are only null when a chapter was reloaded from a
 * persisted analysis that omitted them; the splitter skips such chapters.
 *
 * @param chapterName header text that opened the range
 * @param tag status tag of the header
 * @param startPage first page of the range
 * @param endPage last page of the range
 * @param outputFilename target file name, or null when the chapter is unclassified
 * @param outputFolder target folder name, or null when the chapter is unclassified
 */
public record Chapter(
    @JsonProperty("chapter_name") String chapterName,
    @JsonProperty("tag") String tag,
    @JsonProperty("chapter_start_page_number") Integer startPage,
    @JsonProperty("chapter_end_page_number") Integer endPage,
    @JsonProperty("pdf_filename") @JsonInclude(JsonInclude.Include.NON_NULL)
        String outputFilename,
    @JsonProperty("pdf_folder") @JsonInclude(JsonInclude.Include.NON_NULL) String outputFolder) {

  /** Creates a chapter that has not been routed to an output file yet. */
  public static Chapter unrouted(String chapterName, String tag, int startPage, int endPage) {
    return new Chapter(chapterName, tag, startPage, endPage, null, null);
  }

  /** Returns a copy of this chapter carrying the output location of the classification. */
  public Chapter withClassification(Classification classification) {
    if (classification instanceof Classification.Classified classified) {
      return new Chapter(
          chapterName,
          tag,
          startPage,
          endPage,
          classified.filename(),
          classified.folder().getDirectoryName());
    }
    return new Chapter(chapterName, tag, startPage, endPage, null, null);
  }

  @JsonIgnore
  public boolean isRoutable() {
    return outputFilename != null
        && !outputFilename.isBlank()
        && outputFolder != null
        && !outputFolder.isBlank();
  }
}
