package com.flamingo.ai.papersplit.service.analysis;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Determines the title of a composite document: metadata first, then the first page's text. */
@Component
@Slf4j
public class BookTitleExtractor {

  static final String UNKNOWN_TITLE = "Unknown Title";

  /**
   * Extracts the document title.
   *
   * @param document open source document
   * @return the metadata title, else the first non-blank line of page 1, else {@value
   *     #UNKNOWN_TITLE}
   */
  public String extractTitle(PDDocument document) {
    PDDocumentInformation info = document.getDocumentInformation();
    if (info != null && info.getTitle() != null && !info.getTitle().isBlank()) {
      return info.getTitle().strip();
    }

    if (document.getNumberOfPages() == 0) {
      return UNKNOWN_TITLE;
    }

    try {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setStartPage(1);
      stripper.setEndPage(1);
      String text = stripper.getText(document);
      for (String line : text.split("\\R")) {
        if (!line.isBlank()) {
          return line.strip();
        }
      }
    } catch (IOException e) {
      log.warn("Could not extract title from first page: {}", e.getMessage());
    }
    return UNKNOWN_TITLE;
  }
}
