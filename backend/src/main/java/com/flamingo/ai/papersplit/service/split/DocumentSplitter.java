package com.flamingo.ai.papersplit.service.split;

import com.flamingo.ai.papersplit.service.analysis.model.AnalysisResult;
import com.flamingo.ai.papersplit.service.analysis.model.Chapter;
import com.flamingo.ai.papersplit.service.analysis.model.OutputFolder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/**
 * Copies the page range of every routable chapter into its own PDF.
 *
 * <p>Chapters are processed in order and independently: a chapter with an invalid range, without
 * an output location, whose pages all fail to copy, or whose file cannot be written is logged and
 * skipped. Splitting never throws because of a single chapter; callers judge the outcome from the
 * returned list.
 */
@Service
@Slf4j
public class DocumentSplitter {

  /**
   * Splits the source document according to an analysis.
   *
   * @param source open source document; stays open and unmodified
   * @param analysis analysis of {@code source}, either fresh or reloaded from its JSON artifact
   * @param outputRoot directory under which {@code folder/filename} files are written
   * @return one unit per written file, in chapter order
   */
  public List<SplitUnit> split(PDDocument source, AnalysisResult analysis, Path outputRoot) {
    List<SplitUnit> units = new ArrayList<>();
    List<Chapter> chapters = analysis.chapters() != null ? analysis.chapters() : List.of();
    int totalPages = source.getNumberOfPages();

    int index = 0;
    for (Chapter chapter : chapters) {
      index++;
      if (chapter == null) {
        log.warn("Skipping chapter {}: empty entry", index);
        continue;
      }
      splitChapter(source, chapter, totalPages, outputRoot).ifPresent(units::add);
    }

    log.info(
        "Split {} of {} chapters into separate files under {}",
        units.size(),
        chapters.size(),
        outputRoot);
    return units;
  }

  private Optional<SplitUnit> splitChapter(
      PDDocument source, Chapter chapter, int totalPages, Path outputRoot) {
    String name = chapter.chapterName() != null ? chapter.chapterName() : "unknown";
    Integer startPage = chapter.startPage();
    Integer endPage = chapter.endPage();

    if (startPage == null || endPage == null) {
      log.warn("Skipping chapter '{}': missing page numbers", name);
      return Optional.empty();
    }
    if (startPage < 1 || endPage < startPage || startPage > totalPages) {
      log.warn(
          "Skipping chapter '{}': invalid page range {}-{} for {} pages",
          name,
          startPage,
          endPage,
          totalPages);
      return Optional.empty();
    }
    if (!chapter.isRoutable()) {
      log.warn("Skipping chapter '{}': no output filename or folder", name);
      return Optional.empty();
    }
    Optional<OutputFolder> folder = OutputFolder.fromDirectoryName(chapter.outputFolder());
    if (folder.isEmpty()) {
      log.warn("Skipping chapter '{}': unknown output folder '{}'", name, chapter.outputFolder());
      return Optional.empty();
    }

    Path folderDir = outputRoot.resolve(folder.get().getDirectoryName()).normalize();
    Path target;
    try {
      target = folderDir.resolve(chapter.outputFilename()).normalize();
    } catch (InvalidPathException e) {
      log.warn(
          "Skipping chapter '{}': illegal output filename '{}': {}",
          name,
          chapter.outputFilename(),
          e.getMessage());
      return Optional.empty();
    }
    if (!folderDir.equals(target.getParent())) {
      log.warn(
          "Skipping chapter '{}': illegal output filename '{}'", name, chapter.outputFilename());
      return Optional.empty();
    }
    int lastPage = Math.min(endPage, totalPages);

    try (PDDocument output = new PDDocument()) {
      int pagesCopied = copyPages(source, output, startPage, lastPage, name);
      if (pagesCopied == 0) {
        log.warn("Skipping chapter '{}': no pages could be copied", name);
        return Optional.empty();
      }

      Files.createDirectories(target.getParent());
      output.save(target.toFile());
      log.info(
          "Wrote '{}' pages {}-{} ({} pages) to {}", name, startPage, endPage, pagesCopied, target);

      return Optional.of(
          new SplitUnit(
              chapter.outputFilename(),
              folder.get().getDirectoryName(),
              target.toString(),
              startPage + "-" + endPage,
              pagesCopied,
              name));
    } catch (IOException e) {
      log.error(
          "Failed to write split PDF for chapter '{}' to {}: {}", name, target, e.getMessage());
      return Optional.empty();
    }
  }

  /** Imports the 1-based inclusive page range; pages that fail are logged and left out. */
  private int copyPages(
      PDDocument source, PDDocument output, int firstPage, int lastPage, String chapterName) {
    int copied = 0;
    for (int pageNumber = firstPage; pageNumber <= lastPage; pageNumber++) {
      try {
        output.importPage(source.getPage(pageNumber - 1));
        copied++;
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Could not copy page {} into chapter '{}': {}",
            pageNumber,
            chapterName,
            e.getMessage());
      }
    }
    return copied;
  }
}
