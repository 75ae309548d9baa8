package com.flamingo.ai.papersplit.service.analysis;

import com.flamingo.ai.papersplit.config.SplitterConfig;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

/**
 * Extracts the text printed in the header band of a PDF page.
 *
 * <p>Words reported by PDFBox are grouped into lines (same baseline within {@code
 * splitter.header.line-tolerance}) and lines into blocks (vertical gap no larger than {@code
 * splitter.header.block-gap-ratio} times the line height). A block belongs to the header when its
 * top edge lies within the top {@code splitter.header.region-ratio} of the page. Lines inside a
 * block are joined with {@code \n}; header blocks are joined with a single space.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageHeaderExtractor {

  private final SplitterConfig splitterConfig;

  /**
   * Returns the header text of every page, indexed by {@code pageNumber - 1}.
   *
   * <p>A page whose text cannot be read contributes an empty header.
   *
   * @param document open source document
   * @return one header string per page, never null
   */
  public List<String> extractHeaders(PDDocument document) {
    int pageCount = document.getNumberOfPages();
    List<String> headers = new ArrayList<>(pageCount);
    for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
      try {
        headers.add(extractHeader(document, pageNumber));
      } catch (IOException | RuntimeException e) {
        log.warn("Could not read header text of page {}: {}", pageNumber, e.getMessage());
        headers.add("");
      }
    }
    return headers;
  }

  /**
   * Returns the header text of a single page.
   *
   * @param document open source document
   * @param pageNumber 1-based page number
   * @return concatenated header blocks, or an empty string when the header band holds no text
   * @throws IOException if PDFBox cannot read the page content
   */
  public String extractHeader(PDDocument document, int pageNumber) throws IOException {
    SplitterConfig.Header config = splitterConfig.getHeader();
    BlockCollectingStripper stripper =
        new BlockCollectingStripper(config.getLineTolerance(), config.getBlockGapRatio());
    stripper.setStartPage(pageNumber);
    stripper.setEndPage(pageNumber);
    stripper.getText(document);

    float headerLimit = stripper.getPageHeight() * config.getRegionRatio();
    String header =
        stripper.getBlocks().stream()
            .filter(block -> block.top() < headerLimit)
            .map(TextBlock::text)
            .map(String::strip)
            .filter(text -> !text.isEmpty())
            .collect(Collectors.joining(" "));
    log.debug("Page {} header: '{}'", pageNumber, header);
    return header;
  }

  // ---- inner types ----

  /**
   * A run of vertically adjacent lines.
   *
   * @param text lines joined with {@code \n}
   * @param top distance of the block's upper edge from the top of the page
   */
  record TextBlock(String text, float top) {}

  private record Line(StringBuilder text, float baseline, float top, float bottom) {}

  /** Collects positioned words for one page and groups them into lines and blocks. */
  private static final class BlockCollectingStripper extends PDFTextStripper {

    private final float lineTolerance;
    private final float blockGapRatio;
    private final List<Line> lines = new ArrayList<>();
    private float pageHeight;

    BlockCollectingStripper(float lineTolerance, float blockGapRatio) throws IOException {
      super();
      this.lineTolerance = lineTolerance;
      this.blockGapRatio = blockGapRatio;
      setSortByPosition(true);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
      pageHeight = page.getCropBox().getHeight();
      super.startPage(page);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
      if (text == null || text.isBlank() || textPositions.isEmpty()) {
        return;
      }
      float baseline = textPositions.get(0).getYDirAdj();
      float height = 0f;
      for (TextPosition position : textPositions) {
        height = Math.max(height, position.getHeightDir());
      }
      float top = baseline - height;

      Line current = lines.isEmpty() ? null : lines.get(lines.size() - 1);
      if (current != null && Math.abs(current.baseline() - baseline) <= lineTolerance) {
        current.text().append(' ').append(text);
        lines.set(
            lines.size() - 1,
            new Line(
                current.text(),
                current.baseline(),
                Math.min(current.top(), top),
                Math.max(current.bottom(), baseline)));
      } else {
        lines.add(new Line(new StringBuilder(text), baseline, top, baseline));
      }
    }

    float getPageHeight() {
      return pageHeight;
    }

    List<TextBlock> getBlocks() {
      List<TextBlock> blocks = new ArrayList<>();
      StringBuilder blockText = null;
      float blockTop = 0f;
      Line previous = null;
      for (Line line : lines) {
        boolean continuesBlock =
            previous != null
                && line.top() >= previous.top()
                && line.top() - previous.bottom()
                    <= (previous.bottom() - previous.top()) * blockGapRatio;
        if (continuesBlock) {
          blockText.append('\n').append(line.text());
        } else {
          if (blockText != null) {
            blocks.add(new TextBlock(blockText.toString(), blockTop));
          }
          blockText = new StringBuilder(line.text());
          blockTop = line.top();
        }
        previous = line;
      }
      if (blockText != null) {
        blocks.add(new TextBlock(blockText.toString(), blockTop));
      }
      return blocks;
    }
  }
}
