package com.flamingo.ai.papersplit.service.analysis;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.papersplit.service.analysis.model.AnalysisResult;
import com.flamingo.ai.papersplit.service.analysis.model.Chapter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the persisted analysis artifact.
 *
 * <p>The JSON uses the snake_case field names of {@link AnalysisResult} and {@link
 * com.flamingo.ai.papersplit.service.analysis.model.Chapter}; unclassified chapters omit {@code
 * pdf_filename} and {@code pdf_folder}. Unknown fields are ignored when reading.
 *
 * <p>Chapters are bound one by one. A chapter that does not fit the layout keeps the fields that
 * do, with unreadable page numbers left null, so the splitter skips it and still splits the rest.
 * An entry that is not an object at all is read as null.
 */
@Component
@Slf4j
public class AnalysisResultMapper {

  private final ObjectMapper objectMapper;
  private final ObjectWriter writer;
  private final ObjectReader reader;
  private final ObjectReader chapterReader;

  public AnalysisResultMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.writer = objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT);
    this.reader =
        objectMapper
            .readerFor(AnalysisResult.class)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.chapterReader =
        objectMapper
            .readerFor(Chapter.class)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Serializes an analysis result.
   *
   * @param result the result to write
   * @return UTF-8 JSON bytes
   * @throws IOException if serialization fails
   */
  public byte[] toJson(AnalysisResult result) throws IOException {
    return writer.writeValueAsBytes(result);
  }

  /**
   * Parses raw JSON into a tree, for validation before binding.
   *
   * @param json UTF-8 JSON bytes
   * @return the parsed tree
   * @throws IOException if the bytes are not valid JSON
   */
  public JsonNode readTree(byte[] json) throws IOException {
    return objectMapper.readTree(json);
  }

  /**
   * Binds a JSON tree to an analysis result.
   *
   * @param tree parsed JSON
   * @return the analysis result
   * @throws IOException if the document-level fields do not fit the contract
   */
  public AnalysisResult fromTree(JsonNode tree) throws IOException {
    JsonNode chapterNodes = tree.get("chapters");
    if (!(tree instanceof ObjectNode root) || chapterNodes == null || !chapterNodes.isArray()) {
      return reader.readValue(tree);
    }

    ObjectNode header = root.deepCopy();
    header.remove("chapters");
    AnalysisResult document = reader.readValue(header);

    List<Chapter> chapters = new ArrayList<>(chapterNodes.size());
    for (int i = 0; i < chapterNodes.size(); i++) {
      chapters.add(readChapter(i, chapterNodes.get(i)));
    }
    return new AnalysisResult(
        document.confidenceScore(),
        document.bookTitle(),
        document.bookStartPage(),
        document.bookEndPage(),
        chapters);
  }

  private Chapter readChapter(int index, JsonNode node) {
    if (node == null || !node.isObject()) {
      log.warn("Chapter {} is not an object; it will be skipped", index);
      return null;
    }
    try {
      return chapterReader.readValue(node);
    } catch (IOException e) {
      log.warn("Chapter {} does not fit the analysis layout: {}", index, e.getMessage());
      return new Chapter(
          text(node, "chapter_name"),
          text(node, "tag"),
          pageNumber(node, "chapter_start_page_number"),
          pageNumber(node, "chapter_end_page_number"),
          text(node, "pdf_filename"),
          text(node, "pdf_folder"));
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
  }

  private static Integer pageNumber(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isIntegralNumber() && value.canConvertToInt()
        ? value.intValue()
        : null;
  }

  /**
   * Deserializes an analysis result.
   *
   * @param json UTF-8 JSON bytes
   * @return the analysis result
   * @throws IOException if the bytes are not valid JSON or the document-level fields do not fit
   *     the contract
   */
  public AnalysisResult fromJson(byte[] json) throws IOException {
    return fromTree(readTree(json));
  }
}
