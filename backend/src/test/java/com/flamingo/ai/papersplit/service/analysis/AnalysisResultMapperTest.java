package com.flamingo.ai.papersplit.service.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.papersplit.service.analysis.model.AnalysisResult;
import com.flamingo.ai.papersplit.service.analysis.model.Chapter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnalysisResultMapperTest {

  private AnalysisResultMapper mapper;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
    mapper = new AnalysisResultMapper(objectMapper);
  }

  private static AnalysisResult sampleResult() {
    return new AnalysisResult(
        75,
        "Science Class 10",
        1,
        40,
        List.of(
            new Chapter(
                "UNSOLVED Self Assessment Paper-1",
                "UNSOLVED",
                1,
                10,
                "SAP-1.pdf",
                "question_papers"),
            Chapter.unrouted("Mind Map-2", "NA", 11, 40)));
  }

  @Test
  @DisplayName("Should write the snake_case analysis layout")
  void shouldWriteSnakeCaseFields() throws Exception {
    JsonNode json = objectMapper.readTree(mapper.toJson(sampleResult()));

    assertThat(json.get("confidence_score").asInt()).isEqualTo(75);
    assertThat(json.get("book_title").asText()).isEqualTo("Science Class 10");
    assertThat(json.get("book_start_page").asInt()).isEqualTo(1);
    assertThat(json.get("book_end_page").asInt()).isEqualTo(40);

    JsonNode first = json.get("chapters").get(0);
    assertThat(first.get("chapter_name").asText()).isEqualTo("UNSOLVED Self Assessment Paper-1");
    assertThat(first.get("tag").asText()).isEqualTo("UNSOLVED");
    assertThat(first.get("chapter_start_page_number").asInt()).isEqualTo(1);
    assertThat(first.get("chapter_end_page_number").asInt()).isEqualTo(10);
    assertThat(first.get("pdf_filename").asText()).isEqualTo("SAP-1.pdf");
    assertThat(first.get("pdf_folder").asText()).isEqualTo("question_papers");
  }

  @Test
  @DisplayName("Should omit the output location of unclassified chapters")
  void shouldOmitOutputFields_whenUnclassified() throws Exception {
    JsonNode chapter = objectMapper.readTree(mapper.toJson(sampleResult())).get("chapters").get(1);

    assertThat(chapter.has("pdf_filename")).isFalse();
    assertThat(chapter.has("pdf_folder")).isFalse();
    assertThat(chapter.has("routable")).isFalse();
  }

  @Test
  @DisplayName("Should read back what it wrote")
  void shouldReadWrittenJson() throws Exception {
    AnalysisResult original = sampleResult();

    AnalysisResult reloaded = mapper.fromJson(mapper.toJson(original));

    assertThat(reloaded).isEqualTo(original);
  }

  @Test
  @DisplayName("Should ignore fields it does not know")
  void shouldIgnoreUnknownFields() throws Exception {
    String json =
        """
        {
          "confidence_score": 80,
          "book_title": "Edited",
          "book_start_page": 1,
          "book_end_page": 12,
          "reviewed_by": "editor",
          "chapters": [
            {
              "chapter_name": "PP-1",
              "tag": "UNSOLVED",
              "chapter_start_page_number": 1,
              "chapter_end_page_number": 12,
              "pdf_filename": "PP-1.pdf",
              "pdf_folder": "question_papers",
              "note": "checked"
            }
          ]
        }
        """;

    AnalysisResult result = mapper.fromJson(json.getBytes(StandardCharsets.UTF_8));

    assertThat(result.bookTitle()).isEqualTo("Edited");
    assertThat(result.chapters())
        .singleElement()
        .extracting(Chapter::outputFilename)
        .isEqualTo("PP-1.pdf");
  }

  @Test
  @DisplayName("Should bind a validated tree to the same result as the raw bytes")
  void shouldBindTree() throws Exception {
    byte[] json = mapper.toJson(sampleResult());

    assertThat(mapper.fromTree(mapper.readTree(json))).isEqualTo(mapper.fromJson(json));
  }

  @Test
  @DisplayName("A chapter with an unreadable page number should keep its other fields")
  void shouldLeavePageNull_whenPageIsNotNumeric() throws Exception {
    // Given
    String json =
        """
        {"book_title": "x", "chapters": [
          {"chapter_name": "PP-1", "tag": "UNSOLVED", "chapter_start_page_number": "first",
           "chapter_end_page_number": 2, "pdf_filename": "PP-1.pdf",
           "pdf_folder": "question_papers"},
          {"chapter_name": "PP-2", "tag": "UNSOLVED", "chapter_start_page_number": 3,
           "chapter_end_page_number": 6, "pdf_filename": "PP-2.pdf",
           "pdf_folder": "question_papers"},
          "not a chapter"
        ]}
        """;

    // When
    AnalysisResult result = mapper.fromJson(json.getBytes(StandardCharsets.UTF_8));

    // Then
    assertThat(result.bookTitle()).isEqualTo("x");
    assertThat(result.chapters()).hasSize(3);
    assertThat(result.chapters().get(0))
        .isEqualTo(new Chapter("PP-1", "UNSOLVED", null, 2, "PP-1.pdf", "question_papers"));
    assertThat(result.chapters().get(1))
        .isEqualTo(new Chapter("PP-2", "UNSOLVED", 3, 6, "PP-2.pdf", "question_papers"));
    assertThat(result.chapters().get(2)).isNull();
  }

  @Test
  @DisplayName("Should reject a document-level field of the wrong type")
  void shouldFail_whenBookFieldIsNotNumeric() {
    String json =
        """
        {"book_title": "x", "book_end_page": "last", "chapters": []}
        """;

    assertThatThrownBy(() -> mapper.fromJson(json.getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(IOException.class);
  }
}
