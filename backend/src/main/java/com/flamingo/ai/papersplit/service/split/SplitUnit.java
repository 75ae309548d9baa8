package com.flamingo.ai.papersplit.service.split;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One output PDF written by the {@link DocumentSplitter}.
 *
 * @param filename output file name
 * @param folder output folder name
 * @param path location the file was written to
 * @param sourcePageRange requested source range as {@code "start-end"}
 * @param pageCountWritten pages actually copied, which may be fewer than requested
 * @param chapterName header name of the chapter
 */
public record SplitUnit(
    @JsonProperty("filename") String filename,
    @JsonProperty("folder") String folder,
    @JsonProperty("path") String path,
    @JsonProperty("pages") String sourcePageRange,
    @JsonProperty("page_count") int pageCountWritten,
    @JsonProperty("chapter_name") String chapterName) {}
