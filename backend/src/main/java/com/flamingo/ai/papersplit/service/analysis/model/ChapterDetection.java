package com.flamingo.ai.papersplit.service.analysis.model;

/**
 * A paper header recognized on a single page.
 *
 * @param name the matched header text, whitespace-normalized (e.g. {@code "UNSOLVED Self
 *     Assessment Paper-1"})
 * @param tag status token of the header ({@code SOLVED}, {@code UNSOLVED}, {@code SOLUTIONS}) or
 *     {@code NA} when the header carries none
 * @param page 1-based page number the header was found on
 */
public record ChapterDetection(String name, String tag, int page) {}
