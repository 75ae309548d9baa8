package com.flamingo.ai.papersplit.service.processing;

import com.flamingo.ai.papersplit.service.analysis.model.AnalysisResult;
import com.flamingo.ai.papersplit.service.split.SplitUnit;
import java.util.List;

/**
 * Outcome of analyzing and splitting one document.
 *
 * @param documentName name of the source document
 * @param analysis the persisted analysis
 * @param splitUnits files written, in chapter order
 */
public record ProcessingReport(
    String documentName, AnalysisResult analysis, List<SplitUnit> splitUnits) {}
