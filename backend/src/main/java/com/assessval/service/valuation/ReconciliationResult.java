package com.assessval.service.valuation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a successful reconciliation.
 *
 * @param analysisId           reconciled analysis
 * @param valueConclusion      weighted average written to the analysis
 * @param participatingEntries number of entries that contributed a value
 * @param totalWeight          sum of the contributing weights
 * @param propertyUpdated      whether the subject property's current value was overwritten
 * @param warnings             included entries left out of the computation, with the reason
 */
public record ReconciliationResult(
    String analysisId,
    BigDecimal valueConclusion,
    int participatingEntries,
    BigDecimal totalWeight,
    boolean propertyUpdated,
    List<String> warnings
) {
}
