package com.assessval.service.valuation;

import com.assessval.model.property.Property;

/**
 * A candidate comparable with its similarity score. Computed per request and
 * never stored. The score is an ordinal ranking signal, not a probability.
 */
public record ComparableCandidate(Property property, double similarityScore) {}
