package com.assessval.exception;

/**
 * Raised when an operation tries to change a finalized analysis or its entries.
 */
public class AnalysisFinalizedException extends IllegalStateException {

    public AnalysisFinalizedException(String analysisId) {
        super("Analysis is final and can no longer be changed: " + analysisId);
    }
}
