package com.assessval.exception;

import lombok.Getter;

import java.util.List;

/**
 * Reconciliation found no included entry with a usable value, so no
 * conclusion can be drawn. The analysis is left untouched.
 */
@Getter
public class NoParticipatingEntriesException extends RuntimeException {

    private final String analysisId;
    private final List<String> warnings;

    public NoParticipatingEntriesException(String analysisId, List<String> warnings) {
        super("Analysis " + analysisId + " has no participating entries with a resolvable value");
        this.analysisId = analysisId;
        this.warnings = List.copyOf(warnings);
    }
}
