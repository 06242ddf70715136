package com.project.scratch.analysis.exceptions;

/** Base type of all scratch analysis failures. */
public class AnalysisException extends RuntimeException {
    public AnalysisException(String message) { super(message); }
    public AnalysisException(String message, Throwable cause) { super(message, cause); }
}
