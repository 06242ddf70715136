package com.project.scratch.analysis.exceptions;

/** Image bytes that cannot be decoded into pixels. */
public class DecodeException extends AnalysisException {
    public DecodeException(String message) { super(message); }
    public DecodeException(String message, Throwable cause) { super(message, cause); }
}
