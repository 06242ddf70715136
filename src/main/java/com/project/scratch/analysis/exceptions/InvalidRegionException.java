package com.project.scratch.analysis.exceptions;

/** Region with an empty area or one that does not fit inside the image. */
public class InvalidRegionException extends AnalysisException {
    public InvalidRegionException(String message) { super(message); }
}
