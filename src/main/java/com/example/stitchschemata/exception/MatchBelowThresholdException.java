package com.example.stitchschemata.exception;

/** A tile was located, but with a correlation below the configured minimum. */
public class MatchBelowThresholdException extends AlignmentFailedException {
    public MatchBelowThresholdException(String message) { super(message); }
}
