package com.example.stitchschemata.exception;

/**
 * Root of all errors raised while stitching, OCR'ing or combining scans.
 * Every subclass is fatal for the run unless documented otherwise.
 */
public class StitchException extends RuntimeException {
    public StitchException(String message) { super(message); }
    public StitchException(String message, Throwable cause) { super(message, cause); }
}
