package com.example.stitchschemata.exception;

/** The accumulated rotation of a page left the configured range; the page is assumed misscanned. */
public class RotationExceededException extends StitchException {
    public RotationExceededException(String message) { super(message); }
}
