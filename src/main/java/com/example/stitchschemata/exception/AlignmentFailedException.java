package com.example.stitchschemata.exception;

/**
 * Alignment of two neighbouring pages failed in one search direction.
 * The caller may retry in the reverse direction before giving up.
 */
public abstract class AlignmentFailedException extends StitchException {
    protected AlignmentFailedException(String message) { super(message); }
}
