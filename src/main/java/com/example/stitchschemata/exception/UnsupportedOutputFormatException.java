package com.example.stitchschemata.exception;

/** The output path has an extension no encoder is registered for. */
public class UnsupportedOutputFormatException extends StitchException {
    public UnsupportedOutputFormatException(String message) { super(message); }
}
