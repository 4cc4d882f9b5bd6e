package com.example.stitchschemata.exception;

/** An input image could not be read or decoded. */
public class ImageDecodeException extends StitchException {
    public ImageDecodeException(String message) { super(message); }
    public ImageDecodeException(String message, Throwable cause) { super(message, cause); }
}
