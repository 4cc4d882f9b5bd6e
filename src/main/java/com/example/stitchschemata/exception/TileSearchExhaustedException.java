package com.example.stitchschemata.exception;

/** No tile pair met the texture minimum or the distance constraint. */
public class TileSearchExhaustedException extends AlignmentFailedException {
    public TileSearchExhaustedException(String message) { super(message); }
}
