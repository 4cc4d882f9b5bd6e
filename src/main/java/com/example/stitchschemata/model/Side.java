package com.example.stitchschemata.model;

/**
 * Which vertical band of a page tiles are extracted from.
 * LEFT is the leading edge (overlaps the previous page), RIGHT the trailing edge.
 */
public enum Side {
    LEFT,
    RIGHT
}
