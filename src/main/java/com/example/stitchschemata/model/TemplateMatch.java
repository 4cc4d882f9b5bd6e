package com.example.stitchschemata.model;

import lombok.Getter;

/**
 * Best location of a needle inside a haystack and its normalized correlation.
 */
@Getter
public class TemplateMatch {
    private final int x;
    private final int y;
    private final double score;

    public TemplateMatch(int x, int y, double score) {
        this.x = x;
        this.y = y;
        this.score = score;
    }
}
