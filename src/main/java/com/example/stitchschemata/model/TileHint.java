package com.example.stitchschemata.model;

import com.example.stitchschemata.exception.StitchException;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Manually chosen tile centres for the leading edge of one page, keyed by the
 * page's file name.
 */
@Getter
public class TileHint {

    private static final Pattern FORMAT = Pattern.compile(
            "^(?<name>[^:]+):(?<topX>\\d+),(?<topY>\\d+);(?<bottomX>\\d+),(?<bottomY>\\d+)$");

    private final String basename;
    private final int topX;
    private final int topY;
    private final int bottomX;
    private final int bottomY;

    public TileHint(String basename, int topX, int topY, int bottomX, int bottomY) {
        this.basename = basename;
        this.topX = topX;
        this.topY = topY;
        this.bottomX = bottomX;
        this.bottomY = bottomY;
    }

    /**
     * Parses {@code basename:x,y;x,y}.
     *
     * @throws StitchException if the value does not follow that format
     */
    public static TileHint parse(String value) {
        Matcher matcher = FORMAT.matcher(value == null ? "" : value.trim());
        if (!matcher.matches()) {
            throw new StitchException("Invalid tile hint '" + value + "', expected 'basename:x,y;x,y'.");
        }
        return new TileHint(
                matcher.group("name"),
                Integer.parseInt(matcher.group("topX")),
                Integer.parseInt(matcher.group("topY")),
                Integer.parseInt(matcher.group("bottomX")),
                Integer.parseInt(matcher.group("bottomY")));
    }

    @Override
    public String toString() {
        return basename + ":" + topX + "," + topY + ";" + bottomX + "," + bottomY;
    }
}
