package com.vidnyan.trustgate.domain.syntax;

/**
 * Zero-based row/column position in source text.
 */
public record Point(int row, int column) {

    public static final Point ORIGIN = new Point(0, 0);
}
