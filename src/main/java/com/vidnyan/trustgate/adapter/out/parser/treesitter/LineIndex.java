package com.vidnyan.trustgate.adapter.out.parser.treesitter;

import com.vidnyan.trustgate.domain.syntax.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps character offsets to zero-based row/column points.
 */
public final class LineIndex {

    private final int[] lineStarts;

    public LineIndex(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public Point pointAt(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        int row = idx >= 0 ? idx : -idx - 2;
        return new Point(row, offset - lineStarts[row]);
    }
}
