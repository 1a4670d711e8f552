package com.provenant.core.verification;

import com.provenant.core.model.ByteRangeDelta;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Byte-level comparison of two artifacts. Produces merged ranges of differing offsets;
 * when one input is longer, its tail is reported as a trailing range.
 */
public final class BinaryDiffer {

    private BinaryDiffer() {}

    public record Result(List<ByteRangeDelta> deltas, boolean truncated) {}

    public static Result diff(InputStream left, InputStream right, int maxRanges) throws IOException {
        var deltas = new ArrayList<ByteRangeDelta>();
        boolean truncated = false;
        try (var a = new BufferedInputStream(left); var b = new BufferedInputStream(right)) {
            long offset = 0;
            long rangeStart = -1;
            while (true) {
                int x = a.read();
                int y = b.read();
                if (x == -1 && y == -1) {
                    break;
                }
                if (x != y) {
                    if (rangeStart < 0) {
                        rangeStart = offset;
                    }
                } else if (rangeStart >= 0) {
                    if (deltas.size() == maxRanges) {
                        truncated = true;
                        rangeStart = -1;
                        break;
                    }
                    deltas.add(new ByteRangeDelta(rangeStart, offset - rangeStart));
                    rangeStart = -1;
                }
                offset++;
            }
            if (rangeStart >= 0) {
                if (deltas.size() == maxRanges) {
                    truncated = true;
                } else {
                    deltas.add(new ByteRangeDelta(rangeStart, offset - rangeStart));
                }
            }
        }
        return new Result(List.copyOf(deltas), truncated);
    }

    public static Result diff(byte[] left, byte[] right, int maxRanges) {
        try {
            return diff(new ByteArrayInputStream(left), new ByteArrayInputStream(right), maxRanges);
        } catch (IOException e) {
            throw new IllegalStateException("In-memory diff failed", e);
        }
    }
}
