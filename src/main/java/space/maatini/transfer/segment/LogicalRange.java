package space.maatini.transfer.segment;

import space.maatini.transfer.common.exception.ValidationException;

/**
 * A byte range {@code [start, start + size)} of a remote object, transferred into or out of a
 * caller-owned buffer whose first byte corresponds to {@code start}.
 */
public record LogicalRange(long start, long size) {

    public LogicalRange {
        if (start < 0 || size < 0) {
            throw new ValidationException(String.format("Invalid range: start=%d size=%d", start, size));
        }
        if (size > Long.MAX_VALUE - start) {
            throw new ValidationException(String.format("Range overflows: start=%d size=%d", start, size));
        }
    }

    public static LogicalRange of(long start, long size) {
        return new LogicalRange(start, size);
    }

    public long end() {
        return start + size;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
