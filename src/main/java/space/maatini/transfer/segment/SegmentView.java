package space.maatini.transfer.segment;

import space.maatini.transfer.common.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a logical range into contiguous, non-overlapping parts.
 * <p>
 * The result is plain data: building twice from the same inputs gives equal lists, and a list can
 * be walked again to retry a transfer.
 */
public final class SegmentView {

    private SegmentView() {
    }

    /**
     * Partition {@code range} with the remote store's default part size bounds.
     */
    public static List<BufferPart> build(LogicalRange range, long segmentSize, long maxPartCount) {
        return build(range, segmentSize,
                new SegmentLimits(SegmentLimits.S3.minPartSize(), SegmentLimits.S3.maxPartSize(), maxPartCount));
    }

    /**
     * Partition {@code range} into parts of {@code segmentSize} bytes (the last one may be shorter).
     * <p>
     * If that would need more than {@code limits.maxPartCount()} parts the segment size is enlarged to
     * the smallest size that fits, which must stay within the part size bounds.
     *
     * @throws ValidationException if no segment size within the bounds can cover the range
     */
    public static List<BufferPart> build(LogicalRange range, long segmentSize, SegmentLimits limits) {
        if (segmentSize < 1) {
            throw new ValidationException("Segment size must be positive: " + segmentSize);
        }
        if (limits.maxPartCount() < 1) {
            throw new ValidationException("Part count limit must be positive: " + limits.maxPartCount());
        }
        if (range.isEmpty()) {
            return Collections.emptyList();
        }

        long size = range.size();
        long effective = segmentSize;
        if (ceilDiv(size, segmentSize) > limits.maxPartCount()) {
            effective = ceilDiv(size, limits.maxPartCount());
            if (effective < limits.minPartSize() || effective > limits.maxPartSize()) {
                throw new ValidationException(String.format(
                        "Cannot segment %d bytes into at most %d parts: segment %d outside [%d, %d]",
                        size, limits.maxPartCount(), effective, limits.minPartSize(), limits.maxPartSize()));
            }
        }

        int count = Math.toIntExact(ceilDiv(size, effective));
        List<BufferPart> parts = new ArrayList<>(count);
        for (long offset = 0; offset < size; offset += effective) {
            long length = Math.min(effective, size - offset);
            parts.add(new BufferPart(range.start() + offset, range.start() + offset + length, offset));
        }
        return Collections.unmodifiableList(parts);
    }

    private static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
