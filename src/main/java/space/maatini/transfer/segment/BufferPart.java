package space.maatini.transfer.segment;

/**
 * One segment of a {@link LogicalRange}.
 *
 * @param start             absolute offset of the first byte
 * @param end               absolute offset one past the last byte
 * @param destinationOffset offset of the first byte inside the caller's buffer
 */
public record BufferPart(long start, long end, long destinationOffset) {

    public long length() {
        return end - start;
    }

    /**
     * HTTP range header for this part. The remote range is inclusive, so the exclusive end loses one.
     */
    public String rangeHeader() {
        return "bytes=" + start + "-" + (end - 1);
    }
}
