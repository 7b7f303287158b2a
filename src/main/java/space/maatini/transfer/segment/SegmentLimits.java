package space.maatini.transfer.segment;

import space.maatini.transfer.common.config.TransferConfig;

/**
 * Part size and part count limits imposed by the remote store.
 */
public record SegmentLimits(long minPartSize, long maxPartSize, long maxPartCount) {

    public static final SegmentLimits S3 = new SegmentLimits(
            TransferConfig.MIN_SEGMENT_SIZE, TransferConfig.MAX_SEGMENT_SIZE, TransferConfig.MAX_PART_COUNT);
}
