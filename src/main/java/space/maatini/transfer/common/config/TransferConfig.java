package space.maatini.transfer.common.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import space.maatini.transfer.common.exception.ValidationException;
import space.maatini.transfer.segment.SegmentLimits;

import java.util.Optional;

/**
 * Transfer engine settings.
 * <p>
 * Injected from {@code transfer.*} properties inside a container; {@link #defaults()} gives the same
 * values for standalone use.
 */
@ApplicationScoped
public class TransferConfig {

    public static final long MIB = 1024L * 1024L;
    public static final long GIB = 1024L * MIB;

    /** Remote store limits and the defaults of the AWS command line tools. */
    public static final long DEFAULT_SEGMENT_SIZE = 8 * MIB;
    public static final long MIN_SEGMENT_SIZE = 5 * MIB;
    public static final long MAX_SEGMENT_SIZE = 5 * GIB;
    public static final int MAX_PART_COUNT = 10_000;
    // the service accepts 1000 keys per request, stay a little under it
    public static final int DELETE_BATCH_LIMIT = 995;
    public static final int REMOTE_DELETE_LIMIT = 1000;

    @ConfigProperty(name = "transfer.region", defaultValue = "us-east-1")
    String region;

    @ConfigProperty(name = "transfer.endpoint-override")
    Optional<String> endpointOverride;

    @ConfigProperty(name = "transfer.worker-threads", defaultValue = "36")
    int workerThreads;

    @ConfigProperty(name = "transfer.segment.default-size", defaultValue = "8388608")
    long defaultSegmentSize;

    @ConfigProperty(name = "transfer.segment.min-size", defaultValue = "5242880")
    long minSegmentSize;

    @ConfigProperty(name = "transfer.segment.max-size", defaultValue = "5368709120")
    long maxSegmentSize;

    @ConfigProperty(name = "transfer.segment.max-part-count", defaultValue = "10000")
    int maxPartCount;

    @ConfigProperty(name = "transfer.multipart.threshold", defaultValue = "5242880")
    long multipartThreshold;

    @ConfigProperty(name = "transfer.delete.batch-limit", defaultValue = "995")
    int deleteBatchLimit;

    @ConfigProperty(name = "transfer.part-failure-policy", defaultValue = "PROPAGATE")
    PartFailurePolicy partFailurePolicy;

    public static TransferConfig defaults() {
        TransferConfig config = new TransferConfig();
        config.region = "us-east-1";
        config.endpointOverride = Optional.empty();
        config.workerThreads = 36;
        config.defaultSegmentSize = DEFAULT_SEGMENT_SIZE;
        config.minSegmentSize = MIN_SEGMENT_SIZE;
        config.maxSegmentSize = MAX_SEGMENT_SIZE;
        config.maxPartCount = MAX_PART_COUNT;
        config.multipartThreshold = MIN_SEGMENT_SIZE;
        config.deleteBatchLimit = DELETE_BATCH_LIMIT;
        config.partFailurePolicy = PartFailurePolicy.PROPAGATE;
        return config;
    }

    /**
     * Check the settings against each other and against the remote store's hard limits.
     *
     * @return this config
     * @throws ValidationException if a value is out of range
     */
    public TransferConfig validate() {
        if (workerThreads < 1) {
            throw new ValidationException("transfer.worker-threads must be positive: " + workerThreads);
        }
        if (minSegmentSize < 1 || minSegmentSize > maxSegmentSize) {
            throw new ValidationException(String.format(
                    "Segment size bounds are inconsistent: min=%d max=%d", minSegmentSize, maxSegmentSize));
        }
        if (defaultSegmentSize < minSegmentSize || defaultSegmentSize > maxSegmentSize) {
            throw new ValidationException(String.format(
                    "Default segment size %d outside [%d, %d]", defaultSegmentSize, minSegmentSize, maxSegmentSize));
        }
        if (maxPartCount < 1) {
            throw new ValidationException("transfer.segment.max-part-count must be positive: " + maxPartCount);
        }
        if (multipartThreshold < 0) {
            throw new ValidationException("transfer.multipart.threshold must not be negative: " + multipartThreshold);
        }
        if (deleteBatchLimit < 1 || deleteBatchLimit > REMOTE_DELETE_LIMIT) {
            throw new ValidationException(String.format(
                    "transfer.delete.batch-limit must be within [1, %d]: %d", REMOTE_DELETE_LIMIT, deleteBatchLimit));
        }
        return this;
    }

    public SegmentLimits segmentLimits() {
        return new SegmentLimits(minSegmentSize, maxSegmentSize, maxPartCount);
    }

    // ==================== Accessors ====================

    public String region() {
        return region;
    }

    public Optional<String> endpointOverride() {
        return endpointOverride;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public long defaultSegmentSize() {
        return defaultSegmentSize;
    }

    public long minSegmentSize() {
        return minSegmentSize;
    }

    public long maxSegmentSize() {
        return maxSegmentSize;
    }

    public int maxPartCount() {
        return maxPartCount;
    }

    public long multipartThreshold() {
        return multipartThreshold;
    }

    public int deleteBatchLimit() {
        return deleteBatchLimit;
    }

    public PartFailurePolicy partFailurePolicy() {
        return partFailurePolicy;
    }

    // ==================== Overrides ====================

    public TransferConfig region(String region) {
        this.region = region;
        return this;
    }

    public TransferConfig endpointOverride(String endpoint) {
        this.endpointOverride = Optional.ofNullable(endpoint);
        return this;
    }

    public TransferConfig workerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
        return this;
    }

    public TransferConfig defaultSegmentSize(long size) {
        this.defaultSegmentSize = size;
        return this;
    }

    public TransferConfig minSegmentSize(long size) {
        this.minSegmentSize = size;
        return this;
    }

    public TransferConfig maxSegmentSize(long size) {
        this.maxSegmentSize = size;
        return this;
    }

    public TransferConfig maxPartCount(int count) {
        this.maxPartCount = count;
        return this;
    }

    public TransferConfig multipartThreshold(long threshold) {
        this.multipartThreshold = threshold;
        return this;
    }

    public TransferConfig deleteBatchLimit(int limit) {
        this.deleteBatchLimit = limit;
        return this;
    }

    public TransferConfig partFailurePolicy(PartFailurePolicy policy) {
        this.partFailurePolicy = policy;
        return this;
    }
}
