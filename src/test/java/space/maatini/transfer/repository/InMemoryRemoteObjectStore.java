package space.maatini.transfer.repository;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Remote store kept in memory for tests. Results complete on a small thread pool, like a real
 * client's callbacks.
 * <p>
 * Failures can be scripted per operation, per part, or for the n-th delete batch. Part uploads can
 * be held and released in any order.
 */
public class InMemoryRemoteObjectStore implements RemoteObjectStore, AutoCloseable {

    private final ExecutorService executor = Executors.newFixedThreadPool(4, runnable -> {
        Thread thread = new Thread(runnable, "in-memory-store");
        thread.setDaemon(true);
        return thread;
    });

    // bucket/key -> bytes, sorted for listing
    private final Map<String, byte[]> objects = Collections.synchronizedMap(new TreeMap<>());
    private final Map<String, Upload> uploads = new ConcurrentHashMap<>();
    private final Map<String, Throwable> failures = new ConcurrentHashMap<>();
    private final Map<Integer, Throwable> partFailures = new ConcurrentHashMap<>();
    private final Map<Integer, HeldPart> heldParts = new ConcurrentHashMap<>();

    private final AtomicInteger createCalls = new AtomicInteger();
    private final AtomicInteger uploadPartCalls = new AtomicInteger();
    private final AtomicInteger abortCalls = new AtomicInteger();
    private final AtomicInteger getCalls = new AtomicInteger();
    private final AtomicInteger putCalls = new AtomicInteger();
    private final AtomicInteger listCalls = new AtomicInteger();
    private final List<Integer> deleteBatchSizes = Collections.synchronizedList(new ArrayList<>());
    private final List<String> ranges = Collections.synchronizedList(new ArrayList<>());

    private volatile List<CompletedPartTag> lastManifest = List.of();
    private volatile boolean holdParts;
    private volatile int failingDeleteCall;
    private volatile int throwingDeleteCall;
    private volatile int listPageSize = 1000;
    private volatile boolean truncateWithoutToken;

    private static final class Upload {
        final String bucket;
        final String key;
        final Map<Integer, byte[]> parts = new ConcurrentHashMap<>();
        final Map<Integer, String> tags = new ConcurrentHashMap<>();

        Upload(String bucket, String key) {
            this.bucket = bucket;
            this.key = key;
        }
    }

    private record HeldPart(CompletableFuture<String> future, String eTag) {
    }

    // ==================== Scripting ====================

    /**
     * Fail every call of {@code operation} (the method name) with {@code error}.
     */
    public void failOperation(String operation, Throwable error) {
        failures.put(operation, error);
    }

    public void failPart(int partNumber, Throwable error) {
        partFailures.put(partNumber, error);
    }

    /**
     * Fail the n-th deleteObjects call, counting from 1.
     */
    public void failDeleteCall(int call) {
        failingDeleteCall = call;
    }

    /**
     * Throw from the n-th deleteObjects call itself instead of returning a future, counting from 1.
     */
    public void throwOnDeleteCall(int call) {
        throwingDeleteCall = call;
    }

    public void holdUploadParts() {
        holdParts = true;
    }

    /**
     * Complete held part uploads in the given order of part numbers.
     */
    public void releaseParts(int... partNumbers) {
        for (int partNumber : partNumbers) {
            HeldPart held = heldParts.remove(partNumber);
            if (held == null) {
                throw new IllegalStateException("Part " + partNumber + " is not held");
            }
            held.future().complete(held.eTag());
        }
    }

    public int heldPartCount() {
        return heldParts.size();
    }

    public void listPageSize(int size) {
        listPageSize = size;
    }

    public void truncateWithoutToken() {
        truncateWithoutToken = true;
    }

    public static AwsServiceException serviceError(int status, String errorCode) {
        return S3Exception.builder()
                .statusCode(status)
                .message(errorCode)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(errorCode).errorMessage(errorCode).build())
                .build();
    }

    // ==================== Inspection ====================

    public void putDirect(String bucket, String key, byte[] data) {
        objects.put(path(bucket, key), data.clone());
    }

    public byte[] object(String bucket, String key) {
        return objects.get(path(bucket, key));
    }

    public boolean contains(String bucket, String key) {
        return objects.containsKey(path(bucket, key));
    }

    public int objectCount() {
        return objects.size();
    }

    public int createCalls() {
        return createCalls.get();
    }

    public int uploadPartCalls() {
        return uploadPartCalls.get();
    }

    public int abortCalls() {
        return abortCalls.get();
    }

    public int getCalls() {
        return getCalls.get();
    }

    public int putCalls() {
        return putCalls.get();
    }

    public int listCalls() {
        return listCalls.get();
    }

    public int openUploads() {
        return uploads.size();
    }

    public List<Integer> deleteBatchSizes() {
        synchronized (deleteBatchSizes) {
            return List.copyOf(deleteBatchSizes);
        }
    }

    public List<String> requestedRanges() {
        synchronized (ranges) {
            return List.copyOf(ranges);
        }
    }

    public List<CompletedPartTag> lastManifest() {
        return lastManifest;
    }

    // ==================== RemoteObjectStore ====================

    @Override
    public CompletableFuture<Long> headObject(String bucket, String key) {
        return async("headObject", () -> {
            byte[] data = objects.get(path(bucket, key));
            if (data == null) {
                // HEAD responses carry no error body
                throw S3Exception.builder().statusCode(404).message("Not Found").build();
            }
            return (long) data.length;
        });
    }

    @Override
    public CompletableFuture<byte[]> getObject(String bucket, String key, String range) {
        getCalls.incrementAndGet();
        ranges.add(range);
        return async("getObject", () -> {
            byte[] data = objects.get(path(bucket, key));
            if (data == null) {
                throw serviceError(404, "NoSuchKey");
            }
            if (range == null) {
                return data.clone();
            }
            String[] bounds = range.substring("bytes=".length()).split("-");
            int start = Integer.parseInt(bounds[0]);
            int end = Math.min(Integer.parseInt(bounds[1]) + 1, data.length);
            if (start >= data.length) {
                throw serviceError(416, "InvalidRange");
            }
            byte[] slice = new byte[end - start];
            System.arraycopy(data, start, slice, 0, slice.length);
            return slice;
        });
    }

    @Override
    public CompletableFuture<Void> putObject(String bucket, String key, ByteBuffer body, String contentType) {
        putCalls.incrementAndGet();
        byte[] data = copy(body);
        return async("putObject", () -> {
            objects.put(path(bucket, key), data);
            return null;
        });
    }

    @Override
    public CompletableFuture<String> createMultipartUpload(String bucket, String key, String contentType) {
        createCalls.incrementAndGet();
        return async("createMultipartUpload", () -> {
            String uploadId = UUID.randomUUID().toString();
            uploads.put(uploadId, new Upload(bucket, key));
            return uploadId;
        });
    }

    @Override
    public CompletableFuture<String> uploadPart(String bucket, String key, String uploadId, int partNumber,
            ByteBuffer body) {
        uploadPartCalls.incrementAndGet();
        byte[] data = copy(body);
        Throwable partFailure = partFailures.get(partNumber);
        if (partFailure != null) {
            return CompletableFuture.supplyAsync(() -> {
                throw asRuntime(partFailure);
            }, executor);
        }
        Throwable failure = failures.get("uploadPart");
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        Upload upload = uploads.get(uploadId);
        if (upload == null) {
            return CompletableFuture.failedFuture(serviceError(404, "NoSuchUpload"));
        }
        String eTag = "\"etag-" + partNumber + "-" + data.length + "\"";
        upload.parts.put(partNumber, data);
        upload.tags.put(partNumber, eTag);

        if (holdParts) {
            CompletableFuture<String> held = new CompletableFuture<>();
            heldParts.put(partNumber, new HeldPart(held, eTag));
            return held;
        }
        return CompletableFuture.supplyAsync(() -> eTag, executor);
    }

    @Override
    public CompletableFuture<Void> completeMultipartUpload(String bucket, String key, String uploadId,
            List<CompletedPartTag> parts) {
        lastManifest = List.copyOf(parts);
        return async("completeMultipartUpload", () -> {
            Upload upload = uploads.get(uploadId);
            if (upload == null) {
                throw serviceError(404, "NoSuchUpload");
            }
            ByteArrayOutputStream assembled = new ByteArrayOutputStream();
            for (int i = 0; i < parts.size(); i++) {
                CompletedPartTag part = parts.get(i);
                if (part.partNumber() != i + 1) {
                    throw serviceError(400, "InvalidPartOrder");
                }
                if (!part.eTag().equals(upload.tags.get(part.partNumber()))) {
                    throw serviceError(400, "InvalidPart");
                }
                assembled.writeBytes(upload.parts.get(part.partNumber()));
            }
            uploads.remove(uploadId);
            objects.put(path(upload.bucket, upload.key), assembled.toByteArray());
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> abortMultipartUpload(String bucket, String key, String uploadId) {
        abortCalls.incrementAndGet();
        return async("abortMultipartUpload", () -> {
            uploads.remove(uploadId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteObjects(String bucket, List<String> keys) {
        int call;
        synchronized (deleteBatchSizes) {
            deleteBatchSizes.add(keys.size());
            call = deleteBatchSizes.size();
        }
        if (call == throwingDeleteCall) {
            throw new IllegalStateException("store rejected delete call " + call);
        }
        if (call == failingDeleteCall) {
            return CompletableFuture.failedFuture(serviceError(500, "InternalError"));
        }
        return async("deleteObjects", () -> {
            for (String key : keys) {
                objects.remove(path(bucket, key));
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<ListPage> listObjects(String bucket, String prefix, String continuationToken) {
        listCalls.incrementAndGet();
        return async("listObjects", () -> {
            String base = path(bucket, prefix);
            List<String> keys;
            synchronized (objects) {
                keys = objects.keySet().stream()
                        .filter(path -> path.startsWith(base))
                        .map(path -> path.substring(bucket.length() + 1))
                        .collect(Collectors.toList());
            }
            int from = continuationToken == null ? 0 : Integer.parseInt(continuationToken);
            int to = Math.min(from + listPageSize, keys.size());
            List<String> page = List.copyOf(keys.subList(from, to));
            if (to == keys.size()) {
                return ListPage.last(page);
            }
            return new ListPage(page, true, truncateWithoutToken ? null : String.valueOf(to));
        });
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ==================== Helpers ====================

    private <T> CompletableFuture<T> async(String operation, Supplier<T> call) {
        Throwable failure = failures.get(operation);
        if (failure != null) {
            return CompletableFuture.supplyAsync(() -> {
                throw asRuntime(failure);
            }, executor);
        }
        return CompletableFuture.supplyAsync(call, executor);
    }

    private static RuntimeException asRuntime(Throwable failure) {
        return failure instanceof RuntimeException ? (RuntimeException) failure : new RuntimeException(failure);
    }

    private static byte[] copy(ByteBuffer body) {
        byte[] data = new byte[body.remaining()];
        body.duplicate().get(data);
        return data;
    }

    private static String path(String bucket, String key) {
        return bucket + "/" + key;
    }
}
