package space.maatini.transfer.repository;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Request-level contract of the remote object store.
 * <p>
 * Every call is issued without blocking and completes its future on a worker thread of the remote
 * client. Failures complete the future exceptionally with the client's raw exception; the caller
 * normalizes them.
 */
public interface RemoteObjectStore {

    /**
     * Fetch object metadata.
     *
     * @return the content length in bytes
     */
    CompletableFuture<Long> headObject(String bucket, String key);

    /**
     * Read a byte range.
     *
     * @param range inclusive HTTP range, e.g. {@code bytes=0-1023}
     * @return the bytes the store returned for the range
     */
    CompletableFuture<byte[]> getObject(String bucket, String key, String range);

    /**
     * Store an object in a single request.
     */
    CompletableFuture<Void> putObject(String bucket, String key, ByteBuffer body, String contentType);

    /**
     * Open a multipart upload.
     *
     * @return the upload id
     */
    CompletableFuture<String> createMultipartUpload(String bucket, String key, String contentType);

    /**
     * Upload one part of a multipart upload.
     *
     * @param partNumber 1-based part number
     * @return the completion tag for the part
     */
    CompletableFuture<String> uploadPart(String bucket, String key, String uploadId, int partNumber, ByteBuffer body);

    /**
     * Assemble the object from its uploaded parts.
     *
     * @param parts manifest ordered by part number
     */
    CompletableFuture<Void> completeMultipartUpload(String bucket, String key, String uploadId,
            List<CompletedPartTag> parts);

    /**
     * Discard a multipart upload and the parts uploaded so far.
     */
    CompletableFuture<Void> abortMultipartUpload(String bucket, String key, String uploadId);

    /**
     * Delete a batch of keys in one request. A batch in which any key failed completes exceptionally.
     */
    CompletableFuture<Void> deleteObjects(String bucket, List<String> keys);

    /**
     * Fetch one page of keys starting with {@code prefix}.
     *
     * @param continuationToken token from the previous page, {@code null} for the first page
     */
    CompletableFuture<ListPage> listObjects(String bucket, String prefix, String continuationToken);
}
