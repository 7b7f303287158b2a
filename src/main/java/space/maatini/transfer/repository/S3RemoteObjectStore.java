package space.maatini.transfer.repository;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;
import space.maatini.transfer.common.exception.ErrorCode;
import space.maatini.transfer.common.exception.TransferException;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link RemoteObjectStore} backed by the AWS SDK asynchronous S3 client.
 */
@ApplicationScoped
public class S3RemoteObjectStore implements RemoteObjectStore {

    private static final Logger LOG = Logger.getLogger(S3RemoteObjectStore.class);

    @Inject
    S3AsyncClient s3;

    public S3RemoteObjectStore() {
    }

    public S3RemoteObjectStore(S3AsyncClient s3) {
        this.s3 = s3;
    }

    @Override
    public CompletableFuture<Long> headObject(String bucket, String key) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        return s3.headObject(request).thenApply(HeadObjectResponse::contentLength);
    }

    @Override
    public CompletableFuture<byte[]> getObject(String bucket, String key, String range) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .range(range)
                .build();

        return s3.getObject(request, AsyncResponseTransformer.<GetObjectResponse>toBytes())
                .thenApply(ResponseBytes::asByteArrayUnsafe);
    }

    @Override
    public CompletableFuture<Void> putObject(String bucket, String key, ByteBuffer body, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) body.remaining())
                .build();

        return s3.putObject(request, AsyncRequestBody.fromByteBuffer(body))
                .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<String> createMultipartUpload(String bucket, String key, String contentType) {
        CreateMultipartUploadRequest request = CreateMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .build();

        return s3.createMultipartUpload(request).thenApply(CreateMultipartUploadResponse::uploadId);
    }

    @Override
    public CompletableFuture<String> uploadPart(String bucket, String key, String uploadId, int partNumber,
            ByteBuffer body) {
        UploadPartRequest request = UploadPartRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(uploadId)
                .partNumber(partNumber)
                .contentLength((long) body.remaining())
                .build();

        return s3.uploadPart(request, AsyncRequestBody.fromByteBuffer(body)).thenApply(UploadPartResponse::eTag);
    }

    @Override
    public CompletableFuture<Void> completeMultipartUpload(String bucket, String key, String uploadId,
            List<CompletedPartTag> parts) {
        List<CompletedPart> completed = parts.stream()
                .map(part -> CompletedPart.builder().partNumber(part.partNumber()).eTag(part.eTag()).build())
                .collect(Collectors.toList());

        CompleteMultipartUploadRequest request = CompleteMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(uploadId)
                .multipartUpload(CompletedMultipartUpload.builder().parts(completed).build())
                .build();

        return s3.completeMultipartUpload(request).thenApply(response -> null);
    }

    @Override
    public CompletableFuture<Void> abortMultipartUpload(String bucket, String key, String uploadId) {
        AbortMultipartUploadRequest request = AbortMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(uploadId)
                .build();

        return s3.abortMultipartUpload(request).thenApply(response -> null);
    }

    @Override
    public CompletableFuture<Void> deleteObjects(String bucket, List<String> keys) {
        List<ObjectIdentifier> identifiers = keys.stream()
                .map(key -> ObjectIdentifier.builder().key(key).build())
                .collect(Collectors.toList());

        DeleteObjectsRequest request = DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(identifiers).quiet(true).build())
                .build();

        LOG.debugf("DELETE [%s] %d keys, first %s", bucket, keys.size(), keys.isEmpty() ? "-" : keys.get(0));
        return s3.deleteObjects(request).thenApply(response -> {
            checkDeleteErrors(bucket, response);
            return null;
        });
    }

    // A 200 response can still report failures for individual keys
    private static void checkDeleteErrors(String bucket, DeleteObjectsResponse response) {
        if (!response.hasErrors() || response.errors().isEmpty()) {
            return;
        }
        S3Error first = response.errors().get(0);
        throw new TransferException(ErrorCode.SERVICE_ERROR, String.format(
                "DeleteObjects failed for %d keys in [%s], first %s: %s %s",
                response.errors().size(), bucket, first.key(), first.code(), first.message()));
    }

    @Override
    public CompletableFuture<ListPage> listObjects(String bucket, String prefix, String continuationToken) {
        ListObjectsV2Request.Builder builder = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix);
        if (continuationToken != null) {
            builder.continuationToken(continuationToken);
        }

        return s3.listObjectsV2(builder.build()).thenApply(response -> new ListPage(
                response.contents().stream().map(S3Object::key).collect(Collectors.toList()),
                Boolean.TRUE.equals(response.isTruncated()),
                response.nextContinuationToken()));
    }
}
