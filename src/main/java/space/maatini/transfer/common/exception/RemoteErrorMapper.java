package space.maatini.transfer.common.exception;

import org.jboss.logging.Logger;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps raw remote-client failures to {@link TransferException}s with an {@link ErrorCode}.
 */
public final class RemoteErrorMapper {

    private static final Logger LOG = Logger.getLogger(RemoteErrorMapper.class);

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchBucket", "NotFound");
    private static final Set<String> REDIRECT_CODES = Set.of("PermanentRedirect", "AuthorizationHeaderMalformed");
    private static final Set<String> DENIED_CODES = Set.of("AccessDenied", "InvalidAccessKeyId", "SignatureDoesNotMatch");
    private static final Set<String> TRANSIENT_CODES = Set.of("SlowDown", "Throttling", "RequestTimeout",
            "InternalError", "ServiceUnavailable");

    private RemoteErrorMapper() {
    }

    /**
     * Normalize a failure of the named remote operation on {@code bucket/key}.
     */
    public static TransferException translate(Throwable failure, String operation, String bucket, String key) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TransferException) {
            return (TransferException) cause;
        }

        String target = key == null ? "[" + bucket + "]" : "[" + bucket + "] " + key;
        ErrorCode code = classify(cause);
        String message = String.format("%s failed for %s: %s", operation, target, cause.getMessage());
        LOG.debugf("Mapped %s to %s", cause.getClass().getSimpleName(), code);

        if (code == ErrorCode.NOT_FOUND) {
            return new NotFoundException(message, cause);
        }
        return new TransferException(code, message, cause);
    }

    /**
     * Error code a failure would be translated to.
     */
    public static ErrorCode codeOf(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TransferException) {
            return ((TransferException) cause).getCode();
        }
        return classify(cause);
    }

    static ErrorCode classify(Throwable cause) {
        if (cause instanceof AwsServiceException) {
            AwsServiceException e = (AwsServiceException) cause;
            AwsErrorDetails details = e.awsErrorDetails();
            // Set.of(...).contains(null) throws
            String errorCode = details != null && details.errorCode() != null ? details.errorCode() : "";
            int status = e.statusCode();

            if (status == 404 || NOT_FOUND_CODES.contains(errorCode)) {
                return ErrorCode.NOT_FOUND;
            }
            if (status == 301 || REDIRECT_CODES.contains(errorCode)) {
                return ErrorCode.WRONG_REGION;
            }
            if (status == 401 || status == 403 || DENIED_CODES.contains(errorCode)) {
                return ErrorCode.PERMISSION_DENIED;
            }
            if (status >= 500 || status == 429 || e.isThrottlingException() || TRANSIENT_CODES.contains(errorCode)) {
                return ErrorCode.TRANSIENT_SERVICE_ERROR;
            }
            return ErrorCode.SERVICE_ERROR;
        }
        if (cause instanceof SdkClientException) {
            return ErrorCode.TRANSIENT_SERVICE_ERROR;
        }
        return ErrorCode.UNKNOWN;
    }

    /**
     * Strip the wrappers futures put around the real failure.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
