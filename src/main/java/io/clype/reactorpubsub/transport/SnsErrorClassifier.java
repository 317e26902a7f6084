package io.clype.reactorpubsub.transport;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import io.clype.reactorpubsub.model.BackendException;
import io.clype.reactorpubsub.model.FatalBackendException;
import io.clype.reactorpubsub.model.TransientBackendException;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sns.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sns.model.SnsException;

/**
 * Maps AWS SDK failures onto {@link TransientBackendException} and
 * {@link FatalBackendException}.
 */
public final class SnsErrorClassifier {

    /** AWS error codes that indicate transient failures eligible for retry. */
    static final Set<String> RETRYABLE_ERROR_CODES = Set.of(
            "Throttling", "ThrottlingException", "InternalError", "InternalFailure", "ServiceUnavailable"
    );

    private SnsErrorClassifier() {
    }

    /**
     * Classifies an exception raised by an SNS call.
     */
    public static BackendException classify(Throwable throwable) {
        Throwable error = unwrap(throwable);

        if (error instanceof BackendException backendEx) {
            return backendEx;
        }
        if (error instanceof SnsException snsEx) {
            String code = snsEx.awsErrorDetails() != null ? snsEx.awsErrorDetails().errorCode() : null;
            if (isRetryableSnsError(snsEx, code)) {
                return new TransientBackendException(code, snsEx.getMessage(), snsEx);
            }
            return new FatalBackendException(code, snsEx.getMessage(), snsEx);
        }
        if (isNetworkException(error) || (error.getCause() != null && isNetworkException(error.getCause()))) {
            return new TransientBackendException(null, error.getMessage(), error);
        }
        return new FatalBackendException(null, error.getMessage(), error);
    }

    /**
     * Classifies a failed entry of a PublishBatch response. Service-side failures and
     * retryable codes are transient; sender faults are fatal.
     */
    public static BackendException classifyEntry(BatchResultErrorEntry entry) {
        String message = entry.code() + ": " + entry.message();
        if (RETRYABLE_ERROR_CODES.contains(entry.code()) || !Boolean.TRUE.equals(entry.senderFault())) {
            return new TransientBackendException(entry.code(), message);
        }
        return new FatalBackendException(entry.code(), message);
    }

    private static boolean isRetryableSnsError(SnsException snsEx, String code) {
        if (code != null && RETRYABLE_ERROR_CODES.contains(code)) {
            return true;
        }
        return snsEx.isThrottlingException() || snsEx.statusCode() >= 500;
    }

    /**
     * Checks if the exception is a network-related transient failure.
     */
    private static boolean isNetworkException(Throwable t) {
        return t instanceof IOException
                || (t instanceof SdkClientException && t.getCause() instanceof IOException);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
