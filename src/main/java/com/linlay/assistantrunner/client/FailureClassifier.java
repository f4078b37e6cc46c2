package com.linlay.assistantrunner.client;

import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Single place deciding whether a failed remote call is worth retrying.
 */
public final class FailureClassifier {

    private static final int MAX_DETAIL_LENGTH = 300;

    private FailureClassifier() {
    }

    public static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    public static <T> CallResult<T> classify(String operation, Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            String detail = truncate(LogSanitizer.maskText(responseException.getResponseBodyAsString(), true));
            return isTransientStatus(status)
                    ? CallResult.transientFailure(operation, status, detail)
                    : CallResult.fatal(operation, status, detail);
        }
        if (error instanceof CodecException) {
            // undecodable body; the same request would fail the same way
            return CallResult.fatal(operation, CallResult.NO_STATUS, resolveMessage(error));
        }
        if (error instanceof WebClientRequestException || hasTransportCause(error)) {
            return CallResult.transientFailure(operation, CallResult.NO_STATUS, resolveMessage(error));
        }
        return CallResult.fatal(operation, CallResult.NO_STATUS, resolveMessage(error));
    }

    private static boolean hasTransportCause(Throwable error) {
        Throwable cursor = error;
        while (cursor != null) {
            if (cursor instanceof IOException || cursor instanceof TimeoutException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private static String resolveMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor != null) {
            if (cursor.getMessage() != null && !cursor.getMessage().isBlank()) {
                return truncate(cursor.getMessage());
            }
            cursor = cursor.getCause();
        }
        return error == null ? "unknown error" : error.getClass().getSimpleName();
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_DETAIL_LENGTH ? text : text.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
