package com.linlay.assistantrunner.client;

/**
 * Outcome of one remote assistant call. Calls never signal errors through the reactive
 * channel; every failure arrives as {@link Transient} or {@link Fatal}.
 */
public sealed interface CallResult<T> {

    int NO_STATUS = -1;

    static <T> CallResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> CallResult<T> transientFailure(String operation, int status, String detail) {
        return new Transient<>(operation, status, detail);
    }

    static <T> CallResult<T> fatal(String operation, int status, String detail) {
        return new Fatal<>(operation, status, detail);
    }

    default boolean isOk() {
        return this instanceof Ok<?>;
    }

    /**
     * Human readable failure description, empty for {@link Ok}.
     */
    String describe();

    record Ok<T>(T value) implements CallResult<T> {

        @Override
        public String describe() {
            return "";
        }
    }

    record Transient<T>(String operation, int status, String detail) implements CallResult<T> {

        @Override
        public String describe() {
            return format(operation, status, detail);
        }
    }

    record Fatal<T>(String operation, int status, String detail) implements CallResult<T> {

        @Override
        public String describe() {
            return format(operation, status, detail);
        }
    }

    private static String format(String operation, int status, String detail) {
        StringBuilder text = new StringBuilder(operation == null ? "remote call" : operation);
        if (status != NO_STATUS) {
            text.append(" status=").append(status);
        }
        if (detail != null && !detail.isBlank()) {
            text.append(": ").append(detail);
        }
        return text.toString();
    }
}
