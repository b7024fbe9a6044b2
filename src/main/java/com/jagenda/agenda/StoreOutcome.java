package com.jagenda.agenda;

/**
 * Success or failure of an agenda operation, with a message fit for the user.
 */
public final class StoreOutcome {
    private final boolean success;
    private final String message;

    private StoreOutcome(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static StoreOutcome success(String message) {
        return new StoreOutcome(true, message);
    }

    public static StoreOutcome failure(String message) {
        return new StoreOutcome(false, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return (success ? "OK: " : "FAILED: ") + message;
    }
}
