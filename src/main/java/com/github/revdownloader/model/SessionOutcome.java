package com.github.revdownloader.model;

public enum SessionOutcome {
    ALL_SUCCEEDED("Success"),
    PARTIAL_FAILURE("Done with failures"),
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String displayName;

    SessionOutcome(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
