package net.medroute.core.model;

public enum RejectReason {
    NO_BEDS(true),
    NO_STAFF(true),
    NO_SUPPLIES(true),
    TIMEOUT(true),
    NO_HOSPITAL(true),
    INVALID_REPLY(false);

    private final boolean retryable;

    RejectReason(boolean retryable) { this.retryable = retryable; }

    public boolean retryable() { return retryable; }

    public static RejectReason from(String s) {
        if (s == null) return INVALID_REPLY;
        try { return RejectReason.valueOf(s.trim().toUpperCase()); } catch (IllegalArgumentException e) { return INVALID_REPLY; }
    }
}
