package com.rpyflow.output;

/**
 * Outcome of assessing the target directory. An abort names the first offending entry.
 */
public final class ReconcileDecision {
    private static final ReconcileDecision PROCEED = new ReconcileDecision(true, null, null);

    private final boolean proceed;
    private final String offendingEntry;
    private final String reason;

    private ReconcileDecision(boolean proceed, String offendingEntry, String reason) {
        this.proceed = proceed;
        this.offendingEntry = offendingEntry;
        this.reason = reason;
    }

    public static ReconcileDecision proceed() {
        return PROCEED;
    }

    public static ReconcileDecision abort(String offendingEntry, String reason) {
        return new ReconcileDecision(false, offendingEntry, reason);
    }

    public boolean isProceed() {
        return proceed;
    }

    public String getOffendingEntry() {
        return offendingEntry;
    }

    public String getReason() {
        return reason;
    }
}
