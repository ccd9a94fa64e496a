package com.posidx.common;

import java.util.Objects;

/**
 * Result of processing one document in the map phase.
 */
public final class DocumentOutcome {

    public enum Status { INDEXED, SKIPPED, FAILED }

    private final String docId;
    private final Status status;
    private final PositionalEntry entry;
    private final RuntimeException failure;

    private DocumentOutcome(String docId, Status status, PositionalEntry entry, RuntimeException failure) {
        this.docId = Objects.requireNonNull(docId, "docId cannot be null");
        this.status = status;
        this.entry = entry;
        this.failure = failure;
    }

    public static DocumentOutcome indexed(PositionalEntry entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        return new DocumentOutcome(entry.getDocId(), Status.INDEXED, entry, null);
    }

    public static DocumentOutcome skipped(String docId) {
        return new DocumentOutcome(docId, Status.SKIPPED, null, null);
    }

    public static DocumentOutcome failed(String docId, RuntimeException failure) {
        return new DocumentOutcome(docId, Status.FAILED, null,
                Objects.requireNonNull(failure, "failure cannot be null"));
    }

    public String getDocId() { return docId; }
    public Status getStatus() { return status; }
    public PositionalEntry getEntry() { return entry; }
    public RuntimeException getFailure() { return failure; }

    public boolean isIndexed() { return status == Status.INDEXED; }
    public boolean isFailed() { return status == Status.FAILED; }

    @Override
    public String toString() {
        return "DocumentOutcome{docId=" + docId + ", status=" + status
                + (failure != null ? ", failure=" + failure.getMessage() : "") + '}';
    }
}
