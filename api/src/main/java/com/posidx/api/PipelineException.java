package com.posidx.api;

/**
 * Fatal failure of an index build, raised at the map-phase barrier before anything is written.
 */
public class PipelineException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String docId;

    public PipelineException(String docId, String message, Throwable cause) {
        super(docId == null ? message : message + " (doc_id=" + docId + ")", cause);
        this.docId = docId;
    }

    /** Id of the document that aborted the run, or null when no single document is to blame. */
    public String getDocId() {
        return docId;
    }
}
