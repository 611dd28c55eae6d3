package com.smartstream.transform.dto;

import java.util.List;

public class TransformStatus {

    public static final String COMPLETED_MESSAGE = "Transformation completed successfully";

    private int statusCode;
    private String message;
    private int processedFiles;
    private int failedFiles;
    private List<ObjectOutcome> outcomes;

    /**
     * Default constructor for serialization frameworks.
     */
    public TransformStatus() {
    }

    /**
     * Builds the status for a finished batch of objects.
     */
    public static TransformStatus of(List<ObjectOutcome> outcomes) {
        TransformStatus status = new TransformStatus();
        int failed = (int) outcomes.stream().filter(ObjectOutcome::isFailed).count();
        status.statusCode = 200;
        status.outcomes = List.copyOf(outcomes);
        status.processedFiles = outcomes.size() - failed;
        status.failedFiles = failed;
        status.message = failed == 0
                ? COMPLETED_MESSAGE
                : "Transformation completed with " + failed + " failed object(s) out of " + outcomes.size();
        return status;
    }

    /**
     * Returns the HTTP-style status code of the invocation.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(int statusCode) {
        this.statusCode = statusCode;
    }

    /**
     * Returns the free-text completion message.
     */
    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * Returns how many objects finished without failure, skipped and empty ones included.
     */
    public int getProcessedFiles() {
        return processedFiles;
    }

    public void setProcessedFiles(int processedFiles) {
        this.processedFiles = processedFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public void setFailedFiles(int failedFiles) {
        this.failedFiles = failedFiles;
    }

    /**
     * Returns the per-object outcomes in notification order.
     */
    public List<ObjectOutcome> getOutcomes() {
        return outcomes;
    }

    public void setOutcomes(List<ObjectOutcome> outcomes) {
        this.outcomes = outcomes;
    }

    public boolean hasFailures() {
        return failedFiles > 0;
    }
}
