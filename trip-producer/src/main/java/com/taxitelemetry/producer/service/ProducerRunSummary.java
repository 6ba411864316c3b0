package com.taxitelemetry.producer.service;

/**
 * Outcome of one producer run over a source file.
 */
public record ProducerRunSummary(Status status, int rowsRead, int skipped, int sent, int failed, int batches) {

    public enum Status { COMPLETED, SOURCE_NOT_FOUND, READ_ERROR }

    public static ProducerRunSummary sourceNotFound() {
        return new ProducerRunSummary(Status.SOURCE_NOT_FOUND, 0, 0, 0, 0, 0);
    }

    public boolean succeeded() {
        return status == Status.COMPLETED;
    }
}
