package com.catalogsync.crawl.service;

/**
 * Raised when too many products in a row failed to store; the run is abandoned as an error.
 */
public class StorageEscalationException extends RuntimeException {
    public StorageEscalationException(int consecutiveFailures, Throwable lastFailure) {
        super("Aborting after " + consecutiveFailures + " consecutive storage failures", lastFailure);
    }
}
