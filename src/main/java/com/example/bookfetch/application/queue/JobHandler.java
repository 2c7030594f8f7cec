package com.example.bookfetch.application.queue;

/**
 * Runs one job. The returned value is stored as the ledger result.
 */
@FunctionalInterface
public interface JobHandler {

    Object handle(BrokerJob job) throws Exception;
}
