package com.example.bookfetch.application.queue;

/**
 * Broker events. Called synchronously on the worker thread, in order, for each run.
 */
public interface JobLifecycleListener {

    void onActive(BrokerJob job);

    void onCompleted(BrokerJob job, Object result);

    /**
     * @param finalAttempt {@code true} when the broker will not run the job again
     */
    void onFailed(BrokerJob job, Throwable error, boolean finalAttempt);

    void onStalled(BrokerJob job);
}
