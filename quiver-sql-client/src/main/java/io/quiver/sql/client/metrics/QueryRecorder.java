package io.quiver.sql.client.metrics;

import io.quiver.sql.common.errors.RemoteException;

/**
 * Receives the outcome of every query issued through a client.
 */
public interface QueryRecorder {

    void recordQueryStart();

    /** The result stream was opened and handed to the caller. */
    void recordQueryCompleted();

    void recordQueryError(RemoteException.Stage stage, Throwable error);

    void recordDecodeError(Throwable error);

    /** The call was rejected locally, before any remote call. */
    void recordValidationError();

    void recordBatch(long rowCount);

    long getStartedQueries();

    long getCompletedQueries();

    long getFailedQueries();

    long getRejectedQueries();

    long getRowsRead();
}
