package io.quiver.sql.client.metrics;

import io.quiver.sql.common.errors.RemoteException;

import java.util.concurrent.atomic.AtomicLong;

public class NOOPQueryRecorder implements QueryRecorder {

    private final AtomicLong startedQueries = new AtomicLong();
    private final AtomicLong completedQueries = new AtomicLong();
    private final AtomicLong failedQueries = new AtomicLong();
    private final AtomicLong rejectedQueries = new AtomicLong();
    private final AtomicLong rowsRead = new AtomicLong();

    @Override
    public void recordQueryStart() {
        startedQueries.incrementAndGet();
    }

    @Override
    public void recordQueryCompleted() {
        completedQueries.incrementAndGet();
    }

    @Override
    public void recordQueryError(RemoteException.Stage stage, Throwable error) {
        failedQueries.incrementAndGet();
    }

    @Override
    public void recordDecodeError(Throwable error) {
        failedQueries.incrementAndGet();
    }

    @Override
    public void recordValidationError() {
        rejectedQueries.incrementAndGet();
    }

    @Override
    public void recordBatch(long rowCount) {
        if (rowCount > 0) {
            rowsRead.addAndGet(rowCount);
        }
    }

    @Override
    public long getStartedQueries() {
        return startedQueries.get();
    }

    @Override
    public long getCompletedQueries() {
        return completedQueries.get();
    }

    @Override
    public long getFailedQueries() {
        return failedQueries.get();
    }

    @Override
    public long getRejectedQueries() {
        return rejectedQueries.get();
    }

    @Override
    public long getRowsRead() {
        return rowsRead.get();
    }
}
