package io.quiver.sql.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quiver.sql.common.errors.RemoteException;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

public class MicroMeterQueryRecorder implements QueryRecorder {

    private final MeterRegistry registry;

    private final Counter queryStartCounter;
    private final Counter queryCompletedCounter;
    private final Counter queryErrorCounter;
    private final Counter decodeErrorCounter;
    private final Counter validationErrorCounter;
    private final Counter rowsReadCounter;
    private final Map<RemoteException.Stage, Counter> stageErrorCounters = new EnumMap<>(RemoteException.Stage.class);

    public MicroMeterQueryRecorder(MeterRegistry registry, String clientId) {
        this.registry = registry;

        this.queryStartCounter = counter("query_start", clientId);
        this.queryCompletedCounter = counter("query_completed", clientId);
        this.queryErrorCounter = counter("query_error", clientId);
        this.decodeErrorCounter = counter("decode_error", clientId);
        this.validationErrorCounter = counter("validation_error", clientId);
        this.rowsReadCounter = counter("rows_read", clientId);
        for (RemoteException.Stage stage : RemoteException.Stage.values()) {
            stageErrorCounters.put(stage, Counter.builder("quiver.client.stage_error.count")
                    .tag("client", clientId)
                    .tag("stage", stage.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
    }

    private Counter counter(String name, String clientId) {
        return Counter.builder("quiver.client." + name + ".count")
                .tag("client", clientId)
                .register(registry);
    }

    @Override
    public void recordQueryStart() {
        queryStartCounter.increment();
    }

    @Override
    public void recordQueryCompleted() {
        queryCompletedCounter.increment();
    }

    @Override
    public void recordQueryError(RemoteException.Stage stage, Throwable error) {
        queryErrorCounter.increment();
        stageErrorCounters.get(stage).increment();
    }

    @Override
    public void recordDecodeError(Throwable error) {
        decodeErrorCounter.increment();
    }

    @Override
    public void recordValidationError() {
        validationErrorCounter.increment();
    }

    @Override
    public void recordBatch(long rowCount) {
        if (rowCount > 0) {
            rowsReadCounter.increment(rowCount);
        }
    }

    @Override
    public long getStartedQueries() {
        return (long) queryStartCounter.count();
    }

    @Override
    public long getCompletedQueries() {
        return (long) queryCompletedCounter.count();
    }

    @Override
    public long getFailedQueries() {
        return (long) (queryErrorCounter.count() + decodeErrorCounter.count());
    }

    @Override
    public long getRejectedQueries() {
        return (long) validationErrorCounter.count();
    }

    @Override
    public long getRowsRead() {
        return (long) rowsReadCounter.count();
    }
}
