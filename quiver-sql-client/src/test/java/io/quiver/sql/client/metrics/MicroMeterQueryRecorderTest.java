package io.quiver.sql.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quiver.sql.common.errors.RemoteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MicroMeterQueryRecorderTest {

    private MeterRegistry registry;
    private MicroMeterQueryRecorder recorder;

    @BeforeEach
    void setup() {
        registry = new SimpleMeterRegistry();
        recorder = new MicroMeterQueryRecorder(registry, "client1");
    }

    private Counter counter(String metric) {
        return registry.find("quiver.client." + metric + ".count")
                .tag("client", "client1")
                .counter();
    }

    @Test
    void testStartAndComplete() {
        recorder.recordQueryStart();
        recorder.recordQueryStart();
        recorder.recordQueryCompleted();

        assertEquals(2.0, counter("query_start").count());
        assertEquals(1.0, counter("query_completed").count());
        assertEquals(2, recorder.getStartedQueries());
        assertEquals(1, recorder.getCompletedQueries());
    }

    @Test
    void testQueryErrorIsCountedPerStage() {
        recorder.recordQueryError(RemoteException.Stage.EXECUTE, new RuntimeException("boom"));
        recorder.recordQueryError(RemoteException.Stage.FETCH, new RuntimeException("boom"));
        recorder.recordQueryError(RemoteException.Stage.FETCH, new RuntimeException("boom"));

        assertEquals(3.0, counter("query_error").count());
        Counter fetch = registry.find("quiver.client.stage_error.count")
                .tags("client", "client1", "stage", "fetch")
                .counter();
        assertNotNull(fetch);
        assertEquals(2.0, fetch.count());
        Counter prepare = registry.find("quiver.client.stage_error.count")
                .tags("client", "client1", "stage", "prepare")
                .counter();
        assertNotNull(prepare);
        assertEquals(0.0, prepare.count());
    }

    @Test
    void testFailedQueriesIncludeDecodeErrors() {
        recorder.recordQueryError(RemoteException.Stage.PREPARE, new RuntimeException());
        recorder.recordDecodeError(new IllegalStateException());

        assertEquals(1.0, counter("decode_error").count());
        assertEquals(2, recorder.getFailedQueries());
    }

    @Test
    void testValidationError() {
        recorder.recordValidationError();

        assertEquals(1.0, counter("validation_error").count());
        assertEquals(1, recorder.getRejectedQueries());
        assertEquals(0, recorder.getFailedQueries());
    }

    @Test
    void testRowsRead() {
        recorder.recordBatch(10);
        recorder.recordBatch(0);
        recorder.recordBatch(5);

        assertEquals(15.0, counter("rows_read").count());
        assertEquals(15, recorder.getRowsRead());
    }

    @Test
    void testCountersAreTaggedByClient() {
        var other = new MicroMeterQueryRecorder(registry, "client2");
        other.recordQueryStart();

        assertEquals(0.0, counter("query_start").count());
        assertEquals(1, other.getStartedQueries());
    }
}
