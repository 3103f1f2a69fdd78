package io.quiver.sql.client;

import io.grpc.stub.AbstractStub;
import io.quiver.sql.common.errors.ValidationException;
import org.apache.arrow.flight.CallOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class QueryCallContextTest {

    @Test
    void carriesBearerTokenAndDatabase() {
        var context = QueryCallContext.of("my-token", "events", Map.of(), null);

        assertEquals("Bearer my-token", context.headers().get("authorization"));
        assertEquals("events", context.headers().get("database"));
        assertEquals("events", context.database());
    }

    @Test
    void emptyToken_sendsNoAuthorization() {
        var context = QueryCallContext.of("", "events", Map.of(), null);

        assertNull(context.headers().get("authorization"));
        assertEquals("events", context.headers().get("database"));
    }

    @Test
    void extraHeadersAreSent() {
        var context = QueryCallContext.of("t", "events", Map.of("trace-id", "abc"), null);

        assertEquals("abc", context.headers().get("trace-id"));
    }

    @Test
    void reservedHeadersCannotBeOverridden() {
        assertThrows(ValidationException.class,
                () -> QueryCallContext.of("t", "events", Map.of("Database", "other"), null));
        assertThrows(ValidationException.class,
                () -> QueryCallContext.of("t", "events", Map.of("authorization", "Basic x"), null));
    }

    @Test
    void callOptions_includeDeadlineWhenSet() {
        var withoutTimeout = QueryCallContext.of("t", "db", Map.of(), null).callOptions();
        var withTimeout = QueryCallContext.of("t", "db", Map.of(), Duration.ofSeconds(5)).callOptions();

        assertEquals(1, withoutTimeout.length);
        var headerOption = assertInstanceOf(QueryCallContext.CallHeadersOption.class, withoutTimeout[0]);
        assertEquals("db", headerOption.headers().get("database"));
        assertEquals(2, withTimeout.length);
    }

    @Test
    @SuppressWarnings({"rawtypes", "unchecked"})
    void subMillisecondTimeout_keepsItsDeadline() {
        var options = QueryCallContext.of("t", "db", Map.of(), Duration.ofNanos(500_000)).callOptions();
        AbstractStub stub = mock(AbstractStub.class);

        ((CallOptions.GrpcCallOption) options[1]).wrapStub(stub);

        verify(stub).withDeadlineAfter(500_000L, TimeUnit.NANOSECONDS);
    }
}
