package io.quiver.sql.client;

import io.quiver.sql.common.Headers;
import io.quiver.sql.common.errors.ValidationException;
import org.apache.arrow.flight.CallHeaders;
import org.apache.arrow.flight.CallOption;
import org.apache.arrow.flight.CallOptions;
import org.apache.arrow.flight.FlightCallHeaders;
import org.apache.arrow.flight.HeaderCallOption;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Headers and deadline attached to every call of one query.
 */
final class QueryCallContext {

    private final String database;
    private final FlightCallHeaders headers;
    private final Duration timeout;

    private QueryCallContext(String database, FlightCallHeaders headers, Duration timeout) {
        this.database = database;
        this.headers = headers;
        this.timeout = timeout;
    }

    /**
     * @param token        bearer token, no authorization header is sent when empty
     * @param extraHeaders must not contain the authorization or database header
     */
    static QueryCallContext of(String token, String database, Map<String, String> extraHeaders, Duration timeout) {
        var headers = new FlightCallHeaders();
        extraHeaders.forEach((name, value) -> {
            var lower = name.toLowerCase(Locale.ROOT);
            if (lower.equals(Headers.HEADER_AUTHORIZATION) || lower.equals(Headers.HEADER_DATABASE)) {
                throw new ValidationException("header " + name + " cannot be overridden");
            }
            headers.insert(name, value);
        });
        if (!token.isEmpty()) {
            headers.insert(Headers.HEADER_AUTHORIZATION, Headers.BEARER_PREFIX + token);
        }
        headers.insert(Headers.HEADER_DATABASE, database);
        return new QueryCallContext(database, headers, timeout);
    }

    String database() {
        return database;
    }

    FlightCallHeaders headers() {
        return headers;
    }

    Duration timeout() {
        return timeout;
    }

    CallOption[] callOptions() {
        var options = new ArrayList<CallOption>(2);
        options.add(new CallHeadersOption(headers));
        if (timeout != null) {
            options.add(CallOptions.timeout(timeout.toNanos(), TimeUnit.NANOSECONDS));
        }
        return options.toArray(new CallOption[0]);
    }

    /**
     * Header option that keeps the headers it attaches to the call.
     */
    static final class CallHeadersOption extends HeaderCallOption {
        private final CallHeaders headers;

        CallHeadersOption(CallHeaders headers) {
            super(headers);
            this.headers = headers;
        }

        CallHeaders headers() {
            return headers;
        }
    }
}
