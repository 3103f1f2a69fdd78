package io.quiver.sql.client;

import io.quiver.sql.client.metrics.QueryRecorder;
import io.quiver.sql.client.stream.FlightStreamReader;
import io.quiver.sql.common.config.ClientConfig;
import io.quiver.sql.common.errors.ConnectionException;
import io.quiver.sql.common.errors.DecodeException;
import io.quiver.sql.common.errors.RemoteException;
import io.quiver.sql.common.errors.RemoteException.Stage;
import io.quiver.sql.common.errors.ValidationException;
import io.quiver.sql.common.options.QueryOptions;
import org.apache.arrow.flight.CallOption;
import org.apache.arrow.flight.FlightClient;
import org.apache.arrow.flight.FlightInfo;
import org.apache.arrow.flight.FlightStream;
import org.apache.arrow.flight.sql.FlightSqlClient;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the two protocol handles of a client and runs queries on them.
 * <p>
 * Every query prepares a statement, executes it, fetches the first endpoint of the result
 * and hands the stream to a {@link QueryIterator}. The prepared statement is closed before
 * the call returns, whatever the outcome. Database and credentials travel as call headers,
 * so concurrent queries against different databases share the handles.
 */
final class QuerySession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QuerySession.class);

    private final FlightClient flightClient;
    private final FlightSqlClient sqlClient;
    private final BufferAllocator allocator;
    private final ClientConfig config;
    private final QueryRecorder recorder;

    QuerySession(FlightClient flightClient, FlightSqlClient sqlClient, BufferAllocator allocator,
                 ClientConfig config, QueryRecorder recorder) {
        this.flightClient = flightClient;
        this.sqlClient = sqlClient;
        this.allocator = allocator;
        this.config = config;
        this.recorder = recorder;
    }

    static QuerySession connect(ClientConfig config, BufferAllocator allocator, QueryRecorder recorder) {
        var url = HostUrl.parse(config.host());
        var transport = TransportFactory.create(url, config.disableServerCertificateVerification());
        FlightClient flightClient = null;
        try {
            flightClient = transport.newClient(allocator);
            var sqlClient = new FlightSqlClient(transport.newClient(allocator));
            logger.info("Query client initialized for {} (tls={}, verifyServer={})",
                    transport.getLocation().getUri(), transport.isTls(), transport.verifiesServer());
            return new QuerySession(flightClient, sqlClient, allocator, config, recorder);
        } catch (RuntimeException e) {
            var exception = new ConnectionException("flight: " + e.getMessage(), e);
            if (flightClient != null) {
                closeClient(flightClient, exception);
            }
            throw exception;
        }
    }

    /**
     * @param parameters bound to the prepared statement when not null; it is closed together with
     *                   the statement
     */
    QueryIterator query(QueryOptions options, String query, VectorSchemaRoot parameters) {
        var context = newCallContext(options, query);
        var callOptions = context.callOptions();
        logger.debug("Preparing query on database {} (query type {})", context.database(), options.queryType());
        recorder.recordQueryStart();

        FlightSqlClient.PreparedStatement statement;
        try {
            statement = sqlClient.prepare(query, callOptions);
        } catch (RuntimeException e) {
            recorder.recordQueryError(Stage.PREPARE, e);
            throw new RemoteException(Stage.PREPARE, e);
        }

        RuntimeException failure = null;
        try {
            if (parameters != null) {
                statement.setParameters(parameters);
            }
            var info = execute(statement, callOptions);
            var stream = fetch(info, callOptions);
            var iterator = wrap(stream);
            recorder.recordQueryCompleted();
            return iterator;
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            release(statement, callOptions, failure);
        }
    }

    /**
     * Validates the call and builds its headers. Nothing here reaches the server.
     */
    QueryCallContext newCallContext(QueryOptions options, String query) {
        if (options == null) {
            throw rejected("options not set");
        }
        if (query == null || query.isBlank()) {
            throw rejected("query not specified");
        }
        var database = options.database().isEmpty() ? config.database() : options.database();
        if (database.isEmpty()) {
            throw rejected("database not specified");
        }
        try {
            return QueryCallContext.of(config.token(), database, options.headers(), config.timeout());
        } catch (ValidationException e) {
            recorder.recordValidationError();
            throw e;
        }
    }

    private ValidationException rejected(String message) {
        recorder.recordValidationError();
        return new ValidationException(message);
    }

    private FlightInfo execute(FlightSqlClient.PreparedStatement statement, CallOption[] callOptions) {
        FlightInfo info;
        try {
            info = statement.execute(callOptions);
        } catch (RuntimeException e) {
            recorder.recordQueryError(Stage.EXECUTE, e);
            throw new RemoteException(Stage.EXECUTE, e);
        }
        if (info.getEndpoints().isEmpty()) {
            var exception = new RemoteException(Stage.EXECUTE, "no endpoints returned");
            recorder.recordQueryError(Stage.EXECUTE, exception);
            throw exception;
        }
        if (info.getEndpoints().size() > 1) {
            logger.debug("Query returned {} endpoints, reading the first one only", info.getEndpoints().size());
        }
        return info;
    }

    private FlightStream fetch(FlightInfo info, CallOption[] callOptions) {
        var ticket = info.getEndpoints().get(0).getTicket();
        logger.trace("Fetching ticket of {} bytes", ticket.getBytes().length);
        try {
            return flightClient.getStream(ticket, callOptions);
        } catch (RuntimeException e) {
            recorder.recordQueryError(Stage.FETCH, e);
            throw new RemoteException(Stage.FETCH, e);
        }
    }

    private QueryIterator wrap(FlightStream stream) {
        var reader = FlightStreamReader.of(stream, allocator);
        try {
            reader.getSchema();
            return new QueryIterator(reader, recorder);
        } catch (RemoteException e) {
            closeReader(reader, e);
            recorder.recordQueryError(e.getStage(), e);
            throw e;
        } catch (DecodeException e) {
            closeReader(reader, e);
            recorder.recordDecodeError(e);
            throw e;
        }
    }

    private void release(FlightSqlClient.PreparedStatement statement, CallOption[] callOptions,
                         RuntimeException failure) {
        try {
            statement.close(callOptions);
        } catch (RuntimeException e) {
            if (failure != null) {
                failure.addSuppressed(new RemoteException(Stage.CLOSE, e));
            } else {
                logger.atWarn().setCause(e).log("Failed to close prepared statement");
            }
        }
    }

    private static void closeReader(FlightStreamReader reader, Exception failure) {
        try {
            reader.release();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private static void closeClient(AutoCloseable client, Exception failure) {
        try {
            client.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(e);
        } catch (Exception e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void close() throws Exception {
        Exception first = null;
        try {
            sqlClient.close();
        } catch (Exception e) {
            first = e;
        }
        try {
            flightClient.close();
        } catch (Exception e) {
            if (first != null) {
                first.addSuppressed(e);
            } else {
                first = e;
            }
        }
        if (first != null) {
            throw first;
        }
        logger.debug("Query client closed");
    }
}
