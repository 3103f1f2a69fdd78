package io.quiver.sql.client;

import io.quiver.sql.client.metrics.NOOPQueryRecorder;
import io.quiver.sql.client.metrics.QueryRecorder;
import io.quiver.sql.common.config.ClientConfig;
import io.quiver.sql.common.options.Option;
import io.quiver.sql.common.options.Options;
import io.quiver.sql.common.options.QueryOptions;
import io.quiver.sql.common.options.WriteOptions;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.util.Objects;

/**
 * Client of a columnar time-series database speaking Arrow Flight SQL.
 * <pre>{@code
 * try (var client = QuiverClient.create(ClientConfig.builder()
 *         .host("https://localhost:8181")
 *         .token("my-token")
 *         .database("metrics")
 *         .build());
 *      var result = client.query("SELECT * FROM cpu", Options.withDatabase("events"))) {
 *     while (result.hasNext()) {
 *         System.out.println(result.next());
 *     }
 * }
 * }</pre>
 * The protocol handles are created once and shared by all calls; the client is safe for
 * concurrent queries.
 */
public class QuiverClient implements AutoCloseable {

    private static final class DefaultAllocatorHolder {
        static final BufferAllocator INSTANCE = new RootAllocator();
    }

    private final ClientConfig config;
    private final QuerySession session;

    QuiverClient(ClientConfig config, QuerySession session) {
        this.config = config;
        this.session = session;
    }

    /**
     * Process wide allocator used by clients that are not given one.
     */
    public static BufferAllocator defaultAllocator() {
        return DefaultAllocatorHolder.INSTANCE;
    }

    public static QuiverClient create(ClientConfig config) {
        return create(config, defaultAllocator(), new NOOPQueryRecorder());
    }

    public static QuiverClient create(ClientConfig config, BufferAllocator allocator, QueryRecorder recorder) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(allocator, "allocator must not be null");
        Objects.requireNonNull(recorder, "recorder must not be null");
        config.validate();
        return new QuiverClient(config, QuerySession.connect(config, allocator, recorder));
    }

    /**
     * Runs a query with the configured query options.
     */
    public QueryIterator query(String query) {
        return queryWithOptions(config.queryOptions(), query, null);
    }

    public QueryIterator query(String query, Option... options) {
        return queryWithOptions(Options.queryOptions(config.queryOptions(), options), query, null);
    }

    /**
     * @param parameters values of the query placeholders, one column per parameter
     */
    public QueryIterator queryParametrized(String query, VectorSchemaRoot parameters) {
        return queryWithOptions(config.queryOptions(), query, parameters);
    }

    public QueryIterator queryParametrized(String query, VectorSchemaRoot parameters, Option... options) {
        return queryWithOptions(Options.queryOptions(config.queryOptions(), options), query, parameters);
    }

    /**
     * @param options    resolved query options, the database falls back to the configured one when empty
     * @param parameters may be null
     * @return iterator owning the result stream; close it when not read to the end
     * @throws io.quiver.sql.common.errors.ValidationException when no database can be resolved
     * @throws io.quiver.sql.common.errors.RemoteException     when the server rejects a call
     * @throws io.quiver.sql.common.errors.DecodeException     when the result cannot be decoded
     */
    public QueryIterator queryWithOptions(QueryOptions options, String query, VectorSchemaRoot parameters) {
        return session.query(options, query, parameters);
    }

    /**
     * Write options of a call: configured write defaults with {@code options} applied in order.
     */
    public WriteOptions writeOptions(Option... options) {
        return Options.writeOptions(config.writeOptions(), options);
    }

    public ClientConfig getConfig() {
        return config;
    }

    @Override
    public void close() throws Exception {
        session.close();
    }
}
