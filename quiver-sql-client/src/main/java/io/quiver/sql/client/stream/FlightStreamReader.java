package io.quiver.sql.client.stream;

import io.quiver.sql.common.errors.DecodeException;
import io.quiver.sql.common.errors.RemoteException;
import org.apache.arrow.flight.FlightRuntimeException;
import org.apache.arrow.flight.FlightStream;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * Reads the result stream of a query as an {@link ArrowReader}.
 * <p>
 * Failures while reading are reported in the client's terms: a Flight status raised by the
 * stream becomes a {@link RemoteException} of stage {@link RemoteException.Stage#FETCH}, anything
 * else a {@link DecodeException}. The root is the stream's own root, reloaded in place by each batch.
 */
public class FlightStreamReader extends ArrowReader {
    private final FlightStream flightStream;

    public static FlightStreamReader of(FlightStream flightStream, BufferAllocator bufferAllocator) {
        return new FlightStreamReader(flightStream, bufferAllocator);
    }

    protected FlightStreamReader(FlightStream flightStream, BufferAllocator bufferAllocator) {
        super(bufferAllocator);
        this.flightStream = flightStream;
    }

    /**
     * Blocks until the server has sent the schema.
     */
    public Schema getSchema() {
        return read(() -> flightStream.getRoot().getSchema());
    }

    /**
     * @return false once the stream is drained
     */
    public boolean nextBatch() {
        return read(flightStream::next);
    }

    /**
     * Closes the stream. A failure is reported as a {@link RemoteException} of stage FETCH.
     */
    public void release() {
        try {
            close();
        } catch (IOException e) {
            throw new RemoteException(RemoteException.Stage.FETCH,
                    e.getCause() instanceof FlightRuntimeException f ? f : e);
        }
    }

    private static <T> T read(Supplier<T> step) {
        try {
            return step.get();
        } catch (FlightRuntimeException e) {
            throw new RemoteException(RemoteException.Stage.FETCH, e);
        } catch (RuntimeException e) {
            throw new DecodeException("flight reader: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean loadNextBatch() {
        return nextBatch();
    }

    /**
     * Always 0, {@link FlightStream} does not track bytes.
     */
    @Override
    public long bytesRead() {
        return 0;
    }

    @Override
    protected void closeReadSource() throws IOException {
        try {
            flightStream.close();
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to close result stream", e);
        }
    }

    @Override
    protected Schema readSchema() {
        return getSchema();
    }

    @Override
    public VectorSchemaRoot getVectorSchemaRoot() {
        return flightStream.getRoot();
    }
}
