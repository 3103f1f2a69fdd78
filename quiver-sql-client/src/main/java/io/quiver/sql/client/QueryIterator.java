package io.quiver.sql.client;

import io.quiver.sql.client.metrics.QueryRecorder;
import io.quiver.sql.client.stream.FlightStreamReader;
import io.quiver.sql.common.errors.DecodeException;
import io.quiver.sql.common.errors.RemoteException;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.Text;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Result of a query. Iterates the rows of every record batch as column name to value maps,
 * or the batches themselves through {@link #nextBatch()} and {@link #getRoot()}.
 * <p>
 * The iterator owns the result stream: drain it or close it to release the server side resources.
 * It closes itself once the last batch was read. Not thread safe.
 */
public class QueryIterator implements Iterator<Map<String, Object>>, AutoCloseable {

    private final FlightStreamReader reader;
    private final QueryRecorder recorder;

    private VectorSchemaRoot root;
    private int rowIndex;
    private int rowCount;
    private boolean exhausted;
    private boolean closed;

    QueryIterator(FlightStreamReader reader, QueryRecorder recorder) {
        this.reader = reader;
        this.recorder = recorder;
    }

    /**
     * Moves to the next record batch. Row iteration continues from the first row of that batch.
     *
     * @return false when the stream has no more batches
     */
    public boolean nextBatch() {
        if (exhausted) {
            return false;
        }
        boolean loaded;
        try {
            loaded = reader.nextBatch();
        } catch (RemoteException e) {
            closeAfterFailure(e);
            recorder.recordQueryError(e.getStage(), e);
            throw e;
        } catch (DecodeException e) {
            closeAfterFailure(e);
            recorder.recordDecodeError(e);
            throw e;
        }
        if (!loaded) {
            close();
            return false;
        }
        root = reader.getVectorSchemaRoot();
        rowIndex = 0;
        rowCount = root.getRowCount();
        recorder.recordBatch(rowCount);
        return true;
    }

    @Override
    public boolean hasNext() {
        while (rowIndex >= rowCount) {
            if (!nextBatch()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Map<String, Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        var row = new LinkedHashMap<String, Object>();
        for (FieldVector vector : root.getFieldVectors()) {
            row.put(vector.getName(), value(vector.getObject(rowIndex)));
        }
        rowIndex++;
        return row;
    }

    private static Object value(Object raw) {
        if (raw instanceof Text text) {
            return text.toString();
        }
        return raw;
    }

    /**
     * Current batch, null before the first call of {@link #nextBatch()} or {@link #hasNext()}.
     */
    public VectorSchemaRoot getRoot() {
        return root;
    }

    public Schema getSchema() {
        return reader.getSchema();
    }

    /**
     * The underlying reader, for callers that consume Arrow batches directly.
     */
    public FlightStreamReader getReader() {
        return reader;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @throws RemoteException when the stream cannot be closed
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        exhausted = true;
        rowIndex = rowCount;
        reader.release();
    }

    private void closeAfterFailure(Exception failure) {
        try {
            close();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }
}
