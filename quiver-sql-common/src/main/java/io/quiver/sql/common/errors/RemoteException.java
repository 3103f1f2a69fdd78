package io.quiver.sql.common.errors;

import org.apache.arrow.flight.FlightRuntimeException;
import org.apache.arrow.flight.FlightStatusCode;

/**
 * The server rejected one of the calls of a query: bad query, authorization failure,
 * unknown database or a transport fault in the middle of the call.
 * <p>
 * The remote description is kept in the message; {@link #getStatusCode()} is
 * {@link FlightStatusCode#UNKNOWN} when the failure did not carry a Flight status.
 */
public class RemoteException extends QuiverException {

    public enum Stage {
        PREPARE("flight prepare"),
        EXECUTE("flight execute"),
        FETCH("flight doget"),
        CLOSE("flight close");

        private final String label;

        Stage(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Stage stage;
    private final FlightStatusCode statusCode;

    public RemoteException(Stage stage, String message) {
        super(stage.label() + ": " + message);
        this.stage = stage;
        this.statusCode = FlightStatusCode.UNKNOWN;
    }

    public RemoteException(Stage stage, Throwable cause) {
        super(stage.label() + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.statusCode = cause instanceof FlightRuntimeException f
                ? f.status().code()
                : FlightStatusCode.UNKNOWN;
    }

    public Stage getStage() {
        return stage;
    }

    public FlightStatusCode getStatusCode() {
        return statusCode;
    }
}
