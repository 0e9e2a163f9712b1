package dk.trustworks.attribution.exceptions;

/**
 * Thrown when the snapshot, touch or campaign feed cannot be read.
 * No aggregation is attempted on a partial read.
 */
public class DataUnavailableException extends RuntimeException {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
