package me.matthew.flink.csmoneyscraper.parser;

/**
 * Thrown when the embedded page state cannot be located, decoded or navigated.
 * The kind is informational; callers treat every kind as a failed attempt.
 */
public class SnapshotExtractionException extends Exception {

    public enum Kind {
        MARKER_NOT_FOUND,
        MALFORMED_PAYLOAD,
        UNEXPECTED_SHAPE
    }

    private final Kind kind;

    public SnapshotExtractionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SnapshotExtractionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
