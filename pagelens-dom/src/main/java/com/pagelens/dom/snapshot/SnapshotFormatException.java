package com.pagelens.dom.snapshot;

import lombok.Getter;

/**
 * A captured tree could not be read: malformed JSON, or a node that is
 * missing required fields.
 */
@Getter
public class SnapshotFormatException extends RuntimeException {

    /** Where the snapshot came from, e.g. a file path or "<string>". */
    private final String source;

    public SnapshotFormatException(String message, String source) {
        this(message, source, null);
    }

    public SnapshotFormatException(String message, String source, Throwable cause) {
        super(message + " (source: " + source + ")", cause);
        this.source = source;
    }
}
