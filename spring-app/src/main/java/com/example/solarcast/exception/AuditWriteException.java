package com.example.solarcast.exception;

import java.nio.file.Path;

/** Raised inside the audit writer only; it is logged there and never reaches a request. */
public class AuditWriteException extends RuntimeException {
    public AuditWriteException(Path file, Throwable cause) {
        super("Audit append to " + file + " failed", cause);
    }
}
