package com.polarroute.route.exception;

/**
 * Fatal failure of a mesh import run. Propagated to the scheduler rather than swallowed.
 */
public class MeshIngestionException extends RuntimeException {

    public MeshIngestionException(String message) {
        super(message);
    }

    public MeshIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
