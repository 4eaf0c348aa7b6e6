package com.ordo.app.exception;

import java.io.Serial;

/**
 * Base de todas as falhas do motor de deduplicação e migração.
 */
public class OrdoException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6271543021857763910L;

    public OrdoException(String message) {
        super(message);
    }

    public OrdoException(String message, Throwable cause) {
        super(message, cause);
    }
}
