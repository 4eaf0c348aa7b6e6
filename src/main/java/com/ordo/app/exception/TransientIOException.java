package com.ordo.app.exception;

import java.io.Serial;

/**
 * Falha de I/O passageira (permissão, lock, montagem de rede). Pode ser repetida.
 */
public class TransientIOException extends OrdoException {
    @Serial
    private static final long serialVersionUID = -2047719532880162458L;

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
