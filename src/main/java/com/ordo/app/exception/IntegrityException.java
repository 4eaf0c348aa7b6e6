package com.ordo.app.exception;

import java.io.Serial;

/**
 * Divergência de hash ou tamanho entre o esperado e o que está no disco.
 * Nunca é repetida automaticamente.
 */
public class IntegrityException extends OrdoException {
    @Serial
    private static final long serialVersionUID = 3390188475526931244L;

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
