package com.ordo.app.exception;

import java.io.Serial;

/**
 * Dois destinos iguais no mesmo plano, ou destino já ocupado no disco.
 */
public class ConflictException extends OrdoException {
    @Serial
    private static final long serialVersionUID = -1184720394468820153L;

    public ConflictException(String message) {
        super(message);
    }
}
