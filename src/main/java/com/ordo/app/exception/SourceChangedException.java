package com.ordo.app.exception;

import java.io.Serial;

/**
 * O arquivo de origem de uma ação sumiu ou mudou de conteúdo depois do planejamento.
 */
public class SourceChangedException extends IntegrityException {
    @Serial
    private static final long serialVersionUID = -6841050972417700035L;

    public SourceChangedException(String message) {
        super(message);
    }
}
