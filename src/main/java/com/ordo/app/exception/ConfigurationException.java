package com.ordo.app.exception;

import java.io.Serial;

/**
 * Template inválido ou configuração de estrutura malformada. Aborta o planejamento inteiro.
 */
public class ConfigurationException extends OrdoException {
    @Serial
    private static final long serialVersionUID = 8818923011205694271L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
