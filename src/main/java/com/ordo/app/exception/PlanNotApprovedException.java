package com.ordo.app.exception;

import java.io.Serial;

public class PlanNotApprovedException extends OrdoException {
    @Serial
    private static final long serialVersionUID = 2260917447139985532L;

    private final String planId;

    public PlanNotApprovedException(String planId) {
        super("Plano " + planId + " precisa ser aprovado antes da execução");
        this.planId = planId;
    }

    public String getPlanId() {
        return planId;
    }
}
