package com.ordo.app.reorg;

/**
 * Resultado da reconciliação entre disco e registro.
 *
 * @param extraCopies arquivos cujo conteúdo já está registrado em outro lugar; só reportados
 */
public record SyncReport(int filesOnDisk, int relocated, int missing, int rediscovered, int discovered,
                         int extraCopies, int errors) {

    public int changes() {
        return relocated + missing + rediscovered + discovered;
    }
}
