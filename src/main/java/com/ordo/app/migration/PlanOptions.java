package com.ordo.app.migration;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Set;

import com.ordo.app.config.Config;
import com.ordo.app.database.FileState;

/**
 * Parâmetros do planejamento.
 *
 * @param states            estados elegíveis ({@code classified} na organização inicial,
 *                          {@code organized} na reorganização)
 * @param includeDuplicates aplica a política de duplicatas da configuração de estrutura
 * @param moveType          MOVE ou COPY para arquivos não duplicados
 */
public record PlanOptions(
        Set<FileState> states,
        Path canonicalRoot,
        Path quarantineDir,
        Path trashDir,
        ZoneId zone,
        boolean includeDuplicates,
        ActionType moveType,
        String purpose
) {

    public PlanOptions {
        states = Set.copyOf(states);
        canonicalRoot = canonicalRoot.toAbsolutePath().normalize();
        quarantineDir = quarantineDir.toAbsolutePath().normalize();
        trashDir = trashDir.toAbsolutePath().normalize();
        if (moveType != ActionType.MOVE && moveType != ActionType.COPY) {
            throw new IllegalArgumentException("moveType must be MOVE or COPY");
        }
    }

    public static PlanOptions initial(Config config) {
        return new PlanOptions(Set.of(FileState.CLASSIFIED), config.getCanonicalRoot(), config.getQuarantineDir(),
                config.getTrashDir(), config.getZone(), true, ActionType.MOVE, "organize");
    }

    public static PlanOptions reorganize(Config config, Path canonicalRoot) {
        return new PlanOptions(Set.of(FileState.ORGANIZED), canonicalRoot, config.getQuarantineDir(),
                config.getTrashDir(), config.getZone(), false, ActionType.MOVE, "reorganize");
    }

    public PlanOptions withMoveType(ActionType type) {
        return new PlanOptions(states, canonicalRoot, quarantineDir, trashDir, zone, includeDuplicates, type, purpose);
    }
}
