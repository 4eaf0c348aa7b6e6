package com.ordo.app.reorg;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.AppContext;
import com.ordo.app.migration.ActionOutcome;
import com.ordo.app.migration.ExecutionResult;
import com.ordo.app.migration.MigrationAction;
import com.ordo.app.migration.MigrationExecutor;
import com.ordo.app.migration.MigrationPlan;
import com.ordo.app.migration.MigrationPlanner;
import com.ordo.app.migration.PlanOptions;
import com.ordo.app.migration.StructureConfig;

/**
 * Reorganização reentrante da raiz canônica: sincroniza, replaneja sobre os organizados,
 * executa e limpa diretórios vazios. Sem mudanças de configuração ou de tipos, a segunda
 * rodada não move nada.
 */
public final class Reorganizer {

    private static final Logger logger = LoggerFactory.getLogger(Reorganizer.class);

    private final AppContext ctx;
    private final RegistrySync sync;
    private final MigrationPlanner planner;
    private final MigrationExecutor executor;

    public Reorganizer(AppContext ctx) {
        this.ctx = ctx;
        this.sync = new RegistrySync(ctx);
        this.planner = new MigrationPlanner(ctx);
        this.executor = new MigrationExecutor(ctx);
    }

    public ReorganizeResult reorganize(Path canonicalRoot, StructureConfig config, boolean dryRun) {
        Path root = canonicalRoot.toAbsolutePath().normalize();

        SyncReport report = sync.sync(root);

        PlanOptions options = PlanOptions.reorganize(ctx.config(), root);
        MigrationPlan plan = planner.plan(config, planner.snapshot(), options);

        if (dryRun || plan.isEmpty()) {
            logger.info("Reorganização de {}{}: {} movimentos pendentes", root, dryRun ? " (dry-run)" : "",
                    plan.actions().size());
            return new ReorganizeResult(report, plan.actions(), null, List.of());
        }

        planner.save(plan);
        MigrationPlan approved = planner.approve(plan);
        ExecutionResult execution = executor.execute(approved);

        List<Path> removed = removeEmptyDirectories(root, execution.actions());
        logger.info("Reorganização de {}: {} movimentos, {} diretórios vazios removidos",
                root, execution.succeeded(), removed.size());
        return new ReorganizeResult(report, plan.actions(), execution, removed);
    }

    /**
     * Remove, de baixo para cima, os diretórios esvaziados pelas ações aplicadas. A raiz fica.
     */
    static List<Path> removeEmptyDirectories(Path root, List<MigrationAction> actions) {
        TreeSet<Path> candidates = new TreeSet<>(Comparator.comparingInt(Path::getNameCount).reversed()
                .thenComparing(Comparator.<Path>naturalOrder()));
        for (MigrationAction a : actions) {
            if (a.outcome() != ActionOutcome.SUCCEEDED) continue;
            Path dir = Paths.get(a.sourcePath()).toAbsolutePath().normalize().getParent();
            while (dir != null && dir.startsWith(root) && !dir.equals(root)) {
                candidates.add(dir);
                dir = dir.getParent();
            }
        }

        List<Path> removed = new ArrayList<>();
        for (Path dir : candidates) {
            if (!Files.isDirectory(dir) || !isEmpty(dir)) continue;
            try {
                Files.delete(dir);
                removed.add(dir);
            } catch (DirectoryNotEmptyException e) {
                logger.debug("Diretório recebeu arquivos durante a limpeza: {}", dir);
            } catch (IOException e) {
                logger.warn("Não foi possível remover diretório vazio {}: {}", dir, e.toString());
            }
        }
        return removed;
    }

    private static boolean isEmpty(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.findAny().isEmpty();
        } catch (IOException e) {
            logger.warn("Não foi possível listar {}: {}", dir, e.toString());
            return false;
        }
    }
}
