package com.ordo.app.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.AppContext;
import com.ordo.app.classify.ClassificationService;
import com.ordo.app.classify.CorrectionService;
import com.ordo.app.classify.ExtensionClassifier;
import com.ordo.app.classify.FilenameMetadataExtractor;
import com.ordo.app.config.Config;
import com.ordo.app.database.FileRecord;
import com.ordo.app.dedup.AnalysisResult;
import com.ordo.app.dedup.DuplicateAnalyzer;
import com.ordo.app.dedup.DuplicateGroup;
import com.ordo.app.exception.OrdoException;
import com.ordo.app.exception.RollbackIncompleteException;
import com.ordo.app.inventory.ScanConfig;
import com.ordo.app.inventory.ScanMetrics;
import com.ordo.app.inventory.Scanner;
import com.ordo.app.metrics.MetricsTracker;
import com.ordo.app.migration.ActionType;
import com.ordo.app.migration.ExecutionResult;
import com.ordo.app.migration.MigrationAction;
import com.ordo.app.migration.MigrationExecutor;
import com.ordo.app.migration.MigrationPlan;
import com.ordo.app.migration.MigrationPlanner;
import com.ordo.app.migration.PlanOptions;
import com.ordo.app.migration.RollbackResult;
import com.ordo.app.migration.StructureConfig;
import com.ordo.app.reorg.ReorganizeResult;
import com.ordo.app.reorg.Reorganizer;

/**
 * Ponto de entrada de linha de comando. Códigos de saída: 0 ok, 1 falha, 2 uso inválido.
 */
public final class Cli {

    private static final Logger logger = LoggerFactory.getLogger(Cli.class);

    private Cli() {}

    public static void main(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }
        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        if (cmd.equals("help") || cmd.equals("-h") || cmd.equals("--help")) {
            printUsage();
            return 0;
        }

        Config config;
        try {
            config = Config.load();
        } catch (OrdoException e) {
            System.err.println("Configuração inválida: " + safeMsg(e));
            return 2;
        }
        return execute(config, cmd, rest);
    }

    /** Executa um comando com uma configuração já montada (usado também pelos testes). */
    public static int execute(Config config, String cmd, String[] rest) {
        ParseResult<Options> parsed = Options.parse(rest);
        if (parsed.help()) {
            printUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printUsage();
            return 2;
        }
        Options o = parsed.value();

        try (AppContext ctx = AppContext.open(config)) {
            return switch (cmd) {
                case "scan" -> runScan(ctx, o);
                case "analyze" -> runAnalyze(ctx);
                case "classify" -> runClassify(ctx);
                case "review" -> runReview(ctx, o);
                case "correct" -> runCorrect(ctx, o);
                case "plan" -> runPlan(ctx, o);
                case "approve" -> runApprove(ctx, o);
                case "execute" -> runExecute(ctx, o);
                case "rollback" -> runRollback(ctx, o);
                case "reorg" -> runReorg(ctx, o);
                case "metrics" -> runMetrics(ctx, o);
                default -> {
                    System.err.println("Comando inválido: " + cmd);
                    printUsage();
                    yield 2;
                }
            };
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (Exception e) {
            logger.error("Comando {} falhou", cmd, e);
            System.err.println("Erro fatal: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- scan / analyze / classify -----------------

    private static int runScan(AppContext ctx, Options o) {
        if (o.roots().isEmpty()) throw new UsageException("Informe ao menos um --root");
        List<Path> roots = new ArrayList<>();
        for (String r : o.roots()) {
            Path p = Path.of(r).toAbsolutePath().normalize();
            if (!Files.isDirectory(p)) throw new UsageException("Pasta não existe: " + p);
            roots.add(p);
        }

        ScanConfig cfg = ScanConfig.from(ctx.config()).withExcludes(o.excludes());
        ScanMetrics metrics = new ScanMetrics();
        AtomicBoolean cancel = new AtomicBoolean(false);
        Thread hook = installCancelHook(cancel);
        try {
            Scanner.ScanResult r = new Scanner(ctx).scan(roots, cfg, metrics, cancel);
            System.out.printf("Scan %d%s: vistos=%d novos=%d inalterados=%d substituídos=%d erros=%d%n",
                    r.scanId(), r.canceled() ? " (cancelado)" : "", r.filesSeen(), r.newRecords(),
                    r.unchanged(), r.superseded(), r.errors());
            return r.canceled() ? 1 : 0;
        } finally {
            removeCancelHook(hook);
        }
    }

    private static int runAnalyze(AppContext ctx) {
        AnalysisResult r = new DuplicateAnalyzer(ctx).analyze();
        System.out.printf("Grupos=%d duplicados=%d desperdício=%d bytes sugestões=%d erros=%d%n",
                r.groups().size(), r.duplicateFiles(), r.wastedBytes(), r.suggestions().size(), r.errors());
        for (DuplicateGroup g : r.groups()) {
            System.out.printf("  [%s] canônico=%d duplicados=%s%n",
                    g.detectionMethod(), g.canonicalFileId(), g.duplicateFileIds());
        }
        return 0;
    }

    private static int runClassify(AppContext ctx) {
        ClassificationService.Report r = new ClassificationService(
                ctx, new ExtensionClassifier(), new FilenameMetadataExtractor()).classifyPending();
        System.out.printf("Classificados=%d revisão=%d falhas=%d timeouts=%d%n",
                r.classified(), r.review(), r.failed(), r.timedOut());
        return 0;
    }

    private static int runReview(AppContext ctx, Options o) {
        List<FileRecord> rows = new CorrectionService(ctx).filesRequiringReview(o.limit());
        if (rows.isEmpty()) {
            System.out.println("Nada aguardando revisão.");
            return 0;
        }
        System.out.println("id | tipo | confiança | local");
        for (FileRecord r : rows) {
            System.out.printf("%d | %s | %s | %s%n", r.fileId(), safeText(r.documentType()),
                    r.confidence() == null ? "-" : String.format(Locale.ROOT, "%.2f", r.confidence()), r.location());
        }
        return 0;
    }

    private static int runCorrect(AppContext ctx, Options o) {
        if (o.fileId() == null || isBlank(o.type())) {
            throw new UsageException("Parâmetros obrigatórios: --file e --type");
        }
        FileRecord r = new CorrectionService(ctx).correct(o.fileId(), o.type(), o.reason());
        System.out.printf("Arquivo %d agora é %s%n", r.fileId(), r.documentType());
        return 0;
    }

    // ----------------- planos -----------------

    private static int runPlan(AppContext ctx, Options o) {
        StructureConfig structure = structure(ctx, o);
        PlanOptions options = PlanOptions.initial(ctx.config());
        if (o.copy()) options = options.withMoveType(ActionType.COPY);

        MigrationPlan plan = new MigrationPlanner(ctx).createPlan(structure, options);
        System.out.printf("Plano %s: %d ações%n", plan.planId(), plan.actions().size());
        printActions(plan.actions());
        return 0;
    }

    private static int runApprove(AppContext ctx, Options o) {
        MigrationPlanner planner = new MigrationPlanner(ctx);
        MigrationPlan plan = planner.approve(planner.load(requirePlan(o)));
        System.out.printf("Plano %s aprovado (%d ações)%n", plan.planId(), plan.actions().size());
        return 0;
    }

    private static int runExecute(AppContext ctx, Options o) {
        MigrationPlan plan = new MigrationPlanner(ctx).load(requirePlan(o));
        AtomicBoolean cancel = new AtomicBoolean(false);
        Thread hook = installCancelHook(cancel);
        try {
            ExecutionResult r = new MigrationExecutor(ctx).execute(plan, cancel);
            printExecution(r);
            return r.failed() == 0 && !r.rolledBack() ? 0 : 1;
        } finally {
            removeCancelHook(hook);
        }
    }

    private static int runRollback(AppContext ctx, Options o) {
        MigrationExecutor executor = new MigrationExecutor(ctx);
        try {
            RollbackResult r = executor.rollback(executor.checkpointFor(requirePlan(o)));
            System.out.printf("Rollback %s: desfeitas=%d já restauradas=%d registros=%d%n",
                    r.checkpointId(), r.reversed(), r.alreadyRestored(), r.recordsRestored());
            return 0;
        } catch (RollbackIncompleteException e) {
            System.err.println("Rollback incompleto (" + e.getCheckpointId() + "):");
            e.getDiscrepancies().forEach(d -> System.err.println("  " + d));
            return 1;
        }
    }

    private static int runReorg(AppContext ctx, Options o) {
        StructureConfig structure = structure(ctx, o);
        Path root = o.roots().isEmpty()
                ? ctx.config().getCanonicalRoot()
                : Path.of(o.roots().get(0)).toAbsolutePath().normalize();
        ReorganizeResult r = new Reorganizer(ctx).reorganize(root, structure, o.dryRun());
        System.out.printf("Sync: no disco=%d realocados=%d ausentes=%d reencontrados=%d novos=%d cópias extras=%d%n",
                r.sync().filesOnDisk(), r.sync().relocated(), r.sync().missing(), r.sync().rediscovered(),
                r.sync().discovered(), r.sync().extraCopies());
        if (o.dryRun()) {
            System.out.printf("Dry-run: %d ações planejadas%n", r.plannedActions().size());
            printActions(r.plannedActions());
            return 0;
        }
        r.executionResult().ifPresent(Cli::printExecution);
        System.out.printf("Movidos=%d erros=%d pastas vazias removidas=%d%n",
                r.moves(), r.errors(), r.removedDirectories().size());
        return r.errors() == 0 ? 0 : 1;
    }

    // ----------------- métricas -----------------

    private static int runMetrics(AppContext ctx, Options o) {
        MetricsTracker tracker = new MetricsTracker(ctx);
        MetricsTracker.Snapshot s = o.save() ? tracker.saveSnapshot() : tracker.snapshot();
        System.out.printf(Locale.ROOT, "Classificação: %.1f%% (%d classificados, %d correções)%n",
                s.classification().accuracy() * 100, s.classification().totalClassified(),
                s.classification().totalCorrections());
        for (Map.Entry<String, Long> e : s.classification().byMethod().entrySet()) {
            System.out.printf("  %s: %d%n", e.getKey(), e.getValue());
        }
        if (!s.classification().commonErrors().isEmpty()) {
            System.out.println("Erros mais comuns:");
            s.classification().commonErrors().forEach((k, v) -> System.out.printf("  %s: %d%n", k, v));
        }
        System.out.printf(Locale.ROOT, "Estabilidade: %.1f%% (%d organizados, média %.2f movimentos)%n",
                s.stability().stability() * 100, s.stability().totalOrganized(), s.stability().averageMoves());
        System.out.printf(Locale.ROOT, "Duplicação: %.1f%% (%d de %d, %d bytes desperdiçados)%n",
                s.deduplication().deduplicationRate() * 100, s.deduplication().duplicateFiles(),
                s.deduplication().totalFiles(), s.deduplication().wastedBytes());
        System.out.printf("Revisão: %d arquivos, %d sugestões de quase-duplicata%n",
                s.review().requiringReview(), s.review().openNearDuplicates());
        return 0;
    }

    // ----------------- helpers -----------------

    private static StructureConfig structure(AppContext ctx, Options o) {
        Path path = isBlank(o.config()) ? ctx.config().getStructureConfigPath() : Path.of(o.config());
        if (path == null) throw new UsageException("Informe --config ou ORDO_STRUCTURE_CONFIG");
        return StructureConfig.load(path);
    }

    private static String requirePlan(Options o) {
        if (isBlank(o.planId())) throw new UsageException("Parâmetro obrigatório: --plan");
        return o.planId();
    }

    private static void printActions(List<MigrationAction> actions) {
        for (MigrationAction a : actions) {
            System.out.printf("  #%d %s %s -> %s%s%n", a.seq(), a.actionType(), a.sourcePath(), a.targetPath(),
                    a.requiresReview() ? " (revisar)" : "");
        }
    }

    private static void printExecution(ExecutionResult r) {
        System.out.printf("Plano %s: %s, %d/%d ok, %d falhas%s%n", r.planId(), r.status(), r.succeeded(), r.total(),
                r.failed(), r.rolledBack() ? ", revertido" : "");
        for (MigrationAction a : r.failures()) {
            System.out.printf("  #%d %s: %s%n", a.seq(), a.sourcePath(), safeText(a.error()));
        }
        for (String d : r.rollbackDiscrepancies()) {
            System.out.println("  rollback: " + d);
        }
    }

    private static Thread installCancelHook(AtomicBoolean cancel) {
        Thread hook = new Thread(() -> {
            cancel.set(true);
            System.err.println("Cancelamento solicitado (shutdown hook) em " + Instant.now());
        }, "ordo-cli-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private static void removeCancelHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM já está encerrando
            logger.debug("Hook de cancelamento não removido: {}", e.getMessage());
        }
    }

    private static void printUsage() {
        System.out.println("""
                Ordo CLI
                Comandos:
                  scan --root <pasta> [--root <pasta>...] [--exclude <glob>...]
                  analyze
                  classify
                  review [--limit <n>]
                  correct --file <id> --type <tipo> [--reason <motivo>]
                  plan [--config <estrutura.json>] [--copy]
                  approve --plan <id>
                  execute --plan <id>
                  rollback --plan <id>
                  reorg [--root <raiz canônica>] [--config <estrutura.json>] [--dry-run]
                  metrics [--save]
                  help
                """);
    }

    // ----------------- parsing -----------------

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    private record Options(List<String> roots, List<String> excludes, String config, String planId, Long fileId,
                           String type, String reason, int limit, boolean dryRun, boolean copy, boolean save) {

        static ParseResult<Options> parse(String[] args) {
            List<String> roots = new ArrayList<>();
            List<String> excludes = new ArrayList<>();
            String config = null, planId = null, type = null, reason = null;
            Long fileId = null;
            int limit = 50;
            boolean dryRun = false, copy = false, save = false;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--root" -> roots.add(c.requireNext("--root"));
                        case "--exclude" -> excludes.add(c.requireNext("--exclude"));
                        case "--config" -> config = c.requireNext("--config");
                        case "--plan" -> planId = c.requireNext("--plan");
                        case "--file" -> fileId = Long.parseLong(c.requireNext("--file").trim());
                        case "--type" -> type = c.requireNext("--type");
                        case "--reason" -> reason = c.requireNext("--reason");
                        case "--limit" -> limit = Math.max(1, Integer.parseInt(c.requireNext("--limit").trim()));
                        case "--dry-run" -> dryRun = true;
                        case "--copy" -> copy = true;
                        case "--save" -> save = true;
                        default -> { return ParseResult.errorResult("Opção inválida: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Valor numérico inválido: " + safeMsg(e));
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new Options(List.copyOf(roots), List.copyOf(excludes), config, planId,
                    fileId, type, reason, limit, dryRun, copy, save));
        }
    }

    // ----------------- misc -----------------

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Erro" : t.getClass().getSimpleName())
                : m;
    }

    private static String safeText(String v) {
        return isBlank(v) ? "-" : v;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
