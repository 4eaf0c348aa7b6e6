package com.ordo.app.migration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ordo.app.AppContext;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.MigrationDao;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.exception.ConflictException;
import com.ordo.app.inventory.FileNames;

/**
 * Calcula onde cada arquivo deveria estar e emite as ações necessárias. As ações são função
 * pura de (configuração, fotografia do registro, opções): rodar duas vezes sem mudanças no
 * meio dá um plano vazio na segunda.
 */
public final class MigrationPlanner {

    private static final Logger logger = LoggerFactory.getLogger(MigrationPlanner.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern DATE = Pattern.compile("(\\d{4})[-_](\\d{2})[-_](\\d{2})");
    private static final Set<String> DATE_KEYS = Set.of("YYYY", "MM", "DD");

    private final AppContext ctx;

    public MigrationPlanner(AppContext ctx) {
        this.ctx = ctx;
    }

    // -----------------------------
    // Registro
    // -----------------------------

    public RegistrySnapshot snapshot() {
        return ctx.jdbi().inTransaction(handle -> {
            RegistryDao dao = handle.attach(RegistryDao.class);
            List<FileRecord> records = dao.fetchActive();
            Map<Long, Map<String, String>> metadata = new HashMap<>();
            for (RegistryDao.MetadataRow row : dao.fetchAllMetadata()) {
                if (row.metaValue() == null) continue;
                metadata.computeIfAbsent(row.fileId(), k -> new LinkedHashMap<>()).put(row.metaKey(), row.metaValue());
            }
            Map<Long, Map<String, String>> frozen = new HashMap<>();
            metadata.forEach((k, v) -> frozen.put(k, Map.copyOf(v)));
            return new RegistrySnapshot(records, frozen);
        });
    }

    /** Fotografia + planejamento + persistência como plano pendente. */
    public MigrationPlan createPlan(StructureConfig config, PlanOptions options) {
        RegistrySnapshot snapshot = snapshot();
        MigrationPlan plan = plan(config, snapshot, options);
        organizeInPlace(config, snapshot, options);
        save(plan);
        return plan;
    }

    /**
     * Registra como organizados, sem mover nada, os arquivos elegíveis que já estão onde a
     * configuração os colocaria. Sem isso eles nunca entrariam no plano nem na reorganização.
     *
     * @return quantos registros passaram a {@code organized}
     */
    public int organizeInPlace(StructureConfig config, RegistrySnapshot snapshot, PlanOptions options) {
        List<FileRecord> placed = new ArrayList<>();
        List<Boolean> review = new ArrayList<>();
        for (FileRecord r : snapshot.records()) {
            if (r.state() == FileState.ORGANIZED || !isEligible(r, options)) continue;
            Placement p = place(r, config, snapshot, options);
            if (FileNames.key(p.desired()).equals(FileNames.key(r.locationPath()))) {
                placed.add(r);
                review.add(p.rendered().requiresReview());
            }
        }
        if (placed.isEmpty()) return 0;

        long now = ctx.nowMillis();
        ctx.jdbi().useTransaction(handle -> {
            RegistryDao dao = handle.attach(RegistryDao.class);
            for (int i = 0; i < placed.size(); i++) {
                FileRecord r = placed.get(i);
                dao.markOrganizedInPlace(r.fileId(), FileNames.key(r.locationPath()), review.get(i), now);
            }
        });
        logger.info("{} arquivos já estavam no lugar e foram registrados como organizados", placed.size());
        return placed.size();
    }

    public void save(MigrationPlan plan) {
        ctx.jdbi().useExtension(MigrationDao.class, dao -> dao.savePlan(plan));
        logger.info("Plano {} salvo com {} ações ({})", plan.planId(), plan.actions().size(), plan.purpose());
    }

    public MigrationPlan load(String planId) {
        return ctx.jdbi().inTransaction(handle -> {
            MigrationDao dao = handle.attach(MigrationDao.class);
            MigrationDao.PlanRow row = dao.fetchPlan(planId)
                    .orElseThrow(() -> new IllegalArgumentException("Plano não encontrado: " + planId));
            return new MigrationPlan(row.planId(), row.createdMillis(), row.approved(),
                    PlanStatus.fromDb(row.status()), row.purpose(), dao.fetchActions(planId));
        });
    }

    /**
     * Reconfere que nenhum destino se repete e grava a aprovação.
     */
    public MigrationPlan approve(MigrationPlan plan) {
        if (plan.approved()) return plan;
        if (plan.status() != PlanStatus.PENDING) {
            throw new IllegalStateException("Plano " + plan.planId() + " não está pendente: " + plan.status());
        }
        Set<String> targets = new HashSet<>();
        for (MigrationAction a : plan.actions()) {
            if (!targets.add(FileNames.key(Paths.get(a.targetPath())))) {
                throw new ConflictException("Destino repetido no plano " + plan.planId() + ": " + a.targetPath());
            }
        }
        int updated = ctx.jdbi().withExtension(MigrationDao.class, dao -> dao.approvePlan(plan.planId()));
        if (updated != 1) {
            throw new IllegalStateException("Plano " + plan.planId() + " não pôde ser aprovado");
        }
        logger.info("Plano {} aprovado", plan.planId());
        return plan.withApproval();
    }

    // -----------------------------
    // Planejamento
    // -----------------------------

    public MigrationPlan plan(StructureConfig config, RegistrySnapshot snapshot, PlanOptions options) {
        List<FileRecord> records = new ArrayList<>(snapshot.records());
        records.sort(Comparator.comparingLong(FileRecord::fileId));

        // posições ocupadas agora
        Set<String> reserved = new HashSet<>();
        for (FileRecord r : records) {
            if (r.superseded() || r.state() == FileState.MISSING) continue;
            reserved.add(FileNames.key(r.locationPath()));
        }

        List<MigrationAction> actions = new ArrayList<>();

        for (FileRecord r : records) {
            if (!isEligible(r, options)) continue;

            Placement placement = place(r, config, snapshot, options);
            PathTemplate template = placement.template();
            PathTemplate.Rendered rendered = placement.rendered();
            Path desired = placement.desired();
            String current = FileNames.key(r.locationPath());
            if (FileNames.key(desired).equals(current)) continue;

            String target = claim(desired, current, reserved);
            if (target == null) continue;

            String reason = "tipo " + r.documentType() + " → " + template.raw();
            if (!rendered.unresolved().isEmpty()) {
                reason += " (padrão usado para " + String.join(", ", rendered.unresolved()) + ")";
            }
            actions.add(action(r, target, options.moveType(), reason, rendered.requiresReview()));
        }

        if (options.includeDuplicates() && config.duplicatePolicy() != DuplicatePolicy.IGNORE) {
            for (FileRecord r : records) {
                if (!r.duplicate() || r.superseded() || r.storedPath() != null) continue;
                if (r.state() != FileState.DUPLICATE) continue;

                String current = FileNames.key(r.locationPath());
                Path desired = duplicateTarget(r, config.duplicatePolicy(), options);
                String target = claim(desired, current, reserved);
                if (target == null) continue;

                String reason = "duplicata de #" + r.duplicateOf() + " (" + config.duplicatePolicy().name().toLowerCase(Locale.ROOT) + ")";
                actions.add(action(r, target, duplicateActionType(config.duplicatePolicy()), reason, false));
            }
        }

        List<MigrationAction> numbered = new ArrayList<>(actions.size());
        for (int i = 0; i < actions.size(); i++) numbered.add(actions.get(i).withSeq(i + 1));

        MigrationPlan plan = new MigrationPlan(UUID.randomUUID().toString(), ctx.nowMillis(), false,
                PlanStatus.PENDING, options.purpose(), numbered);
        logger.debug("Plano {}: {} ações", plan.planId(), numbered.size());
        return plan;
    }

    private record Placement(PathTemplate template, PathTemplate.Rendered rendered, Path desired) {}

    private static Placement place(FileRecord r, StructureConfig config, RegistrySnapshot snapshot, PlanOptions options) {
        PathTemplate template = config.templateFor(r.documentType());
        Map<String, String> values = new HashMap<>();
        Set<String> fallbackKeys = new HashSet<>();
        fillVariables(r, snapshot.metadataOf(r.fileId()), options, values, fallbackKeys);
        PathTemplate.Rendered rendered = template.render(values, fallbackKeys, config.templateDefaults());
        return new Placement(template, rendered, options.canonicalRoot().resolve(rendered.relativePath()).normalize());
    }

    private static boolean isEligible(FileRecord r, PlanOptions options) {
        return !r.superseded()
                && !r.duplicate()
                && options.states().contains(r.state())
                && StringUtils.isNotBlank(r.documentType());
    }

    /**
     * Reserva o primeiro destino livre ({@code doc.pdf}, {@code doc_1.pdf}, ...). Devolve null
     * quando o candidato é a própria posição atual: o arquivo já está no lugar.
     */
    private static String claim(Path desired, String current, Set<String> reserved) {
        String fileName = FileNames.name(desired);
        String stem = FileNames.stem(fileName);
        String suffix = FileNames.dottedSuffix(fileName);
        Path parent = desired.getParent();

        for (int n = 0; ; n++) {
            String name = n == 0 ? fileName : stem + "_" + n + suffix;
            String candidate = FileNames.key(parent == null ? Paths.get(name) : parent.resolve(name));
            if (candidate.equals(current)) return null;
            if (reserved.contains(candidate)) continue;
            reserved.add(candidate);
            reserved.remove(current);
            return candidate;
        }
    }

    private static void fillVariables(FileRecord r, Map<String, String> metadata, PlanOptions options,
                                      Map<String, String> values, Set<String> fallbackKeys) {
        values.putAll(metadata);

        String fileName = r.fileName() != null ? r.fileName() : FileNames.name(r.locationPath());
        values.put("filename", PathTemplate.sanitizeSegment(fileName));
        values.put("stem", FileNames.stem(fileName));
        values.put("ext", FileNames.extension(fileName));
        values.put("doc_type", r.documentType());
        String subtype = subtype(r.documentType());
        if (subtype != null) values.put("doc_subtype", subtype);

        LocalDate date = dateFrom(metadata);
        if (date != null) {
            values.put("YYYY", String.format(Locale.ROOT, "%04d", date.getYear()));
            values.put("MM", String.format(Locale.ROOT, "%02d", date.getMonthValue()));
            values.put("DD", String.format(Locale.ROOT, "%02d", date.getDayOfMonth()));
        } else if (!metadata.containsKey("YYYY")) {
            // sem data extraída: usa a descoberta e pede revisão
            LocalDate seen = Instant.ofEpochMilli(r.firstSeenMillis()).atZone(options.zone()).toLocalDate();
            values.put("YYYY", String.format(Locale.ROOT, "%04d", seen.getYear()));
            values.put("MM", String.format(Locale.ROOT, "%02d", seen.getMonthValue()));
            values.put("DD", String.format(Locale.ROOT, "%02d", seen.getDayOfMonth()));
            fallbackKeys.addAll(DATE_KEYS);
        }
    }

    private static LocalDate dateFrom(Map<String, String> metadata) {
        String raw = metadata.get("date");
        if (raw == null) return null;
        Matcher m = DATE.matcher(raw);
        if (!m.find()) return null;
        try {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        } catch (java.time.DateTimeException e) {
            logger.debug("Data inválida nos metadados: {}", raw);
            return null;
        }
    }

    /** {@code financial_invoice} → {@code Invoice}; sem sublinhado não há subtipo. */
    static String subtype(String documentType) {
        if (documentType == null) return null;
        int idx = documentType.indexOf('_');
        if (idx < 0 || idx == documentType.length() - 1) return null;
        return Arrays.stream(documentType.substring(idx + 1).split("_"))
                .filter(s -> !s.isEmpty())
                .map(s -> StringUtils.capitalize(s.toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining(" "));
    }

    private static Path duplicateTarget(FileRecord r, DuplicatePolicy policy, PlanOptions options) {
        String name = PathTemplate.sanitizeSegment(FileNames.name(r.locationPath()));
        return switch (policy) {
            case QUARANTINE -> options.quarantineDir().resolve("Duplicates").resolve(name);
            case ARCHIVE -> options.quarantineDir().resolve("Archive").resolve(name + ".zst");
            case DELETE -> options.trashDir().resolve(name);
            case IGNORE -> throw new IllegalArgumentException("ignore policy has no target");
        };
    }

    private static ActionType duplicateActionType(DuplicatePolicy policy) {
        return switch (policy) {
            case QUARANTINE -> ActionType.MOVE;
            case ARCHIVE -> ActionType.ARCHIVE;
            case DELETE -> ActionType.DELETE;
            case IGNORE -> throw new IllegalArgumentException("ignore policy has no action");
        };
    }

    private static MigrationAction action(FileRecord r, String target, ActionType type, String reason, boolean review) {
        ObjectNode rollback = MAPPER.createObjectNode();
        rollback.put("sourcePath", FileNames.key(r.locationPath()));
        rollback.put("previousCanonicalPath", r.canonicalPath());
        rollback.put("previousState", r.state().dbValue());
        rollback.put("previousStoredPath", r.storedPath());
        rollback.put("previousDocumentType", r.documentType());

        return new MigrationAction(0, r.fileId(), FileNames.key(r.locationPath()), target, type, reason, review,
                r.contentHash(), r.quickHash(), rollback.toString(), ActionOutcome.PENDING, null);
    }
}
