package com.ordo.app.classify;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.AppContext;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.RegistryDao;

/**
 * Correção manual de tipo. Não move o arquivo: a próxima reorganização cuida disso.
 */
public final class CorrectionService {

    private static final Logger logger = LoggerFactory.getLogger(CorrectionService.class);

    private final AppContext ctx;

    public CorrectionService(AppContext ctx) {
        this.ctx = ctx;
    }

    public FileRecord correct(long fileId, String newType, String reason) {
        if (StringUtils.isBlank(newType)) {
            throw new IllegalArgumentException("newType must not be blank");
        }
        String type = newType.strip();
        long now = ctx.nowMillis();

        FileRecord updated = ctx.jdbi().inTransaction(handle -> {
            RegistryDao dao = handle.attach(RegistryDao.class);
            FileRecord current = dao.findById(fileId)
                    .orElseThrow(() -> new IllegalArgumentException("Arquivo não registrado: " + fileId));
            dao.correct(fileId, current.documentType(), type, StringUtils.trimToNull(reason), now);
            return dao.findById(fileId).orElseThrow();
        });

        logger.info("Correção em {}: tipo agora '{}'", fileId, type);
        return updated;
    }

    public List<FileRecord> filesRequiringReview(int limit) {
        return ctx.jdbi().withExtension(RegistryDao.class, dao -> dao.fetchRequiringReview(limit));
    }
}
