package com.ordo.app.dedup;

import java.util.List;
import java.util.Map;

/**
 * Conjunto confirmado de arquivos com o mesmo hash completo. {@code scores} guarda a
 * pontuação de cada membro na escolha do canônico.
 */
public record DuplicateGroup(
        long groupId,
        long canonicalFileId,
        List<Long> memberFileIds,
        DetectionMethod detectionMethod,
        String contentHash,
        long sizeBytes,
        Map<Long, Double> scores
) {

    public DuplicateGroup {
        memberFileIds = List.copyOf(memberFileIds);
        scores = Map.copyOf(scores);
        if (memberFileIds.size() < 2) {
            throw new IllegalArgumentException("duplicate group needs at least two members");
        }
        if (!memberFileIds.contains(canonicalFileId)) {
            throw new IllegalArgumentException("canonical file " + canonicalFileId + " is not a member");
        }
    }

    public long wastedBytes() {
        return sizeBytes * (memberFileIds.size() - 1L);
    }

    public List<Long> duplicateFileIds() {
        return memberFileIds.stream().filter(id -> id != canonicalFileId).toList();
    }

    DuplicateGroup withGroupId(long id) {
        return new DuplicateGroup(id, canonicalFileId, memberFileIds, detectionMethod, contentHash, sizeBytes, scores);
    }
}
