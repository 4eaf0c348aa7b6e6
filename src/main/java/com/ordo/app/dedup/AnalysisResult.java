package com.ordo.app.dedup;

import java.util.List;

/**
 * @param prefilterCandidates arquivos que sobreviveram ao agrupamento por (tamanho, extensão)
 * @param quickHashCandidates arquivos que sobreviveram ao hash rápido
 */
public record AnalysisResult(
        List<DuplicateGroup> groups,
        List<NearDuplicate> suggestions,
        int duplicateFiles,
        long wastedBytes,
        int prefilterCandidates,
        int quickHashCandidates,
        int errors
) {
    public AnalysisResult {
        groups = List.copyOf(groups);
        suggestions = List.copyOf(suggestions);
    }
}
