package com.ordo.app.dedup;

/** Sugestão para revisão manual; nunca altera {@code is_duplicate}. */
public record NearDuplicate(long fileIdA, long fileIdB, double similarity, String normalizedName) {}
