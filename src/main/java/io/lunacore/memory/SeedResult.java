package io.lunacore.memory;

/**
 * Outcome of a seed load.
 *
 * @param loaded number of pinned rows inserted or updated
 * @param pruned number of non-pinned rows evicted afterwards
 */
public record SeedResult(int loaded, int pruned) {}
