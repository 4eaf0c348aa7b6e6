package com.ordo.app.inventory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Contadores do scan, atualizados sem lock pelos workers e pelo escritor.
 */
public final class ScanMetrics {
    public final LongAdder filesSeen = new LongAdder();
    public final LongAdder filesHashed = new LongAdder();
    public final LongAdder newRecords = new LongAdder();
    public final LongAdder unchanged = new LongAdder();
    public final LongAdder superseded = new LongAdder();
    public final LongAdder errors = new LongAdder();
    public final LongAdder dirsSkipped = new LongAdder();
    public final LongAdder dbBatches = new LongAdder();
    public final AtomicBoolean running = new AtomicBoolean(false);

    public volatile Instant start = Instant.EPOCH;

    @Override
    public String toString() {
        return "seen=" + filesSeen.sum()
                + " new=" + newRecords.sum()
                + " unchanged=" + unchanged.sum()
                + " superseded=" + superseded.sum()
                + " errors=" + errors.sum();
    }
}
