package dev.univer.points.service;

import lombok.Getter;
import lombok.ToString;

/** Counters of one reconciliation pass. */
@Getter
@ToString
public class ReconcileStats {
    private int updated;
    private int added;
    private int deleted;
    private int skipped;
    private int errors;
    // ledger writes lost to a concurrent mutation, retried next pass
    private int conflicts;
    private int warnings;

    void updated() { updated++; }
    void added() { added++; }
    void deleted() { deleted++; }
    void skipped() { skipped++; }
    void error() { errors++; }
    void conflict() { conflicts++; }
    void warning() { warnings++; }

    public boolean hasWrites() {
        return updated + added + deleted > 0;
    }
}
