package com.cred.freestyle.warranty.domain.model;

/**
 * Uploaded/assigned totals read from the ledger in one query.
 * Available is derived and never negative.
 *
 * @author Warranty Platform Team
 */
public class LedgerCounts {

    private final long uploaded;
    private final long assigned;

    public LedgerCounts(Long uploaded, Long assigned) {
        this.uploaded = uploaded == null ? 0L : uploaded;
        this.assigned = assigned == null ? 0L : assigned;
    }

    public static LedgerCounts empty() {
        return new LedgerCounts(0L, 0L);
    }

    public long getUploaded() {
        return uploaded;
    }

    public long getAssigned() {
        return assigned;
    }

    public long getAvailable() {
        return Math.max(0L, uploaded - assigned);
    }
}
