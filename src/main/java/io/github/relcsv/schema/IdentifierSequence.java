package io.github.relcsv.schema;

/**
 * Issues row identifiers for one inference run.
 *
 * <p>One sequence is shared by every table of a registry, so an id identifies a row
 * without qualifying it by table name. Ids start at 1 and are never reused.</p>
 */
public final class IdentifierSequence {

    private long next = 1;

    public long nextId() {
        return next++;
    }

    /**
     * Returns the number of ids issued so far.
     */
    public long issued() {
        return next - 1;
    }
}
