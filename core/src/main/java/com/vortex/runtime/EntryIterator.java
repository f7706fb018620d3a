package com.vortex.runtime;

/**
 * Pull-based sequence of log entries, each tagged with its stream.
 *
 * <p>Usage:
 * <pre>{@code
 * try (EntryIterator it = querier.selectLogs(params)) {
 *     while (it.next()) {
 *         long stream = it.streamHash();
 *         Entry entry = it.entry();
 *     }
 *     if (it.error() != null) {
 *         throw it.error();
 *     }
 * }
 * }</pre>
 *
 * <p>Accessors refer to the row of the last successful {@link #next()}.
 */
public interface EntryIterator extends AutoCloseable {

    /**
     * Advances to the next entry.
     *
     * @return true if an entry is available; false at the end of the rows or
     *         after a failure, see {@link #error()}
     */
    boolean next();

    /**
     * Returns the current entry.
     *
     * @return the entry, or {@link Entry#empty()} if the row could not be decoded
     */
    Entry entry();

    /**
     * Returns the canonical label string of the current row, e.g.
     * {@code {env="prod", service_name="api"}}.
     *
     * @return the label string, or an empty string if the row could not be decoded
     */
    String labels();

    /**
     * Returns a 64-bit hash of {@link #labels()}. Equal label strings always
     * hash equal; different ones may collide.
     *
     * @return the stream hash
     */
    long streamHash();

    /**
     * Returns the failure that ended the iteration.
     *
     * @return the cursor's error, else the current row's decode error, else null
     */
    Exception error();

    @Override
    void close();
}
