package com.vortex.runtime;

import com.vortex.exception.RowDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;

/**
 * Entry iterator over a {@link RowCursor}.
 *
 * <p>Rows are decoded lazily: the first accessor call on a row scans it,
 * normalizes its label keys and renders the label string. The result, or the
 * failure, is cached for the rest of the row's lifetime. Advancing past a row
 * whose decode failed ends the iteration; {@link #error()} then reports the
 * failure.
 *
 * <p>Intended for a single consumer. The per-row decode itself is safe to
 * trigger from several threads.
 *
 * <p>The iterator owns the cursor and closes it.
 */
public class RowEntryIterator implements EntryIterator {

    private static final Logger logger = LoggerFactory.getLogger(RowEntryIterator.class);

    private enum State { READY, HAS_ROW, EXHAUSTED, FAILED, CLOSED }

    private final RowCursor cursor;

    private State state = State.READY;
    private DecodedRowSlot current = null;
    private RowDecodeException closedFailure = null;
    private long rowIndex = -1;

    /**
     * Creates an iterator.
     *
     * @param cursor the cursor to read; owned by the iterator from now on
     */
    public RowEntryIterator(RowCursor cursor) {
        this.cursor = Objects.requireNonNull(cursor, "cursor must not be null");
    }

    @Override
    public boolean next() {
        switch (state) {
            case EXHAUSTED:
            case FAILED:
            case CLOSED:
                return false;
            case HAS_ROW:
                if (current.failure() != null) {
                    state = State.FAILED;
                    return false;
                }
                break;
            case READY:
                break;
        }

        if (!cursor.next()) {
            current = null;
            if (cursor.error() != null) {
                state = State.FAILED;
            } else {
                state = State.EXHAUSTED;
                logger.debug("Row cursor exhausted after {} rows", rowIndex + 1);
            }
            return false;
        }

        rowIndex++;
        long index = rowIndex;
        current = new DecodedRowSlot(() -> decode(index));
        state = State.HAS_ROW;
        return true;
    }

    @Override
    public Entry entry() {
        DecodedRow row = currentSlot().row();
        return row == null ? Entry.empty() : new Entry(row.timestamp(), row.body());
    }

    @Override
    public String labels() {
        DecodedRow row = currentSlot().row();
        return row == null ? "" : row.labelString();
    }

    /**
     * Returns the attributes of the current row as stored, before label
     * normalization.
     *
     * @return the attribute map, empty if the row could not be decoded
     */
    public Map<String, String> rawLabels() {
        DecodedRow row = currentSlot().row();
        return row == null ? Map.of() : row.rawLabels();
    }

    @Override
    public long streamHash() {
        return StreamHash.of(labels());
    }

    @Override
    public Exception error() {
        if (cursor.error() != null) {
            return cursor.error();
        }
        if (state == State.CLOSED) {
            return closedFailure;
        }
        return current == null ? null : current.failure();
    }

    @Override
    public void close() {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        if (current != null) {
            // a row that was never read is not scanned on close
            closedFailure = current.resolvedFailure();
            current = null;
        }
        cursor.close();
    }

    private DecodedRowSlot currentSlot() {
        if (current == null) {
            throw new IllegalStateException("No current row (state: " + state + ")");
        }
        return current;
    }

    private DecodedRow decode(long index) {
        try {
            return DecodedRow.decode(cursor.scan());
        } catch (SQLException | RuntimeException e) {
            logger.warn("Failed to decode row {}: {}", index, e.getMessage());
            throw new RowDecodeException("failed to scan row " + index, e);
        }
    }
}
