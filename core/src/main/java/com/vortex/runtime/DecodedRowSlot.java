package com.vortex.runtime;

import com.vortex.exception.RowDecodeException;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-row cache slot: pending until first read, then holding either the
 * decoded row or the decode failure, forever.
 *
 * <p>The decoder runs at most once even when several threads read the slot
 * for the first time together; they all observe the same outcome.
 */
final class DecodedRowSlot {

    private enum Status { PENDING, DECODED, FAILED }

    private Supplier<DecodedRow> decoder;
    private Status status = Status.PENDING;
    private DecodedRow row;
    private RowDecodeException failure;

    /**
     * @param decoder reads and decodes the row; signals failure with {@link RowDecodeException}
     */
    DecodedRowSlot(Supplier<DecodedRow> decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    }

    /**
     * Returns the decoded row, decoding on first call.
     *
     * @return the row, or null if decoding failed
     */
    synchronized DecodedRow row() {
        ensureDecoded();
        return row;
    }

    /**
     * Returns the decode failure, decoding on first call.
     *
     * @return the failure, or null if the row decoded
     */
    synchronized RowDecodeException failure() {
        ensureDecoded();
        return failure;
    }

    /**
     * Returns the decode failure without decoding a pending row.
     *
     * @return the failure, or null if the row decoded or was never read
     */
    synchronized RowDecodeException resolvedFailure() {
        return failure;
    }

    private void ensureDecoded() {
        if (status != Status.PENDING) {
            return;
        }
        try {
            row = decoder.get();
            status = Status.DECODED;
        } catch (RowDecodeException e) {
            failure = e;
            status = Status.FAILED;
        } catch (RuntimeException e) {
            failure = new RowDecodeException("failed to decode row", e);
            status = Status.FAILED;
        } finally {
            decoder = null;
        }
    }
}
