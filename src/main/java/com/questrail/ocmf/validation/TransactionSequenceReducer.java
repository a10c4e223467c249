package com.questrail.ocmf.validation;

import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.model.MeterReadingReason;
import com.questrail.ocmf.model.Reading;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TransactionSequenceReducer
 * -----------------------------------------------------------------------------
 * Pure state machine over the {@code TX} codes of a payload's readings.
 *
 * <h2>States</h2>
 * <pre>
 *   MID   no transaction begin observed yet (initial)
 *   BEGIN a begin reading has been observed
 *   END   an end-type reading has been observed
 * </pre>
 *
 * <h2>Transitions</h2>
 * <ul>
 *   <li>{@code B}: to {@code BEGIN}; illegal in {@code END}</li>
 *   <li>{@code E, L, R, A, P}: to {@code END}; illegal in {@code MID}</li>
 *   <li>{@code C, X, S, T}: state unchanged; illegal in {@code END}</li>
 *   <li>no {@code TX}: state unchanged</li>
 * </ul>
 *
 * Whatever state the last reading leaves is accepted as terminal.
 */
public final class TransactionSequenceReducer
{
    public enum State
    {
        MID,
        BEGIN,
        END
    }

    /**
     * Result of applying one reading.
     *
     * @param newState  state after the reading, unchanged on a violation
     * @param violation the illegal transition, or {@code null}
     */
    public record Result(State newState, OcmfError violation)
    {
        public Optional<OcmfError> violationIfAny() {
            return Optional.ofNullable(violation);
        }
    }

    /**
     * Applies the reading at {@code index} to {@code state}.
     */
    public Result apply(State state, int index, Reading reading) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(reading, "reading");

        MeterReadingReason tx = reading.reason();
        if (tx == null) {
            return new Result(state, null);
        }

        if (tx.isBegin()) {
            if (state == State.END) {
                return violation(state, index, "TX=B (Begin) cannot appear after transaction end");
            }
            return new Result(State.BEGIN, null);
        }

        if (tx.isEndReading()) {
            if (state == State.MID) {
                return violation(state, index, "TX=" + tx.code() + " (End) requires TX=B (Begin) first");
            }
            return new Result(State.END, null);
        }

        if (state == State.END) {
            return violation(state, index, "TX=" + tx.code() + " cannot appear after transaction end");
        }
        return new Result(state, null);
    }

    /**
     * Folds every reading from the initial state and stops at the first violation.
     */
    public Optional<OcmfError> check(List<Reading> readings) {
        State state = State.MID;
        for (int i = 0; i < readings.size(); i++) {
            Result result = apply(state, i, readings.get(i));
            if (result.violation() != null) {
                return Optional.of(result.violation());
            }
            state = result.newState();
        }
        return Optional.empty();
    }

    private static Result violation(State state, int index, String message) {
        return new Result(state, OcmfError.validation("RD[" + index + "].TX", "Reading " + index + ": " + message));
    }
}
