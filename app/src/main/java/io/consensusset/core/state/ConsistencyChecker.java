package io.consensusset.core.state;

import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiafundOutput;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Structural checks run after a block has been fully committed:
 * - no maturity bucket at or below the current height (those must have been drained)
 * - no file contract whose window already closed (those must have been resolved)
 * - siafund outputs add up to the fixed siafund count
 */
public final class ConsistencyChecker {

    private final BigInteger siafundCount;

    public ConsistencyChecker(long siafundCount) {
        this.siafundCount = BigInteger.valueOf(siafundCount);
    }

    public void check(LedgerState state) throws ConsistencyFault {
        long height = state.height();

        Optional<Long> lowest = state.maturityQueue().lowestHeight();
        if (lowest.isPresent() && lowest.get() <= height) {
            throw new ConsistencyFault(ConsistencyFault.Kind.INVARIANT_VIOLATION,
                    "undrained maturity bucket at height " + lowest.get() + " (current height " + height + ")");
        }

        for (Map.Entry<Hash, FileContract> e : state.fileContracts().entrySet()) {
            if (e.getValue().windowEnd() <= height) {
                throw new ConsistencyFault(ConsistencyFault.Kind.INVARIANT_VIOLATION,
                        "file contract " + e.getKey() + " outlived its window end " + e.getValue().windowEnd());
            }
        }

        if (height >= 0 && siafundCount.signum() > 0) {
            BigInteger total = BigInteger.ZERO;
            for (SiafundOutput sfo : state.siafundOutputs().values()) {
                total = total.add(sfo.value());
            }
            if (total.compareTo(siafundCount) != 0) {
                throw new ConsistencyFault(ConsistencyFault.Kind.INVARIANT_VIOLATION,
                        "siafund total " + total + " differs from siafund count " + siafundCount);
            }
        }
    }
}
