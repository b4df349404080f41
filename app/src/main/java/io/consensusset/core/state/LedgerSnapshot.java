package io.consensusset.core.state;

import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;

import java.math.BigInteger;
import java.util.Map;
import java.util.SortedMap;

/** Point-in-time copy of the whole ledger. Two snapshots are equal iff the ledgers are. */
public record LedgerSnapshot(long height,
                             Map<Hash, SiacoinOutput> siacoinOutputs,
                             Map<Hash, SiafundOutput> siafundOutputs,
                             Map<Hash, FileContract> fileContracts,
                             SortedMap<Long, Map<Hash, SiacoinOutput>> delayedSiacoinOutputs,
                             BigInteger siafundPool) {
}
