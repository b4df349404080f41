package io.consensusset.core.state;

import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of consensus ledger state, handed to validators, subscribers and
 * other collaborators. Nothing reachable from here can mutate the ledger.
 */
public interface LedgerView {

    /** Height of the current tip; -1 before genesis has been applied. */
    long height();

    Optional<SiacoinOutput> getSiacoinOutput(Hash id);

    Optional<SiafundOutput> getSiafundOutput(Hash id);

    Optional<FileContract> getFileContract(Hash id);

    /** Outputs waiting to mature at exactly {@code maturityHeight}. */
    Map<Hash, SiacoinOutput> getDelayedSiacoinOutputs(long maturityHeight);

    BigInteger siafundPool();

    /** Contracts ordered by id. */
    Map<Hash, FileContract> fileContracts();

    LedgerSnapshot snapshot();
}
