package io.consensusset.core.consensus;

import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinInput;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundInput;
import io.consensusset.core.protocol.SiafundOutput;
import io.consensusset.core.protocol.StorageProof;
import io.consensusset.core.protocol.Transaction;
import io.consensusset.core.state.LedgerView;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.consensusset.core.consensus.BlockRejectedException.Reason.DOS_BLOCK;
import static io.consensusset.core.consensus.BlockRejectedException.Reason.INVALID_TRANSACTION;

/**
 * Ledger-level transaction rules. Signatures and unlock-condition scripts are not
 * modelled: an input is authorized when its unlock hash equals the spent output's.
 */
public final class StandardTransactionValidator implements TransactionValidator {

    private final ConsensusParams params;

    public StandardTransactionValidator(ConsensusParams params) {
        this.params = params;
    }

    @Override
    public void validate(Transaction tx, LedgerView ledger, long height) throws BlockRejectedException {
        if (tx == null) {
            throw new BlockRejectedException(INVALID_TRANSACTION, "Transaction required");
        }

        BigInteger coinInputs = validateSiacoinInputs(tx, ledger);

        BigInteger coinOutputs = BigInteger.ZERO;
        for (SiacoinOutput out : tx.siacoinOutputs()) {
            if (out.value().signum() == 0) {
                throw invalid(tx, "zero-value siacoin output");
            }
            coinOutputs = coinOutputs.add(out.value());
        }
        for (FileContract fc : tx.fileContracts()) {
            validateFileContract(tx, fc, height);
            coinOutputs = coinOutputs.add(fc.payout());
        }
        for (BigInteger fee : tx.minerFees()) {
            if (fee.signum() == 0) {
                throw invalid(tx, "zero-value miner fee");
            }
            coinOutputs = coinOutputs.add(fee);
        }

        validateStorageProofs(tx, ledger, height);
        validateSiafunds(tx, ledger);

        int cmp = coinInputs.compareTo(coinOutputs);
        if (cmp > 0) {
            // Inputs were funded but the surplus goes nowhere. Cheap to detect, costly to build.
            throw new BlockRejectedException(DOS_BLOCK,
                    "Transaction " + tx.id().hex() + " spends " + coinInputs + " but only creates " + coinOutputs);
        }
        if (cmp < 0) {
            throw invalid(tx, "siacoin outputs " + coinOutputs + " exceed inputs " + coinInputs);
        }
    }

    private static BigInteger validateSiacoinInputs(Transaction tx, LedgerView ledger) throws BlockRejectedException {
        Set<Hash> spent = new HashSet<>();
        BigInteger total = BigInteger.ZERO;
        for (SiacoinInput in : tx.siacoinInputs()) {
            if (!spent.add(in.parentId())) {
                throw invalid(tx, "siacoin output " + in.parentId().hex() + " spent twice");
            }
            Optional<SiacoinOutput> parent = ledger.getSiacoinOutput(in.parentId());
            if (parent.isEmpty()) {
                throw invalid(tx, "unknown siacoin output " + in.parentId().hex());
            }
            if (!parent.get().unlockHash().equals(in.unlockHash())) {
                throw invalid(tx, "wrong unlock hash for siacoin output " + in.parentId().hex());
            }
            total = total.add(parent.get().value());
        }
        return total;
    }

    private void validateFileContract(Transaction tx, FileContract fc, long height) throws BlockRejectedException {
        if (fc.windowStart() <= height) {
            throw invalid(tx, "contract window starts at " + fc.windowStart() + ", not after height " + height);
        }
        if (fc.windowEnd() <= fc.windowStart()) {
            throw invalid(tx, "contract window ends before it starts");
        }
        if (fc.payout().signum() == 0) {
            throw invalid(tx, "contract has no payout");
        }
        BigInteger afterTax = fc.payout().subtract(params.siafundTax(fc.payout()));
        if (sum(fc.validProofOutputs()).compareTo(afterTax) != 0) {
            throw invalid(tx, "valid proof outputs must total payout minus tax (" + afterTax + ")");
        }
        if (sum(fc.missedProofOutputs()).compareTo(afterTax) != 0) {
            throw invalid(tx, "missed proof outputs must total payout minus tax (" + afterTax + ")");
        }
    }

    private static void validateStorageProofs(Transaction tx, LedgerView ledger, long height)
            throws BlockRejectedException {
        Set<Hash> proven = new HashSet<>();
        for (StorageProof sp : tx.storageProofs()) {
            if (!proven.add(sp.parentId())) {
                throw invalid(tx, "two storage proofs for contract " + sp.parentId().hex());
            }
            Optional<FileContract> fc = ledger.getFileContract(sp.parentId());
            if (fc.isEmpty()) {
                throw invalid(tx, "storage proof for unknown contract " + sp.parentId().hex());
            }
            if (height < fc.get().windowStart() || height >= fc.get().windowEnd()) {
                throw invalid(tx, "storage proof outside contract window at height " + height);
            }
        }
    }

    private static void validateSiafunds(Transaction tx, LedgerView ledger) throws BlockRejectedException {
        Set<Hash> spent = new HashSet<>();
        BigInteger in = BigInteger.ZERO;
        for (SiafundInput sfi : tx.siafundInputs()) {
            if (!spent.add(sfi.parentId())) {
                throw invalid(tx, "siafund output " + sfi.parentId().hex() + " spent twice");
            }
            Optional<SiafundOutput> parent = ledger.getSiafundOutput(sfi.parentId());
            if (parent.isEmpty()) {
                throw invalid(tx, "unknown siafund output " + sfi.parentId().hex());
            }
            if (!parent.get().unlockHash().equals(sfi.unlockHash())) {
                throw invalid(tx, "wrong unlock hash for siafund output " + sfi.parentId().hex());
            }
            in = in.add(parent.get().value());
        }
        BigInteger out = BigInteger.ZERO;
        for (SiafundOutput sfo : tx.siafundOutputs()) {
            if (sfo.value().signum() == 0) {
                throw invalid(tx, "zero-value siafund output");
            }
            out = out.add(sfo.value());
        }
        if (in.compareTo(out) != 0) {
            throw invalid(tx, "siafund inputs " + in + " do not equal outputs " + out);
        }
    }

    private static BigInteger sum(List<SiacoinOutput> outputs) {
        BigInteger total = BigInteger.ZERO;
        for (SiacoinOutput o : outputs) total = total.add(o.value());
        return total;
    }

    private static BlockRejectedException invalid(Transaction tx, String message) {
        return new BlockRejectedException(INVALID_TRANSACTION, "Transaction " + tx.id().hex() + ": " + message);
    }
}
