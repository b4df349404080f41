package io.consensusset.core.consensus;

import io.consensusset.core.diff.DelayedSiacoinOutputDiff;
import io.consensusset.core.diff.DiffDirection;
import io.consensusset.core.diff.FileContractDiff;
import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.diff.SiacoinOutputDiff;
import io.consensusset.core.diff.SiafundOutputDiff;
import io.consensusset.core.diff.SiafundPoolDiff;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.Hashes;
import io.consensusset.core.protocol.SiacoinInput;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundInput;
import io.consensusset.core.protocol.SiafundOutput;
import io.consensusset.core.protocol.Specifier;
import io.consensusset.core.protocol.StorageProof;
import io.consensusset.core.protocol.Transaction;
import io.consensusset.core.state.ConsistencyFault;
import io.consensusset.core.state.DiffCommitEngine;
import io.consensusset.core.state.LedgerState;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.consensusset.core.diff.DiffDirection.APPLY;
import static io.consensusset.core.diff.DiffDirection.REVERT;

/**
 * Turns a block into its diff list, committing each diff as it is produced so that
 * later transactions are validated against the effects of earlier ones.
 *
 * Order for a block at height H (ledger height is H-1 throughout):
 * - transactions, in block order
 * - the maturity bucket for H is drained into the coin registry
 * - contracts whose window ends at H are resolved as missed proofs, by ascending id
 * - miner payouts are queued to mature at H + maturityDelay
 *
 * If any step rejects the block or fails unexpectedly, everything committed so far is
 * reverted before the exception propagates, so the ledger is left exactly as it was.
 */
public final class DiffGenerator {

    private final DiffCommitEngine engine;
    private final TransactionValidator validator;
    private final ConsensusParams params;

    public DiffGenerator(DiffCommitEngine engine, TransactionValidator validator, ConsensusParams params) {
        this.engine = engine;
        this.validator = validator;
        this.params = params;
    }

    /** Validates and applies a non-genesis block at {@code height}; returns its diffs. */
    public List<LedgerDiff> generateAndApply(Block block, long height)
            throws BlockRejectedException, ConsistencyFault {
        return run(block, height, true);
    }

    /** Applies the genesis block without transaction or payout validation. */
    public List<LedgerDiff> applyGenesis(Block genesis) throws ConsistencyFault {
        try {
            return run(genesis, 0L, false);
        } catch (BlockRejectedException e) {
            throw new IllegalStateException("genesis rejected without validation", e);
        }
    }

    private List<LedgerDiff> run(Block block, long height, boolean validate)
            throws BlockRejectedException, ConsistencyFault {
        LedgerState state = engine.state();
        if (state.height() != height - 1) {
            throw new IllegalStateException("block at height " + height + " applied on ledger at " + state.height());
        }
        Recorder rec = new Recorder();
        try {
            BigInteger fees = BigInteger.ZERO;
            for (Transaction tx : block.transactions()) {
                if (validate) {
                    validator.validate(tx, state.readOnlyView(), height);
                }
                applyTransaction(rec, tx, height);
                fees = fees.add(tx.totalMinerFees());
            }
            if (validate) {
                ConsensusRules.validateMinerPayouts(block, height, fees, params);
            }
            drainMaturedOutputs(rec, height);
            resolveExpiredContracts(rec, height);
            queueMinerPayouts(rec, block, height);
        } catch (BlockRejectedException e) {
            engine.commitAll(rec.diffs, REVERT);
            throw e.forBlock(block.id());
        } catch (RuntimeException e) {
            engine.commitAll(rec.diffs, REVERT);
            throw e;
        }
        return rec.diffs;
    }

    private void applyTransaction(Recorder rec, Transaction tx, long height) throws ConsistencyFault {
        LedgerState state = engine.state();
        long maturity = height + params.maturityDelay();

        for (SiacoinInput in : tx.siacoinInputs()) {
            SiacoinOutput spent = state.getSiacoinOutput(in.parentId())
                    .orElseThrow(() -> new IllegalStateException("validated input vanished: " + in.parentId()));
            rec.commit(new SiacoinOutputDiff(REVERT, in.parentId(), spent));
        }
        for (int i = 0; i < tx.siacoinOutputs().size(); i++) {
            rec.commit(new SiacoinOutputDiff(APPLY, tx.siacoinOutputId(i), tx.siacoinOutputs().get(i)));
        }
        for (int i = 0; i < tx.fileContracts().size(); i++) {
            FileContract fc = tx.fileContracts().get(i);
            rec.commit(new FileContractDiff(APPLY, tx.fileContractId(i), fc));
            BigInteger tax = params.siafundTax(fc.payout());
            if (tax.signum() > 0) {
                BigInteger pool = state.siafundPool();
                rec.commit(new SiafundPoolDiff(APPLY, pool, pool.add(tax)));
            }
        }
        for (StorageProof sp : tx.storageProofs()) {
            FileContract fc = state.getFileContract(sp.parentId())
                    .orElseThrow(() -> new IllegalStateException("validated contract vanished: " + sp.parentId()));
            rec.commit(new FileContractDiff(REVERT, sp.parentId(), fc));
            List<SiacoinOutput> outs = fc.validProofOutputs();
            for (int i = 0; i < outs.size(); i++) {
                Hash id = Hashes.derive(Specifier.STORAGE_PROOF_VALID, sp.parentId(), i);
                rec.commit(new DelayedSiacoinOutputDiff(APPLY, id, outs.get(i), maturity));
            }
        }
        for (SiafundInput in : tx.siafundInputs()) {
            SiafundOutput spent = state.getSiafundOutput(in.parentId())
                    .orElseThrow(() -> new IllegalStateException("validated siafund input vanished: " + in.parentId()));
            BigInteger claim = params.siafundClaim(state.siafundPool(), spent.claimStart(), spent.value());
            Hash claimId = Hashes.derive(Specifier.SIAFUND_CLAIM, in.parentId(), 0);
            rec.commit(new DelayedSiacoinOutputDiff(APPLY, claimId,
                    new SiacoinOutput(claim, in.claimUnlockHash()), maturity));
            rec.commit(new SiafundOutputDiff(REVERT, in.parentId(), spent));
        }
        for (int i = 0; i < tx.siafundOutputs().size(); i++) {
            SiafundOutput out = tx.siafundOutputs().get(i).withClaimStart(state.siafundPool());
            rec.commit(new SiafundOutputDiff(APPLY, tx.siafundOutputId(i), out));
        }
    }

    private void drainMaturedOutputs(Recorder rec, long height) throws ConsistencyFault {
        Map<Hash, SiacoinOutput> matured = engine.state().getDelayedSiacoinOutputs(height);
        for (Map.Entry<Hash, SiacoinOutput> e : matured.entrySet()) {
            rec.commit(new DelayedSiacoinOutputDiff(REVERT, e.getKey(), e.getValue(), height));
            rec.commit(new SiacoinOutputDiff(APPLY, e.getKey(), e.getValue()));
        }
    }

    private void resolveExpiredContracts(Recorder rec, long height) throws ConsistencyFault {
        long maturity = height + params.maturityDelay();
        // fileContracts() is an id-ordered snapshot, safe to iterate while committing
        for (Map.Entry<Hash, FileContract> e : engine.state().fileContracts().entrySet()) {
            FileContract fc = e.getValue();
            if (fc.windowEnd() != height) continue;
            rec.commit(new FileContractDiff(REVERT, e.getKey(), fc));
            List<SiacoinOutput> outs = fc.missedProofOutputs();
            for (int i = 0; i < outs.size(); i++) {
                Hash id = Hashes.derive(Specifier.STORAGE_PROOF_MISSED, e.getKey(), i);
                rec.commit(new DelayedSiacoinOutputDiff(APPLY, id, outs.get(i), maturity));
            }
        }
    }

    private void queueMinerPayouts(Recorder rec, Block block, long height) throws ConsistencyFault {
        long maturity = height + params.maturityDelay();
        for (int i = 0; i < block.minerPayouts().size(); i++) {
            rec.commit(new DelayedSiacoinOutputDiff(APPLY, block.minerPayoutId(i), block.minerPayouts().get(i), maturity));
        }
    }

    private final class Recorder {
        final List<LedgerDiff> diffs = new ArrayList<>();

        void commit(LedgerDiff diff) throws ConsistencyFault {
            engine.commit(diff, DiffDirection.APPLY);
            diffs.add(diff);
        }
    }
}
