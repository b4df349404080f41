package io.consensusset.core.consensus;

import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.BlockHeader;
import io.consensusset.core.protocol.SiacoinOutput;

import java.math.BigInteger;

import static io.consensusset.core.consensus.BlockRejectedException.Reason.INVALID_HEADER;
import static io.consensusset.core.consensus.BlockRejectedException.Reason.INVALID_PAYOUTS;

/** Block-level rules that need only the parent node, not ledger state. */
public final class ConsensusRules {
    private ConsensusRules() {}

    public static void validateHeader(Block block, BlockNode parent, ConsensusParams params, long nowMillis)
            throws BlockRejectedException {
        BlockHeader hdr = block.header();

        long expectedHeight = parent.height() + 1;
        if (hdr.height() != expectedHeight) {
            throw new BlockRejectedException(INVALID_HEADER,
                    "Bad block height: expected " + expectedHeight + ", got " + hdr.height());
        }

        if (!block.computeMerkleRoot().equals(hdr.merkleRoot())) {
            throw new BlockRejectedException(INVALID_HEADER, "Merkle mismatch");
        }

        if (!ProofOfWork.meetsTarget(hdr)) {
            throw new BlockRejectedException(INVALID_HEADER, "Proof-of-Work target not met");
        }

        if (hdr.timestamp() < parent.block().header().timestamp()) {
            throw new BlockRejectedException(INVALID_HEADER, "Timestamp before parent");
        }
        if (hdr.timestamp() > nowMillis + params.futureThresholdMillis()) {
            throw new BlockRejectedException(INVALID_HEADER, "Timestamp too far in future");
        }
    }

    /**
     * Miner payouts must be non-zero and add up to exactly the block subsidy plus
     * the fees of the block's transactions.
     */
    public static void validateMinerPayouts(Block block, long height, BigInteger fees, ConsensusParams params)
            throws BlockRejectedException {
        BigInteger total = BigInteger.ZERO;
        for (SiacoinOutput payout : block.minerPayouts()) {
            if (payout.value().signum() == 0) {
                throw new BlockRejectedException(INVALID_PAYOUTS, "Zero-value miner payout");
            }
            total = total.add(payout.value());
        }
        BigInteger expected = params.blockSubsidy(height).add(fees);
        if (total.compareTo(expected) != 0) {
            throw new BlockRejectedException(INVALID_PAYOUTS,
                    "Miner payouts total " + total + ", expected " + expected);
        }
    }
}
