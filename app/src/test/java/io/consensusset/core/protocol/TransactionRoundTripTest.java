package io.consensusset.core.protocol;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionRoundTripTest {

    @Test
    void roundTrip() {
        Hash owner = Hash.ofTag(0x11);
        Transaction tx = Transaction.builder()
                .siacoinInput(new SiacoinInput(Hash.ofTag(1), owner))
                .siacoinOutput(SiacoinOutput.of(123, owner))
                .fileContract(new FileContract(10, Hash.ofTag(2), 5, 9, BigInteger.valueOf(1_000),
                        List.of(SiacoinOutput.of(961, owner)), List.of(SiacoinOutput.of(961, owner)), owner, 1))
                .storageProof(new StorageProof(Hash.ofTag(3)))
                .siafundInput(new SiafundInput(Hash.ofTag(4), owner, owner))
                .siafundOutput(SiafundOutput.of(7, owner))
                .minerFee(1)
                .build();

        byte[] bytes = tx.serialize();
        Transaction tx2 = TransactionCodec.fromBytes(bytes);

        assertEquals(tx.siacoinInputs(), tx2.siacoinInputs());
        assertEquals(tx.fileContracts(), tx2.fileContracts());
        assertEquals(tx.siafundOutputs(), tx2.siafundOutputs());
        assertEquals(tx.minerFees(), tx2.minerFees());
        // id is a hash of the canonical encoding
        assertEquals(tx.id(), tx2.id());
    }

    @Test
    void derivedIdsDifferByKindAndIndex() {
        Transaction tx = Transaction.builder().siacoinOutput(SiacoinOutput.of(1, Hash.ofTag(1))).build();
        assertNotEquals(tx.siacoinOutputId(0), tx.siacoinOutputId(1));
        assertNotEquals(tx.siacoinOutputId(0), tx.siafundOutputId(0));
        assertNotEquals(tx.siacoinOutputId(0), tx.fileContractId(0));
    }

    @Test
    void blockRoundTripKeepsId() {
        Transaction tx = Transaction.builder().siacoinOutput(SiacoinOutput.of(5, Hash.ofTag(9))).build();
        List<SiacoinOutput> payouts = List.of(SiacoinOutput.of(300, Hash.ofTag(8)));
        BlockHeader hdr = new BlockHeader(Hash.ofTag(7), Block.computeMerkleRoot(payouts, List.of(tx)), 4, 1_000, 0, 42);
        Block block = new Block(hdr, payouts, List.of(tx));

        Block decoded = BlockCodec.fromBytes(block.serialize());

        assertEquals(block.id(), decoded.id());
        assertEquals(block.minerPayouts(), decoded.minerPayouts());
        assertEquals(block.transactions(), decoded.transactions());
        assertEquals(block.computeMerkleRoot(), decoded.header().merkleRoot());
    }

    @Test
    void hashHexRoundTrip() {
        Hash h = Hashes.hash(new byte[] {1, 2, 3});
        assertEquals(h, Hash.fromHex(h.hex()));
        assertThrows(IllegalArgumentException.class, () -> Hash.fromHex("zz"));
    }
}
