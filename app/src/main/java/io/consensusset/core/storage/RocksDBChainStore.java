package io.consensusset.core.storage;

import io.consensusset.core.diff.DiffCodec;
import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.BlockCodec;
import io.consensusset.core.protocol.Hash;
import org.rocksdb.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistent ChainStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks" : key = blockId(32),   val = block.serialize()
 *  - "diffs"  : key = blockId(32),   val = DiffCodec.encodeList(diffs)
 *  - "path"   : key = height(8, big-endian), val = blockId(32)
 *  - "meta"   : key = "tip",         val = tip height(8, big-endian)
 *
 * Every commitPath is a single synced WriteBatch, which gives the per-block
 * all-or-nothing durability the consensus set relies on.
 */
public final class RocksDBChainStore implements ChainStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] TIP_KEY = "tip".getBytes(StandardCharsets.US_ASCII);

    private final RocksDB db;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfDiffs;
    private final ColumnFamilyHandle cfPath;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;

    private final DBOptions dbOptions;

    private RocksDBChainStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        this.cfBlocks = handles.get(1);
        this.cfDiffs = handles.get(2);
        this.cfPath = handles.get(3);
        this.cfMeta = handles.get(4);
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBChainStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = List.of(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.US_ASCII)),
                    new ColumnFamilyDescriptor("diffs".getBytes(StandardCharsets.US_ASCII)),
                    new ColumnFamilyDescriptor("path".getBytes(StandardCharsets.US_ASCII)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.US_ASCII))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBChainStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- ChainStore API ----------------

    @Override
    public synchronized void putBlock(Block block) {
        if (block == null) return;
        try {
            db.put(cfBlocks, block.id().bytes(), block.serialize());
        } catch (RocksDBException e) {
            throw new IllegalStateException("putBlock failed", e);
        }
    }

    @Override
    public synchronized Optional<Block> getBlock(Hash blockId) {
        if (blockId == null) return Optional.empty();
        try {
            byte[] body = db.get(cfBlocks, blockId.bytes());
            return body == null ? Optional.empty() : Optional.of(BlockCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getBlock failed", e);
        }
    }

    @Override
    public synchronized Optional<List<LedgerDiff>> getDiffs(Hash blockId) {
        if (blockId == null) return Optional.empty();
        try {
            byte[] data = db.get(cfDiffs, blockId.bytes());
            return data == null ? Optional.empty() : Optional.of(DiffCodec.decodeList(data));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getDiffs failed", e);
        }
    }

    @Override
    public synchronized void commitPath(long forkHeight, List<PathEntry> applied) {
        try {
            long tip = readTip();
            if (forkHeight < -1 || forkHeight > tip) {
                throw new IllegalArgumentException("fork height " + forkHeight + " outside stored path (tip " + tip + ")");
            }
            long expected = forkHeight + 1;
            for (PathEntry entry : applied) {
                if (entry.height() != expected++) {
                    throw new IllegalArgumentException("path entries must be contiguous from height " + (forkHeight + 1));
                }
            }

            try (WriteOptions wo = new WriteOptions().setSync(true);
                 WriteBatch batch = new WriteBatch()) {
                for (long h = forkHeight + 1; h <= tip; h++) {
                    batch.delete(cfPath, longToBytes(h));
                }
                for (PathEntry entry : applied) {
                    byte[] id = entry.block().id().bytes();
                    batch.put(cfBlocks, id, entry.block().serialize());
                    batch.put(cfDiffs, id, DiffCodec.encodeList(entry.diffs()));
                    batch.put(cfPath, longToBytes(entry.height()), id);
                }
                long newTip = forkHeight + applied.size();
                if (newTip < 0) {
                    batch.delete(cfMeta, TIP_KEY);
                } else {
                    batch.put(cfMeta, TIP_KEY, longToBytes(newTip));
                }
                db.write(wo, batch);
            }
        } catch (RocksDBException e) {
            throw new IllegalStateException("commitPath failed", e);
        }
    }

    @Override
    public synchronized List<Hash> getPath() {
        try {
            long tip = readTip();
            List<Hash> out = new ArrayList<>();
            for (long h = 0; h <= tip; h++) {
                byte[] id = db.get(cfPath, longToBytes(h));
                if (id == null) {
                    throw new IllegalStateException("stored path has a gap at height " + h);
                }
                out.add(new Hash(id));
            }
            return out;
        } catch (RocksDBException e) {
            throw new IllegalStateException("getPath failed", e);
        }
    }

    @Override
    public synchronized long size() {
        // RocksJava doesn't expose an exact key count; walk the CF.
        try (RocksIterator it = db.newIterator(cfBlocks)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private long readTip() throws RocksDBException {
        byte[] raw = db.get(cfMeta, TIP_KEY);
        return raw == null ? -1L : bytesToLong(raw);
    }

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    private static long bytesToLong(byte[] a) {
        ByteBuffer b = ByteBuffer.wrap(a);
        return b.getLong();
    }
}
