package io.consensusset.core.consensus;

import io.consensusset.core.diff.LedgerDiff;
import io.consensusset.core.metrics.ConsensusMetrics;
import io.consensusset.core.notify.ConsensusChange;
import io.consensusset.core.notify.ConsensusSubscriber;
import io.consensusset.core.notify.NotificationBus;
import io.consensusset.core.notify.NotificationChannel;
import io.consensusset.core.notify.SubscriberTier;
import io.consensusset.core.notify.Subscription;
import io.consensusset.core.protocol.Block;
import io.consensusset.core.protocol.FileContract;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.SiacoinOutput;
import io.consensusset.core.protocol.SiafundOutput;
import io.consensusset.core.state.ConsistencyChecker;
import io.consensusset.core.state.ConsistencyFault;
import io.consensusset.core.state.DiffCommitEngine;
import io.consensusset.core.state.LedgerSnapshot;
import io.consensusset.core.state.LedgerState;
import io.consensusset.core.state.LedgerView;
import io.consensusset.core.state.StateReplayer;
import io.consensusset.core.storage.ChainStore;
import io.consensusset.core.storage.PathEntry;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.consensusset.core.consensus.BlockRejectedException.Reason.DOS_BLOCK;
import static io.consensusset.core.consensus.BlockRejectedException.Reason.KNOWN;
import static io.consensusset.core.consensus.BlockRejectedException.Reason.NON_EXTENDING;
import static io.consensusset.core.consensus.BlockRejectedException.Reason.ORPHAN;

/**
 * The consensus set: owns the block tree, the best path and the ledger, and is the
 * only way blocks get into them.
 *
 * <p>Blocks are accepted one at a time. Readers see either the state before a block
 * or after it, never a partially committed block. Subscribers are notified after the
 * state lock is released but before the next block is processed, so they observe
 * changes in commit order.
 *
 * <p>A {@link ConsistencyFault} means the ledger no longer matches its own history.
 * It is never recovered from: every later {@link #acceptBlock} fails with
 * {@link ConsistencyFault.Kind#HALTED}.
 */
public final class ConsensusSet implements LedgerView, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ConsensusSet.class.getName());

    private final ConsensusParams params;
    private final ChainStore store;
    private final PeerPenalizer penalizer;
    private final ConsistencyChecker checker;
    private final LongSupplier clock;

    private final LedgerState state = new LedgerState();
    private final DiffCommitEngine engine = new DiffCommitEngine(state);
    private final DiffGenerator generator;
    private final ForkResolver forkResolver;
    private final NotificationBus bus = new NotificationBus();

    private final Map<Hash, BlockNode> tree = new HashMap<>();
    private final List<BlockNode> path = new ArrayList<>();
    private final Set<Hash> dosBlocks = new HashSet<>();

    private final ReentrantLock acceptLock = new ReentrantLock();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private volatile ConsistencyFault haltCause;

    public ConsensusSet(Block genesis,
                        ConsensusParams params,
                        TransactionValidator validator,
                        ChainStore store,
                        PeerPenalizer penalizer,
                        boolean consistencyChecks) throws ConsistencyFault {
        this(genesis, params, validator, store, penalizer, consistencyChecks, System::currentTimeMillis);
    }

    ConsensusSet(Block genesis,
                 ConsensusParams params,
                 TransactionValidator validator,
                 ChainStore store,
                 PeerPenalizer penalizer,
                 boolean consistencyChecks,
                 LongSupplier clock) throws ConsistencyFault {
        Objects.requireNonNull(genesis, "genesis");
        this.params = Objects.requireNonNull(params, "params");
        this.store = Objects.requireNonNull(store, "store");
        this.penalizer = Objects.requireNonNull(penalizer, "penalizer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.checker = consistencyChecks ? new ConsistencyChecker(params.siafundCount()) : null;
        this.generator = new DiffGenerator(engine, Objects.requireNonNull(validator, "validator"), params);
        this.forkResolver = new ForkResolver(engine, generator);

        if (genesis.header().height() != 0 || !genesis.parentId().isZero()) {
            throw new IllegalArgumentException("genesis must have height 0 and a zero parent id");
        }

        List<Hash> stored = store.getPath();
        if (stored.isEmpty()) {
            initGenesis(genesis);
        } else {
            if (!stored.get(0).equals(genesis.id())) {
                throw new IllegalStateException("stored chain starts at " + stored.get(0).hex()
                        + ", expected genesis " + genesis.id().hex());
            }
            loadPath(StateReplayer.replay(store, engine));
        }
        if (checker != null) {
            checker.check(state);
        }
        LOG.info("Consensus set ready at height " + state.height() + ", tip " + tip().id().hex());
    }

    private void initGenesis(Block genesis) throws ConsistencyFault {
        List<LedgerDiff> diffs = generator.applyGenesis(genesis);
        engine.setHeight(0L);
        BlockNode node = BlockNode.genesis(genesis, diffs);
        store.commitPath(-1L, List.of(new PathEntry(genesis, diffs)));
        tree.put(node.id(), node);
        path.add(node);
        LOG.info("Applied genesis block " + node.id().hex() + " with " + diffs.size() + " diffs");
    }

    private void loadPath(List<PathEntry> entries) {
        BlockNode prev = null;
        for (PathEntry entry : entries) {
            BlockNode node;
            if (prev == null) {
                node = BlockNode.genesis(entry.block(), entry.diffs());
            } else {
                node = BlockNode.child(prev, entry.block());
                node.attachDiffs(entry.diffs());
            }
            tree.put(node.id(), node);
            path.add(node);
            prev = node;
        }
    }

    // -------------- block acceptance ----------------

    /** Accepts a locally submitted block. */
    public void acceptBlock(Block block) throws BlockRejectedException, ConsistencyFault {
        acceptBlock(block, null);
    }

    /**
     * Validates {@code block} and, if its branch carries the most work, makes it the new
     * tip, reorganizing if needed. On rejection the ledger is unchanged.
     *
     * @param sourcePeer peer that relayed the block, passed to the penalizer for DoS blocks
     */
    public void acceptBlock(Block block, String sourcePeer) throws BlockRejectedException, ConsistencyFault {
        Objects.requireNonNull(block, "block");
        acceptLock.lock();
        try {
            ConsistencyFault halted = haltCause;
            if (halted != null) {
                throw new ConsistencyFault(ConsistencyFault.Kind.HALTED,
                        "block processing halted after: " + halted.getMessage(), halted);
            }

            long start = System.nanoTime();
            ConsensusChange change;
            try {
                change = process(block);
            } catch (BlockRejectedException e) {
                ConsensusMetrics.blockRejected(e.reason().name());
                if (e.isPenalizing()) {
                    Hash offender = e.blockId() != null ? e.blockId() : block.id();
                    LOG.warning("DoS block " + offender.hex() + " from " + sourcePeer + ": " + e.getMessage());
                    penalizer.penalize(sourcePeer, offender, e.getMessage());
                } else {
                    LOG.fine("Rejected block " + block.id().hex() + " [" + e.reason() + "]: " + e.getMessage());
                }
                throw e;
            } catch (ConsistencyFault f) {
                haltCause = f;
                ConsensusMetrics.fault();
                LOG.log(Level.SEVERE, "Consistency fault while processing block " + block.id().hex()
                        + "; halting block processing", f);
                throw f;
            }
            ConsensusMetrics.recordAccept(System.nanoTime() - start);

            bus.deliver(change);
        } finally {
            acceptLock.unlock();
        }
    }

    private ConsensusChange process(Block block) throws BlockRejectedException, ConsistencyFault {
        Hash id = block.id();
        if (dosBlocks.contains(id)) {
            throw new BlockRejectedException(DOS_BLOCK, "Block " + id.hex() + " is a known DoS block", id);
        }
        if (tree.containsKey(id)) {
            throw new BlockRejectedException(KNOWN, "Block " + id.hex() + " already known", id);
        }
        BlockNode parent = tree.get(block.parentId());
        if (parent == null) {
            throw new BlockRejectedException(ORPHAN, "Unknown parent " + block.parentId().hex(), id);
        }
        try {
            ConsensusRules.validateHeader(block, parent, params, clock.getAsLong());
        } catch (BlockRejectedException e) {
            throw e.forBlock(id);
        }

        BlockNode node = BlockNode.child(parent, block);
        store.putBlock(block);
        tree.put(id, node);

        BlockNode tip = tip();
        if (node.cumulativeWork().compareTo(tip.cumulativeWork()) <= 0) {
            throw new BlockRejectedException(NON_EXTENDING,
                    "Block " + id.hex() + " stored on a side chain with less or equal work", id);
        }

        ForkResolver.Result result;
        stateLock.writeLock().lock();
        try {
            try {
                result = forkResolver.switchTo(tip, node);
            } catch (BlockRejectedException e) {
                discard(e.blockId() != null ? e.blockId() : id, e.reason());
                throw e;
            } catch (RuntimeException e) {
                discard(id, null);
                throw new ConsistencyFault(ConsistencyFault.Kind.APPLY_FAILURE,
                        "unexpected failure applying branch to " + id.hex(), e);
            }

            while (path.size() > result.ancestor().height() + 1) {
                path.remove(path.size() - 1);
            }
            path.addAll(result.applied());

            if (checker != null) {
                checker.check(state);
                if (tip().height() != state.height()) {
                    throw new ConsistencyFault(ConsistencyFault.Kind.INVARIANT_VIOLATION,
                            "path tip at height " + tip().height() + " but ledger at " + state.height());
                }
            }

            List<PathEntry> entries = new ArrayList<>(result.applied().size());
            for (BlockNode n : result.applied()) {
                entries.add(new PathEntry(n.block(), n.diffs()));
            }
            try {
                store.commitPath(result.ancestor().height(), entries);
            } catch (RuntimeException e) {
                throw new ConsistencyFault(ConsistencyFault.Kind.PERSISTENCE_FAILURE,
                        "could not persist path at height " + node.height(), e);
            }
        } finally {
            stateLock.writeLock().unlock();
        }

        int diffCount = 0;
        for (BlockNode n : result.applied()) diffCount += n.diffs().size();
        ConsensusMetrics.blockAccepted(diffCount);
        if (result.reverted().isEmpty()) {
            LOG.info("Accepted block h=" + node.height() + " id=" + id.hex());
        } else {
            ConsensusMetrics.reorg(result.reverted().size());
            LOG.info("Reorganized at fork height " + result.ancestor().height() + ": reverted "
                    + result.reverted().size() + ", applied " + result.applied().size()
                    + ", new tip h=" + node.height() + " id=" + id.hex());
        }
        return toChange(result.reverted(), result.applied());
    }

    /** Drops a rejected block and everything built on it from the tree. */
    private void discard(Hash failedId, BlockRejectedException.Reason reason) {
        BlockNode failed = tree.get(failedId);
        if (failed != null) {
            tree.values().removeIf(n -> n.descendsFrom(failed));
        }
        if (reason == DOS_BLOCK) {
            dosBlocks.add(failedId);
        }
    }

    private ConsensusChange toChange(List<BlockNode> reverted, List<BlockNode> applied) {
        List<Hash> revertedIds = new ArrayList<>();
        List<Hash> appliedIds = new ArrayList<>();
        List<LedgerDiff> diffs = new ArrayList<>();
        for (BlockNode n : reverted) {
            revertedIds.add(n.id());
            List<LedgerDiff> d = n.diffs();
            for (int i = d.size() - 1; i >= 0; i--) {
                diffs.add(d.get(i).inverse());
            }
        }
        for (BlockNode n : applied) {
            appliedIds.add(n.id());
            diffs.addAll(n.diffs());
        }
        return new ConsensusChange(revertedIds, appliedIds, diffs, state.height());
    }

    // -------------- subscriptions ----------------

    /**
     * Registers a subscriber. It first receives one change covering the whole current
     * path, then every change committed after it.
     */
    public Subscription subscribe(SubscriberTier tier, ConsensusSubscriber subscriber) {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(subscriber, "subscriber");
        acceptLock.lock();
        try {
            ConsensusChange catchUp = read(() -> toChange(List.of(), path));
            bus.deliverTo(subscriber, catchUp);
            return bus.subscribe(tier, subscriber);
        } finally {
            acceptLock.unlock();
        }
    }

    public Subscription subscribe(ConsensusSubscriber subscriber) {
        return subscribe(SubscriberTier.CONSENSUS, subscriber);
    }

    /** Queue-backed subscription on the consensus tier. */
    public NotificationChannel notifyChannel() {
        NotificationChannel channel = new NotificationChannel();
        subscribe(SubscriberTier.CONSENSUS, channel);
        return channel;
    }

    // -------------- queries ----------------

    @Override
    public long height() {
        return read(state::height);
    }

    @Override
    public Optional<SiacoinOutput> getSiacoinOutput(Hash id) {
        return read(() -> state.getSiacoinOutput(id));
    }

    @Override
    public Optional<SiafundOutput> getSiafundOutput(Hash id) {
        return read(() -> state.getSiafundOutput(id));
    }

    @Override
    public Optional<FileContract> getFileContract(Hash id) {
        return read(() -> state.getFileContract(id));
    }

    @Override
    public Map<Hash, SiacoinOutput> getDelayedSiacoinOutputs(long maturityHeight) {
        return read(() -> state.getDelayedSiacoinOutputs(maturityHeight));
    }

    @Override
    public BigInteger siafundPool() {
        return read(state::siafundPool);
    }

    @Override
    public Map<Hash, FileContract> fileContracts() {
        return read(state::fileContracts);
    }

    @Override
    public LedgerSnapshot snapshot() {
        return read(state::snapshot);
    }

    /** Best path block ids, genesis first. */
    public List<Hash> currentPath() {
        return read(() -> {
            List<Hash> ids = new ArrayList<>(path.size());
            for (BlockNode n : path) ids.add(n.id());
            return ids;
        });
    }

    public Block currentBlock() {
        return read(() -> tip().block());
    }

    public Optional<Block> blockAtHeight(long height) {
        return read(() -> height < 0 || height >= path.size()
                ? Optional.<Block>empty()
                : Optional.of(path.get((int) height).block()));
    }

    /** True for blocks in the block tree, whether on the best path or a side chain. */
    public boolean isKnown(Hash blockId) {
        acceptLock.lock();
        try {
            return tree.containsKey(blockId);
        } finally {
            acceptLock.unlock();
        }
    }

    public boolean isDosBlock(Hash blockId) {
        acceptLock.lock();
        try {
            return dosBlocks.contains(blockId);
        } finally {
            acceptLock.unlock();
        }
    }

    public boolean isHalted() {
        return haltCause != null;
    }

    public Optional<ConsistencyFault> haltCause() {
        return Optional.ofNullable(haltCause);
    }

    public ConsensusParams params() {
        return params;
    }

    /** Read-only view for collaborators that must not see the acceptance API. */
    public LedgerView view() {
        return this;
    }

    /** Closes the chain store if it holds resources. */
    @Override
    public void close() {
        acceptLock.lock();
        try {
            if (store instanceof AutoCloseable) {
                ((AutoCloseable) store).close();
            }
        } catch (Exception e) {
            throw new IllegalStateException("failed to close chain store", e);
        } finally {
            acceptLock.unlock();
        }
    }

    private BlockNode tip() {
        return path.get(path.size() - 1);
    }

    private <T> T read(Supplier<T> query) {
        stateLock.readLock().lock();
        try {
            return query.get();
        } finally {
            stateLock.readLock().unlock();
        }
    }
}
