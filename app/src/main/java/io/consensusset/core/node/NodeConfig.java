package io.consensusset.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.consensusset.core.consensus.ConsensusParams;
import io.consensusset.core.protocol.Hash;
import io.consensusset.core.protocol.Hashes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node configuration: consensus constants plus genesis allocations.
 * Allocation keys are unlock hashes in hex.
 */
public final class NodeConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public final ConsensusParams params;
    public final boolean consistencyChecks;
    public final long genesisTimestamp;
    public final Map<String, Long> genesisSiafundAllocations;
    public final Map<String, Long> genesisSiacoinAllocations;

    public NodeConfig(ConsensusParams params,
                      boolean consistencyChecks,
                      long genesisTimestamp,
                      Map<String, Long> genesisSiafundAllocations,
                      Map<String, Long> genesisSiacoinAllocations) {
        this.params = params;
        this.consistencyChecks = consistencyChecks;
        this.genesisTimestamp = genesisTimestamp;
        this.genesisSiafundAllocations = Map.copyOf(genesisSiafundAllocations);
        this.genesisSiacoinAllocations = Map.copyOf(genesisSiacoinAllocations);
    }

    public static NodeConfig defaultLocal() {
        Map<String, Long> siafunds = new LinkedHashMap<>();
        siafunds.put(Hashes.hash("genesis-siafund-holder".getBytes(StandardCharsets.UTF_8)).hex(), 10_000L);
        return new NodeConfig(
                ConsensusParams.defaults(),
                false,                  // checks are a debugging aid
                1_433_600_000_000L,     // fixed so every node derives the same genesis id
                siafunds,
                Map.of()
        );
    }

    /**
     * Reads a JSON file and overlays it on {@link #defaultLocal()}. Unknown fields are
     * rejected so typos do not silently fall back to defaults.
     */
    public static NodeConfig load(Path file) {
        JsonNode root;
        try {
            root = JSON.readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Config " + file + " must be a JSON object");
        }
        return fromJson(root);
    }

    static NodeConfig fromJson(JsonNode root) {
        NodeConfig base = defaultLocal();
        ConsensusParams p = base.params;

        long maturityDelay = p.maturityDelay();
        long initialCoinbase = p.initialCoinbase();
        long minimumCoinbase = p.minimumCoinbase();
        long siafundCount = p.siafundCount();
        long taxNumerator = p.siafundTaxNumerator();
        long taxDenominator = p.siafundTaxDenominator();
        long futureThreshold = p.futureThresholdMillis();
        boolean checks = base.consistencyChecks;
        long genesisTimestamp = base.genesisTimestamp;
        Map<String, Long> siafunds = base.genesisSiafundAllocations;
        Map<String, Long> siacoins = base.genesisSiacoinAllocations;

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            JsonNode v = f.getValue();
            String key = f.getKey();
            if ("maturityDelay".equals(key)) {
                maturityDelay = requireLong(key, v);
            } else if ("initialCoinbase".equals(key)) {
                initialCoinbase = requireLong(key, v);
            } else if ("minimumCoinbase".equals(key)) {
                minimumCoinbase = requireLong(key, v);
            } else if ("siafundCount".equals(key)) {
                siafundCount = requireLong(key, v);
            } else if ("siafundTaxNumerator".equals(key)) {
                taxNumerator = requireLong(key, v);
            } else if ("siafundTaxDenominator".equals(key)) {
                taxDenominator = requireLong(key, v);
            } else if ("futureThresholdMillis".equals(key)) {
                futureThreshold = requireLong(key, v);
            } else if ("consistencyChecks".equals(key)) {
                if (!v.isBoolean()) throw new IllegalArgumentException("consistencyChecks must be a boolean");
                checks = v.booleanValue();
            } else if ("genesisTimestamp".equals(key)) {
                genesisTimestamp = requireLong(key, v);
            } else if ("genesisSiafundAllocations".equals(key)) {
                siafunds = readAllocations(key, v);
            } else if ("genesisSiacoinAllocations".equals(key)) {
                siacoins = readAllocations(key, v);
            } else {
                throw new IllegalArgumentException("Unknown config field: " + key);
            }
        }

        ConsensusParams params = new ConsensusParams(maturityDelay, initialCoinbase, minimumCoinbase,
                siafundCount, taxNumerator, taxDenominator, futureThreshold);
        return new NodeConfig(params, checks, genesisTimestamp, siafunds, siacoins);
    }

    public NodeConfig withConsistencyChecks(boolean enabled) {
        return new NodeConfig(params, enabled, genesisTimestamp, genesisSiafundAllocations, genesisSiacoinAllocations);
    }

    public NodeConfig withParams(ConsensusParams newParams) {
        return new NodeConfig(newParams, consistencyChecks, genesisTimestamp,
                genesisSiafundAllocations, genesisSiacoinAllocations);
    }

    private static long requireLong(String name, JsonNode v) {
        if (!v.canConvertToLong() || !v.isIntegralNumber()) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
        return v.longValue();
    }

    private static Map<String, Long> readAllocations(String name, JsonNode v) {
        if (!v.isObject()) throw new IllegalArgumentException(name + " must be an object of unlockHash -> amount");
        Map<String, Long> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = v.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            Hash.fromHex(e.getKey());
            long amount = requireLong(name + "." + e.getKey(), e.getValue());
            if (amount <= 0) throw new IllegalArgumentException(name + " amounts must be positive");
            out.put(e.getKey(), amount);
        }
        return out;
    }
}
