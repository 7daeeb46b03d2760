package com.hiring.refnet.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hiring.refnet.api.RefNetException;
import com.hiring.refnet.api.ReferralError;
import com.hiring.refnet.api.Result;
import com.hiring.refnet.api.Referral;
import com.hiring.refnet.engine.ReferralGraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Builds a {@link ReferralGraph} from a JSON network definition.
 *
 * <pre>
 * {"network": {"name": "demo",
 *              "referrals": [{"referrer": "alice", "candidate": "bob"}]}}
 * </pre>
 *
 * Referrals are applied in file order, which matters: the same edges in a
 * different order can trip a different invariant. Loading fails fast on the
 * first rejected referral.
 */
@Log4j2
public final class NetworkLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private NetworkLoader() {
        // Utility class
    }

    public static NetworkDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static NetworkDefinition parse(String json) throws IOException {
        NetworkDefinition def = MAPPER.readValue(json, NetworkDefinition.class);
        if (def.getNetwork() == null)
            throw new IllegalArgumentException("Missing 'network' key");
        return def;
    }

    /** Parses the file and loads it into a fresh graph. */
    public static ReferralGraph load(Path path) throws IOException {
        return load(parseFile(path));
    }

    /**
     * Applies every referral of {@code def} to a fresh graph.
     *
     * @throws RefNetException carrying the rejection kind of the first referral
     *                         the graph refuses
     */
    public static ReferralGraph load(NetworkDefinition def) {
        return loadInto(new ReferralGraph(), def);
    }

    /**
     * Applies every referral of {@code def} to {@code graph}. Referrals applied
     * before a failure stay in the graph.
     *
     * @throws RefNetException of kind {@link ReferralError#INVALID_INPUT} for a
     *                         definition without a network or with a null entry
     */
    public static ReferralGraph loadInto(ReferralGraph graph, NetworkDefinition def) {
        NetworkDefinition.NetworkInfo info = def.getNetwork();
        if (info == null)
            throw new RefNetException(ReferralError.INVALID_INPUT, "Network definition has no 'network' section");
        List<NetworkDefinition.ReferralDef> referrals = info.getReferrals() == null ? List.of() : info.getReferrals();
        for (int i = 0; i < referrals.size(); i++) {
            NetworkDefinition.ReferralDef rd = referrals.get(i);
            if (rd == null)
                throw new RefNetException(ReferralError.INVALID_INPUT, "Referral #" + i + " is null");
            Result<Referral> added = graph.addReferral(rd.getReferrer(), rd.getCandidate());
            if (added.isFailure())
                throw new RefNetException(added.error(),
                        "Referral #" + i + " (" + rd.getReferrer() + " -> " + rd.getCandidate() + ") rejected: "
                                + added.message());
        }
        log.info("Loaded network '{}': {} users, {} referrals", info.getName(), graph.userCount(),
                graph.referralCount());
        return graph;
    }
}
