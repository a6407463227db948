package org.yadacoin.network.role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Declarative topology of the overlay.
 * <p>
 * Seeds form the root and mesh among themselves. Each Seed fronts one SeedGateway,
 * each SeedGateway fronts ServiceProviders, and Users/Miners reach the network through
 * exactly one ServiceProvider.
 *
 * <pre>
 * Role             outbound         inbound          limits
 * SEED             SEED             SEED_GATEWAY     SEED 100000, SEED_GATEWAY 1
 * SEED_GATEWAY     SEED             SERVICE_PROVIDER SEED 1, SERVICE_PROVIDER 1
 * SERVICE_PROVIDER SEED_GATEWAY     USER             SEED_GATEWAY 1, USER 1
 * USER             SERVICE_PROVIDER USER             SERVICE_PROVIDER 1
 * MINER            SERVICE_PROVIDER USER             SERVICE_PROVIDER 1
 * </pre>
 */
public final class RoleTable {

	private static final Map<PeerRole, RoleEntry> ENTRIES = buildEntries();

	private RoleTable() {
		/* Do not instantiate */
	}

	public static RoleEntry get(PeerRole role) {
		return ENTRIES.get(role);
	}

	/**
	 * Returns whether a peer announcing <tt>remoteRole</tt> may connect to a node of <tt>localRole</tt>,
	 * i.e. the remote's upstream is our role.
	 */
	public static boolean acceptsInbound(PeerRole localRole, PeerRole remoteRole) {
		return get(remoteRole).getOutboundRole() == localRole;
	}

	/**
	 * Returns the connection bucket an admitted inbound peer is counted against.
	 * <p>
	 * Peers of our own role (Seed to Seed) share the outbound bucket, everyone else
	 * counts as our inbound role (e.g. Users and Miners both count as User).
	 */
	public static PeerRole inboundBucket(PeerRole localRole, PeerRole remoteRole) {
		if (remoteRole == localRole)
			return remoteRole;

		return get(localRole).getInboundRole();
	}

	private static Map<PeerRole, RoleEntry> buildEntries() {
		Map<PeerRole, RoleEntry> entries = new EnumMap<>(PeerRole.class);

		entries.put(PeerRole.SEED, new RoleEntry(PeerRole.SEED,
				PeerRole.SEED, PeerRole.SEED_GATEWAY,
				limits(PeerRole.SEED, 100000, PeerRole.SEED_GATEWAY, 1),
				EnumSet.of(PeerRole.SEED, PeerRole.SEED_GATEWAY),
				IdAttribute.RID, CandidateSource.ALL_SEEDS));

		entries.put(PeerRole.SEED_GATEWAY, new RoleEntry(PeerRole.SEED_GATEWAY,
				PeerRole.SEED, PeerRole.SERVICE_PROVIDER,
				limits(PeerRole.SEED, 1, PeerRole.SERVICE_PROVIDER, 1),
				EnumSet.of(PeerRole.SEED, PeerRole.SERVICE_PROVIDER),
				IdAttribute.RID, CandidateSource.DESIGNATED_SEED));

		entries.put(PeerRole.SERVICE_PROVIDER, new RoleEntry(PeerRole.SERVICE_PROVIDER,
				PeerRole.SEED_GATEWAY, PeerRole.USER,
				limits(PeerRole.SEED_GATEWAY, 1, PeerRole.USER, 1),
				EnumSet.of(PeerRole.SERVICE_PROVIDER, PeerRole.USER),
				IdAttribute.RID, CandidateSource.SELECTED_GATEWAY));

		entries.put(PeerRole.USER, new RoleEntry(PeerRole.USER,
				PeerRole.SERVICE_PROVIDER, PeerRole.USER,
				limits(PeerRole.SERVICE_PROVIDER, 1),
				EnumSet.of(PeerRole.SERVICE_PROVIDER),
				IdAttribute.RID, CandidateSource.ALL_SERVICE_PROVIDERS));

		entries.put(PeerRole.MINER, new RoleEntry(PeerRole.MINER,
				PeerRole.SERVICE_PROVIDER, PeerRole.USER,
				limits(PeerRole.SERVICE_PROVIDER, 1),
				EnumSet.of(PeerRole.SERVICE_PROVIDER),
				IdAttribute.ADDRESS, CandidateSource.ALL_SERVICE_PROVIDERS));

		return Collections.unmodifiableMap(entries);
	}

	private static Map<PeerRole, Integer> limits(PeerRole role, int limit) {
		Map<PeerRole, Integer> limits = new EnumMap<>(PeerRole.class);
		limits.put(role, limit);
		return limits;
	}

	private static Map<PeerRole, Integer> limits(PeerRole role, int limit, PeerRole otherRole, int otherLimit) {
		Map<PeerRole, Integer> limits = limits(role, limit);
		limits.put(otherRole, otherLimit);
		return limits;
	}

}
