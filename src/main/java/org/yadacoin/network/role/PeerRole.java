package org.yadacoin.network.role;

/**
 * Position of a node in the fan-out overlay.
 * <p>
 * Topology rules for each role live in {@link RoleTable}.
 */
public enum PeerRole {
	SEED,
	SEED_GATEWAY,
	SERVICE_PROVIDER,
	USER,
	MINER;
}
