package org.yadacoin.network.role;

/** Where a role draws its outbound connection candidates from. */
public enum CandidateSource {
	/** Every Seed known to the peer directory. */
	ALL_SEEDS,
	/** The single Seed named by the node's own <tt>seed</tt> back-reference. */
	DESIGNATED_SEED,
	/** The SeedGateway picked by {@link org.yadacoin.network.GatewaySelector} for the current window. */
	SELECTED_GATEWAY,
	/** Every ServiceProvider known to the peer directory. */
	ALL_SERVICE_PROVIDERS;
}
