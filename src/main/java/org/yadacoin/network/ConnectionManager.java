package org.yadacoin.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.role.PeerRole;
import org.yadacoin.network.role.RoleEntry;
import org.yadacoin.network.role.RoleTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps this node connected to its upstream peers, within the per-role limits of the {@link RoleTable},
 * and polices inbound admissions.
 * <p>
 * The limit check and the marking of new attempts as pending happen under the role's table lock,
 * so concurrent callers can never issue more attempts than the remaining slots.
 */
public class ConnectionManager {

	private static final Logger LOGGER = LogManager.getLogger(ConnectionManager.class);

	private final PeerData self;
	private final String localSignature;
	private final RoleEntry roleEntry;
	private final PeerDirectory peerDirectory;
	private final GatewaySelector gatewaySelector;
	private final PeerConnector peerConnector;

	private final Map<PeerRole, StreamTable> streamTables = new EnumMap<>(PeerRole.class);

	public ConnectionManager(PeerData self, PeerDirectory peerDirectory, GatewaySelector gatewaySelector, PeerConnector peerConnector) {
		this.self = self;
		this.localSignature = self.getIdentity().getUsernameSignature();
		this.roleEntry = RoleTable.get(self.getRole());
		this.peerDirectory = peerDirectory;
		this.gatewaySelector = gatewaySelector;
		this.peerConnector = peerConnector;

		for (PeerRole role : PeerRole.values())
			this.streamTables.put(role, new StreamTable(role));
	}

	/**
	 * Tops up outbound connections towards our upstream role.
	 *
	 * @return number of connection attempts issued
	 */
	public int ensurePeersConnected() {
		PeerRole outboundRole = this.roleEntry.getOutboundRole();
		int limit = this.roleEntry.getLimit(outboundRole);

		List<PeerData> candidates;
		try {
			candidates = getOutboundCandidates();
		} catch (NoGatewayAvailableException e) {
			LOGGER.info("No SeedGateway available, will retry: {}", e.getMessage());
			return 0;
		}

		StreamTable streamTable = this.streamTables.get(outboundRole);
		List<PeerData> newAttempts = new ArrayList<>();

		synchronized (streamTable) {
			int remainingSlots = limit - streamTable.occupancy();
			if (remainingSlots <= 0)
				return 0;

			for (PeerData candidate : candidates) {
				String key = this.peerDirectory.keyOf(candidate);

				if (streamTable.isKnown(key) || streamTable.getIgnored().contains(key))
					continue;

				if (newAttempts.size() >= remainingSlots) {
					LOGGER.debug("{} connection limit {} reached, not connecting to {}", outboundRole, limit, candidate);
					break;
				}

				streamTable.getPending().add(key);
				newAttempts.add(candidate);
			}
		}

		for (PeerData candidate : newAttempts) {
			LOGGER.debug("Connecting to {} {}", outboundRole, candidate);
			this.peerConnector.connect(candidate);
		}

		return newAttempts.size();
	}

	/** Returns peers we would dial for our upstream role, before limit and ignore filtering. */
	List<PeerData> getOutboundCandidates() throws NoGatewayAvailableException {
		List<PeerData> candidates;

		switch (this.roleEntry.getCandidateSource()) {
			case ALL_SEEDS:
				candidates = new ArrayList<>(this.peerDirectory.getPeers(PeerRole.SEED).values());
				break;

			case DESIGNATED_SEED: {
				PeerData seed = this.self.getSeed() != null ? this.peerDirectory.findByUsernameSignature(this.self.getSeed()) : null;
				if (seed == null || seed.getRole() != PeerRole.SEED) {
					LOGGER.warn("Designated Seed {} unknown", this.self.getSeed());
					return Collections.emptyList();
				}

				candidates = Collections.singletonList(seed);
				break;
			}

			case SELECTED_GATEWAY: {
				Set<String> ignoredGateways = getIgnored(PeerRole.SEED_GATEWAY);
				PeerData gateway = this.gatewaySelector.select(this.localSignature, this.peerDirectory.getPeers(PeerRole.SEED_GATEWAY), ignoredGateways);
				candidates = Collections.singletonList(gateway);
				break;
			}

			case ALL_SERVICE_PROVIDERS:
				candidates = new ArrayList<>(this.peerDirectory.getPeers(PeerRole.SERVICE_PROVIDER).values());
				break;

			default:
				throw new IllegalStateException("Unhandled candidate source " + this.roleEntry.getCandidateSource());
		}

		// Never ourself, even if some record claims our signature
		candidates.removeIf(peerData -> this.localSignature.equals(peerData.getIdentity().getUsernameSignature()));
		return candidates;
	}

	// Outbound outcomes

	public void onConnected(PeerData peerData) {
		StreamTable streamTable = this.streamTables.get(peerData.getRole());
		String key = this.peerDirectory.keyOf(peerData);

		synchronized (streamTable) {
			streamTable.getPending().remove(key);
			streamTable.getActive().add(key);
		}
	}

	/**
	 * @param attributable whether the failure is the peer's fault, in which case we won't dial it again
	 */
	public void onConnectFailed(PeerData peerData, boolean attributable) {
		StreamTable streamTable = this.streamTables.get(peerData.getRole());
		String key = this.peerDirectory.keyOf(peerData);

		synchronized (streamTable) {
			streamTable.getPending().remove(key);

			if (attributable)
				streamTable.getIgnored().add(key);
		}
	}

	/** Peer didn't complete its handshake in time. */
	public void onHandshakeFailed(PeerData peerData) {
		StreamTable streamTable = this.streamTables.get(peerData.getRole());
		String key = this.peerDirectory.keyOf(peerData);

		synchronized (streamTable) {
			streamTable.getPending().remove(key);
			streamTable.getActive().remove(key);
			streamTable.getIgnored().add(key);
		}

		LOGGER.info("Ignoring {} {} after failed handshake", peerData.getRole(), peerData);
	}

	/** Outbound session closed, for whatever reason. */
	public void onDisconnected(PeerData peerData) {
		StreamTable streamTable = this.streamTables.get(peerData.getRole());
		String key = this.peerDirectory.keyOf(peerData);

		synchronized (streamTable) {
			streamTable.getActive().remove(key);
		}
	}

	// Inbound

	/**
	 * Decides whether to keep an inbound connection from <tt>remote</tt>, as announced in its hello.
	 * Admitted peers occupy a slot until {@link #releaseInbound(PeerData)}.
	 */
	public boolean acceptInbound(PeerData remote) {
		PeerRole localRole = this.self.getRole();

		if (!RoleTable.acceptsInbound(localRole, remote.getRole())) {
			LOGGER.debug("Refusing inbound {} {}: not a {} client", remote.getRole(), remote, localRole);
			return false;
		}

		if (this.localSignature.equals(remote.getIdentity().getUsernameSignature())) {
			LOGGER.debug("Refusing inbound connection from ourself");
			return false;
		}

		PeerRole bucket = RoleTable.inboundBucket(localRole, remote.getRole());
		int limit = this.roleEntry.getLimit(bucket);
		StreamTable streamTable = this.streamTables.get(bucket);
		String key = this.peerDirectory.keyOf(remote);

		synchronized (streamTable) {
			if (streamTable.isKnown(key)) {
				LOGGER.debug("Refusing inbound {} {}: already connected", remote.getRole(), remote);
				return false;
			}

			if (streamTable.occupancy() >= limit) {
				LOGGER.debug("Refusing inbound {} {}: {} limit {} reached", remote.getRole(), remote, bucket, limit);
				return false;
			}

			streamTable.getInbound().add(key);
		}

		return true;
	}

	public void releaseInbound(PeerData remote) {
		PeerRole bucket = RoleTable.inboundBucket(this.self.getRole(), remote.getRole());
		StreamTable streamTable = this.streamTables.get(bucket);
		String key = this.peerDirectory.keyOf(remote);

		synchronized (streamTable) {
			streamTable.getInbound().remove(key);
		}
	}

	// Ignore list

	public boolean isIgnored(PeerData peerData) {
		StreamTable streamTable = this.streamTables.get(peerData.getRole());

		synchronized (streamTable) {
			return streamTable.getIgnored().contains(this.peerDirectory.keyOf(peerData));
		}
	}

	// Snapshots

	public Set<String> getActive(PeerRole role) {
		StreamTable streamTable = this.streamTables.get(role);
		synchronized (streamTable) {
			return new HashSet<>(streamTable.getActive());
		}
	}

	public Set<String> getPending(PeerRole role) {
		StreamTable streamTable = this.streamTables.get(role);
		synchronized (streamTable) {
			return new HashSet<>(streamTable.getPending());
		}
	}

	public Set<String> getInbound(PeerRole role) {
		StreamTable streamTable = this.streamTables.get(role);
		synchronized (streamTable) {
			return new HashSet<>(streamTable.getInbound());
		}
	}

	public Set<String> getIgnored(PeerRole role) {
		StreamTable streamTable = this.streamTables.get(role);
		synchronized (streamTable) {
			return new HashSet<>(streamTable.getIgnored());
		}
	}

	@Override
	public String toString() {
		return String.format("%s %s", this.self.getRole(), this.streamTables.get(this.roleEntry.getOutboundRole()));
	}

}
