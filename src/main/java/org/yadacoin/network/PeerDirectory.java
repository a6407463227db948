package org.yadacoin.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.role.PeerRole;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All peers this node knows about, keyed by participant key, in the order they were first learned.
 * <p>
 * Entries are never removed. Merging a known key only refreshes its reachable host/port,
 * and only when the announced identity matches the one we already hold.
 */
public class PeerDirectory {

	private static final Logger LOGGER = LogManager.getLogger(PeerDirectory.class);

	private final String localSignature;

	private final Lock mergePeersLock = new ReentrantLock();
	private final Map<String, PeerData> knownPeers = new LinkedHashMap<>();

	public PeerDirectory(String localSignature) {
		this.localSignature = localSignature;
	}

	public String getLocalSignature() {
		return this.localSignature;
	}

	/** Returns key of <tt>peerData</tt> as used by this directory. */
	public String keyOf(PeerData peerData) {
		return peerData.getKey(this.localSignature);
	}

	/**
	 * Merges one peer record.
	 *
	 * @return <tt>true</tt> if the peer was added or its host/port refreshed
	 */
	public boolean mergePeer(PeerData peerData) {
		this.mergePeersLock.lock();

		try {
			return mergePeerUnlocked(peerData);
		} finally {
			this.mergePeersLock.unlock();
		}
	}

	/**
	 * Merges peer records, e.g. from a PEERS message.
	 *
	 * @return number of records that were added or refreshed
	 */
	public int mergePeers(Collection<PeerData> peers) {
		this.mergePeersLock.lock();

		try {
			int changed = 0;
			for (PeerData peerData : peers)
				if (mergePeerUnlocked(peerData))
					++changed;

			return changed;
		} finally {
			this.mergePeersLock.unlock();
		}
	}

	private boolean mergePeerUnlocked(PeerData peerData) {
		if (peerData.getIdentity() == null || peerData.getIdentity().getUsernameSignature() == null || peerData.getRole() == null) {
			LOGGER.debug("Ignoring incomplete peer record {}", peerData);
			return false;
		}

		// We don't track ourself
		if (this.localSignature.equals(peerData.getIdentity().getUsernameSignature()))
			return false;

		String key = keyOf(peerData);
		PeerData knownPeerData = this.knownPeers.get(key);

		if (knownPeerData == null) {
			this.knownPeers.put(key, peerData);
			LOGGER.debug("Added {} {} to known peers", peerData.getRole(), peerData);
			return true;
		}

		if (!knownPeerData.getIdentity().matches(peerData.getIdentity())) {
			LOGGER.debug("Rejecting record for {} from {}: identity doesn't match known peer", key, peerData);
			return false;
		}

		if (knownPeerData.isSameHostAndPort(peerData))
			return false;

		this.knownPeers.put(key, knownPeerData.withHostAndPort(peerData.getHost(), peerData.getPort()));
		LOGGER.debug("Updated {} address from {} to {}", key, knownPeerData, peerData);
		return true;
	}

	public PeerData getPeer(String key) {
		this.mergePeersLock.lock();
		try {
			return this.knownPeers.get(key);
		} finally {
			this.mergePeersLock.unlock();
		}
	}

	/** Returns first known peer whose identity carries <tt>usernameSignature</tt>, or <tt>null</tt>. */
	public PeerData findByUsernameSignature(String usernameSignature) {
		this.mergePeersLock.lock();
		try {
			for (PeerData peerData : this.knownPeers.values())
				if (usernameSignature.equals(peerData.getIdentity().getUsernameSignature()))
					return peerData;

			return null;
		} finally {
			this.mergePeersLock.unlock();
		}
	}

	/** Returns snapshot of known peers of <tt>role</tt>, keyed as in this directory, in insertion order. */
	public Map<String, PeerData> getPeers(PeerRole role) {
		this.mergePeersLock.lock();
		try {
			Map<String, PeerData> peers = new LinkedHashMap<>();
			for (Map.Entry<String, PeerData> entry : this.knownPeers.entrySet())
				if (entry.getValue().getRole() == role)
					peers.put(entry.getKey(), entry.getValue());

			return peers;
		} finally {
			this.mergePeersLock.unlock();
		}
	}

	public List<PeerData> getAllPeers() {
		this.mergePeersLock.lock();
		try {
			return new ArrayList<>(this.knownPeers.values());
		} finally {
			this.mergePeersLock.unlock();
		}
	}

	public int size() {
		this.mergePeersLock.lock();
		try {
			return this.knownPeers.size();
		} finally {
			this.mergePeersLock.unlock();
		}
	}

}
