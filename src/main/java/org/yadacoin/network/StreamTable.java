package org.yadacoin.network;

import org.yadacoin.network.role.PeerRole;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Connection bookkeeping for peers of one role, by peer key.
 * <p>
 * Not thread-safe: callers synchronize on the table.
 */
class StreamTable {

	private final PeerRole role;

	/** Established outbound connections. */
	private final Set<String> active = new LinkedHashSet<>();
	/** Outbound attempts issued but not yet resolved. */
	private final Set<String> pending = new LinkedHashSet<>();
	/** Admitted inbound connections. */
	private final Set<String> inbound = new LinkedHashSet<>();
	/** Peers we won't dial again. */
	private final Set<String> ignored = new HashSet<>();

	StreamTable(PeerRole role) {
		this.role = role;
	}

	PeerRole getRole() {
		return this.role;
	}

	/** Returns whether we hold or are establishing any link with <tt>key</tt>. */
	boolean isKnown(String key) {
		return this.active.contains(key) || this.pending.contains(key) || this.inbound.contains(key);
	}

	/** Number of distinct peers occupying a slot in this role's limit. */
	int occupancy() {
		Set<String> all = new HashSet<>(this.active);
		all.addAll(this.pending);
		all.addAll(this.inbound);
		return all.size();
	}

	Set<String> getActive() {
		return this.active;
	}

	Set<String> getPending() {
		return this.pending;
	}

	Set<String> getInbound() {
		return this.inbound;
	}

	Set<String> getIgnored() {
		return this.ignored;
	}

	@Override
	public String toString() {
		return String.format("%s[active=%d, pending=%d, inbound=%d, ignored=%d]", this.role,
				this.active.size(), this.pending.size(), this.inbound.size(), this.ignored.size());
	}

}
