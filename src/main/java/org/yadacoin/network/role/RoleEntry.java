package org.yadacoin.network.role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable topology rules for one {@link PeerRole}.
 */
public final class RoleEntry {

	private final PeerRole role;
	private final PeerRole outboundRole;
	private final PeerRole inboundRole;
	private final Map<PeerRole, Integer> limits;
	private final Set<PeerRole> compatibleRoles;
	private final IdAttribute idAttribute;
	private final CandidateSource candidateSource;

	RoleEntry(PeerRole role, PeerRole outboundRole, PeerRole inboundRole, Map<PeerRole, Integer> limits,
			Set<PeerRole> compatibleRoles, IdAttribute idAttribute, CandidateSource candidateSource) {
		this.role = role;
		this.outboundRole = outboundRole;
		this.inboundRole = inboundRole;
		this.limits = Collections.unmodifiableMap(new EnumMap<>(limits));
		this.compatibleRoles = Collections.unmodifiableSet(EnumSet.copyOf(compatibleRoles));
		this.idAttribute = idAttribute;
		this.candidateSource = candidateSource;
	}

	public PeerRole getRole() {
		return this.role;
	}

	public PeerRole getOutboundRole() {
		return this.outboundRole;
	}

	public PeerRole getInboundRole() {
		return this.inboundRole;
	}

	/** Returns connection limit towards peers of <tt>otherRole</tt>, zero when no link is allowed. */
	public int getLimit(PeerRole otherRole) {
		return this.limits.getOrDefault(otherRole, 0);
	}

	public Set<PeerRole> getCompatibleRoles() {
		return this.compatibleRoles;
	}

	public boolean isCompatible(PeerRole otherRole) {
		return this.compatibleRoles.contains(otherRole);
	}

	public IdAttribute getIdAttribute() {
		return this.idAttribute;
	}

	public CandidateSource getCandidateSource() {
		return this.candidateSource;
	}

	@Override
	public String toString() {
		return String.format("%s[out=%s, in=%s, limits=%s]", this.role, this.outboundRole, this.inboundRole, this.limits);
	}

}
