package org.yadacoin.network.role;

/** Which peer attribute identifies a participant of a given role. */
public enum IdAttribute {
	/** Pairwise relationship id derived from both identities' signatures. */
	RID,
	/** Mining address announced by the peer. */
	ADDRESS;
}
