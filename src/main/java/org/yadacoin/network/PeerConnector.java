package org.yadacoin.network;

import org.yadacoin.data.network.PeerData;

/**
 * Issues an asynchronous outbound connection attempt. Outcome is reported back to the
 * {@link ConnectionManager}.
 */
@FunctionalInterface
public interface PeerConnector {

	void connect(PeerData peerData);

}
