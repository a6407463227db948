package org.yadacoin.network.task;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.Network;

public class PeerConnectTask implements Runnable {

	private static final Logger LOGGER = LogManager.getLogger(PeerConnectTask.class);

	private final Network network;
	private final PeerData peerData;

	public PeerConnectTask(Network network, PeerData peerData) {
		this.network = network;
		this.peerData = peerData;
	}

	@Override
	public void run() {
		try {
			if (this.network.connectPeerNow(this.peerData))
				LOGGER.trace("Successfully connected to peer {}", this.peerData);
		} catch (RuntimeException e) {
			LOGGER.error(String.format("Error connecting to peer %s", this.peerData), e);
			// May have failed after the connection was marked active
			this.network.getConnectionManager().onConnectFailed(this.peerData, false);
			this.network.getConnectionManager().onDisconnected(this.peerData);
		}
	}

}
