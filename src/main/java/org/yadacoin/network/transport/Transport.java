package org.yadacoin.network.transport;

import org.yadacoin.data.network.PeerData;

import java.io.IOException;
import java.util.function.Consumer;

public interface Transport {

	/**
	 * Opens a link to <tt>peerData</tt>, blocking until connected.
	 *
	 * @throws IOException if the peer cannot be reached
	 */
	Connection connect(PeerData peerData) throws IOException;

	/**
	 * Starts accepting inbound links, handing each new (not yet started) connection to <tt>acceptor</tt>.
	 */
	void listen(String bindAddress, int port, Consumer<Connection> acceptor) throws IOException;

	void shutdown();

}
