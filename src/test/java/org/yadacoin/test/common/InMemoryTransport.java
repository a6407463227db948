package org.yadacoin.test.common;

import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.transport.Connection;
import org.yadacoin.network.transport.Transport;

import java.io.IOException;
import java.util.function.Consumer;

public class InMemoryTransport implements Transport {

	private final InMemoryExchange exchange;
	private final String localAddress;

	private String listenHost;
	private int listenPort;

	public InMemoryTransport(InMemoryExchange exchange, String localAddress) {
		this.exchange = exchange;
		this.localAddress = localAddress;
	}

	@Override
	public Connection connect(PeerData peerData) throws IOException {
		return this.exchange.connect(this.localAddress, peerData.getHost(), peerData.getPort());
	}

	@Override
	public synchronized void listen(String bindAddress, int port, Consumer<Connection> acceptor) throws IOException {
		try {
			this.exchange.register(bindAddress, port, acceptor);
		} catch (IllegalStateException e) {
			throw new IOException(e.getMessage(), e);
		}

		this.listenHost = bindAddress;
		this.listenPort = port;
	}

	@Override
	public synchronized void shutdown() {
		if (this.listenHost != null)
			this.exchange.unregister(this.listenHost, this.listenPort);

		this.listenHost = null;
	}

}
