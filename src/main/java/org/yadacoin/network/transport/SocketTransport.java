package org.yadacoin.network.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.settings.Settings;
import org.yadacoin.utils.NamedThreadFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.function.Consumer;

/**
 * TCP transport using framed messages over blocking sockets.
 */
public class SocketTransport implements Transport {

	private static final Logger LOGGER = LogManager.getLogger(SocketTransport.class);

	private final String bindAddress;
	private final int connectTimeout;

	private ServerSocket serverSocket;
	private Thread acceptorThread;

	/**
	 * @param bindAddress local address outbound sockets bind to
	 * @param connectTimeout maximum time for connect() to complete (ms)
	 */
	public SocketTransport(String bindAddress, int connectTimeout) {
		this.bindAddress = bindAddress;
		this.connectTimeout = connectTimeout;
	}

	/** Returns transport binding outbound sockets to the configured address, with the configured connect timeout. */
	public static SocketTransport fromSettings(Settings settings) {
		return new SocketTransport(settings.getBindAddress(), settings.getConnectTimeout());
	}

	public int getConnectTimeout() {
		return this.connectTimeout;
	}

	@Override
	public Connection connect(PeerData peerData) throws IOException {
		LOGGER.trace("Connecting to peer {}", peerData);

		Socket socket = new Socket();
		try {
			socket.bind(new InetSocketAddress(InetAddress.getByName(this.bindAddress), 0));
			socket.connect(new InetSocketAddress(peerData.getHost(), peerData.getPort()), this.connectTimeout);
		} catch (SocketTimeoutException e) {
			closeQuietly(socket);
			throw new IOException("Connection timed out to peer " + peerData, e);
		} catch (UnknownHostException e) {
			closeQuietly(socket);
			throw new IOException("Connection failed to unresolved peer " + peerData, e);
		} catch (IOException e) {
			closeQuietly(socket);
			throw e;
		}

		try {
			return new SocketConnection(socket, true);
		} catch (IOException e) {
			LOGGER.trace("Post-connection setup failed, peer {}", peerData);
			closeQuietly(socket);
			throw e;
		}
	}

	@Override
	public synchronized void listen(String listenAddress, int port, Consumer<Connection> acceptor) throws IOException {
		if (this.serverSocket != null)
			throw new IllegalStateException("Already listening on " + this.serverSocket.getLocalSocketAddress());

		ServerSocket newServerSocket = new ServerSocket();
		newServerSocket.setReuseAddress(true);
		try {
			newServerSocket.bind(new InetSocketAddress(InetAddress.getByName(listenAddress), port));
		} catch (IOException e) {
			closeQuietly(newServerSocket);
			throw new IOException(String.format("Can't bind listen socket to %s:%d", listenAddress, port), e);
		}

		this.serverSocket = newServerSocket;
		LOGGER.info("Listening for peers on {}:{}", listenAddress, port);

		this.acceptorThread = new NamedThreadFactory("ConnectionAcceptor").newThread(new ConnectionAcceptor(newServerSocket, acceptor));
		this.acceptorThread.start();
	}

	/** Returns actual bound port, useful when listening on port 0. */
	public synchronized int getLocalPort() {
		return this.serverSocket != null ? this.serverSocket.getLocalPort() : -1;
	}

	@Override
	public synchronized void shutdown() {
		if (this.serverSocket == null)
			return;

		closeQuietly(this.serverSocket);
		this.serverSocket = null;

		try {
			this.acceptorThread.join(1000L);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static void closeQuietly(Closeable closeable) {
		try {
			closeable.close();
		} catch (IOException e) {
			LOGGER.trace("Exception closing socket: {}", e.getMessage());
		}
	}

}
