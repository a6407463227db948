package org.yadacoin.network.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.function.Consumer;

/**
 * Accept loop for a listening socket. Runs until the server socket is closed.
 */
public class ConnectionAcceptor implements Runnable {

	private static final Logger LOGGER = LogManager.getLogger(ConnectionAcceptor.class);

	private final ServerSocket serverSocket;
	private final Consumer<Connection> acceptor;

	public ConnectionAcceptor(ServerSocket serverSocket, Consumer<Connection> acceptor) {
		this.serverSocket = serverSocket;
		this.acceptor = acceptor;
	}

	@Override
	public void run() {
		while (!this.serverSocket.isClosed()) {
			Socket socket;
			try {
				socket = this.serverSocket.accept();
			} catch (IOException e) {
				if (!this.serverSocket.isClosed())
					LOGGER.warn("Failed to accept connection: {}", e.getMessage());

				continue;
			}

			SocketConnection connection;
			try {
				connection = new SocketConnection(socket, false);
			} catch (IOException e) {
				LOGGER.debug("Connection failed from {} during setup: {}", socket.getRemoteSocketAddress(), e.getMessage());
				closeQuietly(socket);
				continue;
			}

			LOGGER.debug("[{}] Connection accepted from {}", connection.getId(), connection.getRemoteAddress());
			this.acceptor.accept(connection);
		}

		LOGGER.debug("Stopped accepting connections");
	}

	private static void closeQuietly(Socket socket) {
		try {
			socket.close();
		} catch (IOException e) {
			LOGGER.trace("Exception closing rejected socket: {}", e.getMessage());
		}
	}

}
