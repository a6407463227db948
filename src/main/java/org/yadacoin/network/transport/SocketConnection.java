package org.yadacoin.network.transport;

import com.google.common.net.HostAndPort;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.network.message.Message;
import org.yadacoin.network.message.MessageException;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Connection} over a blocking TCP socket with a dedicated reader thread.
 */
public class SocketConnection implements Connection {

	private static final Logger LOGGER = LogManager.getLogger(SocketConnection.class);

	private static final AtomicInteger CONNECTION_ID_GENERATOR = new AtomicInteger(1);

	private final String id;
	private final Socket socket;
	private final boolean isOutbound;
	private final String remoteAddress;

	private final DataInputStream in;
	private final OutputStream out;
	private final Object writeLock = new Object();

	private final AtomicBoolean isStopping = new AtomicBoolean(false);
	private volatile ConnectionListener listener;
	private Thread readerThread;

	public SocketConnection(Socket socket, boolean isOutbound) throws IOException {
		this.id = "C" + CONNECTION_ID_GENERATOR.getAndIncrement();
		this.socket = socket;
		this.isOutbound = isOutbound;
		this.remoteAddress = HostAndPort.fromParts(socket.getInetAddress().getHostAddress(), socket.getPort()).toString();

		this.socket.setTcpNoDelay(true);
		this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
		this.out = new BufferedOutputStream(socket.getOutputStream());
	}

	@Override
	public String getId() {
		return this.id;
	}

	@Override
	public boolean isOutbound() {
		return this.isOutbound;
	}

	@Override
	public String getRemoteAddress() {
		return this.remoteAddress;
	}

	@Override
	public void setListener(ConnectionListener listener) {
		this.listener = listener;
	}

	@Override
	public void start() {
		if (this.listener == null)
			throw new IllegalStateException("Listener must be set before starting connection " + this.id);

		this.readerThread = new Thread(this::readLoop, "Connection-" + this.id);
		this.readerThread.setDaemon(true);
		this.readerThread.start();
	}

	private void readLoop() {
		String reason = "remote closed";

		try {
			while (!this.isStopping.get()) {
				Message message;
				try {
					message = Message.fromStream(this.in);
				} catch (MessageException e) {
					// Frame consumed, stream still in sync
					LOGGER.debug("[{}] Dropping bad message from {}: {}", this.id, this.remoteAddress, e.getMessage());
					continue;
				}

				LOGGER.trace("[{}] Received {} from {}", this.id, message, this.remoteAddress);
				this.listener.onMessage(this, message);
			}
		} catch (EOFException e) {
			reason = "end of stream";
		} catch (SocketException e) {
			reason = this.isStopping.get() ? "local close" : e.getMessage();
		} catch (IOException e) {
			reason = e.getMessage();
		} catch (RuntimeException e) {
			LOGGER.warn(String.format("[%s] Unexpected exception handling message from %s", this.id, this.remoteAddress), e);
			reason = "listener failure";
		}

		close(reason);
	}

	@Override
	public void send(Message message) throws IOException {
		if (!isOpen())
			throw new IOException("Connection " + this.id + " closed");

		byte[] bytes;
		try {
			bytes = message.toBytes();
		} catch (MessageException e) {
			throw new IOException("Unable to serialize " + message, e);
		}

		synchronized (this.writeLock) {
			this.out.write(bytes);
			this.out.flush();
		}

		LOGGER.trace("[{}] Sent {} to {}", this.id, message, this.remoteAddress);
	}

	@Override
	public boolean isOpen() {
		return !this.isStopping.get() && !this.socket.isClosed();
	}

	@Override
	public void close(String reason) {
		if (!this.isStopping.compareAndSet(false, true))
			return;

		LOGGER.debug("[{}] Closing connection to {}: {}", this.id, this.remoteAddress, reason);

		try {
			this.socket.close();
		} catch (IOException e) {
			LOGGER.debug("[{}] Exception closing socket: {}", this.id, e.getMessage());
		}

		ConnectionListener currentListener = this.listener;
		if (currentListener != null)
			currentListener.onClosed(this);
	}

	@Override
	public String toString() {
		return this.id + "@" + this.remoteAddress;
	}

}
