package org.yadacoin.network.transport;

import org.yadacoin.network.message.Message;

import java.io.IOException;

/**
 * One established, framed, bidirectional link to a remote node.
 */
public interface Connection {

	/** Short id used as log prefix. */
	String getId();

	boolean isOutbound();

	/** Remote socket address, host:port, as seen at the transport level. */
	String getRemoteAddress();

	/** Must be called before {@link #start()}. */
	void setListener(ConnectionListener listener);

	/** Begins delivering inbound messages to the listener. */
	void start();

	void send(Message message) throws IOException;

	boolean isOpen();

	/** Closes the link. Idempotent; the listener's <tt>onClosed</tt> fires once. */
	void close(String reason);

}
