package org.yadacoin.network.transport;

import org.yadacoin.network.message.Message;

/**
 * Receives events from a {@link Connection}. Callbacks arrive on the connection's reader thread
 * and must not block for long.
 */
public interface ConnectionListener {

	void onMessage(Connection connection, Message message);

	/** Called exactly once, whichever side closed the connection. */
	void onClosed(Connection connection);

}
