package org.yadacoin.network.message;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Map;

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toMap;

public enum MessageType {
	// HANDSHAKING
	HELLO(0, HelloMessage::fromByteBuffer),

	// PEERS
	GET_PEERS(10, GetPeersMessage::fromByteBuffer),
	PEERS(11, PeersMessage::fromByteBuffer),

	// BLOCKS
	GET_LATEST_BLOCK(20, GetLatestBlockMessage::fromByteBuffer),
	LATEST_BLOCK(21, LatestBlockMessage::fromByteBuffer),
	GET_BLOCKS(22, GetBlocksMessage::fromByteBuffer),
	BLOCKS(23, BlocksMessage::fromByteBuffer);

	public final int value;
	public final MessageProducer fromByteBufferMethod;

	private static final Map<Integer, MessageType> map = Arrays.stream(MessageType.values())
			.collect(toMap(messageType -> messageType.value, identity()));

	MessageType(int value, MessageProducer fromByteBufferMethod) {
		this.value = value;
		this.fromByteBufferMethod = fromByteBufferMethod;
	}

	public static MessageType valueOf(int value) {
		return map.get(value);
	}

	/**
	 * Attempt to read a message from byte buffer.
	 *
	 * @param byteBuffer ByteBuffer source for message
	 * @return message
	 * @throws MessageException if message data is malformed
	 */
	public Message fromByteBuffer(ByteBuffer byteBuffer) throws MessageException {
		return this.fromByteBufferMethod.fromByteBuffer(byteBuffer);
	}
}
