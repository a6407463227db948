package org.yadacoin.network.message;

import java.nio.ByteBuffer;

public class GetPeersMessage extends Message {

	public GetPeersMessage() {
		super(MessageType.GET_PEERS);

		setDataBytes(EMPTY_DATA_BYTES);
	}

	public static Message fromByteBuffer(ByteBuffer bytes) throws MessageException {
		return new GetPeersMessage();
	}

}
