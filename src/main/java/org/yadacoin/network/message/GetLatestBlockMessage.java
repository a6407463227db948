package org.yadacoin.network.message;

import java.nio.ByteBuffer;

public class GetLatestBlockMessage extends Message {

	public GetLatestBlockMessage() {
		super(MessageType.GET_LATEST_BLOCK);

		setDataBytes(EMPTY_DATA_BYTES);
	}

	public static Message fromByteBuffer(ByteBuffer bytes) throws MessageException {
		return new GetLatestBlockMessage();
	}

}
