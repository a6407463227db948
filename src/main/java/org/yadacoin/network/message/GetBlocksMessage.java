package org.yadacoin.network.message;

import com.google.common.primitives.Longs;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Request for blocks with <tt>startIndex &lt;= index &lt; endIndex</tt>.
 * Responders cap the reply at their max blocks per message.
 */
public class GetBlocksMessage extends Message {

	private final long startIndex;
	private final long endIndex;

	public GetBlocksMessage(long startIndex, long endIndex) {
		super(MessageType.GET_BLOCKS);

		this.startIndex = startIndex;
		this.endIndex = endIndex;

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		try {
			bytes.write(Longs.toByteArray(this.startIndex));
			bytes.write(Longs.toByteArray(this.endIndex));
		} catch (IOException e) {
			throw new AssertionError("IOException shouldn't occur with ByteArrayOutputStream");
		}

		setDataBytes(bytes.toByteArray());
	}

	public long getStartIndex() {
		return this.startIndex;
	}

	public long getEndIndex() {
		return this.endIndex;
	}

	public static Message fromByteBuffer(ByteBuffer bytes) throws MessageException {
		if (bytes.remaining() != Long.BYTES * 2)
			return null;

		long startIndex = bytes.getLong();
		long endIndex = bytes.getLong();

		if (startIndex < 0 || endIndex < startIndex)
			throw new MessageException(String.format("Invalid block range [%d, %d)", startIndex, endIndex));

		return new GetBlocksMessage(startIndex, endIndex);
	}

	@Override
	public String toString() {
		return String.format("GET_BLOCKS [%d, %d)", this.startIndex, this.endIndex);
	}

}
