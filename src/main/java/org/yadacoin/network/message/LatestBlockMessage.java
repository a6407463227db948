package org.yadacoin.network.message;

import org.yadacoin.data.block.BlockData;
import org.yadacoin.transform.TransformationException;
import org.yadacoin.utils.Serialization;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Sender's chain tip, sent in reply to GET_LATEST_BLOCK and gossiped after each import.
 */
public class LatestBlockMessage extends Message {

	private final BlockData blockData;

	public LatestBlockMessage(BlockData blockData) {
		super(MessageType.LATEST_BLOCK);

		this.blockData = blockData;

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		try {
			Serialization.serializeBlockData(bytes, blockData);
		} catch (IOException e) {
			throw new AssertionError("IOException shouldn't occur with ByteArrayOutputStream");
		}

		setDataBytes(bytes.toByteArray());
	}

	public BlockData getBlockData() {
		return this.blockData;
	}

	public static Message fromByteBuffer(ByteBuffer bytes) throws MessageException {
		try {
			return new LatestBlockMessage(Serialization.deserializeBlockData(bytes));
		} catch (TransformationException e) {
			throw new MessageException(e.getMessage(), e);
		}
	}

}
