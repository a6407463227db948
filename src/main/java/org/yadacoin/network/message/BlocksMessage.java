package org.yadacoin.network.message;

import com.google.common.primitives.Ints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.transform.TransformationException;
import org.yadacoin.utils.Serialization;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BlocksMessage extends Message {

	private static final Logger LOGGER = LogManager.getLogger(BlocksMessage.class);

	public static final int MAX_BLOCKS = 10_000;

	private final List<BlockData> blocks;

	public BlocksMessage(List<BlockData> blocks) {
		super(MessageType.BLOCKS);

		this.blocks = blocks;

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		try {
			bytes.write(Ints.toByteArray(this.blocks.size()));

			for (BlockData blockData : this.blocks)
				Serialization.serializeBlockData(bytes, blockData);
		} catch (IOException e) {
			throw new AssertionError("IOException shouldn't occur with ByteArrayOutputStream");
		}

		LOGGER.trace("Total length of {} blocks is {} bytes", this.blocks.size(), bytes.size());
		setDataBytes(bytes.toByteArray());
	}

	/**
	 * Returns the longest prefix of <tt>blocks</tt> whose BLOCKS message fits within {@link Message#MAX_DATA_SIZE}.
	 */
	public static List<BlockData> fitToFrame(List<BlockData> blocks) {
		long dataSize = Integer.BYTES;

		for (int i = 0; i < blocks.size(); ++i) {
			dataSize += serializedLength(blocks.get(i));

			if (dataSize > MAX_DATA_SIZE)
				return blocks.subList(0, i);
		}

		return blocks;
	}

	private static long serializedLength(BlockData blockData) {
		String hash = blockData.getHash();
		int hashLength = hash == null ? 0 : hash.getBytes(StandardCharsets.UTF_8).length;

		return Long.BYTES + Integer.BYTES + hashLength + Integer.BYTES + blockData.getPayload().length;
	}

	public List<BlockData> getBlocks() {
		return Collections.unmodifiableList(this.blocks);
	}

	public static Message fromByteBuffer(ByteBuffer bytes) throws MessageException {
		int count = bytes.getInt();
		if (count < 0 || count > MAX_BLOCKS)
			throw new MessageException("Invalid block count in BLOCKS message: " + count);

		List<BlockData> blocks = new ArrayList<>(count);

		try {
			for (int i = 0; i < count; ++i)
				blocks.add(Serialization.deserializeBlockData(bytes));
		} catch (TransformationException e) {
			LOGGER.warn("Received garbled BLOCKS message: {}", e.getMessage());
			throw new MessageException(e.getMessage(), e);
		}

		return new BlocksMessage(blocks);
	}

	@Override
	public String toString() {
		if (this.blocks.isEmpty())
			return "BLOCKS []";

		return String.format("BLOCKS [%d..%d]", this.blocks.get(0).getIndex(), this.blocks.get(this.blocks.size() - 1).getIndex());
	}

}
