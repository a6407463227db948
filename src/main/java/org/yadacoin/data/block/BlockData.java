package org.yadacoin.data.block;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import java.util.Arrays;
import java.util.Objects;

/**
 * Block as seen by the sync layer: its chain index, its hash and an opaque payload.
 * <p>
 * Decoding the payload into transactions belongs to consensus, not to networking.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class BlockData {

	private long index;
	private String hash;
	private byte[] payload;

	// For JAXB
	protected BlockData() {
	}

	public BlockData(long index, String hash, byte[] payload) {
		this.index = index;
		this.hash = hash;
		this.payload = payload != null ? payload : new byte[0];
	}

	public long getIndex() {
		return this.index;
	}

	public String getHash() {
		return this.hash;
	}

	public byte[] getPayload() {
		return this.payload;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof BlockData))
			return false;

		BlockData otherBlockData = (BlockData) other;
		return this.index == otherBlockData.index
				&& Objects.equals(this.hash, otherBlockData.hash)
				&& Arrays.equals(this.payload, otherBlockData.payload);
	}

	@Override
	public int hashCode() {
		return Long.hashCode(this.index);
	}

	@Override
	public String toString() {
		return String.format("block %d (%s)", this.index, this.hash);
	}

}
