package org.yadacoin.network.message;

import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Network message serialization and deserialization.
 * <p>
 * Wire format:
 * <ul>
 * <li>4-byte magic</li>
 * <li>4-byte message type</li>
 * <li>4-byte data length</li>
 * <li>4-byte data checksum, first four bytes of SHA-256 (only present if data length &gt; 0)</li>
 * <li>variable-length data</li>
 * </ul>
 * All integers are big-endian.
 */
public abstract class Message {

	/** "YADA" */
	public static final byte[] MESSAGE_MAGIC = new byte[] { 0x59, 0x41, 0x44, 0x41 };

	private static final int MAGIC_LENGTH = 4;
	private static final int TYPE_LENGTH = 4;
	private static final int DATA_SIZE_LENGTH = 4;
	private static final int CHECKSUM_LENGTH = 4;

	public static final int MAX_DATA_SIZE = 10 * 1024 * 1024; // 10MB

	protected static final byte[] EMPTY_DATA_BYTES = new byte[0];

	private final MessageType type;

	/** Serialized outgoing message data. Expected to be written to by subclass. */
	protected byte[] dataBytes;
	/** Serialized outgoing message checksum. Expected to be written to by subclass. */
	protected byte[] checksumBytes;

	protected Message(MessageType type) {
		this.type = type;
	}

	public MessageType getType() {
		return this.type;
	}

	/**
	 * Reads one framed message from <tt>in</tt>, blocking until complete.
	 *
	 * @throws IOException if stream fails, or framing is lost (bad magic, oversized frame)
	 * @throws MessageException if frame was read but its payload is unusable; stream remains in sync
	 */
	public static Message fromStream(DataInputStream in) throws IOException, MessageException {
		byte[] magic = new byte[MAGIC_LENGTH];
		in.readFully(magic);
		if (!Arrays.equals(magic, MESSAGE_MAGIC))
			throw new IOException("Message magic incorrect");

		int typeValue = in.readInt();

		int dataSize = in.readInt();
		if (dataSize < 0 || dataSize > MAX_DATA_SIZE)
			throw new IOException("Declared data length " + dataSize + " larger than max allowed " + MAX_DATA_SIZE);

		byte[] checksum = null;
		byte[] data = EMPTY_DATA_BYTES;
		if (dataSize > 0) {
			checksum = new byte[CHECKSUM_LENGTH];
			in.readFully(checksum);

			data = new byte[dataSize];
			in.readFully(data);
		}

		return parse(typeValue, checksum, data);
	}

	/** Parses a complete framed message held in <tt>bytes</tt>. */
	public static Message fromBytes(byte[] bytes) throws MessageException {
		ByteBuffer byteBuffer = ByteBuffer.wrap(bytes);

		try {
			byte[] magic = new byte[MAGIC_LENGTH];
			byteBuffer.get(magic);
			if (!Arrays.equals(magic, MESSAGE_MAGIC))
				throw new MessageException("Message magic incorrect");

			int typeValue = byteBuffer.getInt();

			int dataSize = byteBuffer.getInt();
			if (dataSize < 0 || dataSize > MAX_DATA_SIZE)
				throw new MessageException("Declared data length " + dataSize + " larger than max allowed " + MAX_DATA_SIZE);

			byte[] checksum = null;
			byte[] data = EMPTY_DATA_BYTES;
			if (dataSize > 0) {
				checksum = new byte[CHECKSUM_LENGTH];
				byteBuffer.get(checksum);

				data = new byte[dataSize];
				byteBuffer.get(data);
			}

			return parse(typeValue, checksum, data);
		} catch (BufferUnderflowException e) {
			throw new MessageException("Message truncated", e);
		}
	}

	private static Message parse(int typeValue, byte[] checksum, byte[] data) throws MessageException {
		MessageType messageType = MessageType.valueOf(typeValue);
		if (messageType == null)
			throw new MessageException(String.format("Received unknown message type [%d]", typeValue));

		if (checksum != null && !Arrays.equals(checksum, generateChecksum(data)))
			throw new MessageException(String.format("%s message checksum incorrect", messageType.name()));

		ByteBuffer dataSlice = ByteBuffer.wrap(data).asReadOnlyBuffer();

		try {
			Message message = messageType.fromByteBuffer(dataSlice);
			if (message == null)
				throw new MessageException(String.format("Malformed %s message", messageType.name()));

			return message;
		} catch (BufferUnderflowException e) {
			throw new MessageException(String.format("Byte data too short for %s message", messageType.name()), e);
		}
	}

	protected static byte[] generateChecksum(byte[] data) {
		return Arrays.copyOfRange(Hashing.sha256().hashBytes(data).asBytes(), 0, CHECKSUM_LENGTH);
	}

	public byte[] toBytes() throws MessageException {
		if (this.dataBytes == null)
			throw new MessageException(String.format("%s message has no serialized data", this.type.name()));

		ByteArrayOutputStream bytes = new ByteArrayOutputStream(MAGIC_LENGTH + TYPE_LENGTH + DATA_SIZE_LENGTH
				+ CHECKSUM_LENGTH + this.dataBytes.length);

		try {
			bytes.write(MESSAGE_MAGIC);
			bytes.write(Ints.toByteArray(this.type.value));
			bytes.write(Ints.toByteArray(this.dataBytes.length));

			if (this.dataBytes.length > 0) {
				bytes.write(this.checksumBytes);
				bytes.write(this.dataBytes);
			}
		} catch (IOException e) {
			throw new AssertionError("IOException shouldn't occur with ByteArrayOutputStream");
		}

		if (bytes.size() > MAGIC_LENGTH + TYPE_LENGTH + DATA_SIZE_LENGTH + CHECKSUM_LENGTH + MAX_DATA_SIZE)
			throw new MessageException(String.format("About to send %s message larger than allowed", this.type.name()));

		return bytes.toByteArray();
	}

	/** Sets serialized outgoing data and its checksum. */
	protected void setDataBytes(byte[] dataBytes) {
		this.dataBytes = dataBytes;
		this.checksumBytes = dataBytes.length > 0 ? generateChecksum(dataBytes) : null;
	}

	@Override
	public String toString() {
		return this.type.name();
	}

}
