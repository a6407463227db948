package org.yadacoin.utils;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import org.yadacoin.crypto.Identity;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.role.PeerRole;
import org.yadacoin.transform.TransformationException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public class Serialization {

	/** Maximum size of any single serialized string, in bytes. */
	public static final int MAX_STRING_SIZE = 1024;

	/** Maximum size of an opaque block payload, in bytes. */
	public static final int MAX_BLOCK_PAYLOAD_SIZE = 4 * 1024 * 1024;

	private Serialization() {
		/* Do not instantiate */
	}

	public static void serializeSizedString(ByteArrayOutputStream bytes, String string) throws IOException {
		byte[] stringBytes = string.getBytes(StandardCharsets.UTF_8);
		bytes.write(Ints.toByteArray(stringBytes.length));
		bytes.write(stringBytes);
	}

	public static String deserializeSizedString(ByteBuffer byteBuffer, int maxSize) throws TransformationException {
		int size = byteBuffer.getInt();
		if (size < 0 || size > maxSize)
			throw new TransformationException("Serialized string too long");

		if (size > byteBuffer.remaining())
			throw new TransformationException("Byte data too short for serialized string");

		byte[] bytes = new byte[size];
		byteBuffer.get(bytes);

		return new String(bytes, StandardCharsets.UTF_8);
	}

	/**
	 * Nullable variant of {@link #serializeSizedString(ByteArrayOutputStream, String)}.
	 * <p>
	 * Null is written as a zero length, so blank strings come back as null.
	 */
	public static void serializeSizedStringV2(ByteArrayOutputStream bytes, String string) throws IOException {
		if (string == null || string.isEmpty()) {
			bytes.write(Ints.toByteArray(0));
			return;
		}

		serializeSizedString(bytes, string);
	}

	public static String deserializeSizedStringV2(ByteBuffer byteBuffer, int maxSize) throws TransformationException {
		String string = deserializeSizedString(byteBuffer, maxSize);
		return string.isEmpty() ? null : string;
	}

	public static void serializeIdentity(ByteArrayOutputStream bytes, Identity identity) throws IOException {
		serializeSizedString(bytes, identity.getUsername());
		serializeSizedString(bytes, identity.getUsernameSignature());
		serializeSizedString(bytes, identity.getPublicKey());
	}

	public static Identity deserializeIdentity(ByteBuffer byteBuffer) throws TransformationException {
		String username = deserializeSizedString(byteBuffer, MAX_STRING_SIZE);
		String usernameSignature = deserializeSizedString(byteBuffer, MAX_STRING_SIZE);
		String publicKey = deserializeSizedString(byteBuffer, MAX_STRING_SIZE);

		if (usernameSignature.isEmpty())
			throw new TransformationException("Identity without username signature");

		return new Identity(username, usernameSignature, publicKey);
	}

	public static void serializeRole(ByteArrayOutputStream bytes, PeerRole role) throws IOException {
		serializeSizedString(bytes, role.name());
	}

	public static PeerRole deserializeRole(ByteBuffer byteBuffer) throws TransformationException {
		String roleName = deserializeSizedString(byteBuffer, MAX_STRING_SIZE);

		try {
			return PeerRole.valueOf(roleName);
		} catch (IllegalArgumentException e) {
			throw new TransformationException("Unknown peer role " + roleName);
		}
	}

	/**
	 * Peer records travel with the sender's view of their rid. Receivers recompute their own.
	 */
	public static void serializePeerData(ByteArrayOutputStream bytes, PeerData peerData, String rid) throws IOException {
		serializeRole(bytes, peerData.getRole());
		serializeSizedString(bytes, peerData.getHost());
		bytes.write(Ints.toByteArray(peerData.getPort()));
		serializeIdentity(bytes, peerData.getIdentity());
		serializeSizedStringV2(bytes, rid);
		serializeSizedStringV2(bytes, peerData.getSeed());
		serializeSizedStringV2(bytes, peerData.getSeedGateway());
		serializeSizedStringV2(bytes, peerData.getAddress());
	}

	public static PeerData deserializePeerData(ByteBuffer byteBuffer) throws TransformationException {
		PeerRole role = deserializeRole(byteBuffer);
		String host = deserializeSizedString(byteBuffer, MAX_STRING_SIZE);
		int port = byteBuffer.getInt();
		Identity identity = deserializeIdentity(byteBuffer);
		// Sender's rid is informational only
		deserializeSizedStringV2(byteBuffer, MAX_STRING_SIZE);
		String seed = deserializeSizedStringV2(byteBuffer, MAX_STRING_SIZE);
		String seedGateway = deserializeSizedStringV2(byteBuffer, MAX_STRING_SIZE);
		String address = deserializeSizedStringV2(byteBuffer, MAX_STRING_SIZE);

		if (port <= 0 || port > 65535)
			throw new TransformationException("Invalid peer port " + port);

		return new PeerData(host, port, identity, role, seed, seedGateway, address);
	}

	public static void serializeBlockData(ByteArrayOutputStream bytes, BlockData blockData) throws IOException {
		bytes.write(Longs.toByteArray(blockData.getIndex()));
		serializeSizedStringV2(bytes, blockData.getHash());

		byte[] payload = blockData.getPayload();
		bytes.write(Ints.toByteArray(payload.length));
		bytes.write(payload);
	}

	public static BlockData deserializeBlockData(ByteBuffer byteBuffer) throws TransformationException {
		long index = byteBuffer.getLong();
		String hash = deserializeSizedStringV2(byteBuffer, MAX_STRING_SIZE);

		int payloadLength = byteBuffer.getInt();
		if (payloadLength < 0 || payloadLength > MAX_BLOCK_PAYLOAD_SIZE || payloadLength > byteBuffer.remaining())
			throw new TransformationException("Invalid block payload length " + payloadLength);

		byte[] payload = new byte[payloadLength];
		byteBuffer.get(payload);

		return new BlockData(index, hash, payload);
	}

}
