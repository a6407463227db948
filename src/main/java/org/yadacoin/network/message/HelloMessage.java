package org.yadacoin.network.message;

import com.google.common.primitives.Ints;
import org.yadacoin.crypto.Identity;
import org.yadacoin.network.role.PeerRole;
import org.yadacoin.transform.TransformationException;
import org.yadacoin.utils.Serialization;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * First message on a new connection: protocol version and the address we can be reached on,
 * plus our role and identity so the receiver can place us in its topology.
 */
public class HelloMessage extends Message {

	private final int version;
	private final String host;
	private final int port;
	private final PeerRole role;
	private final Identity identity;
	private final String address;

	public HelloMessage(int version, String host, int port, PeerRole role, Identity identity, String address) {
		super(MessageType.HELLO);

		this.version = version;
		this.host = host;
		this.port = port;
		this.role = role;
		this.identity = identity;
		this.address = address;

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		try {
			bytes.write(Ints.toByteArray(version));
			Serialization.serializeSizedString(bytes, host);
			bytes.write(Ints.toByteArray(port));
			Serialization.serializeRole(bytes, role);
			Serialization.serializeIdentity(bytes, identity);
			Serialization.serializeSizedStringV2(bytes, address);
		} catch (IOException e) {
			throw new AssertionError("IOException shouldn't occur with ByteArrayOutputStream");
		}

		setDataBytes(bytes.toByteArray());
	}

	public int getVersion() {
		return this.version;
	}

	public String getHost() {
		return this.host;
	}

	public int getPort() {
		return this.port;
	}

	public PeerRole getRole() {
		return this.role;
	}

	public Identity getIdentity() {
		return this.identity;
	}

	public String getAddress() {
		return this.address;
	}

	public static Message fromByteBuffer(ByteBuffer byteBuffer) throws MessageException {
		int version = byteBuffer.getInt();

		try {
			String host = Serialization.deserializeSizedString(byteBuffer, Serialization.MAX_STRING_SIZE);
			int port = byteBuffer.getInt();
			PeerRole role = Serialization.deserializeRole(byteBuffer);
			Identity identity = Serialization.deserializeIdentity(byteBuffer);
			String address = Serialization.deserializeSizedStringV2(byteBuffer, Serialization.MAX_STRING_SIZE);

			return new HelloMessage(version, host, port, role, identity, address);
		} catch (TransformationException e) {
			throw new MessageException(e.getMessage(), e);
		}
	}

}
