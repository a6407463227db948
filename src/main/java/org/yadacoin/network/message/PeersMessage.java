package org.yadacoin.network.message;

import com.google.common.primitives.Ints;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.transform.TransformationException;
import org.yadacoin.utils.Serialization;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * List of peers known to the sender.
 */
public class PeersMessage extends Message {

	public static final int MAX_PEERS_PER_MESSAGE = 1000;

	private final List<PeerData> peers;

	/**
	 * @param peers peers to announce
	 * @param localSignature sender's username signature, used to attach the sender's view of each rid
	 */
	public PeersMessage(List<PeerData> peers, String localSignature) {
		super(MessageType.PEERS);

		this.peers = peers;

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		try {
			bytes.write(Ints.toByteArray(peers.size()));

			for (PeerData peerData : peers)
				Serialization.serializePeerData(bytes, peerData, peerData.getRid(localSignature));
		} catch (IOException e) {
			throw new AssertionError("IOException shouldn't occur with ByteArrayOutputStream");
		}

		setDataBytes(bytes.toByteArray());
	}

	private PeersMessage(List<PeerData> peers) {
		super(MessageType.PEERS);

		this.peers = peers;
	}

	public List<PeerData> getPeers() {
		return Collections.unmodifiableList(this.peers);
	}

	public static Message fromByteBuffer(ByteBuffer bytes) throws MessageException {
		int count = bytes.getInt();
		if (count < 0 || count > MAX_PEERS_PER_MESSAGE)
			throw new MessageException("Too many peers in PEERS message: " + count);

		List<PeerData> peers = new ArrayList<>(count);

		try {
			for (int i = 0; i < count; ++i)
				peers.add(Serialization.deserializePeerData(bytes));
		} catch (TransformationException e) {
			throw new MessageException(e.getMessage(), e);
		}

		return new PeersMessage(peers);
	}

}
