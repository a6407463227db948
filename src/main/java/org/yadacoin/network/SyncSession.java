package org.yadacoin.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.controller.ChainReader;
import org.yadacoin.controller.Synchronizer;
import org.yadacoin.controller.Synchronizer.ImportResult;
import org.yadacoin.controller.Synchronizer.SynchronizationResult;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.message.BlocksMessage;
import org.yadacoin.network.message.GetBlocksMessage;
import org.yadacoin.network.message.GetLatestBlockMessage;
import org.yadacoin.network.message.GetPeersMessage;
import org.yadacoin.network.message.HelloMessage;
import org.yadacoin.network.message.LatestBlockMessage;
import org.yadacoin.network.message.Message;
import org.yadacoin.network.message.PeersMessage;
import org.yadacoin.network.transport.Connection;
import org.yadacoin.network.transport.ConnectionListener;
import org.yadacoin.utils.NamedThreadFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Protocol state machine for one connection: handshake, peer exchange, and chain sync with the remote.
 * <p>
 * All events for a session, including its teardown, run in order on the session's own thread,
 * so a block import in progress always finishes before the session releases its connection slot.
 */
public class SyncSession implements ConnectionListener {

	private static final Logger LOGGER = LogManager.getLogger(SyncSession.class);

	public enum State {
		IDLE, HANDSHAKING, LISTENING, SYNCING, DISCONNECTED;
	}

	private final Network network;
	private final Connection connection;
	private final boolean isOutbound;
	private final ExecutorService executor;

	/** Known up front for outbound sessions, learned from hello for inbound ones. */
	private volatile PeerData remotePeer;
	/** Whether an inbound peer holds an admission slot. */
	private boolean isAdmitted = false;

	private volatile State state = State.IDLE;
	private ScheduledFuture<?> handshakeTimeoutFuture;

	public SyncSession(Network network, Connection connection, PeerData remotePeer) {
		this.network = network;
		this.connection = connection;
		this.isOutbound = connection.isOutbound();
		this.remotePeer = remotePeer;
		this.executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("SyncSession-" + connection.getId()));
	}

	public State getState() {
		return this.state;
	}

	public boolean isOutbound() {
		return this.isOutbound;
	}

	public PeerData getRemotePeer() {
		return this.remotePeer;
	}

	public Connection getConnection() {
		return this.connection;
	}

	/** Whether this session has completed its handshake and takes part in block gossip. */
	public boolean isEstablished() {
		State currentState = this.state;
		return currentState == State.LISTENING || currentState == State.SYNCING;
	}

	public void start() {
		this.state = State.HANDSHAKING;

		this.connection.setListener(this);
		this.connection.start();

		this.handshakeTimeoutFuture = this.network.getScheduler().schedule(() -> submit(this::onHandshakeTimeout),
				this.network.getSettings().getHandshakeTimeout(), TimeUnit.MILLISECONDS);

		if (this.isOutbound)
			submit(() -> {
				sendMessage(buildHelloMessage());
				sendMessage(new GetPeersMessage());
			});
	}

	/** Closes the underlying connection. Teardown follows asynchronously. */
	public void close(String reason) {
		this.connection.close(reason);
	}

	/**
	 * Attempts to send <tt>message</tt>. Connection is closed on failure.
	 *
	 * @return <tt>true</tt> if message was sent
	 */
	public boolean sendMessage(Message message) {
		try {
			this.connection.send(message);
			return true;
		} catch (IOException e) {
			LOGGER.debug("[{}] Failed to send {} to {}: {}", this.connection.getId(), message, describeRemote(), e.getMessage());
			this.connection.close("send failure");
			return false;
		}
	}

	// Connection events, handed over to our own thread

	@Override
	public void onMessage(Connection connection, Message message) {
		submit(() -> handleMessage(message));
	}

	@Override
	public void onClosed(Connection connection) {
		if (!submit(this::teardown))
			teardown();
	}

	private boolean submit(Runnable runnable) {
		try {
			this.executor.execute(runnable);
			return true;
		} catch (RejectedExecutionException e) {
			// Already torn down
			return false;
		}
	}

	private void handleMessage(Message message) {
		if (this.state == State.DISCONNECTED)
			return;

		// Inbound peers must introduce themselves first
		if (!this.isOutbound && this.remotePeer == null && !(message instanceof HelloMessage)) {
			LOGGER.debug("[{}] Dropping {} received before hello", this.connection.getId(), message);
			return;
		}

		try {
			switch (message.getType()) {
				case HELLO:
					onHelloMessage((HelloMessage) message);
					break;

				case GET_PEERS:
					onGetPeersMessage();
					break;

				case PEERS:
					onPeersMessage((PeersMessage) message);
					break;

				case GET_LATEST_BLOCK:
					onGetLatestBlockMessage();
					break;

				case LATEST_BLOCK:
					onLatestBlockMessage((LatestBlockMessage) message);
					break;

				case GET_BLOCKS:
					onGetBlocksMessage((GetBlocksMessage) message);
					break;

				case BLOCKS:
					onBlocksMessage((BlocksMessage) message);
					break;

				default:
					LOGGER.debug("[{}] Unhandled {} message from {}", this.connection.getId(), message.getType(), describeRemote());
					break;
			}
		} catch (RuntimeException e) {
			LOGGER.warn(String.format("[%s] Unexpected exception processing %s from %s", this.connection.getId(), message, describeRemote()), e);
		}
	}

	// Handshake

	private HelloMessage buildHelloMessage() {
		PeerData self = this.network.getSelf();
		return new HelloMessage(this.network.getSettings().getProtocolVersion(), self.getHost(), self.getPort(),
				self.getRole(), self.getIdentity(), self.getAddress());
	}

	private void onHelloMessage(HelloMessage helloMessage) {
		if (helloMessage.getVersion() != this.network.getSettings().getProtocolVersion()) {
			LOGGER.debug("[{}] Incompatible protocol version {} from {}", this.connection.getId(), helloMessage.getVersion(), describeRemote());
			this.connection.close("incompatible protocol version " + helloMessage.getVersion());
			return;
		}

		PeerData announced = new PeerData(helloMessage.getHost(), helloMessage.getPort(), helloMessage.getIdentity(),
				helloMessage.getRole(), null, null, helloMessage.getAddress());

		if (this.isOutbound) {
			if (!this.remotePeer.getIdentity().matches(announced.getIdentity())) {
				LOGGER.info("[{}] {} announced a different identity", this.connection.getId(), this.remotePeer);
				failHandshake();
				return;
			}

			if (!announced.hasRoutableHost() && this.remotePeer.hasRoutableHost()) {
				LOGGER.debug("[{}] Keeping address {}, announced {} is not routable", this.connection.getId(), this.remotePeer, announced);
				return;
			}

			// Refresh reachable address
			this.network.getPeerDirectory().mergePeer(this.remotePeer.withHostAndPort(announced.getHost(), announced.getPort()));
			return;
		}

		if (this.remotePeer != null) {
			LOGGER.debug("[{}] Ignoring repeated hello from {}", this.connection.getId(), this.remotePeer);
			return;
		}

		if (!this.network.getConnectionManager().acceptInbound(announced)) {
			this.connection.close("inbound " + announced.getRole() + " refused");
			return;
		}

		this.isAdmitted = true;
		this.remotePeer = announced;
		cancelHandshakeTimeout();

		this.network.getPeerDirectory().mergePeer(announced);

		LOGGER.debug("[{}] Accepted inbound {} {}", this.connection.getId(), announced.getRole(), announced);
		this.state = State.LISTENING;

		sendMessage(buildHelloMessage());
	}

	private void onHandshakeTimeout() {
		if (this.state != State.HANDSHAKING)
			return;

		LOGGER.debug("[{}] Handshake with {} timed out", this.connection.getId(), describeRemote());

		if (this.isOutbound)
			failHandshake();
		else
			this.connection.close("handshake timeout");
	}

	private void failHandshake() {
		this.network.getConnectionManager().onHandshakeFailed(this.remotePeer);
		this.connection.close("handshake failed");
	}

	private void cancelHandshakeTimeout() {
		if (this.handshakeTimeoutFuture != null)
			this.handshakeTimeoutFuture.cancel(false);
	}

	// Peer exchange

	/** Replies with ourself followed by every peer we know. */
	private void onGetPeersMessage() {
		List<PeerData> peers = new ArrayList<>();
		peers.add(this.network.getSelf());
		peers.addAll(this.network.getPeerDirectory().getAllPeers());

		if (peers.size() > PeersMessage.MAX_PEERS_PER_MESSAGE)
			peers = peers.subList(0, PeersMessage.MAX_PEERS_PER_MESSAGE);

		sendMessage(new PeersMessage(peers, this.network.getPeerDirectory().getLocalSignature()));
	}

	private void onPeersMessage(PeersMessage peersMessage) {
		int changed = this.network.getPeerDirectory().mergePeers(peersMessage.getPeers());
		LOGGER.debug("[{}] Merged {} of {} peers from {}", this.connection.getId(), changed, peersMessage.getPeers().size(), describeRemote());

		if (!this.isOutbound || this.state != State.HANDSHAKING)
			return;

		cancelHandshakeTimeout();
		LOGGER.debug("[{}] Handshake completed with {} {}", this.connection.getId(), this.remotePeer.getRole(), this.remotePeer);
		this.state = State.LISTENING;

		// Remote's tip is our sync starting point
		sendMessage(new GetLatestBlockMessage());
	}

	// Chain sync, requesting side

	private void onLatestBlockMessage(LatestBlockMessage latestBlockMessage) {
		if (!isEstablished())
			return;

		Synchronizer synchronizer = this.network.getSynchronizer();
		if (synchronizer.isSynchronizing()) {
			LOGGER.trace("[{}] Ignoring latest block from {}: already syncing", this.connection.getId(), this.remotePeer);
			return;
		}

		BlockData blockData = latestBlockMessage.getBlockData();
		long ourHeight = synchronizer.getChainHeight();

		if (blockData.getIndex() == ourHeight + 1) {
			ImportResult importResult = synchronizer.importNextBlock(blockData, this.remotePeer);

			if (importResult.getResult() == SynchronizationResult.OK)
				this.network.broadcastBlock(importResult.getLastImported(), this);

			return;
		}

		if (blockData.getIndex() > ourHeight + 1) {
			LOGGER.debug("[{}] Missing blocks between {} and {}, asking {}", this.connection.getId(), ourHeight, blockData.getIndex(), this.remotePeer);
			requestBlocksFrom(ourHeight + 1);
			return;
		}

		LOGGER.trace("[{}] Ignoring old block {} from {}", this.connection.getId(), blockData.getIndex(), this.remotePeer);
	}

	private void onBlocksMessage(BlocksMessage blocksMessage) {
		if (!isEstablished())
			return;

		List<BlockData> blocks = blocksMessage.getBlocks();
		if (blocks.isEmpty()) {
			this.state = State.LISTENING;
			return;
		}

		ImportResult importResult = this.network.getSynchronizer().importBlocks(blocks, this.remotePeer);

		if (importResult.getImportedCount() == 0) {
			LOGGER.debug("[{}] Import from {} aborted at {}", this.connection.getId(), this.remotePeer, importResult.getChainHeight());
			this.state = State.LISTENING;
			return;
		}

		this.network.broadcastBlock(importResult.getLastImported(), this);

		// Ask for the potential next batch
		requestBlocksFrom(importResult.getChainHeight() + 1);
	}

	private void requestBlocksFrom(long startIndex) {
		int maxBlocks = this.network.getSettings().getMaxBlocksPerMessage();

		if (sendMessage(new GetBlocksMessage(startIndex, startIndex + maxBlocks)))
			this.state = State.SYNCING;
	}

	// Chain sync, responding side

	private void onGetLatestBlockMessage() {
		BlockData latestBlock = this.network.getChainReader().getLatestBlock();
		if (latestBlock == null)
			return;

		sendMessage(new LatestBlockMessage(latestBlock));
	}

	private void onGetBlocksMessage(GetBlocksMessage getBlocksMessage) {
		int maxBlocks = this.network.getSettings().getMaxBlocksPerMessage();
		long startIndex = getBlocksMessage.getStartIndex();
		long endIndex = Math.min(getBlocksMessage.getEndIndex(), startIndex + maxBlocks);

		ChainReader chainReader = this.network.getChainReader();
		List<BlockData> blocks = endIndex > startIndex ? chainReader.getBlocks(startIndex, endIndex) : Collections.emptyList();

		List<BlockData> framedBlocks = BlocksMessage.fitToFrame(blocks);
		if (framedBlocks.size() < blocks.size()) {
			LOGGER.debug("[{}] Trimmed reply to {} of {} blocks to fit message size", this.connection.getId(), framedBlocks.size(), blocks.size());
			blocks = framedBlocks;
		}

		LOGGER.trace("[{}] Sending {} blocks from {} to {}", this.connection.getId(), blocks.size(), startIndex, describeRemote());
		sendMessage(new BlocksMessage(blocks));
	}

	// Teardown

	private void teardown() {
		if (this.state == State.DISCONNECTED)
			return;

		this.state = State.DISCONNECTED;
		cancelHandshakeTimeout();

		if (this.isOutbound)
			this.network.getConnectionManager().onDisconnected(this.remotePeer);
		else if (this.isAdmitted)
			this.network.getConnectionManager().releaseInbound(this.remotePeer);

		this.network.onSessionClosed(this);
		this.executor.shutdown();

		LOGGER.debug("[{}] Session with {} closed", this.connection.getId(), describeRemote());
	}

	private String describeRemote() {
		PeerData peerData = this.remotePeer;
		return peerData != null ? peerData.toString() : this.connection.getRemoteAddress();
	}

	@Override
	public String toString() {
		return String.format("[%s] %s %s", this.connection.getId(), describeRemote(), this.state);
	}

}
