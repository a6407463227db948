package org.yadacoin.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.controller.ChainReader;
import org.yadacoin.controller.Consensus;
import org.yadacoin.controller.Synchronizer;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.message.LatestBlockMessage;
import org.yadacoin.network.task.PeerConnectTask;
import org.yadacoin.network.transport.Connection;
import org.yadacoin.network.transport.Transport;
import org.yadacoin.settings.Settings;
import org.yadacoin.utils.NamedThreadFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Ties a node's networking together: known peers, connection management, per-connection sync sessions
 * and block gossip.
 */
public class Network {

	private static final Logger LOGGER = LogManager.getLogger(Network.class);

	private final Settings settings;
	private final Transport transport;
	private final PeerData self;

	private final PeerDirectory peerDirectory;
	private final ConnectionManager connectionManager;
	private final Synchronizer synchronizer;
	private final ChainReader chainReader;

	private final ScheduledExecutorService scheduler;
	private final ExecutorService connectionExecutor;

	private final List<SyncSession> sessions = new CopyOnWriteArrayList<>();

	private volatile boolean isShuttingDown = false;

	public Network(Settings settings, Transport transport, Consensus consensus, ChainReader chainReader, Clock clock) {
		this.settings = settings;
		this.transport = transport;
		this.self = settings.getSelf();
		this.chainReader = chainReader;

		this.peerDirectory = new PeerDirectory(this.self.getIdentity().getUsernameSignature());
		GatewaySelector gatewaySelector = new GatewaySelector(settings.getEpochMillis(), settings.getRotationIntervalMillis(), clock);
		this.connectionManager = new ConnectionManager(this.self, this.peerDirectory, gatewaySelector, this::connectPeer);
		this.synchronizer = new Synchronizer(consensus, chainReader);

		this.scheduler = Executors.newScheduledThreadPool(1, new NamedThreadFactory("Network-scheduler"));
		this.connectionExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("PeerConnect"));

		int bootstrapCount = this.peerDirectory.mergePeers(settings.getBootstrapPeers());
		LOGGER.debug("Starting with {} known peers", bootstrapCount);
	}

	public Network(Settings settings, Transport transport, Consensus consensus, ChainReader chainReader) {
		this(settings, transport, consensus, chainReader, Clock.systemUTC());
	}

	// Getters

	public Settings getSettings() {
		return this.settings;
	}

	public PeerData getSelf() {
		return this.self;
	}

	public PeerDirectory getPeerDirectory() {
		return this.peerDirectory;
	}

	public ConnectionManager getConnectionManager() {
		return this.connectionManager;
	}

	public Synchronizer getSynchronizer() {
		return this.synchronizer;
	}

	public ChainReader getChainReader() {
		return this.chainReader;
	}

	ScheduledExecutorService getScheduler() {
		return this.scheduler;
	}

	public List<SyncSession> getSessions() {
		return new ArrayList<>(this.sessions);
	}

	// Lifecycle

	public void start() throws IOException {
		LOGGER.info("Starting {} node {} ({})", this.self.getRole(), this.self.getIdentity(), this.self);

		this.transport.listen(this.settings.getBindAddress(), this.settings.getListenPort(), this::onInboundConnection);

		this.scheduler.scheduleWithFixedDelay(this::connectTick, 0L, this.settings.getConnectInterval(), TimeUnit.MILLISECONDS);
	}

	public void shutdown() {
		this.isShuttingDown = true;

		this.scheduler.shutdownNow();
		this.transport.shutdown();

		for (SyncSession session : this.sessions)
			session.close("shutting down");

		this.connectionExecutor.shutdownNow();
		try {
			if (!this.connectionExecutor.awaitTermination(5000L, TimeUnit.MILLISECONDS))
				LOGGER.warn("Peer connection threads did not terminate");
		} catch (InterruptedException e) {
			LOGGER.warn("Interrupted while waiting for peer connection threads to terminate");
			Thread.currentThread().interrupt();
		}
	}

	public boolean isShuttingDown() {
		return this.isShuttingDown;
	}

	// Outbound

	/** One connection top-up round. Runs periodically once started. */
	public void connectTick() {
		if (this.isShuttingDown)
			return;

		try {
			int attempts = this.connectionManager.ensurePeersConnected();
			if (attempts > 0)
				LOGGER.debug("Issued {} connection attempt{}", attempts, (attempts != 1 ? "s" : ""));
		} catch (RuntimeException e) {
			// Keep ticking
			LOGGER.warn("Unexpected exception while connecting peers", e);
		}
	}

	private void connectPeer(PeerData peerData) {
		try {
			this.connectionExecutor.execute(new PeerConnectTask(this, peerData));
		} catch (RejectedExecutionException e) {
			this.connectionManager.onConnectFailed(peerData, false);
		}
	}

	/**
	 * Connects to <tt>peerData</tt> on the calling thread and starts a session on success.
	 *
	 * @return <tt>true</tt> if connected
	 */
	public boolean connectPeerNow(PeerData peerData) {
		Connection connection;
		try {
			connection = this.transport.connect(peerData);
		} catch (IOException e) {
			LOGGER.debug("Connection failed to {} {}: {}", peerData.getRole(), peerData, e.getMessage());
			this.connectionManager.onConnectFailed(peerData, false);
			return false;
		}

		if (this.isShuttingDown) {
			connection.close("shutting down");
			this.connectionManager.onConnectFailed(peerData, false);
			return false;
		}

		LOGGER.debug("[{}] Connected to {} {}", connection.getId(), peerData.getRole(), peerData);
		this.connectionManager.onConnected(peerData);

		try {
			startSession(new SyncSession(this, connection, peerData));
		} catch (RuntimeException e) {
			connection.close("session start failed");
			throw e;
		}

		return true;
	}

	// Inbound

	private void onInboundConnection(Connection connection) {
		if (this.isShuttingDown) {
			connection.close("shutting down");
			return;
		}

		try {
			startSession(new SyncSession(this, connection, null));
		} catch (RuntimeException e) {
			LOGGER.warn(String.format("[%s] Unable to start session for inbound connection from %s", connection.getId(), connection.getRemoteAddress()), e);
			connection.close("session start failed");
		}
	}

	private void startSession(SyncSession session) {
		this.sessions.add(session);

		try {
			session.start();
		} catch (RuntimeException e) {
			this.sessions.remove(session);
			throw e;
		}
	}

	void onSessionClosed(SyncSession session) {
		this.sessions.remove(session);
	}

	// Gossip

	/** Announces a newly imported block to every established session except <tt>origin</tt>. */
	public void broadcastBlock(BlockData blockData, SyncSession origin) {
		LatestBlockMessage message = new LatestBlockMessage(blockData);

		for (SyncSession session : this.sessions) {
			if (this.isShuttingDown)
				return;

			if (session == origin || !session.isEstablished())
				continue;

			session.sendMessage(message);
		}
	}

}
