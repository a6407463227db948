package org.yadacoin.test.network;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.Network;
import org.yadacoin.network.SyncSession;
import org.yadacoin.network.message.BlocksMessage;
import org.yadacoin.network.message.GetBlocksMessage;
import org.yadacoin.network.message.GetLatestBlockMessage;
import org.yadacoin.network.message.GetPeersMessage;
import org.yadacoin.network.message.HelloMessage;
import org.yadacoin.network.message.LatestBlockMessage;
import org.yadacoin.network.message.MessageType;
import org.yadacoin.network.message.PeersMessage;
import org.yadacoin.network.role.PeerRole;
import org.yadacoin.test.common.Common;
import org.yadacoin.test.common.InMemoryExchange;
import org.yadacoin.test.common.InMemoryTransport;
import org.yadacoin.test.common.TestChain;
import org.yadacoin.test.common.TestPeer;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class SyncSessionTests {

	private InMemoryExchange exchange;
	private TestChain chain;
	private Network network;

	@Before
	public void beforeTest() {
		this.exchange = new InMemoryExchange();
		this.chain = new TestChain(10);
		this.network = new Network(Common.loadSettings("settings-seed.json"), new InMemoryTransport(this.exchange, "127.0.0.1:9000"), this.chain, this.chain);
	}

	@After
	public void afterTest() {
		this.network.shutdown();
	}

	/** Connects our node to a scripted Seed and completes the handshake. */
	private TestPeer connectRemote(String name, int port) throws Exception {
		TestPeer remote = new TestPeer(this.exchange, Common.peer(name, PeerRole.SEED, port)).listen();
		assertTrue(this.network.connectPeerNow(remote.getPeerData()));

		remote.awaitMessage(MessageType.HELLO);
		remote.awaitMessage(MessageType.GET_PEERS);
		remote.sendPeers();
		remote.awaitMessage(MessageType.GET_LATEST_BLOCK);

		return remote;
	}

	private SyncSession sessionWith(TestPeer remote) {
		for (SyncSession session : this.network.getSessions())
			if (session.getRemotePeer() != null && session.getRemotePeer().isSameHostAndPort(remote.getPeerData()))
				return session;

		throw new AssertionError("no session with " + remote.getPeerData());
	}

	@Test
	public void testOutboundHandshake() throws Exception {
		TestPeer remote = new TestPeer(this.exchange, Common.peer("remote_seed", PeerRole.SEED, 9101)).listen();
		assertTrue(this.network.connectPeerNow(remote.getPeerData()));

		HelloMessage helloMessage = remote.awaitMessage(MessageType.HELLO);
		assertEquals(2, helloMessage.getVersion());
		assertEquals(PeerRole.SEED, helloMessage.getRole());
		assertEquals("seed_node_signature", helloMessage.getIdentity().getUsernameSignature());
		assertEquals(9000, helloMessage.getPort());

		remote.awaitMessage(MessageType.GET_PEERS);
		assertEquals(SyncSession.State.HANDSHAKING, sessionWith(remote).getState());

		PeerData gossiped = Common.peer("gossiped_seed", PeerRole.SEED, 9150);
		remote.sendPeers(List.of(remote.getPeerData(), gossiped));

		remote.awaitMessage(MessageType.GET_LATEST_BLOCK);
		assertEquals(SyncSession.State.LISTENING, sessionWith(remote).getState());
		assertNotNull(this.network.getPeerDirectory().findByUsernameSignature("gossiped_seed_signature"));
		assertEquals(1, this.network.getConnectionManager().getActive(PeerRole.SEED).size());
	}

	@Test
	public void testHandshakeTimeout() throws Exception {
		TestPeer remote = new TestPeer(this.exchange, Common.peer("silent_seed", PeerRole.SEED, 9102)).listen();
		assertTrue(this.network.connectPeerNow(remote.getPeerData()));
		remote.awaitMessage(MessageType.HELLO);

		// Never send our peer list
		assertTrue(remote.awaitClosed());
		Common.waitUntil("session removed", () -> this.network.getSessions().isEmpty());

		assertTrue(this.network.getConnectionManager().isIgnored(remote.getPeerData()));
		assertTrue(this.network.getConnectionManager().getActive(PeerRole.SEED).isEmpty());
	}

	@Test
	public void testDirectImportAndGossip() throws Exception {
		TestPeer announcer = connectRemote("announcer", 9103);
		TestPeer bystander = connectRemote("bystander", 9104);

		announcer.send(new LatestBlockMessage(Common.block(11)));

		Common.waitUntil("block 11 imported", () -> this.chain.getHeight() == 11);

		LatestBlockMessage gossip = bystander.awaitMessage(MessageType.LATEST_BLOCK);
		assertEquals(11L, gossip.getBlockData().getIndex());

		// Not echoed back to where it came from
		Thread.sleep(100L);
		assertFalse(announcer.hasReceived(MessageType.LATEST_BLOCK));
	}

	@Test
	public void testRejectedAnnouncementDropped() throws Exception {
		TestPeer announcer = connectRemote("announcer", 9103);
		TestPeer bystander = connectRemote("bystander", 9104);
		this.chain.reject(11);

		announcer.send(new LatestBlockMessage(Common.block(11)));

		Thread.sleep(200L);
		assertEquals(10L, this.chain.getHeight());
		assertFalse(bystander.hasReceived(MessageType.LATEST_BLOCK));
		assertEquals(SyncSession.State.LISTENING, sessionWith(announcer).getState());
	}

	@Test
	public void testStaleAnnouncementIgnored() throws Exception {
		TestPeer announcer = connectRemote("announcer", 9103);

		announcer.send(new LatestBlockMessage(Common.block(9)));
		announcer.send(new LatestBlockMessage(Common.block(10)));

		Thread.sleep(200L);
		assertFalse(announcer.hasReceived(MessageType.GET_BLOCKS));
		assertEquals(10L, this.chain.getHeight());
	}

	@Test
	public void testGapFill() throws Exception {
		TestPeer ahead = connectRemote("ahead", 9105);
		TestPeer bystander = connectRemote("bystander", 9106);
		this.chain.reject(13);

		ahead.send(new LatestBlockMessage(Common.block(15)));

		GetBlocksMessage request = ahead.awaitMessage(MessageType.GET_BLOCKS);
		assertEquals(11L, request.getStartIndex());
		assertEquals(111L, request.getEndIndex());
		Common.waitUntil("syncing", () -> sessionWith(ahead).getState() == SyncSession.State.SYNCING);

		ahead.send(new BlocksMessage(Common.blocks(11, 13)));

		GetBlocksMessage nextRequest = ahead.awaitMessage(MessageType.GET_BLOCKS);
		assertEquals(13L, nextRequest.getStartIndex());
		assertEquals(113L, nextRequest.getEndIndex());
		assertEquals(12L, this.chain.getHeight());

		// Last imported block is gossiped
		LatestBlockMessage gossip = bystander.awaitMessage(MessageType.LATEST_BLOCK);
		assertEquals(12L, gossip.getBlockData().getIndex());

		// Nothing importable in the next batch: back to listening
		ahead.send(new BlocksMessage(Common.blocks(13, 15)));
		Common.waitUntil("listening", () -> sessionWith(ahead).getState() == SyncSession.State.LISTENING);
		assertEquals(12L, this.chain.getHeight());
	}

	@Test
	public void testEmptyBatchEndsSync() throws Exception {
		TestPeer ahead = connectRemote("ahead", 9105);

		ahead.send(new LatestBlockMessage(Common.block(12)));
		ahead.awaitMessage(MessageType.GET_BLOCKS);

		ahead.send(new BlocksMessage(Common.blocks(11, 12)));
		GetBlocksMessage nextRequest = ahead.awaitMessage(MessageType.GET_BLOCKS);
		assertEquals(13L, nextRequest.getStartIndex());

		ahead.send(new BlocksMessage(List.of()));
		Common.waitUntil("listening", () -> sessionWith(ahead).getState() == SyncSession.State.LISTENING);
		assertEquals(12L, this.chain.getHeight());
	}

	@Test
	public void testAnnouncementIgnoredWhileSyncing() throws Exception {
		TestPeer ahead = connectRemote("ahead", 9105);
		TestPeer announcer = connectRemote("announcer", 9106);

		CountDownLatch importEntered = new CountDownLatch(1);
		CountDownLatch importRelease = new CountDownLatch(1);
		this.chain.holdImports(importEntered, importRelease);

		ahead.send(new LatestBlockMessage(Common.block(12)));
		ahead.awaitMessage(MessageType.GET_BLOCKS);
		ahead.send(new BlocksMessage(Common.blocks(11, 12)));

		assertTrue(importEntered.await(Common.WAIT_TIMEOUT, TimeUnit.MILLISECONDS));
		assertTrue(this.network.getSynchronizer().isSynchronizing());

		announcer.send(new LatestBlockMessage(Common.block(20)));
		Thread.sleep(200L);

		importRelease.countDown();
		Common.waitUntil("batch imported", () -> this.chain.getHeight() == 12);

		assertFalse(announcer.hasReceived(MessageType.GET_BLOCKS));
	}

	@Test
	public void testResponder() throws Exception {
		TestPeer remote = connectRemote("remote_seed", 9107);

		remote.send(new GetLatestBlockMessage());
		LatestBlockMessage latest = remote.awaitMessage(MessageType.LATEST_BLOCK);
		assertEquals(10L, latest.getBlockData().getIndex());

		remote.send(new GetBlocksMessage(5, 500));
		BlocksMessage blocks = remote.awaitMessage(MessageType.BLOCKS);
		assertEquals(6, blocks.getBlocks().size());
		assertEquals(5L, blocks.getBlocks().get(0).getIndex());

		remote.send(new GetBlocksMessage(50, 60));
		assertTrue(((BlocksMessage) remote.awaitMessage(MessageType.BLOCKS)).getBlocks().isEmpty());

		remote.send(new GetPeersMessage());
		PeersMessage peers = remote.awaitMessage(MessageType.PEERS);
		assertEquals("seed_node_signature", peers.getPeers().get(0).getIdentity().getUsernameSignature());
		assertTrue(peers.getPeers().stream().anyMatch(peerData -> "remote_seed_signature".equals(peerData.getIdentity().getUsernameSignature())));
	}

	@Test
	public void testResponderCapsBlocks() throws Exception {
		TestChain longChain = new TestChain(250);
		Network otherNetwork = new Network(Common.loadSettings("settings-seed.json"), new InMemoryTransport(this.exchange, "127.0.0.1:9000"), longChain, longChain);

		try {
			TestPeer remote = new TestPeer(this.exchange, Common.peer("remote_seed", PeerRole.SEED, 9108)).listen();
			assertTrue(otherNetwork.connectPeerNow(remote.getPeerData()));
			remote.awaitMessage(MessageType.GET_PEERS);
			remote.sendPeers();

			remote.send(new GetBlocksMessage(0, 1000));
			BlocksMessage blocks = remote.awaitMessage(MessageType.BLOCKS);

			assertEquals(100, blocks.getBlocks().size());
			BlockData last = blocks.getBlocks().get(99);
			assertEquals(99L, last.getIndex());
		} finally {
			otherNetwork.shutdown();
		}
	}

	@Test
	public void testIdentityMismatchFailsHandshake() throws Exception {
		PeerData expected = Common.peer("expected_seed", PeerRole.SEED, 9109);
		TestPeer impostor = new TestPeer(this.exchange, Common.peer("impostor_seed", PeerRole.SEED, 9109)).listen();

		assertTrue(this.network.connectPeerNow(expected));
		impostor.awaitMessage(MessageType.HELLO);
		impostor.sendHello();

		assertTrue(impostor.awaitClosed());
		Common.waitUntil("ignored", () -> this.network.getConnectionManager().isIgnored(expected));
	}

	@Test
	public void testDisconnectReleasesSlot() throws Exception {
		TestPeer remote = connectRemote("remote_seed", 9110);
		assertEquals(1, this.network.getConnectionManager().getActive(PeerRole.SEED).size());

		remote.getConnection().close("test over");

		Common.waitUntil("session removed", () -> this.network.getSessions().isEmpty());
		assertTrue(this.network.getConnectionManager().getActive(PeerRole.SEED).isEmpty());
		assertFalse(this.network.getConnectionManager().isIgnored(remote.getPeerData()));
	}

	@Test
	public void testDisconnectDuringImport() throws Exception {
		TestPeer remote = connectRemote("remote_seed", 9111);

		CountDownLatch importEntered = new CountDownLatch(1);
		CountDownLatch importRelease = new CountDownLatch(1);
		this.chain.holdImports(importEntered, importRelease);

		remote.send(new BlocksMessage(Common.blocks(11, 12)));
		assertTrue(importEntered.await(Common.WAIT_TIMEOUT, TimeUnit.MILLISECONDS));

		remote.getConnection().close("leaving mid-import");
		Thread.sleep(200L);

		// Import still running: slot and sync flag held
		assertTrue(this.network.getSynchronizer().isSynchronizing());
		assertEquals(1, this.network.getConnectionManager().getActive(PeerRole.SEED).size());

		importRelease.countDown();

		Common.waitUntil("session removed", () -> this.network.getSessions().isEmpty());
		assertEquals(12L, this.chain.getHeight());
		assertFalse(this.network.getSynchronizer().isSynchronizing());
		assertTrue(this.network.getConnectionManager().getActive(PeerRole.SEED).isEmpty());
	}

	@Test
	public void testLoopbackHelloKeepsKnownAddress() throws Exception {
		PeerData known = new PeerData("10.1.2.3", 9112, Common.identity("remote_seed"), PeerRole.SEED);
		this.network.getPeerDirectory().mergePeer(known);

		TestPeer remote = new TestPeer(this.exchange, known).listen();
		assertTrue(this.network.connectPeerNow(known));

		remote.awaitMessage(MessageType.HELLO);
		remote.awaitMessage(MessageType.GET_PEERS);
		remote.send(new HelloMessage(2, Common.LOCALHOST, 9112, PeerRole.SEED, known.getIdentity(), null));
		remote.sendPeers(List.of());
		remote.awaitMessage(MessageType.GET_LATEST_BLOCK);

		assertEquals("10.1.2.3", this.network.getPeerDirectory().findByUsernameSignature("remote_seed_signature").getHost());
	}

	@Test
	public void testHelloRefreshesAddress() throws Exception {
		TestPeer remote = new TestPeer(this.exchange, Common.peer("remote_seed", PeerRole.SEED, 9113)).listen();
		assertTrue(this.network.connectPeerNow(remote.getPeerData()));

		remote.awaitMessage(MessageType.HELLO);
		remote.awaitMessage(MessageType.GET_PEERS);
		remote.send(new HelloMessage(2, "192.0.2.7", 9213, PeerRole.SEED, remote.getPeerData().getIdentity(), null));
		remote.sendPeers(List.of());
		remote.awaitMessage(MessageType.GET_LATEST_BLOCK);

		PeerData refreshed = this.network.getPeerDirectory().findByUsernameSignature("remote_seed_signature");
		assertEquals("192.0.2.7", refreshed.getHost());
		assertEquals(9213, refreshed.getPort());
	}

}
