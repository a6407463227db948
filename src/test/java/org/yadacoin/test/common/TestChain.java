package org.yadacoin.test.common;

import org.yadacoin.controller.ChainReader;
import org.yadacoin.controller.Consensus;
import org.yadacoin.controller.ConsensusRejectedException;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory chain that accepts any block following its tip, except those marked as rejected.
 */
public class TestChain implements Consensus, ChainReader {

	private final List<BlockData> blocks = new ArrayList<>();
	private final Set<Long> rejectedIndexes = new HashSet<>();

	private volatile CountDownLatch importEntered;
	private volatile CountDownLatch importRelease;

	/** Creates chain holding blocks 0 to <tt>height</tt>. */
	public TestChain(long height) {
		this.blocks.addAll(Common.blocks(0, height));
	}

	public synchronized void reject(long index) {
		this.rejectedIndexes.add(index);
	}

	/** Makes the next imports wait for <tt>release</tt>, counting down <tt>entered</tt> on arrival. */
	public void holdImports(CountDownLatch entered, CountDownLatch release) {
		this.importEntered = entered;
		this.importRelease = release;
	}

	public synchronized long getHeight() {
		return this.blocks.get(this.blocks.size() - 1).getIndex();
	}

	@Override
	public void insertConsensusBlock(BlockData blockData, PeerData sourcePeer) throws ConsensusRejectedException {
		synchronized (this) {
			if (this.rejectedIndexes.contains(blockData.getIndex()))
				throw new ConsensusRejectedException("Block " + blockData.getIndex() + " rejected by test");
		}
	}

	@Override
	public boolean importBlock(BlockData blockData, PeerData sourcePeer) {
		CountDownLatch entered = this.importEntered;
		CountDownLatch release = this.importRelease;

		if (entered != null && release != null) {
			entered.countDown();

			try {
				if (!release.await(Common.WAIT_TIMEOUT, TimeUnit.MILLISECONDS))
					return false;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return false;
			}
		}

		synchronized (this) {
			if (blockData.getIndex() != getHeight() + 1)
				return false;

			this.blocks.add(blockData);
			return true;
		}
	}

	@Override
	public synchronized BlockData getLatestBlock() {
		return this.blocks.get(this.blocks.size() - 1);
	}

	@Override
	public synchronized List<BlockData> getBlocks(long startIndex, long endIndex) {
		List<BlockData> range = new ArrayList<>();
		for (BlockData blockData : this.blocks)
			if (blockData.getIndex() >= startIndex && blockData.getIndex() < endIndex)
				range.add(blockData);

		return range;
	}

}
