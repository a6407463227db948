package org.yadacoin.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies blocks received from peers to the local chain, one application at a time across the whole node.
 * <p>
 * A single announced block is treated as a batch of one.
 */
public class Synchronizer {

	private static final Logger LOGGER = LogManager.getLogger(Synchronizer.class);

	public enum SynchronizationResult {
		/** At least one block imported. */
		OK,
		/** Batch empty or doesn't follow our chain tip. */
		NOTHING_TO_DO,
		/** First block failed consensus. */
		INVALID_DATA,
		/** Another application is in progress. */
		NO_SYNC_LOCK;
	}

	public static class ImportResult {
		private final SynchronizationResult result;
		private final int importedCount;
		private final BlockData lastImported;
		private final long chainHeight;

		ImportResult(SynchronizationResult result, int importedCount, BlockData lastImported, long chainHeight) {
			this.result = result;
			this.importedCount = importedCount;
			this.lastImported = lastImported;
			this.chainHeight = chainHeight;
		}

		public SynchronizationResult getResult() {
			return this.result;
		}

		public int getImportedCount() {
			return this.importedCount;
		}

		/** Returns last block successfully imported, or <tt>null</tt>. */
		public BlockData getLastImported() {
			return this.lastImported;
		}

		/** Returns index of our chain tip once the batch finished, -1 when empty. */
		public long getChainHeight() {
			return this.chainHeight;
		}

		@Override
		public String toString() {
			return String.format("%s, imported %d, chain tip %d", this.result, this.importedCount, this.chainHeight);
		}
	}

	private final Consensus consensus;
	private final ChainReader chainReader;

	private final ReentrantLock syncLock = new ReentrantLock();
	/** Whether a batch is being applied. */
	private volatile boolean isSynchronizing = false;

	public Synchronizer(Consensus consensus, ChainReader chainReader) {
		this.consensus = consensus;
		this.chainReader = chainReader;
	}

	public boolean isSynchronizing() {
		return this.isSynchronizing;
	}

	/** Returns index of our chain tip, or -1 if the chain is empty. */
	public long getChainHeight() {
		BlockData latestBlock = this.chainReader.getLatestBlock();
		return latestBlock != null ? latestBlock.getIndex() : -1L;
	}

	public ChainReader getChainReader() {
		return this.chainReader;
	}

	/**
	 * Imports a single announced block, unless another application is already running,
	 * in which case the block is dropped and {@link SynchronizationResult#NO_SYNC_LOCK} returned.
	 */
	public ImportResult importNextBlock(BlockData blockData, PeerData sourcePeer) {
		if (!this.syncLock.tryLock()) {
			LOGGER.debug("Dropping block {} from {}: sync already in progress", blockData.getIndex(), sourcePeer);
			return new ImportResult(SynchronizationResult.NO_SYNC_LOCK, 0, null, getChainHeight());
		}

		return applyWhileLocked(Collections.singletonList(blockData), sourcePeer);
	}

	/**
	 * Imports a batch of consecutive blocks, waiting for any running application to finish first.
	 * <p>
	 * The batch is discarded unless its first block directly follows our chain tip as read after acquiring the lock.
	 * Blocks are applied in order, stopping at the first rejection. Blocks before that stay imported.
	 */
	public ImportResult importBlocks(List<BlockData> blocks, PeerData sourcePeer) {
		this.syncLock.lock();

		return applyWhileLocked(blocks, sourcePeer);
	}

	// Caller must hold syncLock, which is released here
	private ImportResult applyWhileLocked(List<BlockData> blocks, PeerData sourcePeer) {
		this.isSynchronizing = true;

		try {
			long chainHeight = getChainHeight();

			if (blocks.isEmpty() || blocks.get(0).getIndex() != chainHeight + 1) {
				LOGGER.debug("Discarding blocks from {} not following our chain tip {}", sourcePeer, chainHeight);
				return new ImportResult(SynchronizationResult.NOTHING_TO_DO, 0, null, chainHeight);
			}

			int importedCount = 0;
			BlockData lastImported = null;

			for (BlockData blockData : blocks) {
				if (blockData.getIndex() != chainHeight + 1) {
					LOGGER.debug("Block {} from {} out of sequence, expected {}", blockData.getIndex(), sourcePeer, chainHeight + 1);
					break;
				}

				try {
					this.consensus.insertConsensusBlock(blockData, sourcePeer);
				} catch (ConsensusRejectedException e) {
					LOGGER.info("Block {} from {} rejected: {}", blockData.getIndex(), sourcePeer, e.getMessage());
					break;
				}

				if (!this.consensus.importBlock(blockData, sourcePeer)) {
					LOGGER.info("Block {} from {} failed to import", blockData.getIndex(), sourcePeer);
					break;
				}

				++importedCount;
				lastImported = blockData;
				chainHeight = blockData.getIndex();
			}

			if (importedCount == 0)
				return new ImportResult(SynchronizationResult.INVALID_DATA, 0, null, chainHeight);

			LOGGER.debug("Imported {} block{} from {}, chain tip now {}", importedCount, (importedCount != 1 ? "s" : ""), sourcePeer, chainHeight);
			return new ImportResult(SynchronizationResult.OK, importedCount, lastImported, chainHeight);
		} finally {
			this.isSynchronizing = false;
			this.syncLock.unlock();
		}
	}

}
