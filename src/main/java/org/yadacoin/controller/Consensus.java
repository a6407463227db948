package org.yadacoin.controller;

import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;

/**
 * Block validation and persistence, provided by the node embedding this library.
 */
public interface Consensus {

	/**
	 * Records <tt>blockData</tt> as a consensus candidate received from <tt>sourcePeer</tt>.
	 *
	 * @throws ConsensusRejectedException if the block is invalid
	 */
	void insertConsensusBlock(BlockData blockData, PeerData sourcePeer) throws ConsensusRejectedException;

	/**
	 * Appends a previously inserted block to the local chain.
	 *
	 * @return <tt>true</tt> if the block is now our chain tip
	 */
	boolean importBlock(BlockData blockData, PeerData sourcePeer);

}
