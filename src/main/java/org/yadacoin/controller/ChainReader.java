package org.yadacoin.controller;

import org.yadacoin.data.block.BlockData;

import java.util.List;

/**
 * Read access to local chain storage.
 */
public interface ChainReader {

	/** Returns our chain tip, or <tt>null</tt> if the chain is empty. */
	BlockData getLatestBlock();

	/** Returns blocks with <tt>startIndex &lt;= index &lt; endIndex</tt>, in index order. */
	List<BlockData> getBlocks(long startIndex, long endIndex);

}
