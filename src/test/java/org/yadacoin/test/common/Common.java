package org.yadacoin.test.common;

import org.yadacoin.crypto.Identity;
import org.yadacoin.data.block.BlockData;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.role.PeerRole;
import org.yadacoin.settings.Settings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

public class Common {

	public static final String LOCALHOST = "127.0.0.1";

	/** Default wait for asynchronous outcomes. (ms) */
	public static final long WAIT_TIMEOUT = 5_000L;

	public static Identity identity(String name) {
		return new Identity(name, name + "_signature", name + "_public_key");
	}

	public static PeerData peer(String name, PeerRole role, int port) {
		return new PeerData(LOCALHOST, port, identity(name), role);
	}

	public static BlockData block(long index) {
		return new BlockData(index, "hash-" + index, ("block " + index).getBytes(StandardCharsets.UTF_8));
	}

	/** Returns blocks <tt>fromIndex</tt> to <tt>toIndex</tt> inclusive. */
	public static List<BlockData> blocks(long fromIndex, long toIndex) {
		List<BlockData> blocks = new ArrayList<>();
		for (long index = fromIndex; index <= toIndex; ++index)
			blocks.add(block(index));

		return blocks;
	}

	public static Settings loadSettings(String resourceName) {
		try (InputStream in = Common.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (in == null)
				throw new IllegalArgumentException("Missing test resource " + resourceName);

			return Settings.fromStream(in);
		} catch (IOException e) {
			throw new IllegalStateException("Unable to read test resource " + resourceName, e);
		}
	}

	/** Polls <tt>condition</tt> until it holds, failing the test after {@link #WAIT_TIMEOUT}. */
	public static void waitUntil(String description, BooleanSupplier condition) {
		long deadline = System.currentTimeMillis() + WAIT_TIMEOUT;

		while (!condition.getAsBoolean()) {
			if (System.currentTimeMillis() > deadline)
				throw new AssertionError("Timed out waiting until " + description);

			try {
				Thread.sleep(10L);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new AssertionError("Interrupted waiting until " + description);
			}
		}
	}

}
