package org.yadacoin.network;

import com.google.common.hash.Hashing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.network.PeerData;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the SeedGateway a ServiceProvider should attach to.
 * <p>
 * Choice depends only on the ServiceProvider's username signature, the ordered gateway list and the
 * current rotation window, so every node computes the same assignment and it rotates every window.
 * Window boundaries are predictable from wall-clock time.
 */
public class GatewaySelector {

	private static final Logger LOGGER = LogManager.getLogger(GatewaySelector.class);

	private final long epoch; // ms
	private final long rotationInterval; // ms
	private final Clock clock;

	public GatewaySelector(long epoch, long rotationInterval, Clock clock) {
		if (rotationInterval <= 0)
			throw new IllegalArgumentException("rotation interval must be positive");

		this.epoch = epoch;
		this.rotationInterval = rotationInterval;
		this.clock = clock;
	}

	/**
	 * Returns the gateway for <tt>usernameSignature</tt> from <tt>gateways</tt> (in directory order),
	 * skipping any whose key is in <tt>ignoredKeys</tt>.
	 *
	 * @throws NoGatewayAvailableException if there are no gateways or all are ignored
	 */
	public PeerData select(String usernameSignature, Map<String, PeerData> gateways, Set<String> ignoredKeys) throws NoGatewayAvailableException {
		List<Map.Entry<String, PeerData>> entries = new ArrayList<>(gateways.entrySet());
		int size = entries.size();
		if (size == 0)
			throw new NoGatewayAvailableException("No SeedGateways known");

		long seedTime = seedTime(this.clock.millis());
		int index = startIndex(signatureHash(usernameSignature), seedTime, size);

		for (int probe = 0; probe < size; ++probe) {
			Map.Entry<String, PeerData> entry = entries.get((index + probe) % size);

			if (ignoredKeys.contains(entry.getKey()))
				continue;

			LOGGER.debug("Selected SeedGateway {} (window {}, start {}, probes {})", entry.getValue(), seedTime, index, probe + 1);
			return entry.getValue();
		}

		throw new NoGatewayAvailableException(String.format("All %d SeedGateways ignored", size));
	}

	/** Returns 1-based rotation window number containing <tt>now</tt> (ms). */
	public long seedTime(long now) {
		return Math.floorDiv(now - this.epoch, this.rotationInterval) + 1;
	}

	/** Returns SHA-256 of <tt>usernameSignature</tt> as an unsigned integer. */
	public static BigInteger signatureHash(String usernameSignature) {
		byte[] digest = Hashing.sha256().hashString(usernameSignature, StandardCharsets.UTF_8).asBytes();
		return new BigInteger(1, digest);
	}

	/** Returns <tt>(hash × seedTime) mod size</tt>. */
	public static int startIndex(BigInteger hash, long seedTime, int size) {
		return hash.multiply(BigInteger.valueOf(seedTime)).mod(BigInteger.valueOf(size)).intValueExact();
	}

}
