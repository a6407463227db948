package org.yadacoin.test.network;

import org.junit.Test;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.GatewaySelector;
import org.yadacoin.network.NoGatewayAvailableException;
import org.yadacoin.network.role.PeerRole;
import org.yadacoin.test.common.Common;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class GatewaySelectorTests {

	private static final long EPOCH = 1602914018_000L; // ms
	private static final long ROTATION_INTERVAL = 259200_000L; // ms

	private static final String PROVIDER_SIGNATURE = "provider_signature";

	private static GatewaySelector selectorAt(long now) {
		return new GatewaySelector(EPOCH, ROTATION_INTERVAL, Clock.fixed(Instant.ofEpochMilli(now), ZoneOffset.UTC));
	}

	private static Map<String, PeerData> gateways(int count) {
		Map<String, PeerData> gateways = new LinkedHashMap<>();
		for (int i = 0; i < count; ++i)
			gateways.put("gateway-" + i, Common.peer("gateway_" + i, PeerRole.SEED_GATEWAY, 9200 + i));

		return gateways;
	}

	@Test
	public void testWorkedExample() {
		// (7 × 5) mod 3 = 2
		assertEquals(2, GatewaySelector.startIndex(BigInteger.valueOf(7), 5L, 3));
	}

	@Test
	public void testSeedTime() {
		GatewaySelector selector = selectorAt(EPOCH);

		assertEquals(1L, selector.seedTime(EPOCH));
		assertEquals(1L, selector.seedTime(EPOCH + ROTATION_INTERVAL - 1));
		assertEquals(2L, selector.seedTime(EPOCH + ROTATION_INTERVAL));
		assertEquals(5L, selector.seedTime(EPOCH + 4 * ROTATION_INTERVAL + 1000L));
	}

	@Test
	public void testSignatureHashIsUnsigned() {
		assertTrue(GatewaySelector.signatureHash(PROVIDER_SIGNATURE).signum() > 0);
		assertEquals(GatewaySelector.signatureHash(PROVIDER_SIGNATURE), GatewaySelector.signatureHash(PROVIDER_SIGNATURE));
	}

	@Test
	public void testSelectionFollowsFormula() throws NoGatewayAvailableException {
		long now = EPOCH + 10 * ROTATION_INTERVAL + 12345L;
		GatewaySelector selector = selectorAt(now);
		Map<String, PeerData> gateways = gateways(5);

		int expectedIndex = GatewaySelector.startIndex(GatewaySelector.signatureHash(PROVIDER_SIGNATURE), selector.seedTime(now), 5);
		PeerData expected = gateways.get("gateway-" + expectedIndex);

		assertSame(expected, selector.select(PROVIDER_SIGNATURE, gateways, Collections.emptySet()));
	}

	@Test
	public void testSelectionIsDeterministic() throws NoGatewayAvailableException {
		long now = EPOCH + 3 * ROTATION_INTERVAL;
		Map<String, PeerData> gateways = gateways(7);

		PeerData first = selectorAt(now).select(PROVIDER_SIGNATURE, gateways, Collections.emptySet());
		// Another node, later in the same window
		PeerData second = selectorAt(now + ROTATION_INTERVAL - 1).select(PROVIDER_SIGNATURE, gateways(7), Collections.emptySet());

		assertTrue(first.isSameHostAndPort(second));
	}

	@Test
	public void testIgnoredGatewaySkipped() throws NoGatewayAvailableException {
		GatewaySelector selector = selectorAt(EPOCH + 42L);
		Map<String, PeerData> gateways = gateways(3);

		PeerData chosen = selector.select(PROVIDER_SIGNATURE, gateways, Collections.emptySet());
		String chosenKey = keyOf(gateways, chosen);

		PeerData next = selector.select(PROVIDER_SIGNATURE, gateways, Collections.singleton(chosenKey));
		assertNotSame(chosen, next);

		// Probe moves forward, wrapping around
		int chosenIndex = Integer.parseInt(chosenKey.substring("gateway-".length()));
		assertSame(gateways.get("gateway-" + ((chosenIndex + 1) % 3)), next);
	}

	@Test
	public void testSingleRemainingGateway() throws NoGatewayAvailableException {
		GatewaySelector selector = selectorAt(EPOCH + 42L);
		Map<String, PeerData> gateways = gateways(4);

		Set<String> ignored = new HashSet<>(gateways.keySet());
		ignored.remove("gateway-2");

		assertSame(gateways.get("gateway-2"), selector.select(PROVIDER_SIGNATURE, gateways, ignored));
	}

	@Test(expected = NoGatewayAvailableException.class)
	public void testAllGatewaysIgnored() throws NoGatewayAvailableException {
		Map<String, PeerData> gateways = gateways(3);
		selectorAt(EPOCH).select(PROVIDER_SIGNATURE, gateways, new HashSet<>(gateways.keySet()));
	}

	@Test(expected = NoGatewayAvailableException.class)
	public void testNoGateways() throws NoGatewayAvailableException {
		selectorAt(EPOCH).select(PROVIDER_SIGNATURE, Collections.emptyMap(), Collections.emptySet());
	}

	private static String keyOf(Map<String, PeerData> gateways, PeerData peerData) {
		for (Map.Entry<String, PeerData> entry : gateways.entrySet())
			if (entry.getValue() == peerData)
				return entry.getKey();

		throw new AssertionError("unknown gateway " + peerData);
	}

}
