package org.yadacoin.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.role.PeerRole;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlElement;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static peer records a node starts from, one list per upper-tier role.
 * <p>
 * Record order matters: it is the order gateways are enumerated in by the gateway selector.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class BootstrapPeers {

	private static final Logger LOGGER = LogManager.getLogger(BootstrapPeers.class);

	public static final String BOOTSTRAP_PEERS_SOURCE = "bootstrap-peers.json";

	private List<PeerData> seeds;

	@XmlElement(name = "seed_gateways")
	private List<PeerData> seedGateways;

	@XmlElement(name = "service_providers")
	private List<PeerData> serviceProviders;

	// For JAXB
	protected BootstrapPeers() {
	}

	/** Reads default bootstrap records bundled with the node. */
	public static BootstrapPeers fromClasspath() {
		ClassLoader classLoader = BootstrapPeers.class.getClassLoader();

		try (InputStream in = classLoader.getResourceAsStream(BOOTSTRAP_PEERS_SOURCE)) {
			if (in == null)
				throw new SettingsException("Missing bundled " + BOOTSTRAP_PEERS_SOURCE);

			BootstrapPeers bootstrapPeers = Settings.unmarshal(in, BootstrapPeers.class);
			LOGGER.debug("Loaded {} bundled bootstrap peers", bootstrapPeers.getAll().size());
			return bootstrapPeers;
		} catch (IOException e) {
			throw new SettingsException("Unable to read " + BOOTSTRAP_PEERS_SOURCE, e);
		}
	}

	public List<PeerData> getSeeds() {
		return withRole(this.seeds, PeerRole.SEED);
	}

	public List<PeerData> getSeedGateways() {
		return withRole(this.seedGateways, PeerRole.SEED_GATEWAY);
	}

	public List<PeerData> getServiceProviders() {
		return withRole(this.serviceProviders, PeerRole.SERVICE_PROVIDER);
	}

	public List<PeerData> getAll() {
		List<PeerData> all = new ArrayList<>();
		all.addAll(getSeeds());
		all.addAll(getSeedGateways());
		all.addAll(getServiceProviders());
		return all;
	}

	static List<PeerData> withRole(List<PeerData> peers, PeerRole role) {
		if (peers == null)
			return Collections.emptyList();

		for (PeerData peerData : peers)
			peerData.setRole(role);

		return Collections.unmodifiableList(peers);
	}

}
