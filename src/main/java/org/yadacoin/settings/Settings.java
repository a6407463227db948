package org.yadacoin.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;
import org.yadacoin.crypto.Identity;
import org.yadacoin.data.network.PeerData;
import org.yadacoin.network.role.PeerRole;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.transform.stream.StreamSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class Settings {

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);

	// Node identity

	private PeerRole role = PeerRole.USER;
	private Identity identity;
	/** Designated Seed, by username signature. Required for SeedGateways. */
	private String seed;
	/** SeedGateway fronting this node, by username signature. Informational for Seeds. */
	@XmlElement(name = "seed_gateway")
	private String seedGateway;
	/** Mining address. Identifies Miners. */
	private String address;

	// Networking

	private String bindAddress = "0.0.0.0";
	private int listenPort = 8000;
	/** Host we announce to peers as reachable. */
	private String peerHost = "127.0.0.1";
	/** Port we announce to peers as reachable. Defaults to listenPort. */
	private Integer peerPort;
	private int protocolVersion = 2;
	/** Maximum time to allow connect() to remote peer to complete. (ms) */
	private int connectTimeout = 2_000; // ms
	/** Interval between connection top-up rounds. (ms) */
	private long connectInterval = 10_000L; // ms
	/** Maximum time for a remote to answer our peer-list request. (ms) */
	private long handshakeTimeout = 20_000L; // ms

	// Gateway selection

	/** Reference instant for gateway rotation windows, unix seconds. */
	private long epoch = 1602914018L; // s
	/** Length of a gateway rotation window. (s) */
	private long rotationInterval = 259200L; // s, 3 days

	// Sync

	private int maxBlocksPerMessage = 100;

	// Bootstrap overrides, bundled records used when absent

	private List<PeerData> seeds;
	@XmlElement(name = "seed_gateways")
	private List<PeerData> seedGateways;
	@XmlElement(name = "service_providers")
	private List<PeerData> serviceProviders;

	// Constructors

	// For JAXB
	private Settings() {
	}

	public static Settings fromFile(Path path) {
		LOGGER.info("Using settings file: {}", path);

		try (InputStream in = Files.newInputStream(path)) {
			return fromStream(in);
		} catch (IOException e) {
			throw new SettingsException("Unable to read settings file " + path, e);
		}
	}

	public static Settings fromStream(InputStream in) {
		Settings settings = unmarshal(in, Settings.class);
		settings.validate();
		return settings;
	}

	static <T> T unmarshal(InputStream in, Class<T> clazz) {
		Unmarshaller unmarshaller;

		try {
			// Create JAXB context aware of classes we need to unmarshal
			JAXBContext jc = JAXBContextFactory.createContext(new Class[] {
					clazz
			}, null);

			// Create unmarshaller
			unmarshaller = jc.createUnmarshaller();

			// Set the unmarshaller media type to JSON
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");

			// Tell unmarshaller that there's no JSON root element in the JSON input
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);
		} catch (JAXBException e) {
			String message = "Failed to setup unmarshaller to read " + clazz.getSimpleName();
			LOGGER.error(message, e);
			throw new SettingsException(message, e);
		}

		try {
			return unmarshaller.unmarshal(new StreamSource(in), clazz).getValue();
		} catch (JAXBException e) {
			String message = "Failed to parse " + clazz.getSimpleName();
			LOGGER.error(message, e);
			throw new SettingsException(message, e);
		}
	}

	private void validate() {
		if (this.role == null)
			throw new SettingsException("Node role is required");

		if (this.identity == null || this.identity.getUsernameSignature() == null || this.identity.getUsernameSignature().isEmpty())
			throw new SettingsException("Node identity with username_signature is required");

		if (this.role == PeerRole.SEED_GATEWAY && this.seed == null)
			throw new SettingsException("SeedGateway requires its designated seed");

		if (this.listenPort <= 0 || this.listenPort > 65535)
			throw new SettingsException("Invalid listenPort " + this.listenPort);

		if (this.peerPort != null && (this.peerPort <= 0 || this.peerPort > 65535))
			throw new SettingsException("Invalid peerPort " + this.peerPort);

		if (this.rotationInterval <= 0)
			throw new SettingsException("rotationInterval must be positive");

		if (this.maxBlocksPerMessage <= 0)
			throw new SettingsException("maxBlocksPerMessage must be positive");

		if (this.handshakeTimeout <= 0 || this.connectInterval <= 0)
			throw new SettingsException("handshakeTimeout and connectInterval must be positive");

		if (this.role == PeerRole.MINER && this.address == null)
			LOGGER.warn("Miner configured without address, peers will key it by rid");
	}

	// Getters

	public PeerRole getRole() {
		return this.role;
	}

	public Identity getIdentity() {
		return this.identity;
	}

	public String getSeed() {
		return this.seed;
	}

	public String getSeedGateway() {
		return this.seedGateway;
	}

	public String getAddress() {
		return this.address;
	}

	public String getBindAddress() {
		return this.bindAddress;
	}

	public int getListenPort() {
		return this.listenPort;
	}

	public String getPeerHost() {
		return this.peerHost;
	}

	public int getPeerPort() {
		return this.peerPort != null ? this.peerPort : this.listenPort;
	}

	public int getProtocolVersion() {
		return this.protocolVersion;
	}

	public int getConnectTimeout() {
		return this.connectTimeout;
	}

	public long getConnectInterval() {
		return this.connectInterval;
	}

	public long getHandshakeTimeout() {
		return this.handshakeTimeout;
	}

	/** Returns rotation epoch in milliseconds. */
	public long getEpochMillis() {
		return TimeUnit.SECONDS.toMillis(this.epoch);
	}

	/** Returns rotation window in milliseconds. */
	public long getRotationIntervalMillis() {
		return TimeUnit.SECONDS.toMillis(this.rotationInterval);
	}

	public int getMaxBlocksPerMessage() {
		return this.maxBlocksPerMessage;
	}

	/** Returns our own peer record, as announced to others. */
	public PeerData getSelf() {
		return new PeerData(this.peerHost, getPeerPort(), this.identity, this.role, this.seed, this.seedGateway, this.address);
	}

	/**
	 * Returns bootstrap records in directory order: seeds, then seed gateways, then service providers.
	 * Lists given in the settings file replace the bundled list for that role.
	 */
	public List<PeerData> getBootstrapPeers() {
		BootstrapPeers bundled = null;
		if (this.seeds == null || this.seedGateways == null || this.serviceProviders == null)
			bundled = BootstrapPeers.fromClasspath();

		List<PeerData> peers = new ArrayList<>();
		peers.addAll(this.seeds != null ? BootstrapPeers.withRole(this.seeds, PeerRole.SEED) : bundled.getSeeds());
		peers.addAll(this.seedGateways != null ? BootstrapPeers.withRole(this.seedGateways, PeerRole.SEED_GATEWAY) : bundled.getSeedGateways());
		peers.addAll(this.serviceProviders != null ? BootstrapPeers.withRole(this.serviceProviders, PeerRole.SERVICE_PROVIDER) : bundled.getServiceProviders());
		return peers;
	}

}
