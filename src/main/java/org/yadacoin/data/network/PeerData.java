package org.yadacoin.data.network;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import org.yadacoin.crypto.Identity;
import org.yadacoin.network.role.IdAttribute;
import org.yadacoin.network.role.PeerRole;
import org.yadacoin.network.role.RoleTable;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlElement;
import java.net.InetAddress;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class PeerData {

	// Properties
	private String host;
	private int port;
	private Identity identity;
	private PeerRole role;

	/** Username signature of the Seed this peer hangs off (SeedGateway records). */
	private String seed;

	/** Username signature of the SeedGateway fronting this peer (Seed records). */
	@XmlElement(name = "seed_gateway")
	private String seedGateway;

	/** Mining address, used as identifier for Miners. */
	private String address;

	// Constructors

	// For JAXB
	protected PeerData() {
	}

	public PeerData(String host, int port, Identity identity, PeerRole role, String seed, String seedGateway, String address) {
		this.host = host;
		this.port = port;
		this.identity = identity;
		this.role = role;
		this.seed = seed;
		this.seedGateway = seedGateway;
		this.address = address;
	}

	public PeerData(String host, int port, Identity identity, PeerRole role) {
		this(host, port, identity, role, null, null, null);
	}

	// Getters / setters

	public String getHost() {
		return this.host;
	}

	public int getPort() {
		return this.port;
	}

	public Identity getIdentity() {
		return this.identity;
	}

	public PeerRole getRole() {
		return this.role;
	}

	/** Bootstrap records take their role from the list they were declared in. */
	public void setRole(PeerRole role) {
		this.role = role;
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

	/** Returns pairwise id of this peer as seen from the node owning <tt>localSignature</tt>. */
	public String getRid(String localSignature) {
		return this.identity.generateRid(localSignature);
	}

	/**
	 * Returns the key identifying this participant from the point of view of the node owning <tt>localSignature</tt>.
	 * <p>
	 * Miners are keyed by address when they announce one, everyone else by rid.
	 */
	public String getKey(String localSignature) {
		if (RoleTable.get(this.role).getIdAttribute() == IdAttribute.ADDRESS && this.address != null)
			return this.address;

		return getRid(localSignature);
	}

	/** Returns copy of this record with refreshed reachable address. */
	public PeerData withHostAndPort(String host, int port) {
		return new PeerData(host, port, this.identity, this.role, this.seed, this.seedGateway, this.address);
	}

	/** Returns whether other nodes could reach our host, i.e. it is not loopback or wildcard. */
	public boolean hasRoutableHost() {
		if (this.host == null || this.host.isEmpty() || this.host.equalsIgnoreCase("localhost"))
			return false;

		// Hostnames are taken at face value
		if (!InetAddresses.isInetAddress(this.host))
			return true;

		InetAddress address = InetAddresses.forString(this.host);
		return !address.isLoopbackAddress() && !address.isAnyLocalAddress();
	}

	public boolean isSameHostAndPort(PeerData other) {
		return this.port == other.port && this.host.equalsIgnoreCase(other.host);
	}

	@Override
	public String toString() {
		return HostAndPort.fromParts(this.host, this.port).toString();
	}

}
