package org.yadacoin.crypto;

import com.google.common.hash.Hashing;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlElement;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Cryptographic identity of a node: a username, the signature over that username
 * (which acts as the node's unique handle) and the signing public key.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class Identity {

	private String username;

	@XmlElement(name = "username_signature")
	private String usernameSignature;

	@XmlElement(name = "public_key")
	private String publicKey;

	// For JAXB
	protected Identity() {
	}

	public Identity(String username, String usernameSignature, String publicKey) {
		this.username = username;
		this.usernameSignature = usernameSignature;
		this.publicKey = publicKey;
	}

	public String getUsername() {
		return this.username;
	}

	public String getUsernameSignature() {
		return this.usernameSignature;
	}

	public String getPublicKey() {
		return this.publicKey;
	}

	/**
	 * Returns the relationship id between this identity and the owner of <tt>counterpartSignature</tt>.
	 * <p>
	 * Both signatures are ordered case-insensitively before hashing, so either side of the
	 * pair derives the same value. Result is lowercase hex SHA-256.
	 */
	public String generateRid(String counterpartSignature) {
		Objects.requireNonNull(counterpartSignature, "counterpart signature required");

		String ours = this.usernameSignature;
		String first = ours;
		String second = counterpartSignature;
		if (String.CASE_INSENSITIVE_ORDER.compare(ours, counterpartSignature) > 0) {
			first = counterpartSignature;
			second = ours;
		}

		return Hashing.sha256().hashString(first + second, StandardCharsets.UTF_8).toString();
	}

	/** Same participant: signatures and public keys match. Username is cosmetic. */
	public boolean matches(Identity other) {
		if (other == null)
			return false;

		return Objects.equals(this.usernameSignature, other.usernameSignature)
				&& Objects.equals(this.publicKey, other.publicKey);
	}

	@Override
	public String toString() {
		return this.username;
	}

}
