package org.yadacoin.network;

/** Every candidate SeedGateway is ignored, or none are known. */
@SuppressWarnings("serial")
public class NoGatewayAvailableException extends Exception {

	public NoGatewayAvailableException(String message) {
		super(message);
	}

}
