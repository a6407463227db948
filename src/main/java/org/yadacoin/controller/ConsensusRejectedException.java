package org.yadacoin.controller;

/** Block failed consensus validation and was not stored. */
@SuppressWarnings("serial")
public class ConsensusRejectedException extends Exception {

	public ConsensusRejectedException(String message) {
		super(message);
	}

	public ConsensusRejectedException(String message, Throwable cause) {
		super(message, cause);
	}

}
