package org.yadacoin.network.message;

@SuppressWarnings("serial")
public class MessageException extends Exception {

	public MessageException() {
	}

	public MessageException(String message) {
		super(message);
	}

	public MessageException(String message, Throwable cause) {
		super(message, cause);
	}

	public MessageException(Throwable cause) {
		super(cause);
	}

}
