package org.yadacoin.settings;

/** Settings could not be read or describe an unusable node. Fatal at startup. */
@SuppressWarnings("serial")
public class SettingsException extends RuntimeException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}

}
