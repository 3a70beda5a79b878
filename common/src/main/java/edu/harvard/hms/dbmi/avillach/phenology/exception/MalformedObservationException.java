package edu.harvard.hms.dbmi.avillach.phenology.exception;

/**
 * A single input row could not be turned into an observation. The row is dropped, the batch carries on.
 */
public class MalformedObservationException extends Exception {

	private static final long serialVersionUID = -1750281939026623416L;

	private final String column;

	private final String rawValue;

	public MalformedObservationException(String column, String rawValue, String message) {
		super(message);
		this.column = column;
		this.rawValue = rawValue;
	}

	public MalformedObservationException(String column, String rawValue, String message, Throwable cause) {
		super(message, cause);
		this.column = column;
		this.rawValue = rawValue;
	}

	public String getColumn() {
		return column;
	}

	public String getRawValue() {
		return rawValue;
	}
}
