package edu.harvard.hms.dbmi.avillach.phenology.exception;

/**
 * Thrown when a series has too few observations to be analysed. Grouping should make this impossible,
 * batch processing treats it as a skipped group rather than a fatal error.
 */
public class InsufficientDataException extends RuntimeException {

	private static final long serialVersionUID = -4158723920446513298L;

	public InsufficientDataException(String message) {
		super(message);
	}
}
