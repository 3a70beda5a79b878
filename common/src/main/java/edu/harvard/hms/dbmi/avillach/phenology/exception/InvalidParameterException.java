package edu.harvard.hms.dbmi.avillach.phenology.exception;

public class InvalidParameterException extends RuntimeException {

	private static final long serialVersionUID = 6230117758912341207L;

	private final String parameter;

	public InvalidParameterException(String parameter, String message) {
		super(parameter + ": " + message);
		this.parameter = parameter;
	}

	public String getParameter() {
		return parameter;
	}
}
