package cladeguess.exceptions;

import java.io.PrintStream;

/**
 * Thrown when an outline or species file cannot be turned into a usable tree.
 */
public class DataFormatException extends Exception {

	private static final long serialVersionUID = 1L;
	private String message;

	public DataFormatException(String msg) {
		this.message = msg;
	}

	public DataFormatException(String msg, Throwable cause) {
		super(cause);
		this.message = msg;
	}

	@Override
	public String getMessage() {
		return this.message;
	}

	@Override
	public String toString() {
		return "Format not recognized: " + this.message;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
