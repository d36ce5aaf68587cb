package edu.isi.mako;
/** for malformed description files and for systems that violate their well-formedness rules */

public class DataFormatException extends Exception {
	/** Constructs a new exception with null as its detail message. */
	public DataFormatException() { super(); }
	/** Constructs a new exception with the specified detail message. */
	public DataFormatException(String message) { super(message); }
	/** Constructs a new exception with the specified detail message and cause. */
	public DataFormatException(String message, Throwable cause) { super(message, cause); }
	/** Constructs a new exception with the specified cause. */
	public DataFormatException(Throwable cause) { super(cause); }
}
