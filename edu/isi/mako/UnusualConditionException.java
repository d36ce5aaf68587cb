package edu.isi.mako;
/** for searches that ran out of their step budget before reaching a verdict */
public class UnusualConditionException extends Exception {
	/** Constructs a new exception with null as its detail message. */
	public UnusualConditionException() { super(); }
	/** Constructs a new exception with the specified detail message. */
	public UnusualConditionException(String message) { super(message); }
	/** Constructs a new exception with the specified detail message and cause. */
	public UnusualConditionException(String message, Throwable cause) { super(message, cause); }
	/** Constructs a new exception with the specified cause. */
	public UnusualConditionException(Throwable cause) { super(cause); }
}
