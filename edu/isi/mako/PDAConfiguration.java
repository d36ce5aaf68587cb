package edu.isi.mako;

// instantaneous description of an NPDA: state, unread input, stack (top at the end).
// only lives during a search
public class PDAConfiguration {

	private final String state;
	private final String input;
	private final int position;
	private final String stack;

	public PDAConfiguration(String state, String input, int position, String stack) {
		this.state = state;
		this.input = input;
		this.position = position;
		this.stack = stack;
	}

	public String getState() { return state; }
	// the whole input; unread part starts at getPosition()
	public String getInput() { return input; }
	public int getPosition() { return position; }
	public String getStack() { return stack; }

	public String getRemaining() {
		return input.substring(position);
	}

	public boolean isInputConsumed() {
		return position >= input.length();
	}

	public boolean equals(Object o) {
		if (!(o instanceof PDAConfiguration))
			return false;
		PDAConfiguration c = (PDAConfiguration)o;
		return state.equals(c.state) && getRemaining().equals(c.getRemaining()) && stack.equals(c.stack);
	}

	public int hashCode() {
		return 31*(31*state.hashCode() + getRemaining().hashCode()) + stack.hashCode();
	}

	public String toString() {
		return "("+state+", "+Alphabet.show(getRemaining())+", "+Alphabet.show(stack)+")";
	}
}
