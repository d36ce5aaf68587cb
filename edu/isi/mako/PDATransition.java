package edu.isi.mako;

// NPDA transition: source state, input symbol, symbol to pop, symbol to push, destination state.
// any of the three symbols may be epsilon
public class PDATransition {

	private final String source;
	private final char input;
	private final char pop;
	private final char push;
	private final String destination;

	public PDATransition(String source, char input, char pop, char push, String destination) {
		this.source = source;
		this.input = input;
		this.pop = pop;
		this.push = push;
		this.destination = destination;
	}

	// <state>:<input>,<pop>><push>:<state>
	public static PDATransition parseLine(String line) throws DataFormatException {
		String[] parts = DescriptionReader.splitTransition(line);
		String label = parts[1];
		if (label.length() != 5 || label.charAt(1) != ',' || label.charAt(3) != '>')
			throw new DataFormatException("Label must look like input,pop>push in "+line);
		return new PDATransition(parts[0], label.charAt(0), label.charAt(2), label.charAt(4), parts[2]);
	}

	// accessors
	public String getSource() { return source; }
	public char getInput() { return input; }
	public char getPop() { return pop; }
	public char getPush() { return push; }
	public String getDestination() { return destination; }

	/**
	 * The configuration reached by taking this transition from c, or null if the
	 * transition does not apply. Epsilon requirements always match and use nothing up.
	 */
	public PDAConfiguration fire(PDAConfiguration c) {
		if (!c.getState().equals(source))
			return null;
		int position = c.getPosition();
		if (!Alphabet.isEpsilon(input)) {
			if (c.isInputConsumed() || c.getInput().charAt(position) != input)
				return null;
			position++;
		}
		String stack = c.getStack();
		if (!Alphabet.isEpsilon(pop)) {
			if (stack.length() == 0 || stack.charAt(stack.length()-1) != pop)
				return null;
			stack = stack.substring(0, stack.length()-1);
		}
		if (!Alphabet.isEpsilon(push))
			stack = stack+push;
		return new PDAConfiguration(destination, c.getInput(), position, stack);
	}

	public boolean equals(Object o) {
		if (!(o instanceof PDATransition))
			return false;
		PDATransition t = (PDATransition)o;
		return source.equals(t.source) && input == t.input && pop == t.pop && push == t.push &&
			destination.equals(t.destination);
	}

	public int hashCode() {
		int h = source.hashCode();
		h = 31*h + input;
		h = 31*h + pop;
		h = 31*h + push;
		return 31*h + destination.hashCode();
	}

	public String toString() {
		return source+":"+input+","+pop+">"+push+":"+destination;
	}
}
