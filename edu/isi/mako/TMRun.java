package edu.isi.mako;

/**
 * One run of a Turing machine on one input. The tape is made fresh from the input
 * and changed in place as the run steps.
 */
public class TMRun {

	/** what a single step did */
	public enum Outcome {
		/** the machine is in the accept state; it halts */
		ACCEPT,
		/** no transition for the state and the symbol under the head; it halts */
		REJECT,
		/** a transition was taken */
		CONTINUE
	}

	private final TuringMachine machine;
	private final Tape tape;
	private String state;
	private int head;
	private long steps;

	TMRun(TuringMachine machine, String input) {
		this.machine = machine;
		this.tape = new Tape(input);
		this.state = machine.getStartState();
		this.head = 0;
		this.steps = 0;
	}

	public Outcome step() {
		boolean debug = false;
		if (TuringMachine.ACCEPT.equals(state))
			return Outcome.ACCEPT;
		TMTransition t = machine.getTransition(state, tape.read(head));
		if (t == null)
			return Outcome.REJECT;
		if (debug) Debug.debug(debug, "Taking "+t+" on "+this);
		tape.write(head, t.getWrite());
		if (t.getDirection() == TMTransition.Direction.RIGHT)
			head++;
		else if (head > 0)
			head--;
		state = t.getDestination();
		steps++;
		return Outcome.CONTINUE;
	}

	// step until halted, or until maxSteps transitions (negative for no limit)
	public boolean run(long maxSteps) throws UnusualConditionException {
		while (true) {
			if (maxSteps >= 0 && steps >= maxSteps && !isHalted())
				throw new UnusualConditionException("Machine still running after "+maxSteps+" steps in "+this);
			switch (step()) {
			case ACCEPT:
				return true;
			case REJECT:
				return false;
			default:
				break;
			}
		}
	}

	// would the next step halt
	public boolean isHalted() {
		return TuringMachine.ACCEPT.equals(state) || machine.getTransition(state, tape.read(head)) == null;
	}

	public String getState() { return state; }
	public int getHead() { return head; }
	public long getSteps() { return steps; }
	public Tape getTape() { return tape; }

	public String toString() {
		String cells = tape.toString();
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < Math.max(cells.length(), head+1); i++) {
			if (i == head)
				sb.append('[').append(tape.read(i)).append(']');
			else
				sb.append(tape.read(i));
		}
		return state+" "+sb.toString();
	}
}
