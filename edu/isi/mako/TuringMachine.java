package edu.isi.mako;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import gnu.trove.TIntObjectHashMap;
import gnu.trove.TObjectIntHashMap;

/**
 * Deterministic single-tape Turing machine. The accept state is the one named
 * "accept"; there is no reject state, a missing transition rejects. There is no
 * step limit unless one is asked for, so a machine that never halts runs forever.
 */
public class TuringMachine extends Recognizer {

	/** name of the accept state */
	public static final String ACCEPT = "accept";

	/** no step budget */
	public static final long UNBOUNDED = -1;

	// states, not counting the implicit reject state
	private Set<String> states;
	private Set<Character> tapeAlphabet;
	private ArrayList<TMTransition> transitions;
	private String startState;

	// integer mapping of states; transitions keyed by state index and read symbol
	private TObjectIntHashMap s2i;
	private TIntObjectHashMap transitionsByKey;

	public TuringMachine(String filename, String encoding) throws IOException, DataFormatException {
		this(DescriptionReader.open(filename, encoding));
	}

	// read from file. the first transition's source is the start state
	public TuringMachine(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		Date readTime = new Date();
		ArrayList<String> lines = DescriptionReader.readLines(br);
		if (lines.isEmpty())
			throw new DataFormatException("No transitions found");
		LinkedHashSet<TMTransition> read = new LinkedHashSet<TMTransition>();
		for (String line : lines) {
			if (debug) Debug.debug(debug, "Trying to get transitions out of "+line);
			read.addAll(TMTransition.parseLine(line));
		}
		String start = read.iterator().next().getSource();
		initialize(collectStates(read), collectSymbols(read), read, start);
		Debug.dbtime(1, readTime, "Read "+transitions.size()+" transitions");
	}

	// states and tape alphabet found from the transitions themselves
	public TuringMachine(Collection<TMTransition> intransitions, String start) throws DataFormatException {
		initialize(collectStates(intransitions), collectSymbols(intransitions), intransitions, start);
	}

	public TuringMachine(Set<String> instates, Set<Character> inalphabet, Collection<TMTransition> intransitions,
			String start) throws DataFormatException {
		initialize(instates, inalphabet, intransitions, start);
	}

	private static Set<String> collectStates(Collection<TMTransition> ts) {
		HashSet<String> ret = new HashSet<String>();
		for (TMTransition t : ts) {
			ret.add(t.getSource());
			ret.add(t.getDestination());
		}
		return ret;
	}

	private static Set<Character> collectSymbols(Collection<TMTransition> ts) {
		HashSet<Character> ret = new HashSet<Character>();
		for (TMTransition t : ts) {
			ret.add(t.getRead());
			ret.add(t.getWrite());
		}
		return ret;
	}

	private static int key(int state, char symbol) {
		return (state << 16) | symbol;
	}

	private void initialize(Set<String> instates, Set<Character> inalphabet, Collection<TMTransition> intransitions,
			String start) throws DataFormatException {
		boolean debug = false;
		if (!inalphabet.contains(Alphabet.BLANK))
			throw new DataFormatException("The tape alphabet must contain the blank symbol '"+Alphabet.BLANK+"'");
		s2i = new TObjectIntHashMap();
		int nextState = 0;
		for (String s : new TreeSet<String>(instates)) {
			if (debug) Debug.debug(debug, "Mapping "+nextState+" to "+s);
			s2i.put(s, nextState++);
		}
		transitions = new ArrayList<TMTransition>();
		transitionsByKey = new TIntObjectHashMap();
		for (TMTransition t : intransitions) {
			if (!instates.contains(t.getSource()))
				throw new DataFormatException("The source state '"+t.getSource()+"' must be one of the states");
			if (!instates.contains(t.getDestination()))
				throw new DataFormatException("The destination state '"+t.getDestination()+"' must be one of the states");
			if (!inalphabet.contains(t.getRead()))
				throw new DataFormatException("The read symbol '"+t.getRead()+"' must be one of the tape alphabet symbols");
			if (!inalphabet.contains(t.getWrite()))
				throw new DataFormatException("The write symbol '"+t.getWrite()+"' must be one of the tape alphabet symbols");
			if (transitions.contains(t))
				continue;
			// zero transitions for a pair is fine: that's a reject
			int k = key(s2i.get(t.getSource()), t.getRead());
			if (transitionsByKey.containsKey(k))
				throw new DataFormatException("This is a deterministic TM. However, there are multiple transitions with the "+
						"same source state '"+t.getSource()+"' and read symbol '"+t.getRead()+"'");
			transitionsByKey.put(k, t);
			transitions.add(t);
		}
		if (start == null || !instates.contains(start))
			throw new DataFormatException("The start state must be one of the states");
		if (!instates.contains(ACCEPT))
			throw new DataFormatException("The accept state '"+ACCEPT+"' must be one of the states");
		states = Collections.unmodifiableSet(new TreeSet<String>(instates));
		tapeAlphabet = Collections.unmodifiableSet(new TreeSet<Character>(inalphabet));
		startState = start;
	}

	// accessors
	public Set<String> getStates() { return states; }
	public Set<Character> getTapeAlphabet() { return tapeAlphabet; }
	public List<TMTransition> getTransitions() { return Collections.unmodifiableList(transitions); }
	public String getStartState() { return startState; }

	// the only transition for the pair, or null
	public TMTransition getTransition(String state, char symbol) {
		if (!s2i.containsKey(state))
			return null;
		return (TMTransition)transitionsByKey.get(key(s2i.get(state), symbol));
	}

	// start a run on string; the caller steps it
	public TMRun start(String string) {
		checkInput(string);
		return new TMRun(this, string);
	}

	public boolean accepts(String string) {
		try {
			return accepts(string, UNBOUNDED);
		}
		catch (UnusualConditionException e) {
			// only a budget can run out
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Step from the start state, head on cell 0, until the accept state or a missing transition.
	 * @param maxSteps most transitions to take; negative for no limit
	 * @throws UnusualConditionException if the machine had not halted after maxSteps
	 */
	public boolean accepts(String string, long maxSteps) throws UnusualConditionException {
		Date runTime = new Date();
		TMRun run = start(string);
		boolean ret = run.run(maxSteps);
		Debug.dbtime(2, runTime, (ret ? "Accepted" : "Rejected")+" after "+run.getSteps()+" steps");
		return ret;
	}

	private static void checkInput(String string) {
		if (string.indexOf(Alphabet.BLANK) >= 0)
			throw new IllegalArgumentException("Do not use the blank '"+Alphabet.BLANK+"' in strings: "+string);
	}

	public String getName() {
		return "TM";
	}

	public long getDefaultBound() {
		return UNBOUNDED;
	}

	// bound is the step budget
	public boolean recognizes(String s, long bound) throws UnusualConditionException {
		return accepts(s, bound);
	}

	String acceptPhrase() {
		return "accepts it";
	}

	String rejectPhrase() {
		return "rejects it";
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (TMTransition t : transitions)
			sb.append(t.toString()).append("\n");
		return sb.toString();
	}
}
