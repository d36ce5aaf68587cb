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
 * Nondeterministic pushdown automaton accepting by final state.
 * At most one symbol is popped and one pushed per transition; stack contents at
 * the end do not matter.
 * <p>
 * The search has no memory of visited configurations, so a cycle of epsilon moves
 * that never reaches an accept state keeps it going forever unless a step budget
 * is given.
 */
public class PushdownAutomaton extends Recognizer {

	/** no step budget */
	public static final long UNBOUNDED = -1;

	private Set<String> states;
	private Set<Character> inputAlphabet;
	private Set<Character> stackAlphabet;
	private ArrayList<PDATransition> transitions;
	private String startState;
	private Set<String> acceptStates;

	// integer mapping of states, and transitions by source state index
	private TObjectIntHashMap s2i;
	private TIntObjectHashMap transitionsBySource;

	public PushdownAutomaton(String filename, String encoding) throws IOException, DataFormatException {
		this(DescriptionReader.open(filename, encoding));
	}

	// read from file: transitions, then a last line listing the accept states.
	// the first transition's source is the start state
	public PushdownAutomaton(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		Date readTime = new Date();
		ArrayList<String> lines = DescriptionReader.readLines(br);
		if (lines.isEmpty())
			throw new DataFormatException("Expected transitions and a line of accept states");
		LinkedHashSet<PDATransition> read = new LinkedHashSet<PDATransition>();
		String start = null;
		for (String line : lines.subList(0, lines.size()-1)) {
			if (debug) Debug.debug(debug, "Trying to get a transition out of "+line);
			PDATransition t = PDATransition.parseLine(line);
			if (start == null)
				start = t.getSource();
			read.add(t);
		}
		LinkedHashSet<String> accepts = new LinkedHashSet<String>();
		String last = lines.get(lines.size()-1);
		for (String s : last.split(",", -1)) {
			if (s.length() == 0)
				throw new DataFormatException("Empty accept state in "+last);
			accepts.add(s);
		}
		if (start == null)
			throw new DataFormatException("No transitions found, so there is no start state");
		initialize(collectStates(read), collectInputs(read), collectStackSymbols(read), read, start, accepts);
		Debug.dbtime(1, readTime, "Read "+transitions.size()+" transitions");
	}

	// states and alphabets found from the transitions themselves
	public PushdownAutomaton(Collection<PDATransition> intransitions, String start, Collection<String> accepts)
	throws DataFormatException {
		initialize(collectStates(intransitions), collectInputs(intransitions), collectStackSymbols(intransitions),
				intransitions, start, accepts);
	}

	public PushdownAutomaton(Set<String> instates, Set<Character> ininput, Set<Character> instack,
			Collection<PDATransition> intransitions, String start, Collection<String> accepts) throws DataFormatException {
		initialize(instates, ininput, instack, intransitions, start, accepts);
	}

	private static Set<String> collectStates(Collection<PDATransition> ts) {
		HashSet<String> ret = new HashSet<String>();
		for (PDATransition t : ts) {
			ret.add(t.getSource());
			ret.add(t.getDestination());
		}
		return ret;
	}

	private static Set<Character> collectInputs(Collection<PDATransition> ts) {
		HashSet<Character> ret = new HashSet<Character>();
		for (PDATransition t : ts)
			if (!Alphabet.isEpsilon(t.getInput()))
				ret.add(t.getInput());
		return ret;
	}

	private static Set<Character> collectStackSymbols(Collection<PDATransition> ts) {
		HashSet<Character> ret = new HashSet<Character>();
		for (PDATransition t : ts) {
			if (!Alphabet.isEpsilon(t.getPop()))
				ret.add(t.getPop());
			if (!Alphabet.isEpsilon(t.getPush()))
				ret.add(t.getPush());
		}
		return ret;
	}

	private void initialize(Set<String> instates, Set<Character> ininput, Set<Character> instack,
			Collection<PDATransition> intransitions, String start, Collection<String> accepts) throws DataFormatException {
		boolean debug = false;
		if (start == null || !instates.contains(start))
			throw new DataFormatException("Start state "+start+" must be a member of all states");
		for (String a : accepts)
			if (!instates.contains(a))
				throw new DataFormatException("Accept state "+a+" must be a member of all states");
		for (Character c : ininput)
			if (Alphabet.isEpsilon(c))
				throw new DataFormatException("Input alphabet may not contain "+Alphabet.EPSILON);
		for (Character c : instack)
			if (Alphabet.isEpsilon(c))
				throw new DataFormatException("Stack alphabet may not contain "+Alphabet.EPSILON);

		s2i = new TObjectIntHashMap();
		int nextState = 0;
		for (String s : new TreeSet<String>(instates)) {
			if (debug) Debug.debug(debug, "Mapping "+nextState+" to "+s);
			s2i.put(s, nextState++);
		}
		transitions = new ArrayList<PDATransition>();
		transitionsBySource = new TIntObjectHashMap();
		for (PDATransition t : intransitions) {
			if (!instates.contains(t.getSource()) || !instates.contains(t.getDestination()))
				throw new DataFormatException("Transition "+t+" uses a state that is not a member of all states");
			checkSymbol(t.getInput(), ininput, "input", t);
			checkSymbol(t.getPop(), instack, "stack", t);
			checkSymbol(t.getPush(), instack, "stack", t);
			if (transitions.contains(t))
				continue;
			transitions.add(t);
			int src = s2i.get(t.getSource());
			if (!transitionsBySource.containsKey(src))
				transitionsBySource.put(src, new ArrayList<PDATransition>());
			((ArrayList<PDATransition>)transitionsBySource.get(src)).add(t);
		}
		states = Collections.unmodifiableSet(new TreeSet<String>(instates));
		inputAlphabet = Collections.unmodifiableSet(new TreeSet<Character>(ininput));
		stackAlphabet = Collections.unmodifiableSet(new TreeSet<Character>(instack));
		acceptStates = Collections.unmodifiableSet(new TreeSet<String>(accepts));
		startState = start;
	}

	private static void checkSymbol(char c, Set<Character> alphabet, String which, PDATransition t)
	throws DataFormatException {
		if (!Alphabet.isEpsilon(c) && !alphabet.contains(c))
			throw new DataFormatException("Symbol "+c+" of "+t+" is not in the "+which+" alphabet");
	}

	// accessors
	public Set<String> getStates() { return states; }
	public Set<Character> getInputAlphabet() { return inputAlphabet; }
	public Set<Character> getStackAlphabet() { return stackAlphabet; }
	public List<PDATransition> getTransitions() { return Collections.unmodifiableList(transitions); }
	public String getStartState() { return startState; }
	public Set<String> getAcceptStates() { return acceptStates; }

	public List<PDATransition> getTransitionsFrom(String state) {
		if (!s2i.containsKey(state))
			return Collections.emptyList();
		ArrayList<PDATransition> ret = (ArrayList<PDATransition>)transitionsBySource.get(s2i.get(state));
		if (ret == null)
			return Collections.emptyList();
		return Collections.unmodifiableList(ret);
	}

	public boolean isAccepting(PDAConfiguration c) {
		return acceptStates.contains(c.getState()) && c.isInputConsumed();
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

	public boolean accepts(String string, long maxSteps) throws UnusualConditionException {
		return !findAcceptingPath(string, maxSteps).isEmpty();
	}

	public List<PDAConfiguration> findAcceptingPath(String string) {
		try {
			return findAcceptingPath(string, UNBOUNDED);
		}
		catch (UnusualConditionException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Exhaustive depth-first search for a run that reads all of string and ends in an
	 * accept state. Transitions are tried in the order they were given; the search goes
	 * as deep as it can down each before trying the next.
	 * @param maxSteps most configurations to expand; negative for no limit
	 * @return configurations from the start to the accepting one, empty if string is rejected
	 * @throws UnusualConditionException if maxSteps expansions were not enough to decide
	 */
	public List<PDAConfiguration> findAcceptingPath(String string, long maxSteps) throws UnusualConditionException {
		boolean debug = false;
		checkInput(string);
		Date searchTime = new Date();
		// explicit stack in place of recursion: the frames are the current path
		ArrayList<Frame> frames = new ArrayList<Frame>();
		frames.add(new Frame(new PDAConfiguration(startState, string, 0, "")));
		long steps = 0;
		while (!frames.isEmpty()) {
			Frame top = frames.get(frames.size()-1);
			if (top.outgoing == null) {
				if (debug) Debug.debug(debug, frames.size(), "Simulating "+top.config);
				if (isAccepting(top.config)) {
					Debug.dbtime(2, searchTime, "Accepted after "+steps+" steps");
					ArrayList<PDAConfiguration> path = new ArrayList<PDAConfiguration>();
					for (Frame f : frames)
						path.add(f.config);
					return path;
				}
				steps++;
				if (maxSteps >= 0 && steps > maxSteps)
					throw new UnusualConditionException("Gave up on '"+string+"' after "+maxSteps+" steps");
				top.outgoing = getTransitionsFrom(top.config.getState());
			}
			PDAConfiguration child = null;
			while (child == null && top.next < top.outgoing.size())
				child = top.outgoing.get(top.next++).fire(top.config);
			if (child == null)
				frames.remove(frames.size()-1);
			else
				frames.add(new Frame(child));
		}
		Debug.dbtime(2, searchTime, "Rejected after "+steps+" steps");
		return Collections.emptyList();
	}

	// a configuration and how far along its transitions the search is
	private static class Frame {
		final PDAConfiguration config;
		List<PDATransition> outgoing = null;
		int next = 0;
		Frame(PDAConfiguration config) {
			this.config = config;
		}
	}

	private static void checkInput(String string) {
		if (Alphabet.containsEpsilon(string))
			throw new IllegalArgumentException("Do not use "+Alphabet.EPSILON+" in strings: "+string);
	}

	public String getName() {
		return "NPDA";
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
		for (PDATransition t : transitions)
			sb.append(t.toString()).append("\n");
		boolean first = true;
		for (String a : acceptStates) {
			if (!first)
				sb.append(",");
			sb.append(a);
			first = false;
		}
		return sb.append("\n").toString();
	}
}
