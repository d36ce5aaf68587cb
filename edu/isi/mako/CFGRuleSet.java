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

import edu.stanford.nlp.util.FixedPrioritiesPriorityQueue;
import gnu.trove.TIntObjectHashMap;

/**
 * A context-free grammar and its leftmost-derivation search.
 * Immutable once built; every query keeps its own search state.
 */
public class CFGRuleSet extends Recognizer {

	/** default largest number of variable occurrences in an intermediate form */
	public static final int DEFAULT_MAX_VARIABLES = 64;

	private char startState;
	private ArrayList<CFGRule> rules;
	private Set<Character> variables;
	private Set<Character> terminals;

	// rules indexed by lhs character
	private TIntObjectHashMap rulesByLHS;

	public CFGRuleSet(String filename, String encoding) throws IOException, DataFormatException {
		this(DescriptionReader.open(filename, encoding));
	}

	// read from file. the first rule's lhs is the start variable
	public CFGRuleSet(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		Date readTime = new Date();
		ArrayList<String> lines = DescriptionReader.readLines(br);
		if (lines.isEmpty())
			throw new DataFormatException("No rules found");
		LinkedHashSet<CFGRule> read = new LinkedHashSet<CFGRule>();
		for (String line : lines) {
			if (debug) Debug.debug(debug, "Trying to get rules out of "+line);
			read.addAll(CFGRule.parseLine(line));
		}
		char start = read.iterator().next().getLHS();
		initialize(collectVariables(read), collectTerminals(read), read, start);
		Debug.dbtime(1, readTime, "Read "+rules.size()+" rules");
	}

	// states and terminals found from the rules themselves
	public CFGRuleSet(char start, Collection<CFGRule> inrules) throws DataFormatException {
		initialize(collectVariables(inrules), collectTerminals(inrules), inrules, start);
	}

	public CFGRuleSet(Set<Character> invariables, Set<Character> interminals, Collection<CFGRule> inrules, char start)
	throws DataFormatException {
		initialize(invariables, interminals, inrules, start);
	}

	private static Set<Character> collectVariables(Collection<CFGRule> rs) {
		HashSet<Character> ret = new HashSet<Character>();
		for (CFGRule r : rs)
			ret.add(r.getLHS());
		return ret;
	}

	private static Set<Character> collectTerminals(Collection<CFGRule> rs) throws DataFormatException {
		HashSet<Character> ret = new HashSet<Character>();
		for (CFGRule r : rs) {
			String rhs = r.getRHS();
			for (int i = 0; i < rhs.length(); i++) {
				char c = rhs.charAt(i);
				if (Alphabet.isTerminal(c))
					ret.add(c);
				else if (!Alphabet.isVariable(c) && !Alphabet.isEpsilon(c))
					throw new DataFormatException("Unexpected symbol '"+c+"' in rule "+r);
			}
		}
		return ret;
	}

	// check every well-formedness rule, then index
	private void initialize(Set<Character> invariables, Set<Character> interminals, Collection<CFGRule> inrules, char start)
	throws DataFormatException {
		boolean debug = false;
		if (!invariables.contains(start))
			throw new DataFormatException("Start variable "+start+" is not one of the variables");
		for (Character v : invariables) {
			if (!Alphabet.isVariable(v))
				throw new DataFormatException("Variable "+v+" is not a capital English letter");
			if (interminals.contains(v))
				throw new DataFormatException("Variables and terminals must be disjoint; "+v+" is both");
		}
		for (Character t : interminals) {
			if (!Alphabet.isTerminal(t))
				throw new DataFormatException("Terminal "+t+" must be a lowercase English letter other than "+
						Alphabet.EPSILON+" or a digit");
		}
		rulesByLHS = new TIntObjectHashMap();
		rules = new ArrayList<CFGRule>();
		for (CFGRule r : inrules) {
			if (!invariables.contains(r.getLHS()))
				throw new DataFormatException("Left-hand side of "+r+" is not a variable");
			String rhs = r.getRHS();
			if (rhs.length() == 0)
				throw new DataFormatException("Rule "+r+" has an empty right-hand side; use "+Alphabet.EPSILON);
			for (int i = 0; i < rhs.length(); i++) {
				char c = rhs.charAt(i);
				if (!Alphabet.isEpsilon(c) && !invariables.contains(c) && !interminals.contains(c))
					throw new DataFormatException("Symbol "+c+" of rule "+r+" is neither a variable, a terminal, nor "+
							Alphabet.EPSILON);
			}
			if (rules.contains(r))
				continue;
			if (debug) Debug.debug(debug, "Adding "+r);
			rules.add(r);
			if (!rulesByLHS.containsKey(r.getLHS()))
				rulesByLHS.put(r.getLHS(), new ArrayList<CFGRule>());
			getRules(r.getLHS()).add(r);
		}
		// there must be at least one rule for each variable
		for (Character v : invariables) {
			if (!rulesByLHS.containsKey(v))
				throw new DataFormatException("Variable "+v+" has no rules");
		}
		variables = Collections.unmodifiableSet(new TreeSet<Character>(invariables));
		terminals = Collections.unmodifiableSet(new TreeSet<Character>(interminals));
		startState = start;
	}

	private ArrayList<CFGRule> getRules(char variable) {
		return (ArrayList<CFGRule>)rulesByLHS.get(variable);
	}

	// accessors
	public char getStartState() { return startState; }
	public List<CFGRule> getRules() { return Collections.unmodifiableList(rules); }
	public Set<Character> getVariables() { return variables; }
	public Set<Character> getTerminals() { return terminals; }
	public int getNumRules() { return rules.size(); }

	public List<CFGRule> getRulesFor(char variable) {
		ArrayList<CFGRule> ret = getRules(variable);
		if (ret == null)
			return Collections.emptyList();
		return Collections.unmodifiableList(ret);
	}

	public Derivation generate(String string) {
		return generate(string, DEFAULT_MAX_VARIABLES);
	}

	// being able to generate a string means deriving it from the start variable
	public Derivation generate(String string, int maxVariables) {
		return derive(String.valueOf(startState), string, maxVariables);
	}

	/**
	 * Depth-first search for a leftmost derivation of string from current.
	 * There is a derivation if and only if there is a leftmost one.
	 * Gives up on intermediate forms with more than maxVariables variable occurrences,
	 * so an empty result can be wrong for grammars that need more.
	 * @return the derivation, empty if none was found
	 */
	public Derivation derive(String current, String string, int maxVariables) {
		boolean debug = false;
		checkForm(current);
		checkTarget(string);
		Date searchTime = new Date();
		// the pool is shared by every branch of the search
		HashSet<String> pool = new HashSet<String>();
		ArrayList<String> path = new ArrayList<String>();
		boolean found = leftmostDerive(current, Alphabet.stripEpsilon(string), maxVariables, pool, path);
		if (debug) Debug.debug(debug, "Visited "+pool.size()+" forms looking for "+string);
		Debug.dbtime(2, searchTime, "Searched "+pool.size()+" forms");
		if (!found)
			return Derivation.NONE;
		return new Derivation(path);
	}

	private boolean leftmostDerive(String current, String string, int maxVariables, HashSet<String> pool,
			ArrayList<String> path) {
		current = Alphabet.stripEpsilon(current);

		// whether it failed already or is pending further up this branch, a second visit can't help
		if (!pool.add(current))
			return false;

		if (Alphabet.countVariables(current) > maxVariables)
			return false;

		// rules never delete terminals
		int terminalCount = Alphabet.countTerminals(current);
		if (terminalCount > string.length())
			return false;

		path.add(current);
		if (terminalCount == current.length()) {
			if (current.equals(string))
				return true;
			path.remove(path.size()-1);
			return false;
		}

		int pos = Alphabet.leftmostVariable(current);
		for (CFGRule r : getRulesFor(current.charAt(pos))) {
			if (leftmostDerive(r.applyAt(current, pos), string, maxVariables, pool, path))
				return true;
		}
		path.remove(path.size()-1);
		return false;
	}

	public Derivation generateShortest(String string) {
		return generateShortest(string, DEFAULT_MAX_VARIABLES);
	}

	/**
	 * Best-first search for a leftmost derivation with the fewest steps. Forms are
	 * expanded in order of derivation length; among equally long ones, those whose
	 * terminal prefix already matches more of the target go first.
	 */
	public Derivation generateShortest(String string, int maxVariables) {
		boolean debug = false;
		checkTarget(string);
		string = Alphabet.stripEpsilon(string);
		Date searchTime = new Date();
		FixedPrioritiesPriorityQueue<Form> agenda = new FixedPrioritiesPriorityQueue<Form>();
		HashSet<String> seen = new HashSet<String>();
		Form root = new Form(String.valueOf(startState), null, 0);
		seen.add(root.form);
		agenda.add(root, priority(root, string));
		while (!agenda.isEmpty()) {
			Form f = agenda.removeFirst();
			int pos = Alphabet.leftmostVariable(f.form);
			if (pos < 0) {
				if (f.form.equals(string)) {
					Debug.dbtime(2, searchTime, "Searched "+seen.size()+" forms");
					return f.toDerivation();
				}
				continue;
			}
			for (CFGRule r : getRulesFor(f.form.charAt(pos))) {
				String next = Alphabet.stripEpsilon(r.applyAt(f.form, pos));
				if (!seen.add(next))
					continue;
				if (!admissible(next, string, maxVariables)) {
					if (debug) Debug.debug(debug, "Pruning "+next);
					continue;
				}
				Form child = new Form(next, f, f.depth+1);
				agenda.add(child, priority(child, string));
			}
		}
		Debug.dbtime(2, searchTime, "Searched "+seen.size()+" forms");
		return Derivation.NONE;
	}

	// the terminals left of the leftmost variable never change again
	private static boolean admissible(String form, String string, int maxVariables) {
		if (Alphabet.countVariables(form) > maxVariables)
			return false;
		if (Alphabet.countTerminals(form) > string.length())
			return false;
		int pos = Alphabet.leftmostVariable(form);
		String prefix = pos < 0 ? form : form.substring(0, pos);
		return string.startsWith(prefix);
	}

	// the queue pops its highest priority first: shorter derivations win,
	// the matched prefix fraction (always below one) breaks ties
	private static double priority(Form f, String string) {
		int pos = Alphabet.leftmostVariable(f.form);
		int matched = pos < 0 ? f.form.length() : pos;
		return -f.depth + ((double)matched)/(string.length()+1);
	}

	// a node of the shortest-derivation search
	private static class Form {
		final String form;
		final Form parent;
		final int depth;
		Form(String form, Form parent, int depth) {
			this.form = form;
			this.parent = parent;
			this.depth = depth;
		}
		Derivation toDerivation() {
			ArrayList<String> steps = new ArrayList<String>();
			for (Form f = this; f != null; f = f.parent)
				steps.add(f.form);
			Collections.reverse(steps);
			return new Derivation(steps);
		}
	}

	// a form to derive from: letters and digits, no epsilon
	private static void checkForm(String current) {
		for (int i = 0; i < current.length(); i++) {
			char c = current.charAt(i);
			if (!Alphabet.isGrammarSymbol(c))
				throw new IllegalArgumentException("Current string must contain English letters and digits only: "+current);
			if (Alphabet.isEpsilon(c))
				throw new IllegalArgumentException("Do not use "+Alphabet.EPSILON+" in current strings: "+current);
		}
	}

	// a string to derive: terminals only
	private static void checkTarget(String string) {
		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);
			if (Alphabet.isEpsilon(c))
				throw new IllegalArgumentException("Do not use "+Alphabet.EPSILON+" in strings: "+string);
			if (!Alphabet.isTerminal(c))
				throw new IllegalArgumentException("String must contain lowercase English letters and digits only: "+string);
		}
	}

	public String getName() {
		return "grammar";
	}

	public long getDefaultBound() {
		return DEFAULT_MAX_VARIABLES;
	}

	// bound is the largest variable count
	public boolean recognizes(String s, long bound) {
		int max = bound > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int)bound;
		return !generate(s, max).isEmpty();
	}

	String acceptPhrase() {
		return "can generate it";
	}

	String rejectPhrase() {
		return "*cannot* generate it (a larger variable bound may help)";
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (CFGRule r : rules)
			sb.append(r.toString()).append("\n");
		return sb.toString();
	}
}
