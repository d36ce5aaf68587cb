package edu.isi.mako;

import java.util.HashSet;
import java.util.List;

// Abstract language recognizer.
// useful classes are CFGRuleSet, PushdownAutomaton, TuringMachine.
// holds the labelled-example self test that all of them share.
public abstract class Recognizer {

	/** what the system is called in reports */
	public abstract String getName();

	/**
	 * Membership under a search bound. The meaning of the bound belongs to the subclass
	 * (largest variable count for grammars, step budget for automata).
	 * @throws UnusualConditionException if the bound ran out before a verdict
	 */
	public abstract boolean recognizes(String s, long bound) throws UnusualConditionException;

	/** bound used when the caller names none */
	public abstract long getDefaultBound();

	// verdict phrasing for reports
	abstract String acceptPhrase();
	abstract String rejectPhrase();

	public boolean recognizes(String s) throws UnusualConditionException {
		return recognizes(s, getDefaultBound());
	}

	public int performTests(List<String> inLanguage, List<String> notInLanguage) {
		return performTests(inLanguage, notInLanguage, getDefaultBound(), new DebugReporter());
	}

	public int performTests(List<String> inLanguage, List<String> notInLanguage, MismatchReporter reporter) {
		return performTests(inLanguage, notInLanguage, getDefaultBound(), reporter);
	}

	// run every example, report every disagreement. never stops early.
	// returns the number of mismatches
	public int performTests(List<String> inLanguage, List<String> notInLanguage, long bound, MismatchReporter reporter) {
		boolean debug = false;
		HashSet<String> overlap = new HashSet<String>(inLanguage);
		overlap.retainAll(notInLanguage);
		if (!overlap.isEmpty())
			throw new IllegalArgumentException("A string can either be a member of the language or not: "+overlap);
		int errors = 0;
		for (String s : inLanguage) {
			if (debug) Debug.debug(debug, "Expecting "+getName()+" to recognize '"+s+"'");
			Mismatch m = check(s, true, bound);
			if (m != null) {
				reporter.mismatch(m);
				errors++;
			}
		}
		for (String s : notInLanguage) {
			if (debug) Debug.debug(debug, "Expecting "+getName()+" to refuse '"+s+"'");
			Mismatch m = check(s, false, bound);
			if (m != null) {
				reporter.mismatch(m);
				errors++;
			}
		}
		if (errors == 0)
			reporter.passed(getName(), inLanguage.size()+notInLanguage.size());
		return errors;
	}

	private Mismatch check(String s, boolean expected, long bound) {
		boolean verdict;
		try {
			verdict = recognizes(s, bound);
		}
		catch (UnusualConditionException e) {
			return new Mismatch(getName(), s, Mismatch.Kind.UNDECIDED, e.getMessage());
		}
		if (verdict == expected)
			return null;
		if (expected)
			return new Mismatch(getName(), s, Mismatch.Kind.FALSE_NEGATIVE, rejectPhrase());
		return new Mismatch(getName(), s, Mismatch.Kind.FALSE_POSITIVE, acceptPhrase());
	}
}
