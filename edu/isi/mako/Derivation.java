package edu.isi.mako;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of sentential forms, each obtained from the previous one by a single
 * leftmost rewrite. An empty derivation means none was found.
 */
public class Derivation {

	private final List<String> steps;

	public static final Derivation NONE = new Derivation(new ArrayList<String>());

	public Derivation(List<String> steps) {
		this.steps = Collections.unmodifiableList(new ArrayList<String>(steps));
	}

	public boolean isEmpty() { return steps.isEmpty(); }
	public int size() { return steps.size(); }
	public String get(int i) { return steps.get(i); }
	public List<String> getSteps() { return steps; }

	/**
	 * Drop closed loops. Walking the original steps from the end, whenever a form
	 * occurs more than once in what is left, everything from its first occurrence up
	 * to its last one goes. The result is not necessarily the shortest derivation.
	 */
	public Derivation minimize() {
		boolean debug = false;
		ArrayList<String> shorter = new ArrayList<String>(steps);
		for (int i = steps.size()-1; i >= 0; i--) {
			String s = steps.get(i);
			int first = shorter.indexOf(s);
			int last = shorter.lastIndexOf(s);
			if (first < 0 || first == last)
				continue;
			if (debug) Debug.debug(debug, "Collapsing loop on "+s+" between "+first+" and "+last);
			shorter.subList(first, last).clear();
		}
		if (shorter.size() == steps.size())
			return this;
		return new Derivation(shorter);
	}

	public boolean equals(Object o) {
		if (!(o instanceof Derivation))
			return false;
		return steps.equals(((Derivation)o).steps);
	}

	public int hashCode() {
		return steps.hashCode();
	}

	public String toString() {
		if (steps.isEmpty())
			return "There is no derivation.";
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < steps.size(); i++) {
			if (i > 0)
				sb.append(" -> ");
			sb.append(Alphabet.show(steps.get(i)));
		}
		return sb.toString();
	}
}
