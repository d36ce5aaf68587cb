package edu.isi.mako;

import java.util.ArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// CFG Rule. variable lhs, string rhs over variables, terminals and epsilon.
public class CFGRule {

	private final char lhs;
	private final String rhs;

	public CFGRule(char lhs, String rhs) {
		this.lhs = lhs;
		this.rhs = rhs;
	}

	// accessors
	public char getLHS() { return lhs; }
	public String getRHS() { return rhs; }

	// rewrite the variable at pos (which must be this rule's lhs) with the rhs
	public String applyAt(String s, int pos) {
		if (s.charAt(pos) != lhs)
			throw new IllegalArgumentException("Rule "+this+" does not apply at "+pos+" of "+s);
		return s.substring(0, pos)+rhs+s.substring(pos+1);
	}

	// rewrite the first occurrence of the lhs
	public String apply(String s) {
		int pos = s.indexOf(lhs);
		if (pos < 0)
			throw new IllegalArgumentException("Rule "+this+" does not apply to "+s);
		return applyAt(s, pos);
	}

	// separate left from right. one symbol on the left, one arrow.
	private static Pattern sidesPat = Pattern.compile("(.)>([^>]*)");

	// a line is a variable, an arrow, and |-separated alternatives. one rule per alternative
	public static ArrayList<CFGRule> parseLine(String text) throws DataFormatException {
		boolean debug = false;
		if (debug) Debug.debug(debug, "Creating rules out of "+text);
		if (DescriptionReader.count(text, '>') != 1)
			throw new DataFormatException("There must be a single '>' in "+text);
		Matcher sidesMatch = sidesPat.matcher(text);
		if (!sidesMatch.matches())
			throw new DataFormatException("There must be a single character on the left of '>' in "+text);
		char left = sidesMatch.group(1).charAt(0);
		if (!Alphabet.isVariable(left))
			throw new DataFormatException("Left-hand side must be a capital English letter in "+text);
		String right = sidesMatch.group(2);
		for (int i = 0; i < right.length(); i++) {
			char c = right.charAt(i);
			if (c != '|' && !Alphabet.isGrammarSymbol(c))
				throw new DataFormatException("Right-hand side may hold only English letters, digits and '|' in "+text+
						"; saw '"+c+"'");
		}
		ArrayList<CFGRule> ret = new ArrayList<CFGRule>();
		// -1 keeps trailing empty alternatives so they can be refused
		for (String alt : right.split("\\|", -1)) {
			if (alt.length() == 0)
				throw new DataFormatException("Empty alternative in "+text+"; write "+Alphabet.EPSILON+" for the empty string");
			ret.add(new CFGRule(left, alt));
		}
		return ret;
	}

	public boolean equals(Object o) {
		if (!(o instanceof CFGRule))
			return false;
		CFGRule r = (CFGRule)o;
		return lhs == r.lhs && rhs.equals(r.rhs);
	}

	public int hashCode() {
		return 31*lhs + rhs.hashCode();
	}

	public String toString() {
		return lhs+" -> "+rhs;
	}
}
