package edu.isi.mako;

// symbol classes shared by grammars and automata.
// uppercase letters are variables, lowercase letters (but not 'e') and digits are terminals.
public class Alphabet {

	/** the empty symbol. never a terminal, never part of a tested string */
	public static final char EPSILON = 'e';

	/** what unwritten tape cells hold */
	public static final char BLANK = '.';

	private Alphabet() {}

	public static boolean isVariable(char c) {
		return c >= 'A' && c <= 'Z';
	}

	public static boolean isTerminal(char c) {
		return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z' && c != EPSILON);
	}

	// letters and digits, epsilon included
	public static boolean isGrammarSymbol(char c) {
		return isVariable(c) || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
	}

	public static boolean isEpsilon(char c) {
		return c == EPSILON;
	}

	// occurrences, not distinct variables
	public static int countVariables(String s) {
		int count = 0;
		for (int i = 0; i < s.length(); i++)
			if (isVariable(s.charAt(i)))
				count++;
		return count;
	}

	// occurrences, not distinct terminals
	public static int countTerminals(String s) {
		int count = 0;
		for (int i = 0; i < s.length(); i++)
			if (isTerminal(s.charAt(i)))
				count++;
		return count;
	}

	// index of the first variable, or -1
	public static int leftmostVariable(String s) {
		for (int i = 0; i < s.length(); i++)
			if (isVariable(s.charAt(i)))
				return i;
		return -1;
	}

	public static String stripEpsilon(String s) {
		if (s.indexOf(EPSILON) < 0)
			return s;
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c != EPSILON)
				sb.append(c);
		}
		return sb.toString();
	}

	public static boolean containsEpsilon(String s) {
		return s.indexOf(EPSILON) >= 0;
	}

	// how an empty sentential form or symbol is printed
	public static String show(String s) {
		return s.length() == 0 ? String.valueOf(EPSILON) : s;
	}
}
