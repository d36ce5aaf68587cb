package edu.isi.mako;

/**
 * One labelled example on which a system disagreed with its label,
 * or on which it ran out of budget before deciding.
 */
public class Mismatch {

	public enum Kind {
		/** labelled in the language, but not recognized */
		FALSE_NEGATIVE,
		/** labelled outside the language, but recognized */
		FALSE_POSITIVE,
		/** no verdict: the search gave up */
		UNDECIDED
	}

	private final String system;
	private final String string;
	private final Kind kind;
	private final String detail;

	public Mismatch(String system, String string, Kind kind, String detail) {
		this.system = system;
		this.string = string;
		this.kind = kind;
		this.detail = detail;
	}

	public String getSystem() { return system; }
	public String getString() { return string; }
	public Kind getKind() { return kind; }
	public String getDetail() { return detail; }

	public String toString() {
		switch (kind) {
		case FALSE_NEGATIVE:
			return "It looks like the "+system+" is incorrect: '"+string+"' is said to be in the language but the "+
			system+" "+detail+". But are you sure the string is in the language?";
		case FALSE_POSITIVE:
			return "It looks like the "+system+" is incorrect: '"+string+"' is said to be *not* in the language but the "+
			system+" "+detail+". Are you sure it is not in the language?";
		default:
			return "Could not decide '"+string+"' with the "+system+": "+detail;
		}
	}
}
