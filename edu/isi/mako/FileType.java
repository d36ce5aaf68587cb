package edu.isi.mako;

// tells which kind of system a description file holds.
// emphasis is on differentiation, not validation: construction does the checking.
//  - no line with ':' at all: grammar rules
//  - the last line has no ':': it lists accept states, so a pushdown automaton
//  - otherwise every line is a transition: a Turing machine

import java.util.List;

public class FileType {

	public enum TYPE {
		UNKNOWN,
		CFG,
		NPDA,
		TM;

		public static TYPE get(String s) throws ConfigureException {
			for (TYPE t : TYPE.values()) {
				if (t != UNKNOWN && t.toString().equalsIgnoreCase(s))
					return t;
			}
			throw new ConfigureException("Invalid system kind ("+s+"); valid values are cfg, npda, tm");
		}
	}

	private FileType() {}

	// lines as cleaned by DescriptionReader
	public static TYPE detect(List<String> lines) {
		boolean debug = false;
		if (lines.isEmpty())
			return TYPE.UNKNOWN;
		boolean sawColon = false;
		for (String line : lines) {
			if (line.indexOf(':') >= 0) {
				sawColon = true;
				break;
			}
		}
		TYPE ret;
		if (!sawColon)
			ret = TYPE.CFG;
		else if (lines.get(lines.size()-1).indexOf(':') < 0)
			ret = TYPE.NPDA;
		else
			ret = TYPE.TM;
		if (debug) Debug.debug(debug, "Detected "+ret+" from "+lines.size()+" lines");
		return ret;
	}
}
