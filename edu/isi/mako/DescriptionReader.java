package edu.isi.mako;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.regex.Pattern;

// reads description files: comments and blank lines are dropped,
// whitespace is squeezed out of everything else
public class DescriptionReader {

	// empty lines or comment lines
	private static Pattern commentPat = Pattern.compile("\\s*(#.*)?");

	private static Pattern spacePat = Pattern.compile("\\s+");

	private DescriptionReader() {}

	public static BufferedReader open(String filename, String encoding) throws IOException {
		return new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding));
	}

	// reads to the end and closes br
	public static ArrayList<String> readLines(BufferedReader br) throws IOException {
		boolean debug = false;
		ArrayList<String> lines = new ArrayList<String>();
		try {
			String line;
			while ((line = br.readLine()) != null) {
				if (commentPat.matcher(line).matches()) {
					if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
					continue;
				}
				lines.add(spacePat.matcher(line).replaceAll(""));
			}
		}
		finally {
			br.close();
		}
		return lines;
	}

	public static int count(String s, char c) {
		int n = 0;
		for (int i = 0; i < s.length(); i++)
			if (s.charAt(i) == c)
				n++;
		return n;
	}

	// automaton lines share the shape <state>:<label>:<state>, with the only '>' inside the label.
	// returns the three parts
	public static String[] splitTransition(String line) throws DataFormatException {
		if (count(line, ':') != 2)
			throw new DataFormatException("Expected exactly two ':' in "+line);
		if (count(line, '>') != 1)
			throw new DataFormatException("Expected exactly one '>' in "+line);
		int first = line.indexOf(':');
		int last = line.lastIndexOf(':');
		int arrow = line.indexOf('>');
		if (!(first < arrow && arrow < last))
			throw new DataFormatException("'>' must sit between the two ':' in "+line);
		String[] parts = new String[3];
		parts[0] = line.substring(0, first);
		parts[1] = line.substring(first+1, last);
		parts[2] = line.substring(last+1);
		if (parts[0].length() == 0)
			throw new DataFormatException("Missing source state in "+line);
		if (parts[2].length() == 0)
			throw new DataFormatException("Missing destination state in "+line);
		return parts;
	}
}
