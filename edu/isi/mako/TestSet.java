package edu.isi.mako;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

// labelled examples: +string for members of the language, -string for the rest.
// a bare + or - is the empty string
public class TestSet {

	private final ArrayList<String> inLanguage = new ArrayList<String>();
	private final ArrayList<String> notInLanguage = new ArrayList<String>();

	public TestSet(String filename, String encoding) throws IOException, DataFormatException {
		this(DescriptionReader.open(filename, encoding));
	}

	public TestSet(BufferedReader br) throws IOException, DataFormatException {
		for (String line : DescriptionReader.readLines(br)) {
			char label = line.charAt(0);
			String s = line.substring(1);
			if (label == '+')
				inLanguage.add(s);
			else if (label == '-')
				notInLanguage.add(s);
			else
				throw new DataFormatException("Example must start with + or -: "+line);
		}
	}

	public TestSet(List<String> inLanguage, List<String> notInLanguage) {
		this.inLanguage.addAll(inLanguage);
		this.notInLanguage.addAll(notInLanguage);
	}

	public List<String> getInLanguage() { return inLanguage; }
	public List<String> getNotInLanguage() { return notInLanguage; }

	public int size() {
		return inLanguage.size()+notInLanguage.size();
	}

	public int run(Recognizer r, long bound, MismatchReporter reporter) {
		return r.performTests(inLanguage, notInLanguage, bound, reporter);
	}
}
