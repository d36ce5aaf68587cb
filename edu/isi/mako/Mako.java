package edu.isi.mako;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.Writer;
import java.util.Date;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.LongStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class Mako {
	// version number. change this when updating mako!
	static final String VERSION = "1.0";

	/** exit status when a self test found mismatches */
	public static final int TESTS_FAILED = 2;

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// what the description file holds. detected if absent
		FlaggedOption kindopt = new FlaggedOption("kind",
				EnumeratedStringParser.getParser("cfg; npda; tm"),
				JSAP.NO_DEFAULT,
				false,
				'k',
				"kind",
				"kind of system described by the input file: cfg (grammar), npda (pushdown automaton) or "+
		"tm (Turing machine). Detected from the file if absent");
		jsap.registerParameter(kindopt);

		FlaggedOption maxvarsopt = new FlaggedOption("maxvars",
				IntegerStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				'b',
				"maxvars",
				"grammars only: give up on intermediate strings with more than this many variables (default "+
				CFGRuleSet.DEFAULT_MAX_VARIABLES+"). Raise it for grammars that need "+
		"long intermediate strings");
		jsap.registerParameter(maxvarsopt);

		FlaggedOption limitopt = new FlaggedOption("limit",
				LongStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				'l',
				"limit",
				"automata only: give up on a string after this many steps. Without it, an automaton "+
		"that never halts on a string runs forever");
		jsap.registerParameter(limitopt);

		Switch shortestsw = new Switch("shortest",
				's',
				"shortest",
		"grammars only: search for a shortest derivation instead of the first one found");
		jsap.registerParameter(shortestsw);

		Switch nominsw = new Switch("nominimize",
				JSAP.NO_SHORTFLAG,
				"no-minimize",
		"grammars only: print derivations as found, without removing repeated parts");
		jsap.registerParameter(nominsw);

		Switch pathsw = new Switch("path",
				'p',
				"path",
		"pushdown automata only: print the configurations on the way to acceptance");
		jsap.registerParameter(pathsw);

		FlaggedOption testsopt = new FlaggedOption("tests",
				FileStringParser.getParser().setMustBeFile(true).setMustExist(true),
				JSAP.NO_DEFAULT,
				false,
				't',
				"tests",
				"file of labelled examples, one per line: +string for a member of the language, -string "+
		"for a non-member. Every disagreement is reported");
		jsap.registerParameter(testsopt);

		Switch csw = new Switch("check",
				'c',
				"check",
		"print the number of states, variables, rules, transitions and symbols of the system");
		jsap.registerParameter(csw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				JSAP.NO_SHORTFLAG,
				"time",
		"print timing information to stderr; higher levels print more");
		jsap.registerParameter(timeopt);

		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					JSAP.NO_DEFAULT,
					false,
					'o',
					"outputfile",
					"file to write results to. If absent, writing is done "+
			"to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption infileopt = new UnflaggedOption("infile",
				FileStringParser.getParser(),
				JSAP.NO_DEFAULT,
				true,
				false,
		"description of a grammar, pushdown automaton or Turing machine");
		jsap.registerParameter(infileopt);

		UnflaggedOption stringsopt = new UnflaggedOption("strings",
				StringStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				true,
		"strings to try. Grammars print a derivation, automata print accept or reject");
		jsap.registerParameter(stringsopt);

		JSAPResult config = jsap.parse(argv);
		if (config.getBoolean("shortest") && config.getBoolean("nominimize"))
			throw new ConfigureException("--shortest derivations have nothing to minimize; drop --no-minimize");
		return config;
	}

	// options that only make sense for some kinds of system
	private static void checkKind(FileType.TYPE kind, JSAPResult config) throws ConfigureException {
		if (kind != FileType.TYPE.CFG) {
			if (config.contains("maxvars") || config.getBoolean("shortest") || config.getBoolean("nominimize"))
				throw new ConfigureException("-b, -s and --no-minimize only apply to grammars, not "+kind);
		}
		else if (config.contains("limit"))
			throw new ConfigureException("-l only applies to automata, not grammars");
		if (kind != FileType.TYPE.NPDA && config.getBoolean("path"))
			throw new ConfigureException("-p only applies to pushdown automata, not "+kind);
	}

	private static String readAll(File f, String encoding) throws IOException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
		try {
			StringBuilder sb = new StringBuilder();
			String line;
			while ((line = br.readLine()) != null)
				sb.append(line).append("\n");
			return sb.toString();
		}
		finally {
			br.close();
		}
	}

	private static Recognizer build(FileType.TYPE kind, String text) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new StringReader(text));
		switch (kind) {
		case CFG:
			return new CFGRuleSet(br);
		case NPDA:
			return new PushdownAutomaton(br);
		case TM:
			return new TuringMachine(br);
		default:
			throw new DataFormatException("Could not tell what kind of system this is");
		}
	}

	// summary of the system
	static String getCheck(String name, Recognizer r) {
		StringBuilder buffer = new StringBuilder();
		if (r instanceof CFGRuleSet) {
			CFGRuleSet g = (CFGRuleSet)r;
			buffer.append("CFG info for "+name+":\n");
			buffer.append("\t"+g.getVariables().size()+" variables\n");
			buffer.append("\t"+g.getTerminals().size()+" terminals\n");
			buffer.append("\t"+g.getNumRules()+" rules\n");
			buffer.append("\tstart variable "+g.getStartState()+"\n");
		}
		else if (r instanceof PushdownAutomaton) {
			PushdownAutomaton p = (PushdownAutomaton)r;
			buffer.append("NPDA info for "+name+":\n");
			buffer.append("\t"+p.getStates().size()+" states\n");
			buffer.append("\t"+p.getAcceptStates().size()+" accept states\n");
			buffer.append("\t"+p.getTransitions().size()+" transitions\n");
			buffer.append("\t"+p.getInputAlphabet().size()+" input symbols\n");
			buffer.append("\t"+p.getStackAlphabet().size()+" stack symbols\n");
			buffer.append("\tstart state "+p.getStartState()+"\n");
		}
		else if (r instanceof TuringMachine) {
			TuringMachine m = (TuringMachine)r;
			buffer.append("TM info for "+name+":\n");
			buffer.append("\t"+m.getStates().size()+" states\n");
			buffer.append("\t"+m.getTransitions().size()+" transitions\n");
			buffer.append("\t"+m.getTapeAlphabet().size()+" tape symbols\n");
			buffer.append("\tstart state "+m.getStartState()+"\n");
		}
		return buffer.toString();
	}

	// one line of output per string
	static String query(Recognizer r, String s, JSAPResult config) throws UnusualConditionException {
		if (r instanceof CFGRuleSet) {
			CFGRuleSet g = (CFGRuleSet)r;
			int max = config.contains("maxvars") ? config.getInt("maxvars") : CFGRuleSet.DEFAULT_MAX_VARIABLES;
			if (config.getBoolean("shortest"))
				return g.generateShortest(s, max).toString();
			Derivation d = g.generate(s, max);
			if (!config.getBoolean("nominimize"))
				d = d.minimize();
			return d.toString();
		}
		long limit = config.contains("limit") ? config.getLong("limit") : r.getDefaultBound();
		if (r instanceof PushdownAutomaton && config.getBoolean("path")) {
			List<PDAConfiguration> path = ((PushdownAutomaton)r).findAcceptingPath(s, limit);
			if (path.isEmpty())
				return Alphabet.show(s)+": reject";
			StringBuilder sb = new StringBuilder(Alphabet.show(s)+": accept");
			for (int i = 0; i < path.size(); i++)
				sb.append(i == 0 ? " " : " -> ").append(path.get(i).toString());
			return sb.toString();
		}
		return Alphabet.show(s)+": "+(r.recognizes(s, limit) ? "accept" : "reject");
	}

	/**
	 * Everything main does, writing results to out (or the output file) and errors to stderr.
	 * @return the exit status
	 */
	public static int run(String argv[], Writer out) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("Mako options improperly configured: "+e.getMessage());
			System.err.println("Try 'mako -h` for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Mako options improperly configured: "+e.getMessage());
			System.err.println("Try 'mako -h` for a detailed help message");
			return 1;
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: mako ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator();
			errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: mako ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}

		String encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		if (config.contains("time"))
			Debug.setDbLevel(config.getInt("time"));

		Writer w = out;
		try {
			File infile = config.getFile("infile");
			Date readTime = new Date();
			String text = readAll(infile, encoding);
			FileType.TYPE kind;
			if (config.contains("kind"))
				kind = FileType.TYPE.get(config.getString("kind"));
			else
				kind = FileType.detect(DescriptionReader.readLines(new BufferedReader(new StringReader(text))));
			checkKind(kind, config);
			Recognizer r = build(kind, text);
			Debug.dbtime(1, readTime, "read "+kind+" from "+infile.getName());

			if (config.contains("outfile"))
				w = new OutputStreamWriter(new FileOutputStream(config.getFile("outfile")), encoding);
			else if (w == null)
				w = new OutputStreamWriter(System.out, encoding);

			if (config.getBoolean("check"))
				w.write(getCheck(infile.getName(), r));

			int status = 0;
			if (config.contains("tests")) {
				Date testTime = new Date();
				TestSet tests = new TestSet(config.getFile("tests").getPath(), encoding);
				long bound = r.getDefaultBound();
				if (config.contains("maxvars"))
					bound = config.getInt("maxvars");
				else if (config.contains("limit"))
					bound = config.getLong("limit");
				if (tests.run(r, bound, new DebugReporter()) > 0)
					status = TESTS_FAILED;
				Debug.dbtime(1, testTime, "ran "+tests.size()+" tests");
			}

			String[] strings = config.getStringArray("strings");
			if (strings != null) {
				for (String s : strings)
					w.write(query(r, s, config)+"\n");
			}
			w.flush();
			return status;
		}
		catch (ConfigureException e) {
			System.err.println("Mako options improperly configured: "+e.getMessage());
			return 1;
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading input file: "+e.getMessage());
			return 1;
		}
		catch (UnusualConditionException e) {
			System.err.println("Unusual condition: "+e.getMessage());
			return 1;
		}
		catch (IllegalArgumentException e) {
			System.err.println("Improper string: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Problem reading or writing: "+e.getMessage());
			return 1;
		}
		finally {
			// only close what we opened
			if (w != null && w != out && config.contains("outfile")) {
				try {
					w.close();
				}
				catch (IOException e) {
					System.err.println("Couldn't close "+config.getFile("outfile")+": "+e.getMessage());
				}
			}
		}
	}

	public static void main(String argv[]) {
		Debug.prettyDebug("This is Mako, version "+VERSION);
		System.exit(run(argv, null));
	}
}
