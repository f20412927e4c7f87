package edu.isi.wfsa;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;
import java.util.HashMap;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.DoubleStringParser;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class WFSA {
	// version number. change this when updating!
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// OPTIONS REGARDING THE FUNDAMENTALS OF DATA INPUT

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// semiring: how do we combine the numbers?
		FlaggedOption semiringtype =
			new FlaggedOption("srtype",
					EnumeratedStringParser.getParser("log; tropical; probability"),
					"log",
					true,
					'm',
					"semiring",
					"type of weights: log (log probabilities, written to files as probabilities), tropical "+
			"(min-plus costs), or probability (linear probabilities)");
		jsap.registerParameter(semiringtype);

		// OPTIONS REGARDING HOW INPUTS ARE COMBINED

		Switch concatsw = new Switch("concat",
				JSAP.NO_SHORTFLAG,
				"concat",
		"concatenate the input files in order. Default is to take their union");
		jsap.registerParameter(concatsw);

		FlaggedOption replaceopt = new FlaggedOption("replace",
				StringStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"replace",
				"label=file: expand every state whose label ends in 'label' with the fsm in 'file'. "+
		"May be given many times; expansion is recursive");
		replaceopt.setAllowMultipleDeclarations(true);
		jsap.registerParameter(replaceopt);

		// OPTIONS REGARDING TRANSFORMATIONS, in the order they are applied

		Switch rmnilsw = new Switch("rmnil",
				JSAP.NO_SHORTFLAG,
				"rmnil",
		"remove nil (non-emitting, unlabeled, non-boundary) states");
		jsap.registerParameter(rmnilsw);

		Switch prunesw = new Switch("prune",
				JSAP.NO_SHORTFLAG,
				"prune",
		"remove states that can't be reached from an initial state or can't reach a final state");
		jsap.registerParameter(prunesw);

		Switch pushsw = new Switch("push",
				JSAP.NO_SHORTFLAG,
				"push",
		"push path weights onto arcs (acyclic machines only)");
		jsap.registerParameter(pushsw);

		FlaggedOption selfloopopt = new FlaggedOption("selfloop",
				DoubleStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"selfloop",
		"add a self loop with this probability to every emitting state");
		jsap.registerParameter(selfloopopt);

		Switch detsw = new Switch("determ",
				'd',
				"determinize",
		"determinize with respect to state labels");
		jsap.registerParameter(detsw);

		Switch backsw = new Switch("backward",
				JSAP.NO_SHORTFLAG,
				"backward",
		"with -d, determinize backward from the final states");
		jsap.registerParameter(backsw);

		Switch minsw = new Switch("minimize",
				JSAP.NO_SHORTFLAG,
				"minimize",
		"minimize (acyclic machines only)");
		jsap.registerParameter(minsw);

		Switch transsw = new Switch("transpose",
				'T',
				"transpose",
		"reverse all arcs and swap initial and final weights");
		jsap.registerParameter(transsw);

		Switch normsw = new Switch("norm",
				'n',
				"normalize",
		"renormalize so each state's exits and the initial weights sum to one");
		jsap.registerParameter(normsw);

		// OPTIONS REGARDING OUTPUT

		Switch dotsw = new Switch("dot",
				JSAP.NO_SHORTFLAG,
				"dot",
		"write a graphviz dot graph instead of the fsm format");
		jsap.registerParameter(dotsw);

		Switch csw = new Switch("check",
				'c',
				"check",
		"print a summary of the result instead of the result itself");
		jsap.registerParameter(csw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				't',
				"time",
		"print timing information at this level of detail (1-3)");
		jsap.registerParameter(timeopt);

		FlaggedOption outfileopt = new FlaggedOption("outfile",
				FileStringParser.getParser(),
				null,
				false,
				'o',
				"outputfile",
				"file to write output fsm or summary. If absent, writing is done "+
		"to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				FileStringParser.getParser(),
				null,
				true,
				true,
				"list of input fsm files. The special symbol '-' (no quote) may be specified up to one "+
		"time to indicate reading from STDIN");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);

		if (config.getBoolean("backward") && !config.getBoolean("determ"))
			throw new ConfigureException("--backward only makes sense with -d");
		if (config.getBoolean("determ") && config.getBoolean("minimize"))
			throw new ConfigureException("-d and --minimize are redundant; pick one");
		if (config.getBoolean("dot") && config.getBoolean("check"))
			throw new ConfigureException("Can have at most one of --dot and -c");
		if (config.contains("selfloop")) {
			double p = config.getDouble("selfloop");
			if (!(p > 0 && p < 1))
				throw new ConfigureException("--selfloop probability must be strictly between 0 and 1; got "+p);
		}
		return config;
	}

	static Semiring getSemiring(String srtype) throws ConfigureException {
		if (srtype.equals("log"))
			return new LogSemiring();
		else if (srtype.equals("tropical"))
			return new TropicalSemiring();
		else if (srtype.equals("probability"))
			return new ProbabilitySemiring();
		throw new ConfigureException("Unexpected semiring type: "+srtype);
	}

	// read each input file into an fsm, opening one file at a time. detect stdin here and
	// prevent multiple stdins.
	static FSM[] readInputs(File[] infiles, String encoding, Semiring sr) throws ConfigureException, FileNotFoundException,
	IOException, DataFormatException {
		boolean debug = false;
		boolean seenstdin = false;
		for (File f : infiles) {
			if (f.getName().equals("-")) {
				if (seenstdin)
					throw new ConfigureException("Can only reference stdin (-) once in the list of files");
				seenstdin = true;
			}
		}
		FSM[] ret = new FSM[infiles.length];
		for (int i = 0; i < infiles.length; i++) {
			boolean stdin = infiles[i].getName().equals("-");
			Debug.debug(debug, "Reading from "+(stdin ? "stdin" : infiles[i].getName()));
			BufferedReader br = stdin ?
					new BufferedReader(new InputStreamReader(System.in, encoding)) :
					new BufferedReader(new InputStreamReader(new FileInputStream(infiles[i]), encoding));
			try {
				ret[i] = FSMReader.read(br, sr);
			}
			catch (DataFormatException e) {
				throw new DataFormatException(infiles[i].getName()+": "+e.getMessage(), e);
			}
			finally {
				if (!stdin)
					br.close();
			}
		}
		return ret;
	}

	// label=file pairs for --replace
	static HashMap<String, FSM> readSubstitutions(String[] pairs, String encoding, Semiring sr) throws ConfigureException,
	IOException, DataFormatException {
		HashMap<String, FSM> subs = new HashMap<String, FSM>();
		for (String pair : pairs) {
			int eq = pair.indexOf('=');
			if (eq <= 0 || eq == pair.length()-1)
				throw new ConfigureException("Expected label=file for --replace, got "+pair);
			String label = pair.substring(0, eq);
			if (subs.containsKey(label))
				throw new ConfigureException("Label "+label+" given twice to --replace");
			subs.put(label, FSMReader.read(pair.substring(eq+1), encoding, sr));
		}
		return subs;
	}

	// apply the requested transformations in their fixed order
	static FSM transform(FSM fsm, JSAPResult config, HashMap<String, FSM> subs) throws UnusualConditionException {
		Date pt = new Date();
		if (!subs.isEmpty()) {
			fsm = Substitution.compose(fsm, subs);
			Debug.dbtime(1, pt, "replace");
		}
		if (config.getBoolean("rmnil")) {
			pt = new Date();
			int n = Simplifier.removeNilStates(fsm);
			Debug.dbtime(1, pt, "removed "+n+" nil states");
		}
		if (config.getBoolean("prune")) {
			pt = new Date();
			int n = Simplifier.pruneUnreachable(fsm);
			Debug.dbtime(1, pt, "pruned "+n+" states");
		}
		if (config.getBoolean("push")) {
			pt = new Date();
			Simplifier.pushWeights(fsm);
			Debug.dbtime(1, pt, "push weights");
		}
		if (config.contains("selfloop"))
			fsm.addSelfLoop(config.getDouble("selfloop"));
		if (config.getBoolean("determ")) {
			pt = new Date();
			fsm = Determinizer.determinize(fsm, config.getBoolean("backward") ? Direction.BACKWARD : Direction.FORWARD);
			Debug.dbtime(1, pt, "determinize");
		}
		if (config.getBoolean("minimize")) {
			pt = new Date();
			fsm = Minimizer.minimize(fsm);
			Debug.dbtime(1, pt, "minimize");
		}
		if (config.getBoolean("transpose"))
			fsm = fsm.transpose();
		if (config.getBoolean("norm"))
			fsm.renormalize();
		return fsm;
	}

	// summary of a machine, for -c
	static String check(String name, FSM fsm) {
		int nils = 0;
		int emitting = 0;
		for (FSMState s : fsm.getStates()) {
			if (s.isNil())
				nils++;
			if (s.isEmitting())
				emitting++;
		}
		StringBuffer buffer = new StringBuffer();
		buffer.append("FSM info for "+name+":\n");
		buffer.append("\t"+fsm.getSemiring().getName()+" semiring\n");
		buffer.append("\t"+fsm.getNumStates()+" states\n");
		buffer.append("\t"+fsm.getNumArcs()+" arcs\n");
		buffer.append("\t"+fsm.getInitialStates().size()+" initial states\n");
		buffer.append("\t"+fsm.getFinalStates().size()+" final states\n");
		buffer.append("\t"+emitting+" emitting states\n");
		buffer.append("\t"+nils+" nil states\n");
		buffer.append("\t"+(Simplifier.isAcyclic(fsm) ? "acyclic" : "cyclic")+"\n");
		buffer.append("\t"+(Determinizer.isDeterministic(fsm, Direction.FORWARD) ? "deterministic" : "not deterministic")+"\n");
		return buffer.toString();
	}

	// does the work of main. Returns the exit status. If out is null, output goes to the
	// -o file or stdout
	public static int run(String argv[], Writer out) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		Semiring sr = null;
		String encoding = null;
		File outfile = null;
		File infiles[] = null;
		try {
			config = processParameters(jsap, argv);
			if (config.getBoolean("help")) {
				Debug.prettyDebug("Usage: wfsa ");
				Debug.prettyDebug("             "+jsap.getUsage());
				Debug.prettyDebug("");
				Debug.prettyDebug(jsap.getHelp());
				return 0;
			}
			if (!config.success()) {
				for (java.util.Iterator errs = config.getErrorMessageIterator(); errs.hasNext();)
					Debug.prettyDebug("Error: " + errs.next());
				Debug.prettyDebug("Usage: wfsa ");
				Debug.prettyDebug("             "+jsap.getUsage());
				return 1;
			}
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time"))
				Debug.setDbLevel(config.getInt("time"));
			sr = getSemiring(config.getString("srtype"));
			outfile = config.getFile("outfile");
			infiles = config.getFileArray("infiles");
		}
		catch (JSAPException e) {
			System.err.println("wfsa options improperly configured: "+e.getMessage());
			System.err.println("Try 'wfsa -h' for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("wfsa options improperly configured: "+e.getMessage());
			System.err.println("Try 'wfsa -h' for a detailed help message");
			return 1;
		}

		try {
			Date readTime = new Date();
			FSM[] inputs = readInputs(infiles, encoding, sr);
			HashMap<String, FSM> subs = new HashMap<String, FSM>();
			if (config.contains("replace"))
				subs = readSubstitutions(config.getStringArray("replace"), encoding, sr);
			Debug.dbtime(1, readTime, "read input");

			FSM fsm = config.getBoolean("concat") ? FSM.concat(inputs) : FSM.union(inputs);
			fsm = transform(fsm, config, subs);

			Writer w = out;
			if (w == null) {
				if (outfile != null)
					w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
				else
					w = new OutputStreamWriter(System.out, encoding);
			}
			if (config.getBoolean("check"))
				w.write(check(infiles.length == 1 ? infiles[0].getName() : infiles.length+" files", fsm));
			else if (config.getBoolean("dot"))
				DotWriter.write(fsm, w);
			else
				fsm.print(w);
			w.flush();
			if (out == null && outfile != null)
				w.close();
			return 0;
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Improper data specified: "+e.getMessage());
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("wfsa options improperly configured: "+e.getMessage());
			return 1;
		}
		catch (UnusualConditionException e) {
			System.err.println("Unusual condition: "+e.getMessage());
			return 1;
		}
		catch (InvalidStructureException e) {
			System.err.println("Invalid structure: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("I/O problem: "+e.getMessage());
			return 1;
		}
		catch (OutOfMemoryError e) {
			Runtime runtime = Runtime.getRuntime();
			System.err.println("Out of memory with "+runtime.freeMemory()+" left: "+e.getMessage());
			return 1;
		}
	}

	public static void main(String argv[]) {
		Debug.prettyDebug("This is wfsa, version "+VERSION);
		System.exit(run(argv, null));
	}
}
