package edu.isi.wfsa;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import gnu.trove.map.hash.TIntObjectHashMap;

// reads the line format written by FSM.print:
//   % comment
//   state <id> [label=<text>] [pdf=<int>] [init=<weight>] [final=<weight>]
//   arc <src> <dst> [<weight>]
// weights are in the semiring's print form. States must be declared before arcs use them
public class FSMReader {

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");

	private static Pattern statePat = Pattern.compile("state\\s+(\\d+)((?:\\s+\\w+=(?:\"(?:[^\"\\\\]|\\\\.)*\"|[^\\s\"]+))*)");
	private static Pattern attrPat = Pattern.compile("(\\w+)=(\"(?:[^\"\\\\]|\\\\.)*\"|[^\\s\"]+)");
	private static Pattern arcPat = Pattern.compile("arc\\s+(\\d+)\\s+(\\d+)(?:\\s+(\\S+))?");

	public static FSM read(String filename, Semiring s) throws FileNotFoundException, IOException, DataFormatException {
		return read(filename, "utf-8", s);
	}
	public static FSM read(String filename, String encoding, Semiring s) throws FileNotFoundException, IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding));
		try {
			return read(br, s);
		}
		finally {
			br.close();
		}
	}

	public static FSM read(BufferedReader br, Semiring s) throws IOException, DataFormatException {
		boolean debug = false;
		FSM fsm = new FSM(s);
		TIntObjectHashMap<FSMState> ids = new TIntObjectHashMap<FSMState>();
		int linenum = 0;
		String line;
		while ((line = br.readLine()) != null) {
			linenum++;
			if (commentPat.matcher(line).matches()) {
				if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
				continue;
			}
			String text = stripComment(line);
			try {
				Matcher stateMatch = statePat.matcher(text);
				Matcher arcMatch = arcPat.matcher(text);
				if (stateMatch.matches()) {
					int id = Integer.parseInt(stateMatch.group(1));
					if (ids.containsKey(id))
						throw new DataFormatException("Line "+linenum+": state "+id+" declared twice");
					ids.put(id, readState(fsm, stateMatch.group(2)));
				}
				else if (arcMatch.matches()) {
					FSMState src = ids.get(Integer.parseInt(arcMatch.group(1)));
					FSMState dst = ids.get(Integer.parseInt(arcMatch.group(2)));
					if (src == null || dst == null)
						throw new DataFormatException("Line "+linenum+": arc uses undeclared state: "+text);
					double w = s.ONE();
					if (arcMatch.group(3) != null)
						w = readWeight(s, arcMatch.group(3));
					fsm.addArc(src, dst, w);
				}
				else
					throw new DataFormatException("Line "+linenum+": expected state or arc, got "+text);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Line "+linenum+": bad number in "+text, e);
			}
			catch (InvalidStructureException e) {
				throw new DataFormatException("Line "+linenum+": "+e.getMessage(), e);
			}
			catch (DataFormatException e) {
				if (e.getMessage().startsWith("Line "))
					throw e;
				throw new DataFormatException("Line "+linenum+": "+e.getMessage(), e);
			}
		}
		if (debug) Debug.debug(debug, "Read "+fsm.summary());
		return fsm;
	}

	private static FSMState readState(FSM fsm, String attrs) throws DataFormatException {
		Semiring s = fsm.getSemiring();
		String label = null;
		Integer pdf = null;
		double init = s.ZERO();
		double fin = s.ZERO();
		Matcher m = attrPat.matcher(attrs);
		while (m.find()) {
			String key = m.group(1);
			String val = m.group(2);
			if (key.equals("label"))
				label = unquote(val);
			else if (key.equals("pdf"))
				pdf = Integer.valueOf(val);
			else if (key.equals("init"))
				init = readWeight(s, val);
			else if (key.equals("final"))
				fin = readWeight(s, val);
			else
				throw new DataFormatException("Unknown state attribute "+key);
		}
		return fsm.addState(label, pdf, init, fin);
	}

	private static double readWeight(Semiring s, String val) throws DataFormatException {
		double w = s.printToInternal(Double.parseDouble(val));
		if (!s.isValid(w))
			throw new DataFormatException("Weight "+val+" is not a valid "+s.getName()+" weight");
		return w;
	}

	// cut a trailing comment, leaving % inside quoted labels alone
	static String stripComment(String line) {
		boolean inQuote = false;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (inQuote && c == '\\')
				i++;
			else if (c == '"')
				inQuote = !inQuote;
			else if (c == '%' && !inQuote)
				return line.substring(0, i).trim();
		}
		return line.trim();
	}

	static String unquote(String val) {
		if (!val.startsWith("\""))
			return val;
		StringBuffer sb = new StringBuffer();
		for (int i = 1; i < val.length()-1; i++) {
			char c = val.charAt(i);
			if (c == '\\' && i+1 < val.length()-1)
				c = val.charAt(++i);
			sb.append(c);
		}
		return sb.toString();
	}
}
