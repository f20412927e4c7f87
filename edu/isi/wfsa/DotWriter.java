package edu.isi.wfsa;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Renders an FSM as a Graphviz dot graph. Only reads the public surface of the
 * machine. Nodes show <code>label:pdf</code> (ϵ for a missing value) followed by
 * the initial and final weights when they are non-zero; final states are double
 * circles, initial states have a thick border, emitting states are filled.
 * Weights are shown in the semiring's print form, rounded to 3 digits.
 */
public class DotWriter {

	public static void write(FSM fsm, Writer w) throws IOException {
		Semiring sr = fsm.getSemiring();
		w.write("digraph {\n");
		w.write("  rankdir=LR;\n");
		for (FSMState s : fsm.getStates()) {
			StringBuffer label = new StringBuffer();
			label.append(s.isLabeled() ? s.getLabel() : "ϵ");
			label.append(":");
			label.append(s.isEmitting() ? s.getPdfIndex().toString() : "ϵ");
			if (s.isInitial())
				label.append("/"+round(sr.internalToPrint(s.getInitWeight())));
			if (s.isFinal())
				label.append("/"+round(sr.internalToPrint(s.getFinalWeight())));
			String attrs = "shape="+(s.isFinal() ? "doublecircle" : "circle");
			attrs += " penwidth="+(s.isInitial() ? "2" : "1");
			attrs += " label="+escape(label.toString());
			attrs += " style=filled fillcolor="+(s.isEmitting() ? "lightblue" : "none");
			w.write("  "+s.getId()+" [ "+attrs+" ];\n");
		}
		for (FSMState s : fsm.getStates()) {
			for (Arc a : fsm.getArcs(s))
				w.write("  "+a.getSource()+" -> "+a.getDest()+" [ label="+escape(round(sr.internalToPrint(a.getWeight())))+" ];\n");
		}
		w.write("}\n");
		w.flush();
	}

	public static String toDot(FSM fsm) {
		StringWriter sw = new StringWriter();
		try {
			write(fsm, sw);
		}
		catch (IOException e) {
			// a StringWriter doesn't throw
			throw new IllegalStateException(e);
		}
		return sw.toString();
	}

	static String round(double v) {
		if (Double.isInfinite(v) || Double.isNaN(v))
			return Double.toString(v);
		return Double.toString(Math.round(v*1000.0)/1000.0);
	}

	// any double-quoted string is a dot id, as long as inner quotes are escaped
	private static String escape(String str) {
		return "\""+str.replace("\\", "\\\\").replace("\"", "\\\"")+"\"";
	}
}
