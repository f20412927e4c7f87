package edu.isi.wfsa;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.Test;

public class FSMReaderTest {

	private static final double EPS = 1e-12;

	private static FSM read(String text, Semiring sr) throws IOException, DataFormatException {
		return FSMReader.read(new BufferedReader(new StringReader(text)), sr);
	}

	@Test
	public void testRead() throws IOException, DataFormatException {
		String text =
			"% a small machine\n"+
			"\n"+
			"state 10 label=s init=1\n"+
			"state 20 label=\"a b\" pdf=3   % trailing comment\n"+
			"state 30 label=\"100%\" final=0.5\n"+
			"state 40\n"+
			"arc 10 20 0.25\n"+
			"arc 20 30\n"+
			"arc 20 40 0.75\n";
		FSM fsm = read(text, new LogSemiring());
		assertEquals(4, fsm.getNumStates());
		assertEquals(3, fsm.getNumArcs());
		FSMState s = fsm.getState(0);
		assertEquals("s", s.getLabel());
		assertEquals(0.0, s.getInitWeight(), EPS);
		assertFalse(s.isFinal());
		FSMState ab = fsm.getState(1);
		assertEquals("a b", ab.getLabel());
		assertEquals(Integer.valueOf(3), ab.getPdfIndex());
		assertEquals("100%", fsm.getState(2).getLabel());
		assertEquals(Math.log(0.5), fsm.getState(2).getFinalWeight(), EPS);
		assertTrue(fsm.getState(3).isNil());
		assertEquals(Math.log(0.25), fsm.getArcs(0).get(0).getWeight(), EPS);
		assertEquals(0.0, fsm.getArcs(1).get(0).getWeight(), EPS);
		assertEquals(3, fsm.getArcs(1).get(1).getDest());
	}

	@Test
	public void testPrintThenRead() throws IOException, DataFormatException {
		FSM fsm = new FSM(new TropicalSemiring());
		FSMState s = fsm.addState("with \"quotes\"", 2, 0.5, Double.POSITIVE_INFINITY);
		FSMState t = fsm.addState(null, null, Double.POSITIVE_INFINITY, 1.5);
		fsm.addArc(s, t, 3);
		fsm.addArc(t, t, 0.25);
		StringWriter sw = new StringWriter();
		fsm.print(sw);
		FSM back = read(sw.toString(), new TropicalSemiring());
		assertEquals(fsm.getNumStates(), back.getNumStates());
		assertEquals(fsm.getNumArcs(), back.getNumArcs());
		assertEquals("with \"quotes\"", back.getState(0).getLabel());
		assertEquals(Integer.valueOf(2), back.getState(0).getPdfIndex());
		assertEquals(0.5, back.getState(0).getInitWeight(), EPS);
		assertNull(back.getState(1).getLabel());
		assertEquals(1.5, back.getState(1).getFinalWeight(), EPS);
		assertEquals(0.25, back.getArcs(1).get(0).getWeight(), EPS);
	}

	@Test
	public void testPrintFormat() throws IOException {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", 1, 1, 0);
		fsm.addArc(s, fsm.addState("t", null, 0, 0.5), 0.5);
		StringWriter sw = new StringWriter();
		fsm.print(sw);
		assertEquals(
				"% FSM(probability) # states: 2 # arcs: 1\n"+
				"state 0 label=s pdf=1 init=1.0\n"+
				"state 1 label=t final=0.5\n"+
				"arc 0 1 0.5\n", sw.toString());
	}

	private static void assertBad(String text, String expected) throws IOException {
		try {
			read(text, new ProbabilitySemiring());
			fail("read bad input: "+text);
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith(expected));
		}
	}

	@Test
	public void testErrors() throws IOException {
		assertBad("state 0\nstate 0\n", "Line 2: state 0 declared twice");
		assertBad("state 0\narc 0 1\n", "Line 2: arc uses undeclared state");
		assertBad("state 0 color=red\n", "Line 1: Unknown state attribute color");
		assertBad("state 0 init=-1\n", "Line 1: Weight -1 is not a valid probability weight");
		assertBad("state 0 pdf=x\n", "Line 1: bad number");
		assertBad("state 0\narc 0 0 lots\n", "Line 2: bad number");
		assertBad("\nnonsense\n", "Line 2: expected state or arc");
	}

	@Test
	public void testStripComment() {
		assertEquals("state 1", FSMReader.stripComment("state 1 % note"));
		assertEquals("state 1 label=\"a%b\"", FSMReader.stripComment("state 1 label=\"a%b\" % note"));
		assertEquals("a\"b", FSMReader.unquote("\"a\\\"b\""));
		assertEquals("plain", FSMReader.unquote("plain"));
	}
}
