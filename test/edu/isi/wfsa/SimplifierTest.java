package edu.isi.wfsa;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class SimplifierTest {

	private static final double EPS = 1e-12;

	@Test
	public void testRemoveNilState() throws UnusualConditionException {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState n = fsm.addState();
		FSMState a = fsm.addState("a", 0, 0, 1);
		FSMState b = fsm.addState("b", 1, 0, 1);
		fsm.addArc(s, n, 0.5);
		fsm.addArc(n, a, 0.4);
		fsm.addArc(n, b, 0.6);
		FSM before = fsm.copy();
		assertEquals(1, Simplifier.removeNilStates(fsm));
		assertEquals(3, fsm.getNumStates());
		assertEquals(2, fsm.getNumArcs());
		assertFalse(n.isLive());
		List<Arc> arcs = fsm.getArcs(s);
		assertEquals(0.2, arcs.get(0).getWeight(), EPS);
		assertEquals(a, arcs.get(0).getDestState());
		assertEquals(0.3, arcs.get(1).getWeight(), EPS);
		PathSums.assertSame(before, fsm);
	}

	@Test
	public void testRemoveNilChain() throws UnusualConditionException {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState n1 = fsm.addState();
		FSMState n2 = fsm.addState();
		FSMState a = fsm.addState("a", null, 0, 1);
		FSMState b = fsm.addState("b", null, 0, 1);
		fsm.addArc(s, n1, 0.5);
		fsm.addArc(s, n2, 0.5);
		fsm.addArc(n1, n2, 0.5);
		fsm.addArc(n1, a, 0.5);
		fsm.addArc(n2, b, 1);
		FSM before = fsm.copy();
		assertEquals(2, Simplifier.removeNilStates(fsm));
		assertEquals(3, fsm.getNumStates());
		for (FSMState st : fsm.getStates())
			assertFalse(st.isNil());
		PathSums.assertSame(before, fsm);
		assertEquals(0.75, PathSums.of(fsm).get("s b"), EPS);
	}

	@Test
	public void testRemoveNilSelfLoop() throws UnusualConditionException {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState n = fsm.addState();
		FSMState a = fsm.addState("a", null, 0, 1);
		fsm.addArc(s, n, 1);
		fsm.addArc(n, n, 0.5);
		fsm.addArc(n, a, 0.5);
		Simplifier.removeNilStates(fsm);
		assertEquals(2, fsm.getNumStates());
		assertEquals(1, fsm.getNumArcs());
		// 1 * (1 + .5 + .25 + ...) * .5
		assertEquals(1.0, fsm.getArcs(s).get(0).getWeight(), EPS);
	}

	@Test(expected = UnusualConditionException.class)
	public void testRemoveNilDivergentLoop() throws UnusualConditionException {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState n = fsm.addState();
		fsm.addArc(s, n, 1);
		fsm.addArc(n, n, 1);
		fsm.addArc(n, fsm.addState("a", null, 0, 1), 1);
		Simplifier.removeNilStates(fsm);
	}

	@Test
	public void testBoundaryStatesStay() throws UnusualConditionException {
		FSM fsm = new FSM();
		FSMState s = fsm.addState(null, null, 0, Double.NEGATIVE_INFINITY);
		FSMState t = fsm.addState(null, null, Double.NEGATIVE_INFINITY, 0);
		fsm.addArc(s, t);
		assertEquals(0, Simplifier.removeNilStates(fsm));
		assertEquals(2, fsm.getNumStates());
	}

	@Test
	public void testPrune() {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState a = fsm.addState("a", null, 0, 1);
		FSMState dead = fsm.addState("dead");
		FSMState orphan = fsm.addState("orphan");
		FSMState zeroed = fsm.addState("zeroed", null, 0, 1);
		fsm.addArc(s, a, 1);
		fsm.addArc(s, dead, 1);
		fsm.addArc(orphan, a, 1);
		fsm.addArc(s, zeroed, 0);
		ArrayList<FSMState> fwd = Simplifier.unreachableStates(fsm, Direction.FORWARD);
		assertEquals(2, fwd.size());
		assertTrue(fwd.contains(orphan));
		assertTrue(fwd.contains(zeroed));
		ArrayList<FSMState> bwd = Simplifier.unreachableStates(fsm, Direction.BACKWARD);
		assertEquals(1, bwd.size());
		assertTrue(bwd.contains(dead));
		assertEquals(3, Simplifier.pruneUnreachable(fsm));
		assertEquals(2, fsm.getNumStates());
		assertEquals(1, fsm.getNumArcs());
		assertEquals(1, a.getId());
	}

	@Test
	public void testPushWeights() throws UnusualConditionException {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState a = fsm.addState("a");
		FSMState b = fsm.addState("b", null, 0, 1);
		fsm.addArc(s, a, 0.5);
		fsm.addArc(a, b, 0.5);
		Simplifier.pushWeights(fsm);
		assertEquals(0.5, fsm.getArcs(s).get(0).getWeight(), EPS);
		assertEquals(0.25, fsm.getArcs(a).get(0).getWeight(), EPS);
		assertEquals(0.25, b.getFinalWeight(), EPS);
	}

	@Test
	public void testPushWeightsVisitsOnce() throws UnusualConditionException {
		// two ways into b; b's own arcs are scaled only once
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState a = fsm.addState("a");
		FSMState b = fsm.addState("b");
		FSMState c = fsm.addState("c", null, 0, 1);
		fsm.addArc(s, a, 0.5);
		fsm.addArc(s, b, 0.5);
		fsm.addArc(a, b, 0.5);
		fsm.addArc(b, c, 1);
		Simplifier.pushWeights(fsm);
		double bc = fsm.getArcs(b).get(0).getWeight();
		assertTrue(bc == 0.5 || bc == 0.25);
		assertEquals(bc, c.getFinalWeight(), EPS);
	}

	@Test
	public void testAcyclic() {
		FSM fsm = FSMTest.chain("a", "b", "c");
		assertTrue(Simplifier.isAcyclic(fsm));
		fsm.addArc(fsm.getState(2), fsm.getState(0));
		assertFalse(Simplifier.isAcyclic(fsm));
		FSM loop = FSMTest.chain("a");
		loop.addArc(loop.getState(0), loop.getState(0));
		assertFalse(Simplifier.isAcyclic(loop));
		// diamond
		FSM d = new FSM();
		FSMState s = d.addState("s");
		FSMState l = d.addState("l");
		FSMState r = d.addState("r");
		FSMState t = d.addState("t");
		d.addArc(s, l);
		d.addArc(s, r);
		d.addArc(l, t);
		d.addArc(r, t);
		assertTrue(Simplifier.isAcyclic(d));
	}

	@Test
	public void testPushRejectsCycle() {
		FSM fsm = FSMTest.chain("a", "b");
		fsm.addArc(fsm.getState(1), fsm.getState(0));
		try {
			Simplifier.pushWeights(fsm);
			fail("pushed weights around a cycle");
		}
		catch (UnusualConditionException e) {
			assertEquals("Can't do weight pushing: fsm has a cycle", e.getMessage());
		}
	}
}
