package edu.isi.wfsa;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;

import org.junit.Test;

public class MinimizerTest {

	private static final double EPS = 1e-9;

	private static double lg(double p) { return Math.log(p); }

	// "s a b c" and "s a b d" with probability one half each, as two unshared branches
	private static FSM branches() {
		FSM fsm = new FSM();
		double zero = fsm.getSemiring().ZERO();
		FSMState s = fsm.addState("s", 0, lg(1), zero);
		FSMState a1 = fsm.addState("a", 1);
		FSMState a2 = fsm.addState("a", 1);
		FSMState b1 = fsm.addState("b", 2);
		FSMState b2 = fsm.addState("b", 2);
		FSMState c = fsm.addState("c", 3, zero, lg(1));
		FSMState d = fsm.addState("d", 4, zero, lg(1));
		fsm.addArc(s, a1, lg(0.5));
		fsm.addArc(s, a2, lg(0.5));
		fsm.addArc(a1, b1);
		fsm.addArc(a2, b2);
		fsm.addArc(b1, c);
		fsm.addArc(b2, d);
		return fsm;
	}

	@Test
	public void testMinimizeSharesPrefix() throws UnusualConditionException {
		FSM fsm = branches();
		FSM min = Minimizer.minimize(fsm);
		assertEquals(7, fsm.getNumStates());
		assertEquals(5, min.getNumStates());
		assertEquals(4, min.getNumArcs());
		PathSums.assertSame(fsm, min);
		HashMap<String, Double> sums = PathSums.of(min);
		assertEquals(lg(0.5), sums.get("s a b c"), EPS);
		assertEquals(lg(0.5), sums.get("s a b d"), EPS);
	}

	@Test
	public void testMinimizeSharesSuffix() throws UnusualConditionException {
		FSM fsm = new FSM();
		double zero = fsm.getSemiring().ZERO();
		FSMState s = fsm.addState("s", null, lg(1), zero);
		FSMState a = fsm.addState("a");
		FSMState b = fsm.addState("b");
		FSMState c1 = fsm.addState("c", null, zero, lg(1));
		FSMState c2 = fsm.addState("c", null, zero, lg(1));
		fsm.addArc(s, a, lg(0.5));
		fsm.addArc(s, b, lg(0.5));
		fsm.addArc(a, c1);
		fsm.addArc(b, c2);
		FSM min = Minimizer.minimize(fsm);
		assertEquals(4, min.getNumStates());
		assertEquals(1, min.getFinalStates().size());
		assertEquals(lg(1), min.getFinalStates().get(0).getFinalWeight(), EPS);
		PathSums.assertSame(fsm, min);
	}

	@Test
	public void testMinimizeIsDeterministic() throws UnusualConditionException {
		FSM min = Minimizer.minimize(branches());
		assertTrue(Determinizer.isDeterministic(min, Direction.FORWARD));
		assertTrue(Determinizer.isDeterministic(min, Direction.BACKWARD));
	}

	@Test(expected = UnusualConditionException.class)
	public void testMinimizeRejectsCycle() throws UnusualConditionException {
		FSM fsm = branches();
		fsm.addArc(fsm.getState(5), fsm.getState(0), lg(0.5));
		Minimizer.minimize(fsm);
	}

	@Test
	public void testMinimizeExpanded() throws UnusualConditionException {
		FSM fsm = branches();
		// a nil state and a dead end for the clean-up passes to take out
		FSMState n = fsm.addState();
		FSMState e = fsm.addState("e");
		fsm.addArc(fsm.getState(0), n, fsm.getSemiring().ZERO());
		fsm.addArc(fsm.getState(3), e, lg(0.5));
		FSM min = Minimizer.minimizeExpanded(fsm);
		// input untouched
		assertEquals(9, fsm.getNumStates());
		assertEquals(5, min.getNumStates());
		PathSums.assertSame(branches(), min);
	}

	// same shape as branches() but with unequal weights, so the two "a" states carry
	// different prefix mass into their suffixes
	private static FSM unevenBranches() {
		FSM fsm = new FSM(new ProbabilitySemiring());
		FSMState s = fsm.addState("s", null, 1, 0);
		FSMState a1 = fsm.addState("a");
		FSMState a2 = fsm.addState("a");
		FSMState b1 = fsm.addState("b");
		FSMState b2 = fsm.addState("b");
		FSMState c1 = fsm.addState("c", null, 0, 1);
		FSMState d1 = fsm.addState("d", null, 0, 1);
		FSMState c2 = fsm.addState("c", null, 0, 1);
		FSMState d2 = fsm.addState("d", null, 0, 1);
		fsm.addArc(s, a1, 0.2);
		fsm.addArc(s, a2, 0.8);
		fsm.addArc(a1, b1);
		fsm.addArc(a2, b2);
		fsm.addArc(b1, c1, 0.9);
		fsm.addArc(b1, d1, 0.1);
		fsm.addArc(b2, c2, 0.1);
		fsm.addArc(b2, d2, 0.9);
		return fsm;
	}

	@Test
	public void testMinimizeUnevenBranches() throws UnusualConditionException {
		FSM fsm = unevenBranches();
		HashMap<String, Double> before = PathSums.of(fsm);
		assertEquals(0.26, before.get("s a b c"), EPS);
		assertEquals(0.74, before.get("s a b d"), EPS);
		FSM min = Minimizer.minimize(fsm);
		assertEquals(5, min.getNumStates());
		PathSums.assertSame(fsm.getSemiring(), before, PathSums.of(min));
		// input untouched by the push
		assertEquals(0.2, fsm.getArcs(0).get(0).getWeight(), 0);
		assertEquals(1.0, fsm.getState(5).getFinalWeight(), 0);
	}

	@Test
	public void testMinimizeExpandedUnevenBranches() throws UnusualConditionException {
		FSM fsm = unevenBranches();
		FSM min = Minimizer.minimizeExpanded(fsm);
		assertEquals(5, min.getNumStates());
		PathSums.assertSame(fsm, min);
	}

	@Test
	public void testMinimizeUnevenLogWeights() throws UnusualConditionException {
		FSM fsm = new FSM();
		double zero = fsm.getSemiring().ZERO();
		FSMState s = fsm.addState("s", null, lg(1), zero);
		FSMState a1 = fsm.addState("a");
		FSMState a2 = fsm.addState("a");
		fsm.addArc(s, a1, lg(0.3));
		fsm.addArc(s, a2, lg(0.7));
		fsm.addArc(a1, fsm.addState("x", null, zero, lg(1)));
		fsm.addArc(a2, fsm.addState("y", null, zero, lg(1)));
		FSM min = Minimizer.minimize(fsm);
		assertEquals(4, min.getNumStates());
		HashMap<String, Double> sums = PathSums.of(min);
		assertEquals(lg(0.3), sums.get("s a x"), EPS);
		assertEquals(lg(0.7), sums.get("s a y"), EPS);
	}

	@Test
	public void testMinimizeTropical() throws UnusualConditionException {
		FSM fsm = new FSM(new TropicalSemiring());
		FSMState s = fsm.addState("s", null, 0, Double.POSITIVE_INFINITY);
		FSMState a1 = fsm.addState("a", null, Double.POSITIVE_INFINITY, 0);
		FSMState a2 = fsm.addState("a", null, Double.POSITIVE_INFINITY, 0);
		fsm.addArc(s, a1, 1);
		fsm.addArc(s, a2, 2);
		FSM min = Minimizer.minimize(fsm);
		assertEquals(2, min.getNumStates());
		assertEquals(1, min.getNumArcs());
	}
}
