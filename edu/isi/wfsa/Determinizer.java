package edu.isi.wfsa;

import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.Map;

import gnu.trove.set.hash.TIntHashSet;

/**
 * Weighted subset construction with respect to state labels. Each state of the
 * result stands for a class: the set of original states with one label that can
 * be reached together. Weights of a class (entry, exit, and the arcs between two
 * classes) are the semiring sums of its members' weights.
 *
 * The construction walks in a {@link Direction}: FORWARD from the initial states
 * along outgoing arcs, BACKWARD from the final states along incoming arcs. The
 * result always has its arcs in the original orientation.
 *
 * Nothing bounds the number of classes; the worst case is exponential in the
 * number of states.
 */
public class Determinizer {

	// a class is identified by exactly which original states are in it
	static class StateClass {
		final int[] members;
		final String label;
		private final int hsh;
		StateClass(TIntHashSet set, String l) {
			members = set.toArray();
			Arrays.sort(members);
			label = l;
			hsh = Arrays.hashCode(members);
		}
		public int hashCode() {
			return hsh;
		}
		public boolean equals(Object o) {
			if (!(o instanceof StateClass))
				return false;
			return Arrays.equals(members, ((StateClass)o).members);
		}
		public String toString() {
			return label+":"+Arrays.toString(members);
		}
	}

	// the members reached under one label, and the summed weight of the arcs that reached them
	private static class Successor {
		TIntHashSet members = new TIntHashSet();
		double weight;
		Successor(double w) { weight = w; }
	}

	public static FSM determinize(FSM fsm) {
		return determinize(fsm, Direction.FORWARD);
	}

	public static FSM determinize(FSM fsm, Direction dir) {
		boolean debug = false;
		Date startTime = new Date();
		Semiring sr = fsm.getSemiring();
		FSM ret = new FSM(sr);
		HashMap<StateClass, FSMState> built = new HashMap<StateClass, FSMState>();
		LinkedList<StateClass> queue = new LinkedList<StateClass>();

		// seeds: the frontier, grouped by label
		LinkedHashMap<String, TIntHashSet> seeds = new LinkedHashMap<String, TIntHashSet>();
		for (FSMState s : fsm.getStates()) {
			if (!dir.isFrontier(fsm, s))
				continue;
			if (!seeds.containsKey(s.getLabel()))
				seeds.put(s.getLabel(), new TIntHashSet());
			seeds.get(s.getLabel()).add(s.getId());
		}
		for (Map.Entry<String, TIntHashSet> e : seeds.entrySet()) {
			StateClass c = new StateClass(e.getValue(), e.getKey());
			double frontier = sr.ZERO();
			for (int m : c.members)
				frontier = sr.plus(frontier, dir.frontierWeight(fsm.getState(m)));
			built.put(c, buildState(fsm, ret, dir, c, frontier));
			queue.add(c);
		}

		int arcCount = 0;
		while (!queue.isEmpty()) {
			StateClass curr = queue.removeFirst();
			if (debug) Debug.debug(debug, "Expanding "+curr);
			LinkedHashMap<String, Successor> nexts = new LinkedHashMap<String, Successor>();
			for (int m : curr.members) {
				for (Arc a : dir.arcs(fsm, fsm.getState(m))) {
					if (sr.isZero(a.getWeight()))
						continue;
					int nxt = dir.next(a);
					String label = fsm.getState(nxt).getLabel();
					Successor succ = nexts.get(label);
					if (succ == null) {
						succ = new Successor(sr.ZERO());
						nexts.put(label, succ);
					}
					succ.members.add(nxt);
					succ.weight = sr.plus(succ.weight, a.getWeight());
				}
			}
			for (Map.Entry<String, Successor> e : nexts.entrySet()) {
				StateClass c = new StateClass(e.getValue().members, e.getKey());
				if (!built.containsKey(c)) {
					built.put(c, buildState(fsm, ret, dir, c, sr.ZERO()));
					queue.add(c);
				}
				dir.addArc(ret, built.get(curr), built.get(c), e.getValue().weight);
				arcCount++;
			}
		}
		if (debug) Debug.debug(debug, "Built "+built.size()+" classes and "+arcCount+" arcs from "+fsm.summary());
		Debug.dbtime(3, startTime, "determinize "+dir);
		return ret;
	}

	// new state for a class: its label, the members' common pdf index if they share one,
	// the given frontier weight and the summed terminal weight of the members
	private static FSMState buildState(FSM fsm, FSM ret, Direction dir, StateClass c, double frontier) {
		Semiring sr = fsm.getSemiring();
		double terminal = sr.ZERO();
		Integer pdf = fsm.getState(c.members[0]).getPdfIndex();
		for (int m : c.members) {
			FSMState s = fsm.getState(m);
			terminal = sr.plus(terminal, dir.terminalWeight(s));
			if (pdf != null && !pdf.equals(s.getPdfIndex()))
				pdf = null;
		}
		return dir.addState(ret, c.label, pdf, frontier, terminal);
	}

	// true if no state has two arcs (in the walk direction) to states with the same label
	public static boolean isDeterministic(FSM fsm, Direction dir) {
		for (FSMState s : fsm.getStates()) {
			HashMap<String, Integer> seen = new HashMap<String, Integer>();
			for (Arc a : dir.arcs(fsm, s)) {
				String label = fsm.getState(dir.next(a)).getLabel();
				Integer prev = seen.get(label);
				if (prev != null && prev.intValue() != dir.next(a))
					return false;
				seen.put(label, dir.next(a));
			}
		}
		return true;
	}
}
