package edu.isi.wfsa;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

// in-place clean-up passes: nil state removal, weight pushing, reachability pruning.
// Also the cycle check the acyclic-only passes rely on
public class Simplifier {

	// remove every nil state (non-emitting, unlabeled, not initial or final), bridging
	// each predecessor to each successor. Loops on the nil state are folded in through
	// the semiring closure. Repeats until no nil state is left; returns how many were removed
	public static int removeNilStates(FSM fsm) throws UnusualConditionException {
		boolean debug = false;
		Semiring sr = fsm.getSemiring();
		int removed = 0;
		FSMState nil = findNil(fsm);
		while (nil != null) {
			ArrayList<Arc> in = new ArrayList<Arc>(fsm.getIncomingArcs(nil));
			ArrayList<Arc> out = new ArrayList<Arc>(fsm.getArcs(nil));
			double loop = sr.ZERO();
			for (Arc a : out)
				if (a.isSelfLoop())
					loop = sr.plus(loop, a.getWeight());
			double closure = sr.star(loop);
			if (debug) Debug.debug(debug, "Bridging "+in.size()+" x "+out.size()+" arcs around "+nil);
			for (Arc ia : in) {
				if (ia.isSelfLoop())
					continue;
				FSMState pred = fsm.getState(ia.getSource());
				double pre = sr.times(ia.getWeight(), closure);
				for (Arc oa : out) {
					if (oa.isSelfLoop())
						continue;
					double w = sr.times(pre, oa.getWeight());
					if (sr.isZero(w))
						continue;
					fsm.addArc(pred, fsm.getState(oa.getDest()), w);
				}
			}
			fsm.removeState(nil);
			removed++;
			nil = findNil(fsm);
		}
		return removed;
	}

	private static FSMState findNil(FSM fsm) {
		for (FSMState s : fsm.getStates())
			if (s.isNil())
				return s;
		return null;
	}

	// in place: a single walk from the initial states, each state visited once. A state's
	// accumulated weight is the weight of the arc it was first reached by (its initial
	// weight for initial states); that weight is multiplied into each outgoing arc
	// and into the final weight. Only defined for acyclic machines
	public static void pushWeights(FSM fsm) throws UnusualConditionException {
		checkAcyclic(fsm, "weight pushing");
		Semiring sr = fsm.getSemiring();
		boolean[] visited = new boolean[fsm.getNumStates()];
		TIntArrayList stack = new TIntArrayList();
		TDoubleArrayList accs = new TDoubleArrayList();
		List<FSMState> inits = fsm.getInitialStates();
		// reversed so the first initial state is walked first
		for (int i = inits.size()-1; i >= 0; i--) {
			stack.add(inits.get(i).getId());
			accs.add(inits.get(i).getInitWeight());
		}
		while (!stack.isEmpty()) {
			int id = stack.removeAt(stack.size()-1);
			double acc = accs.removeAt(accs.size()-1);
			if (visited[id])
				continue;
			visited[id] = true;
			FSMState s = fsm.getState(id);
			for (Arc a : fsm.getArcs(s)) {
				a.setWeight(sr.times(a.getWeight(), acc));
				if (!visited[a.getDest()]) {
					stack.add(a.getDest());
					accs.add(a.getWeight());
				}
			}
			s.setFinalWeight(sr.times(s.getFinalWeight(), acc));
		}
	}

	// states that can't be reached from the frontier of the given direction.
	// Arcs with zero weight don't count
	public static ArrayList<FSMState> unreachableStates(FSM fsm, Direction dir) {
		Semiring sr = fsm.getSemiring();
		TIntHashSet reached = new TIntHashSet();
		TIntArrayList tovisit = new TIntArrayList();
		for (FSMState s : fsm.getStates()) {
			if (dir.isFrontier(fsm, s)) {
				reached.add(s.getId());
				tovisit.add(s.getId());
			}
		}
		while (!tovisit.isEmpty()) {
			int id = tovisit.removeAt(tovisit.size()-1);
			for (Arc a : dir.arcs(fsm, fsm.getState(id))) {
				if (sr.isZero(a.getWeight()))
					continue;
				int nxt = dir.next(a);
				if (reached.add(nxt))
					tovisit.add(nxt);
			}
		}
		ArrayList<FSMState> ret = new ArrayList<FSMState>();
		for (FSMState s : fsm.getStates())
			if (!reached.contains(s.getId()))
				ret.add(s);
		return ret;
	}

	// in place: remove states not both forward and backward reachable. Returns how many
	public static int pruneUnreachable(FSM fsm) {
		boolean debug = false;
		HashSet<FSMState> doomed = new HashSet<FSMState>(unreachableStates(fsm, Direction.FORWARD));
		doomed.addAll(unreachableStates(fsm, Direction.BACKWARD));
		if (debug) Debug.debug(debug, "Pruning "+doomed.size()+" of "+fsm.getNumStates()+" states");
		fsm.removeStates(doomed);
		return doomed.size();
	}

	// depth-first search with an explicit stack. A self loop is a cycle
	public static boolean isAcyclic(FSM fsm) {
		int n = fsm.getNumStates();
		// 0 = unseen, 1 = on the current path, 2 = finished
		int[] color = new int[n];
		TIntArrayList stack = new TIntArrayList();
		TIntArrayList pos = new TIntArrayList();
		for (int root = 0; root < n; root++) {
			if (color[root] != 0)
				continue;
			color[root] = 1;
			stack.add(root);
			pos.add(0);
			while (!stack.isEmpty()) {
				int top = stack.size()-1;
				int id = stack.get(top);
				int p = pos.get(top);
				List<Arc> arcs = fsm.getArcs(id);
				if (p >= arcs.size()) {
					color[id] = 2;
					stack.removeAt(top);
					pos.removeAt(top);
					continue;
				}
				pos.set(top, p+1);
				int nxt = arcs.get(p).getDest();
				if (color[nxt] == 1)
					return false;
				if (color[nxt] == 0) {
					color[nxt] = 1;
					stack.add(nxt);
					pos.add(0);
				}
			}
		}
		return true;
	}

	public static void checkAcyclic(FSM fsm, String operation) throws UnusualConditionException {
		if (!isAcyclic(fsm))
			throw new UnusualConditionException("Can't do "+operation+": fsm has a cycle");
	}
}
