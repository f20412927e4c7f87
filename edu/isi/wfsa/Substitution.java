package edu.isi.wfsa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

import gnu.trove.list.array.TDoubleArrayList;

/**
 * Hierarchical expansion: states are replaced by whole sub-machines, keyed by
 * label. A label is matched on its last delimiter-separated token, so after
 * expanding <code>x</code> into states labeled <code>x!a</code>, <code>x!b</code>,
 * those match keys <code>a</code> and <code>b</code> at the next level.
 *
 * Arcs into a replaced state go to every initial state of its sub-machine
 * (times that initial weight); arcs out of it leave from every final state
 * (times that final weight).
 */
public class Substitution {

	public static final String DELIM = "!";

	// where paths enter and leave the stand-in for one original state
	private static class Endpoints {
		ArrayList<FSMState> entries = new ArrayList<FSMState>();
		TDoubleArrayList entryWeights = new TDoubleArrayList();
		ArrayList<FSMState> exits = new ArrayList<FSMState>();
		TDoubleArrayList exitWeights = new TDoubleArrayList();
	}

	// the key a label is matched against
	public static String matchLabel(String label, String delim) {
		if (label == null)
			return null;
		int i = label.lastIndexOf(delim);
		if (i < 0)
			return label;
		return label.substring(i+delim.length());
	}

	public static FSM replace(FSM fsm, Map<String, FSM> subs) {
		return replace(fsm, subs, DELIM);
	}

	// one level of replacement into a new machine. States without a matching
	// sub-machine are copied as they are
	public static FSM replace(FSM fsm, Map<String, FSM> subs, String delim) {
		boolean debug = false;
		Semiring sr = fsm.getSemiring();
		FSM ret = new FSM(sr);
		Endpoints[] ends = new Endpoints[fsm.getNumStates()];
		for (FSMState s : fsm.getStates()) {
			Endpoints e = new Endpoints();
			FSM sub = lookup(fsm, s, subs, delim);
			if (sub == null) {
				FSMState ns = ret.addState(s.getLabel(), s.getPdfIndex(), s.getInitWeight(), s.getFinalWeight());
				e.entries.add(ns);
				e.entryWeights.add(sr.ONE());
				e.exits.add(ns);
				e.exitWeights.add(sr.ONE());
			}
			else {
				if (debug) Debug.debug(debug, "Replacing "+s+" with "+sub.summary());
				FSMState[] map = copySub(ret, s, sub, delim);
				collectEndpoints(sub, map, e);
			}
			ends[s.getId()] = e;
		}
		for (FSMState s : fsm.getStates()) {
			Endpoints from = ends[s.getId()];
			for (Arc a : fsm.getArcs(s)) {
				Endpoints to = ends[a.getDest()];
				for (int i = 0; i < from.exits.size(); i++) {
					double pre = sr.times(from.exitWeights.get(i), a.getWeight());
					for (int j = 0; j < to.entries.size(); j++) {
						double w = sr.times(pre, to.entryWeights.get(j));
						if (sr.isZero(w))
							continue;
						ret.addArc(from.exits.get(i), to.entries.get(j), w);
					}
				}
			}
		}
		return ret;
	}

	public static FSM compose(FSM fsm, Map<String, FSM> subs) throws UnusualConditionException {
		return compose(fsm, subs, DELIM);
	}

	// replace repeatedly until no state matches. Refuses sub-machine maps where a
	// label can (eventually) expand into itself
	public static FSM compose(FSM fsm, Map<String, FSM> subs, String delim) throws UnusualConditionException {
		boolean debug = false;
		checkRecursion(subs, delim);
		FSM curr = fsm;
		int level = 0;
		while (hasMatch(curr, subs, delim)) {
			curr = replace(curr, subs, delim);
			level++;
			if (debug) Debug.debug(debug, "After level "+level+": "+curr.summary());
		}
		if (curr == fsm)
			return fsm.copy();
		return curr;
	}

	public static void splice(FSM fsm, FSMState state, FSM sub) {
		splice(fsm, state, sub, DELIM);
	}

	// in place: replace one state with a copy of sub
	public static void splice(FSM fsm, FSMState state, FSM sub, String delim) {
		fsm.checkOwned(state);
		Semiring sr = fsm.getSemiring();
		// arcs touching state are gone once it is removed; take what we need first
		ArrayList<FSMState> preds = new ArrayList<FSMState>();
		TDoubleArrayList predWeights = new TDoubleArrayList();
		ArrayList<FSMState> succs = new ArrayList<FSMState>();
		TDoubleArrayList succWeights = new TDoubleArrayList();
		TDoubleArrayList loops = new TDoubleArrayList();
		for (Arc a : fsm.getIncomingArcs(state)) {
			if (a.isSelfLoop())
				continue;
			preds.add(a.getSourceState());
			predWeights.add(a.getWeight());
		}
		for (Arc a : fsm.getArcs(state)) {
			if (a.isSelfLoop()) {
				loops.add(a.getWeight());
				continue;
			}
			succs.add(a.getDestState());
			succWeights.add(a.getWeight());
		}
		FSMState[] map = copySub(fsm, state, sub, delim);
		Endpoints e = new Endpoints();
		collectEndpoints(sub, map, e);
		for (int j = 0; j < e.entries.size(); j++)
			for (int i = 0; i < preds.size(); i++)
				addNonZero(fsm, preds.get(i), e.entries.get(j), sr.times(predWeights.get(i), e.entryWeights.get(j)));
		for (int j = 0; j < e.exits.size(); j++)
			for (int i = 0; i < succs.size(); i++)
				addNonZero(fsm, e.exits.get(j), succs.get(i), sr.times(e.exitWeights.get(j), succWeights.get(i)));
		for (int k = 0; k < loops.size(); k++)
			for (int j = 0; j < e.exits.size(); j++)
				for (int i = 0; i < e.entries.size(); i++)
					addNonZero(fsm, e.exits.get(j), e.entries.get(i),
							sr.times(sr.times(e.exitWeights.get(j), loops.get(k)), e.entryWeights.get(i)));
		fsm.removeState(state);
	}

	private static void addNonZero(FSM fsm, FSMState from, FSMState to, double w) {
		if (!fsm.getSemiring().isZero(w))
			fsm.addArc(from, to, w);
	}

	private static FSM lookup(FSM fsm, FSMState s, Map<String, FSM> subs, String delim) {
		String key = matchLabel(s.getLabel(), delim);
		if (key == null)
			return null;
		FSM sub = subs.get(key);
		if (sub != null && sub.getSemiring().getClass() != fsm.getSemiring().getClass())
			throw new InvalidStructureException("Sub-fsm for "+key+" is "+sub.getSemiring().getName()+
					"; expected "+fsm.getSemiring().getName());
		return sub;
	}

	// add sub's states and internal arcs to target in place of parent. The new
	// states carry parent's initial and final weight times their own
	private static FSMState[] copySub(FSM target, FSMState parent, FSM sub, String delim) {
		Semiring sr = target.getSemiring();
		if (sub.getSemiring().getClass() != sr.getClass())
			throw new InvalidStructureException("Can't splice "+sub.getSemiring().getName()+" fsm into "+sr.getName()+" fsm");
		FSMState[] map = new FSMState[sub.getNumStates()];
		for (FSMState cs : sub.getStates()) {
			String label = null;
			if (cs.isLabeled())
				label = parent.isLabeled() ? parent.getLabel()+delim+cs.getLabel() : cs.getLabel();
			map[cs.getId()] = target.addState(label, cs.getPdfIndex(),
					sr.times(parent.getInitWeight(), cs.getInitWeight()),
					sr.times(parent.getFinalWeight(), cs.getFinalWeight()));
		}
		for (FSMState cs : sub.getStates())
			for (Arc a : sub.getArcs(cs))
				target.addArc(map[a.getSource()], map[a.getDest()], a.getWeight());
		return map;
	}

	private static void collectEndpoints(FSM sub, FSMState[] map, Endpoints e) {
		for (FSMState cs : sub.getStates()) {
			if (cs.isInitial()) {
				e.entries.add(map[cs.getId()]);
				e.entryWeights.add(cs.getInitWeight());
			}
			if (cs.isFinal()) {
				e.exits.add(map[cs.getId()]);
				e.exitWeights.add(cs.getFinalWeight());
			}
		}
	}

	private static boolean hasMatch(FSM fsm, Map<String, FSM> subs, String delim) {
		for (FSMState s : fsm.getStates()) {
			String key = matchLabel(s.getLabel(), delim);
			if (key != null && subs.containsKey(key))
				return true;
		}
		return false;
	}

	// each key depends on the keys its sub-machine's labels match. A cycle in
	// that graph means expansion never ends
	static void checkRecursion(Map<String, FSM> subs, String delim) throws UnusualConditionException {
		// 0 = unseen, 1 = on the current path, 2 = finished
		HashMap<String, Integer> color = new HashMap<String, Integer>();
		for (String key : subs.keySet())
			visit(key, subs, delim, color, new ArrayList<String>());
	}

	private static void visit(String key, Map<String, FSM> subs, String delim,
			HashMap<String, Integer> color, ArrayList<String> path) throws UnusualConditionException {
		Integer c = color.get(key);
		if (c != null && c.intValue() == 2)
			return;
		path.add(key);
		if (c != null && c.intValue() == 1)
			throw new UnusualConditionException("Recursive substitution: "+String.join(" -> ", path));
		color.put(key, 1);
		for (FSMState s : subs.get(key).getStates()) {
			String dep = matchLabel(s.getLabel(), delim);
			if (dep != null && subs.containsKey(dep))
				visit(dep, subs, delim, color, path);
		}
		color.put(key, 2);
		path.remove(path.size()-1);
	}
}
