package edu.isi.wfsa;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Weighted finite state machine over a {@link Semiring}. States live in a dense
 * array indexed by id; each state has an outgoing and an incoming list of
 * {@link Arc}s. Any number of states may carry non-zero initial or final weight.
 *
 * Operations that return an FSM build a fresh one and leave their inputs alone;
 * operations that return void (or a count) modify this machine in place.
 */
public class FSM {

	private Semiring semiring;
	private ArrayList<FSMState> states;
	// indexed by state id
	private ArrayList<ArrayList<Arc>> outArcs;
	private ArrayList<ArrayList<Arc>> inArcs;
	private int numArcs;

	public FSM(Semiring s) {
		semiring = s;
		states = new ArrayList<FSMState>();
		outArcs = new ArrayList<ArrayList<Arc>>();
		inArcs = new ArrayList<ArrayList<Arc>>();
		numArcs = 0;
	}

	// log semiring by default
	public FSM() {
		this(new LogSemiring());
	}

	// accessors

	public Semiring getSemiring() { return semiring; }
	public int getNumStates() { return states.size(); }
	public int getNumArcs() { return numArcs; }
	public List<FSMState> getStates() { return Collections.unmodifiableList(states); }

	public FSMState getState(int id) {
		if (id < 0 || id >= states.size())
			throw new InvalidStructureException("No state "+id+" in fsm of "+states.size()+" states");
		return states.get(id);
	}

	// outgoing arcs
	public List<Arc> getArcs(FSMState s) {
		checkOwned(s);
		return Collections.unmodifiableList(outArcs.get(s.id));
	}
	public List<Arc> getArcs(int id) {
		return getArcs(getState(id));
	}
	public List<Arc> getIncomingArcs(FSMState s) {
		checkOwned(s);
		return Collections.unmodifiableList(inArcs.get(s.id));
	}
	public List<Arc> getIncomingArcs(int id) {
		return getIncomingArcs(getState(id));
	}

	public ArrayList<FSMState> getInitialStates() {
		ArrayList<FSMState> ret = new ArrayList<FSMState>();
		for (FSMState s : states)
			if (s.isInitial())
				ret.add(s);
		return ret;
	}
	public ArrayList<FSMState> getFinalStates() {
		ArrayList<FSMState> ret = new ArrayList<FSMState>();
		for (FSMState s : states)
			if (s.isFinal())
				ret.add(s);
		return ret;
	}

	public boolean owns(FSMState s) {
		return s != null && s.owner == this && s.id < states.size() && states.get(s.id) == s;
	}

	void checkOwned(FSMState s) {
		if (s == null)
			throw new InvalidStructureException("Null state");
		if (!s.isLive())
			throw new InvalidStructureException("State "+s.id+" has been removed");
		if (!owns(s))
			throw new InvalidStructureException("State "+s+" belongs to a different fsm");
	}

	void checkWeight(double w) {
		if (!semiring.isValid(w))
			throw new InvalidStructureException("Weight "+w+" is not a valid "+semiring.getName()+" value");
	}

	// builders

	public FSMState addState(String label, Integer pdfIndex, double initWeight, double finalWeight) {
		checkWeight(initWeight);
		checkWeight(finalWeight);
		FSMState s = new FSMState(this, states.size(), label, pdfIndex, initWeight, finalWeight);
		states.add(s);
		outArcs.add(new ArrayList<Arc>());
		inArcs.add(new ArrayList<Arc>());
		return s;
	}
	public FSMState addState(String label, Integer pdfIndex) {
		return addState(label, pdfIndex, semiring.ZERO(), semiring.ZERO());
	}
	public FSMState addState(String label) {
		return addState(label, null);
	}
	// a nil state
	public FSMState addState() {
		return addState(null, null);
	}

	public Arc addArc(FSMState src, FSMState dst, double weight) {
		checkOwned(src);
		checkOwned(dst);
		checkWeight(weight);
		Arc a = new Arc(this, src.id, dst.id, weight);
		outArcs.get(src.id).add(a);
		inArcs.get(dst.id).add(a);
		numArcs++;
		return a;
	}
	public Arc addArc(FSMState src, FSMState dst) {
		return addArc(src, dst, semiring.ONE());
	}

	// remove the state and every arc into or out of it. Ids above it shift down
	public void removeState(FSMState s) {
		ArrayList<FSMState> l = new ArrayList<FSMState>();
		l.add(s);
		removeStates(l);
	}

	// remove a batch of states in one compaction pass
	public void removeStates(Collection<FSMState> doomed) {
		boolean debug = false;
		if (doomed.isEmpty())
			return;
		boolean[] dead = new boolean[states.size()];
		for (FSMState s : doomed) {
			checkOwned(s);
			dead[s.id] = true;
		}
		int[] remap = new int[states.size()];
		int next = 0;
		for (int i = 0; i < states.size(); i++)
			remap[i] = dead[i] ? -1 : next++;

		ArrayList<FSMState> newStates = new ArrayList<FSMState>(next);
		ArrayList<ArrayList<Arc>> newOut = new ArrayList<ArrayList<Arc>>(next);
		ArrayList<ArrayList<Arc>> newIn = new ArrayList<ArrayList<Arc>>(next);
		int arcCount = 0;
		for (int i = 0; i < states.size(); i++) {
			FSMState s = states.get(i);
			if (dead[i]) {
				for (Arc a : outArcs.get(i))
					a.owner = null;
				for (Arc a : inArcs.get(i))
					a.owner = null;
				s.owner = null;
				continue;
			}
			ArrayList<Arc> out = new ArrayList<Arc>();
			for (Arc a : outArcs.get(i))
				if (!dead[a.dst])
					out.add(a);
			ArrayList<Arc> in = new ArrayList<Arc>();
			for (Arc a : inArcs.get(i))
				if (!dead[a.src])
					in.add(a);
			arcCount += out.size();
			newStates.add(s);
			newOut.add(out);
			newIn.add(in);
		}
		// every surviving arc is in exactly one outgoing list
		for (ArrayList<Arc> out : newOut) {
			for (Arc a : out) {
				a.src = remap[a.src];
				a.dst = remap[a.dst];
			}
		}
		for (FSMState s : newStates)
			s.id = remap[s.id];
		if (debug) Debug.debug(debug, "Removed "+(states.size()-newStates.size())+" states and "+(numArcs-arcCount)+" arcs");
		states = newStates;
		outArcs = newOut;
		inArcs = newIn;
		numArcs = arcCount;
	}

	// remove a single arc
	public void removeArc(Arc a) {
		if (a.owner != this)
			throw new InvalidStructureException("Arc "+a+" does not belong to this fsm");
		outArcs.get(a.src).remove(a);
		inArcs.get(a.dst).remove(a);
		a.owner = null;
		numArcs--;
	}

	// copy all states and arcs of this machine into target. Initial and final
	// weights are kept only if asked for. Returns the new states, indexed by old id
	FSMState[] copyInto(FSM target, boolean keepInit, boolean keepFinal) {
		if (target.semiring.getClass() != semiring.getClass())
			throw new InvalidStructureException("Can't combine "+semiring.getName()+" fsm with "+
					target.semiring.getName()+" fsm");
		FSMState[] map = new FSMState[states.size()];
		for (FSMState s : states) {
			map[s.id] = target.addState(s.getLabel(), s.getPdfIndex(),
					keepInit ? s.getInitWeight() : semiring.ZERO(),
					keepFinal ? s.getFinalWeight() : semiring.ZERO());
		}
		for (ArrayList<Arc> out : outArcs)
			for (Arc a : out)
				target.addArc(map[a.src], map[a.dst], a.getWeight());
		return map;
	}

	public FSM copy() {
		FSM ret = new FSM(semiring);
		copyInto(ret, true, true);
		return ret;
	}

	// disjoint merge of all the machines
	public static FSM union(FSM... fsms) {
		if (fsms.length == 0)
			throw new IllegalArgumentException("Need at least one fsm to take a union");
		FSM ret = new FSM(fsms[0].semiring);
		for (FSM f : fsms)
			f.copyInto(ret, true, true);
		return ret;
	}

	// concatenation, folding left. Each pair is joined through one nil connector state
	public static FSM concat(FSM... fsms) {
		if (fsms.length == 0)
			throw new IllegalArgumentException("Need at least one fsm to concatenate");
		FSM ret = fsms[0].copy();
		for (int i = 1; i < fsms.length; i++)
			ret = concat(ret, fsms[i]);
		return ret;
	}

	private static FSM concat(FSM left, FSM right) {
		FSM ret = new FSM(left.semiring);
		Semiring sr = left.semiring;
		FSMState[] lmap = left.copyInto(ret, true, false);
		FSMState connector = ret.addState();
		FSMState[] rmap = right.copyInto(ret, false, true);
		for (FSMState s : left.states)
			if (s.isFinal())
				ret.addArc(lmap[s.id], connector, s.getFinalWeight());
		for (FSMState s : right.states)
			if (s.isInitial())
				ret.addArc(connector, rmap[s.id], s.getInitWeight());
		return ret;
	}

	// arcs reversed, initial and final weights swapped
	public FSM transpose() {
		FSM ret = new FSM(semiring);
		FSMState[] map = new FSMState[states.size()];
		for (FSMState s : states)
			map[s.id] = ret.addState(s.getLabel(), s.getPdfIndex(), s.getFinalWeight(), s.getInitWeight());
		for (ArrayList<Arc> out : outArcs)
			for (Arc a : out)
				ret.addArc(map[a.dst], map[a.src], a.getWeight());
		return ret;
	}

	// in place: initial weights sum to one, and for each state the final weight
	// plus outgoing arc weights sum to one. A state whose total is zero stays zero
	public void renormalize() {
		boolean debug = false;
		double inittotal = semiring.ZERO();
		for (FSMState s : states)
			inittotal = semiring.plus(inittotal, s.getInitWeight());
		for (FSMState s : states)
			s.setInitWeight(semiring.divide(s.getInitWeight(), inittotal));
		for (FSMState s : states) {
			double total = s.getFinalWeight();
			for (Arc a : outArcs.get(s.id))
				total = semiring.plus(total, a.getWeight());
			if (debug) Debug.debug(debug, "Total for "+s+" is "+total);
			for (Arc a : outArcs.get(s.id))
				a.setWeight(semiring.divide(a.getWeight(), total));
			s.setFinalWeight(semiring.divide(s.getFinalWeight(), total));
		}
	}

	// in place: outgoing arc weights of each state sum to one. Final weights are not touched
	public void weightNormalize() {
		for (FSMState s : states) {
			double total = semiring.ZERO();
			for (Arc a : outArcs.get(s.id))
				total = semiring.plus(total, a.getWeight());
			for (Arc a : outArcs.get(s.id))
				a.setWeight(semiring.divide(a.getWeight(), total));
		}
	}

	// in place: give every emitting state a self loop taken with probability loopProb.
	// Its other exits (arcs and final weight) are scaled by 1-loopProb
	public void addSelfLoop(double loopProb) {
		if (!(loopProb > 0 && loopProb < 1))
			throw new IllegalArgumentException("Loop probability must be in (0,1); got "+loopProb);
		double stay = semiring.convertFromReal(loopProb);
		double leave = semiring.convertFromReal(1-loopProb);
		for (FSMState s : states) {
			if (!s.isEmitting())
				continue;
			for (Arc a : outArcs.get(s.id))
				a.setWeight(semiring.times(a.getWeight(), leave));
			s.setFinalWeight(semiring.times(s.getFinalWeight(), leave));
			addArc(s, s, stay);
		}
	}

	// write in the format FSMReader reads
	public void print(Writer w) throws IOException {
		w.write("% "+summary()+"\n");
		for (FSMState s : states) {
			StringBuffer sb = new StringBuffer("state "+s.id);
			if (s.isLabeled())
				sb.append(" label="+quote(s.getLabel()));
			if (s.isEmitting())
				sb.append(" pdf="+s.getPdfIndex());
			if (s.isInitial())
				sb.append(" init="+semiring.internalToPrint(s.getInitWeight()));
			if (s.isFinal())
				sb.append(" final="+semiring.internalToPrint(s.getFinalWeight()));
			w.write(sb.toString()+"\n");
		}
		for (ArrayList<Arc> out : outArcs)
			for (Arc a : out)
				w.write("arc "+a.src+" "+a.dst+" "+semiring.internalToPrint(a.getWeight())+"\n");
		w.flush();
	}

	// labels with whitespace, quotes, or comment chars are double-quoted
	static String quote(String label) {
		if (label.length() > 0 && !label.matches(".*[\\s\"%\\\\].*"))
			return label;
		return "\""+label.replace("\\", "\\\\").replace("\"", "\\\"")+"\"";
	}

	public String summary() {
		return "FSM("+semiring.getName()+") # states: "+states.size()+" # arcs: "+numArcs;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer(summary());
		sb.append("\n");
		for (FSMState s : states) {
			sb.append(s.toString()+"\n");
			for (Arc a : outArcs.get(s.id))
				sb.append("\t"+a.toString()+"\n");
		}
		return sb.toString();
	}
}
