package edu.isi.wfsa;

import java.util.List;

// which way a traversal walks an fsm. FORWARD starts at the initial states and
// follows outgoing arcs; BACKWARD starts at the final states and follows incoming arcs
public enum Direction {
	FORWARD {
		public List<Arc> arcs(FSM fsm, FSMState s) { return fsm.getArcs(s); }
		public int next(Arc a) { return a.getDest(); }
		public double frontierWeight(FSMState s) { return s.getInitWeight(); }
		public double terminalWeight(FSMState s) { return s.getFinalWeight(); }
		public FSMState addState(FSM fsm, String label, Integer pdf, double frontier, double terminal) {
			return fsm.addState(label, pdf, frontier, terminal);
		}
		public Arc addArc(FSM fsm, FSMState from, FSMState to, double w) {
			return fsm.addArc(from, to, w);
		}
	},
	BACKWARD {
		public List<Arc> arcs(FSM fsm, FSMState s) { return fsm.getIncomingArcs(s); }
		public int next(Arc a) { return a.getSource(); }
		public double frontierWeight(FSMState s) { return s.getFinalWeight(); }
		public double terminalWeight(FSMState s) { return s.getInitWeight(); }
		public FSMState addState(FSM fsm, String label, Integer pdf, double frontier, double terminal) {
			return fsm.addState(label, pdf, terminal, frontier);
		}
		public Arc addArc(FSM fsm, FSMState from, FSMState to, double w) {
			return fsm.addArc(to, from, w);
		}
	};

	// the arcs to walk from s
	public abstract List<Arc> arcs(FSM fsm, FSMState s);
	// the id at the other end of a walked arc
	public abstract int next(Arc a);
	// weight of entering the machine at s (where traversal starts)
	public abstract double frontierWeight(FSMState s);
	// weight of leaving the machine at s (where traversal ends)
	public abstract double terminalWeight(FSMState s);
	// build a state or arc in a new machine, oriented so that the walk
	// direction of the new machine matches this direction
	public abstract FSMState addState(FSM fsm, String label, Integer pdf, double frontier, double terminal);
	public abstract Arc addArc(FSM fsm, FSMState from, FSMState to, double w);

	public boolean isFrontier(FSM fsm, FSMState s) {
		return !fsm.getSemiring().isZero(frontierWeight(s));
	}
}
