package edu.isi.wfsa;

import java.util.Date;

// minimization by pushing weights, determinizing twice, once in each direction, then
// renormalizing. Only sound for acyclic machines; cycles are refused
public class Minimizer {

	// renormalize . transpose . determinize . transpose . determinize . push.
	// Classes sum their members' arc weights, so each member's prefix mass has to be
	// on its arcs before states are merged
	public static FSM minimize(FSM fsm) throws UnusualConditionException {
		boolean debug = false;
		Simplifier.checkAcyclic(fsm, "minimization");
		Date startTime = new Date();
		FSM pushed = fsm.copy();
		Simplifier.pushWeights(pushed);
		FSM forward = Determinizer.determinize(pushed, Direction.FORWARD);
		if (debug) Debug.debug(debug, "Forward pass: "+fsm.summary()+" to "+forward.summary());
		FSM ret = Determinizer.determinize(forward.transpose(), Direction.FORWARD).transpose();
		if (debug) Debug.debug(debug, "Backward pass: "+ret.summary());
		ret.renormalize();
		Debug.dbtime(2, startTime, "minimize");
		return ret;
	}

	// the long way around, on a copy: prune, drop nil states, push weights,
	// determinize forward then backward, renormalize
	public static FSM minimizeExpanded(FSM fsm) throws UnusualConditionException {
		boolean debug = false;
		Simplifier.checkAcyclic(fsm, "minimization");
		Date startTime = new Date();
		FSM work = fsm.copy();
		int pruned = Simplifier.pruneUnreachable(work);
		int nils = Simplifier.removeNilStates(work);
		if (debug) Debug.debug(debug, "Pruned "+pruned+" unreachable and "+nils+" nil states");
		Simplifier.pushWeights(work);
		FSM ret = Determinizer.determinize(Determinizer.determinize(work, Direction.FORWARD), Direction.BACKWARD);
		ret.renormalize();
		Debug.dbtime(2, startTime, "minimize (expanded)");
		return ret;
	}
}
