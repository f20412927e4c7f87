package edu.isi.wfsa;

// weighted transition between two states of the same fsm, stored by index.
// the same object sits in the source's outgoing list and the destination's incoming list
public class Arc {
	FSM owner;
	int src;
	int dst;
	private double weight;

	Arc(FSM fsm, int s, int d, double w) {
		owner = fsm;
		src = s;
		dst = d;
		weight = w;
	}

	public int getSource() { return src; }
	public int getDest() { return dst; }
	public double getWeight() { return weight; }
	public FSMState getSourceState() { return owner.getState(src); }
	public FSMState getDestState() { return owner.getState(dst); }
	public boolean isSelfLoop() { return src == dst; }

	public void setWeight(double w) {
		if (owner == null)
			throw new InvalidStructureException("Arc "+this+" has been removed from its fsm");
		owner.checkWeight(w);
		weight = w;
	}

	public String toString() { return src+" -> "+dst+" / "+weight; }
}
