package edu.isi.wfsa;

// a state of a weighted fsm. Only created by FSM.addState.
// the id is the state's current index in its fsm; it changes when
// earlier states are removed, so hold on to the object, not the id
public class FSMState {
	FSM owner;
	int id;
	private double initWeight;
	private double finalWeight;
	// null means non-emitting
	private Integer pdfIndex;
	// null means unlabeled
	private String label;

	FSMState(FSM fsm, int i, String l, Integer pdf, double iw, double fw) {
		owner = fsm;
		id = i;
		label = l;
		pdfIndex = pdf;
		initWeight = iw;
		finalWeight = fw;
	}

	// accessors
	public int getId() { return id; }
	public String getLabel() { return label; }
	public Integer getPdfIndex() { return pdfIndex; }
	public double getInitWeight() { return initWeight; }
	public double getFinalWeight() { return finalWeight; }
	public FSM getFSM() { return owner; }

	public boolean isInitial() { return owner != null && !owner.getSemiring().isZero(initWeight); }
	public boolean isFinal() { return owner != null && !owner.getSemiring().isZero(finalWeight); }
	public boolean isEmitting() { return pdfIndex != null; }
	public boolean isLabeled() { return label != null; }
	// candidate for nil-state elimination
	public boolean isNil() { return !isEmitting() && !isLabeled() && !isInitial() && !isFinal(); }
	// false once removed from its fsm
	public boolean isLive() { return owner != null; }

	// settors
	public void setInitWeight(double w) {
		checkLive();
		owner.checkWeight(w);
		initWeight = w;
	}
	public void setFinalWeight(double w) {
		checkLive();
		owner.checkWeight(w);
		finalWeight = w;
	}
	public void setLabel(String l) {
		label = l;
	}
	public void setPdfIndex(Integer p) {
		pdfIndex = p;
	}

	void checkLive() {
		if (owner == null)
			throw new InvalidStructureException("State "+id+" has been removed from its fsm");
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append(id);
		sb.append("[");
		sb.append(label == null ? "ϵ" : label);
		sb.append(":");
		sb.append(pdfIndex == null ? "ϵ" : pdfIndex.toString());
		sb.append("]");
		if (isInitial())
			sb.append(" init="+initWeight);
		if (isFinal())
			sb.append(" final="+finalWeight);
		return sb.toString();
	}
}
