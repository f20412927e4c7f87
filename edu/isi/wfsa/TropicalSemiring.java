package edu.isi.wfsa;

// tropical is min, +, +INF, 0
// weights are costs (negative logs), so smaller is better
public class TropicalSemiring extends Semiring {
	public double plus(double a, double b) {
		return Math.min(a, b);
	}
	public double times(double a, double b) {
		if (a == ZERO() || b == ZERO())
			return ZERO();
		return a+b;
	}
	public double divide(double a, double b) {
		if (a == ZERO() || b == ZERO())
			return ZERO();
		return a-b;
	}
	// fewest loops always the best, unless the loop pays us
	public double star(double a) throws UnusualConditionException {
		if (a < ONE())
			throw new UnusualConditionException("Tried to take star of negative cost "+a);
		return ONE();
	}

	public boolean better(double a, double b) {
		return a<b;
	}
	public boolean betteroreq(double a, double b) {
		return a<=b;
	}
	public double ZERO() { return Double.POSITIVE_INFINITY; }
	public double ONE() { return 0; }

	public boolean isValid(double a) {
		return !Double.isNaN(a) && a != Double.NEGATIVE_INFINITY;
	}
	public double convertFromReal(double a) {
		return -Math.log(a);
	}
	public double internalToPrint(double a) { return a; }
	public double printToInternal(double a) { return a; }
	public String getName() { return "tropical"; }
}
