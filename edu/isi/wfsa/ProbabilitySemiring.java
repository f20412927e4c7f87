package edu.isi.wfsa;

// real is +, *, 0, 1
// lots of underflows on long paths, but useful for checking the log semiring
public class ProbabilitySemiring extends Semiring {

	public double plus(double a, double b) {
		return a+b;
	}
	public double times(double a, double b) {
		return a*b;
	}
	public double divide(double a, double b) {
		if (b == ZERO())
			return ZERO();
		return a/b;
	}
	// can be infinity if divergent (i.e. if >= 1)!
	public double star(double a) throws UnusualConditionException {
		if (a >= 0 && a < 1)
			return 1/(1-a);
		throw new UnusualConditionException("Tried to take star of "+a+"; closure diverges");
	}
	public boolean better(double a, double b) {
		return a>b;
	}
	public boolean betteroreq(double a, double b) {
		return a>=b;
	}
	public double ZERO() { return 0; }
	public double ONE() { return 1; }

	public boolean isValid(double a) {
		return !Double.isNaN(a) && !Double.isInfinite(a) && a >= 0;
	}
	public double convertFromReal(double a) {
		return a;
	}
	public double internalToPrint(double a) { return a; }
	public double printToInternal(double a) { return a; }
	public String getName() { return "probability"; }
}
