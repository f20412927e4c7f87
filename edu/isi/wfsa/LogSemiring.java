package edu.isi.wfsa;

// log is logaddexp, +, -inf, 0
// weights are natural logs of probabilities, so bigger is better
public class LogSemiring extends Semiring {

	// numerically stable log(exp(a)+exp(b))
	public static double logaddexp(double a, double b) {
		if (a == Double.NEGATIVE_INFINITY)
			return b;
		if (b == Double.NEGATIVE_INFINITY)
			return a;
		double x = Math.max(a, b);
		double diff = Math.abs(a-b);
		return x + Math.log1p(Math.exp(-diff));
	}

	public double plus(double a, double b) {
		return logaddexp(a, b);
	}
	public double times(double a, double b) {
		// -inf is absorbing; avoids -inf + inf
		if (a == ZERO() || b == ZERO())
			return ZERO();
		return a+b;
	}
	public double divide(double a, double b) {
		if (a == ZERO() || b == ZERO())
			return ZERO();
		return a-b;
	}
	// 1/(1-p) in log space. p >= 1 diverges
	public double star(double a) throws UnusualConditionException {
		if (a == ZERO())
			return ONE();
		if (a >= 0)
			throw new UnusualConditionException("Tried to take star of "+a+"; closure diverges");
		return -Math.log(-Math.expm1(a));
	}
	public boolean better(double a, double b) {
		return a>b;
	}
	public boolean betteroreq(double a, double b) {
		return a>=b;
	}
	public double ZERO() { return Double.NEGATIVE_INFINITY; }
	public double ONE() { return 0; }

	public boolean isValid(double a) {
		return !Double.isNaN(a) && a != Double.POSITIVE_INFINITY;
	}
	public double convertFromReal(double a) {
		return Math.log(a);
	}
	public double internalToPrint(double a) { return Math.exp(a); }
	public double printToInternal(double a) { return Math.log(a); }
	public String getName() { return "log"; }
}
