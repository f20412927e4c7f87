package edu.isi.wfsa;
import java.io.Serializable;
// the general semiring. Subclasses do the operations.
// values are always doubles; what a double means is up to the subclass
public abstract class Semiring implements Serializable {
	// tolerance for approxEqual, in the internal representation
	static final double TOLERANCE = 1e-9;

	public abstract double plus(double a, double b);
	public abstract double times(double a, double b);
	// inverse of times. dividing by ZERO gives ZERO, never an undefined value
	public abstract double divide(double a, double b);
	// for closure: ONE + a + a*a + ... Throws if the sum diverges
	public abstract double star(double a) throws UnusualConditionException;
	// better means "closer to one"...sort of
	public abstract boolean better(double a, double b);
	public abstract boolean betteroreq(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();
	// is a a legal value of this semiring?
	public abstract boolean isValid(double a);
	// assuming that the "real" semiring is standard, we may want to convert from it
	public abstract double convertFromReal(double a);
	// so we can represent things differently on the inside
	public abstract double internalToPrint(double a);
	public abstract double printToInternal(double a);
	public abstract String getName();

	public boolean isZero(double a) {
		return a == ZERO();
	}

	// equality up to floating point noise. zeros only equal zeros
	public boolean approxEqual(double a, double b) {
		if (isZero(a) || isZero(b))
			return isZero(a) && isZero(b);
		if (a == b)
			return true;
		double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
		return Math.abs(a-b) <= TOLERANCE*scale;
	}

	// sum of many
	public double sum(double[] vals) {
		double total = ZERO();
		for (int i = 0; i < vals.length; i++)
			total = plus(total, vals[i]);
		return total;
	}

	public String toString() { return getName(); }
}
