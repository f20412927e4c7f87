package edu.isi.wfsa;
/** for structural errors in an fsm: arcs between machines, references to removed
    or foreign states, weights outside the semiring. These are programming errors,
    so unchecked. */
public class InvalidStructureException extends RuntimeException {
    /**          Constructs a new exception with null as its detail message. */
    public InvalidStructureException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public InvalidStructureException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public InvalidStructureException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()). */
    public InvalidStructureException(Throwable cause) { super(cause); }
}
