package edu.isi.wfsa;
/** for errors in the command line configuration, like unknown semirings,
    contradictory switches, malformed substitution specs */
public class ConfigureException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public ConfigureException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public ConfigureException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ConfigureException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()). */
    public ConfigureException(Throwable cause) { super(cause); }
}
