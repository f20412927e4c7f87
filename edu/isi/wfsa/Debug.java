package edu.isi.wfsa;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// debugging things. everything goes to stderr so stdout stays clean for fsm output
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}

	private static OutputStreamWriter w=null;
	private static void initializeStream() {
		try {
			w = new OutputStreamWriter(System.err, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(System.err);
		}
	}

	private static void write(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s);
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// stuff we always print
	public static void prettyDebug(String s) {
		write(s+"\n");
	}

	// true debugging stuff: only printed if d is set. Prefixed with the caller
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		debug(caller.getClassName()+":"+caller.getMethodName(), s);
	}
	private static void debug(String caller, String s) {
		write(caller+" : "+s+"\n");
	}

	private static int dblevel=0;
	public static void setDbLevel(int i) {
		dblevel = i;
	}

	// print elapsed time between pta and ptb if the global level is at least needlevel
	public static void dbtime(int needlevel, Date pta, Date ptb, String msg) {
		if (dblevel < needlevel)
			return;
		long x = ptb.getTime() - pta.getTime();
		write(msg+": "+x+" ms\n");
	}

	// elapsed time from pta until now
	public static void dbtime(int needlevel, Date pta, String msg) {
		dbtime(needlevel, pta, new Date(), msg);
	}
}
