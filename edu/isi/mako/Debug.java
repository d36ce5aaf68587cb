package edu.isi.mako;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;
// diagnostic output. everything goes to stderr unless redirected
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		if (!redirected)
			initializeStream(System.err);
	}

	private static Writer w=null;
	private static boolean redirected=false;
	private static void initializeStream(OutputStream os) {
		try {
			w = new OutputStreamWriter(os, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(os);
		}
	}

	// send everything somewhere else (tests capture messages this way)
	public static void setStream(Writer writer) {
		w = writer;
		redirected = true;
	}
	// back to stderr
	public static void resetStream() {
		redirected = false;
		initializeStream(System.err);
	}

	private static void emit(String s) {
		if (w == null)
			initializeStream(System.err);
		try {
			w.write(s+"\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// stuff we always print
	public static void prettyDebug(String s) {
		emit(s);
	}

	// true debugging stuff, tagged with the calling class and method
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		debug(0, caller.getClassName()+":"+caller.getMethodName(), s);
	}
	public static void debug(boolean d, int i, String s) {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		debug(i, caller.getClassName()+":"+caller.getMethodName(), s);
	}
	private static void debug(int indent, String caller, String s) {
		StringBuilder sb = new StringBuilder();
		for (int x = 0; x < indent; x++)
			sb.append(' ');
		sb.append(caller).append(" : ").append(s);
		emit(sb.toString());
	}

	private static int dblevel=0;
	public static void setDbLevel(int i) {
		dblevel = i;
	}
	public static int getDbLevel() {
		return dblevel;
	}

	// print elapsed time since pta if the global level is high enough
	public static void dbtime(int needlevel, Date pta, String msg) {
		if (dblevel < needlevel)
			return;
		long x = new Date().getTime() - pta.getTime();
		emit(msg+": "+x+" ms");
	}
}
