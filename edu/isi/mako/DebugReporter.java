package edu.isi.mako;

// reports self-test results on the diagnostic stream
public class DebugReporter implements MismatchReporter {
	public void mismatch(Mismatch m) {
		Debug.prettyDebug(m.toString());
	}
	public void passed(String system, int examples) {
		Debug.prettyDebug("The "+system+" has passed all "+examples+" tests.");
	}
}
