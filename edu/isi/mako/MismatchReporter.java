package edu.isi.mako;

// where self-test results go
public interface MismatchReporter {
	public void mismatch(Mismatch m);
	// called once, when a run had no mismatches at all
	public void passed(String system, int examples);
}
