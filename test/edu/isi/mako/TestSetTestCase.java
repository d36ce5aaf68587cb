package edu.isi.mako;

import java.util.Arrays;

public class TestSetTestCase extends MakoTestSupport {

	public static void main(String[] args) {
		junit.textui.TestRunner.run(TestSetTestCase.class);
	}

	public TestSetTestCase(String name) {
		super(name);
	}

	public void testReadExamples() throws Exception {
		TestSet tests = new TestSet(resource("cfg-tests.txt"));
		assertEquals(BALANCED, tests.getInLanguage());
		assertEquals(UNBALANCED, tests.getNotInLanguage());
		assertEquals(7, tests.size());
	}

	public void testHashIsASymbol() throws Exception {
		TestSet tests = new TestSet(resource("tm-tests.txt"));
		assertEquals(EQUAL_HALVES, tests.getInLanguage());
		assertEquals(UNEQUAL_HALVES, tests.getNotInLanguage());
	}

	public void testUnlabelled() throws Exception {
		try {
			new TestSet(text("+01\n01\n"));
			fail("unlabelled example accepted");
		}
		catch (DataFormatException e) {
		}
	}

	public void testRunAgainstEachSystem() throws Exception {
		CollectingReporter r = new CollectingReporter();
		assertEquals(0, new TestSet(resource("cfg-tests.txt")).run(new CFGRuleSet(resource("cfg.txt")),
				CFGRuleSet.DEFAULT_MAX_VARIABLES, r));
		assertEquals(0, new TestSet(resource("npda-tests.txt")).run(new PushdownAutomaton(resource("npda.txt")),
				PushdownAutomaton.UNBOUNDED, r));
		assertEquals(0, new TestSet(resource("tm-tests.txt")).run(new TuringMachine(resource("tm.txt")),
				TuringMachine.UNBOUNDED, r));
		assertEquals(3, r.passed);
	}

	public void testBothLabels() throws Exception {
		TestSet tests = new TestSet(Arrays.asList("01"), Arrays.asList("01"));
		try {
			tests.run(new CFGRuleSet(resource("cfg.txt")), CFGRuleSet.DEFAULT_MAX_VARIABLES, new CollectingReporter());
			fail("a string labelled both ways was run");
		}
		catch (IllegalArgumentException e) {
		}
	}
}
