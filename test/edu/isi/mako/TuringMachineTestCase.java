package edu.isi.mako;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class TuringMachineTestCase extends MakoTestSupport {

	private TuringMachine halves;

	public static void main(String[] args) {
		junit.textui.TestRunner.run(TuringMachineTestCase.class);
	}

	public TuringMachineTestCase(String name) {
		super(name);
	}

	protected void setUp() throws Exception {
		super.setUp();
		halves = new TuringMachine(resource("tm.txt"));
	}

	public void testReadMachine() {
		assertEquals("q1", halves.getStartState());
		assertEquals(9, halves.getStates().size());
		assertTrue(halves.getStates().contains(TuringMachine.ACCEPT));
		assertTrue(halves.getTapeAlphabet().contains(Alphabet.BLANK));
		assertTrue(halves.getTapeAlphabet().contains('x'));
		TMTransition t = halves.getTransition("q4", '0');
		assertEquals('x', t.getWrite());
		assertEquals(TMTransition.Direction.LEFT, t.getDirection());
		assertEquals("q6", t.getDestination());
		assertNull(halves.getTransition("q4", '1'));
		assertNull(halves.getTransition("q9", '1'));
	}

	public void testEqualHalves() throws Exception {
		for (String s : EQUAL_HALVES)
			assertTrue("rejected '"+s+"'", halves.accepts(s));
		for (String s : UNEQUAL_HALVES)
			assertFalse("accepted '"+s+"'", halves.accepts(s));
		assertFalse(halves.accepts(""));
	}

	public void testSelfTest() {
		CollectingReporter r = new CollectingReporter();
		assertEquals(0, halves.performTests(EQUAL_HALVES, UNEQUAL_HALVES, r));
		assertEquals(1, r.passed);
	}

	public void testSelfTestFindsLooseMatching() throws Exception {
		String text = resourceText("tm.txt")
			.replace("q4 : 0 > x, l : q6", "q4 : 0, 1 > x, l : q6")
			.replace("q5 : 1 > x, l : q6", "q5 : 0, 1 > x, l : q6");
		TuringMachine loose = new TuringMachine(text(text));
		CollectingReporter r = new CollectingReporter();
		assertEquals(3, loose.performTests(EQUAL_HALVES, UNEQUAL_HALVES, r));
		assertEquals(Arrays.asList("1#0", "01#11", "0000#1111"), r.strings());
		for (Mismatch m : r.mismatches) {
			assertEquals(Mismatch.Kind.FALSE_POSITIVE, m.getKind());
			assertEquals("TM", m.getSystem());
		}
	}

	public void testStepping() throws Exception {
		TuringMachine m = new TuringMachine(text("q1:0>l:q2\nq2:0>x,r:q3\nq3:.>r:accept"));
		TMRun run = m.start("0");
		assertEquals("q1 [0]", run.toString());
		assertEquals(TMRun.Outcome.CONTINUE, run.step());
		// a left move on the first cell stays put
		assertEquals(0, run.getHead());
		assertEquals("q2", run.getState());
		assertEquals(TMRun.Outcome.CONTINUE, run.step());
		assertEquals(1, run.getHead());
		assertEquals("q3 x[.]", run.toString());
		assertFalse(run.isHalted());
		assertEquals(TMRun.Outcome.CONTINUE, run.step());
		assertTrue(run.isHalted());
		assertEquals(TMRun.Outcome.ACCEPT, run.step());
		assertEquals(TMRun.Outcome.ACCEPT, run.step());
		assertEquals(3, run.getSteps());
		assertEquals("x.", run.getTape().toString());
	}

	public void testMissingTransitionRejects() throws Exception {
		TMRun run = halves.start("01");
		List<TMRun.Outcome> outcomes = new ArrayList<TMRun.Outcome>();
		TMRun.Outcome o;
		while ((o = run.step()) == TMRun.Outcome.CONTINUE)
			outcomes.add(o);
		assertEquals(TMRun.Outcome.REJECT, o);
		assertEquals("q2", run.getState());
		assertEquals(2, outcomes.size());
		assertEquals("x1", run.getTape().toString());
	}

	public void testStepBudget() throws Exception {
		TuringMachine m = new TuringMachine(text("q1:.>r:q1\nq1:1>r:accept"));
		assertTrue(m.accepts("1", 10));
		try {
			m.accepts("", 100);
			fail("a machine that never halts was decided");
		}
		catch (UnusualConditionException e) {
			assertTrue(e.getMessage().indexOf("100") >= 0);
		}
		CollectingReporter r = new CollectingReporter();
		assertEquals(1, m.performTests(Arrays.asList("1"), Arrays.asList(""), 100, r));
		assertEquals(Mismatch.Kind.UNDECIDED, r.mismatches.get(0).getKind());
	}

	public void testTape() {
		Tape t = new Tape("01");
		assertEquals(Alphabet.BLANK, t.read(10));
		t.write(4, 'x');
		assertEquals("01..x", t.toString());
		assertEquals(5, t.length());
		assertEquals('x', t.read(4));
		try {
			t.read(-1);
			fail("read left of the tape");
		}
		catch (IndexOutOfBoundsException e) {
		}
	}

	public void testParseTransitions() throws Exception {
		List<TMTransition> ts = TMTransition.parseLine("q6:0,1,x>l:q6");
		assertEquals(3, ts.size());
		for (TMTransition t : ts)
			assertEquals(t.getRead(), t.getWrite());
		TMTransition t = TMTransition.parseLine("q1:0>x,r:q2").get(0);
		assertEquals('0', t.getRead());
		assertEquals('x', t.getWrite());
		assertEquals(TMTransition.Direction.RIGHT, t.getDirection());
		assertEquals("q1:0>x,r:q2", t.toString());
	}

	private static void assertRefused(String machine) throws Exception {
		try {
			new TuringMachine(text(machine));
			fail("built machine from "+machine);
		}
		catch (DataFormatException e) {
		}
	}

	public void testMalformedFiles() throws Exception {
		assertRefused("");
		assertRefused("q1:0>x,u:accept\nq1:.>r:accept");
		assertRefused("q1:00>r:accept\nq1:.>r:accept");
		assertRefused("q1:0>:accept");
		assertRefused("q1:0>x,y,r:accept\nq1:.>r:accept");
		// no accept state
		assertRefused("q1:0>r:q2\nq2:.>r:q1");
		// no blank anywhere
		assertRefused("q1:0>r:accept");
	}

	public void testDeterminism() throws Exception {
		try {
			new TuringMachine(text("q1:0>r:q2\nq1:0>l:accept\nq2:.>r:accept"));
			fail("two transitions on the same state and symbol");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().indexOf("deterministic") >= 0);
		}
		TuringMachine m = new TuringMachine(text("q1:0>r:q1\nq1 : 0 > r : q1\nq1:.>r:accept"));
		assertEquals(2, m.getTransitions().size());
	}

	public void testProgrammaticConstruction() throws Exception {
		List<TMTransition> ts = new ArrayList<TMTransition>();
		ts.add(new TMTransition("q1", '0', '0', TMTransition.Direction.RIGHT, "q1"));
		ts.add(new TMTransition("q1", Alphabet.BLANK, Alphabet.BLANK, TMTransition.Direction.RIGHT, TuringMachine.ACCEPT));
		ts.add(new TMTransition("q1", '0', '0', TMTransition.Direction.RIGHT, "q1"));
		TuringMachine m = new TuringMachine(ts, "q1");
		assertEquals(2, m.getTransitions().size());
		assertTrue(m.accepts("000"));
		assertFalse(m.accepts("010"));
		try {
			new TuringMachine(ts, "q7");
			fail("start state outside the states");
		}
		catch (DataFormatException e) {
		}
	}

	public void testBlankInInput() {
		try {
			halves.start("0.1");
			fail("blank in input accepted");
		}
		catch (IllegalArgumentException e) {
		}
	}
}
