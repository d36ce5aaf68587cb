package edu.isi.mako;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

public class PushdownAutomatonTestCase extends MakoTestSupport {

	private PushdownAutomaton balanced;

	public static void main(String[] args) {
		junit.textui.TestRunner.run(PushdownAutomatonTestCase.class);
	}

	public PushdownAutomatonTestCase(String name) {
		super(name);
	}

	protected void setUp() throws Exception {
		super.setUp();
		balanced = new PushdownAutomaton(resource("npda.txt"));
	}

	// pushes forever on epsilon before it ever looks at the input
	private static PushdownAutomaton epsilonCycle(boolean cycleFirst) throws DataFormatException {
		PDATransition cycle = new PDATransition("q0", 'e', 'e', 'a', "q0");
		PDATransition read = new PDATransition("q0", '1', 'e', 'e', "q1");
		List<PDATransition> ts = cycleFirst ? Arrays.asList(cycle, read) : Arrays.asList(read, cycle);
		return new PushdownAutomaton(ts, "q0", Arrays.asList("q1"));
	}

	public void testReadAutomaton() {
		assertEquals("q0", balanced.getStartState());
		assertEquals(new HashSet<String>(Arrays.asList("q0", "q1", "q2")), balanced.getStates());
		assertEquals(new HashSet<String>(Arrays.asList("q2")), balanced.getAcceptStates());
		assertEquals(new HashSet<Character>(Arrays.asList('0', '1')), balanced.getInputAlphabet());
		assertEquals(new HashSet<Character>(Arrays.asList('$', '0')), balanced.getStackAlphabet());
		assertEquals(4, balanced.getTransitions().size());
		assertEquals(3, balanced.getTransitionsFrom("q1").size());
		assertTrue(balanced.getTransitionsFrom("q2").isEmpty());
		assertTrue(balanced.getTransitionsFrom("q9").isEmpty());
	}

	public void testBalancedStrings() {
		for (String s : BALANCED)
			assertTrue("rejected '"+s+"'", balanced.accepts(s));
		for (String s : UNBALANCED)
			assertFalse("accepted '"+s+"'", balanced.accepts(s));
	}

	public void testAcceptingPath() {
		List<PDAConfiguration> path = balanced.findAcceptingPath("01");
		List<String> shown = new ArrayList<String>();
		for (PDAConfiguration c : path)
			shown.add(c.toString());
		assertEquals(Arrays.asList("(q0, 01, e)", "(q1, 01, $)", "(q1, 1, $0)", "(q1, e, $)", "(q2, e, e)"), shown);
		assertTrue(balanced.isAccepting(path.get(path.size()-1)));
		assertTrue(balanced.findAcceptingPath("10").isEmpty());
	}

	// one transition reads at most one symbol and changes the stack by at most one
	public void testPathMovesOneStepAtATime() {
		List<PDAConfiguration> path = balanced.findAcceptingPath("001011");
		assertFalse(path.isEmpty());
		for (int i = 1; i < path.size(); i++) {
			PDAConfiguration prev = path.get(i-1);
			PDAConfiguration next = path.get(i);
			int read = next.getPosition()-prev.getPosition();
			assertTrue(read == 0 || read == 1);
			assertTrue(Math.abs(next.getStack().length()-prev.getStack().length()) <= 1);
		}
	}

	public void testFire() {
		PDATransition pop = new PDATransition("q1", '1', '0', 'e', "q1");
		PDAConfiguration c = new PDAConfiguration("q1", "1", 0, "$0");
		PDAConfiguration next = pop.fire(c);
		assertEquals(new PDAConfiguration("q1", "1", 1, "$"), next);
		assertTrue(next.isInputConsumed());
		// top of the stack is $, not 0
		assertNull(pop.fire(next));
		assertNull(pop.fire(new PDAConfiguration("q1", "1", 0, "")));
		assertNull(pop.fire(new PDAConfiguration("q2", "1", 0, "0")));
	}

	public void testAcceptNeedsAllInput() throws Exception {
		PushdownAutomaton p = new PushdownAutomaton(text("q0:0,e>e:q1\nq1"));
		assertTrue(p.accepts("0"));
		assertFalse(p.accepts("00"));
		assertFalse(p.accepts(""));
	}

	public void testStackLeftOverDoesNotMatter() throws Exception {
		PushdownAutomaton p = new PushdownAutomaton(text("q0:0,e>x:q1\nq1:e,e>y:q2\nq2"));
		assertTrue(p.accepts("0"));
	}

	public void testSelfTest() {
		CollectingReporter r = new CollectingReporter();
		assertEquals(0, balanced.performTests(BALANCED, UNBALANCED, r));
		assertEquals(1, r.passed);
	}

	public void testSelfTestFindsMissingTransition() throws Exception {
		PushdownAutomaton broken = new PushdownAutomaton(text("q0:e,e>$:q1\nq1:0,e>0:q1\nq1:e,$>e:q2\nq2"));
		CollectingReporter r = new CollectingReporter();
		assertEquals(2, broken.performTests(BALANCED, UNBALANCED, r));
		assertEquals(Arrays.asList("01", "001011"), r.strings());
		for (Mismatch m : r.mismatches) {
			assertEquals(Mismatch.Kind.FALSE_NEGATIVE, m.getKind());
			assertEquals("NPDA", m.getSystem());
		}
	}

	public void testEpsilonCycleUnderBudget() throws Exception {
		PushdownAutomaton p = epsilonCycle(true);
		try {
			p.accepts("1", 1000);
			fail("an endless epsilon cycle was decided");
		}
		catch (UnusualConditionException e) {
			assertTrue(e.getMessage().indexOf("1000") >= 0);
		}
		CollectingReporter r = new CollectingReporter();
		assertEquals(2, p.performTests(Arrays.asList("1"), Arrays.asList(""), 1000, r));
		for (Mismatch m : r.mismatches)
			assertEquals(Mismatch.Kind.UNDECIDED, m.getKind());
	}

	public void testTransitionOrderMatters() throws Exception {
		assertTrue(epsilonCycle(false).accepts("1", 1000));
		assertTrue(epsilonCycle(false).accepts("1"));
	}

	public void testEpsilonInInput() {
		try {
			balanced.accepts("0e1");
			fail("epsilon in input accepted");
		}
		catch (IllegalArgumentException e) {
		}
	}

	private static void assertRefused(String automaton) throws Exception {
		try {
			new PushdownAutomaton(text(automaton));
			fail("built automaton from "+automaton);
		}
		catch (DataFormatException e) {
		}
	}

	public void testMalformedFiles() throws Exception {
		assertRefused("");
		assertRefused("q2");
		assertRefused("q0:e,e>$:q1\nq1:e,$>e:q2\nq2,,q1");
		assertRefused("q0:e,e>$:q1\nq9");
		assertRefused("q0:e,e$:q1\nq1");
		assertRefused("q0:ee>$:q1\nq1");
		assertRefused("q0:e,e>$\nq1");
		assertRefused(":e,e>$:q1\nq1");
		assertRefused("q0:e,e>$:\nq1");
		assertRefused("q0:e,e>$:q1:q2\nq1");
	}

	public void testDuplicateTransitionsCollapse() throws Exception {
		PushdownAutomaton p = new PushdownAutomaton(text("q0:0,e>e:q1\nq0 : 0 , e > e : q1\nq1"));
		assertEquals(1, p.getTransitions().size());
	}

	public void testDeclaredAlphabets() throws Exception {
		List<PDATransition> ts = Arrays.asList(new PDATransition("q0", '0', 'e', 'x', "q1"));
		HashSet<String> states = new HashSet<String>(Arrays.asList("q0", "q1"));
		HashSet<Character> input = new HashSet<Character>(Arrays.asList('0'));
		PushdownAutomaton p = new PushdownAutomaton(states, input, new HashSet<Character>(Arrays.asList('x')), ts, "q0",
				Arrays.asList("q1"));
		assertTrue(p.accepts("0"));
		try {
			new PushdownAutomaton(states, input, new HashSet<Character>(Arrays.asList('y')), ts, "q0", Arrays.asList("q1"));
			fail("push symbol outside the stack alphabet");
		}
		catch (DataFormatException e) {
		}
		try {
			new PushdownAutomaton(states, input, new HashSet<Character>(Arrays.asList('x')), ts, "q2", Arrays.asList("q1"));
			fail("start state outside the states");
		}
		catch (DataFormatException e) {
		}
	}
}
