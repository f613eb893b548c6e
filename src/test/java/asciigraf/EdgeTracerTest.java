package asciigraf;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeMap;

import org.junit.Test;

public class EdgeTracerTest {

	private EdgeTracer tracerFor(String diagram) {
		List<Token> tokens = new TokenScanner().scan(diagram);
		ArrayList<Token> nodes = new ArrayList<Token>();
		for (Token t : tokens) {
			if (t.isNode()) {
				nodes.add(t);
			}
		}
		TreeMap<Point, Character> chars = new EdgeCharMapBuilder().build(diagram);
		new LabelPatcher().patch(tokens, chars);
		return new EdgeTracer(chars, EdgeCharMapBuilder.occupancy(nodes));
	}

	@Test
	public void testDirectionalNeighbours() {
		EdgeTracer tracer = tracerFor("n1-n2");
		assertEquals(Arrays.asList(new Point(1, 0), new Point(3, 0)),
				new ArrayList<Point>(tracer.neighbours(new Point(2, 0))));
	}

	@Test
	public void testAbuttingNeighbourAtCorner() {
		// a '-' only points left and right; the '\' above-left is found because it points back
		EdgeTracer tracer = tracerFor("n1\n \\\n  ---n2");
		LinkedHashSet<Point> found = tracer.neighbours(new Point(2, 2));
		assertEquals(new HashSet<Point>(Arrays.asList(new Point(3, 2), new Point(1, 1))), found);
	}

	@Test
	public void testTraceClaimsEveryLineCharacterOnce() {
		String diagram = "a---b\n|   |\nc---d";
		TraceResult result = tracerFor(diagram).trace();
		assertFalse(result.isFailure());
		assertEquals(4, result.getEdges().size());

		int total = 0;
		HashSet<Point> seen = new HashSet<Point>();
		for (TracedEdge e : result.getEdges()) {
			total += e.getLength();
			for (Point p : e.getPath()) {
				assertTrue("claimed twice: " + p, seen.add(p));
				assertSame(e, result.getClaimed().get(p));
			}
		}
		assertEquals(new EdgeCharMapBuilder().build(diagram).size(), total);
		assertEquals(total, result.getClaimed().size());
	}

	@Test
	public void testEdgesComeOutInRowMajorOrderOfTheirFirstCell() {
		TraceResult result = tracerFor("a---b\n|   |\nc---d").trace();
		List<TracedEdge> edges = result.getEdges();
		assertEquals("a", edges.get(0).getNodeA());
		assertEquals("b", edges.get(0).getNodeB());
		assertEquals("c", edges.get(1).getNodeB());
		assertEquals("d", edges.get(2).getNodeB());
		assertEquals("c", edges.get(3).getNodeA());
		assertEquals("d", edges.get(3).getNodeB());
	}

	@Test
	public void testPathRunsFromSmallerNameToLarger() {
		// z is scanned first but a sorts first
		TraceResult result = tracerFor("z\n|\n\\\n ---a").trace();
		TracedEdge e = result.getEdges().get(0);
		assertEquals("a", e.getNodeA());
		assertEquals("z", e.getNodeB());
		assertEquals(5, e.getLength());
		assertEquals(new Point(3, 3), e.getPath().get(0));
		assertEquals(new Point(0, 1), e.getPath().get(4));
	}

	@Test
	public void testLongLineIsWalkedIteratively() {
		StringBuilder sb = new StringBuilder("a");
		for (int i = 0; i < 20000; i++) {
			sb.append('-');
		}
		sb.append("b");
		TraceResult result = tracerFor(sb.toString()).trace();
		assertFalse(result.isFailure());
		assertEquals(20000, result.getEdges().get(0).getLength());
	}

	@Test
	public void testDanglingLine() {
		TraceResult result = tracerFor("n1---").trace();
		assertTrue(result.isFailure());
		assertEquals(EdgeTraceFailure.Kind.TOO_FEW_NODES, result.getFailure().getKind());
		assertEquals(new Point(4, 0), result.getFailure().getPosition());
		assertEquals('-', result.getFailure().getGlyph());
		assertTrue(result.getEdges().isEmpty());
	}

	@Test
	public void testBranchingLine() {
		TraceResult result = tracerFor("n1---n2\n  |\n  n3").trace();
		assertTrue(result.isFailure());
		assertEquals(EdgeTraceFailure.Kind.TOO_MANY_NODES, result.getFailure().getKind());
		assertEquals(new Point(2, 0), result.getFailure().getPosition());
		assertEquals("n1--\n  |", result.getFailure().getSnippet());
	}

	@Test
	public void testClosedLoopWithoutNodes() {
		TraceResult result = tracerFor(" /-\\\n | |\n \\-/").trace();
		assertTrue(result.isFailure());
		assertEquals(EdgeTraceFailure.Kind.INVALID_EDGE, result.getFailure().getKind());
		assertEquals(new Point(1, 0), result.getFailure().getPosition());
	}

	@Test
	public void testLineBackToTheSameNode() {
		TraceResult result = tracerFor("n1--\\\n     |\nn1--/").trace();
		assertTrue(result.isFailure());
		assertEquals(EdgeTraceFailure.Kind.INVALID_EDGE, result.getFailure().getKind());
		assertEquals(new Point(2, 0), result.getFailure().getPosition());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsMapsNotInRowMajorOrder() {
		TreeMap<Point, Character> reversed = new TreeMap<Point, Character>(Collections.<Point>reverseOrder());
		reversed.put(new Point(0, 0), '-');
		new EdgeTracer(reversed, new TreeMap<Point, Token>());
	}
}
