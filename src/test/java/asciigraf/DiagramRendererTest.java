package asciigraf;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.TreeMap;

import org.junit.Test;

public class DiagramRendererTest {

	@Test
	public void testDrawsAtOriginalCoordinates() {
		TreeMap<Point, Character> chars = new TreeMap<Point, Character>();
		chars.put(new Point(3, 2), '|');
		assertEquals("\n\n   |", DiagramRenderer.render(chars));
	}

	@Test
	public void testDrawsNodeNamesFromTheirFirstCell() {
		TreeMap<Point, Character> chars = new TreeMap<Point, Character>();
		chars.put(new Point(4, 0), '-');
		chars.put(new Point(3, 0), '-');
		HashMap<Point, String> nodes = new HashMap<Point, String>();
		nodes.put(new Point(1, 0), "n1");
		nodes.put(new Point(0, 0), "n1");
		assertEquals("n1 --", DiagramRenderer.render(chars, nodes));
	}

	@Test
	public void testRowsAreDrawnInOrder() {
		TreeMap<Point, Character> chars = new TreeMap<Point, Character>();
		chars.put(new Point(0, 2), '|');
		chars.put(new Point(0, 1), '|');
		HashMap<Point, String> nodes = new HashMap<Point, String>();
		nodes.put(new Point(0, 0), "n1");
		assertEquals("n1\n|\n|", DiagramRenderer.render(chars, nodes));
	}

	@Test
	public void testEmptyMap() {
		assertEquals("", DiagramRenderer.render(new TreeMap<Point, Character>()));
	}

	@Test
	public void testSnippetScansBackToTheSameCells() {
		TreeMap<Point, Character> chars = new TreeMap<Point, Character>();
		chars.put(new Point(2, 1), '/');
		chars.put(new Point(5, 0), '\\');
		chars.put(new Point(0, 3), '-');
		String drawn = DiagramRenderer.render(chars);
		assertEquals(chars, new EdgeCharMapBuilder().build(drawn));
	}
}
