package asciigraf;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import org.junit.Test;

public class EdgeCharMapBuilderTest {

	@Test
	public void testFindsOnlyLineCharacters() {
		TreeMap<Point, Character> chars = new EdgeCharMapBuilder().build("a-b + |\n /x\\ _=");
		assertEquals(4, chars.size());
		assertEquals(Character.valueOf('-'), chars.get(new Point(1, 0)));
		assertEquals(Character.valueOf('|'), chars.get(new Point(6, 0)));
		assertEquals(Character.valueOf('/'), chars.get(new Point(1, 1)));
		assertEquals(Character.valueOf('\\'), chars.get(new Point(3, 1)));
	}

	@Test
	public void testKeysAreRowMajor() {
		TreeMap<Point, Character> chars = new EdgeCharMapBuilder().build("  |\n-  \n |");
		assertEquals(Arrays.asList(new Point(2, 0), new Point(0, 1), new Point(1, 2)),
				new ArrayList<Point>(chars.keySet()));
	}

	@Test
	public void testOccupancyCoversEveryCharacter() {
		Token n = new Token("node", new Point(2, 1));
		Token l = new Token("(x)", new Point(0, 3));
		Map<Point, Token> chars = EdgeCharMapBuilder.occupancy(Arrays.asList(n, l));
		assertEquals(7, chars.size());
		assertSame(n, chars.get(new Point(2, 1)));
		assertSame(n, chars.get(new Point(5, 1)));
		assertNull(chars.get(new Point(6, 1)));
		assertSame(l, chars.get(new Point(2, 3)));
	}
}
