package asciigraf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.log4j.Logger;

/**
 * Follows the lines of a diagram from node to node.
 *
 * Tracing happens in two passes. The first resolves, for every line character, the two
 * cells it connects to and rejects any character that connects to more or fewer. The
 * second walks each chain of characters from a starting cell out to the node at either
 * end. Both passes visit line characters in row-major order; that order decides where
 * a chain is entered and, on failure, which cell is reported.
 */
public class EdgeTracer {

	static Logger _LOG = Logger.getLogger(EdgeTracer.class);

	private static final Point LEFT = new Point(-1, 0);
	private static final Point RIGHT = new Point(1, 0);
	private static final Point ABOVE = new Point(0, -1);
	private static final Point BELOW = new Point(0, 1);
	private static final Point TOP_LEFT = new Point(-1, -1);
	private static final Point TOP_RIGHT = new Point(1, -1);
	private static final Point BOTTOM_LEFT = new Point(-1, 1);
	private static final Point BOTTOM_RIGHT = new Point(1, 1);

	/** The two directions a line character points in. */
	private static final Map<Character, List<Point>> DIRECTIONS;

	/** offset -> the character that, sitting at that offset, points back at the centre cell */
	private static final Map<Point, Character> ABUTTING;

	static {
		HashMap<Character, List<Point>> directions = new HashMap<Character, List<Point>>();
		directions.put(EdgeCharMapBuilder.HORIZONTAL, Collections.unmodifiableList(Arrays.asList(LEFT, RIGHT)));
		directions.put(EdgeCharMapBuilder.VERTICAL, Collections.unmodifiableList(Arrays.asList(ABOVE, BELOW)));
		directions.put(EdgeCharMapBuilder.FORWARD_SLASH, Collections.unmodifiableList(Arrays.asList(BOTTOM_LEFT, TOP_RIGHT)));
		directions.put(EdgeCharMapBuilder.BACK_SLASH, Collections.unmodifiableList(Arrays.asList(TOP_LEFT, BOTTOM_RIGHT)));
		DIRECTIONS = Collections.unmodifiableMap(directions);

		LinkedHashMap<Point, Character> abutting = new LinkedHashMap<Point, Character>();
		abutting.put(TOP_LEFT, EdgeCharMapBuilder.BACK_SLASH);
		abutting.put(ABOVE, EdgeCharMapBuilder.VERTICAL);
		abutting.put(TOP_RIGHT, EdgeCharMapBuilder.FORWARD_SLASH);
		abutting.put(LEFT, EdgeCharMapBuilder.HORIZONTAL);
		abutting.put(RIGHT, EdgeCharMapBuilder.HORIZONTAL);
		abutting.put(BOTTOM_LEFT, EdgeCharMapBuilder.FORWARD_SLASH);
		abutting.put(BELOW, EdgeCharMapBuilder.VERTICAL);
		abutting.put(BOTTOM_RIGHT, EdgeCharMapBuilder.BACK_SLASH);
		ABUTTING = Collections.unmodifiableMap(abutting);
	}

	private final SortedMap<Point, Character> edgeChars;
	private final Map<Point, Token> nodeChars;

	/**
	 * @param edgeChars line characters, already patched for labels. Must be sorted row-major
	 *		(a map keyed by Point with its natural ordering); tracing order depends on it.
	 * @param nodeChars cell -> node token for every cell covered by a node name
	 */
	public EdgeTracer(SortedMap<Point, Character> edgeChars, Map<Point, Token> nodeChars) {
		if (edgeChars.comparator() != null) {
			throw new IllegalArgumentException("edge characters must be in row-major (natural) order");
		}
		this.edgeChars = edgeChars;
		this.nodeChars = nodeChars;
	}

	/**
	 * @return the cells connected to the line character at `pos`, directional neighbours first
	 */
	public LinkedHashSet<Point> neighbours(Point pos) {
		char glyph = this.edgeChars.get(pos);
		LinkedHashSet<Point> found = new LinkedHashSet<Point>();
		for (Point offset : DIRECTIONS.get(glyph)) {
			Point candidate = pos.add(offset);
			if (this.edgeChars.containsKey(candidate) || this.nodeChars.containsKey(candidate)) {
				found.add(candidate);
			}
		}
		for (Map.Entry<Point, Character> e : ABUTTING.entrySet()) {
			Point candidate = pos.add(e.getKey());
			Character other = this.edgeChars.get(candidate);
			if (other != null && other.charValue() == e.getValue().charValue()) {
				found.add(candidate);
			}
		}
		return found;
	}

	public TraceResult trace() {
		TreeMap<Point, List<Point>> neighbourMap = new TreeMap<Point, List<Point>>();
		for (Map.Entry<Point, Character> e : this.edgeChars.entrySet()) {
			Point pos = e.getKey();
			LinkedHashSet<Point> found = this.neighbours(pos);
			if (_LOG.isTraceEnabled()) {
				_LOG.trace("'" + e.getValue() + "' at " + pos + " -> " + found);
			}
			if (found.size() != 2) {
				ArrayList<Point> cells = new ArrayList<Point>(found);
				cells.add(pos);
				EdgeTraceFailure.Kind kind = found.size() > 2
						? EdgeTraceFailure.Kind.TOO_MANY_NODES
						: EdgeTraceFailure.Kind.TOO_FEW_NODES;
				String detail = "line character connects to " + found.size() + " cells, expected 2";
				return TraceResult.failed(this.failureAt(kind, pos, detail, cells));
			}
			neighbourMap.put(pos, new ArrayList<Point>(found));
		}

		ArrayList<TracedEdge> edges = new ArrayList<TracedEdge>();
		LinkedHashMap<Point, TracedEdge> claimed = new LinkedHashMap<Point, TracedEdge>();
		for (Point start : neighbourMap.keySet()) {
			if (claimed.containsKey(start)) {
				continue;
			}
			List<Point> startNeighbours = neighbourMap.get(start);
			HashSet<Point> visited = new HashSet<Point>();
			visited.add(start);

			Walk back = this.walk(start, startNeighbours.get(0), neighbourMap, visited, claimed);
			if (back.failure != null) {
				return TraceResult.failed(back.failure);
			}
			Walk forward = this.walk(start, startNeighbours.get(1), neighbourMap, visited, claimed);
			if (forward.failure != null) {
				return TraceResult.failed(forward.failure);
			}

			String first = back.endpoint.getText();
			String second = forward.endpoint.getText();
			ArrayList<Point> path = new ArrayList<Point>(back.cells.size() + forward.cells.size() + 1);
			for (int i = back.cells.size() - 1; i >= 0; i--) {
				path.add(back.cells.get(i));
			}
			path.add(start);
			path.addAll(forward.cells);

			if (first.equals(second)) {
				return TraceResult.failed(this.failureAt(EdgeTraceFailure.Kind.INVALID_EDGE, start,
						"line starts and ends at the same node '" + first + "'", path));
			}
			TracedEdge edge;
			if (first.compareTo(second) > 0) {
				Collections.reverse(path);
				edge = new TracedEdge(second, first, path);
			} else {
				edge = new TracedEdge(first, second, path);
			}
			for (Point p : path) {
				claimed.put(p, edge);
			}
			edges.add(edge);
			_LOG.debug("traced " + edge);
		}
		return TraceResult.success(edges, claimed);
	}

	/**
	 * Follows a chain of line characters away from `from`, starting at `next`, until a node
	 * is reached. Cells are recorded in walking order, the node cell is not.
	 */
	private Walk walk(Point from, Point next, Map<Point, List<Point>> neighbourMap,
			HashSet<Point> visited, Map<Point, TracedEdge> claimed) {
		ArrayList<Point> cells = new ArrayList<Point>();
		Point prev = from;
		Point cur = next;
		while (true) {
			Token node = this.nodeChars.get(cur);
			if (node != null) {
				return new Walk(cells, node, null);
			}
			if (!visited.add(cur) || claimed.containsKey(cur)) {
				cells.add(cur);
				return new Walk(cells, null, this.failureAt(EdgeTraceFailure.Kind.INVALID_EDGE, cur,
						"line runs into itself or into another line", cells));
			}
			cells.add(cur);
			List<Point> ns = neighbourMap.get(cur);
			if (!ns.contains(prev)) {
				ArrayList<Point> context = new ArrayList<Point>(ns);
				context.add(cur);
				context.add(prev);
				return new Walk(cells, null, this.failureAt(EdgeTraceFailure.Kind.INVALID_EDGE, cur,
						"line character does not connect back to " + prev, context));
			}
			Point after = ns.get(0).equals(prev) ? ns.get(1) : ns.get(0);
			prev = cur;
			cur = after;
		}
	}

	private EdgeTraceFailure failureAt(EdgeTraceFailure.Kind kind, Point pos, String detail, Collection<Point> cells) {
		char glyph = this.edgeChars.get(pos);
		String snippet = this.snippet(cells);
		_LOG.warn("cannot trace diagram, " + kind + " at " + pos + ": " + detail);
		return new EdgeTraceFailure(kind, pos, glyph, detail, snippet);
	}

	/**
	 * Redraws the given cells. Node cells are drawn as the whole node name.
	 */
	private String snippet(Collection<Point> cells) {
		TreeMap<Point, Character> chars = new TreeMap<Point, Character>();
		HashMap<Point, String> nodes = new HashMap<Point, String>();
		for (Point p : cells) {
			Character c = this.edgeChars.get(p);
			if (c != null) {
				chars.put(p, c);
			}
			Token node = this.nodeChars.get(p);
			if (node != null) {
				nodes.put(node.getRoot(), node.getText());
			}
		}
		return DiagramRenderer.render(chars, nodes);
	}

	private static final class Walk {
		final List<Point> cells;
		final Token endpoint;
		final EdgeTraceFailure failure;

		Walk(List<Point> cells, Token endpoint, EdgeTraceFailure failure) {
			this.cells = cells;
			this.endpoint = endpoint;
			this.failure = failure;
		}
	}
}
