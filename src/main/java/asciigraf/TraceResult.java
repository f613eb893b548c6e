package asciigraf;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of tracing a diagram: either every edge with the cells it claimed, or the
 * failure that stopped the trace.
 */
public final class TraceResult {

	private final List<TracedEdge> edges;
	private final Map<Point, TracedEdge> claimed;
	private final EdgeTraceFailure failure;

	private TraceResult(List<TracedEdge> edges, Map<Point, TracedEdge> claimed, EdgeTraceFailure failure) {
		this.edges = edges;
		this.claimed = claimed;
		this.failure = failure;
	}

	public static TraceResult success(List<TracedEdge> edges, Map<Point, TracedEdge> claimed) {
		return new TraceResult(Collections.unmodifiableList(edges), Collections.unmodifiableMap(claimed), null);
	}

	public static TraceResult failed(EdgeTraceFailure failure) {
		return new TraceResult(Collections.<TracedEdge>emptyList(), Collections.<Point, TracedEdge>emptyMap(), failure);
	}

	public boolean isFailure() {return this.failure != null;}

	/**
	 * @return the failure, or null if tracing succeeded
	 */
	public EdgeTraceFailure getFailure() {return this.failure;}

	/**
	 * @return the edges in the order they were traced (row-major order of their first cell)
	 */
	public List<TracedEdge> getEdges() {return this.edges;}

	/**
	 * @return line cell -> the edge that claimed it
	 */
	public Map<Point, TracedEdge> getClaimed() {return this.claimed;}
}
