package asciigraf;

import java.util.Collections;
import java.util.List;

/**
 * A line of the diagram followed from one node to another. The node names are in
 * canonical (sorted) order and the path runs from the first node to the second.
 */
public final class TracedEdge {

	private final String nodeA;
	private final String nodeB;
	private final List<Point> path;

	public TracedEdge(String nodeA, String nodeB, List<Point> path) {
		this.nodeA = nodeA;
		this.nodeB = nodeB;
		this.path = Collections.unmodifiableList(path);
	}

	public String getNodeA() {return this.nodeA;}

	public String getNodeB() {return this.nodeB;}

	/**
	 * @return the line cells from the cell next to nodeA to the cell next to nodeB
	 */
	public List<Point> getPath() {return this.path;}

	/**
	 * @return the number of line cells, label cells included
	 */
	public int getLength() {return this.path.size();}

	@Override
	public String toString() {
		return this.nodeA + " -- " + this.nodeB + " (length " + this.getLength() + ")";
	}
}
