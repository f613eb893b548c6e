package asciigraf.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A minimal undirected graph that keeps nodes and edges in the order they were added.
 * Nodes are keyed by name and edges by their (sorted) pair of node names, so adding the
 * same node or edge twice updates its properties rather than duplicating it.
 */
public class AsciiGraph implements GraphSink {

	private final LinkedHashMap<String, GraphNode> nodes;
	private final LinkedHashMap<List<String>, GraphEdge> edges;

	public AsciiGraph() {
		this.nodes = new LinkedHashMap<String, GraphNode>();
		this.edges = new LinkedHashMap<List<String>, GraphEdge>();
	}

	@Override
	public void addNode(String name, Map<String, Object> properties) {
		GraphNode n = this.getOrCreateNode(name);
		for (Map.Entry<String, Object> e : properties.entrySet()) {
			n.assocObject(e.getKey(), e.getValue());
		}
	}

	@Override
	public void addEdge(String nodeA, String nodeB, Map<String, Object> properties) {
		List<String> key = edgeKey(nodeA, nodeB);
		GraphEdge e = this.edges.get(key);
		if (e == null) {
			GraphNode a = this.getOrCreateNode(key.get(0));
			GraphNode b = this.getOrCreateNode(key.get(1));
			e = new GraphEdge(a, b);
			a.addEdge(e);
			b.addEdge(e);
			this.edges.put(key, e);
		}
		for (Map.Entry<String, Object> p : properties.entrySet()) {
			e.assocObject(p.getKey(), p.getValue());
		}
	}

	private GraphNode getOrCreateNode(String name) {
		GraphNode n = this.nodes.get(name);
		if (n == null) {
			n = new GraphNode(name);
			this.nodes.put(name, n);
		}
		return n;
	}

	private static List<String> edgeKey(String nodeA, String nodeB) {
		if (nodeA.compareTo(nodeB) > 0) {
			return Arrays.asList(nodeB, nodeA);
		}
		return Arrays.asList(nodeA, nodeB);
	}

	/**
	 * @return the node named `name` or null
	 */
	public GraphNode getNode(String name) {
		return this.nodes.get(name);
	}

	/**
	 * @return the edge between the two nodes, in either order, or null
	 */
	public GraphEdge getEdge(String nodeA, String nodeB) {
		return this.edges.get(edgeKey(nodeA, nodeB));
	}

	public boolean hasEdge(String nodeA, String nodeB) {
		return this.getEdge(nodeA, nodeB) != null;
	}

	public Set<String> getNodeNames() {
		return this.nodes.keySet();
	}

	public List<GraphNode> getNodes() {
		return new ArrayList<GraphNode>(this.nodes.values());
	}

	public List<GraphEdge> getEdges() {
		return new ArrayList<GraphEdge>(this.edges.values());
	}

	public int getNodeCount() {return this.nodes.size();}

	public int getEdgeCount() {return this.edges.size();}

	@Override
	public String toString() {
		return "AsciiGraph" + this.nodes.keySet() + this.edges.values();
	}
}
