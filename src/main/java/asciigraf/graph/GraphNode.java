package asciigraf.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import asciigraf.Point;
import asciigraf.constants.NodeProperty;

public class GraphNode {

	private final String name;
	private final LinkedHashMap<String, Object> assoc;
	private final ArrayList<GraphEdge> edges;

	public GraphNode(String name) {
		this.name = name;
		this.assoc = new LinkedHashMap<String, Object>();
		this.edges = new ArrayList<GraphEdge>();
	}

	public String getName() {return this.name;}

	/**
	 * Adds or replaces a mapping of key->obj for this node
	 */
	public void assocObject(String key, Object obj) {
		this.assoc.put(key, obj);
	}

	/**
	 * @return Object associated with this node and key through a previous call
	 *		to assocObject, or null
	 */
	public Object getObject(String key) {
		return this.assoc.get(key);
	}

	public Map<String, Object> getProperties() {return this.assoc;}

	public Point getPosition() {
		return (Point) this.getObject(NodeProperty.POSITION.propertyName);
	}

	void addEdge(GraphEdge e) {
		if (!this.edges.contains(e)) {
			this.edges.add(e);
		}
	}

	public List<GraphEdge> getEdges() {return this.edges;}

	public int getDegree() {return this.edges.size();}

	@Override
	public String toString() {
		return this.name;
	}
}
