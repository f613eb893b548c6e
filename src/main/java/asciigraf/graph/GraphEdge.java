package asciigraf.graph;

import java.util.LinkedHashMap;
import java.util.Map;

import asciigraf.constants.EdgeProperty;

/**
 * An undirected edge. nodeA always has the name that sorts first.
 */
public class GraphEdge {

	private final GraphNode nodeA;
	private final GraphNode nodeB;
	private final LinkedHashMap<String, Object> assoc;

	public GraphEdge(GraphNode nodeA, GraphNode nodeB) {
		this.nodeA = nodeA;
		this.nodeB = nodeB;
		this.assoc = new LinkedHashMap<String, Object>();
	}

	public GraphNode getNodeA() {return this.nodeA;}

	public GraphNode getNodeB() {return this.nodeB;}

	/**
	 * @return the endpoint that is not `n`, or null if `n` is not on this edge
	 */
	public GraphNode getOtherNode(GraphNode n) {
		if (n == this.nodeA) {
			return this.nodeB;
		} else if (n == this.nodeB) {
			return this.nodeA;
		}
		return null;
	}

	public void assocObject(String key, Object obj) {
		this.assoc.put(key, obj);
	}

	public Object getObject(String key) {
		return this.assoc.get(key);
	}

	public Map<String, Object> getProperties() {return this.assoc;}

	public Integer getLength() {
		return (Integer) this.getObject(EdgeProperty.LENGTH.propertyName);
	}

	/**
	 * @return the label text, or null for unlabelled edges
	 */
	public String getLabel() {
		return (String) this.getObject(EdgeProperty.LABEL.propertyName);
	}

	@Override
	public String toString() {
		return this.nodeA + " -- " + this.nodeB;
	}
}
