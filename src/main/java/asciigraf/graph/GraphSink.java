package asciigraf.graph;

import java.util.Map;

/**
 * Receives the nodes and edges found in a diagram. Property keys are the property
 * names from {@link asciigraf.constants.NodeProperty} and {@link asciigraf.constants.EdgeProperty}.
 *
 * All nodes are emitted before any edge, so an edge only ever names nodes that have
 * already been added.
 */
public interface GraphSink {

	void addNode(String name, Map<String, Object> properties);

	/**
	 * @param nodeA the endpoint whose name sorts first
	 * @param nodeB the other endpoint
	 */
	void addEdge(String nodeA, String nodeB, Map<String, Object> properties);
}
