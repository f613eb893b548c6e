package asciigraf;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import asciigraf.constants.EdgeProperty;
import asciigraf.constants.NodeProperty;
import asciigraf.graph.GraphSink;

/**
 * Hands the nodes and traced edges of a diagram to a {@link GraphSink}.
 */
public class GraphAssembler {

	static Logger _LOG = Logger.getLogger(GraphAssembler.class);

	public GraphAssembler() {
	}

	/**
	 * @param nodes node tokens in scan order; label tokens are skipped
	 * @param edges traced edges in trace order
	 * @param labelChars cell -> label content for every cell covered by a label
	 */
	public void assemble(List<Token> nodes, List<TracedEdge> edges, Map<Point, String> labelChars, GraphSink sink) {
		int nodeCount = 0;
		for (Token t : nodes) {
			if (!t.isNode()) {
				continue;
			}
			LinkedHashMap<String, Object> props = new LinkedHashMap<String, Object>();
			props.put(NodeProperty.POSITION.propertyName, t.getRoot());
			sink.addNode(t.getText(), props);
			nodeCount++;
		}
		for (TracedEdge e : edges) {
			LinkedHashMap<String, Object> props = new LinkedHashMap<String, Object>();
			props.put(EdgeProperty.LENGTH.propertyName, e.getLength());
			String label = labelFor(e, labelChars);
			if (label != null) {
				props.put(EdgeProperty.LABEL.propertyName, label);
			}
			sink.addEdge(e.getNodeA(), e.getNodeB(), props);
		}
		_LOG.debug("emitted " + nodeCount + " nodes and " + edges.size() + " edges");
	}

	/**
	 * @return the content of the first label found along the edge's path, or null
	 */
	static String labelFor(TracedEdge e, Map<Point, String> labelChars) {
		for (Point p : e.getPath()) {
			String label = labelChars.get(p);
			if (label != null) {
				return label;
			}
		}
		return null;
	}
}
