package asciigraf;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import asciigraf.exceptions.InvalidEdgeException;
import asciigraf.graph.AsciiGraph;
import asciigraf.graph.GraphSink;

/**
 * Builds a graph from an ASCII drawing of a network, e.g.
 *
 * <pre>
 *   n1---(10)---n2
 *   |            \
 *   |             ---n3
 *   n4
 * </pre>
 *
 * Names made of letters, digits, '_', '{' and '}' are nodes. Lines are drawn with
 * '-', '|', '/' and '\' and must connect exactly two nodes. A name in parentheses
 * drawn on a line labels that line.
 *
 * The parser keeps no state between calls; one instance may be shared.
 */
public class AsciiGraphParser {

	static Logger _LOG = Logger.getLogger(AsciiGraphParser.class);

	private final TokenScanner scanner;
	private final EdgeCharMapBuilder edgeCharMapBuilder;
	private final LabelPatcher labelPatcher;
	private final GraphAssembler assembler;

	public AsciiGraphParser() {
		this.scanner = new TokenScanner();
		this.edgeCharMapBuilder = new EdgeCharMapBuilder();
		this.labelPatcher = new LabelPatcher();
		this.assembler = new GraphAssembler();
	}

	/**
	 * @return a new graph holding the nodes and edges of the diagram
	 * @throws InvalidEdgeException if a line cannot be traced between two nodes
	 */
	public AsciiGraph graphFromAscii(String diagram) throws InvalidEdgeException {
		AsciiGraph graph = new AsciiGraph();
		this.parse(diagram, graph);
		return graph;
	}

	/**
	 * Parses the diagram and emits its nodes, then its edges, to `sink`. Nothing is
	 * emitted if the diagram is invalid.
	 *
	 * @throws InvalidEdgeException if a line cannot be traced between two nodes
	 */
	public void parse(String diagram, GraphSink sink) throws InvalidEdgeException {
		Diagram d = this.read(diagram);
		TraceResult result = d.trace();
		if (result.isFailure()) {
			throw result.getFailure().toException();
		}
		this.assembler.assemble(d.nodes, result.getEdges(), d.labelChars, sink);
	}

	/**
	 * Runs the tracer without building a graph.
	 */
	public TraceResult trace(String diagram) {
		return this.read(diagram).trace();
	}

	private Diagram read(String diagram) {
		List<Token> tokens = this.scanner.scan(diagram);
		ArrayList<Token> nodes = new ArrayList<Token>();
		ArrayList<Token> labels = new ArrayList<Token>();
		for (Token t : tokens) {
			if (t.isLabel()) {
				labels.add(t);
			} else {
				nodes.add(t);
			}
		}
		_LOG.debug(nodes.size() + " node tokens, " + labels.size() + " label tokens");

		TreeMap<Point, String> labelChars = new TreeMap<Point, String>();
		for (Token label : labels) {
			for (int i = 0; i < label.length(); i++) {
				labelChars.put(label.charPosition(i), label.getContent());
			}
		}

		TreeMap<Point, Character> edgeChars = this.edgeCharMapBuilder.build(diagram);
		this.labelPatcher.patch(labels, edgeChars);
		return new Diagram(nodes, EdgeCharMapBuilder.occupancy(nodes), labelChars, edgeChars);
	}

	/** The maps built from one diagram. */
	private static final class Diagram {
		final List<Token> nodes;
		final Map<Point, Token> nodeChars;
		final Map<Point, String> labelChars;
		final TreeMap<Point, Character> edgeChars;

		Diagram(List<Token> nodes, Map<Point, Token> nodeChars, Map<Point, String> labelChars,
				TreeMap<Point, Character> edgeChars) {
			this.nodes = nodes;
			this.nodeChars = nodeChars;
			this.labelChars = labelChars;
			this.edgeChars = edgeChars;
		}

		TraceResult trace() {
			return new EdgeTracer(this.edgeChars, this.nodeChars).trace();
		}
	}
}
