package asciigraf.exceptions;

import asciigraf.Point;

/**
 * Thrown when a line character touches fewer than two other cells: the line stops
 * without reaching a node.
 */
public class TooFewNodesOnEdgeException extends InvalidEdgeException {

	private static final long serialVersionUID = 1L;

	public TooFewNodesOnEdgeException(String msg, Point position, char glyph, String snippet) {
		super(msg, position, glyph, snippet);
	}

	@Override
	protected String getKind() {
		return "Too few nodes on edge";
	}
}
