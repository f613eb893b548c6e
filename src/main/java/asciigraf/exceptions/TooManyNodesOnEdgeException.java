package asciigraf.exceptions;

import asciigraf.Point;

/**
 * Thrown when a line character touches more than two other cells, i.e. a line branches
 * or two lines cross in a way that cannot be told apart.
 */
public class TooManyNodesOnEdgeException extends InvalidEdgeException {

	private static final long serialVersionUID = 1L;

	public TooManyNodesOnEdgeException(String msg, Point position, char glyph, String snippet) {
		super(msg, position, glyph, snippet);
	}

	@Override
	protected String getKind() {
		return "Too many nodes on edge";
	}
}
