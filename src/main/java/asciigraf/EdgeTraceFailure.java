package asciigraf;

import asciigraf.exceptions.InvalidEdgeException;
import asciigraf.exceptions.TooFewNodesOnEdgeException;
import asciigraf.exceptions.TooManyNodesOnEdgeException;

/**
 * Describes why the tracer gave up on a diagram. Returned by the tracer as a value and
 * turned into an exception by the caller with {@link #toException()}.
 */
public final class EdgeTraceFailure {

	public enum Kind {
		TOO_MANY_NODES,
		TOO_FEW_NODES,
		INVALID_EDGE
	}

	private final Kind kind;
	private final Point position;
	private final char glyph;
	private final String detail;
	private final String snippet;

	public EdgeTraceFailure(Kind kind, Point position, char glyph, String detail, String snippet) {
		this.kind = kind;
		this.position = position;
		this.glyph = glyph;
		this.detail = detail;
		this.snippet = snippet;
	}

	public Kind getKind() {return this.kind;}

	public Point getPosition() {return this.position;}

	public char getGlyph() {return this.glyph;}

	public String getDetail() {return this.detail;}

	public String getSnippet() {return this.snippet;}

	public InvalidEdgeException toException() {
		switch (this.kind) {
		case TOO_MANY_NODES:
			return new TooManyNodesOnEdgeException(this.detail, this.position, this.glyph, this.snippet);
		case TOO_FEW_NODES:
			return new TooFewNodesOnEdgeException(this.detail, this.position, this.glyph, this.snippet);
		default:
			return new InvalidEdgeException(this.detail, this.position, this.glyph, this.snippet);
		}
	}

	@Override
	public String toString() {
		return this.kind + " at " + this.position + " '" + this.glyph + "': " + this.detail;
	}
}
