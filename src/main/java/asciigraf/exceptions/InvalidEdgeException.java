package asciigraf.exceptions;

import java.io.PrintStream;

import asciigraf.Point;

/**
 * Thrown when a line in a diagram cannot be traced between two nodes. Carries the cell
 * where tracing failed and a redrawing of the cells around it.
 *
 * More specific subclasses are thrown for lines with too many or too few ends.
 */
public class InvalidEdgeException extends Exception {

	private static final long serialVersionUID = 1L;

	private final Point position;
	private final char glyph;
	private final String snippet;

	public InvalidEdgeException(String msg, Point position, char glyph, String snippet) {
		super(msg);
		this.position = position;
		this.glyph = glyph;
		this.snippet = snippet;
	}

	public Point getPosition() {return this.position;}

	public char getGlyph() {return this.glyph;}

	/**
	 * @return the offending cells redrawn at their original coordinates
	 */
	public String getSnippet() {return this.snippet;}

	protected String getKind() {
		return "Invalid edge";
	}

	@Override
	public String toString() {
		return this.getKind() + " at " + this.position + " '" + this.glyph + "': " + this.getMessage()
				+ "\n" + this.snippet;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
