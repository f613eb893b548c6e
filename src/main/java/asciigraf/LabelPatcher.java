package asciigraf;

import java.util.Map;

import org.apache.log4j.Logger;

import asciigraf.constants.GeneralConstants;

/**
 * Makes labels that are drawn on top of a line transparent to that line.
 *
 * A label such as `---(cost)---` interrupts the dashes. The patcher puts a line
 * character under every cell of the label that continues the line, so that the
 * tracer walks straight through it. The label text is still recorded separately and
 * ends up as the label of whichever edge claims those cells.
 */
public class LabelPatcher {

	static Logger _LOG = Logger.getLogger(LabelPatcher.class);

	private static final Point LEFT = new Point(-1, 0);
	private static final Point RIGHT = new Point(1, 0);
	private static final Point ABOVE = new Point(0, -1);
	private static final Point BELOW = new Point(0, 1);

	public LabelPatcher() {
	}

	/**
	 * Injects edge characters into `edgeChars` underneath the given labels. Cells are
	 * visited left to right, so a cell patched with '-' lets the next cell continue it.
	 *
	 * @param labels label tokens; node tokens are ignored
	 * @param edgeChars the line characters of the diagram, modified in place
	 * @return the number of cells that were patched
	 */
	public int patch(Iterable<Token> labels, Map<Point, Character> edgeChars) {
		int patched = 0;
		for (Token label : labels) {
			if (!label.isLabel()) {
				continue;
			}
			String text = label.getText();
			for (int i = 0; i < text.length(); i++) {
				Point pos = label.charPosition(i);
				Character glyph = glyphFor(text.charAt(i), pos, edgeChars);
				if (glyph != null) {
					edgeChars.put(pos, glyph);
					patched++;
				}
			}
		}
		if (patched > 0) {
			_LOG.debug("patched " + patched + " label cells into lines");
		}
		return patched;
	}

	private Character glyphFor(char c, Point pos, Map<Point, Character> edgeChars) {
		if (c == GeneralConstants.LABEL_OPEN.charValue() && holds(edgeChars, pos.add(LEFT), EdgeCharMapBuilder.HORIZONTAL)) {
			return EdgeCharMapBuilder.HORIZONTAL;
		} else if (c == GeneralConstants.LABEL_CLOSE.charValue() && holds(edgeChars, pos.add(RIGHT), EdgeCharMapBuilder.HORIZONTAL)) {
			return EdgeCharMapBuilder.HORIZONTAL;
		} else if (holds(edgeChars, pos.add(ABOVE), EdgeCharMapBuilder.VERTICAL)
				&& holds(edgeChars, pos.add(BELOW), EdgeCharMapBuilder.VERTICAL)) {
			return EdgeCharMapBuilder.VERTICAL;
		} else if (holds(edgeChars, pos.add(LEFT), EdgeCharMapBuilder.HORIZONTAL)) {
			return EdgeCharMapBuilder.HORIZONTAL;
		}
		return null;
	}

	private static boolean holds(Map<Point, Character> edgeChars, Point pos, char glyph) {
		Character c = edgeChars.get(pos);
		return c != null && c.charValue() == glyph;
	}
}
