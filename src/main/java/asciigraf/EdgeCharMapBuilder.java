package asciigraf;

import java.util.Map;
import java.util.TreeMap;

import org.apache.log4j.Logger;

/**
 * Finds the line-drawing characters of a diagram.
 */
public class EdgeCharMapBuilder {

	static Logger _LOG = Logger.getLogger(EdgeCharMapBuilder.class);

	public static final char HORIZONTAL = '-';
	public static final char VERTICAL = '|';
	public static final char FORWARD_SLASH = '/';
	public static final char BACK_SLASH = '\\';

	public EdgeCharMapBuilder() {
	}

	public static boolean isEdgeChar(char c) {
		return c == HORIZONTAL || c == VERTICAL || c == FORWARD_SLASH || c == BACK_SLASH;
	}

	/**
	 * @return position -> glyph for every line character, sorted row-major
	 */
	public TreeMap<Point, Character> build(String diagram) {
		TreeMap<Point, Character> edgeChars = new TreeMap<Point, Character>();
		String[] rows = TokenScanner.splitRows(diagram);
		for (int row = 0; row < rows.length; row++) {
			String line = rows[row];
			for (int col = 0; col < line.length(); col++) {
				char c = line.charAt(col);
				if (isEdgeChar(c)) {
					edgeChars.put(new Point(col, row), c);
				}
			}
		}
		_LOG.debug("found " + edgeChars.size() + " edge characters");
		return edgeChars;
	}

	/**
	 * Expands every token over the cells it occupies.
	 *
	 * @return cell -> token for every character of every token in `tokens`
	 */
	public static Map<Point, Token> occupancy(Iterable<Token> tokens) {
		TreeMap<Point, Token> chars = new TreeMap<Point, Token>();
		for (Token t : tokens) {
			for (int i = 0; i < t.length(); i++) {
				chars.put(t.charPosition(i), t);
			}
		}
		return chars;
	}
}
