package asciigraf;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import asciigraf.constants.GeneralConstants;

/**
 * Reads the node and label tokens out of a diagram, row by row and left to right.
 */
public class TokenScanner {

	static Logger _LOG = Logger.getLogger(TokenScanner.class);

	private static final Pattern TOKEN = Pattern.compile(GeneralConstants.TOKEN_PATTERN.stringValue());

	public TokenScanner() {
	}

	/**
	 * @return every token in the diagram in row-major order of their root positions
	 */
	public List<Token> scan(String diagram) {
		ArrayList<Token> tokens = new ArrayList<Token>();
		String[] rows = splitRows(diagram);
		for (int row = 0; row < rows.length; row++) {
			Matcher m = TOKEN.matcher(rows[row]);
			while (m.find()) {
				tokens.add(new Token(m.group(), new Point(m.start(), row)));
			}
		}
		_LOG.debug("scanned " + tokens.size() + " tokens from " + rows.length + " rows");
		return tokens;
	}

	/**
	 * Splits on the row separator, keeping trailing empty rows so that row indices
	 * always match line numbers.
	 */
	static String[] splitRows(String diagram) {
		return diagram.split(Pattern.quote(GeneralConstants.ROW_SEPARATOR.stringValue()), -1);
	}
}
