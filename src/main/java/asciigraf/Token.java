package asciigraf;

import asciigraf.constants.GeneralConstants;

/**
 * A run of name characters found on one row of a diagram. Runs wrapped in parentheses
 * are labels for the line they sit on; all other runs name a node.
 */
public final class Token {

	public enum Kind {
		NODE,
		LABEL
	}

	private final String text;
	private final Point root;
	private final Kind kind;

	public Token(String text, Point root) {
		this.text = text;
		this.root = root;
		this.kind = isLabelText(text) ? Kind.LABEL : Kind.NODE;
	}

	private static boolean isLabelText(String text) {
		return text.length() >= 2
				&& text.charAt(0) == GeneralConstants.LABEL_OPEN.charValue()
				&& text.charAt(text.length() - 1) == GeneralConstants.LABEL_CLOSE.charValue();
	}

	/**
	 * @return the literal text as drawn, including parentheses for labels
	 */
	public String getText() {return this.text;}

	/**
	 * @return the position of the first (leftmost) character
	 */
	public Point getRoot() {return this.root;}

	public Kind getKind() {return this.kind;}

	public boolean isLabel() {return this.kind == Kind.LABEL;}

	public boolean isNode() {return this.kind == Kind.NODE;}

	/**
	 * @return the label text without its parentheses, or the node name for nodes
	 */
	public String getContent() {
		if (this.isLabel()) {
			return this.text.substring(1, this.text.length() - 1);
		}
		return this.text;
	}

	/**
	 * @return the position of the i-th character of this token
	 */
	public Point charPosition(int i) {
		return this.root.offset(i, 0);
	}

	public int length() {return this.text.length();}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return this.text.equals(other.text) && this.root.equals(other.root);
	}

	@Override
	public int hashCode() {
		return 31 * this.text.hashCode() + this.root.hashCode();
	}

	@Override
	public String toString() {
		return this.kind + " '" + this.text + "' at " + this.root;
	}
}
