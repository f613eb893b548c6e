package asciigraf.constants;

/**
 * Fixed values describing how a diagram is read. Like the property enums in this package,
 * the data objects are stored in `value` and their type is given by `type`.
 */
public enum GeneralConstants {

	/** A run of name characters, optionally wrapped in parentheses (which makes it a label). */
	TOKEN_PATTERN (String.class, "\\(?[0-9A-Za-z_{}]+\\)?"),

	/** Rows of a diagram are separated by this. A trailing '\r' is left on the row and is inert. */
	ROW_SEPARATOR (String.class, "\n"),

	LABEL_OPEN (Character.class, '('),
	LABEL_CLOSE (Character.class, ')');

	public final Class<?> type;
	public final Object value;

	GeneralConstants(Class<?> type, Object value) {
		this.type = type;
		this.value = value;
	}

	public String stringValue() {
		return String.valueOf(this.value);
	}

	public char charValue() {
		return (Character) this.value;
	}
}
