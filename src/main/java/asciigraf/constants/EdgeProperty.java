package asciigraf.constants;

/**
 * Edge properties emitted for every line traced in a diagram. Not every edge carries
 * every property: LABEL is only present when a label sits on the line.
 */
public enum EdgeProperty {

	/** The number of line characters (label cells included) between the two nodes. */
	LENGTH ("length", Integer.class),

	/** The text of the label drawn on the line, without its parentheses. */
	LABEL ("label", String.class);

	public final String propertyName;
	public final Class<?> type;

	EdgeProperty(String propertyName, Class<?> T) {
		this.propertyName = propertyName;
		this.type = T;
	}
}
