package asciigraf.constants;

import asciigraf.Point;

/**
 * Node properties emitted for every node found in a diagram.
 */
public enum NodeProperty {

	POSITION ("position", Point.class, "The grid position of the first character of the node's name.");

	public final String propertyName;
	public final Class<?> type;
	public final String description;

	NodeProperty(String propertyName, Class<?> T, String description) {
		this.propertyName = propertyName;
		this.type = T;
		this.description = description;
	}
}
