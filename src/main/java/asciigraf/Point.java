package asciigraf;

/**
 * A cell on the character grid of a diagram. x is the column (grows to the right),
 * y is the row (grows downward).
 *
 * Points are ordered row-major: first by y, then by x. This is the order in which
 * the diagram is read and the order in which edge characters are traced.
 */
public final class Point implements Comparable<Point> {

	private final int x;
	private final int y;

	public Point(int x, int y) {
		this.x = x;
		this.y = y;
	}

	public int getX() {return this.x;}

	public int getY() {return this.y;}

	public Point add(Point other) {
		return new Point(this.x + other.x, this.y + other.y);
	}

	public Point subtract(Point other) {
		return new Point(this.x - other.x, this.y - other.y);
	}

	/**
	 * @return the point `dx` columns to the right and `dy` rows below this one
	 */
	public Point offset(int dx, int dy) {
		return new Point(this.x + dx, this.y + dy);
	}

	@Override
	public int compareTo(Point other) {
		if (this.y != other.y) {
			return Integer.compare(this.y, other.y);
		}
		return Integer.compare(this.x, other.x);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Point)) {
			return false;
		}
		Point other = (Point) o;
		return this.x == other.x && this.y == other.y;
	}

	@Override
	public int hashCode() {
		return 31 * this.x + this.y;
	}

	@Override
	public String toString() {
		return "(" + this.x + ", " + this.y + ")";
	}
}
