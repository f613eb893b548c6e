package asciigraf;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * Redraws a handful of diagram cells as text. Used to show the part of a drawing
 * that could not be traced.
 *
 * Cells are drawn at their original coordinates (the output starts at row 0, column 0),
 * so a rendered snippet can be parsed again and points at the same positions.
 */
public final class DiagramRenderer {

	private DiagramRenderer() {
	}

	public static String render(Map<Point, Character> chars) {
		return render(chars, null);
	}

	/**
	 * @param chars position -> line character
	 * @param nodeChars position -> node name, may be null. Each name is drawn once, starting
	 *		at the smallest position given for it.
	 */
	public static String render(Map<Point, Character> chars, Map<Point, String> nodeChars) {
		HashMap<String, Point> nodeStarts = new HashMap<String, Point>();
		if (nodeChars != null) {
			for (Map.Entry<Point, String> e : nodeChars.entrySet()) {
				Point start = nodeStarts.get(e.getValue());
				if (start == null || e.getKey().compareTo(start) < 0) {
					nodeStarts.put(e.getValue(), e.getKey());
				}
			}
		}

		ArrayList<Map.Entry<Point, String>> cells = new ArrayList<Map.Entry<Point, String>>();
		for (Map.Entry<String, Point> e : nodeStarts.entrySet()) {
			cells.add(new AbstractMap.SimpleImmutableEntry<Point, String>(e.getValue(), e.getKey()));
		}
		for (Map.Entry<Point, Character> e : chars.entrySet()) {
			cells.add(new AbstractMap.SimpleImmutableEntry<Point, String>(e.getKey(), String.valueOf(e.getValue())));
		}
		Collections.sort(cells, new Comparator<Map.Entry<Point, String>>() {
			@Override
			public int compare(Map.Entry<Point, String> a, Map.Entry<Point, String> b) {
				return a.getKey().compareTo(b.getKey());
			}
		});

		StringBuilder sb = new StringBuilder();
		int cursorX = 0;
		int cursorY = 0;
		for (Map.Entry<Point, String> cell : cells) {
			Point pos = cell.getKey();
			if (cursorY < pos.getY()) {
				sb.append(StringUtils.repeat('\n', pos.getY() - cursorY));
				cursorY = pos.getY();
				cursorX = 0;
			}
			if (cursorX < pos.getX()) {
				sb.append(StringUtils.repeat(' ', pos.getX() - cursorX));
				cursorX = pos.getX();
			}
			sb.append(cell.getValue());
			cursorX += cell.getValue().length();
		}
		return sb.toString();
	}
}
