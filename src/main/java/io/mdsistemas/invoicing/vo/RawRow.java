package io.mdsistemas.invoicing.vo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One source spreadsheet row: header to cell value, in column order. Cells are {@link String},
 * {@link Double}, {@link Boolean}, {@link java.time.LocalDateTime} or absent.
 */
public final class RawRow {

	private final Map<String, Object> cells;

	public RawRow(Map<String, Object> cells) {
		this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
	}

	public static RawRow of(Object... headerValuePairs) {
		if (headerValuePairs.length % 2 != 0) {
			throw new IllegalArgumentException("header/value pairs expected");
		}
		Map<String, Object> cells = new LinkedHashMap<>();
		for (int i = 0; i < headerValuePairs.length; i += 2) {
			cells.put((String) headerValuePairs[i], headerValuePairs[i + 1]);
		}
		return new RawRow(cells);
	}

	public Object get(String header) {
		return cells.get(header);
	}

	/**
	 * True when the column exists and its cell carries a value (blank text counts as empty).
	 */
	public boolean isPresent(String header) {
		return isPresentValue(cells.get(header));
	}

	public List<String> headers() {
		return List.copyOf(cells.keySet());
	}

	public static boolean isPresentValue(Object value) {
		if (value == null) {
			return false;
		}
		if (value instanceof String s) {
			return !s.isBlank();
		}
		if (value instanceof Double d) {
			return !d.isNaN();
		}
		return true;
	}

	@Override
	public String toString() {
		return "RawRow" + cells;
	}
}
