package io.mdsistemas.invoicing.helper;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import io.mdsistemas.invoicing.util.ConstantUtility;

/**
 * Text form of loaded cell values.
 */
public final class CellValues {

	private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern(ConstantUtility.DISPLAY_DATE_PATTERN);

	private CellValues() {
	}

	public static String asText(Object value) {
		if (value == null) {
			return "";
		}
		if (value instanceof Double d) {
			// 12345.0 -> "12345", as the value appears in the sheet
			if (d == Math.rint(d) && !Double.isInfinite(d)) {
				return BigDecimal.valueOf(d).toBigInteger().toString();
			}
			return BigDecimal.valueOf(d).toPlainString();
		}
		if (value instanceof LocalDateTime dateTime) {
			return dateTime.format(DISPLAY_DATE);
		}
		if (value instanceof LocalDate date) {
			return date.format(DISPLAY_DATE);
		}
		return value.toString().strip();
	}
}
