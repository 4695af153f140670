package io.mdsistemas.invoicing.vo;

import io.mdsistemas.invoicing.util.DateMode;

/**
 * Request-level rule for deriving each row's emission date. {@code customDate} is only read in
 * {@link DateMode#CUSTOM}.
 */
public record DatePolicy(DateMode mode, String customDate) {

	public static DatePolicy current() {
		return new DatePolicy(DateMode.CURRENT, null);
	}

	public static DatePolicy saleDate() {
		return new DatePolicy(DateMode.SALE_DATE, null);
	}

	public static DatePolicy custom(String customDate) {
		return new DatePolicy(DateMode.CUSTOM, customDate);
	}

	public static DatePolicy fromRequest(String modeName, String customDate) {
		return new DatePolicy(DateMode.fromRequest(modeName), customDate);
	}

	public DatePolicy {
		if (mode == null) {
			mode = DateMode.CURRENT;
		}
	}
}
