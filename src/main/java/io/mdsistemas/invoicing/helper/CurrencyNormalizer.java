package io.mdsistemas.invoicing.helper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Brazilian real amounts: {@code "R$ 1.234,56"} and spreadsheet numbers in, {@code double} out, and back to
 * the display form.
 */
@Component
public class CurrencyNormalizer {

	private static final String CURRENCY_SYMBOL = "R$";

	private static final String DISPLAY_PREFIX = "R$ ";

	// includes the no-break spaces written by pt-BR number formatters
	private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u202F]");

	/**
	 * Parses a cell value. Numbers pass through; text has the currency symbol and all whitespace removed, {@code .}
	 * dropped as thousands separator and {@code ,} read as the decimal separator.
	 *
	 * @return the amount, or empty when the value is absent or not a number
	 */
	public Optional<Double> tryParse(Object value) {
		if (value == null) {
			return Optional.empty();
		}
		if (value instanceof Number number) {
			double d = number.doubleValue();
			return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
		}
		String text = WHITESPACE.matcher(value.toString().replace(CURRENCY_SYMBOL, "")).replaceAll("")
				.replace(".", "")
				.replace(",", ".");
		if (text.isEmpty()) {
			return Optional.empty();
		}
		try {
			double d = new BigDecimal(text).doubleValue();
			return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
		} catch (NumberFormatException ex) {
			return Optional.empty();
		}
	}

	public double normalize(Object value) {
		return tryParse(value).orElse(0.0);
	}

	public String format(double value) {
		BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
		return DISPLAY_PREFIX + displayFormat().format(rounded);
	}

	private static DecimalFormat displayFormat() {
		DecimalFormatSymbols symbols = new DecimalFormatSymbols();
		symbols.setGroupingSeparator('.');
		symbols.setDecimalSeparator(',');
		symbols.setMinusSign('-');
		DecimalFormat format = new DecimalFormat("#,##0.00", symbols);
		format.setRoundingMode(RoundingMode.HALF_UP);
		return format;
	}
}
