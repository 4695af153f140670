package io.mdsistemas.invoicing.helper;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import io.mdsistemas.invoicing.util.ConstantUtility;
import io.mdsistemas.invoicing.vo.DatePolicy;
import io.mdsistemas.invoicing.vo.RawRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@Slf4j
@RequiredArgsConstructor
public class EmissionDateResolver {

	private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern(ConstantUtility.DISPLAY_DATE_PATTERN);

	private static final DateTimeFormatter CUSTOM_DATE = DateTimeFormatter.ofPattern("uuuu-M-d")
			.withResolverStyle(ResolverStyle.STRICT);

	private final Clock clock;

	/**
	 * Emission date for one row, {@code dd/MM/yyyy} unless a sale date column holds free text, which is kept
	 * as written. Unusable custom or sale dates fall back to today.
	 */
	public String resolve(DatePolicy policy, RawRow row) {
		return switch (policy.mode()) {
			case CURRENT -> today();
			case CUSTOM -> tryParseCustomDate(policy.customDate()).map(DISPLAY_DATE::format).orElseGet(this::today);
			case SALE_DATE -> saleDate(row).orElseGet(this::today);
		};
	}

	public String today() {
		return LocalDate.now(clock).format(DISPLAY_DATE);
	}

	public Optional<LocalDate> tryParseCustomDate(String customDate) {
		if (StringUtils.isBlank(customDate)) {
			return Optional.empty();
		}
		try {
			return Optional.of(LocalDate.parse(customDate.trim(), CUSTOM_DATE));
		} catch (DateTimeParseException ex) {
			log.debug("Ignoring unparseable custom date '{}'", customDate);
			return Optional.empty();
		}
	}

	private Optional<String> saleDate(RawRow row) {
		if (!row.isPresent(ConstantUtility.SALE_DATE_COLUMN)) {
			return Optional.empty();
		}
		Object raw = row.get(ConstantUtility.SALE_DATE_COLUMN);
		if (raw instanceof LocalDateTime dateTime) {
			return Optional.of(dateTime.format(DISPLAY_DATE));
		}
		if (raw instanceof LocalDate date) {
			return Optional.of(date.format(DISPLAY_DATE));
		}
		return Optional.of(CellValues.asText(raw));
	}
}
