package io.mdsistemas.invoicing.helper;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import io.mdsistemas.invoicing.vo.RawRow;

/**
 * Finds a logical field in rows whose headers vary between exports ("Resp. Fin", "Resp Fin", "Nome"...).
 */
@Component
public class ColumnResolver {

	/**
	 * First pass tries {@code exactCandidates} in order; second pass walks the row's own headers in column
	 * order and matches their normalized form against {@code fallbackKeys}. Only non-empty cells match.
	 */
	public Optional<Object> find(RawRow row, List<String> exactCandidates, Set<String> fallbackKeys) {
		for (String candidate : exactCandidates) {
			if (row.isPresent(candidate)) {
				return Optional.of(row.get(candidate));
			}
		}
		if (fallbackKeys.isEmpty()) {
			return Optional.empty();
		}
		for (String header : row.headers()) {
			if (fallbackKeys.contains(normalizeHeader(header)) && row.isPresent(header)) {
				return Optional.of(row.get(header));
			}
		}
		return Optional.empty();
	}

	public String resolveText(RawRow row, ColumnSpec spec) {
		return find(row, spec.exactCandidates(), spec.fallbackKeys())
				.map(CellValues::asText)
				.orElse(spec.placeholder());
	}

	static String normalizeHeader(String header) {
		return header.replace(".", "").replace(" ", "").toLowerCase(Locale.ROOT);
	}
}
