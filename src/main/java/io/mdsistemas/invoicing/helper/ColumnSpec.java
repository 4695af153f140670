package io.mdsistemas.invoicing.helper;

import java.util.List;
import java.util.Set;

/**
 * Where to look for one logical field: header variants in priority order, normalized keys for the
 * fallback pass, and the value used when neither matches.
 */
public record ColumnSpec(List<String> exactCandidates, Set<String> fallbackKeys, String placeholder) {

	public ColumnSpec {
		exactCandidates = List.copyOf(exactCandidates);
		fallbackKeys = Set.copyOf(fallbackKeys);
	}

	public static ColumnSpec exact(String placeholder, String... candidates) {
		return new ColumnSpec(List.of(candidates), Set.of(), placeholder);
	}
}
