package io.mdsistemas.invoicing.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DateModeTest {

	@Test
	void fromRequest_mapsFormValues() {
		assertThat(DateMode.fromRequest("atual")).isEqualTo(DateMode.CURRENT);
		assertThat(DateMode.fromRequest("venda")).isEqualTo(DateMode.SALE_DATE);
		assertThat(DateMode.fromRequest(" Escolher ")).isEqualTo(DateMode.CUSTOM);
	}

	@Test
	void fromRequest_unknownOrMissingIsCurrent() {
		assertThat(DateMode.fromRequest(null)).isEqualTo(DateMode.CURRENT);
		assertThat(DateMode.fromRequest("")).isEqualTo(DateMode.CURRENT);
		assertThat(DateMode.fromRequest("amanha")).isEqualTo(DateMode.CURRENT);
	}
}
