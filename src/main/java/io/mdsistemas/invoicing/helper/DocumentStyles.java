package io.mdsistemas.invoicing.helper;

import java.util.List;

/**
 * Fixed look of the invoice sheet. Immutable; the renderer turns it into POI styles per workbook.
 *
 * @param bannerTitle    text of the merged banner at A1:D2
 * @param accentColorHex RGB hex of banner fill, section titles and section underline
 * @param columnWidths   widths of columns A..D, in characters
 */
public record DocumentStyles(String sheetName, String bannerTitle, String accentColorHex, short bannerFontSize,
		short totalFontSize, String currencyFormat, List<Integer> columnWidths) {

	public static final String DEFAULT_BANNER_TITLE = "MD SISTEMAS - NOTA FISCAL DE SERVIÇO";

	public DocumentStyles {
		columnWidths = List.copyOf(columnWidths);
	}

	public static DocumentStyles defaults() {
		return withBannerTitle(DEFAULT_BANNER_TITLE);
	}

	public static DocumentStyles withBannerTitle(String bannerTitle) {
		return new DocumentStyles("Nota Fiscal", bannerTitle, "2C5282", (short) 14, (short) 12, "R$ #,##0.00",
				List.of(30, 25, 20, 20));
	}
}
