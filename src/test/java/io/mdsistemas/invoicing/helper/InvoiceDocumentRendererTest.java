package io.mdsistemas.invoicing.helper;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import io.mdsistemas.invoicing.vo.InvoiceData;

class InvoiceDocumentRendererTest {

	private final InvoiceDocumentRenderer renderer = new InvoiceDocumentRenderer(DocumentStyles.defaults());

	private static InvoiceData sampleInvoice() {
		return InvoiceData.builder()
				.sequenceIndex(7)
				.customerName("Ana Souza")
				.taxId("123.456.789-00")
				.origin("Loja Centro")
				.title("Mensalidade")
				.species("Boleto")
				.amountDue(150.0)
				.amountDiscount(20.0)
				.emissionDate("15/03/2024")
				.dueDate("10/04/2024")
				.build();
	}

	@Test
	void render_laysOutInvoiceSheet() throws IOException {
		try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(renderer.render(sampleInvoice())))) {
			Sheet sheet = wb.getSheet("Nota Fiscal");

			assertThat(sheet).isNotNull();
			assertThat(text(sheet, "A1")).isEqualTo("MD SISTEMAS - NOTA FISCAL DE SERVIÇO");
			assertThat(number(sheet, "B4")).isEqualTo(1007.0);
			assertThat(text(sheet, "D4")).isEqualTo("15/03/2024");
			assertThat(text(sheet, "B8")).isEqualTo("Ana Souza");
			assertThat(text(sheet, "B9")).isEqualTo("123.456.789-00");
			assertThat(text(sheet, "B10")).isEqualTo("Loja Centro");
			assertThat(text(sheet, "A14")).isEqualTo("Descrição (Espécie)");
			assertThat(text(sheet, "D14")).isEqualTo("Valor Total");
			assertThat(text(sheet, "A15")).isEqualTo("Boleto - Mensalidade");
			assertThat(text(sheet, "B15")).isEqualTo("10/04/2024");
			assertThat(number(sheet, "C15")).isEqualTo(20.0);
			assertThat(number(sheet, "D15")).isEqualTo(150.0);
			assertThat(number(sheet, "D17")).isEqualTo(130.0);
			assertThat(sheet.getNumMergedRegions()).isEqualTo(3);
			assertThat(sheet.getColumnWidth(0)).isEqualTo(30 * 256);
		}
	}

	@Test
	void render_appliesCurrencyFormatToAmounts() throws IOException {
		try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(renderer.render(sampleInvoice())))) {
			Sheet sheet = wb.getSheetAt(0);

			assertThat(cell(sheet, "D15").getCellStyle().getDataFormatString()).isEqualTo("R$ #,##0.00");
			assertThat(cell(sheet, "D17").getCellStyle().getDataFormatString()).isEqualTo("R$ #,##0.00");
		}
	}

	@Test
	void render_usesConfiguredBannerTitle() throws IOException {
		InvoiceDocumentRenderer custom = new InvoiceDocumentRenderer(DocumentStyles.withBannerTitle("LOJA TESTE"));
		byte[] bytes = Base64.getDecoder().decode(custom.renderBase64(sampleInvoice()));

		try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
			assertThat(text(wb.getSheetAt(0), "A1")).isEqualTo("LOJA TESTE");
		}
	}

	private static org.apache.poi.ss.usermodel.Cell cell(Sheet sheet, String a1) {
		CellReference ref = new CellReference(a1);
		return sheet.getRow(ref.getRow()).getCell(ref.getCol());
	}

	private static String text(Sheet sheet, String a1) {
		return cell(sheet, a1).getStringCellValue();
	}

	private static double number(Sheet sheet, String a1) {
		return cell(sheet, a1).getNumericCellValue();
	}
}
