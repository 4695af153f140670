package io.mdsistemas.invoicing.helper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import io.mdsistemas.invoicing.exception.InvoiceProcessingException;
import io.mdsistemas.invoicing.exception.InvoicingExceptionMessage;
import io.mdsistemas.invoicing.vo.RawRow;

class TabularFileReaderTest {

	private final TabularFileReader reader = new TabularFileReader();

	@Test
	void read_utf8CommaCsv() {
		String csv = "\uFEFFResp. Fin,V. Devido,Data,Código\n"
				+ "Ana Souza,\"R$ 1.234,56\",10/02/2024,42\n"
				+ "\n"
				+ "\"Silva, João\",99.9,,\n";

		List<RawRow> rows = reader.read("cobranca.CSV", csv.getBytes(StandardCharsets.UTF_8));

		assertThat(rows).hasSize(2);
		assertThat(rows.get(0).headers()).containsExactly("Resp. Fin", "V. Devido", "Data", "Código");
		assertThat(rows.get(0).get("Resp. Fin")).isEqualTo("Ana Souza");
		assertThat(rows.get(0).get("V. Devido")).isEqualTo("R$ 1.234,56");
		assertThat(rows.get(0).get("Data")).isEqualTo("10/02/2024");
		assertThat(rows.get(0).get("Código")).isEqualTo(42.0);
		assertThat(rows.get(1).get("Resp. Fin")).isEqualTo("Silva, João");
		assertThat(rows.get(1).get("V. Devido")).isEqualTo(99.9);
		assertThat(rows.get(1).get("Data")).isNull();
	}

	@Test
	void read_latin1SemicolonCsvWhenUtf8Fails() {
		String csv = "Nome;V. Devido;Espécie\r\nJoão;10,5;Boleto\r\n";

		List<RawRow> rows = reader.read("cobranca.csv", csv.getBytes(StandardCharsets.ISO_8859_1));

		assertThat(rows).hasSize(1);
		assertThat(rows.get(0).get("Nome")).isEqualTo("João");
		assertThat(rows.get(0).get("V. Devido")).isEqualTo("10,5");
		assertThat(rows.get(0).get("Espécie")).isEqualTo("Boleto");
	}

	@Test
	void read_shortRowsPadWithEmptyCells() {
		String csv = "Nome,CPF,Origem\nAna\n";

		List<RawRow> rows = reader.read("a.csv", csv.getBytes(StandardCharsets.UTF_8));

		assertThat(rows).hasSize(1);
		assertThat(rows.get(0).headers()).contains("Origem");
		assertThat(rows.get(0).isPresent("Origem")).isFalse();
	}

	@Test
	void read_unterminatedQuoteIsUnreadable() {
		byte[] csv = "Nome,Valor\n\"Ana,10\n".getBytes(StandardCharsets.UTF_8);

		assertThatThrownBy(() -> reader.read("a.csv", csv))
				.isInstanceOf(InvoiceProcessingException.class)
				.extracting("reason")
				.isEqualTo(InvoicingExceptionMessage.FILE_UNREADABLE);
	}

	@Test
	void read_emptyCsvHasNoRows() {
		assertThat(reader.read("a.csv", new byte[0])).isEmpty();
		assertThat(reader.read("a.csv", "Nome,Valor\n".getBytes(StandardCharsets.UTF_8))).isEmpty();
	}

	@Test
	void read_xlsxFirstSheet() throws IOException {
		byte[] xlsx = workbook();

		List<RawRow> rows = reader.read("cobranca.xlsx", xlsx);

		assertThat(rows).hasSize(2);
		RawRow first = rows.get(0);
		assertThat(first.headers()).containsExactly("Nome", "V. Devido", "Data", "Nome.1", "Unnamed: 4", "Extra");
		assertThat(first.get("Nome")).isEqualTo("Ana Souza");
		assertThat(first.get("V. Devido")).isEqualTo(150.5);
		assertThat(first.get("Data")).isEqualTo(LocalDateTime.of(2024, 2, 10, 0, 0));
		assertThat(first.get("Nome.1")).isEqualTo("Apelido");
		assertThat(rows.get(1).get("Nome")).isEqualTo("Carlos");
		assertThat(rows.get(1).get("V. Devido")).isEqualTo("R$ 10,00");
		assertThat(rows.get(1).get("Data")).isNull();
	}

	@Test
	void read_nonWorkbookBytesAreUnreadable() {
		byte[] garbage = "isto não é uma planilha".getBytes(StandardCharsets.UTF_8);

		assertThatThrownBy(() -> reader.read("cobranca.xlsx", garbage))
				.isInstanceOf(InvoiceProcessingException.class)
				.hasMessageContaining("planilha");
	}

	@Test
	void uniqueHeaders_suffixesRepeats() {
		assertThat(TabularFileReader.uniqueHeaders(List.of("Valor", "Valor", " Nome ", "Valor")))
				.containsExactly("Valor", "Valor.1", "Nome", "Valor.2");
	}

	private static byte[] workbook() throws IOException {
		try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			Sheet sheet = wb.createSheet("Cobranças");
			CellStyle dateStyle = wb.createCellStyle();
			dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("dd/mm/yyyy"));

			// title rows above the header are left blank by some exports
			Row header = sheet.createRow(1);
			header.createCell(0).setCellValue("Nome");
			header.createCell(1).setCellValue("V. Devido");
			header.createCell(2).setCellValue("Data");
			header.createCell(3).setCellValue("Nome");
			header.createCell(5).setCellValue("Extra");

			Row first = sheet.createRow(2);
			first.createCell(0).setCellValue("Ana Souza");
			first.createCell(1).setCellValue(150.5);
			first.createCell(2).setCellValue(LocalDateTime.of(2024, 2, 10, 0, 0));
			first.getCell(2).setCellStyle(dateStyle);
			first.createCell(3).setCellValue("Apelido");

			sheet.createRow(3);

			Row second = sheet.createRow(4);
			second.createCell(0).setCellValue("Carlos");
			second.createCell(1).setCellValue("R$ 10,00");

			wb.write(out);
			return out.toByteArray();
		}
	}
}
