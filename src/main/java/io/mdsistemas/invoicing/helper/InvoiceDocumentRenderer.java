package io.mdsistemas.invoicing.helper;

import static io.mdsistemas.invoicing.helper.SheetCells.merge;
import static io.mdsistemas.invoicing.helper.SheetCells.num;
import static io.mdsistemas.invoicing.helper.SheetCells.text;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import io.mdsistemas.invoicing.exception.InvoiceProcessingException;
import io.mdsistemas.invoicing.exception.InvoicingExceptionMessage;
import io.mdsistemas.invoicing.vo.InvoiceData;
import lombok.RequiredArgsConstructor;

/**
 * Lays out the one-sheet service invoice for a processed row and serializes it as XLSX.
 */
@Component
@RequiredArgsConstructor
public class InvoiceDocumentRenderer {

	private static final String[] PAYMENT_HEADERS = {"Descrição (Espécie)", "Vencimento", "Desconto", "Valor Total"};

	private static final String[] COLUMNS = {"A", "B", "C", "D"};

	private final DocumentStyles styles;

	public String renderBase64(InvoiceData invoice) {
		return Base64.getEncoder().encodeToString(render(invoice));
	}

	public byte[] render(InvoiceData invoice) {
		try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			Palette p = new Palette(wb, styles);
			XSSFSheet s = wb.createSheet(styles.sheetName());

			// banner
			merge(s, "A1:D2");
			text(s, "A1", styles.bannerTitle(), p.banner);

			text(s, "A4", "Número da Nota:", p.bold);
			num(s, "B4", invoice.getInvoiceNumber(), null);
			text(s, "C4", "Data Emissão:", p.bold);
			text(s, "D4", invoice.getEmissionDate(), null);

			merge(s, "A6:D6");
			text(s, "A6", "DADOS DO TOMADOR DE SERVIÇO", p.section);
			text(s, "A8", "Razão Social / Nome:", null);
			text(s, "B8", invoice.getCustomerName(), null);
			text(s, "A9", "CPF / CNPJ:", null);
			text(s, "B9", invoice.getTaxId(), null);
			text(s, "A10", "Origem:", null);
			text(s, "B10", invoice.getOrigin(), null);

			merge(s, "A12:D12");
			text(s, "A12", "DETALHES DO PAGAMENTO", p.section);
			for (int i = 0; i < PAYMENT_HEADERS.length; i++) {
				text(s, COLUMNS[i] + "14", PAYMENT_HEADERS[i], p.tableHeader);
			}

			text(s, "A15", invoice.getSpecies() + " - " + invoice.getTitle(), p.tableCell);
			text(s, "B15", invoice.getDueDate(), p.tableCell);
			num(s, "C15", invoice.getAmountDiscount(), p.tableMoney);
			num(s, "D15", invoice.getAmountDue(), p.tableMoney);

			text(s, "C17", "VALOR LÍQUIDO:", p.bold);
			num(s, "D17", invoice.getAmountDue() - invoice.getAmountDiscount(), p.total);

			List<Integer> widths = styles.columnWidths();
			for (int i = 0; i < widths.size(); i++) {
				s.setColumnWidth(i, widths.get(i) * 256);
			}

			wb.write(out);
			return out.toByteArray();
		} catch (IOException ex) {
			throw new InvoiceProcessingException(InvoicingExceptionMessage.DOCUMENT_RENDER_FAILED,
					"Falha ao gerar documento da nota " + invoice.getInvoiceNumber() + ": " + ex.getMessage(), ex);
		}
	}

	/**
	 * POI styles belong to a workbook, so each render builds its own set from the shared constants.
	 */
	private static final class Palette {

		final XSSFCellStyle banner;
		final XSSFCellStyle bold;
		final XSSFCellStyle section;
		final XSSFCellStyle tableHeader;
		final XSSFCellStyle tableCell;
		final XSSFCellStyle tableMoney;
		final XSSFCellStyle total;

		Palette(XSSFWorkbook wb, DocumentStyles styles) {
			XSSFColor accent = new XSSFColor(HexFormat.of().parseHex(styles.accentColorHex()), null);
			XSSFColor white = new XSSFColor(new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF}, null);
			short money = wb.createDataFormat().getFormat(styles.currencyFormat());

			XSSFFont bannerFont = wb.createFont();
			bannerFont.setBold(true);
			bannerFont.setFontHeightInPoints(styles.bannerFontSize());
			bannerFont.setColor(white);
			banner = wb.createCellStyle();
			banner.setFont(bannerFont);
			banner.setFillForegroundColor(accent);
			banner.setFillPattern(FillPatternType.SOLID_FOREGROUND);
			banner.setAlignment(HorizontalAlignment.CENTER);
			banner.setVerticalAlignment(VerticalAlignment.CENTER);

			XSSFFont boldFont = wb.createFont();
			boldFont.setBold(true);
			bold = wb.createCellStyle();
			bold.setFont(boldFont);

			XSSFFont sectionFont = wb.createFont();
			sectionFont.setBold(true);
			sectionFont.setColor(accent);
			section = wb.createCellStyle();
			section.setFont(sectionFont);
			section.setBorderBottom(BorderStyle.THICK);
			section.setBottomBorderColor(accent);

			tableHeader = wb.createCellStyle();
			tableHeader.setFont(boldFont);
			thinBorder(tableHeader);
			tableHeader.setAlignment(HorizontalAlignment.CENTER);
			tableHeader.setVerticalAlignment(VerticalAlignment.CENTER);

			tableCell = wb.createCellStyle();
			thinBorder(tableCell);
			tableCell.setAlignment(HorizontalAlignment.CENTER);

			tableMoney = wb.createCellStyle();
			tableMoney.cloneStyleFrom(tableCell);
			tableMoney.setDataFormat(money);

			XSSFFont totalFont = wb.createFont();
			totalFont.setBold(true);
			totalFont.setFontHeightInPoints(styles.totalFontSize());
			total = wb.createCellStyle();
			total.setFont(totalFont);
			total.setDataFormat(money);
		}

		private static void thinBorder(XSSFCellStyle st) {
			st.setBorderTop(BorderStyle.THIN);
			st.setBorderBottom(BorderStyle.THIN);
			st.setBorderLeft(BorderStyle.THIN);
			st.setBorderRight(BorderStyle.THIN);
		}
	}
}
