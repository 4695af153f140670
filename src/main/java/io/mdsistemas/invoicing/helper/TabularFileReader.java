package io.mdsistemas.invoicing.helper;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import io.mdsistemas.invoicing.exception.InvoiceProcessingException;
import io.mdsistemas.invoicing.exception.InvoicingExceptionMessage;
import io.mdsistemas.invoicing.vo.RawRow;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads an uploaded billing sheet into rows. {@code .csv} files are read as UTF-8 with {@code ,} and, when
 * that fails, as Latin-1 with {@code ;}; anything else is opened as an Excel workbook (first sheet).
 */
@Component
@Slf4j
public class TabularFileReader {

	private static final Pattern PLAIN_NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?");

	public List<RawRow> read(String filename, byte[] content) {
		if (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
			return readCsv(content);
		}
		return readWorkbook(content);
	}

	// ---------- csv ----------

	List<RawRow> readCsv(byte[] content) {
		try {
			return parseCsv(decodeStrict(content, StandardCharsets.UTF_8), ',');
		} catch (CharacterCodingException | MalformedCsvException ex) {
			log.info("CSV is not UTF-8 with ',' ({}), retrying as Latin-1 with ';'", ex.getMessage());
		}
		try {
			return parseCsv(new String(content, StandardCharsets.ISO_8859_1), ';');
		} catch (MalformedCsvException ex) {
			throw new InvoiceProcessingException(InvoicingExceptionMessage.FILE_UNREADABLE,
					"Não foi possível ler o arquivo CSV: " + ex.getMessage(), ex);
		}
	}

	private static String decodeStrict(byte[] content, Charset charset) throws CharacterCodingException {
		return charset.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(content))
				.toString();
	}

	private static List<RawRow> parseCsv(String text, char delimiter) throws MalformedCsvException {
		if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
			text = text.substring(1);
		}
		List<List<String>> records = splitRecords(text, delimiter);
		List<RawRow> rows = new ArrayList<>();
		if (records.isEmpty()) {
			return rows;
		}
		List<String> headers = uniqueHeaders(records.get(0));
		for (int r = 1; r < records.size(); r++) {
			List<String> fields = records.get(r);
			if (fields.size() > headers.size()) {
				throw new MalformedCsvException("line " + (r + 1) + " has " + fields.size() + " fields, expected "
						+ headers.size());
			}
			Map<String, Object> cells = new LinkedHashMap<>();
			for (int c = 0; c < headers.size(); c++) {
				cells.put(headers.get(c), c < fields.size() ? csvValue(fields.get(c)) : null);
			}
			rows.add(new RawRow(cells));
		}
		return rows;
	}

	/**
	 * RFC 4180 style split: quoted fields may hold the delimiter, line breaks and doubled quotes. Blank lines
	 * are dropped.
	 */
	private static List<List<String>> splitRecords(String text, char delimiter) throws MalformedCsvException {
		List<List<String>> records = new ArrayList<>();
		List<String> fields = new ArrayList<>();
		StringBuilder field = new StringBuilder();
		boolean quoted = false;
		boolean lineHasContent = false;
		int i = 0;
		while (i < text.length()) {
			char ch = text.charAt(i);
			if (quoted) {
				if (ch == '"') {
					if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
						field.append('"');
						i++;
					} else {
						quoted = false;
					}
				} else {
					field.append(ch);
				}
			} else if (ch == '"') {
				quoted = true;
				lineHasContent = true;
			} else if (ch == delimiter) {
				fields.add(field.toString());
				field.setLength(0);
				lineHasContent = true;
			} else if (ch == '\r' || ch == '\n') {
				if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
					i++;
				}
				if (lineHasContent || field.length() > 0) {
					fields.add(field.toString());
					records.add(fields);
				}
				fields = new ArrayList<>();
				field.setLength(0);
				lineHasContent = false;
			} else {
				field.append(ch);
			}
			i++;
		}
		if (quoted) {
			throw new MalformedCsvException("unterminated quoted field");
		}
		if (lineHasContent || field.length() > 0) {
			fields.add(field.toString());
			records.add(fields);
		}
		return records;
	}

	private static Object csvValue(String field) {
		String trimmed = field.strip();
		if (trimmed.isEmpty()) {
			return null;
		}
		if (PLAIN_NUMBER.matcher(trimmed).matches()) {
			return Double.valueOf(trimmed);
		}
		return field;
	}

	// ---------- workbook ----------

	List<RawRow> readWorkbook(byte[] content) {
		try (Workbook wb = WorkbookFactory.create(new ByteArrayInputStream(content))) {
			if (wb.getNumberOfSheets() == 0) {
				return List.of();
			}
			return readSheet(wb.getSheetAt(0));
		} catch (IOException | RuntimeException ex) {
			throw new InvoiceProcessingException(InvoicingExceptionMessage.FILE_UNREADABLE,
					"Não foi possível ler a planilha: " + ex.getMessage(), ex);
		}
	}

	private static List<RawRow> readSheet(Sheet sheet) {
		List<RawRow> rows = new ArrayList<>();
		int headerRowIdx = -1;
		for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum() && r >= 0; r++) {
			if (!isBlankRow(sheet.getRow(r))) {
				headerRowIdx = r;
				break;
			}
		}
		if (headerRowIdx < 0) {
			return rows;
		}

		Row headerRow = sheet.getRow(headerRowIdx);
		List<String> rawHeaders = new ArrayList<>();
		for (int c = 0; c < headerRow.getLastCellNum(); c++) {
			Object v = cellValue(headerRow.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
			rawHeaders.add(v == null ? "Unnamed: " + c : CellValues.asText(v));
		}
		List<String> headers = uniqueHeaders(rawHeaders);

		for (int r = headerRowIdx + 1; r <= sheet.getLastRowNum(); r++) {
			Row row = sheet.getRow(r);
			if (isBlankRow(row)) continue;
			Map<String, Object> cells = new LinkedHashMap<>();
			for (int c = 0; c < headers.size(); c++) {
				cells.put(headers.get(c), cellValue(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL)));
			}
			rows.add(new RawRow(cells));
		}
		return rows;
	}

	private static boolean isBlankRow(Row row) {
		if (row == null) return true;
		for (Cell c : row) {
			if (cellValue(c) != null) return false;
		}
		return true;
	}

	private static Object cellValue(Cell c) {
		if (c == null) return null;
		CellType type = c.getCellType() == CellType.FORMULA ? c.getCachedFormulaResultType() : c.getCellType();
		return switch (type) {
			case STRING -> {
				String s = c.getStringCellValue();
				yield s.isBlank() ? null : s;
			}
			case NUMERIC -> DateUtil.isCellDateFormatted(c)
					? c.getLocalDateTimeCellValue()
					: Double.valueOf(c.getNumericCellValue());
			case BOOLEAN -> c.getBooleanCellValue();
			default -> null;
		};
	}

	// ---------- shared ----------

	/**
	 * Trims header names and suffixes repeats with {@code .1}, {@code .2}...
	 */
	static List<String> uniqueHeaders(List<String> raw) {
		List<String> headers = new ArrayList<>(raw.size());
		Map<String, Integer> seen = new HashMap<>();
		for (String h : raw) {
			String name = h.strip();
			Integer count = seen.get(name);
			if (count == null) {
				seen.put(name, 0);
				headers.add(name);
			} else {
				String renamed;
				do {
					count++;
					renamed = name + "." + count;
				} while (seen.containsKey(renamed));
				seen.put(name, count);
				seen.put(renamed, 0);
				headers.add(renamed);
			}
		}
		return headers;
	}

	static final class MalformedCsvException extends Exception {

		private static final long serialVersionUID = 1L;

		MalformedCsvException(String message) {
			super(message);
		}
	}
}
