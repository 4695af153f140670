package io.mdsistemas.invoicing.helper;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellAddress;
import org.apache.poi.ss.util.CellRangeAddress;

/**
 * A1-style cell writes on a POI sheet.
 */
final class SheetCells {

    private SheetCells() {
    }

    static Cell cell(Sheet s, String a1) {
        CellAddress address = new CellAddress(a1);
        Row r = s.getRow(address.getRow());
        if (r == null) r = s.createRow(address.getRow());
        Cell c = r.getCell(address.getColumn());
        return c != null ? c : r.createCell(address.getColumn());
    }

    static Cell text(Sheet s, String a1, String value, CellStyle st) {
        Cell c = cell(s, a1);
        c.setCellValue(value);
        if (st != null) c.setCellStyle(st);
        return c;
    }

    static Cell num(Sheet s, String a1, double value, CellStyle st) {
        Cell c = cell(s, a1);
        c.setCellValue(value);
        if (st != null) c.setCellStyle(st);
        return c;
    }

    static void merge(Sheet s, String range) {
        s.addMergedRegion(CellRangeAddress.valueOf(range));
    }
}
