package com.rambopet.clinic_backend.util;

import com.rambopet.clinic_backend.dto.response.InventoryValuation;
import com.rambopet.clinic_backend.exception.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.http.HttpStatus;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

@Slf4j
public class ReportGenerator {

    public static final String XLSX_CONTENT_TYPE =
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private ReportGenerator() {
        // Utility class, no instantiation
    }

    public static byte[] generateInventoryValuationExcel(InventoryValuation valuation) {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet("Inventory Valuation");

            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle currencyStyle = createCurrencyStyle(workbook);

            int rowNum = 0;
            Row titleRow = sheet.createRow(rowNum++);
            titleRow.createCell(0).setCellValue("Inventory valuation as of " + DateUtil.formatDate(valuation.getAsOf()));
            titleRow.getCell(0).setCellStyle(headerStyle);

            rowNum++; // Empty row

            Row headerRow = sheet.createRow(rowNum++);
            String[] headers = {"Code", "Product", "Stock", "Purchase price", "Value"};
            for (int i = 0; i < headers.length; i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(headers[i]);
                cell.setCellStyle(headerStyle);
            }

            for (InventoryValuation.Line line : valuation.getLines()) {
                Row row = sheet.createRow(rowNum++);
                row.createCell(0).setCellValue(line.getCode());
                row.createCell(1).setCellValue(line.getName());
                row.createCell(2).setCellValue(line.getTotalStock());
                row.createCell(3).setCellValue(line.getPurchasePrice().doubleValue());
                row.getCell(3).setCellStyle(currencyStyle);
                row.createCell(4).setCellValue(line.getValue().doubleValue());
                row.getCell(4).setCellStyle(currencyStyle);
            }

            rowNum++; // Empty row

            Row totalRow = sheet.createRow(rowNum);
            totalRow.createCell(3).setCellValue("Total:");
            totalRow.getCell(3).setCellStyle(headerStyle);
            totalRow.createCell(4).setCellValue(valuation.getTotalValue().doubleValue());
            totalRow.getCell(4).setCellStyle(currencyStyle);

            int[] widths = {14, 40, 10, 16, 16};
            for (int i = 0; i < widths.length; i++) {
                sheet.setColumnWidth(i, widths[i] * 256);
            }

            workbook.write(out);
            return out.toByteArray();

        } catch (IOException e) {
            log.error("Failed to generate inventory valuation workbook", e);
            throw new ApiException("Failed to generate report", HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    private static CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }

    private static CellStyle createCurrencyStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        DataFormat format = workbook.createDataFormat();
        style.setDataFormat(format.getFormat("#,##0.00"));
        return style;
    }
}
