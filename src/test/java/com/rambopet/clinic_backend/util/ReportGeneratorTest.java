package com.rambopet.clinic_backend.util;

import com.rambopet.clinic_backend.dto.response.InventoryValuation;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportGeneratorTest {

    @Test
    void valuationWorkbook_listsEachProductAndTheTotal() throws Exception {
        InventoryValuation valuation = InventoryValuation.builder()
                .asOf(LocalDate.of(2025, 3, 1))
                .totalValue(new BigDecimal("412.50"))
                .lines(List.of(
                        line("AMX-250", "Amoxicillin 250mg", 20, "12.50"),
                        line("MEL-15", "Meloxicam 1.5mg", 5, "32.50")))
                .build();

        byte[] bytes = ReportGenerator.generateInventoryValuationExcel(valuation);

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = workbook.getSheet("Inventory Valuation");
            assertNotNull(sheet);
            assertEquals("Inventory valuation as of 01/03/2025", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Code", sheet.getRow(2).getCell(0).getStringCellValue());
            assertEquals("AMX-250", sheet.getRow(3).getCell(0).getStringCellValue());
            assertEquals(250.0, sheet.getRow(3).getCell(4).getNumericCellValue(), 0.001);
            assertEquals("MEL-15", sheet.getRow(4).getCell(0).getStringCellValue());
            assertEquals(412.5, sheet.getRow(6).getCell(4).getNumericCellValue(), 0.001);
        }
    }

    private InventoryValuation.Line line(String code, String name, int stock, String price) {
        BigDecimal purchasePrice = new BigDecimal(price);
        return InventoryValuation.Line.builder()
                .code(code)
                .name(name)
                .totalStock(stock)
                .purchasePrice(purchasePrice)
                .value(purchasePrice.multiply(BigDecimal.valueOf(stock)))
                .build();
    }
}
