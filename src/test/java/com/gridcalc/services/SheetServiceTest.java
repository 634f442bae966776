package com.gridcalc.services;

import com.gridcalc.config.EngineProperties;
import com.gridcalc.exceptions.InvalidNameException;
import com.gridcalc.exceptions.InvalidReferenceException;
import com.gridcalc.exceptions.SheetNotFoundException;
import com.gridcalc.formula.functions.FunctionRegistry;
import com.gridcalc.models.CellDetails;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;
import com.gridcalc.models.ValueType;
import com.gridcalc.recalc.RecalcMode;
import com.gridcalc.recalc.RecalcStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SheetService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class SheetServiceTest {

    private SheetService sheetService;
    private long sheetId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);
        sheetService = new SheetService(new EngineProperties(), new FunctionRegistry(), clock, () -> new Random(42));
        sheetId = sheetService.createSheet();
    }

    /**
     * Literal numbers, labels and an arithmetic formula.
     */
    @Test
    void testSetLiteralValuesAndFormula() {
        sheetService.setCell(sheetId, "A1", "10");
        sheetService.setCell(sheetId, "B1", "20");
        sheetService.setCell(sheetId, "C1", "=A1+B1");
        sheetService.setCell(sheetId, "D1", "'123");

        Map<String, String> data = sheetService.getSheetData(sheetId);
        assertEquals("10", data.get("A1"));
        assertEquals("30", data.get("C1"));
        assertEquals("123", data.get("D1"));
        assertEquals(Arrays.asList("A1", "B1", "C1", "D1"), List.copyOf(data.keySet()));
    }

    /**
     * Partial re-eval: updating A1 refreshes C1 when C1 reads A1.
     */
    @Test
    void testDependentsFollowEdits() {
        sheetService.setCell(sheetId, "A1", "hi");
        sheetService.setCell(sheetId, "C1", "=A1");
        assertEquals("hi", sheetService.getSheetData(sheetId).get("C1"));

        sheetService.setCell(sheetId, "A1", "hello");
        assertEquals("hello", sheetService.getSheetData(sheetId).get("C1"));
    }

    /**
     * A cycle is not rejected; it shows as #CIRC! and is reported both ways.
     */
    @Test
    void testCycleIsReportedNotRejected() {
        sheetService.setCell(sheetId, "C1", "=A1");
        sheetService.setCell(sheetId, "A1", "=B1");
        sheetService.setCell(sheetId, "B1", "=C1");

        Map<String, String> data = sheetService.getSheetData(sheetId);
        assertEquals("#CIRC!", data.get("A1"));

        Map<String, List<String>> circular = sheetService.getCircularReferences(sheetId);
        assertEquals(Arrays.asList("A1", "B1", "C1"), circular.get("cycles"));
        assertFalse(circular.get("live").isEmpty());

        sheetService.setCell(sheetId, "B1", "5");
        assertEquals("5", sheetService.getSheetData(sheetId).get("A1"));
        assertTrue(sheetService.getCircularReferences(sheetId).get("cycles").isEmpty());
    }

    @Test
    void testCellDetails() {
        sheetService.setCell(sheetId, "A1", "4");
        sheetService.setCell(sheetId, "B2", "=A1*2.5");

        CellDetails details = sheetService.getCellDetails(sheetId, "b2");
        assertEquals("B2", details.getRef());
        assertEquals("=A1*2.5", details.getRawValue());
        assertEquals("A1*2.5", details.getFormula());
        assertEquals(ValueType.NUMBER, details.getType());
        assertEquals("10", details.getValue());
        assertEquals(Collections.singletonList("A1"), details.getDependencies());
        assertEquals(Collections.singletonList("B2"),
                sheetService.getCellDetails(sheetId, "A1").getDependents());
    }

    @Test
    void testFormatCodeChangesDisplayOnly() {
        sheetService.setCell(sheetId, "A1", "1234.5");
        sheetService.setRangeFormat(sheetId, "A1", "C2");

        assertEquals("$1,234.50", sheetService.getSheetData(sheetId).get("A1"));
        assertEquals("1234.5", sheetService.getCellDetails(sheetId, "A1").getValue());
    }

    @Test
    void testEvaluateDoesNotStore() {
        sheetService.setCell(sheetId, "A1", "3");
        Value value = sheetService.evaluate(sheetId, "=A1^2+1");
        assertEquals(Value.number(10), value);
        assertEquals(1, sheetService.getSheetData(sheetId).size());
    }

    @Test
    void testManualModeWaitsForRecalculate() {
        sheetService.setCell(sheetId, "A1", "1");
        sheetService.setCell(sheetId, "B1", "=A1+1");
        sheetService.setRecalcMode(sheetId, RecalcMode.MANUAL);

        sheetService.setCell(sheetId, "A1", "5");
        assertEquals("2", sheetService.getSheetData(sheetId).get("B1"));

        RecalcStats stats = sheetService.recalculate(sheetId, false);
        assertEquals(1, stats.getCellsEvaluated());
        assertEquals("6", sheetService.getSheetData(sheetId).get("B1"));
    }

    @Test
    void testInsertAndDeleteRows() {
        sheetService.setCell(sheetId, "A1", "1");
        sheetService.setCell(sheetId, "A2", "2");
        sheetService.setCell(sheetId, "B1", "=SUM(A1:A2)");

        sheetService.insertRow(sheetId, 1);
        assertEquals("=SUM(A1:A3)", sheetService.getCellDetails(sheetId, "B1").getRawValue());
        assertEquals("2", sheetService.getSheetData(sheetId).get("A3"));

        sheetService.deleteRow(sheetId, 0);
        Map<String, String> data = sheetService.getSheetData(sheetId);
        assertEquals("2", data.get("A2"));
        assertFalse(data.containsKey("B1"));
    }

    @Test
    void testCopyRangeAdjustsReferences() {
        sheetService.setCell(sheetId, "A1", "1");
        sheetService.setCell(sheetId, "A2", "2");
        sheetService.setCell(sheetId, "B1", "=A1*10");

        sheetService.copyRange(sheetId, "B1", "B2");
        assertEquals("=A2*10", sheetService.getCellDetails(sheetId, "B2").getRawValue());
        assertEquals("20", sheetService.getSheetData(sheetId).get("B2"));
    }

    @Test
    void testNamedRanges() {
        sheetService.setCell(sheetId, "A1", "1");
        sheetService.setCell(sheetId, "A2", "2");
        sheetService.setCell(sheetId, "B1", "=SUM(SALES)");
        assertEquals("#REF!", sheetService.getSheetData(sheetId).get("B1"));

        sheetService.defineName(sheetId, "sales", "A1:A2", null);
        assertEquals("3", sheetService.getSheetData(sheetId).get("B1"));
        assertEquals("A1:A2", sheetService.listNames(sheetId).get("SALES"));

        assertThrows(InvalidNameException.class, () -> sheetService.defineName(sheetId, "A1", "B1", null));
        assertTrue(sheetService.deleteName(sheetId, "SALES"));
        assertFalse(sheetService.deleteName(sheetId, "SALES"));
    }

    @Test
    void testDependencyListings() {
        sheetService.setCell(sheetId, "B1", "=C2");
        sheetService.setCell(sheetId, "A1", "=B1+C2");

        Map<String, List<String>> forward = sheetService.getForwardDependencies(sheetId);
        assertEquals(Arrays.asList("B1", "C2"), forward.get("A1"));
        assertEquals(Collections.singletonList("C2"), forward.get("B1"));

        Map<String, List<String>> reverse = sheetService.getReverseDependencies(sheetId);
        assertEquals(Arrays.asList("A1", "B1"), reverse.get("C2"));
        assertEquals(Collections.singletonList("A1"), reverse.get("B1"));
    }

    @Test
    void testBadRequests() {
        assertThrows(SheetNotFoundException.class, () -> sheetService.getSheet(999_999));
        assertThrows(InvalidReferenceException.class, () -> sheetService.setCell(sheetId, "A0", "1"));
        assertThrows(InvalidReferenceException.class, () -> sheetService.setCell(sheetId, "1A", "1"));
    }

    @Test
    void testFormulaErrorsAreValues() {
        sheetService.setCell(sheetId, "A1", "=1/0");
        sheetService.setCell(sheetId, "B1", "=A1*100");
        assertEquals(ErrorKind.DIV_ZERO.getText(), sheetService.getSheetData(sheetId).get("B1"));
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads set different cells simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        sheetService.setCell(sheetId, "C1", "=A1+B1");
        Runnable task1 = () -> {
            for (int i = 1; i <= 50; i++) {
                sheetService.setCell(sheetId, "A1", String.valueOf(i));
            }
        };
        Runnable task2 = () -> {
            for (int i = 1; i <= 50; i++) {
                sheetService.setCell(sheetId, "B1", String.valueOf(i * 2));
            }
        };

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Map<String, String> data = sheetService.getSheetData(sheetId);
        assertEquals("50", data.get("A1"));
        assertEquals("100", data.get("B1"));
        assertEquals("150", data.get("C1"));
    }
}
