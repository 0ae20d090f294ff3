package com.spreadsheet.reactive.services;

import com.spreadsheet.reactive.config.SpreadsheetProperties;
import com.spreadsheet.reactive.engine.CellSnapshot;
import com.spreadsheet.reactive.engine.PropagationEngine;
import com.spreadsheet.reactive.engine.RecalculationResult;
import com.spreadsheet.reactive.exceptions.SheetNotFoundException;
import com.spreadsheet.reactive.models.CellAddress;
import com.spreadsheet.reactive.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Hosts sheets in memory and serializes access to each of them.
 * The sheets themselves are unsynchronized, so every call goes through the sheet's lock here.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; nothing is persisted
    private final Map<Long, HostedSheet> sheets = new ConcurrentHashMap<>();

    private final PropagationEngine engine;
    private final SpreadsheetProperties properties;

    public SheetService(PropagationEngine engine, SpreadsheetProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * Creates a new Sheet and returns its ID. Null dimensions fall back to the configured defaults;
     * columns beyond 26 are dropped. More rows than spreadsheet.max-rows is an IllegalArgumentException.
     */
    public long createSheet(Integer rows, Integer columns) {
        int r = rows != null ? rows : properties.getDefaultRows();
        int c = columns != null ? columns : properties.getDefaultColumns();
        if (r > properties.getMaxRows()) {
            throw new IllegalArgumentException(
                    "Sheet may have at most " + properties.getMaxRows() + " rows, got " + r);
        }
        Sheet sheet = new Sheet(r, c);
        sheets.put(sheet.getId(), new HostedSheet(sheet));
        logger.info("Created sheet {} with {} rows and {} columns", sheet.getId(), sheet.getRows(), sheet.getColumns());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        return host(sheetId).sheet;
    }

    public RecalculationResult setCellValue(long sheetId, String cellId, String rawValue) {
        HostedSheet hosted = host(sheetId);
        hosted.lock.writeLock().lock();
        try {
            return engine.setCellValue(hosted.sheet, cellId, rawValue);
        } finally {
            hosted.lock.writeLock().unlock();
        }
    }

    public int getCellValue(long sheetId, String cellId) {
        HostedSheet hosted = host(sheetId);
        hosted.lock.readLock().lock();
        try {
            return engine.getCellValue(hosted.sheet, cellId);
        } finally {
            hosted.lock.readLock().unlock();
        }
    }

    public CellSnapshot describeCell(long sheetId, String cellId) {
        HostedSheet hosted = host(sheetId);
        hosted.lock.readLock().lock();
        try {
            return engine.describeCell(hosted.sheet, cellId);
        } finally {
            hosted.lock.readLock().unlock();
        }
    }

    /**
     * Returns cellId -> value for every cell, row by row ("A1", "B1", ..., "A2", ...).
     */
    public Map<String, Integer> getSheetData(long sheetId) {
        HostedSheet hosted = host(sheetId);
        hosted.lock.readLock().lock();
        try {
            Sheet sheet = hosted.sheet;
            Map<String, Integer> data = new LinkedHashMap<>();
            for (int r = 0; r < sheet.getRows(); r++) {
                for (int c = 0; c < sheet.getColumns(); c++) {
                    CellAddress address = new CellAddress(r, c);
                    data.put(address.toString(), sheet.getCell(address).getValue());
                }
            }
            return data;
        } finally {
            hosted.lock.readLock().unlock();
        }
    }

    /**
     * Returns cellId -> direct dependents, only for cells that have any.
     */
    public Map<String, List<String>> getDependents(long sheetId) {
        HostedSheet hosted = host(sheetId);
        hosted.lock.readLock().lock();
        try {
            Sheet sheet = hosted.sheet;
            Map<String, List<String>> graph = new TreeMap<>();
            for (int r = 0; r < sheet.getRows(); r++) {
                for (int c = 0; c < sheet.getColumns(); c++) {
                    CellAddress address = new CellAddress(r, c);
                    Set<CellAddress> dependents = sheet.getCell(address).getDependents();
                    if (!dependents.isEmpty()) {
                        graph.put(address.toString(), dependents.stream()
                                .sorted()
                                .map(CellAddress::toString)
                                .collect(Collectors.toCollection(ArrayList::new)));
                    }
                }
            }
            return graph;
        } finally {
            hosted.lock.readLock().unlock();
        }
    }

    private HostedSheet host(long sheetId) {
        HostedSheet hosted = sheets.get(sheetId);
        if (hosted == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return hosted;
    }

    private static final class HostedSheet {
        private final Sheet sheet;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        private HostedSheet(Sheet sheet) {
            this.sheet = sheet;
        }
    }
}
