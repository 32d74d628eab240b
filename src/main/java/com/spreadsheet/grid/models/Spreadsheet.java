package com.spreadsheet.grid.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A workbook: an ordered list of sheets (never empty) and the index of the
 * active one. Carries the read/write lock callers take around mutations and
 * recalculation passes.
 */
public class Spreadsheet {

    private final List<Sheet> sheets = new ArrayList<>();
    private int activeSheet;

    // One writer per workbook; a recalculation pass is a critical section
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Spreadsheet() {
        this(new Sheet("Sheet1"));
    }

    public Spreadsheet(Sheet first) {
        sheets.add(first);
        activeSheet = 0;
    }

    public int sheetCount() {
        return sheets.size();
    }

    public Optional<Sheet> sheet(int index) {
        if (index < 0 || index >= sheets.size()) {
            return Optional.empty();
        }
        return Optional.of(sheets.get(index));
    }

    public Sheet active() {
        return sheets.get(activeSheet);
    }

    public int getActiveSheet() {
        return activeSheet;
    }

    public boolean setActiveSheet(int index) {
        if (index < 0 || index >= sheets.size()) {
            return false;
        }
        activeSheet = index;
        return true;
    }

    /**
     * Appends a sheet and returns its index.
     */
    public int addSheet(String name) {
        return addSheet(new Sheet(name));
    }

    public int addSheet(Sheet sheet) {
        sheets.add(sheet);
        return sheets.size() - 1;
    }

    /**
     * Removes a sheet. Returns empty for an invalid index or when it is the
     * last remaining sheet.
     */
    public Optional<Sheet> removeSheet(int index) {
        if (sheets.size() <= 1 || index < 0 || index >= sheets.size()) {
            return Optional.empty();
        }
        Sheet removed = sheets.remove(index);
        if (activeSheet >= sheets.size()) {
            activeSheet = sheets.size() - 1;
        }
        return Optional.of(removed);
    }

    public boolean renameSheet(int index, String name) {
        if (index < 0 || index >= sheets.size()) {
            return false;
        }
        sheets.get(index).setName(name);
        return true;
    }

    public List<String> sheetNames() {
        List<String> names = new ArrayList<>(sheets.size());
        for (Sheet sheet : sheets) {
            names.add(sheet.getName());
        }
        return names;
    }

    /**
     * Index of the first sheet with the given name, or -1.
     */
    public int indexOf(String name) {
        for (int i = 0; i < sheets.size(); i++) {
            if (sheets.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
