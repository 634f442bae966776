package com.gridcalc.references;

import com.gridcalc.exceptions.InvalidNameException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * The named ranges of one sheet.
 * Names are case-insensitive, must start with a letter and may not look like a cell reference.
 */
public class NamedRangeManager implements NamedRangeLookup {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    // Upper-cased name -> definition, kept sorted for listing
    private final Map<String, NamedRange> names = new TreeMap<>();

    public NamedRange add(String name, CellReference cell, String description) {
        return put(name, new NamedRange(requireValid(name), cell, description));
    }

    public NamedRange add(String name, RangeReference range, String description) {
        return put(name, new NamedRange(requireValid(name), range, description));
    }

    /**
     * Defines {@code name} from reference text such as "A1" or "A1:B10".
     */
    public NamedRange addFromString(String name, String referenceText, String description) {
        if (referenceText != null && (referenceText.contains(":") || referenceText.contains(".."))) {
            return add(name, RangeReference.parse(referenceText), description);
        }
        return add(name, CellReference.parse(referenceText), description);
    }

    private NamedRange put(String name, NamedRange namedRange) {
        names.put(key(name), namedRange);
        return namedRange;
    }

    public boolean delete(String name) {
        return names.remove(key(name)) != null;
    }

    public NamedRange get(String name) {
        return name == null ? null : names.get(key(name));
    }

    @Override
    public boolean exists(String name) {
        return name != null && names.containsKey(key(name));
    }

    @Override
    public NamedRange resolve(String name) {
        return get(name);
    }

    public List<NamedRange> listAll() {
        return new ArrayList<>(names.values());
    }

    /**
     * All names whose target covers the given cell.
     */
    public List<NamedRange> findByCell(int row, int col) {
        List<NamedRange> result = new ArrayList<>();
        for (NamedRange named : names.values()) {
            if (named.getReference().contains(row, col)) {
                result.add(named);
            }
        }
        return result;
    }

    /**
     * Shifts every name at or beyond {@code index} by one for an inserted row/column.
     */
    public void adjustForInsert(Axis axis, int index) {
        for (Map.Entry<String, NamedRange> entry : names.entrySet()) {
            RangeReference ref = entry.getValue().getReference();
            CellReference start = shiftFrom(ref.getStart(), axis, index, 1);
            CellReference end = shiftFrom(ref.getEnd(), axis, index, 1);
            entry.setValue(entry.getValue().withReference(new RangeReference(start, end)));
        }
    }

    /**
     * Shifts names for a deleted row/column. Single-cell names that pointed
     * at the deleted line are dropped; their names are returned.
     */
    public List<String> adjustForDelete(Axis axis, int index) {
        List<String> invalidated = new ArrayList<>();
        Iterator<Map.Entry<String, NamedRange>> it = names.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, NamedRange> entry = it.next();
            NamedRange named = entry.getValue();
            RangeReference ref = named.getReference();
            if (named.isSingleCell() && coordinate(ref.getStart(), axis) == index) {
                invalidated.add(named.getName());
                it.remove();
                continue;
            }
            CellReference start = shiftFrom(ref.getStart(), axis, index + 1, -1);
            CellReference end = shiftFrom(ref.getEnd(), axis, index + 1, -1);
            entry.setValue(named.withReference(new RangeReference(start, end)));
        }
        return invalidated;
    }

    private static CellReference shiftFrom(CellReference cell, Axis axis, int threshold, int shift) {
        int coord = coordinate(cell, axis);
        if (coord < threshold || coord + shift < 0) {
            return cell;
        }
        return axis == Axis.ROW ? cell.withRow(coord + shift) : cell.withCol(coord + shift);
    }

    private static int coordinate(CellReference cell, Axis axis) {
        return axis == Axis.ROW ? cell.getRow() : cell.getCol();
    }

    public void clear() {
        names.clear();
    }

    public int size() {
        return names.size();
    }

    /**
     * Letters-and-digits names that are not themselves cell references.
     */
    public static boolean isValidName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            return false;
        }
        return !name.matches("^[A-Za-z]+\\d+$");
    }

    private static String requireValid(String name) {
        if (!isValidName(name)) {
            throw new InvalidNameException("Invalid name '" + name
                    + "': must start with a letter, contain only letters, digits and underscores,"
                    + " and not look like a cell reference");
        }
        return name;
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
