package dev.univer.points.sheets;

import dev.univer.points.util.ParseUtil;

import java.util.List;

/**
 * Converts between raw cell lists and {@link SheetRow}.
 */
public final class SheetRowMapper {
    public static final List<Object> HEADER = List.of("UserID", "FullName", "Phone", "Username", "Points", "LastUpdated");
    public static final String DATA_RANGE = "A2:F";

    private SheetRowMapper() {
    }

    /**
     * @return the row, or {@code null} for rows without an id or a name
     */
    public static SheetRow fromCells(List<?> cells) {
        String id = cell(cells, 0);
        String fullName = cell(cells, 1);
        if (id.isEmpty() || fullName.isEmpty()) return null;

        Integer points = ParseUtil.parsePoints(cell(cells, 4));
        return new SheetRow(id, fullName, cell(cells, 2), cell(cells, 3),
                            points == null ? 0 : points, cell(cells, 5), points == null);
    }

    public static List<Object> toCells(SheetRow row) {
        return List.of(row.id(),
                       nullToEmpty(row.fullName()),
                       nullToEmpty(row.phone()),
                       nullToEmpty(row.username()),
                       row.points(),
                       nullToEmpty(row.lastUpdated()));
    }

    private static String cell(List<?> cells, int index) {
        if (cells == null || index >= cells.size() || cells.get(index) == null) return "";
        return cells.get(index).toString().trim();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
