package dev.univer.points.sheets;

import java.util.List;

/**
 * Tabular store with one tab per partition. No transactions and no row locks:
 * every call stands alone and a failure may leave earlier calls applied.
 * Failures surface as {@link dev.univer.points.exception.SpreadsheetException}.
 */
public interface SpreadsheetAdapter {

    List<String> listPartitionNames();

    /** Adds a tab with the header row. */
    void createPartition(String name);

    void renamePartition(String oldName, String newName);

    /** Data rows in sheet order; rows without an id or a name are left out. */
    List<SheetRow> readRows(String sheet);

    /**
     * Overwrites the row carrying {@code row.id()}.
     *
     * @return {@code false} when no row has that id
     */
    boolean writeRow(String sheet, SheetRow row);

    /**
     * @return {@code false} when no row has that id
     */
    boolean deleteRow(String sheet, String id);

    void appendRow(String sheet, SheetRow row);
}
