package dev.univer.points.sheets;

import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.model.*;
import dev.univer.points.config.SheetsProperties;
import dev.univer.points.exception.SpreadsheetException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "sheets", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GoogleSheetsAdapter implements SpreadsheetAdapter {

    private static final String RAW = "RAW";

    private final Sheets sheets;
    private final SheetsProperties props;

    @Override
    public List<String> listPartitionNames() {
        List<String> names = new ArrayList<>();
        for (Sheet s : spreadsheetTabs()) names.add(s.getProperties().getTitle());
        return names;
    }

    @Override
    public void createPartition(String name) {
        AddSheetRequest add = new AddSheetRequest().setProperties(new SheetProperties().setTitle(name));
        batchUpdate(new Request().setAddSheet(add), "create tab " + name);
        try {
            sheets.spreadsheets().values()
                  .update(props.getSpreadsheetId(), range(name, "A1:F1"),
                          new ValueRange().setValues(List.of(SheetRowMapper.HEADER)))
                  .setValueInputOption(RAW)
                  .execute();
        } catch (IOException e) {
            throw new SpreadsheetException("Failed to write header of tab " + name, e);
        }
        log.info("Created tab {}", name);
    }

    @Override
    public void renamePartition(String oldName, String newName) {
        UpdateSheetPropertiesRequest rename = new UpdateSheetPropertiesRequest()
                .setProperties(new SheetProperties().setSheetId(sheetId(oldName)).setTitle(newName))
                .setFields("title");
        batchUpdate(new Request().setUpdateSheetProperties(rename), "rename tab " + oldName);
        log.info("Renamed tab {} -> {}", oldName, newName);
    }

    @Override
    public List<SheetRow> readRows(String sheet) {
        List<SheetRow> rows = new ArrayList<>();
        for (List<Object> cells : readData(sheet)) {
            SheetRow row = SheetRowMapper.fromCells(cells);
            if (row != null) rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean writeRow(String sheet, SheetRow row) {
        int rowNumber = findRowNumber(sheet, row.id());
        if (rowNumber < 0) return false;
        try {
            sheets.spreadsheets().values()
                  .update(props.getSpreadsheetId(), range(sheet, "A" + rowNumber + ":F" + rowNumber),
                          new ValueRange().setValues(List.of(SheetRowMapper.toCells(row))))
                  .setValueInputOption(RAW)
                  .execute();
            return true;
        } catch (IOException e) {
            throw new SpreadsheetException("Failed to write row " + row.id() + " in " + sheet, e);
        }
    }

    @Override
    public boolean deleteRow(String sheet, String id) {
        int rowNumber = findRowNumber(sheet, id);
        if (rowNumber < 0) return false;
        DeleteDimensionRequest delete = new DeleteDimensionRequest().setRange(new DimensionRange()
                .setSheetId(sheetId(sheet))
                .setDimension("ROWS")
                .setStartIndex(rowNumber - 1)
                .setEndIndex(rowNumber));
        batchUpdate(new Request().setDeleteDimension(delete), "delete row " + id + " in " + sheet);
        return true;
    }

    @Override
    public void appendRow(String sheet, SheetRow row) {
        try {
            sheets.spreadsheets().values()
                  .append(props.getSpreadsheetId(), range(sheet, "A:F"),
                          new ValueRange().setValues(List.of(SheetRowMapper.toCells(row))))
                  .setValueInputOption(RAW)
                  .setInsertDataOption("INSERT_ROWS")
                  .execute();
        } catch (IOException e) {
            throw new SpreadsheetException("Failed to append row " + row.id() + " to " + sheet, e);
        }
    }

    // 1-based sheet row number of the id, -1 if absent
    private int findRowNumber(String sheet, String id) {
        List<List<Object>> data = readData(sheet);
        for (int i = 0; i < data.size(); i++) {
            List<Object> cells = data.get(i);
            if (!cells.isEmpty() && cells.get(0) != null && id.equals(cells.get(0).toString().trim())) {
                return i + 2;
            }
        }
        return -1;
    }

    private List<List<Object>> readData(String sheet) {
        try {
            ValueRange result = sheets.spreadsheets().values()
                                      .get(props.getSpreadsheetId(), range(sheet, SheetRowMapper.DATA_RANGE))
                                      .execute();
            List<List<Object>> values = result.getValues();
            return values == null ? List.of() : values;
        } catch (IOException e) {
            throw new SpreadsheetException("Failed to read tab " + sheet, e);
        }
    }

    private List<Sheet> spreadsheetTabs() {
        try {
            Spreadsheet spreadsheet = sheets.spreadsheets().get(props.getSpreadsheetId())
                                            .setFields("sheets.properties")
                                            .execute();
            return spreadsheet.getSheets() == null ? List.of() : spreadsheet.getSheets();
        } catch (IOException e) {
            throw new SpreadsheetException("Failed to list tabs", e);
        }
    }

    private int sheetId(String name) {
        return spreadsheetTabs().stream()
                .map(Sheet::getProperties)
                .filter(p -> name.equals(p.getTitle()))
                .map(SheetProperties::getSheetId)
                .findFirst()
                .orElseThrow(() -> new SpreadsheetException("No such tab: " + name));
    }

    private void batchUpdate(Request request, String what) {
        try {
            sheets.spreadsheets()
                  .batchUpdate(props.getSpreadsheetId(), new BatchUpdateSpreadsheetRequest().setRequests(List.of(request)))
                  .execute();
        } catch (IOException e) {
            throw new SpreadsheetException("Failed to " + what, e);
        }
    }

    private static String range(String sheet, String cells) {
        return "'" + sheet.replace("'", "''") + "'!" + cells;
    }
}
