package dev.univer.points.sheets;

/**
 * One spreadsheet row: {@code UserID | FullName | Phone | Username | Points | LastUpdated}.
 *
 * @param lastUpdated raw cell text, local time of the sheet, may be empty
 * @param malformedPoints the points cell held something that was not an integer and {@code points} fell back to 0
 */
public record SheetRow(String id,
                       String fullName,
                       String phone,
                       String username,
                       int points,
                       String lastUpdated,
                       boolean malformedPoints) {

    public static SheetRow of(String id, String fullName, String phone, String username, int points, String lastUpdated) {
        return new SheetRow(id, fullName, phone, username, points, lastUpdated, false);
    }

    public SheetRow withPoints(int newPoints, String newLastUpdated) {
        return new SheetRow(id, fullName, phone, username, newPoints, newLastUpdated, false);
    }
}
