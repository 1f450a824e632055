package dev.univer.points.sheets;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SheetRowMapperTest {

    @Test
    void readsAFullRow() {
        SheetRow row = SheetRowMapper.fromCells(List.of(" 1001 ", "Ann Lee", "+998", "ann", "15", "2025-01-10 14:30:45"));

        assertThat(row).isEqualTo(new SheetRow("1001", "Ann Lee", "+998", "ann", 15, "2025-01-10 14:30:45", false));
    }

    @Test
    void trailingCellsMayBeMissing() {
        SheetRow row = SheetRowMapper.fromCells(List.of("1001", "Ann Lee"));

        assertThat(row.points()).isZero();
        assertThat(row.malformedPoints()).isFalse();
        assertThat(row.phone()).isEmpty();
        assertThat(row.lastUpdated()).isEmpty();
    }

    @Test
    void malformedPointsFallBackToZero() {
        SheetRow row = SheetRowMapper.fromCells(List.of("1001", "Ann Lee", "", "", "lots", ""));

        assertThat(row.points()).isZero();
        assertThat(row.malformedPoints()).isTrue();
    }

    @Test
    void rowsWithoutIdOrNameAreDropped() {
        assertThat(SheetRowMapper.fromCells(List.of("", "Ann Lee", "", "", "5"))).isNull();
        assertThat(SheetRowMapper.fromCells(List.of("1001", " ", "", "", "5"))).isNull();
        assertThat(SheetRowMapper.fromCells(List.of())).isNull();
    }

    @Test
    void writesSixColumns() {
        List<Object> cells = SheetRowMapper.toCells(SheetRow.of("1001", "Ann Lee", null, "ann", 7, "2025-01-10 14:30:45"));

        assertThat(cells).containsExactly("1001", "Ann Lee", "", "ann", 7, "2025-01-10 14:30:45");
    }
}
