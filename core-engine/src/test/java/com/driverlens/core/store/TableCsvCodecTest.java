package com.driverlens.core.store;

import com.driverlens.core.model.ColumnType;
import com.driverlens.core.model.DataTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TableCsvCodec}.
 */
class TableCsvCodecTest {

    @Test
    @DisplayName("Should type columns as numeric only when every non-blank cell parses")
    void shouldInferColumnTypes() throws IOException {
        String csv = "value_speed,line,value_temp\n"
                + "1.5,A,20\n"
                + ",B,\n"
                + "3,C1,22.5\n";

        DataTable table = TableCsvCodec.read(new StringReader(csv));

        assertThat(table.getColumnType("value_speed")).isEqualTo(ColumnType.NUMERIC);
        assertThat(table.getColumnType("line")).isEqualTo(ColumnType.TEXT);
        double[] speed = table.numericValues("value_speed");
        assertThat(speed[0]).isEqualTo(1.5);
        assertThat(speed[1]).isNaN();
        assertThat(speed[2]).isEqualTo(3.0);
        assertThat(table.numericValues("value_temp")[1]).isNaN();
        assertThat(table.cellAsText("line", 1)).isEqualTo("B");
    }

    @Test
    @DisplayName("Should write missing values as empty cells and read them back")
    void shouldRoundTripMissingValues() throws IOException {
        DataTable original = DataTable.builder()
                .numericColumn("value_speed", 1.0, Double.NaN)
                .textColumn("note", "has, comma", null)
                .build();

        StringWriter out = new StringWriter();
        TableCsvCodec.write(original, out);
        DataTable reread = TableCsvCodec.read(new StringReader(out.toString()));

        assertThat(out.toString()).contains("\"has, comma\"");
        assertThat(reread).isEqualTo(original);
    }

    @Test
    @DisplayName("Should reject records with the wrong number of fields")
    void shouldRejectRaggedRecords() {
        String csv = "a,b\n1,2\n3\n";

        assertThatThrownBy(() -> TableCsvCodec.read(new StringReader(csv)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected 2");
    }

    @Test
    @DisplayName("Should reject content without a header")
    void shouldRejectEmptyContent() {
        assertThatThrownBy(() -> TableCsvCodec.read(new StringReader("")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("header");
    }

    @Test
    @DisplayName("Should name a blank header cell after its position")
    void shouldNameBlankHeader() throws Exception {
        String csv = ",value_speed,value_temp\n0,1.5,20\n1,2.5,21\n";

        DataTable table = TableCsvCodec.read(new StringReader(csv));

        assertThat(table.getColumnNames()).containsExactly("Unnamed: 0", "value_speed", "value_temp");
        assertThat(table.numericValues("Unnamed: 0")).containsExactly(0.0, 1.0);
        assertThat(table.numericValues("value_temp")).containsExactly(20.0, 21.0);
    }

    @Test
    @DisplayName("Should refuse to write a table without columns")
    void shouldRefuseEmptyTable() {
        assertThatThrownBy(() -> TableCsvCodec.write(DataTable.builder().build(), new StringWriter()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
