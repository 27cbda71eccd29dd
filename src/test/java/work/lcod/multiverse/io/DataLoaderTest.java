package work.lcod.multiverse.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.StringReader;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.table.Table;

class DataLoaderTest {
    @Test
    void loadsCsvAsATable() {
        var table = (Table) DataLoader.load(Resources.path("data/survey.csv"));
        assertEquals(List.of("name", "age", "score"), table.columns());
        assertEquals(7, table.size());
        assertEquals(Arrays.asList(34.0, 17.0, null, 52.0, 15.0, null, 41.0), table.column("age"));
        assertEquals(71.5, table.get(0, "score"));
        assertEquals("ann", table.get(0, "name"));
    }

    @Test
    void csvCellsAreTypedOneByOne() {
        var table = DataLoader.fromCsv(new StringReader("id,code,value\n007, x1 ,-1.5e2\n"), Path.of("inline.csv"));
        assertEquals(7.0, table.get(0, "id"));
        assertEquals("x1", table.get(0, "code"));
        assertEquals(-150.0, table.get(0, "value"));
        assertNull(DataLoader.cell("NA"));
        assertEquals("NaN", DataLoader.cell("NaN"));
        assertEquals(0.5, DataLoader.cell(".5"));
    }

    @Test
    void jsonArraysOfObjectsBecomeTables() {
        var table = (Table) DataLoader.load(Resources.path("data/weights.json"));
        assertEquals(List.of("group", "weight", "note"), table.columns());
        assertEquals(2.0, table.get(1, "weight"));
        assertNull(table.get(0, "note"));
    }

    @Test
    void otherJsonIsBoundAsAValue() {
        assertEquals(Map.of("alpha", 0.05, "tails", List.of(1.0, 2.0)), DataLoader.fromJson("{\"alpha\": 0.05, \"tails\": [1, 2]}", Path.of("x.json")));
        assertEquals(List.of(), DataLoader.fromJson("[]", Path.of("x.json")));
        assertThrows(IllegalStateException.class, () -> DataLoader.fromJson("{", Path.of("x.json")));
    }

    @Test
    void rejectsUnknownFormats() {
        assertThrows(IllegalArgumentException.class, () -> DataLoader.load(Resources.path("scripts/survey.txt")));
    }
}
