package io.gridflow.renewables.load;

import com.codahale.metrics.MetricRegistry;
import io.gridflow.core.Table;
import io.gridflow.metrics.Metrics;
import io.gridflow.renewables.SeriesTables;
import io.gridflow.renewables.WeeklyBatch;
import io.gridflow.renewables.transform.ColumnConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionedCsvLoaderTest {
    static final LocalDate REFERENCE_DAY = LocalDate.of(2024, 6, 12);

    @TempDir
    Path root;

    final Metrics metrics = new Metrics(new MetricRegistry());

    static Table normalized(long variable, double value) {
        Instant t = Instant.parse("2024-06-05T00:00:00Z");
        return Table.builder(ColumnConfig.NORMALIZED_COLUMNS)
                .addRow(Map.of(ColumnConfig.TIMESTAMP, t, ColumnConfig.VARIABLE, variable,
                        ColumnConfig.VALUE, value, ColumnConfig.LAST_MODIFIED, t.plusSeconds(60)))
                .build();
    }

    @Test
    void partition_is_monday_of_the_previous_week() {
        assertEquals("2024-06-03", PartitionedCsvLoader.partition(LocalDate.of(2024, 6, 12)));
        assertEquals("2024-06-03", PartitionedCsvLoader.partition(LocalDate.of(2024, 6, 10)));
        assertEquals("2024-06-03", PartitionedCsvLoader.partition(LocalDate.of(2024, 6, 16)));
        assertEquals("2024-06-10", PartitionedCsvLoader.partition(LocalDate.of(2024, 6, 17)));
        assertEquals("2023-12-25", PartitionedCsvLoader.partition(LocalDate.of(2024, 1, 3)));
    }

    @Test
    void writes_each_series_under_its_partition() throws Exception {
        var loader = new PartitionedCsvLoader(root, metrics);
        List<Path> written = loader.load(new SeriesTables(normalized(583, 12.5), normalized(1044, 3.25)), REFERENCE_DAY);

        Path wind = root.resolve("wind/2024-06-03/wind_data.csv");
        Path solar = root.resolve("solar/2024-06-03/solar_data.csv");
        assertEquals(List.of(wind, solar), written);
        assertEquals(List.of(
                "Timezone_Aware_Timestamp,Variable,Value,Last_Modified_Utc",
                "2024-06-05T00:00:00Z,583,12.5,2024-06-05T00:01:00Z"), Files.readAllLines(wind));
        assertEquals("2024-06-05T00:00:00Z,1044,3.25,2024-06-05T00:01:00Z", Files.readAllLines(solar).get(1));
        assertEquals(2, metrics.counter("load.rows").getCount());
    }

    @Test
    void rerun_overwrites_the_same_files() throws Exception {
        var loader = new PartitionedCsvLoader(root, metrics);
        loader.load(new SeriesTables(normalized(1, 1.0), normalized(2, 2.0)), REFERENCE_DAY);
        loader.accept(new WeeklyBatch(REFERENCE_DAY,
                new SeriesTables(normalized(3, 3.0), Table.builder(ColumnConfig.NORMALIZED_COLUMNS).build())));

        assertEquals(2, Files.readAllLines(root.resolve("wind/2024-06-03/wind_data.csv")).size());
        assertTrue(Files.readAllLines(root.resolve("wind/2024-06-03/wind_data.csv")).get(1).contains(",3,3.0,"));
        assertEquals(List.of("Timezone_Aware_Timestamp,Variable,Value,Last_Modified_Utc"),
                Files.readAllLines(root.resolve("solar/2024-06-03/solar_data.csv")));
    }

    @Test
    void blocked_solar_path_leaves_no_wind_output() throws Exception {
        Files.createFile(root.resolve("solar"));
        var loader = new PartitionedCsvLoader(root, metrics);

        assertThrows(IOException.class,
                () -> loader.load(new SeriesTables(normalized(583, 12.5), normalized(1044, 3.25)), REFERENCE_DAY));

        Path windDir = root.resolve("wind/2024-06-03");
        assertFalse(Files.exists(windDir.resolve("wind_data.csv")));
        try (Stream<Path> left = Files.list(windDir)) {
            assertEquals(0, left.count());
        }
        assertEquals(0, metrics.counter("load.rows").getCount());
    }

    @Test
    void failed_load_keeps_previous_output() throws Exception {
        var loader = new PartitionedCsvLoader(root, metrics);
        loader.load(new SeriesTables(normalized(1, 1.0), normalized(2, 2.0)), REFERENCE_DAY);
        Path wind = root.resolve("wind/2024-06-03/wind_data.csv");
        List<String> before = Files.readAllLines(wind);

        Path solarDir = root.resolve("solar/2024-06-03");
        Files.delete(solarDir.resolve("solar_data.csv"));
        Files.delete(solarDir);
        Files.createFile(solarDir);

        assertThrows(IOException.class,
                () -> loader.load(new SeriesTables(normalized(9, 9.0), normalized(8, 8.0)), REFERENCE_DAY));
        assertEquals(before, Files.readAllLines(wind));
    }

    @Test
    void create_directory_structure_is_idempotent() throws Exception {
        Path first = PartitionedCsvLoader.createDirectoryStructure(root, "wind", "2024-06-03");
        Path again = PartitionedCsvLoader.createDirectoryStructure(root, "wind", "2024-06-03");
        assertEquals(first, again);
        assertTrue(Files.isDirectory(root.resolve("wind").resolve("2024-06-03")));
    }

    @Test
    void cells_needing_quotes_are_quoted() throws Exception {
        Table t = Table.builder(List.of("a", "b"))
                .addRow(Map.of("a", "x,y", "b", "say \"hi\""))
                .addRow(Map.of("a", "plain"))
                .build();
        Path out = root.resolve("t.csv");
        PartitionedCsvLoader.writeCsv(t, out);
        assertEquals(List.of("a,b", "\"x,y\",\"say \"\"hi\"\"\"", "plain,"), Files.readAllLines(out));
    }
}
