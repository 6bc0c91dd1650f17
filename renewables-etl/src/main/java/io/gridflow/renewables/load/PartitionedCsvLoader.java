package io.gridflow.renewables.load;

import io.gridflow.core.Sink;
import io.gridflow.core.Table;
import io.gridflow.metrics.Metrics;
import io.gridflow.renewables.SeriesTables;
import io.gridflow.renewables.WeeklyBatch;
import io.gridflow.renewables.extract.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes each series to {@code {root}/{series}/{partition}/{series}_data.csv} with a header row and no index
 * column. The partition is the Monday of the week one week before the reference day.
 * <p>
 * Both files are staged next to their targets and only moved into place once every series has been written,
 * so a failed load leaves earlier output untouched.
 */
public class PartitionedCsvLoader implements Sink<WeeklyBatch> {
    private static final Logger log = LoggerFactory.getLogger(PartitionedCsvLoader.class);

    private final Path root;
    private final Metrics metrics;

    public PartitionedCsvLoader(Path root, Metrics metrics) {
        this.root = root;
        this.metrics = metrics;
    }

    public static String partition(LocalDate referenceDay) {
        return referenceDay.minusDays(7).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toString();
    }

    public static Path createDirectoryStructure(Path root, String category, String partition) throws IOException {
        return Files.createDirectories(root.resolve(category).resolve(partition));
    }

    @Override
    public void accept(WeeklyBatch batch) throws IOException {
        load(batch.tables(), batch.referenceDay());
    }

    /** @return the written files, wind first */
    public List<Path> load(SeriesTables tables, LocalDate referenceDay) throws IOException {
        String partition = partition(referenceDay);
        Map<Series, Path> staged = new EnumMap<>(Series.class);
        List<Path> written = new ArrayList<>(Series.values().length);
        try {
            for (Series s : Series.values()) {
                Path dir = createDirectoryStructure(root, s.directory(), partition);
                Path tmp = Files.createTempFile(dir, "." + s.directory() + "_data", ".csv.tmp");
                staged.put(s, tmp);
                writeCsv(tables.get(s), tmp);
            }
            for (Series s : Series.values()) {
                Path tmp = staged.get(s);
                Path out = tmp.resolveSibling(s.directory() + "_data.csv");
                moveIntoPlace(tmp, out);
                Table t = tables.get(s);
                metrics.counter("load.rows").inc(t.size());
                log.info("Wrote {} {} rows to {}", t.size(), s.displayName(), out);
                written.add(out);
            }
            return written;
        } finally {
            for (Path tmp : staged.values()) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove staging file {}", tmp, e);
                }
            }
        }
    }

    private static void moveIntoPlace(Path tmp, Path out) throws IOException {
        try {
            Files.move(tmp, out, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static void writeCsv(Table table, Path out) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            w.write(line(table.columns()));
            w.write('\n');
            for (Map<String, Object> row : table.rows()) {
                List<String> cells = new ArrayList<>(table.columns().size());
                for (String c : table.columns()) {
                    Object v = row.get(c);
                    cells.add(v == null ? "" : v.toString());
                }
                w.write(line(cells));
                w.write('\n');
            }
        }
    }

    private static String line(List<String> cells) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(cells.get(i)));
        }
        return sb.toString();
    }

    private static String escape(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) return cell;
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
