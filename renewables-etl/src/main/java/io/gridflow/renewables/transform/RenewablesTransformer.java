package io.gridflow.renewables.transform;

import io.gridflow.core.Table;
import io.gridflow.renewables.SeriesTables;
import io.gridflow.renewables.extract.Series;
import io.gridflow.transform.TransformChain;
import io.gridflow.transform.TransformException;

/**
 * Turns merged wind and solar tables into normalized tables. Steps, in order: timestamp localization,
 * type casting, column name normalization, custom renaming, sort by timestamp. Pure and deterministic.
 */
public class RenewablesTransformer {

    /** Wind timestamps are text, solar timestamps are epoch milliseconds. */
    public SeriesTables transform(SeriesTables tables) throws TransformException {
        return transform(tables, TimestampUnit.TEXT, TimestampUnit.EPOCH_MILLIS);
    }

    public SeriesTables transform(SeriesTables tables, TimestampUnit windUnit, TimestampUnit solarUnit) throws TransformException {
        Table wind = normalize(Series.WIND, tables.wind(), windUnit);
        Table solar = normalize(Series.SOLAR, tables.solar(), solarUnit);
        return new SeriesTables(wind, solar);
    }

    public Table normalize(Table raw, TimestampUnit unit) throws TransformException {
        return chain(unit).apply(raw);
    }

    private Table normalize(Series series, Table raw, TimestampUnit unit) throws TransformException {
        try {
            return normalize(raw, unit);
        } catch (TransformException e) {
            throw new TransformException(series.displayName() + " data transform failed: " + e.getMessage(), e);
        }
    }

    static TransformChain<Table> chain(TimestampUnit unit) {
        return new TransformChain<>(
                new TimestampLocalizer(unit),
                new TypeCaster(ColumnConfig.COLUMN_TYPES),
                new ColumnNameNormalizer(),
                new ColumnRenamer(ColumnConfig.CUSTOM_COLUMN_NAMES),
                new TimeSorter(ColumnConfig.TIMESTAMP),
                new NormalizedSchema());
    }
}
