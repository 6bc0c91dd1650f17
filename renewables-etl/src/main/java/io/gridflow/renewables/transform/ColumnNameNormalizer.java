package io.gridflow.renewables.transform;

import io.gridflow.core.Table;
import io.gridflow.core.Transform;
import io.gridflow.transform.TransformException;

import java.util.Locale;

/**
 * Rewrites every column name to {@code Capitalized_Word_Form}: trim, whitespace to underscores, then each
 * underscore-separated part upper-cased on its first letter and lower-cased on the rest.
 */
public class ColumnNameNormalizer implements Transform<Table, Table> {
    public static final char SEPARATOR = '_';

    public static String normalize(String column) {
        String trimmed = column.strip();
        StringBuilder out = new StringBuilder(trimmed.length());
        boolean startOfPart = true;
        for (int i = 0; i < trimmed.length(); i++) {
            char ch = trimmed.charAt(i);
            if (Character.isWhitespace(ch) || ch == SEPARATOR) {
                out.append(SEPARATOR);
                startOfPart = true;
            } else if (startOfPart) {
                out.append(String.valueOf(ch).toUpperCase(Locale.ROOT));
                startOfPart = false;
            } else {
                out.append(String.valueOf(ch).toLowerCase(Locale.ROOT));
            }
        }
        return out.toString();
    }

    @Override
    public Table apply(Table input) throws TransformException {
        try {
            return input.renameColumns(ColumnNameNormalizer::normalize);
        } catch (IllegalArgumentException e) {
            throw new TransformException("Column names collide after normalization: " + input.columns(), e);
        }
    }
}
