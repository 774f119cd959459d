// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import mathtree.util.annotation.Nullable;

/**
 * A matrix or table, filled row by row.
 * <p>
 * After {@link #setDimension()} every row has {@link #columnCount()} entries and no entry is {@code null}.
 */
public final class MatrixNode extends CompositeNode {
    public MatrixNode() {
    }

    /**
     * Starts a new, empty row.
     */
    public void newRow() {
        rows.add(new ArrayList<>());
    }

    /**
     * Adds an entry at the end of the current row, starting the first row if there is none.
     */
    public void addEntry(final @Nullable Node entry) {
        if (rows.isEmpty()) {
            newRow();
        }
        rows.get(rows.size() - 1).add(entry);
    }

    /**
     * Fixes the dimensions: the column count becomes the length of the longest row, and shorter rows, like
     * missing entries, are filled with empty text.
     */
    public void setDimension() {
        int columns = 0;
        for (final var row : rows) {
            columns = Math.max(columns, row.size());
        }
        for (final var row : rows) {
            for (int i = 0; i < row.size(); i += 1) {
                if (row.get(i) == null) {
                    row.set(i, emptyEntry());
                }
            }
            while (row.size() < columns) {
                row.add(emptyEntry());
            }
        }
        columnCount = columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columnCount;
    }

    /**
     * Retrieves the entry at the given position.
     *
     * @throws IndexOutOfBoundsException if the position is outside of the matrix.
     */
    public @Nullable Node entry(final int row, final int column) {
        Objects.checkIndex(row, rows.size());
        final var cells = rows.get(row);
        Objects.checkIndex(column, cells.size());
        return cells.get(column);
    }

    public boolean isSpecial() {
        return isSpecial;
    }

    public void setSpecial(final boolean special) {
        isSpecial = special;
    }

    /**
     * Checks whether this table is an inference rule display. Inference tables are always special.
     */
    public boolean isInference() {
        return isInference;
    }

    public void setInference(final boolean inference) {
        isInference = inference;
        if (inference) {
            isSpecial = true;
        }
    }

    public boolean hasRowNames() {
        return hasRowNames;
    }

    public void setRowNames(final boolean rowNames) {
        hasRowNames = rowNames;
    }

    public boolean hasColumnNames() {
        return hasColumnNames;
    }

    public void setColumnNames(final boolean columnNames) {
        hasColumnNames = columnNames;
    }

    /**
     * Returns the entries in row-major order.
     */
    @Override
    public List<@Nullable Node> slots() {
        final var slots = new ArrayList<@Nullable Node>();
        for (final var row : rows) {
            slots.addAll(row);
        }
        return slots;
    }

    @Override
    String format() {
        final var builder = new StringBuilder("matrix(");
        for (int row = 0; row < rows.size(); row += 1) {
            if (row > 0) {
                builder.append(',');
            }
            builder.append('[');
            final var cells = rows.get(row);
            for (int column = 0; column < cells.size(); column += 1) {
                if (column > 0) {
                    builder.append(',');
                }
                builder.append(slotString(cells.get(column)));
            }
            builder.append(']');
        }
        return builder.append(')').toString();
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        final var columnWidths = new int[columnCount];
        int height = 0;
        for (final var row : rows) {
            int rowCenter = 0;
            int rowDrop = 0;
            for (int column = 0; column < row.size(); column += 1) {
                final var entry = row.get(column);
                Chain.recalculate(entry, context, fontSize);
                if (column < columnCount) {
                    columnWidths[column] = Math.max(columnWidths[column], slotWidth(entry));
                }
                rowCenter = Math.max(rowCenter, slotCenter(entry));
                rowDrop = Math.max(rowDrop, slotDrop(entry));
            }
            height += rowCenter + rowDrop;
        }
        height += Math.max(0, rows.size() - 1) * ROW_GAP;
        int width = Math.max(0, columnCount - 1) * COLUMN_GAP;
        for (final var columnWidth : columnWidths) {
            width += columnWidth;
        }
        if (!isSpecial) {
            width += 2 * PAREN_WIDTH;
        }
        finish(width, height, height / 2);
    }

    private TextNode emptyEntry() {
        final var node = new TextNode("");
        node.setKind(kind());
        node.setGroup(group());
        return node;
    }

    private static final int COLUMN_GAP = 10;
    private static final int ROW_GAP = 4;
    private static final int PAREN_WIDTH = 6;

    private final List<List<@Nullable Node>> rows = new ArrayList<>();
    private int columnCount = 0;
    private boolean isSpecial = false;
    private boolean isInference = false;
    private boolean hasRowNames = false;
    private boolean hasColumnNames = false;
}
