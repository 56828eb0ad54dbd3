package io.captionsync.registry;

import io.captionsync.error.DatabaseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Optimistic edit: the proposed value is shown first, then the statement runs. If the statement fails, the
 * previously held value is shown again.
 *
 * @param <T> value rendered by the caller, for example a box label
 */
public final class EditCommand<T> {
    private final String description;
    private final T previous;
    private final T proposed;
    private final SqlStatement statement;
    private final Consumer<T> display;

    public EditCommand(String description, T previous, T proposed, SqlStatement statement, Consumer<T> display) {
        this.description = Objects.requireNonNull(description, "description");
        this.previous = previous;
        this.proposed = proposed;
        this.statement = Objects.requireNonNull(statement, "statement");
        this.display = display == null ? value -> { } : display;
    }

    public String description() {
        return description;
    }

    public Result<T> run(DatabaseHandle handle) {
        display.accept(proposed);
        try {
            int affected = handle.execute(statement.sql(), statement.params().toArray());
            return new Result<>(true, proposed, affected, null);
        } catch (DatabaseException e) {
            display.accept(previous);
            return new Result<>(false, previous, 0, e);
        }
    }

    public record SqlStatement(String sql, List<Object> params) {

        public SqlStatement {
            Objects.requireNonNull(sql, "sql");
            params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        }

        public static SqlStatement of(String sql, Object... params) {
            return new SqlStatement(sql, Arrays.asList(params));
        }
    }

    /**
     * Outcome of one edit. {@code value} is what the caller is showing after the edit.
     */
    public record Result<T>(boolean applied, T value, int affectedRows, DatabaseException error) {
    }
}
