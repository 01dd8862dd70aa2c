package uk.gegc.readlater.features.libraryitem.domain.repository.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Mutable builder for native statements over {@code library_item}.
 * <p>
 * Conditions are ANDed. Parameters are named; registering a name twice with a different
 * value is rejected so that two rules can never silently overwrite each other's binding.
 * Only SQL fragments produced by this package are appended; caller-supplied values always
 * travel as bound parameters.
 */
public class LibraryItemQuery {

    public static final String TABLE = "library_item";

    private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final List<String> selections = new ArrayList<>();
    private final List<String> conditions = new ArrayList<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final List<String> orderings = new ArrayList<>();

    /**
     * Starts a query restricted to rows owned by {@code userId}.
     */
    public static LibraryItemQuery forUser(UUID userId) {
        Objects.requireNonNull(userId, "userId");
        LibraryItemQuery query = new LibraryItemQuery();
        query.where(column("user_id") + " = :userId", "userId", userId);
        return query;
    }

    public static String column(String name) {
        return TABLE + "." + name;
    }

    public LibraryItemQuery select(String expression) {
        selections.add(expression);
        return this;
    }

    public LibraryItemQuery where(String condition) {
        conditions.add(condition);
        return this;
    }

    public LibraryItemQuery where(String condition, String parameterName, Object value) {
        bind(parameterName, value);
        conditions.add(condition);
        return this;
    }

    public LibraryItemQuery bind(String name, Object value) {
        if (!PARAMETER_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid parameter name: " + name);
        }
        if (parameters.containsKey(name) && !Objects.deepEquals(parameters.get(name), value)) {
            throw new IllegalStateException("Parameter '" + name + "' is already bound to a different value");
        }
        parameters.put(name, value);
        return this;
    }

    public LibraryItemQuery orderBy(String ordering) {
        orderings.add(ordering);
        return this;
    }

    /**
     * Puts an ordering ahead of all orderings added so far.
     */
    public LibraryItemQuery orderByFirst(String ordering) {
        orderings.add(0, ordering);
        return this;
    }

    public List<String> getSelections() {
        return Collections.unmodifiableList(selections);
    }

    public List<String> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public List<String> getOrderings() {
        return Collections.unmodifiableList(orderings);
    }

    public String toSelectSql() {
        StringBuilder sql = new StringBuilder("SELECT ").append(TABLE).append(".*");
        for (String selection : selections) {
            sql.append(", ").append(selection);
        }
        sql.append(" FROM ").append(TABLE).append(whereClause());
        if (!orderings.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderings));
        }
        return sql.toString();
    }

    public String toCountSql() {
        return "SELECT COUNT(*) FROM " + TABLE + whereClause();
    }

    public String toIdSql() {
        return "SELECT " + column("id") + " FROM " + TABLE + whereClause();
    }

    /**
     * Renders an UPDATE over the matching rows; each assignment is a {@code column = expression} fragment.
     */
    public String toUpdateSql(List<String> assignments) {
        if (assignments == null || assignments.isEmpty()) {
            throw new IllegalArgumentException("At least one assignment is required");
        }
        return "UPDATE " + TABLE + " SET " + String.join(", ", assignments) + whereClause();
    }

    /**
     * Parameters referenced by {@code sql}; a count statement, for instance, drops the rank projection.
     */
    public Map<String, Object> parametersFor(String sql) {
        Map<String, Object> used = new LinkedHashMap<>();
        parameters.forEach((name, value) -> {
            if (Pattern.compile(":" + name + "\\b").matcher(sql).find()) {
                used.put(name, value);
            }
        });
        return used;
    }

    private String whereClause() {
        if (conditions.isEmpty()) {
            return "";
        }
        return " WHERE " + String.join(" AND ", conditions);
    }
}
