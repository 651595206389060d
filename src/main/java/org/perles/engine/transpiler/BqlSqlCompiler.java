package org.perles.engine.transpiler;

import org.perles.bql.dsl.BinaryExpr;
import org.perles.bql.dsl.CompareExpr;
import org.perles.bql.dsl.CompareExpr.Operator;
import org.perles.bql.dsl.ExprVisitor;
import org.perles.bql.dsl.InExpr;
import org.perles.bql.dsl.NotExpr;
import org.perles.bql.dsl.OrderTerm;
import org.perles.bql.dsl.Query;
import org.perles.bql.dsl.Value;
import org.perles.bql.validation.FieldRegistry;
import org.perles.bql.validation.FieldType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Compiles a validated BQL query into a parameterized WHERE clause, an ORDER BY clause
 * and the positional parameters, against the issues table aliased as {@code i}.
 *
 * The compiler is stateless; each call to {@link #compile(Query)} uses a fresh parameter list.
 * Every value reaches SQL through a placeholder.
 */
public final class BqlSqlCompiler {

    public static final String DEFAULT_ORDER_BY = "i.updated_at DESC, i.id ASC";

    private static final String BLOCKED_IDS = "SELECT issue_id FROM blocked_issues_cache";
    private static final String READY_IDS = "SELECT id FROM ready_issues";
    private static final String LABELLED_IDS = "SELECT issue_id FROM labels WHERE label";

    private final SQLDialect dialect;
    private final FieldRegistry registry;

    public BqlSqlCompiler() {
        this(SQLiteDialect.INSTANCE, FieldRegistry.DEFAULT);
    }

    public BqlSqlCompiler(SQLDialect dialect, FieldRegistry registry) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    /**
     * Compiles the filter and ORDER BY of a query. The EXPAND clause is not part of the SQL.
     *
     * @param query A query that passed validation
     * @return The compiled clauses and their parameters
     */
    public CompiledQuery compile(Query query) {
        List<Object> params = new ArrayList<>();
        String where = query.hasFilter() ? query.filter().accept(new WhereBuilder(params)) : "";
        return new CompiledQuery(where, orderBy(query.orderBy()), params);
    }

    /**
     * Maps a field name to its column on the issues table.
     */
    public static String column(String field) {
        return switch (field) {
            case "type" -> "i.issue_type";
            case "created" -> "i.created_at";
            case "updated" -> "i.updated_at";
            case "closed" -> "i.closed_at";
            default -> "i." + field;
        };
    }

    /**
     * Escapes LIKE wildcards and wraps the value for a substring match.
     */
    static String likePattern(String value) {
        String escaped = value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private String orderBy(List<OrderTerm> terms) {
        if (terms.isEmpty()) {
            return DEFAULT_ORDER_BY;
        }
        return terms.stream()
                .map(term -> orderExpression(term.field()) + (term.descending() ? " DESC" : " ASC"))
                .collect(Collectors.joining(", "));
    }

    private String orderExpression(String field) {
        return switch (field) {
            case "blocked" -> "(i.id IN (" + BLOCKED_IDS + "))";
            case "ready" -> "(i.id IN (" + READY_IDS + "))";
            case "label", "labels" -> aggregatedLabels();
            default -> column(field);
        };
    }

    private String aggregatedLabels() {
        return "(SELECT " + dialect.stringAggregate("l.label", ",")
                + " FROM labels l WHERE l.issue_id = i.id)";
    }

    private FieldType typeOf(String field) {
        return registry.find(field)
                .map(FieldRegistry.FieldSpec::type)
                .orElse(FieldType.STRING);
    }

    private static boolean isNullableText(String field) {
        return field.equals("assignee") || field.equals("description");
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static String comparisonSql(Operator operator) {
        return switch (operator) {
            case CONTAINS -> "LIKE";
            case NOT_CONTAINS -> "NOT LIKE";
            default -> operator.symbol();
        };
    }

    /**
     * Visitor producing the WHERE body and appending parameters in placeholder order.
     */
    private final class WhereBuilder implements ExprVisitor<String> {

        private final List<Object> params;

        WhereBuilder(List<Object> params) {
            this.params = params;
        }

        @Override
        public String visitBinary(BinaryExpr binary) {
            String left = binary.left().accept(this);
            String right = binary.right().accept(this);
            return "(" + left + " " + binary.operator().name() + " " + right + ")";
        }

        @Override
        public String visitNot(NotExpr not) {
            return "NOT (" + not.inner().accept(this) + ")";
        }

        @Override
        public String visitCompare(CompareExpr compare) {
            String field = compare.field();
            Operator operator = compare.operator();
            Value value = compare.value();

            switch (field) {
                case "blocked":
                    return membership(BLOCKED_IDS, value.bool() ^ (operator == Operator.NOT_EQUALS));
                case "ready":
                    return membership(READY_IDS, value.bool() ^ (operator == Operator.NOT_EQUALS));
                case "label":
                    return labelCompare(operator, value);
                case "labels":
                    if (operator.isContains()) {
                        params.add(likePattern(value.raw()));
                        return "COALESCE(" + aggregatedLabels() + ", '') " + comparisonSql(operator)
                                + " ? ESCAPE '\\'";
                    }
                    return labelCompare(operator, value);
                default:
                    break;
            }

            String column = column(field);
            switch (typeOf(field)) {
                case PRIORITY:
                    params.add(value.priorityLevel());
                    return column + " " + operator.symbol() + " ?";
                case DATE:
                    SQLDialect.DateExpression date = dialect.dateExpression(value);
                    params.add(date.parameter());
                    return dialect.timestamp(column) + " " + operator.symbol() + " " + date.sql();
                case BOOL:
                    params.add(dialect.booleanParameter(value.bool()));
                    return "COALESCE(" + column + ", 0) " + operator.symbol() + " ?";
                default:
                    break;
            }

            String target = isNullableText(field) ? "COALESCE(" + column + ", '')" : column;
            if (operator.isContains()) {
                params.add(likePattern(value.raw()));
                return target + " " + comparisonSql(operator) + " ? ESCAPE '\\'";
            }
            params.add(value.raw());
            return target + " " + operator.symbol() + " ?";
        }

        @Override
        public String visitIn(InExpr in) {
            String field = in.field();
            String not = in.negated() ? "NOT " : "";
            String list = placeholders(in.values().size());

            if (field.equals("label") || field.equals("labels")) {
                in.values().forEach(value -> params.add(value.raw()));
                return "i.id " + not + "IN (" + LABELLED_IDS + " IN (" + list + "))";
            }

            boolean priority = typeOf(field) == FieldType.PRIORITY;
            for (Value value : in.values()) {
                params.add(priority ? (Object) value.priorityLevel() : value.raw());
            }
            String column = column(field);
            String target = isNullableText(field) ? "COALESCE(" + column + ", '')" : column;
            return target + " " + not + "IN (" + list + ")";
        }

        private String membership(String subquery, boolean member) {
            return "i.id " + (member ? "" : "NOT ") + "IN (" + subquery + ")";
        }

        private String labelCompare(Operator operator, Value value) {
            return switch (operator) {
                case EQUALS -> {
                    params.add(value.raw());
                    yield "i.id IN (" + LABELLED_IDS + " = ?)";
                }
                case NOT_EQUALS -> {
                    params.add(value.raw());
                    yield "i.id NOT IN (" + LABELLED_IDS + " = ?)";
                }
                case CONTAINS -> {
                    params.add(likePattern(value.raw()));
                    yield "i.id IN (" + LABELLED_IDS + " LIKE ? ESCAPE '\\')";
                }
                case NOT_CONTAINS -> {
                    params.add(likePattern(value.raw()));
                    yield "i.id NOT IN (" + LABELLED_IDS + " LIKE ? ESCAPE '\\')";
                }
                default -> throw new IllegalArgumentException(
                        "operator " + operator.symbol() + " is not supported for labels");
            };
        }
    }
}
