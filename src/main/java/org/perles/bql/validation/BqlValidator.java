package org.perles.bql.validation;

import org.perles.bql.dsl.BinaryExpr;
import org.perles.bql.dsl.CompareExpr;
import org.perles.bql.dsl.ExprVisitor;
import org.perles.bql.dsl.InExpr;
import org.perles.bql.dsl.NotExpr;
import org.perles.bql.dsl.OrderTerm;
import org.perles.bql.dsl.Query;
import org.perles.bql.dsl.Value;
import org.perles.bql.validation.FieldRegistry.FieldSpec;

import java.util.Objects;

/**
 * Checks a parsed query against a {@link FieldRegistry}.
 *
 * Every comparison must name a registered field, use an operator its FieldType allows
 * and carry a value of the matching kind. ORDER BY fields must be registered.
 */
public final class BqlValidator implements ExprVisitor<Void> {

    private final FieldRegistry registry;

    public BqlValidator() {
        this(FieldRegistry.DEFAULT);
    }

    public BqlValidator(FieldRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    /**
     * Validates a query against the default registry.
     *
     * @throws BqlValidationException on the first violation found
     */
    public static void check(Query query) {
        new BqlValidator().validate(query);
    }

    public void validate(Query query) {
        if (query.hasFilter()) {
            query.filter().accept(this);
        }
        for (OrderTerm term : query.orderBy()) {
            if (!registry.contains(term.field())) {
                throw new BqlValidationException(term.field(),
                        "unknown field in ORDER BY: \"" + term.field() + "\" (valid: "
                                + registry.describeFieldNames() + ")");
            }
        }
    }

    @Override
    public Void visitBinary(BinaryExpr binary) {
        binary.left().accept(this);
        binary.right().accept(this);
        return null;
    }

    @Override
    public Void visitNot(NotExpr not) {
        not.inner().accept(this);
        return null;
    }

    @Override
    public Void visitCompare(CompareExpr compare) {
        FieldSpec spec = lookup(compare.field());
        if (!spec.type().allows(compare.operator())) {
            throw new BqlValidationException(spec.name(),
                    "operator \"" + compare.operator().symbol() + "\" is not valid for "
                            + describeType(spec.type()) + " field \"" + spec.name() + "\" (use "
                            + describeOperators(spec.type()) + ")");
        }
        checkValue(spec, compare.value());
        return null;
    }

    @Override
    public Void visitIn(InExpr in) {
        FieldSpec spec = lookup(in.field());
        if (!spec.type().supportsIn()) {
            throw new BqlValidationException(spec.name(),
                    "operator " + (in.negated() ? "NOT IN" : "IN") + " is not valid for "
                            + describeType(spec.type()) + " field \"" + spec.name() + "\"");
        }
        for (Value value : in.values()) {
            checkValue(spec, value);
        }
        return null;
    }

    private FieldSpec lookup(String field) {
        return registry.find(field).orElseThrow(() -> new BqlValidationException(field,
                "unknown field: \"" + field + "\" (valid: " + registry.describeFieldNames() + ")"));
    }

    private static void checkValue(FieldSpec spec, Value value) {
        switch (spec.type()) {
            case BOOL -> {
                if (value.kind() != Value.Kind.BOOL) {
                    throw new BqlValidationException(spec.name(),
                            "field \"" + spec.name() + "\" requires a boolean value (true or false), got \""
                                    + value.raw() + "\"");
                }
            }
            case PRIORITY -> {
                if (value.kind() != Value.Kind.PRIORITY) {
                    throw new BqlValidationException(spec.name(),
                            "field \"" + spec.name() + "\" requires a priority value (P0-P4), got \""
                                    + value.raw() + "\"");
                }
            }
            case DATE -> {
                if (value.kind() != Value.Kind.DATE) {
                    throw new BqlValidationException(spec.name(),
                            "field \"" + spec.name()
                                    + "\" requires a date value (today, yesterday, -Nd, -Nh, -Nm or ISO date), got \""
                                    + value.raw() + "\"");
                }
            }
            case ENUM -> {
                if (value.kind() != Value.Kind.STRING || !spec.allowedValues().contains(value.text())) {
                    throw new BqlValidationException(spec.name(),
                            "invalid value \"" + value.raw() + "\" for field \"" + spec.name() + "\" (valid: "
                                    + String.join(", ", spec.allowedValues()) + ")");
                }
            }
            case STRING -> {
                // Any literal is compared by its text
            }
        }
    }

    private static String describeType(FieldType type) {
        return switch (type) {
            case STRING -> "string";
            case ENUM -> "enum";
            case PRIORITY -> "priority";
            case BOOL -> "boolean";
            case DATE -> "date";
        };
    }

    private static String describeOperators(FieldType type) {
        StringBuilder sb = new StringBuilder();
        for (CompareExpr.Operator operator : type.operators()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(operator.symbol());
        }
        return sb.toString();
    }
}
