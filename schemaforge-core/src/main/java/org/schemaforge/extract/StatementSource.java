package org.schemaforge.extract;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import org.schemaforge.exception.SchemaExtractionException;
import org.schemaforge.model.ParsedColumn;
import org.schemaforge.model.ParsedSchema;

import java.util.List;
import java.util.Optional;

/**
 * Reads the lower-level statement syntax used by generated migration sources, looking
 * only inside the method named {@code up}:
 * <pre>{@code
 * manager.createTable(Table.create().table(Alias.of("users")).ifNotExists()
 *         .col(ColumnDef.of(Alias.of("id")).integer().notNull().primaryKey())
 *         .col(ColumnDef.of(Alias.of("email")).string().notNull().unique()));
 * manager.createIndex(Index.create().name("idx_users_email").table(Alias.of("users")).col(Alias.of("email")));
 * }</pre>
 */
public class StatementSource implements SchemaSource {

    @Override
    public Optional<ParsedSchema> extract(String source) {
        Optional<CompilationUnit> unit = CallExpressions.parse(source);
        if (unit.isEmpty()) {
            return Optional.empty();
        }

        Optional<MethodDeclaration> up = unit.get()
                .findFirst(MethodDeclaration.class, m -> m.getNameAsString().equals("up"));
        if (up.isEmpty() || up.get().getBody().isEmpty()) {
            return Optional.empty();
        }

        Accumulator acc = new Accumulator();
        up.get().getBody().get().accept(new StatementVisitor(), acc);
        if (acc.tableName == null || acc.tableName.isBlank()) {
            throw new SchemaExtractionException("Unable to find table name in migration 'up' method");
        }
        return Optional.of(acc.builder.tableName(acc.tableName).build());
    }

    @Override
    public String name() {
        return "statement";
    }

    private static final class Accumulator {
        private final ParsedSchema.ParsedSchemaBuilder builder = ParsedSchema.builder();
        private String tableName;
    }

    /**
     * Recognized calls are read whole; their arguments are not descended into, so the
     * {@code col} of an index is never taken for a table column. Receivers are visited
     * before arguments to keep source order.
     */
    private static final class StatementVisitor extends VoidVisitorAdapter<Accumulator> {

        @Override
        public void visit(MethodCallExpr call, Accumulator acc) {
            String method = call.getNameAsString();
            call.getScope().ifPresent(scope -> scope.accept(this, acc));
            if (!isRecognized(method) || call.getArguments().isEmpty()) {
                call.getArguments().forEach(a -> a.accept(this, acc));
                return;
            }

            Expression arg = call.getArgument(0);
            switch (method) {
                case "table" -> {
                    if (acc.tableName == null) {
                        acc.tableName = CallExpressions.findAliasValue(arg)
                                .or(() -> CallExpressions.firstString(arg))
                                .orElse(null);
                    }
                }
                case "col" -> column(arg, acc);
                case "foreignKey", "createForeignKey" -> CallExpressions.foreignKey(arg).ifPresent(acc.builder::foreignKey);
                case "index", "createIndex" -> CallExpressions.index(arg).ifPresent(acc.builder::index);
                default -> {
                }
            }
        }

        private static boolean isRecognized(String method) {
            return switch (method) {
                case "table", "col", "foreignKey", "createForeignKey", "index", "createIndex" -> true;
                default -> false;
            };
        }

        private static void column(Expression arg, Accumulator acc) {
            Optional<String> name = CallExpressions.columnName(arg);
            if (name.isEmpty()) {
                return;
            }
            List<String> methods = CallExpressions.methodNames(arg);
            ParsedColumn column = ParsedColumn.builder()
                    .name(name.get())
                    .type(TypeTokens.fromStatement(methods))
                    .nullable(methods.contains("nullable"))
                    .unique(methods.contains("unique"))
                    .build();
            if (methods.contains("primaryKey")) {
                column.setNullable(false);
                acc.builder.primaryKey(column);
            } else {
                acc.builder.column(column);
            }
        }
    }
}
