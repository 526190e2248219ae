package org.schemaforge.extract;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.schemaforge.model.ParsedColumn;
import org.schemaforge.model.ParsedSchema;
import org.schemaforge.naming.CaseConverter;

import java.util.List;
import java.util.Optional;

/**
 * Reads the declarative builder syntax:
 * <pre>{@code
 * model("User")
 *     .tableName("users")
 *     .primaryKey(PrimaryKeyDef.of("id").i32())
 *     .column(ColumnDef.of("email").string().unique())
 *     .foreignKey(ForeignKeyDef.of("team_id").references("teams").onDelete(Action.CASCADE))
 *     .index(IndexDef.of("idx_users_email", "email"))
 *     .build();
 * }</pre>
 * Only the first chain that ends in {@code build()} is read.
 */
public class BuilderChainSource implements SchemaSource {

    @Override
    public Optional<ParsedSchema> extract(String source) {
        Optional<CompilationUnit> unit = CallExpressions.parse(source);
        if (unit.isEmpty()) {
            return Optional.empty();
        }

        for (MethodCallExpr call : unit.get().findAll(MethodCallExpr.class)) {
            List<MethodCallExpr> chain = CallExpressions.chainOf(call);
            boolean hasBuild = chain.stream().anyMatch(c -> c.getNameAsString().equals("build"));
            if (hasBuild) {
                Optional<ParsedSchema> schema = readChain(chain);
                if (schema.isPresent()) {
                    return schema;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ParsedSchema> readChain(List<MethodCallExpr> chain) {
        String modelTable = null;
        String explicitTable = null;
        ParsedSchema.ParsedSchemaBuilder builder = ParsedSchema.builder();

        for (MethodCallExpr call : chain) {
            String method = call.getNameAsString();
            if (method.equals("model")) {
                modelTable = CallExpressions.firstStringArg(call).map(CaseConverter::toSnakeCase).orElse(modelTable);
                continue;
            }
            if (method.equals("tableName")) {
                explicitTable = CallExpressions.firstStringArg(call).orElse(explicitTable);
                continue;
            }
            if (call.getArguments().isEmpty()) {
                continue;
            }

            Expression arg = call.getArgument(0);
            switch (method) {
                case "primaryKey" -> primaryKey(arg).ifPresent(builder::primaryKey);
                case "column" -> column(arg).ifPresent(builder::column);
                case "foreignKey" -> CallExpressions.foreignKey(arg).ifPresent(builder::foreignKey);
                case "index" -> CallExpressions.index(arg).ifPresent(builder::index);
                default -> {
                }
            }
        }

        String table = explicitTable != null ? explicitTable : modelTable;
        if (table == null || table.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(builder.tableName(table).build());
    }

    private Optional<ParsedColumn> primaryKey(Expression arg) {
        return CallExpressions.firstString(arg).map(name -> ParsedColumn.builder()
                .name(name)
                .type(TypeTokens.fromPrimaryKey(CallExpressions.methodNames(arg)))
                .nullable(false)
                .build());
    }

    private Optional<ParsedColumn> column(Expression arg) {
        List<String> methods = CallExpressions.methodNames(arg);
        return CallExpressions.firstString(arg).map(name -> ParsedColumn.builder()
                .name(name)
                .type(TypeTokens.fromBuilder(methods))
                .nullable(methods.contains("nullable") || methods.contains("autoNow") || methods.contains("autoNowUpdate"))
                .unique(methods.contains("unique"))
                .ignored(methods.contains("ignored"))
                .build());
    }

    @Override
    public String name() {
        return "builder";
    }
}
