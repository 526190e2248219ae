package org.schemaforge.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import org.schemaforge.model.ParsedForeignKey;
import org.schemaforge.model.ParsedIndex;
import org.schemaforge.model.ReferentialAction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Pattern-matching helpers over JavaParser call expressions shared by both front-ends.
 */
final class CallExpressions {

    private static final String ALIAS = "Alias";

    private CallExpressions() {
    }

    /**
     * Parses a compilation unit; syntax errors yield empty instead of an exception.
     */
    static Optional<CompilationUnit> parse(String source) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful()) {
            return Optional.empty();
        }
        return result.getResult();
    }

    /**
     * {@code a().b().c()} -> {@code [a(), b(), c()]}, innermost receiver first.
     */
    static List<MethodCallExpr> chainOf(Expression expr) {
        List<MethodCallExpr> chain = new ArrayList<>();
        Expression current = expr;
        while (current instanceof MethodCallExpr call) {
            chain.add(call);
            current = call.getScope().orElse(null);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Every method name called anywhere inside {@code expr}, receivers and arguments included.
     */
    static List<String> methodNames(Expression expr) {
        List<String> names = new ArrayList<>();
        expr.findAll(MethodCallExpr.class).forEach(call -> names.add(call.getNameAsString()));
        return names;
    }

    static Optional<String> firstStringArg(MethodCallExpr call) {
        if (call.getArguments().isEmpty()) {
            return Optional.empty();
        }
        Expression first = call.getArgument(0);
        if (first instanceof StringLiteralExpr literal) {
            return Optional.of(literal.asString());
        }
        return Optional.empty();
    }

    /**
     * First string literal met while walking receivers before arguments.
     */
    static Optional<String> firstString(Expression expr) {
        List<String> strings = allStrings(expr);
        return strings.isEmpty() ? Optional.empty() : Optional.of(strings.get(0));
    }

    /**
     * String literals in evaluation order, receivers before arguments.
     */
    static List<String> allStrings(Expression expr) {
        List<String> result = new ArrayList<>();
        collectStrings(expr, result);
        return result;
    }

    private static void collectStrings(Expression expr, List<String> result) {
        if (expr instanceof StringLiteralExpr literal) {
            result.add(literal.asString());
        } else if (expr instanceof MethodCallExpr call) {
            call.getScope().ifPresent(scope -> collectStrings(scope, result));
            call.getArguments().forEach(arg -> collectStrings(arg, result));
        } else if (expr instanceof ObjectCreationExpr creation) {
            creation.getArguments().forEach(arg -> collectStrings(arg, result));
        }
    }

    /**
     * Value of {@code Alias.of("x")} or {@code new Alias("x")} when {@code expr} is exactly that.
     */
    static Optional<String> aliasValue(Expression expr) {
        if (expr instanceof MethodCallExpr call
                && call.getScope().filter(s -> s instanceof NameExpr n && n.getNameAsString().equals(ALIAS)).isPresent()) {
            return firstStringArg(call);
        }
        if (expr instanceof ObjectCreationExpr creation
                && creation.getType().getNameAsString().equals(ALIAS)
                && creation.getArguments().isNonEmpty()
                && creation.getArgument(0) instanceof StringLiteralExpr literal) {
            return Optional.of(literal.asString());
        }
        return Optional.empty();
    }

    /**
     * First alias value found anywhere inside {@code expr}.
     */
    static Optional<String> findAliasValue(Expression expr) {
        Optional<String> direct = aliasValue(expr);
        if (direct.isPresent()) {
            return direct;
        }
        if (expr instanceof MethodCallExpr call) {
            if (call.getScope().isPresent()) {
                Optional<String> fromScope = findAliasValue(call.getScope().get());
                if (fromScope.isPresent()) {
                    return fromScope;
                }
            }
            for (Expression arg : call.getArguments()) {
                Optional<String> fromArg = findAliasValue(arg);
                if (fromArg.isPresent()) {
                    return fromArg;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Column name of a column expression: an alias when there is one, else the first string.
     */
    static Optional<String> columnName(Expression expr) {
        return findAliasValue(expr).or(() -> firstString(expr));
    }

    static Optional<MethodCallExpr> findCall(Expression expr, String methodName) {
        return expr.findFirst(MethodCallExpr.class, call -> call.getNameAsString().equals(methodName));
    }

    /**
     * Resolves the action passed to {@code onDelete(...)} / {@code onUpdate(...)} inside {@code expr}.
     */
    static ReferentialAction action(Expression expr, String methodName) {
        return findCall(expr, methodName)
                .filter(call -> call.getArguments().isNonEmpty())
                .map(call -> actionValue(call.getArgument(0)))
                .orElse(ReferentialAction.NO_ACTION);
    }

    static ReferentialAction actionValue(Expression arg) {
        if (arg instanceof FieldAccessExpr field) {
            return ReferentialAction.fromIdentifier(field.getNameAsString());
        }
        if (arg instanceof NameExpr name) {
            return ReferentialAction.fromIdentifier(name.getNameAsString());
        }
        if (arg instanceof StringLiteralExpr literal) {
            return ReferentialAction.fromIdentifier(literal.asString());
        }
        return ReferentialAction.NO_ACTION;
    }

    /**
     * Reads a foreign key in either supported call shape:
     * {@code ForeignKey.create().from(t, c).to(t2, c2)} or
     * {@code ForeignKeyDef.of("c").references("t2", "c2")}.
     */
    static Optional<ParsedForeignKey> foreignKey(Expression expr) {
        List<MethodCallExpr> chain = chainOf(expr);
        boolean statementShape = chain.stream().anyMatch(c -> c.getNameAsString().equals("from"))
                && chain.stream().anyMatch(c -> c.getNameAsString().equals("to"));
        return statementShape ? statementForeignKey(chain) : referencesForeignKey(expr);
    }

    private static Optional<ParsedForeignKey> statementForeignKey(List<MethodCallExpr> chain) {
        String fromColumn = null;
        String toTable = null;
        String toColumn = null;
        ReferentialAction onDelete = ReferentialAction.NO_ACTION;
        ReferentialAction onUpdate = ReferentialAction.NO_ACTION;

        for (MethodCallExpr call : chain) {
            switch (call.getNameAsString()) {
                case "from" -> {
                    if (call.getArguments().size() >= 2) {
                        fromColumn = aliasValue(call.getArgument(1)).orElse(null);
                    }
                }
                case "to" -> {
                    if (call.getArguments().size() >= 2) {
                        toTable = aliasValue(call.getArgument(0)).orElse(null);
                        toColumn = aliasValue(call.getArgument(1)).orElse(null);
                    }
                }
                case "onDelete" -> {
                    if (call.getArguments().isNonEmpty()) {
                        onDelete = actionValue(call.getArgument(0));
                    }
                }
                case "onUpdate" -> {
                    if (call.getArguments().isNonEmpty()) {
                        onUpdate = actionValue(call.getArgument(0));
                    }
                }
                default -> {
                }
            }
        }

        if (fromColumn == null || toTable == null) {
            return Optional.empty();
        }
        return Optional.of(ParsedForeignKey.builder()
                .fromColumn(fromColumn)
                .toTable(toTable)
                .toColumn(toColumn != null ? toColumn : "id")
                .onDelete(onDelete)
                .onUpdate(onUpdate)
                .build());
    }

    private static Optional<ParsedForeignKey> referencesForeignKey(Expression expr) {
        String fromColumn = columnName(stripReferences(expr)).orElse("");
        String toTable = "";
        String toColumn = "id";

        Optional<MethodCallExpr> references = findCall(expr, "references");
        if (references.isPresent()) {
            List<String> target = new ArrayList<>();
            references.get().getArguments().forEach(arg -> target.addAll(allStrings(arg)));
            if (!target.isEmpty()) {
                toTable = target.get(0);
            }
            if (target.size() > 1) {
                toColumn = target.get(1);
            }
        }

        return Optional.of(ParsedForeignKey.builder()
                .fromColumn(fromColumn)
                .toTable(toTable)
                .toColumn(toColumn)
                .onDelete(action(expr, "onDelete"))
                .onUpdate(action(expr, "onUpdate"))
                .build());
    }

    /**
     * The part of a references-style chain that names the local column.
     */
    private static Expression stripReferences(Expression expr) {
        for (MethodCallExpr call : chainOf(expr)) {
            if (call.getNameAsString().equals("references")) {
                return call.getScope().orElse(expr);
            }
        }
        return expr;
    }

    /**
     * Reads an index in either supported call shape:
     * {@code Index.create().name("n").col(Alias.of("c")).unique()} or
     * {@code IndexDef.of("n", "c1", "c2").unique()}.
     */
    static Optional<ParsedIndex> index(Expression expr) {
        List<MethodCallExpr> chain = chainOf(expr);
        boolean statementShape = chain.stream().anyMatch(c -> c.getNameAsString().equals("name"));
        boolean unique = methodNames(expr).contains("unique");

        if (statementShape) {
            String name = null;
            List<String> columns = new ArrayList<>();
            for (MethodCallExpr call : chain) {
                switch (call.getNameAsString()) {
                    case "name" -> name = firstStringArg(call).orElse(name);
                    case "col" -> {
                        if (call.getArguments().isNonEmpty()) {
                            columnName(call.getArgument(0)).ifPresent(columns::add);
                        }
                    }
                    default -> {
                    }
                }
            }
            if (name == null) {
                return Optional.empty();
            }
            return Optional.of(ParsedIndex.builder().name(name).columns(columns).unique(unique).build());
        }

        List<String> strings = allStrings(expr);
        if (strings.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ParsedIndex.builder()
                .name(strings.get(0))
                .columns(new ArrayList<>(strings.subList(1, strings.size())))
                .unique(unique)
                .build());
    }
}
