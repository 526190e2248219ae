package org.schemaforge.classify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.diff.Changes;
import org.schemaforge.model.ColumnType;
import org.schemaforge.model.ParsedColumn;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DestructiveChangeClassifierTest {

    private final DestructiveChangeClassifier classifier = new DestructiveChangeClassifier();

    private static ParsedColumn column(String name, ColumnType type, boolean nullable) {
        return ParsedColumn.builder().name(name).type(type).nullable(nullable).build();
    }

    @Test
    @DisplayName("Any type change is destructive")
    void typeChange() {
        assertThat(classifier.isDestructive(column("age", ColumnType.INTEGER, true), column("age", ColumnType.STRING, true)))
                .isTrue();
        assertThat(classifier.classify(column("age", ColumnType.INTEGER, false), column("age", ColumnType.BIG_INTEGER, true)))
                .contains(DestructiveChange.Kind.TYPE_CHANGE);
    }

    @Test
    @DisplayName("Nullable to required under the same type is destructive")
    void nullableToRequired() {
        assertThat(classifier.classify(column("bio", ColumnType.TEXT, true), column("bio", ColumnType.TEXT, false)))
                .contains(DestructiveChange.Kind.NULLABLE_TO_REQUIRED);
    }

    @Test
    @DisplayName("Relaxing to nullable or toggling uniqueness is safe")
    void safeChanges() {
        assertThat(classifier.isDestructive(column("bio", ColumnType.TEXT, false), column("bio", ColumnType.TEXT, true)))
                .isFalse();
        ParsedColumn email = column("email", ColumnType.STRING, false);
        assertThat(classifier.isDestructive(email, email.toBuilder().unique(true).build())).isFalse();
    }

    @Test
    @DisplayName("Aggregation lists type changes before nullability narrowing")
    void aggregateOrder() {
        Changes users = Changes.builder().tableName("users").build();
        users.getModifiedColumns().add(Changes.ColumnChange.of(
                column("bio", ColumnType.TEXT, true), column("bio", ColumnType.TEXT, false)));
        Changes posts = Changes.builder().tableName("posts").build();
        posts.getModifiedColumns().add(Changes.ColumnChange.of(
                column("views", ColumnType.INTEGER, false), column("views", ColumnType.BIG_INTEGER, false)));
        posts.getModifiedColumns().add(Changes.ColumnChange.of(
                column("title", ColumnType.STRING, false), column("title", ColumnType.STRING, true)));

        List<DestructiveChange> result = classifier.classify(List.of(users, posts));

        assertThat(result).extracting(DestructiveChange::toString).containsExactly(
                "posts.views: type INTEGER -> BIG_INTEGER",
                "users.bio: nullable -> not_null (requires a default or backfill)");
    }
}
