package org.schemaforge.diff;

import org.schemaforge.model.ParsedForeignKey;
import org.schemaforge.model.ParsedSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Add/drop comparison of foreign keys keyed by {@link ParsedForeignKey#key()}.
 * There is no modified state: a changed foreign key is dropped and added again.
 */
public class ForeignKeyDiffer implements TableComponentDiffer {

    @Override
    public void diff(ParsedSchema previous, ParsedSchema current, Changes result) {
        Map<String, ParsedForeignKey> oldByKey = byKey(previous);
        Map<String, ParsedForeignKey> newByKey = byKey(current);

        oldByKey.forEach((key, oldFk) -> {
            ParsedForeignKey newFk = newByKey.get(key);
            if (newFk == null || !newFk.equals(oldFk)) {
                result.getDroppedForeignKeys().add(oldFk);
            }
        });
        newByKey.forEach((key, newFk) -> {
            ParsedForeignKey oldFk = oldByKey.get(key);
            if (oldFk == null || !oldFk.equals(newFk)) {
                result.getAddedForeignKeys().add(newFk);
            }
        });
    }

    private static Map<String, ParsedForeignKey> byKey(ParsedSchema schema) {
        Map<String, ParsedForeignKey> fks = new LinkedHashMap<>();
        schema.getForeignKeys().forEach(fk -> fks.putIfAbsent(fk.key(), fk));
        return fks;
    }
}
