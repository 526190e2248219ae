package org.schemaforge.diff;

import org.schemaforge.model.ParsedIndex;
import org.schemaforge.model.ParsedSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Add/drop comparison of indexes by name. An index whose columns or uniqueness
 * changed is reported as a drop of the old definition plus an add of the new one.
 */
public class IndexDiffer implements TableComponentDiffer {

    @Override
    public void diff(ParsedSchema previous, ParsedSchema current, Changes result) {
        Map<String, ParsedIndex> oldByName = byName(previous);
        Map<String, ParsedIndex> newByName = byName(current);

        oldByName.forEach((name, oldIndex) -> {
            ParsedIndex newIndex = newByName.get(name);
            if (newIndex == null || !newIndex.equals(oldIndex)) {
                result.getDroppedIndexes().add(oldIndex);
            }
        });
        newByName.forEach((name, newIndex) -> {
            ParsedIndex oldIndex = oldByName.get(name);
            if (oldIndex == null || !oldIndex.equals(newIndex)) {
                result.getAddedIndexes().add(newIndex);
            }
        });
    }

    private static Map<String, ParsedIndex> byName(ParsedSchema schema) {
        Map<String, ParsedIndex> indexes = new LinkedHashMap<>();
        schema.getIndexes().forEach(idx -> indexes.putIfAbsent(idx.getName(), idx));
        return indexes;
    }
}
