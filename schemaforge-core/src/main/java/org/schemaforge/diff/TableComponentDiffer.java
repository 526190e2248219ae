package org.schemaforge.diff;

import org.schemaforge.model.ParsedSchema;

@FunctionalInterface
public interface TableComponentDiffer {
    void diff(ParsedSchema previous, ParsedSchema current, Changes result);
}
