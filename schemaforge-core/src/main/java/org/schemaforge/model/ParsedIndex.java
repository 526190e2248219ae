package org.schemaforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ParsedIndex {
    private String name;
    @Builder.Default private List<String> columns = new ArrayList<>();
    @Builder.Default private boolean unique = false;
}
