package com.survey.boothsampling.engine;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Finds which column of a layer carries a semantic field.
 * The alias list decides precedence, never the iteration order of the column set.
 */
@Component
public class SchemaResolver {

    public Optional<String> resolve(Collection<String> columns, List<String> aliases) {
        if (columns == null || columns.isEmpty() || aliases == null) {
            return Optional.empty();
        }
        for (String alias : aliases) {
            if (columns.contains(alias)) {
                return Optional.of(alias);
            }
        }
        return Optional.empty();
    }

    public Optional<String> resolve(Collection<String> columns, SemanticField field) {
        return resolve(columns, field.getAliases());
    }
}
