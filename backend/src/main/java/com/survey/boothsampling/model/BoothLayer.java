package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * All booths of a state, loaded once and validated per region
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoothLayer {
    private String state;
    private String crs;
    private Set<String> columns;
    private List<Booth> booths;

    public boolean hasCrs() {
        return crs != null && !crs.isBlank();
    }

    public boolean isEmpty() {
        return booths == null || booths.isEmpty();
    }
}
