package com.survey.boothsampling.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegionDTO {
    private String code;
    private String name;

    /**
     * Region list of one state and selection type
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Listing {
        private List<RegionDTO> regions;
        private int count;
    }
}
