package com.survey.boothsampling.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One downloadable region map of the latest run
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MapFileDTO {
    private String code;
    private String name;
    private String filename;
}
