package com.survey.boothsampling.engine;

import java.util.List;

/**
 * Attribute columns the sampler understands, each with its known spellings in source files.
 * Alias order is the resolution order.
 */
public enum SemanticField {
    STATE("state", "STATE", "st_name", "ST_NAME"),
    DISTRICT("district", "DISTRICT", "dist", "DIST"),
    DISTRICT_NAME("district_n", "DISTRICT_N", "dist_name", "DIST_NAME"),
    PC_CODE("pc", "PC", "pc_no", "PC_NO"),
    PC_NAME("pc_name", "PC_NAME"),
    AC_CODE("ac", "AC", "ac_no", "AC_NO"),
    AC_NAME("ac_name", "AC_NAME"),
    BOOTH_CODE("booth", "booth_no", "BOOTH_NO", "BOOTH"),
    BOOTH_NAME("booth_name", "BOOTH_NAME", "name", "NAME"),

    // Region layer columns
    REGION_CODE("ac_no", "pc_no", "ac", "pc", "AC_NO", "PC_NO", "AC", "PC"),
    REGION_NAME("ac_name", "pc_name", "name", "AC_NAME", "PC_NAME", "NAME");

    private final List<String> aliases;

    SemanticField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> getAliases() {
        return aliases;
    }
}
