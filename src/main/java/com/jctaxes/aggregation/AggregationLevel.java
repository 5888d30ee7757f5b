package com.jctaxes.aggregation;

/** The granularities at which tax payments can be mapped, with the names used on the command line. */
public enum AggregationLevel {

    UNIT("unit", "-units"),
    LOT("lot", "-lots"),
    BLOCK("block", "-blocks"),
    CENSUS_BLOCK("census-block", "-census-blocks"),
    WARD("ward", "-wards");

    public final String levelName;

    /** Appended to the year in output file names. */
    public final String fileSuffix;

    AggregationLevel (String levelName, String fileSuffix) {
        this.levelName = levelName;
        this.fileSuffix = fileSuffix;
    }

    /** @return e.g. taxes-2024-census-blocks.geojson */
    public String fileName (int year) {
        return "taxes-" + year + fileSuffix + ".geojson";
    }

    /** @throws IllegalArgumentException if the name matches no level. */
    public static AggregationLevel fromName (String name) {
        for (AggregationLevel level : values()) {
            if (level.levelName.equalsIgnoreCase(name) || level.name().equalsIgnoreCase(name)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation level: " + name);
    }

    @Override
    public String toString () {
        return levelName;
    }

}
