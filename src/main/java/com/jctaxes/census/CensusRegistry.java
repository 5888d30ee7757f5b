package com.jctaxes.census;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * The census blocks and wards of the city, loaded once per run and never modified. Iteration order of both lists is
 * the order of the source files, which is also the order of output features.
 */
public class CensusRegistry {

    public final List<CensusBlock> blocks;

    public final List<Ward> wards;

    private final Map<String, Ward> wardsById;

    public CensusRegistry (List<CensusBlock> blocks, List<Ward> wards) {
        this.blocks = ImmutableList.copyOf(blocks);
        this.wards = ImmutableList.copyOf(wards);
        ImmutableMap.Builder<String, Ward> builder = ImmutableMap.builder();
        for (Ward ward : wards) {
            builder.put(ward.id, ward);
        }
        this.wardsById = builder.build();
    }

    /** @return the ward with the given identifier, or null if there is none. */
    public Ward getWard (String wardId) {
        return wardId == null ? null : wardsById.get(wardId);
    }

}
