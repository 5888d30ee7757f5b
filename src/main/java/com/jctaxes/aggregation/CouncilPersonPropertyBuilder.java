package com.jctaxes.aggregation;

import com.jctaxes.census.CensusRegistry;
import com.jctaxes.census.Ward;

/** Names the council person of a ward result, whose key is the ward identifier. */
public class CouncilPersonPropertyBuilder implements PropertyBuilder {

    public static final String COUNCIL_PERSON = "council_person";

    private final CensusRegistry registry;

    public CouncilPersonPropertyBuilder (CensusRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void addProperties (AggregateResult result) {
        Ward ward = registry.getWard(result.key);
        if (ward != null) {
            result.withAttribute(COUNCIL_PERSON, ward.councilPerson);
        }
    }

}
