package com.jctaxes.lots;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import com.jctaxes.datasource.DataSourceException;
import com.jctaxes.output.JsonUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The hand-curated list of omnibus payment groups. This is domain knowledge about one city's billing quirks, so it is
 * kept as a data file beside the configuration rather than in code. A default table is bundled on the classpath.
 */
public class OmnibusTable {

    private static final Logger LOG = LoggerFactory.getLogger(OmnibusTable.class);

    public static final String DEFAULT_RESOURCE = "omnibus-groups.json";

    public static final OmnibusTable EMPTY = new OmnibusTable(List.of());

    public final List<OmnibusGroup> groups;

    public OmnibusTable (List<OmnibusGroup> groups) {
        Set<String> seenSources = new HashSet<>();
        ImmutableList.Builder<OmnibusGroup> copies = ImmutableList.builder();
        for (OmnibusGroup original : groups) {
            checkArgument(original.lots != null, "Omnibus group has no lots: %s", original);
            // Validate and keep a copy, so the caller's group cannot change behind our back.
            OmnibusGroup group = original.immutableCopy();
            checkArgument(group.source != null, "Omnibus group has no source lot: %s", group);
            checkArgument(group.lots.contains(group.source),
                    "Omnibus group lots must include the source lot %s", group.source);
            checkArgument(new HashSet<>(group.lots).size() == group.lots.size(),
                    "Omnibus group for %s lists a lot more than once", group.source);
            checkArgument(seenSources.add(group.source), "Omnibus source lot %s appears twice", group.source);
            copies.add(group);
        }
        this.groups = copies.build();
    }

    public static OmnibusTable fromFile (File file) {
        try (InputStream inputStream = new FileInputStream(file)) {
            return fromStream(inputStream);
        } catch (IOException e) {
            throw new DataSourceException("Could not read omnibus table from " + file, e);
        }
    }

    public static OmnibusTable fromClasspath () {
        URL url = Resources.getResource(OmnibusTable.class, "/" + DEFAULT_RESOURCE);
        try (InputStream inputStream = url.openStream()) {
            return fromStream(inputStream);
        } catch (IOException e) {
            throw new DataSourceException("Could not read bundled omnibus table " + DEFAULT_RESOURCE, e);
        }
    }

    private static OmnibusTable fromStream (InputStream inputStream) throws IOException {
        List<OmnibusGroup> groups = JsonUtilities.objectMapper.readValue(
            inputStream, new TypeReference<List<OmnibusGroup>>() { }
        );
        LOG.info("Loaded {} omnibus payment groups.", groups.size());
        return new OmnibusTable(groups);
    }

    /**
     * Split each source lot's payment evenly across all lots of its group. The split replaces whatever the siblings
     * had on their own, and creates entries for siblings with no payment record. Groups whose source lot has no
     * payment are left alone. The input map is not modified.
     *
     * @param paymentsByLot payments keyed on block-lot
     * @return a new map with the redistributed payments
     */
    public Map<String, Payment> redistribute (Map<String, Payment> paymentsByLot) {
        Map<String, Payment> result = new LinkedHashMap<>(paymentsByLot);
        int applied = 0;
        for (OmnibusGroup group : groups) {
            Payment sourcePayment = paymentsByLot.get(group.source);
            if (sourcePayment == null) {
                LOG.debug("No payment for omnibus source lot {}, leaving group unchanged.", group.source);
                continue;
            }
            Payment share = sourcePayment.dividedBy(group.lots.size());
            for (String lot : group.lots) {
                result.put(lot, share);
            }
            applied += 1;
        }
        LOG.info("Redistributed {} of {} omnibus payment groups.", applied, groups.size());
        return result;
    }

}
