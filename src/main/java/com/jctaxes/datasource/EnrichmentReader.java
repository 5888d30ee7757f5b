package com.jctaxes.datasource;

import com.csvreader.CsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/** Reads the optional enrichment CSV with columns key, addr, owner and streets. Only the key column is required. */
public abstract class EnrichmentReader {

    private static final Logger LOG = LoggerFactory.getLogger(EnrichmentReader.class);

    private static final String[] ATTRIBUTES = { Enrichment.ADDR, Enrichment.OWNER, Enrichment.STREETS };

    public static Enrichment read (File file) {
        Map<String, Map<String, String>> attributesByKey = new HashMap<>();
        try (InputStream inputStream = new FileInputStream(file)) {
            CsvReader reader = new CsvReader(inputStream, ',', StandardCharsets.UTF_8);
            CsvColumns columns = new CsvColumns(reader, file);
            int keyCol = columns.required("key");
            int[] attributeCols = new int[ATTRIBUTES.length];
            for (int a = 0; a < ATTRIBUTES.length; a++) {
                attributeCols[a] = columns.optional(ATTRIBUTES[a]);
            }
            while (reader.readRecord()) {
                String key = columns.get(keyCol);
                if (key == null || key.isEmpty()) continue;
                Map<String, String> attributes = new HashMap<>();
                for (int a = 0; a < ATTRIBUTES.length; a++) {
                    String value = columns.get(attributeCols[a]);
                    if (value != null && !value.isEmpty()) {
                        attributes.put(ATTRIBUTES[a], value);
                    }
                }
                attributesByKey.put(key, attributes);
            }
        } catch (IOException e) {
            throw new DataSourceException("Could not read enrichment table " + file, e);
        }
        LOG.info("Read descriptive attributes for {} keys from {}.", attributesByKey.size(), file);
        return new Enrichment(attributesByKey);
    }

}
