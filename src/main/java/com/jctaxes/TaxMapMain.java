package com.jctaxes;

import com.jctaxes.aggregation.AggregationLevel;
import com.jctaxes.datasource.DataSourceException;
import com.jctaxes.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point producing one GeoJSON file:
 * <pre>TaxMapMain config.properties 2024 census-block</pre>
 * Levels are unit, lot, block, census-block and ward.
 */
public abstract class TaxMapMain {

    private static final Logger LOG = LoggerFactory.getLogger(TaxMapMain.class);

    public static void main (String... args) {
        if (args.length != 3) {
            LOG.error("Usage: TaxMapMain <config file> <year> <unit|lot|block|census-block|ward>");
            System.exit(2);
        }
        try {
            int year = Integer.parseInt(args[1]);
            AggregationLevel level = AggregationLevel.fromName(args[2]);
            TaxMapConfig config = TaxMapConfig.fromFile(args[0]);
            new TaxMapPipeline(config).run(year, level);
        } catch (DataSourceException | IllegalArgumentException e) {
            // Problems with the inputs or arguments. The message says what to fix, a stack trace would not help.
            LOG.error(ExceptionUtils.causeChainString(e));
            System.exit(1);
        } catch (Throwable throwable) {
            LOG.error("Unexpected failure, exiting.\n{}", ExceptionUtils.stackTraceString(throwable));
            System.exit(1);
        }
    }

}
