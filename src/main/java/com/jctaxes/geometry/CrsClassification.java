package com.jctaxes.geometry;

import org.locationtech.jts.geom.Envelope;

/**
 * Result of guessing which reference system a geometry's coordinates are in.
 *
 * This is a heuristic, not metadata: an envelope whose minimum X exceeds a threshold is taken to be planar feet,
 * anything else is taken to be degrees. Near the boundary between the two ranges the guess can be wrong, so rather
 * than guessing silently we flag classifications that contradict themselves on the other axis or fall outside the
 * valid range of the chosen system. Flagged geometries are still processed using the guessed system, but are
 * counted and logged so an operator can look at them.
 */
public class CrsClassification {

    public final ReferenceSystem referenceSystem;

    public final boolean ambiguous;

    /** Human readable reason for the ambiguous flag, null when the classification is unambiguous. */
    public final String reason;

    private CrsClassification (ReferenceSystem referenceSystem, String reason) {
        this.referenceSystem = referenceSystem;
        this.ambiguous = reason != null;
        this.reason = reason;
    }

    public static CrsClassification classify (Envelope envelope, double projectedMinX) {
        if (envelope.getMinX() > projectedMinX) {
            if (envelope.getMinY() <= projectedMinX) {
                return new CrsClassification(ReferenceSystem.PLANAR, String.format(
                    "X looks planar but minimum Y %.3f does not exceed %.0f", envelope.getMinY(), projectedMinX
                ));
            }
            return new CrsClassification(ReferenceSystem.PLANAR, null);
        }
        if (Math.abs(envelope.getMinX()) > 180 || Math.abs(envelope.getMaxX()) > 180
                || Math.abs(envelope.getMinY()) > 90 || Math.abs(envelope.getMaxY()) > 90) {
            return new CrsClassification(ReferenceSystem.GEOGRAPHIC, String.format(
                "treated as degrees but envelope %s is outside longitude/latitude range", envelope
            ));
        }
        return new CrsClassification(ReferenceSystem.GEOGRAPHIC, null);
    }

    @Override
    public String toString () {
        return ambiguous ? referenceSystem + " (ambiguous: " + reason + ")" : referenceSystem.toString();
    }

}
