package com.jctaxes.datasource;

import com.jctaxes.geometry.GeometryParseException;
import com.jctaxes.geometry.MissingGeometryException;
import com.jctaxes.geometry.RawGeometry;

/**
 * One row from the parcel source: a piece of geometry with the block, lot and (for condominium units) qualifier it
 * belongs to. A single lot may be represented by many fragments, one per unit.
 */
public class ParcelFragment {

    public final String block;

    public final String lot;

    /** Unit qualifier such as C0001, or null for the lot as a whole. */
    public final String qualifier;

    /** Null when the source row had no geometry, or a geometry in an unrecognized encoding. */
    public final RawGeometry rawGeometry;

    /** Why the source geometry could not be identified, or null if it was identified or absent. */
    public final String geometryError;

    public ParcelFragment (String block, String lot, String qualifier, RawGeometry rawGeometry) {
        this(block, lot, qualifier, rawGeometry, null);
    }

    private ParcelFragment (String block, String lot, String qualifier, RawGeometry rawGeometry, String geometryError) {
        this.block = clean(block);
        this.lot = clean(lot);
        this.qualifier = clean(qualifier);
        this.rawGeometry = rawGeometry;
        this.geometryError = geometryError;
    }

    /**
     * Identify the encoding of a geometry value as read from the source. A value in no known encoding does not stop
     * ingestion: the fragment is kept, marked unparseable, so that its whole lot can be dropped later.
     */
    public static ParcelFragment fromSourceValue (String block, String lot, String qualifier, Object geometryValue) {
        try {
            return new ParcelFragment(block, lot, qualifier, RawGeometry.of(geometryValue), null);
        } catch (MissingGeometryException e) {
            return new ParcelFragment(block, lot, qualifier, null, null);
        } catch (GeometryParseException e) {
            return new ParcelFragment(block, lot, qualifier, null, e.getMessage());
        }
    }

    /** Identifiers are compared after trimming. Blank values are treated as absent. */
    static String clean (String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString () {
        return String.format("parcel %s-%s-%s", block, lot, qualifier == null ? "" : qualifier);
    }

}
