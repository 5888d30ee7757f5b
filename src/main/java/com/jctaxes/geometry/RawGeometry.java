package com.jctaxes.geometry;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A geometry exactly as it arrived from a parcel source, before decoding. Parcel exports mix three encodings in the
 * same column: well-known binary (sometimes hex encoded), GeoJSON text, or geometries a reader has already parsed.
 * The encoding is identified once, when the record is ingested, by {@link #of(Object)}. After that, decoding is a
 * single virtual call and nothing downstream needs to inspect runtime types again.
 */
public abstract class RawGeometry {

    public enum Encoding {
        WELL_KNOWN_BINARY, GEOJSON_TEXT, PARSED
    }

    public abstract Encoding encoding ();

    /**
     * Decode into a JTS geometry.
     * @throws GeometryParseException if the content cannot be decoded or decodes to an empty geometry.
     */
    public abstract Geometry decode (GeometryFactory geometryFactory);

    /**
     * Identify the encoding of a value read from a parcel source.
     * Byte arrays are well-known binary. Strings starting with an opening brace are GeoJSON, other strings are
     * expected to be hex-encoded well-known binary. Already-parsed JTS geometries are wrapped as they are.
     * @throws MissingGeometryException if the value is null or blank.
     * @throws GeometryParseException if the value is of a type that does not correspond to any known encoding.
     */
    public static RawGeometry of (Object value) {
        if (value == null) {
            throw new MissingGeometryException("Record has no geometry.");
        }
        if (value instanceof RawGeometry) {
            return (RawGeometry) value;
        }
        if (value instanceof byte[]) {
            return wellKnownBinary((byte[]) value);
        }
        if (value instanceof Geometry) {
            return parsed((Geometry) value);
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                throw new MissingGeometryException("Record has a blank geometry.");
            }
            if (text.startsWith("{")) {
                return new GeoJsonText(text);
            }
            if (isHex(text)) {
                return wellKnownBinary(WKBReader.hexToBytes(text));
            }
            throw new GeometryParseException("Geometry text is neither GeoJSON nor hex well-known binary.");
        }
        throw new GeometryParseException("Unrecognized geometry encoding " + value.getClass().getSimpleName());
    }

    public static RawGeometry wellKnownBinary (byte[] bytes) {
        return new WellKnownBinary(bytes);
    }

    public static RawGeometry parsed (Geometry geometry) {
        return new Parsed(geometry);
    }

    private static boolean isHex (String text) {
        if (text.length() % 2 != 0) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static Geometry checkNonEmpty (Geometry geometry, Encoding encoding) {
        if (geometry == null || geometry.isEmpty()) {
            throw new GeometryParseException("Decoded " + encoding + " geometry is empty.");
        }
        return geometry;
    }

    public static class WellKnownBinary extends RawGeometry {

        private final byte[] bytes;

        private WellKnownBinary (byte[] bytes) {
            this.bytes = checkNotNull(bytes);
        }

        @Override
        public Encoding encoding () {
            return Encoding.WELL_KNOWN_BINARY;
        }

        @Override
        public Geometry decode (GeometryFactory geometryFactory) {
            Geometry geometry;
            try {
                geometry = new WKBReader(geometryFactory).read(bytes);
            } catch (ParseException | RuntimeException e) {
                // WKBReader signals truncated input with unchecked exceptions as well as ParseException.
                throw new GeometryParseException("Could not decode well-known binary geometry.", e);
            }
            return checkNonEmpty(geometry, encoding());
        }
    }

    public static class GeoJsonText extends RawGeometry {

        private final String json;

        private GeoJsonText (String json) {
            this.json = checkNotNull(json);
        }

        @Override
        public Encoding encoding () {
            return Encoding.GEOJSON_TEXT;
        }

        @Override
        public Geometry decode (GeometryFactory geometryFactory) {
            Geometry geometry;
            try {
                geometry = new GeoJsonReader(geometryFactory).read(json);
            } catch (ParseException | RuntimeException e) {
                throw new GeometryParseException("Could not decode GeoJSON geometry.", e);
            }
            return checkNonEmpty(geometry, encoding());
        }
    }

    public static class Parsed extends RawGeometry {

        private final Geometry geometry;

        private Parsed (Geometry geometry) {
            this.geometry = checkNotNull(geometry);
        }

        @Override
        public Encoding encoding () {
            return Encoding.PARSED;
        }

        @Override
        public Geometry decode (GeometryFactory geometryFactory) {
            return checkNonEmpty(geometry, encoding());
        }
    }

}
