package org.timberline.pipeline.resources.storage;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.timberline.pipeline.api.contracts.GridArtifact;
import org.timberline.pipeline.api.contracts.GridVariableData;
import org.timberline.pipeline.api.contracts.TileBounds;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.GridVariable;
import org.timberline.pipeline.api.grid.IndexRange;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.resources.storage.DecodedArtifact;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import com.google.protobuf.InvalidProtocolBufferException;

/**
 * Encodes {@link GridDataset}s to the artifact file format and back.
 * <p>
 * File layout:
 * <pre>
 *   bytes 0-3   magic "TMBR"
 *   byte  4     compression (0 = none, 1 = zstd)
 *   bytes 5-8   uncompressed payload length (big endian)
 *   bytes 9-    payload: a {@link GridArtifact} protobuf message
 * </pre>
 * Float values are stored as raw IEEE bits, so every value, including NaN fill
 * values, survives a round trip unchanged.
 * <p>
 * Instances are immutable and thread-safe. Decoding detects the compression from the
 * header, so any codec can read any artifact.
 */
public final class ArtifactCodec {

    public static final int FORMAT_VERSION = 1;

    private static final byte[] MAGIC = {'T', 'M', 'B', 'R'};
    private static final int HEADER_SIZE = MAGIC.length + 1 + Integer.BYTES;

    /**
     * Payload compression.
     */
    public enum Compression {
        NONE((byte) 0),
        ZSTD((byte) 1);

        private final byte id;

        Compression(byte id) {
            this.id = id;
        }

        static Compression fromId(byte id) throws ArtifactIOException {
            for (Compression compression : values()) {
                if (compression.id == id) {
                    return compression;
                }
            }
            throw new ArtifactIOException("Unknown artifact compression id: " + id, false);
        }

        /**
         * Parses a configuration value such as {@code zstd} or {@code none}.
         */
        public static Compression parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Compression compression;
    private final int level;

    public ArtifactCodec(Compression compression, int level) {
        this.compression = compression;
        this.level = level;
    }

    public static ArtifactCodec uncompressed() {
        return new ArtifactCodec(Compression.NONE, 0);
    }

    public Compression compression() {
        return compression;
    }

    public byte[] encode(String name, GridDataset dataset, TileSpec tile) {
        GridArtifact.Builder builder = GridArtifact.newBuilder()
            .setName(name)
            .setFormatVersion(FORMAT_VERSION)
            .setFillValue(dataset.fillValue())
            .putAllAttributes(dataset.attributes());

        if (tile != null) {
            builder.setTile(TileBounds.newBuilder()
                .setTileName(tile.name())
                .setLatStart(tile.latRange().start())
                .setLatEnd(tile.latRange().end())
                .setLonStart(tile.lonRange().start())
                .setLonEnd(tile.lonRange().end()));
        }
        for (double value : dataset.lat()) {
            builder.addLat(value);
        }
        for (double value : dataset.lon()) {
            builder.addLon(value);
        }
        for (long value : dataset.time()) {
            builder.addTime(value);
        }
        for (GridVariable variable : dataset.variables()) {
            GridVariableData.Builder data = GridVariableData.newBuilder()
                .setName(variable.name())
                .putAllAttributes(variable.attributes());
            for (float value : variable.toArray()) {
                data.addValues(value);
            }
            builder.addVariables(data);
        }

        byte[] payload = builder.build().toByteArray();
        byte[] body = compression == Compression.ZSTD ? Zstd.compress(payload, level) : payload;

        ByteBuffer out = ByteBuffer.allocate(HEADER_SIZE + body.length);
        out.put(MAGIC);
        out.put(compression.id);
        out.putInt(payload.length);
        out.put(body);
        return out.array();
    }

    public DecodedArtifact decode(byte[] bytes) throws ArtifactIOException {
        if (bytes.length < HEADER_SIZE || !Arrays.equals(Arrays.copyOf(bytes, MAGIC.length), MAGIC)) {
            throw new ArtifactIOException("Not an artifact file (bad magic header)", false);
        }
        ByteBuffer in = ByteBuffer.wrap(bytes);
        in.position(MAGIC.length);
        Compression stored = Compression.fromId(in.get());
        int payloadLength = in.getInt();
        if (payloadLength < 0) {
            throw new ArtifactIOException("Corrupt artifact header: negative payload length " + payloadLength, false);
        }
        byte[] body = Arrays.copyOfRange(bytes, HEADER_SIZE, bytes.length);

        byte[] payload;
        try {
            payload = stored == Compression.ZSTD ? Zstd.decompress(body, payloadLength) : body;
        } catch (ZstdException e) {
            throw new ArtifactIOException("Corrupt artifact payload: " + e.getMessage(), e, false);
        }
        if (payload.length != payloadLength) {
            throw new ArtifactIOException("Truncated artifact: expected " + payloadLength
                + " payload bytes, got " + payload.length, false);
        }

        GridArtifact artifact;
        try {
            artifact = GridArtifact.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            throw new ArtifactIOException("Corrupt artifact payload: " + e.getMessage(), e, false);
        }
        if (artifact.getFormatVersion() > FORMAT_VERSION) {
            throw new ArtifactIOException("Unsupported artifact format version " + artifact.getFormatVersion(), false);
        }
        try {
            return toDecoded(artifact);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ArtifactIOException("Corrupt artifact contents: " + e.getMessage(), e, false);
        }
    }

    private static DecodedArtifact toDecoded(GridArtifact artifact) {
        double[] lat = new double[artifact.getLatCount()];
        for (int i = 0; i < lat.length; i++) {
            lat[i] = artifact.getLat(i);
        }
        double[] lon = new double[artifact.getLonCount()];
        for (int i = 0; i < lon.length; i++) {
            lon[i] = artifact.getLon(i);
        }
        long[] time = new long[artifact.getTimeCount()];
        for (int i = 0; i < time.length; i++) {
            time[i] = artifact.getTime(i);
        }

        List<GridVariable> variables = new ArrayList<>(artifact.getVariablesCount());
        for (GridVariableData data : artifact.getVariablesList()) {
            float[] values = new float[data.getValuesCount()];
            for (int i = 0; i < values.length; i++) {
                values[i] = data.getValues(i);
            }
            variables.add(new GridVariable(data.getName(), time.length, lat.length, lon.length,
                values, sorted(data.getAttributesMap())));
        }
        GridDataset dataset = new GridDataset(lat, lon, time, artifact.getFillValue(), variables,
            sorted(artifact.getAttributesMap()));

        TileSpec tile = null;
        if (artifact.hasTile()) {
            TileBounds bounds = artifact.getTile();
            tile = new TileSpec(bounds.getTileName(),
                new IndexRange(bounds.getLatStart(), bounds.getLatEnd()),
                new IndexRange(bounds.getLonStart(), bounds.getLonEnd()));
        }
        return new DecodedArtifact(artifact.getName(), artifact.getFormatVersion(), tile, dataset);
    }

    private static Map<String, String> sorted(Map<String, String> attributes) {
        return new TreeMap<>(attributes);
    }
}
