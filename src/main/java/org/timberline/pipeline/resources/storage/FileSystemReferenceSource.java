package org.timberline.pipeline.resources.storage;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.GridVariable;
import org.timberline.pipeline.api.grid.IndexRange;
import org.timberline.pipeline.api.reference.IReferenceSource;
import org.timberline.pipeline.api.reference.ReferenceSurface;
import org.timberline.pipeline.api.reference.SurfaceLayout;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.tiling.DimensionMismatchException;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;

/**
 * Reference surfaces stored as day blocks on the local file system:
 * <pre>
 *   {rootDirectory}/{surface}/manifest.json
 *   {rootDirectory}/{surface}/block_000.grid
 *   {rootDirectory}/{surface}/block_001.grid
 *   ...
 * </pre>
 * The manifest holds the {@link SurfaceLayout}. Each block is an artifact whose time axis
 * lists the calendar days it covers and whose single variable is named after the surface.
 */
public class FileSystemReferenceSource implements IReferenceSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemReferenceSource.class);

    static final String MANIFEST = "manifest.json";

    private final FileSystemArtifactStore store;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public FileSystemReferenceSource(String name, Config options) {
        this.store = new FileSystemArtifactStore(name, options);
    }

    static String blockFileName(int block) {
        return String.format("block_%03d.grid", block);
    }

    @Override
    public Set<String> availableSurfaces() throws IOException {
        try (Stream<Path> children = Files.list(store.root())) {
            Set<String> names = new TreeSet<>();
            children.filter(dir -> Files.isRegularFile(dir.resolve(MANIFEST)))
                .forEach(dir -> names.add(dir.getFileName().toString()));
            return names;
        }
    }

    @Override
    public SurfaceLayout describe(String name) throws IOException {
        Path manifest = store.root().resolve(name).resolve(MANIFEST);
        try (Reader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
            SurfaceLayout layout = gson.fromJson(reader, SurfaceLayout.class);
            if (layout == null) {
                throw new ArtifactIOException("Empty manifest for reference surface '" + name + "'", false);
            }
            return layout;
        } catch (NoSuchFileException e) {
            throw new ArtifactIOException("Unknown reference surface '" + name + "'", e, false);
        } catch (JsonParseException e) {
            throw new ArtifactIOException("Corrupt manifest for reference surface '" + name + "': "
                + e.getMessage(), e, false);
        }
    }

    @Override
    public ReferenceSurface readBlock(String name, int block) throws IOException {
        SurfaceLayout layout = describe(name);
        if (block < 0 || block >= layout.blockCount()) {
            throw new IllegalArgumentException("Block " + block + " out of range for surface '" + name
                + "' with " + layout.blockCount() + " blocks");
        }
        Path file = store.root().resolve(name).resolve(blockFileName(block));
        GridDataset dataset = store.read(file).dataset();
        GridVariable variable = dataset.variable(name);
        if (variable == null) {
            throw new ArtifactIOException("Block " + file + " has no variable '" + name + "'", false);
        }
        int days = layout.daysInBlock(block);
        if (variable.timeCount() != days || variable.latCount() != layout.latCount()
                || variable.lonCount() != layout.lonCount()) {
            throw new DimensionMismatchException("reference block " + file.getFileName() + " of '" + name + "'",
                "(" + days + ", " + layout.latCount() + ", " + layout.lonCount() + ")",
                "(" + variable.timeCount() + ", " + variable.latCount() + ", " + variable.lonCount() + ")");
        }
        log.debug("Read block {} of reference surface '{}'", block, name);
        return new ReferenceSurface(name, days, layout.latCount(), layout.lonCount(),
            variable.toArray(), layout.units());
    }

    /**
     * Stores a complete surface, split into blocks of {@code daysPerBlock} calendar days.
     * Blocks are written before the manifest, so a surface only becomes visible once it
     * is complete.
     *
     * @param surface      the surface to store
     * @param daysPerBlock calendar days per block
     * @return the layout that was written
     * @throws IOException if any file cannot be written
     */
    public SurfaceLayout write(ReferenceSurface surface, int daysPerBlock) throws IOException {
        SurfaceLayout layout = new SurfaceLayout(surface.name(), surface.dayCount(), surface.latCount(),
            surface.lonCount(), daysPerBlock, surface.units());
        double[] lat = indexCoordinates(layout.latCount());
        double[] lon = indexCoordinates(layout.lonCount());
        IndexRange latRange = new IndexRange(0, layout.latCount());
        IndexRange lonRange = new IndexRange(0, layout.lonCount());
        int cells = layout.latCount() * layout.lonCount();
        Map<String, String> attributes = surface.units() == null
            ? Map.of()
            : Map.of(GridVariable.ATTR_UNITS, surface.units());

        for (int block = 0; block < layout.blockCount(); block++) {
            int first = layout.firstDayOf(block);
            int days = layout.daysInBlock(block);
            long[] time = new long[days];
            float[] values = new float[days * cells];
            for (int d = 0; d < days; d++) {
                time[d] = first + d;
                surface.copyWindow(first + d, latRange, lonRange, values, d);
            }
            GridVariable variable = new GridVariable(surface.name(), days, layout.latCount(), layout.lonCount(),
                values, attributes);
            store.write(surface.name() + "/" + blockFileName(block), surface.name(),
                new GridDataset(lat, lon, time, GridDataset.DEFAULT_FILL_VALUE, List.of(variable), Map.of()), null);
        }

        Path manifest = store.root().resolve(surface.name()).resolve(MANIFEST);
        Files.writeString(manifest, gson.toJson(layout), StandardCharsets.UTF_8);
        log.debug("Stored reference surface '{}' in {} block(s)", surface.name(), layout.blockCount());
        return layout;
    }

    private static double[] indexCoordinates(int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = i;
        }
        return values;
    }
}
