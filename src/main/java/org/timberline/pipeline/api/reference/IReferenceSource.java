package org.timberline.pipeline.api.reference;

import java.io.IOException;
import java.util.Set;

/**
 * Backing store of named reference surfaces.
 * <p>
 * Surfaces are read per name and per day block so that a run only touches the
 * surfaces it needs, and only the blocks it actually uses.
 */
public interface IReferenceSource {

    /**
     * Lists the names of all stored surfaces.
     *
     * @return surface names, possibly empty
     * @throws IOException if the store cannot be listed
     */
    Set<String> availableSurfaces() throws IOException;

    /**
     * Reads the layout of one surface without reading its values.
     *
     * @param name surface name
     * @return the layout
     * @throws IOException if the surface does not exist or its description is unreadable
     */
    SurfaceLayout describe(String name) throws IOException;

    /**
     * Reads one day block of a surface.
     *
     * @param name  surface name
     * @param block zero-based block index, below {@link SurfaceLayout#blockCount()}
     * @return a surface holding the block's days only
     * @throws IOException if the block cannot be read
     */
    ReferenceSurface readBlock(String name, int block) throws IOException;
}
