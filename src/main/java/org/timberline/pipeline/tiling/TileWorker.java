package org.timberline.pipeline.tiling;

import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.calculator.CalculationError;
import org.timberline.pipeline.api.calculator.CalculationException;
import org.timberline.pipeline.api.calculator.CalculationResult;
import org.timberline.pipeline.api.calculator.ICalculator;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.reference.ReferenceSurface;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.resources.storage.TileArtifactHandle;
import org.timberline.pipeline.api.tiling.DimensionMismatchException;
import org.timberline.pipeline.api.tiling.PartialResultPolicy;
import org.timberline.pipeline.api.tiling.TileComputationFailedException;

/**
 * Computes and persists the result of a single tile.
 * <p>
 * Stateless apart from its policy, so one instance serves all tasks of a scheduler.
 */
public class TileWorker {

    private static final Logger log = LoggerFactory.getLogger(TileWorker.class);

    private final PartialResultPolicy policy;

    public TileWorker(PartialResultPolicy policy) {
        this.policy = policy;
    }

    public PartialResultPolicy getPolicy() {
        return policy;
    }

    /**
     * Slices the chunk input to the tile, runs the Calculator and writes the tile result.
     *
     * @param tile       the tile to compute
     * @param chunkInput full-domain input of the chunk
     * @param references reference surfaces already restricted to the tile
     * @param calculator the Calculator
     * @param scope      cleanup scope the artifact is written through
     * @return handle of the written artifact
     * @throws TileComputationFailedException if the Calculator fails, the policy rejects its
     *                                        partial result, or the artifact cannot be written
     * @throws DimensionMismatchException     if the Calculator returns wrongly shaped arrays
     */
    public TileArtifactHandle process(TileSpec tile, GridDataset chunkInput, Map<String, ReferenceSurface> references,
                                      ICalculator calculator, TileArtifactScope scope)
            throws TileComputationFailedException {
        GridDataset slice = chunkInput.slice(tile);

        CalculationResult result;
        try {
            result = calculator.compute(slice, references);
        } catch (CalculationException e) {
            throw new TileComputationFailedException(tile.name(), e);
        } catch (DimensionMismatchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TileComputationFailedException(tile.name(), e);
        }

        if (result.hasErrors()) {
            if (policy == PartialResultPolicy.FAIL_TILE) {
                TileComputationFailedException failure = new TileComputationFailedException(tile.name(),
                    "calculation errors in " + result.errors().stream()
                        .map(CalculationError::toString)
                        .collect(Collectors.joining("; ")));
                result.errors().stream()
                    .map(CalculationError::cause)
                    .filter(cause -> cause != null)
                    .forEach(failure::addSuppressed);
                throw failure;
            }
            for (CalculationError error : result.errors()) {
                log.warn("Tile {}: result '{}' not produced, keeping partial results: {}",
                    tile.name(), error.resultName(), error.message());
            }
        }

        GridDataset tileResult = new GridDataset(slice.lat(), slice.lon(), result.time(), slice.fillValue(),
            result.variables().values(), Map.of());

        try {
            TileArtifactHandle handle = scope.write(tile, tileResult);
            log.debug("Tile {} written to {}", tile.name(), handle.path());
            return handle;
        } catch (ArtifactIOException e) {
            throw new TileComputationFailedException(tile.name(), e);
        }
    }
}
