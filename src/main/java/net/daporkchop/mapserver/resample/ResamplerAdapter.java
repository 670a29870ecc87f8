/*
 * Adapted from The MIT License (MIT)
 *
 * Copyright (c) 2020-2022 DaPorkchop_
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy,
 * modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software
 * is furnished to do so, subject to the following conditions:
 *
 * Any persons and/or organizations using this software must include the above copyright notice and this permission notice,
 * provide sufficient credit to the original authors of the project (IE: DaPorkchop_), as well as provide a link to the original project.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS
 * BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 *
 */

package net.daporkchop.mapserver.resample;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.data.Dataset;
import net.daporkchop.mapserver.data.SampleSet;
import net.daporkchop.mapserver.error.MapServerException;
import net.daporkchop.mapserver.error.ResourceFaultException;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.server.RenderGate;
import net.daporkchop.mapserver.util.geom.Bounds2d;

import static com.google.common.base.Preconditions.*;

/**
 * Produces fixed-size tile grids from a {@link Dataset} using a {@link Resampler}.
 * <p>
 * The resampler may touch caches on the dataset handle, so {@link #resample(FieldRef.Compound, Bounds2d)} may only be called while the
 * {@link RenderGate} guarding that dataset is held.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
public class ResamplerAdapter {
    protected final Dataset dataset;
    protected final Resampler resampler;
    protected final RenderGate gate;
    protected final int tileSize;

    public ResamplerAdapter(@NonNull Dataset dataset, @NonNull Resampler resampler, @NonNull RenderGate gate, int tileSize) {
        checkArgument(tileSize > 0, "tileSize (%s) must be positive", tileSize);

        this.dataset = dataset;
        this.resampler = resampler;
        this.gate = gate;
        this.tileSize = tileSize;
    }

    /**
     * @return a {@code [tileSize][tileSize]} grid of the given field's values over the given rectangle
     */
    public double[][] resample(@NonNull FieldRef.Compound field, @NonNull Bounds2d box) {
        checkState(this.gate.isHeldByCurrentThread(), "resampling requires exclusive access to the dataset");

        SampleSet samples = this.dataset.samples(field);
        double[][] grid;
        try {
            grid = this.resampler.pixelize(samples, box, this.tileSize, this.tileSize);
        } catch (MapServerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResourceFaultException(String.format("failed to resample %s over %s", field, box), e);
        }

        if (grid == null || grid.length != this.tileSize || (grid.length != 0 && grid[0].length != this.tileSize)) {
            throw new ResourceFaultException(String.format("resampler returned a grid of the wrong size for %s", field), null);
        }
        return grid;
    }
}
