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

package net.daporkchop.mapserver.tilematrix;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.error.InvalidAddressException;
import net.daporkchop.mapserver.util.geom.Bounds2d;
import net.daporkchop.mapserver.util.geom.Point2l;

import static com.google.common.base.Preconditions.*;

/**
 * {@link TileMatrix} which subdivides a rectangular domain into {@code 2^zoom} tiles along each axis.
 * <p>
 * Tile {@code (0, 0)} touches the domain's left edge on both axes.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
public class DomainTileMatrix implements TileMatrix {
    protected final Bounds2d domain;
    protected final int tileSize;

    public DomainTileMatrix(@NonNull Bounds2d domain, int tileSize) {
        checkArgument(tileSize > 0, "tileSize (%s) must be positive", tileSize);
        checkArgument(domain.width() > 0.0d && domain.height() > 0.0d, "domain must have a positive area: %s", domain);

        this.domain = domain;
        this.tileSize = tileSize;
    }

    /**
     * @return the fraction of the domain covered by one tile at the given zoom level
     */
    protected static double tileFraction(int zoom) {
        return 1.0d / (1L << zoom);
    }

    @Override
    public Bounds2d tileBounds(@NonNull Point2l t, int zoom) {
        if (!this.isValid(t, zoom)) {
            throw new InvalidAddressException(String.format("tile (%d, %d) does not exist at zoom level %d", t.x(), t.y(), zoom));
        }

        //both edges are derived from the tile index rather than from each other, so that neighboring tiles share an edge value exactly
        double dd = tileFraction(zoom);
        double xl = this.domain.minX() + (t.x() * dd) * this.domain.width();
        double yl = this.domain.minY() + (t.y() * dd) * this.domain.height();
        double xr = this.domain.minX() + ((t.x() + 1L) * dd) * this.domain.width();
        double yr = this.domain.minY() + ((t.y() + 1L) * dd) * this.domain.height();
        return new Bounds2d(xl, xr, yl, yr);
    }

    @Override
    public double resolution(int zoom) {
        return tileFraction(zoom) * this.domain.width() / this.tileSize;
    }
}
