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

import lombok.NonNull;
import net.daporkchop.mapserver.util.geom.Bounds2d;
import net.daporkchop.mapserver.util.geom.Point2l;

/**
 * Maps quad-tree tile addresses to rectangles in the physical domain.
 *
 * @author DaPorkchop_
 */
public interface TileMatrix {
    int MAX_ZOOM_LEVEL = 32;

    /**
     * @return the number of pixels along each edge of a tile
     */
    int tileSize();

    /**
     * @return the full extent of the domain being tiled
     */
    Bounds2d domain();

    /**
     * Returns bounds of the given tile in domain coordinates.
     *
     * @throws net.daporkchop.mapserver.error.InvalidAddressException if the tile does not exist at the given zoom level
     */
    Bounds2d tileBounds(@NonNull Point2l t, int zoom);

    /**
     * Resolution (domain units/pixel along the x axis) for given zoom level
     */
    double resolution(int zoom);

    /**
     * @return whether the given tile exists at the given zoom level
     */
    default boolean isValid(@NonNull Point2l t, int zoom) {
        if (zoom < 0 || zoom >= MAX_ZOOM_LEVEL) {
            return false;
        }
        long tiles = 1L << zoom;
        return t.x() >= 0L && t.x() < tiles && t.y() >= 0L && t.y() < tiles;
    }
}
