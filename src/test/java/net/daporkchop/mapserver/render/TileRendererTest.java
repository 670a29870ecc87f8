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

package net.daporkchop.mapserver.render;

import net.daporkchop.mapserver.TestDatasets;
import net.daporkchop.mapserver.error.InvalidAddressException;
import net.daporkchop.mapserver.error.InvalidDomainException;
import net.daporkchop.mapserver.error.UnknownColormapException;
import net.daporkchop.mapserver.error.UnknownFieldException;
import net.daporkchop.mapserver.resample.PixelizingResampler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TileRendererTest {
    private final TileRenderer renderer = TestDatasets.renderer(TestDatasets.unitGrid());

    private static BufferedImage decode(byte[] png) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertNotNull(image, "not a PNG");
        return image;
    }

    @Test
    void rootTile() throws IOException {
        BufferedImage image = decode(this.renderer.render("density", 0, 0L, 0L, false, "viridis"));
        assertEquals(TestDatasets.TILE_SIZE, image.getWidth());
        assertEquals(TestDatasets.TILE_SIZE, image.getHeight());

        //the first grid row (lowest y) is the top row of the image
        assertEquals(Colormap.Viridis.color(0.0d), image.getRGB(0, 0));
        assertEquals(Colormap.Viridis.color(1.0d), image.getRGB(255, 255));
        assertEquals(Colormap.Viridis.color(3.0d / 99.0d), image.getRGB(255, 0));
    }

    @Test
    void deterministic() {
        byte[] first = this.renderer.render("gas,density", 1, 1L, 0L, false, "hot");
        byte[] second = this.renderer.render("gas,density", 1, 1L, 0L, false, "hot");
        assertArrayEquals(first, second);
    }

    @Test
    void logScale() throws IOException {
        BufferedImage image = decode(this.renderer.render("density", 0, 0L, 0L, true, "gray"));
        assertEquals(0xFF000000, image.getRGB(0, 0));
        assertEquals(0xFFFFFFFF, image.getRGB(255, 255));
        //log10(10) is halfway between log10(1) and log10(100)
        assertEquals(Colormap.Gray.color(0.5d), image.getRGB(64, 128));
    }

    @Test
    @DisplayName("the logarithm of a field with non-positive values is rejected")
    void logOfNonPositiveField() {
        assertThrows(InvalidDomainException.class, () -> this.renderer.render("temperature", 0, 0L, 0L, true, "viridis"));
        assertThrows(InvalidDomainException.class, () -> this.renderer.render("deposit,PartType0_density", 0, 0L, 0L, true, "viridis"));
        assertFalse(this.renderer.state().gate().isHeld());
    }

    @Test
    void tilesWithoutBoundsAreTransparent() throws IOException {
        BufferedImage image = decode(this.renderer.render("density", 4, 0L, 0L, false, "viridis"));
        assertEquals(0, image.getRGB(0, 0) >>> 24);
        assertEquals(0, image.getRGB(255, 255) >>> 24);
    }

    @Test
    void errors() {
        assertThrows(UnknownFieldException.class, () -> this.renderer.render("pressure", 0, 0L, 0L, false, "viridis"));
        assertThrows(UnknownColormapException.class, () -> this.renderer.render("density", 0, 0L, 0L, false, "jet"));
        assertThrows(InvalidAddressException.class, () -> this.renderer.render("density", 1, 2L, 0L, false, "viridis"));
        assertThrows(InvalidAddressException.class, () -> this.renderer.render("density", 0, 0L, -1L, false, "viridis"));
    }

    @Test
    @DisplayName("concurrent renders never resample at the same time")
    void mutualExclusion() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        PixelizingResampler delegate = new PixelizingResampler();
        TileRenderer slow = TestDatasets.renderer(TestDatasets.unitGrid(), (samples, box, resX, resY) -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(5L);
                return delegate.pixelize(samples, box, resX, resY);
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            } finally {
                active.decrementAndGet();
            }
        });

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<byte[]>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                long x = i & 1;
                long y = (i >> 1) & 1;
                futures.add(executor.submit(() -> slow.render("density", 1, x, y, false, "viridis")));
            }
            for (Future<byte[]> future : futures) {
                assertTrue(future.get(30L, TimeUnit.SECONDS).length > 0);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxActive.get());
        assertFalse(slow.state().gate().isHeld());
    }
}
