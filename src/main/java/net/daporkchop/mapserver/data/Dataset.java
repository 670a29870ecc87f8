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

package net.daporkchop.mapserver.data;

import lombok.NonNull;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.util.geom.Bounds2d;

import java.util.List;

/**
 * A handle to scattered 2D sample data.
 * <p>
 * Implementations are not required to be thread-safe: {@link #samples(FieldRef.Compound)} may populate caches on the handle, so all
 * access happens under the server's {@link net.daporkchop.mapserver.server.RenderGate}.
 *
 * @author DaPorkchop_
 */
public interface Dataset {
    /**
     * Category under which particle deposit fields are registered.
     */
    String DEPOSIT_CATEGORY = "deposit";

    /**
     * @return the physical extent of the dataset. Never changes for the lifetime of the handle.
     */
    Bounds2d domain();

    /**
     * @return the names of the particle types in this dataset
     */
    List<String> particleTypes();

    /**
     * @return the names of the fluid types in this dataset
     */
    List<String> fluidTypes();

    /**
     * @return every field which can be sampled, in a stable order
     */
    List<FieldRef.Compound> derivedFieldList();

    /**
     * Resolves a field reference to a concrete field of this dataset.
     *
     * @throws net.daporkchop.mapserver.error.UnknownFieldException if no such field exists
     */
    FieldRef.Compound resolve(@NonNull FieldRef ref);

    /**
     * Gets the samples of the given field.
     *
     * @throws net.daporkchop.mapserver.error.UnknownFieldException if no such field exists
     */
    SampleSet samples(@NonNull FieldRef.Compound field);
}
