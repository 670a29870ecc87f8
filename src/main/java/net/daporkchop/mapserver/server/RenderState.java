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

package net.daporkchop.mapserver.server;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.data.Dataset;
import net.daporkchop.mapserver.field.FieldRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The mutable state shared by all requests to one server: the dataset handle, the gate guarding it, and the field selected in the UI.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
public class RenderState {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderState.class);

    protected final Dataset dataset;
    protected final RenderGate gate = new RenderGate();

    protected volatile FieldRef activeField;

    public RenderState(@NonNull Dataset dataset, @NonNull FieldRef activeField) {
        this.dataset = dataset;
        this.activeField = activeField;
    }

    public void activeField(@NonNull FieldRef activeField) {
        FieldRef previous = this.activeField;
        this.activeField = activeField;
        if (!previous.equals(activeField)) {
            LOGGER.debug("active field changed: {} -> {}", previous, activeField);
        }
    }
}
