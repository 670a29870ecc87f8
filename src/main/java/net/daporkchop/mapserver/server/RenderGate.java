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

import lombok.NonNull;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.*;

/**
 * Serializes render work against one shared dataset handle.
 * <p>
 * This is a single coarse lock over the whole dataset: at most one thread renders at a time, regardless of field or tile. Waiting threads
 * block without a timeout, and no ordering between them is guaranteed.
 *
 * @author DaPorkchop_
 */
public class RenderGate {
    protected final ReentrantLock lock = new ReentrantLock();

    /**
     * Blocks until the gate is free, then takes it.
     */
    public void acquire() {
        this.lock.lock();
    }

    /**
     * Frees the gate.
     *
     * @throws IllegalStateException if the calling thread does not hold the gate
     */
    public void release() {
        checkState(this.lock.isHeldByCurrentThread(), "gate is not held by %s", Thread.currentThread().getName());
        this.lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return this.lock.isHeldByCurrentThread();
    }

    /**
     * @return whether any thread currently holds the gate
     */
    public boolean isHeld() {
        return this.lock.isLocked();
    }

    /**
     * Runs the given action while holding the gate.
     */
    public <T> T call(@NonNull Supplier<T> action) {
        this.acquire();
        try {
            return action.get();
        } finally {
            this.release();
        }
    }
}
