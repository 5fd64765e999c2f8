package com.photomatic.core.render;

import java.awt.Graphics2D;

/**
 * Child graphics context whose clip, transform and composite changes vanish on {@link #close()}.
 * Use with try-with-resources so the parent state is restored on every exit path.
 */
final class GraphicsScope implements AutoCloseable {

    private final Graphics2D graphics;

    private GraphicsScope(Graphics2D graphics) {
        this.graphics = graphics;
    }

    static GraphicsScope open(Graphics2D parent) {
        return new GraphicsScope((Graphics2D) parent.create());
    }

    Graphics2D graphics() {
        return graphics;
    }

    @Override
    public void close() {
        graphics.dispose();
    }
}
