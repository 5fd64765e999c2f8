package com.photomatic.core.render;

import com.photomatic.core.layout.Placement;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.util.Arrays;

/**
 * Paints a soft halo behind the photo: a tiny, repeatedly box-blurred copy of the raster,
 * scaled up past the photo's bounds and drawn translucent.
 */
final class GlowRenderer {

    private static final int SAMPLE_SIZE = 48;
    private static final int BLUR_RADIUS = 2;
    private static final int BLUR_PASSES = 3;

    private GlowRenderer() {
    }

    static void drawGlow(Graphics2D g2d, BufferedImage raster, Placement placement, float alpha, double spread) {
        int longest = Math.max(raster.getWidth(), raster.getHeight());
        int sampleW = Math.max(1, (int) Math.round(raster.getWidth() * (double) SAMPLE_SIZE / longest));
        int sampleH = Math.max(1, (int) Math.round(raster.getHeight() * (double) SAMPLE_SIZE / longest));
        int pad = BLUR_RADIUS * BLUR_PASSES;

        BufferedImage blurred = blur(downsample(raster, sampleW, sampleH, pad));

        double grownX = placement.x() - placement.width() * spread;
        double grownY = placement.y() - placement.height() * spread;
        double scaleX = placement.width() * (1 + 2 * spread) / sampleW;
        double scaleY = placement.height() * (1 + 2 * spread) / sampleH;

        AffineTransform transform = new AffineTransform();
        transform.translate(grownX - pad * scaleX, grownY - pad * scaleY);
        transform.scale(scaleX, scaleY);

        try (GraphicsScope scope = GraphicsScope.open(g2d)) {
            Graphics2D g = scope.graphics();
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, alpha));
            g.drawImage(blurred, transform, null);
        }
    }

    private static BufferedImage downsample(BufferedImage raster, int width, int height, int pad) {
        BufferedImage sample = new BufferedImage(width + 2 * pad, height + 2 * pad, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = sample.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(raster, pad, pad, width, height, null);
        } finally {
            g.dispose();
        }
        return sample;
    }

    private static BufferedImage blur(BufferedImage source) {
        int size = 2 * BLUR_RADIUS + 1;
        float[] weights = new float[size * size];
        Arrays.fill(weights, 1f / weights.length);
        ConvolveOp op = new ConvolveOp(new Kernel(size, size, weights), ConvolveOp.EDGE_ZERO_FILL, null);

        BufferedImage current = source;
        for (int pass = 0; pass < BLUR_PASSES; pass++) {
            current = op.filter(current, null);
        }
        return current;
    }
}
