package com.photomatic.core.render;

import com.photomatic.config.LayoutSettings;
import com.photomatic.core.geometry.RoundedRectPath;
import com.photomatic.core.image.ImageSupport;
import com.photomatic.core.layout.FitCalculator;
import com.photomatic.core.layout.Margins;
import com.photomatic.core.layout.Placement;
import com.photomatic.core.metadata.MetadataFormatter;
import com.photomatic.core.model.DisplayOptions;
import com.photomatic.core.model.PhotoRecord;

import java.awt.AlphaComposite;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Draws a framed photo onto a canvas: mat, optional glow, the photo itself (optionally with
 * rounded corners) and the optional exposure line underneath.
 * <p>
 * Every call repaints the whole target, so rendering the same photo with the same options
 * twice yields identical pixels.
 */
public final class Compositor {

    private final LayoutSettings settings;
    private final Font overlayFont;

    public Compositor(LayoutSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.overlayFont = new Font(Font.MONOSPACED, Font.BOLD, settings.overlayFontSize());
    }

    public BufferedImage createSurface() {
        return new BufferedImage(settings.canvasWidth(), settings.canvasHeight(), BufferedImage.TYPE_INT_RGB);
    }

    public void render(BufferedImage target, PhotoRecord photo, DisplayOptions options) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(photo, "photo");
        Objects.requireNonNull(options, "options");

        int canvasWidth = target.getWidth();
        int canvasHeight = target.getHeight();
        String overlayText = MetadataFormatter.formatOverlay(photo.getMetadata());
        boolean drawOverlay = options.showMetadataOverlay() && !overlayText.isEmpty();

        Graphics2D g2d = target.createGraphics();
        try {
            ImageSupport.setupHighQualityRendering(g2d);

            g2d.setComposite(AlphaComposite.Clear);
            g2d.fillRect(0, 0, canvasWidth, canvasHeight);
            g2d.setComposite(AlphaComposite.SrcOver);
            g2d.setColor(options.mat().background());
            g2d.fillRect(0, 0, canvasWidth, canvasHeight);

            Placement placement = placementFor(canvasWidth, canvasHeight, photo, drawOverlay);

            if (options.glow()) {
                GlowRenderer.drawGlow(g2d, photo.getRaster(), placement, settings.glowAlpha(), settings.glowSpread());
            }

            drawPhoto(g2d, photo.getRaster(), placement, options.roundedCorners());

            if (drawOverlay) {
                drawOverlayText(g2d, overlayText, options, canvasWidth, canvasHeight);
            }
        } finally {
            g2d.dispose();
        }
    }

    /**
     * Where {@code photo} would be drawn on a canvas of the given size.
     */
    public Placement placementFor(int canvasWidth, int canvasHeight, PhotoRecord photo, boolean overlayShown) {
        Margins margins = Margins.uniform(settings.margin());
        if (overlayShown) {
            margins = margins.withBottom(settings.overlayMargin());
        }
        return FitCalculator.computeFit(canvasWidth, canvasHeight, margins, photo.getAspectRatio());
    }

    private void drawPhoto(Graphics2D g2d, BufferedImage raster, Placement placement, boolean rounded) {
        try (GraphicsScope scope = GraphicsScope.open(g2d)) {
            Graphics2D g = scope.graphics();
            if (rounded) {
                double radius = Math.min(settings.cornerRadius(),
                    Math.min(placement.width(), placement.height()) / 2.0);
                g.clip(RoundedRectPath.build(placement.x(), placement.y(), placement.width(), placement.height(), radius));
            }
            AffineTransform transform = new AffineTransform();
            transform.translate(placement.x(), placement.y());
            transform.scale(placement.width() / raster.getWidth(), placement.height() / raster.getHeight());
            g.drawImage(raster, transform, null);
        }
    }

    private void drawOverlayText(Graphics2D g2d,
                                 String text,
                                 DisplayOptions options,
                                 int canvasWidth,
                                 int canvasHeight) {
        g2d.setFont(overlayFont);
        g2d.setColor(options.mat().textColor());
        FontMetrics fm = g2d.getFontMetrics();
        int textWidth = fm.stringWidth(text);
        float x = canvasWidth / 2f - textWidth / 2f;
        // middle baseline: center the glyph box on the anchor line
        float y = canvasHeight - settings.overlayTextOffset() + (fm.getAscent() - fm.getDescent()) / 2f;
        g2d.drawString(text, x, y);
    }
}
