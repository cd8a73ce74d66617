package com.example.handwritingcomparator.support;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.geom.Arc2D;
import java.awt.geom.CubicCurve2D;
import java.awt.geom.Line2D;
import java.awt.geom.QuadCurve2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Random;
import javax.imageio.ImageIO;

/**
 * Deterministic synthetic specimens drawn with plain Java2D shapes, so tests need no fonts.
 */
public final class SpecimenImages {

    private SpecimenImages() {
    }

    /**
     * Three lines of cursive-like glyphs: arcs, hooks, arches and loops with a slight forward slant.
     */
    public static BufferedImage handwriting(long seed, int width, int height) {
        return handwriting(seed, width, height, -0.2);
    }

    /**
     * Same glyph generator with an explicit horizontal shear; 0 is upright, negative values lean the
     * glyph tops to the right.
     */
    public static BufferedImage handwriting(long seed, int width, int height, double shear) {
        BufferedImage image = blank(width, height);
        Random random = new Random(seed);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(new Color(20, 20, 40));
            g.setStroke(new BasicStroke(3.0f, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
            int lineHeight = height / 3;
            for (int line = 0; line < 3; line++) {
                int baseline = line * lineHeight + (int) (lineHeight * 0.7);
                AffineTransform original = g.getTransform();
                g.translate(0, baseline);
                g.shear(shear, 0);
                int x = 24;
                int letters = 0;
                while (x < width - 60) {
                    int glyphWidth = 16 + random.nextInt(12);
                    int glyphHeight = 26 + random.nextInt(14);
                    drawGlyph(g, random.nextInt(4), x, glyphWidth, glyphHeight, random);
                    x += glyphWidth + 6 + random.nextInt(5);
                    letters++;
                    if (letters % (4 + random.nextInt(3)) == 0) {
                        x += 14;
                    }
                }
                g.setTransform(original);
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private static void drawGlyph(Graphics2D g, int kind, int x, int w, int h, Random random) {
        switch (kind) {
            case 0 -> g.draw(new Arc2D.Double(x, -h * 0.6, w, h * 0.6, 40, 280 + random.nextInt(40), Arc2D.OPEN));
            case 1 -> {
                g.draw(new Line2D.Double(x + w * 0.3, -h, x + w * 0.3, 0));
                g.draw(new QuadCurve2D.Double(x + w * 0.3, 0, x + w * 0.6, 6, x + w, -h * 0.3));
            }
            case 2 -> {
                g.draw(new QuadCurve2D.Double(x, 0, x + w * 0.25, -h * 1.0, x + w * 0.5, 0));
                g.draw(new QuadCurve2D.Double(x + w * 0.5, 0, x + w * 0.75, -h * 0.9, x + w, 0));
            }
            default -> g.draw(new CubicCurve2D.Double(x, 0, x + w * 1.4, -h * 1.2, x - w * 0.4, -h * 1.2, x + w, 0));
        }
    }

    public static BufferedImage blank(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Parallel bars with crisp edges, for descriptor tests that need a known geometry.
     */
    public static BufferedImage bars(int width, int height, int count, float thickness, boolean vertical) {
        BufferedImage image = blank(width, height);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(thickness, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER));
            for (int i = 0; i < count; i++) {
                if (vertical) {
                    int x = (i + 1) * width / (count + 1);
                    g.draw(new Line2D.Double(x, height * 0.3, x, height * 0.7));
                } else {
                    int y = (i + 1) * height / (count + 1);
                    g.draw(new Line2D.Double(width * 0.2, y, width * 0.8, y));
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Parallel bars leaning {@code leanDegrees} from vertical, tops to the right for positive values.
     */
    public static BufferedImage leaningBars(int width, int height, int count, float thickness, double leanDegrees) {
        BufferedImage image = blank(width, height);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(thickness, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER));
            double top = height * 0.3;
            double bottom = height * 0.7;
            double offset = Math.tan(Math.toRadians(leanDegrees)) * (bottom - top) / 2.0;
            for (int i = 0; i < count; i++) {
                int x = (i + 1) * width / (count + 1);
                g.draw(new Line2D.Double(x - offset, bottom, x + offset, top));
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Two rows of separate plus signs, so every glyph skeleton carries a junction.
     */
    public static BufferedImage crosses(int width, int height, int perRow, int size, float thickness) {
        BufferedImage image = blank(width, height);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(thickness, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER));
            double half = size / 2.0;
            for (int row = 0; row < 2; row++) {
                int y = (row + 1) * height / 3;
                for (int i = 0; i < perRow; i++) {
                    int x = (i + 1) * width / (perRow + 1);
                    g.draw(new Line2D.Double(x - half, y, x + half, y));
                    g.draw(new Line2D.Double(x, y - half, x, y + half));
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Horizontal bars, as in {@link #bars}, with the whole page turned clockwise by {@code degrees}
     * about its centre.
     */
    public static BufferedImage rotatedLines(int width, int height, int count, float thickness, double degrees) {
        BufferedImage image = blank(width, height);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(thickness, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER));
            g.rotate(Math.toRadians(degrees), width / 2.0, height / 2.0);
            for (int i = 0; i < count; i++) {
                int y = (i + 1) * height / (count + 1);
                g.draw(new Line2D.Double(width * 0.2, y, width * 0.8, y));
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Copy of {@code source} where each pixel is replaced by black or white with probability
     * {@code fraction}.
     */
    public static BufferedImage withSaltAndPepper(BufferedImage source, double fraction, long seed) {
        BufferedImage noisy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Random random = new Random(seed);
        for (int y = 0; y < source.getHeight(); y++) {
            for (int x = 0; x < source.getWidth(); x++) {
                int rgb = source.getRGB(x, y);
                if (random.nextDouble() < fraction) {
                    rgb = random.nextBoolean() ? 0x000000 : 0xFFFFFF;
                }
                noisy.setRGB(x, y, rgb);
            }
        }
        return noisy;
    }

    public static byte[] png(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
