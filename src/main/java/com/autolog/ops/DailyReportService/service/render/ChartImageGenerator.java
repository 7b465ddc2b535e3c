package com.autolog.ops.DailyReportService.service.render;

import com.autolog.ops.DailyReportService.exception.RenderException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Draws simple PNG bar charts for inline embedding. Shapes only, no text, so rendering does not
 * depend on installed fonts; labels live in the surrounding html.
 */
@Component
public class ChartImageGenerator {

    public static final String PNG = "image/png";

    private static final Color BACKGROUND = new Color(0xF8, 0xF9, 0xFA);
    private static final Color AXIS = new Color(0xCE, 0xD4, 0xDA);
    private static final int PADDING = 16;

    public byte[] barChart(List<BigDecimal> values, Color from, Color to, int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, width, height);

            int plotWidth = width - 2 * PADDING;
            int plotHeight = height - 2 * PADDING;
            int baseline = height - PADDING;
            g.setColor(AXIS);
            g.fillRect(PADDING, baseline, plotWidth, 1);

            BigDecimal max = values.stream().filter(v -> v != null && v.signum() > 0)
                    .reduce(BigDecimal.ZERO, BigDecimal::max);
            if (!values.isEmpty() && max.signum() > 0) {
                int slot = Math.max(1, plotWidth / values.size());
                int barWidth = Math.max(1, (int) (slot * 0.7));
                for (int i = 0; i < values.size(); i++) {
                    BigDecimal value = values.get(i);
                    if (value == null || value.signum() <= 0) {
                        continue;
                    }
                    int barHeight = Math.max(2, value.multiply(BigDecimal.valueOf(plotHeight)).divide(max, 0, java.math.RoundingMode.HALF_UP).intValue());
                    int x = PADDING + i * slot + (slot - barWidth) / 2;
                    int y = baseline - barHeight;
                    g.setPaint(new GradientPaint(x, y, from, x, baseline, to));
                    g.fillRoundRect(x, y, barWidth, barHeight, 6, 6);
                }
            }
        } finally {
            g.dispose();
        }
        return encode(image);
    }

    private static byte[] encode(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new RenderException("No PNG writer available for chart image");
            }
        } catch (IOException e) {
            throw new RenderException("Failed to encode chart image", e);
        }
        return out.toByteArray();
    }
}
