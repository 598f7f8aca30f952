package org.counterseries.cli.rendering;

import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.MetricRecord;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Renders per-item line charts (cumulative totals and interval deltas) as PNG images.
 * <p>
 * The x axis is proportional to elapsed time, so collection gaps stay visible. Points of
 * records flagged with a negative diff are drawn as larger red markers. Charts carry no text;
 * titles and legends live in the HTML report that embeds them.
 */
public class SeriesChartRenderer {

    static final Color[] PALETTE = {
        Color.decode("#1f77b4"), // blue
        Color.decode("#ff7f0e"), // orange
        Color.decode("#2ca02c"), // green
        Color.decode("#9467bd"), // purple
        Color.decode("#8c564b")  // brown
    };

    private static final int MARGIN = 40;
    private static final int GRID_LINES = 5;

    private final Color colorBackground = Color.decode("#ffffff");
    private final Color colorGrid = Color.decode("#e6e6e6");
    private final Color colorAxis = Color.decode("#404040");
    private final Color colorAnomaly = Color.decode("#d62728");

    private final int width;
    private final int height;

    /**
     * @param width  image width in pixels
     * @param height image height in pixels
     */
    public SeriesChartRenderer(int width, int height) {
        if (width <= 2 * MARGIN || height <= 2 * MARGIN) {
            throw new IllegalArgumentException("Chart must be larger than " + (2 * MARGIN) + "px in each dimension");
        }
        this.width = width;
        this.height = height;
    }

    /**
     * Draws the counter values of one series.
     */
    public BufferedImage renderTotals(List<MetricRecord> series, List<CounterField> counters) {
        return render(series, counters, (metric, counter) -> metric.record().counter(counter.name()), false);
    }

    /**
     * Draws the interval deltas of one series, with a zero baseline.
     */
    public BufferedImage renderDeltas(List<MetricRecord> series, List<CounterField> counters) {
        return render(series, counters, (metric, counter) -> metric.delta(counter.name()), true);
    }

    /**
     * Writes {@code image} as PNG, creating parent directories.
     *
     * @throws IOException if no PNG writer is available or the file cannot be written
     */
    public static void writePng(BufferedImage image, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        if (!ImageIO.write(image, "png", file.toFile())) {
            throw new IOException("No PNG image writer available for " + file);
        }
    }

    private BufferedImage render(List<MetricRecord> series, List<CounterField> counters,
                                 BiFunction<MetricRecord, CounterField, Double> valueOf, boolean includeZero) {
        final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(colorBackground);
            g.fillRect(0, 0, width, height);

            final double[] range = valueRange(series, counters, valueOf, includeZero);
            drawGrid(g);

            if (range != null) {
                if (includeZero) {
                    g.setColor(colorAxis);
                    final int zeroY = toY(0.0, range);
                    g.drawLine(MARGIN, zeroY, width - MARGIN, zeroY);
                }
                final double span = spanMinutes(series);
                for (int c = 0; c < counters.size(); c++) {
                    drawSeries(g, series, counters.get(c), valueOf, range, span, PALETTE[c % PALETTE.length]);
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private void drawGrid(Graphics2D g) {
        g.setColor(colorGrid);
        for (int i = 0; i <= GRID_LINES; i++) {
            final int y = MARGIN + (height - 2 * MARGIN) * i / GRID_LINES;
            g.drawLine(MARGIN, y, width - MARGIN, y);
        }
        g.setColor(colorAxis);
        g.drawLine(MARGIN, MARGIN, MARGIN, height - MARGIN);
        g.drawLine(MARGIN, height - MARGIN, width - MARGIN, height - MARGIN);
    }

    private void drawSeries(Graphics2D g, List<MetricRecord> series, CounterField counter,
                            BiFunction<MetricRecord, CounterField, Double> valueOf,
                            double[] range, double span, Color color) {
        final LocalDateTime origin = series.get(0).record().timestamp();
        final List<int[]> anomalies = new ArrayList<>();

        g.setStroke(new BasicStroke(2f));
        int[] previous = null;
        for (MetricRecord metric : series) {
            final Double value = valueOf.apply(metric, counter);
            if (value == null) {
                // gap in the line where the value is absent
                previous = null;
                continue;
            }
            final double minutes = Duration.between(origin, metric.record().timestamp()).toMillis() / 60_000.0;
            final int[] point = {toX(minutes, span), toY(value, range)};
            g.setColor(color);
            if (previous != null) {
                g.drawLine(previous[0], previous[1], point[0], point[1]);
            }
            g.fillOval(point[0] - 3, point[1] - 3, 6, 6);
            if (metric.anomalyNegativeDiff()) {
                anomalies.add(point);
            }
            previous = point;
        }

        g.setColor(colorAnomaly);
        for (int[] point : anomalies) {
            g.fillOval(point[0] - 5, point[1] - 5, 10, 10);
        }
    }

    private int toX(double minutes, double span) {
        final int plotWidth = width - 2 * MARGIN;
        if (span <= 0) {
            return MARGIN + plotWidth / 2;
        }
        return MARGIN + (int) Math.round(minutes / span * plotWidth);
    }

    private int toY(double value, double[] range) {
        final int plotHeight = height - 2 * MARGIN;
        final double fraction = (value - range[0]) / (range[1] - range[0]);
        return height - MARGIN - (int) Math.round(fraction * plotHeight);
    }

    private static double spanMinutes(List<MetricRecord> series) {
        final LocalDateTime first = series.get(0).record().timestamp();
        final LocalDateTime last = series.get(series.size() - 1).record().timestamp();
        return Duration.between(first, last).toMillis() / 60_000.0;
    }

    /**
     * @return {min, max} of the present values, widened when flat, or {@code null} if nothing is present
     */
    private static double[] valueRange(List<MetricRecord> series, List<CounterField> counters,
                                       BiFunction<MetricRecord, CounterField, Double> valueOf, boolean includeZero) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (MetricRecord metric : series) {
            for (CounterField counter : counters) {
                final Double value = valueOf.apply(metric, counter);
                if (value != null) {
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
            }
        }
        if (min > max) {
            return null;
        }
        if (includeZero) {
            min = Math.min(min, 0.0);
            max = Math.max(max, 0.0);
        }
        if (min == max) {
            min -= 1.0;
            max += 1.0;
        }
        return new double[] {min, max};
    }
}
