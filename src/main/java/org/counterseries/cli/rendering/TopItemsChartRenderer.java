package org.counterseries.cli.rendering;

import org.counterseries.cli.rendering.ItemRanking.RankedItem;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Arrays;
import java.util.List;

/**
 * Renders a horizontal bar chart of the top-ranked items of one source.
 * <p>
 * Bars are drawn top to bottom in rank order and scaled to the largest absolute ranked value;
 * positive values grow right from the zero line (green), negative ones left (red).
 */
public class TopItemsChartRenderer {

    private final int chartWidth;
    private final int rowHeight;

    private final int colorBackground = Color.decode("#1a1a1a").getRGB();
    private final int colorPositive = Color.decode("#32cd32").getRGB();
    private final int colorNegative = Color.decode("#d62728").getRGB();
    private final int colorBorder = Color.decode("#ffffff").getRGB();

    /**
     * @param chartWidth width of the chart in pixels
     * @param rowHeight  height of one bar row in pixels
     */
    public TopItemsChartRenderer(int chartWidth, int rowHeight) {
        if (chartWidth < 8 || rowHeight < 3) {
            throw new IllegalArgumentException("Chart too small: " + chartWidth + "x" + rowHeight);
        }
        this.chartWidth = chartWidth;
        this.rowHeight = rowHeight;
    }

    /**
     * @param ranked items in rank order, as returned by {@link ItemRanking}
     * @return the chart, one row per item (at least one row for an empty ranking)
     */
    public BufferedImage render(List<RankedItem> ranked) {
        final int rows = Math.max(ranked.size(), 1);
        final int height = rows * rowHeight + 2;
        final BufferedImage image = new BufferedImage(chartWidth, height, BufferedImage.TYPE_INT_RGB);
        final int[] buffer = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
        Arrays.fill(buffer, colorBackground);
        drawBorder(buffer, height);

        double maxPositive = 0.0;
        double maxNegative = 0.0;
        for (RankedItem item : ranked) {
            maxPositive = Math.max(maxPositive, item.value());
            maxNegative = Math.max(maxNegative, -item.value());
        }
        final double total = maxPositive + maxNegative;
        if (total == 0.0) {
            return image;
        }

        final int innerWidth = chartWidth - 2;
        final int zeroX = 1 + (int) Math.round(innerWidth * maxNegative / total);
        for (int row = 0; row < ranked.size(); row++) {
            final double value = ranked.get(row).value();
            final int length = (int) Math.round(innerWidth * Math.abs(value) / total);
            final int startX = value >= 0 ? zeroX : zeroX - length;
            final int endX = Math.min(startX + length, chartWidth - 1);
            final int color = value >= 0 ? colorPositive : colorNegative;
            // one pixel of spacing between rows
            final int top = 1 + row * rowHeight + 1;
            final int bottom = 1 + (row + 1) * rowHeight - 1;
            for (int y = top; y < bottom; y++) {
                Arrays.fill(buffer, y * chartWidth + Math.max(startX, 1), y * chartWidth + endX, color);
            }
        }
        return image;
    }

    private void drawBorder(int[] buffer, int height) {
        Arrays.fill(buffer, 0, chartWidth, colorBorder);
        Arrays.fill(buffer, (height - 1) * chartWidth, height * chartWidth, colorBorder);
        for (int y = 0; y < height; y++) {
            buffer[y * chartWidth] = colorBorder;
            buffer[y * chartWidth + chartWidth - 1] = colorBorder;
        }
    }
}
