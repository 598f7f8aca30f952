package org.counterseries.cli.rendering;

import org.counterseries.datapipeline.api.contracts.GroupKey;
import org.counterseries.datapipeline.utils.UniqueFileNames;
import org.counterseries.datapipeline.utils.ValueFormat;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.TreeSet;

/**
 * File layout below the output root:
 * <pre>
 *   csv/&lt;source&gt;_summary.csv, csv/&lt;source&gt;_series.csv
 *   png/&lt;source&gt;_&lt;item&gt;_totals.png, png/&lt;source&gt;_&lt;item&gt;_deltas.png
 *   png/&lt;source&gt;_top&lt;N&gt;_totals.png, png/&lt;source&gt;_top&lt;N&gt;_delta.png
 *   reports/&lt;source&gt;_&lt;item&gt;_report.html, reports/&lt;source&gt;_index.html
 * </pre>
 * Sources and series whose sanitized names coincide get distinct names, see {@link #forSeries}.
 *
 * @param root        output root directory
 * @param sourceStems file name stem per source
 * @param itemStems   file name stem per series
 */
public record OutputLayout(Path root, Map<String, String> sourceStems, Map<GroupKey, String> itemStems) {

    public OutputLayout {
        sourceStems = Map.copyOf(sourceStems);
        itemStems = Map.copyOf(itemStems);
    }

    /**
     * A layout without registered names: every name is the plain sanitized id.
     */
    public OutputLayout(Path root) {
        this(root, Map.of(), Map.of());
    }

    /**
     * @param root output root directory
     * @param keys every series that will be written
     * @return a layout that gives every source and every series its own file names
     */
    public static OutputLayout forSeries(Path root, Collection<GroupKey> keys) {
        final TreeSet<GroupKey> sorted = new TreeSet<>(keys);
        final TreeSet<String> sources = new TreeSet<>();
        for (GroupKey key : sorted) {
            sources.add(key.source());
        }
        final Map<String, String> sourceStems = UniqueFileNames.assign(sources, ValueFormat::fileNamePart);
        final Map<GroupKey, String> itemStems = UniqueFileNames.assign(sorted,
                key -> sourceStems.get(key.source()) + "_" + ValueFormat.fileNamePart(key.itemId()));
        return new OutputLayout(root, sourceStems, itemStems);
    }

    public Path csvDir() {
        return root.resolve("csv");
    }

    public Path pngDir() {
        return root.resolve("png");
    }

    public Path reportsDir() {
        return root.resolve("reports");
    }

    public String totalsChartName(GroupKey key) {
        return itemPrefix(key) + "_totals.png";
    }

    public String deltasChartName(GroupKey key) {
        return itemPrefix(key) + "_deltas.png";
    }

    /**
     * @return the ranking of a source by latest cumulative value
     */
    public String topTotalsChartName(String source, int topN) {
        return sourcePrefix(source) + "_top" + topN + "_totals.png";
    }

    /**
     * @return the ranking of a source by recent average delta
     */
    public String topDeltaChartName(String source, int topN) {
        return sourcePrefix(source) + "_top" + topN + "_delta.png";
    }

    public String itemReportName(GroupKey key) {
        return itemPrefix(key) + "_report.html";
    }

    public String sourceIndexName(String source) {
        return sourcePrefix(source) + "_index.html";
    }

    /**
     * @return the link from a report page to an image in the PNG directory
     */
    public String chartLinkFromReports(String chartName) {
        return "../png/" + chartName;
    }

    private String sourcePrefix(String source) {
        final String stem = sourceStems.get(source);
        return stem != null ? stem : ValueFormat.fileNamePart(source);
    }

    private String itemPrefix(GroupKey key) {
        final String stem = itemStems.get(key);
        return stem != null ? stem : sourcePrefix(key.source()) + "_" + ValueFormat.fileNamePart(key.itemId());
    }
}
