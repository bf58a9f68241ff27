package com.driverlens.core.analysis;

import com.driverlens.core.config.AnalysisSettings;
import com.driverlens.core.error.AnalysisResult;
import com.driverlens.core.error.AnalysisStage;
import com.driverlens.core.model.CorrelationRecord;
import com.driverlens.core.model.DriverMetadata;
import com.driverlens.core.model.DriverStrength;
import com.driverlens.core.model.RankedDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns a batch of {@link CorrelationRecord}s into a ranked, explained driver
 * list.
 *
 * <h3>Score</h3>
 * <pre>
 * r_norm = (|r| - min|r|) / (max|r| - min|r| + 1e-9)   when the batch has more
 *                                                       than one record and
 *                                                       max|r| != min|r|
 * r_norm = |r|                                         otherwise
 * score  = r_norm × -log10(max(p_value, 1e-12))
 * </pre>
 * <p>
 * Drivers are sorted by descending score (ties keep input order) and the list
 * is optionally truncated to the top {@code k}.
 * </p>
 *
 * <h3>Enrichment</h3>
 * <p>
 * Each driver is looked up in the {@link DriverMetadataProvider} by its name
 * with the configured value prefix stripped. Every driver gets a display name;
 * unknown drivers keep empty enrichment fields.
 * </p>
 *
 * @since 1.0.0
 */
public class ImpactRanker {

    private static final Logger LOG = LoggerFactory.getLogger(ImpactRanker.class);

    /** Keeps the normalization denominator away from zero. */
    static final double EPSILON = 1e-9;

    /** Lower bound for p-values before the log transform. */
    static final double P_FLOOR = 1e-12;

    private final AnalysisSettings settings;
    private final DriverMetadataProvider metadata;

    public ImpactRanker(AnalysisSettings settings) {
        this(settings, DriverMetadataProvider.none());
    }

    public ImpactRanker(AnalysisSettings settings, DriverMetadataProvider metadata) {
        this.settings = Objects.requireNonNull(settings, "AnalysisSettings must not be null");
        this.metadata = Objects.requireNonNull(metadata, "DriverMetadataProvider must not be null");
    }

    /**
     * @return the configured top-k, {@code 0} meaning no truncation
     */
    public int getDefaultTopK() {
        return settings.getTopK();
    }

    /**
     * Rank using the configured default top-k.
     *
     * @see #rank(List, Integer)
     */
    public AnalysisResult<List<RankedDriver>> rank(List<CorrelationRecord> records) {
        return rank(records, settings.getTopK());
    }

    /**
     * Rank a correlation batch.
     *
     * @param records correlation records; an empty batch yields an empty
     *                ranking
     * @param topK    maximum number of drivers to keep; {@code null} or
     *                {@code <= 0} keeps all
     * @return ranked drivers, or the failure for the
     *         {@link AnalysisStage#RANKING} stage
     */
    public AnalysisResult<List<RankedDriver>> rank(List<CorrelationRecord> records, Integer topK) {
        return AnalysisResult.capture(AnalysisStage.RANKING, () -> rankAll(records, topK));
    }

    private List<RankedDriver> rankAll(List<CorrelationRecord> records, Integer topK) {
        Objects.requireNonNull(records, "Correlation records must not be null");
        if (records.isEmpty()) {
            LOG.info("Empty correlation batch, nothing to rank");
            return List.of();
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (CorrelationRecord record : records) {
            double absR = Math.abs(record.getR());
            min = Math.min(min, absR);
            max = Math.max(max, absR);
        }
        boolean normalize = records.size() > 1 && max != min;

        List<RankedDriver> ranked = new ArrayList<>(records.size());
        for (CorrelationRecord record : records) {
            double absR = Math.abs(record.getR());
            double rNorm = normalize ? (absR - min) / (max - min + EPSILON) : absR;
            ranked.add(toRankedDriver(record, score(rNorm, record.getPValue())));
        }
        ranked.sort(Comparator.comparingDouble(RankedDriver::getScore).reversed());

        if (topK != null && topK > 0 && ranked.size() > topK) {
            ranked = new ArrayList<>(ranked.subList(0, topK));
        }
        LOG.info("Ranked {} of {} driver(s)", ranked.size(), records.size());
        return List.copyOf(ranked);
    }

    static double score(double rNorm, double pValue) {
        double pClipped = Math.max(pValue, P_FLOOR);
        // p = 1 gives -0.0
        return Math.max(0.0, rNorm * -Math.log10(pClipped));
    }

    private RankedDriver toRankedDriver(CorrelationRecord record, double score) {
        DriverStrength strength = DriverStrength.classify(Math.abs(record.getR()),
                settings.getStrongThreshold(), settings.getModerateThreshold());
        String key = metadataKey(record.getDriverName());
        DriverMetadata entry = metadata.find(key).orElse(null);
        return RankedDriver.builder(record)
                .score(score)
                .strength(strength)
                .explanation(explain(strength, record))
                .displayName(metadata.displayName(key))
                .metadata(entry)
                .build();
    }

    String explain(DriverStrength strength, CorrelationRecord record) {
        String direction = record.getR() < 0 ? "negative" : "positive";
        String confidence = record.getPValue() < settings.getSignificanceLevel()
                ? "statistical significance"
                : "moderate confidence";
        return strength.getLabel() + " " + direction + " correlation with " + confidence;
    }

    String metadataKey(String driverName) {
        String prefix = settings.getMetadataKeyPrefix();
        if (prefix != null && !prefix.isEmpty() && driverName.startsWith(prefix)) {
            return driverName.substring(prefix.length());
        }
        return driverName;
    }
}
