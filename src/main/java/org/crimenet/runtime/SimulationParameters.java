package org.crimenet.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

/**
 * Immutable, validated parameter set for one simulation replicate.
 * <p>
 * Built from the {@code crimenet.simulation} block of the application configuration. Every
 * setting is read and checked before the object is returned; if anything is missing, of the
 * wrong type or out of range, an {@link InvalidConfigurationException} listing all violations
 * is thrown and no simulation can be constructed.
 * <p>
 * Defaults live in {@code reference.conf}. Tests typically start from
 * {@link #defaults()} and apply {@link #withOverrides(Map)}.
 */
public final class SimulationParameters {

    /** Path of the simulation block inside the application configuration. */
    public static final String CONFIG_PATH = "crimenet.simulation";

    private final Config source;
    private final List<String> violations = new ArrayList<>();

    private final long seed;
    private final int horizonDays;

    private final int populationSize;
    private final double initialCriminalShare;
    private final double initialAtRiskShare;
    private final double propensityMean;
    private final double propensityStddev;

    private final int attachmentCount;

    private final double peerInfluenceWeight;
    private final double stigmaWeight;
    private final double capitalWeight;
    private final double riskThreshold;
    private final double atRiskDecayRate;
    private final double crimeBaseRate;
    private final double crimeCapitalWeight;
    private final double crimePeerWeight;

    private final double coerciveCapacity;
    private final double forensicCapacity;

    private final DurationDistribution detentionDistribution;
    private final double detentionMeanDays;
    private final double detentionStigmaIncrement;
    private final double detentionCapitalIncrement;

    private final double convictionBaseProbability;
    private final int evidenceWindowDays;
    private final double evidenceFloor;
    private final double evidenceSaturationFraction;

    private final DurationDistribution sentenceDistribution;
    private final double sentenceMeanDays;
    private final double prisonCapitalIncrement;
    private final double prisonReleaseCapitalIncrement;

    private final double congestionScalingStrength;
    private final boolean congestionThresholdEnabled;
    private final double congestionThresholdShare;
    private final double congestionShorteningFactor;

    private final boolean rewiringEnabled;
    private final double dropLawfulEdgeProbability;
    private final double addCriminalEdgeProbability;
    private final int maxNewEdgesPerEvent;

    private SimulationParameters(Config config) {
        this.source = config;
        rejectUnknownSettings();

        this.seed = readLong("seed");
        this.horizonDays = readInt("horizon-days");
        atLeast("horizon-days", horizonDays, 1);

        this.populationSize = readInt("population.size");
        atLeast("population.size", populationSize, 1);
        this.initialCriminalShare = probability("population.initial-criminal-share");
        this.initialAtRiskShare = probability("population.initial-at-risk-share");
        if (initialCriminalShare + initialAtRiskShare > 1.0) {
            violations.add("population.initial-criminal-share + population.initial-at-risk-share must not exceed 1, got "
                    + (initialCriminalShare + initialAtRiskShare));
        }
        this.propensityMean = probability("population.propensity-mean");
        this.propensityStddev = nonNegative("population.propensity-stddev");

        this.attachmentCount = readInt("network.attachment-count");
        if (attachmentCount < 1 || attachmentCount >= populationSize) {
            violations.add("network.attachment-count must satisfy 1 <= m < population.size ("
                    + populationSize + "), got " + attachmentCount);
        }

        this.peerInfluenceWeight = nonNegative("behavior.peer-influence-weight");
        this.stigmaWeight = nonNegative("behavior.stigma-weight");
        this.capitalWeight = nonNegative("behavior.capital-weight");
        this.riskThreshold = probability("behavior.risk-threshold");
        this.atRiskDecayRate = probability("behavior.at-risk-decay-rate");
        this.crimeBaseRate = probability("behavior.crime-base-rate");
        this.crimeCapitalWeight = nonNegative("behavior.crime-capital-weight");
        this.crimePeerWeight = nonNegative("behavior.crime-peer-weight");

        this.coerciveCapacity = probability("policing.coercive-capacity");
        this.forensicCapacity = probability("policing.forensic-capacity");

        this.detentionDistribution = readDistribution("detention.duration.distribution");
        this.detentionMeanDays = positive("detention.duration.mean-days");
        this.detentionStigmaIncrement = probability("detention.stigma-increment");
        this.detentionCapitalIncrement = probability("detention.capital-increment");

        this.convictionBaseProbability = probability("judiciary.conviction-base-probability");
        this.evidenceWindowDays = readInt("judiciary.evidence-window-days");
        atLeast("judiciary.evidence-window-days", evidenceWindowDays, 1);
        this.evidenceFloor = probability("judiciary.evidence-floor");
        this.evidenceSaturationFraction = positive("judiciary.evidence-saturation-fraction");

        this.sentenceDistribution = readDistribution("prison.sentence.distribution");
        this.sentenceMeanDays = positive("prison.sentence.mean-days");
        this.prisonCapitalIncrement = probability("prison.capital-increment");
        this.prisonReleaseCapitalIncrement = probability("prison.release-capital-increment");

        this.congestionScalingStrength = probability("congestion.sentence-scaling-strength");
        this.congestionThresholdEnabled = readBoolean("congestion.threshold.enabled");
        this.congestionThresholdShare = probability("congestion.threshold.share");
        this.congestionShorteningFactor = readDouble("congestion.threshold.shortening-factor");
        if (!(congestionShorteningFactor > 0.0 && congestionShorteningFactor <= 1.0)) {
            violations.add("congestion.threshold.shortening-factor must be in (0, 1], got " + congestionShorteningFactor);
        }

        this.rewiringEnabled = readBoolean("rewiring.enabled");
        this.dropLawfulEdgeProbability = probability("rewiring.drop-lawful-edge-probability");
        this.addCriminalEdgeProbability = probability("rewiring.add-criminal-edge-probability");
        this.maxNewEdgesPerEvent = readInt("rewiring.max-new-edges-per-event");
        atLeast("rewiring.max-new-edges-per-event", maxNewEdgesPerEvent, 0);

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
    }

    /**
     * Reads and validates the parameters from a {@code crimenet.simulation} block.
     *
     * @param simulationConfig The block itself (not the application root).
     * @return The validated parameters.
     * @throws InvalidConfigurationException if any setting is missing or invalid.
     */
    public static SimulationParameters fromConfig(Config simulationConfig) {
        return new SimulationParameters(simulationConfig);
    }

    /**
     * Reads the parameters from a full application configuration.
     *
     * @param applicationConfig A resolved configuration containing {@value #CONFIG_PATH}.
     * @return The validated parameters.
     */
    public static SimulationParameters fromApplicationConfig(Config applicationConfig) {
        if (!applicationConfig.hasPath(CONFIG_PATH)) {
            throw new InvalidConfigurationException(List.of("Missing configuration block '" + CONFIG_PATH + "'"));
        }
        return fromConfig(applicationConfig.getConfig(CONFIG_PATH));
    }

    /**
     * @return The parameters defined in {@code reference.conf}.
     */
    public static SimulationParameters defaults() {
        return fromConfig(referenceConfig());
    }

    /**
     * @return The raw {@code crimenet.simulation} block from {@code reference.conf}.
     */
    public static Config referenceConfig() {
        return ConfigFactory.defaultReference().getConfig(CONFIG_PATH);
    }

    /**
     * Returns a copy with some settings replaced.
     *
     * @param overrides Dotted paths relative to the simulation block, e.g. {@code "policing.forensic-capacity"}.
     * @return The new, validated parameters.
     */
    public SimulationParameters withOverrides(Map<String, ?> overrides) {
        return fromConfig(ConfigFactory.parseMap(overrides).withFallback(source).resolve());
    }

    /**
     * @return The configuration block these parameters were read from.
     */
    public Config toConfig() {
        return source;
    }

    private void rejectUnknownSettings() {
        Config reference = referenceConfig();
        for (Map.Entry<String, ConfigValue> entry : source.entrySet()) {
            if (!reference.hasPath(entry.getKey())) {
                violations.add("Unknown setting '" + entry.getKey() + "'");
            }
        }
    }

    private long readLong(String path) {
        try {
            return source.getLong(path);
        } catch (ConfigException e) {
            violations.add(e.getMessage());
            return 0L;
        }
    }

    private int readInt(String path) {
        try {
            return source.getInt(path);
        } catch (ConfigException e) {
            violations.add(e.getMessage());
            return 0;
        }
    }

    private double readDouble(String path) {
        try {
            return source.getDouble(path);
        } catch (ConfigException e) {
            violations.add(e.getMessage());
            return 0.0;
        }
    }

    private boolean readBoolean(String path) {
        try {
            return source.getBoolean(path);
        } catch (ConfigException e) {
            violations.add(e.getMessage());
            return false;
        }
    }

    private DurationDistribution readDistribution(String path) {
        try {
            return source.getEnum(DurationDistribution.class, path);
        } catch (ConfigException e) {
            violations.add(e.getMessage());
            return DurationDistribution.FIXED;
        }
    }

    private double probability(String path) {
        double value = readDouble(path);
        if (!(value >= 0.0 && value <= 1.0)) {
            violations.add(path + " must be in [0, 1], got " + value);
        }
        return value;
    }

    private double nonNegative(String path) {
        double value = readDouble(path);
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            violations.add(path + " must be a finite value >= 0, got " + value);
        }
        return value;
    }

    private double positive(String path) {
        double value = readDouble(path);
        if (!(value > 0.0) || Double.isInfinite(value)) {
            violations.add(path + " must be a finite value > 0, got " + value);
        }
        return value;
    }

    private void atLeast(String path, int value, int min) {
        if (value < min) {
            violations.add(path + " must be >= " + min + ", got " + value);
        }
    }

    public long getSeed() {
        return seed;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public double getInitialCriminalShare() {
        return initialCriminalShare;
    }

    public double getInitialAtRiskShare() {
        return initialAtRiskShare;
    }

    public double getPropensityMean() {
        return propensityMean;
    }

    public double getPropensityStddev() {
        return propensityStddev;
    }

    public int getAttachmentCount() {
        return attachmentCount;
    }

    public double getPeerInfluenceWeight() {
        return peerInfluenceWeight;
    }

    public double getStigmaWeight() {
        return stigmaWeight;
    }

    public double getCapitalWeight() {
        return capitalWeight;
    }

    public double getRiskThreshold() {
        return riskThreshold;
    }

    public double getAtRiskDecayRate() {
        return atRiskDecayRate;
    }

    public double getCrimeBaseRate() {
        return crimeBaseRate;
    }

    public double getCrimeCapitalWeight() {
        return crimeCapitalWeight;
    }

    public double getCrimePeerWeight() {
        return crimePeerWeight;
    }

    public double getCoerciveCapacity() {
        return coerciveCapacity;
    }

    public double getForensicCapacity() {
        return forensicCapacity;
    }

    public DurationDistribution getDetentionDistribution() {
        return detentionDistribution;
    }

    public double getDetentionMeanDays() {
        return detentionMeanDays;
    }

    public double getDetentionStigmaIncrement() {
        return detentionStigmaIncrement;
    }

    public double getDetentionCapitalIncrement() {
        return detentionCapitalIncrement;
    }

    public double getConvictionBaseProbability() {
        return convictionBaseProbability;
    }

    public int getEvidenceWindowDays() {
        return evidenceWindowDays;
    }

    public double getEvidenceFloor() {
        return evidenceFloor;
    }

    public double getEvidenceSaturationFraction() {
        return evidenceSaturationFraction;
    }

    public DurationDistribution getSentenceDistribution() {
        return sentenceDistribution;
    }

    public double getSentenceMeanDays() {
        return sentenceMeanDays;
    }

    public double getPrisonCapitalIncrement() {
        return prisonCapitalIncrement;
    }

    public double getPrisonReleaseCapitalIncrement() {
        return prisonReleaseCapitalIncrement;
    }

    public double getCongestionScalingStrength() {
        return congestionScalingStrength;
    }

    public boolean isCongestionThresholdEnabled() {
        return congestionThresholdEnabled;
    }

    public double getCongestionThresholdShare() {
        return congestionThresholdShare;
    }

    public double getCongestionShorteningFactor() {
        return congestionShorteningFactor;
    }

    public boolean isRewiringEnabled() {
        return rewiringEnabled;
    }

    public double getDropLawfulEdgeProbability() {
        return dropLawfulEdgeProbability;
    }

    public double getAddCriminalEdgeProbability() {
        return addCriminalEdgeProbability;
    }

    public int getMaxNewEdgesPerEvent() {
        return maxNewEdgesPerEvent;
    }

    /**
     * @return Number of arrest attempts per tick, {@code floor(coercive × population)}.
     */
    public int arrestAttemptsPerTick() {
        return (int) (coerciveCapacity * populationSize);
    }
}
