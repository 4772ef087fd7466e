/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Set;

/**
 * Which rules a {@link CumulativePropagator} runs. Instances are immutable.
 * Settings can be read from JSON objects such as
 * <pre>
 * { "coreTimes": true, "coreTimeHoles": false, "edgeFinding": true,
 *   "energeticReasoning": true, "shortEdgeFindingExplanations": true }
 * </pre>
 * where missing keys keep their default value.
 */
public final class CumulativeSettings {

    public static final String DEFAULT_RESOURCE = "/cumulative-settings.json";

    private static final String CORE_TIMES = "coreTimes";
    private static final String CORE_TIME_HOLES = "coreTimeHoles";
    private static final String EDGE_FINDING = "edgeFinding";
    private static final String ENERGETIC_REASONING = "energeticReasoning";
    private static final String SHORT_EXPLANATIONS = "shortEdgeFindingExplanations";

    private static final Set<String> KEYS = Set.of(CORE_TIMES, CORE_TIME_HOLES, EDGE_FINDING,
            ENERGETIC_REASONING, SHORT_EXPLANATIONS);

    private static final CumulativeSettings DEFAULTS = new CumulativeSettings(true, false, true, true, true);

    private final boolean useCoreTimes;
    private final boolean useCoreTimeHoles;
    private final boolean useEdgeFinding;
    private final boolean useEnergeticReasoning;
    private final boolean useShortEdgeFindingExplanations;

    private CumulativeSettings(boolean useCoreTimes, boolean useCoreTimeHoles, boolean useEdgeFinding,
                               boolean useEnergeticReasoning, boolean useShortEdgeFindingExplanations) {
        this.useCoreTimes = useCoreTimes;
        this.useCoreTimeHoles = useCoreTimeHoles;
        this.useEdgeFinding = useEdgeFinding;
        this.useEnergeticReasoning = useEnergeticReasoning;
        this.useShortEdgeFindingExplanations = useShortEdgeFindingExplanations;
    }

    /**
     * Core times, edge-finding and energetic reasoning on, holes off.
     */
    public static CumulativeSettings defaults() {
        return DEFAULTS;
    }

    /**
     * @throws IllegalArgumentException on an unknown key
     * @throws JSONException if a value is not a boolean
     */
    public static CumulativeSettings fromJson(JSONObject json) {
        for (String key : json.keySet()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("unknown cumulative setting '" + key + "'");
            }
        }
        return new CumulativeSettings(
                flag(json, CORE_TIMES, DEFAULTS.useCoreTimes),
                flag(json, CORE_TIME_HOLES, DEFAULTS.useCoreTimeHoles),
                flag(json, EDGE_FINDING, DEFAULTS.useEdgeFinding),
                flag(json, ENERGETIC_REASONING, DEFAULTS.useEnergeticReasoning),
                flag(json, SHORT_EXPLANATIONS, DEFAULTS.useShortEdgeFindingExplanations));
    }

    private static boolean flag(JSONObject json, String key, boolean defaultValue) {
        return json.has(key) ? json.getBoolean(key) : defaultValue;
    }

    /**
     * Reads the settings from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static CumulativeSettings fromResource(String name) {
        try (InputStream in = CumulativeSettings.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("no settings resource " + name);
            }
            return fromJson(new JSONObject(new JSONTokener(in)));
        } catch (IOException e) {
            throw new IllegalArgumentException("cannot read settings resource " + name, e);
        }
    }

    /**
     * @return the settings of {@link #DEFAULT_RESOURCE}
     */
    public static CumulativeSettings load() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put(CORE_TIMES, useCoreTimes)
                .put(CORE_TIME_HOLES, useCoreTimeHoles)
                .put(EDGE_FINDING, useEdgeFinding)
                .put(ENERGETIC_REASONING, useEnergeticReasoning)
                .put(SHORT_EXPLANATIONS, useShortEdgeFindingExplanations);
    }

    public boolean useCoreTimes() {
        return useCoreTimes;
    }

    public boolean useCoreTimeHoles() {
        return useCoreTimeHoles;
    }

    public boolean useEdgeFinding() {
        return useEdgeFinding;
    }

    public boolean useEnergeticReasoning() {
        return useEnergeticReasoning;
    }

    public boolean useShortEdgeFindingExplanations() {
        return useShortEdgeFindingExplanations;
    }

    public CumulativeSettings withCoreTimes(boolean b) {
        return new CumulativeSettings(b, useCoreTimeHoles, useEdgeFinding, useEnergeticReasoning, useShortEdgeFindingExplanations);
    }

    public CumulativeSettings withCoreTimeHoles(boolean b) {
        return new CumulativeSettings(useCoreTimes, b, useEdgeFinding, useEnergeticReasoning, useShortEdgeFindingExplanations);
    }

    public CumulativeSettings withEdgeFinding(boolean b) {
        return new CumulativeSettings(useCoreTimes, useCoreTimeHoles, b, useEnergeticReasoning, useShortEdgeFindingExplanations);
    }

    public CumulativeSettings withEnergeticReasoning(boolean b) {
        return new CumulativeSettings(useCoreTimes, useCoreTimeHoles, useEdgeFinding, b, useShortEdgeFindingExplanations);
    }

    public CumulativeSettings withShortEdgeFindingExplanations(boolean b) {
        return new CumulativeSettings(useCoreTimes, useCoreTimeHoles, useEdgeFinding, useEnergeticReasoning, b);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CumulativeSettings)) {
            return false;
        }
        CumulativeSettings s = (CumulativeSettings) o;
        return useCoreTimes == s.useCoreTimes && useCoreTimeHoles == s.useCoreTimeHoles
                && useEdgeFinding == s.useEdgeFinding && useEnergeticReasoning == s.useEnergeticReasoning
                && useShortEdgeFindingExplanations == s.useShortEdgeFindingExplanations;
    }

    @Override
    public int hashCode() {
        return Objects.hash(useCoreTimes, useCoreTimeHoles, useEdgeFinding, useEnergeticReasoning,
                useShortEdgeFindingExplanations);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
