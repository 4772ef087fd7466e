/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CumulativeSettingsTest {

    @Test
    public void defaults() {
        CumulativeSettings s = CumulativeSettings.defaults();
        assertTrue(s.useCoreTimes());
        assertFalse(s.useCoreTimeHoles());
        assertTrue(s.useEdgeFinding());
        assertTrue(s.useEnergeticReasoning());
        assertTrue(s.useShortEdgeFindingExplanations());
        assertEquals(s, CumulativeSettings.load());
    }

    @Test
    public void fromJson() {
        CumulativeSettings s = CumulativeSettings.fromJson(new JSONObject("{\"coreTimeHoles\": true, \"energeticReasoning\": false}"));
        assertTrue(s.useCoreTimes());
        assertTrue(s.useCoreTimeHoles());
        assertFalse(s.useEnergeticReasoning());
        assertEquals(CumulativeSettings.defaults().withCoreTimeHoles(true).withEnergeticReasoning(false), s);
        assertEquals(s, CumulativeSettings.fromJson(s.toJson()));
        assertEquals(s.hashCode(), CumulativeSettings.fromJson(s.toJson()).hashCode());
    }

    @Test
    public void fromResource() {
        CumulativeSettings s = CumulativeSettings.fromResource("/settings/edge-finding-only.json");
        assertFalse(s.useCoreTimes());
        assertTrue(s.useEdgeFinding());
        assertFalse(s.useEnergeticReasoning());
        assertTrue(s.useShortEdgeFindingExplanations());
    }

    @Test
    public void invalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> CumulativeSettings.fromResource("/settings/unknown-key.json"));
        assertThrows(IllegalArgumentException.class, () -> CumulativeSettings.fromResource("/settings/missing.json"));
        assertThrows(JSONException.class, () -> CumulativeSettings.fromJson(new JSONObject("{\"edgeFinding\": 3}")));
    }
}
