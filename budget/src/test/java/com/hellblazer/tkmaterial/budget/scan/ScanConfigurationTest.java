/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tkmaterial.budget.scan;

import com.hellblazer.tkmaterial.budget.model.Material;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ScanConfigurationTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaultsResource() {
        var config = ScanConfiguration.defaults();

        assertEquals(50, config.getEtaSteps());
        assertEquals(2.4, config.getEtaMax());
        assertEquals(List.of(1.0, 10.0, 100.0), config.getMomenta());
        assertTrue(config.isShadowIntegration());
        assertEquals(1, config.getThreads());
        assertEquals(23.0, config.getBeamPipeRadius());
        assertEquals(new Material(0.0023, 0.0019), config.getBeamPipeMaterial());
    }

    @Test
    public void testPartialDocumentKeepsDefaults() {
        var config = ScanConfiguration.fromStream(
        json("{\"etaSteps\": 7, \"threads\": 3, \"beamPipe\": {\"radius\": 30.0}}"));

        assertEquals(7, config.getEtaSteps());
        assertEquals(3, config.getThreads());
        assertEquals(30.0, config.getBeamPipeRadius());
        assertEquals(new Material(0.0023, 0.0019), config.getBeamPipeMaterial());
        assertEquals(2.4, config.getEtaMax());
    }

    @Test
    public void testFluentConfiguration() {
        var config = new ScanConfiguration().withEtaSteps(10)
                                            .withEtaMax(3.0)
                                            .withMomenta(List.of(5.0))
                                            .withShadowIntegration(false)
                                            .withThreads(2);

        assertEquals(10, config.getEtaSteps());
        assertEquals(3.0, config.getEtaMax());
        assertEquals(List.of(5.0), config.getMomenta());
        assertFalse(config.isShadowIntegration());
        assertEquals(2, config.getThreads());
    }

    @Test
    public void testInvalidValuesAreRejected() {
        var config = new ScanConfiguration();
        assertThrows(IllegalArgumentException.class, () -> config.withEtaSteps(0));
        assertThrows(IllegalArgumentException.class, () -> config.withEtaMax(-0.1));
        assertThrows(IllegalArgumentException.class, () -> config.withEtaMax(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> config.withThreads(0));
        assertThrows(IllegalArgumentException.class, () -> config.withBeamPipe(0, Material.ZERO));
        assertThrows(IllegalArgumentException.class, () -> ScanConfiguration.fromStream(json("{\"etaSteps\": 0}")));
    }

    @Test
    public void testMalformedDocuments() {
        assertThrows(UncheckedIOException.class, () -> ScanConfiguration.fromStream(json("{\"etaSteps\": ")));
        assertThrows(UncheckedIOException.class, () -> ScanConfiguration.fromStream(json("[1, 2]")));
        assertThrows(UncheckedIOException.class,
                     () -> ScanConfiguration.fromStream(json("{\"etaSteps\": \"many\"}")));
        assertThrows(UncheckedIOException.class,
                     () -> ScanConfiguration.fromStream(json("{\"momenta\": [1.0, \"x\"]}")));
        assertThrows(UncheckedIOException.class, () -> ScanConfiguration.fromResource("/tkmaterial/missing.json"));
    }
}
