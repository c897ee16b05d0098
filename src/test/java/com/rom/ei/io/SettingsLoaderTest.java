package com.rom.ei.io;

import com.rom.ei.algorithms.EiGreedyConfig;
import com.rom.ei.algorithms.Projection;
import com.rom.ei.api.InvalidConfigurationException;
import com.rom.ei.interpolation.Algorithm;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class SettingsLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testParseEiGreedy() {
        InterpolationSettings s = SettingsLoader.parse(
                "{\"algorithm\":\"ei_greedy\",\"targetError\":1e-6,\"maxInterpolationDofs\":25,\"projection\":\"ei\"}");
        assertEquals(Algorithm.EI_GREEDY, s.algorithmType());

        EiGreedyConfig config = s.toEiGreedyConfig();
        assertEquals(Projection.EI, config.projection());
        assertEquals(1e-6, config.targetError(), 0.0);
        assertEquals(Integer.valueOf(25), config.maxInterpolationDofs());
        assertNull(config.product());
    }

    @Test
    public void testDefaults() {
        InterpolationSettings s = SettingsLoader.parse("{}");
        assertEquals(Algorithm.EI_GREEDY, s.algorithmType());
        assertEquals("orthogonal", s.getProjection());
        assertEquals("memory", s.getCacheRegion());
        assertNull(s.getTargetError());
        assertNull(s.toEiGreedyConfig().maxInterpolationDofs());
    }

    @Test
    public void testLoadResourceIgnoresUnknownKeys() throws IOException {
        InterpolationSettings s = SettingsLoader.loadResource("deim-settings.json");
        assertEquals(Algorithm.DEIM, s.algorithmType());
        assertEquals(Integer.valueOf(3), s.toDeimConfig().modes());
    }

    @Test
    public void testLoadFileAndWriteBack() throws IOException {
        InterpolationSettings s = new InterpolationSettings();
        s.setTargetError(1e-4);
        s.setProjection("ei");
        Path file = tmp.newFile("settings.json").toPath();
        Files.writeString(file, SettingsLoader.toJson(s));

        InterpolationSettings loaded = SettingsLoader.load(file);
        assertEquals(s, loaded);
        // unset options are left out
        assertFalse(SettingsLoader.toJson(s).contains("modes"));
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        SettingsLoader.loadResource("no-such-settings.json");
    }

    @Test
    public void testInvalidSettingsFailOnLoad() {
        String[] invalid = {
                "{\"algorithm\":\"pod\"}",
                "{\"projection\":\"galerkin\"}",
                "{\"maxInterpolationDofs\":0}",
                "{\"targetError\":-1.0}",
                "{\"algorithm\":\"deim\",\"modes\":-2}",
                "{\"targetError\": \"small\"}",
                "{not json" };
        for (String json : invalid) {
            try {
                SettingsLoader.parse(json);
                fail("Should reject " + json);
            } catch (InvalidConfigurationException e) {
                // Expected
            }
        }
    }
}
