package com.rom.ei;

import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class EiDemoTest {

    @Test
    public void testModel() {
        VectorArray u = EiDemo.model().solve(Parameter.of("mu", 1.0));
        assertEquals(1, u.len());
        assertEquals(EiDemo.GRID, u.dim());
        assertTrue(u.amax().value(0) > 0.0);
    }

    @Test
    public void testSampleIncludesEndpoints() {
        List<Parameter> s = EiDemo.sample(0.5, 1.5, 3);
        assertEquals(3, s.size());
        assertEquals(0.5, s.get(0).get("mu"), 0.0);
        assertEquals(1.0, s.get(1).get("mu"), 1e-15);
        assertEquals(1.5, s.get(2).get("mu"), 0.0);
    }

    @Test
    public void testMainRunsWithBundledSettings() throws Exception {
        EiDemo.main(new String[0]);
    }
}
