package com.yhy.nesting.cut.service;

import com.yhy.nesting.cut.config.NestingProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class MaterialDensityTableTest {

    @Test
    // 牌号不区分大小写，未知牌号走默认密度
    void lookupIsCaseInsensitiveWithDefault() {
        NestingProperties properties = new NestingProperties();
        properties.getDensities().put("cu", 8960.0);
        properties.setDefaultDensity(7000);
        MaterialDensityTable table = new MaterialDensityTable(properties);

        assertEquals(7850, table.densityOf("ms").getAsDouble());
        assertEquals(2700, table.densityOf(" AL ").getAsDouble());
        assertEquals(8960, table.densityOf("CU").getAsDouble());
        assertFalse(table.densityOf("TI").isPresent());
        assertFalse(table.densityOf(null).isPresent());
        assertEquals(7000, table.getDefaultDensity());
    }
}
