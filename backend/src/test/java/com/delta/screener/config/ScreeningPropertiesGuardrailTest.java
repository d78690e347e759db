package com.delta.screener.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScreeningPropertiesGuardrailTest {

    @Test
    void lengthAndConcurrencyAreClamped() {
        ScreeningProperties properties = new ScreeningProperties();
        properties.setMinTextLength(0);
        properties.setBatchConcurrency(-3);
        assertEquals(1, properties.getMinTextLength());
        assertEquals(1, properties.getBatchConcurrency());
    }

    @Test
    void defaultsMatchShippedConfiguration() {
        ScreeningProperties properties = new ScreeningProperties();
        assertEquals(50, properties.getMinTextLength());
        assertNull(properties.getReferenceYear());
        assertEquals(40, properties.getSkills().getKeywords().size());
        assertEquals(7, properties.getBias().getCategories().size());
        assertTrue(properties.getBias().getCategories().get("name").isCaseSensitive());
        assertFalse(properties.getBias().getCategories().get("age").isCaseSensitive());
    }

    @Test
    void nullListsBecomeEmpty() {
        ScreeningProperties properties = new ScreeningProperties();
        properties.getSkills().setKeywords(null);
        properties.getBias().setPhotoTerms(null);
        assertTrue(properties.getSkills().getKeywords().isEmpty());
        assertTrue(properties.getBias().getPhotoTerms().isEmpty());
    }
}
