package com.themixednuts.typeschema.generator;

import com.themixednuts.typeschema.testtypes.SampleTypes;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;

import static org.junit.jupiter.api.Assertions.*;

class FieldTagTest {

    private static FieldTag tagOf(Class<?> type, String fieldName) throws NoSuchFieldException {
        Field field = type.getDeclaredField(fieldName);
        return FieldTag.of(field, type);
    }

    @Test
    void publicField_isVisibleUnderItsOwnName() throws Exception {
        FieldTag tag = tagOf(SampleTypes.Visibility.class, "shown");
        assertEquals(new FieldTag("shown", true, false, false), tag);
    }

    @Test
    void jsonProperty_renamesAndExposesPrivateField() throws Exception {
        FieldTag tag = tagOf(SampleTypes.Visibility.class, "hidden");
        assertEquals("renamed", tag.name());
        assertTrue(tag.visible());
    }

    @Test
    void privateField_isMetadataCarrier() throws Exception {
        FieldTag tag = tagOf(SampleTypes.Visibility.class, "metadata");
        assertFalse(tag.visible());
        assertFalse(tag.ignored());
    }

    @Test
    void transientField_isNotVisible() throws Exception {
        assertFalse(tagOf(SampleTypes.Visibility.class, "transientField").visible());
    }

    @Test
    void dashName_isIgnored() throws Exception {
        FieldTag tag = tagOf(SampleTypes.Visibility.class, "dashed");
        assertEquals("-", tag.name());
        assertTrue(tag.ignored());
    }

    @Test
    void jsonIgnore_isIgnored() throws Exception {
        assertTrue(tagOf(SampleTypes.Basic.class, "omitted").ignored());
    }

    @Test
    void recordComponents_areVisible() throws Exception {
        assertTrue(tagOf(SampleTypes.Point.class, "x").visible());
        assertEquals("label", tagOf(SampleTypes.Point.class, "name").name());
    }

    @Test
    void jsonInclude_marksOmitEmpty() throws Exception {
        assertTrue(tagOf(SampleTypes.Basic.class, "bool").omitEmpty());
        assertFalse(tagOf(SampleTypes.Basic.class, "float64").omitEmpty());
    }

    @Test
    void classLevelInclude_appliesUnlessFieldOverrides() throws Exception {
        assertTrue(tagOf(SampleTypes.OmitAll.class, "a").omitEmpty());
        assertFalse(tagOf(SampleTypes.OmitAll.class, "b").omitEmpty());
    }
}
