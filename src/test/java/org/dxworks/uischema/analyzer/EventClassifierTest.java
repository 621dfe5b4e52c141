package org.dxworks.uischema.analyzer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventClassifierTest {

    @Test
    void onFollowedByUppercaseIsAnEvent() {
        assertTrue(EventClassifier.isEventName("onClick"));
        assertTrue(EventClassifier.isEventName("onValueChange"));
    }

    @Test
    void lookalikesAreNotEvents() {
        assertFalse(EventClassifier.isEventName("online"));
        assertFalse(EventClassifier.isEventName("once"));
        assertFalse(EventClassifier.isEventName("on"));
        assertFalse(EventClassifier.isEventName("title"));
        assertFalse(EventClassifier.isEventName(null));
    }

    @Test
    void ecosystemSpellingsAreNormalized() {
        assertEquals("onClick", EventClassifier.normalize("@click"));
        assertEquals("onClick", EventClassifier.normalize("v-on:click"));
        assertEquals("onClick", EventClassifier.normalize("on:click"));
        assertEquals("onValueChange", EventClassifier.normalize("(valueChange)"));
        assertEquals("onUpdateModelValue", EventClassifier.normalize("@update:model-value"));
        assertTrue(EventClassifier.isEventName("@click"));
    }

    @Test
    void plainNamesAreLeftAlone() {
        assertEquals("label", EventClassifier.normalize("label"));
        assertEquals("onClick", EventClassifier.normalize(" onClick "));
    }

    @Test
    void bareRuntimeEventNamesAreCanonicalized() {
        assertEquals("onChange", EventClassifier.canonicalize("change"));
        assertEquals("onUpdateModelValue", EventClassifier.canonicalize("update:modelValue"));
        assertEquals("onSelect", EventClassifier.canonicalize("onSelect"));
    }
}
