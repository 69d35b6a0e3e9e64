package com.herzen.completion;

import com.herzen.completion.classification.BlockTypeClassifier;
import com.herzen.completion.classification.FallbackMode;
import com.herzen.completion.domain.ContentModels.CompletionMode;
import com.herzen.completion.domain.ContentModels.ContentNode;
import com.herzen.completion.exception.UnknownBlockTypeException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockTypeClassifierTest {

    @Test
    void classifiesRegisteredTypes() {
        BlockTypeClassifier classifier = new BlockTypeClassifier(Map.of(
                "chapter", CompletionMode.AGGREGATOR,
                "video", CompletionMode.COMPLETABLE,
                "discussion", CompletionMode.EXCLUDED), FallbackMode.NONE);

        assertEquals(CompletionMode.AGGREGATOR, classifier.classify("chapter"));
        assertEquals(CompletionMode.COMPLETABLE, classifier.classify("video"));
        assertEquals(CompletionMode.EXCLUDED, classifier.classify("discussion"));
        assertTrue(classifier.isRegistered("video"));
        assertFalse(classifier.isRegistered("poll"));
    }

    @Test
    void rejectsUnknownTypeWithoutFallback() {
        BlockTypeClassifier classifier = new BlockTypeClassifier(Map.of("chapter", CompletionMode.AGGREGATOR), FallbackMode.NONE);

        assertThrows(UnknownBlockTypeException.class, () -> classifier.classify("poll"));
        assertThrows(UnknownBlockTypeException.class, () -> classifier.classify((String) null));
    }

    @Test
    void appliesConfiguredFallback() {
        BlockTypeClassifier excluded = new BlockTypeClassifier(Map.of("chapter", CompletionMode.AGGREGATOR), FallbackMode.EXCLUDED);
        assertEquals(CompletionMode.EXCLUDED, excluded.classify("poll"));

        BlockTypeClassifier structural = new BlockTypeClassifier(Map.of(), FallbackMode.STRUCTURAL);
        assertEquals(CompletionMode.AGGREGATOR, structural.classify(new ContentNode("x", "unit", List.of("y"), null)));
        assertEquals(CompletionMode.COMPLETABLE, structural.classify(new ContentNode("y", "unit", List.of(), "x")));
        assertEquals(CompletionMode.COMPLETABLE, structural.classify("unit"));
    }

    @Test
    void validatesRegistryAtConstruction() {
        assertThrows(IllegalStateException.class, () -> new BlockTypeClassifier(Map.of(), FallbackMode.NONE));

        Map<String, CompletionMode> blank = new HashMap<>();
        blank.put(" ", CompletionMode.COMPLETABLE);
        assertThrows(IllegalStateException.class, () -> new BlockTypeClassifier(blank, FallbackMode.COMPLETABLE));
    }
}
