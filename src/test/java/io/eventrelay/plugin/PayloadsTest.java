package io.eventrelay.plugin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.ValidationException;
import io.eventrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class PayloadsTest {
    @Test
    void readsStringOrArrayLists() throws Exception {
        ObjectNode data = (ObjectNode) Jsons.readTree("""
                {"one": "a:*", "many": ["a:*", "b:c"], "bad": [1]}
                """);
        Assertions.assertEquals(List.of("a:*"), Payloads.stringList(data, "one"));
        Assertions.assertEquals(List.of("a:*", "b:c"), Payloads.stringList(data, "many"));
        Assertions.assertTrue(Payloads.stringList(data, "missing").isEmpty());
        Assertions.assertThrows(ValidationException.class, () -> Payloads.stringList(data, "bad"));
    }

    @Test
    void instantsAcceptMillisSecondsAndIso() throws Exception {
        ObjectNode data = (ObjectNode) Jsons.readTree("""
                {"ms": 1700000000000, "secs": 1700000000.5, "iso": "2023-11-14T22:13:20Z", "junk": "yesterday"}
                """);
        Assertions.assertEquals(1_700_000_000_000L, Payloads.instantMs(data, "ms"));
        Assertions.assertEquals(1_700_000_000_500L, Payloads.instantMs(data, "secs"));
        Assertions.assertEquals(1_700_000_000_000L, Payloads.instantMs(data, "iso"));
        Assertions.assertNull(Payloads.instantMs(data, "missing"));
        Assertions.assertThrows(ValidationException.class, () -> Payloads.instantMs(data, "junk"));
    }

    @Test
    void boundsAreEnforced() {
        ObjectNode data = Jsons.object().put("limit", 0).put("name", 3);
        Assertions.assertEquals(100, Payloads.intValue(data, "other", 100, 1, 1_000));
        Assertions.assertThrows(ValidationException.class, () -> Payloads.intValue(data, "limit", 100, 1, 1_000));
        ObjectNode fractional = Jsons.object().put("limit", 2.5d).put("since", 7.9d);
        Assertions.assertThrows(ValidationException.class,
                () -> Payloads.intValue(fractional, "limit", 100, 1, 1_000));
        Assertions.assertThrows(ValidationException.class, () -> Payloads.longValue(fractional, "since", 0L));
        Assertions.assertEquals(7L, Payloads.longValue(Jsons.object().put("since", 7), "since", 0L));
        Assertions.assertThrows(ValidationException.class, () -> Payloads.text(data, "name"));
        Assertions.assertThrows(ValidationException.class, () -> Payloads.requireText(data, "missing"));
    }
}
