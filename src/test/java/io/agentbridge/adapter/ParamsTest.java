package io.agentbridge.adapter;

import io.agentbridge.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class ParamsTest {

    @Test
    void requiredValuesMustBePresentAndNonBlank() {
        Params params = new Params(Map.of("owner", "octo", "blank", "  "));

        Assertions.assertEquals("octo", params.requireString("owner"));
        ValidationException missing = Assertions.assertThrows(ValidationException.class, () -> params.requireString("repo"));
        Assertions.assertEquals("Missing required parameter: repo", missing.getMessage());
        Assertions.assertThrows(ValidationException.class, () -> params.require("blank"));
        Assertions.assertFalse(params.has("blank"));
        Assertions.assertNull(params.optString("blank"));
        Assertions.assertEquals("x", params.optString("blank", "x"));
    }

    @Test
    void numbersAndBooleansAcceptJsonAndTextForms() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("a", 3);
        raw.put("b", "4");
        raw.put("c", 5.0);
        raw.put("d", 5.5);
        raw.put("e", "true");
        raw.put("f", "nope");
        Params params = new Params(raw);

        Assertions.assertEquals(3, params.requireInt("a"));
        Assertions.assertEquals(4, params.optInt("b"));
        Assertions.assertEquals(5, params.optInt("c"));
        Assertions.assertThrows(ValidationException.class, () -> params.optInt("d"));
        Assertions.assertEquals(30, params.optInt("missing", 30));
        Assertions.assertTrue(params.optBoolean("e", false));
        Assertions.assertThrows(ValidationException.class, () -> params.optBoolean("f", false));
    }

    @Test
    void integersOutsideIntRangeAreRejectedNotTruncated() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("pullNumber", 4_294_967_297L);
        raw.put("small", 42L);
        raw.put("huge", 1e12);
        raw.put("bigint", new BigInteger("99999999999999999999"));
        Params params = new Params(raw);

        ValidationException range = Assertions.assertThrows(ValidationException.class, () -> params.requireInt("pullNumber"));
        Assertions.assertTrue(range.getMessage().contains("pullNumber"));
        Assertions.assertEquals(42, params.requireInt("small"));
        Assertions.assertThrows(ValidationException.class, () -> params.optInt("huge"));
        Assertions.assertThrows(ValidationException.class, () -> params.optInt("bigint"));
    }

    @Test
    void structuredValuesAreTypeChecked() {
        Params params = new Params(Map.of("obj", Map.of("k", 1), "list", List.of(1, 2), "one", "solo"));

        Assertions.assertEquals(Map.of("k", 1), params.requireMap("obj"));
        Assertions.assertThrows(ValidationException.class, () -> params.optMap("list"));
        Assertions.assertThrows(ValidationException.class, () -> params.optString("obj"));
        Assertions.assertEquals(List.of(1, 2), params.optList("list"));
        Assertions.assertEquals(List.of("solo"), params.optList("one"));
        Assertions.assertNull(params.optList("none"));
        Assertions.assertTrue(new Params(null).asMap().isEmpty());
    }
}
