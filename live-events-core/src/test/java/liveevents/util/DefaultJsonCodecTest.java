package liveevents.util;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  enum Color { RED }

  @Test
  void toJsonWithEmptyMap() {
    assertEquals("{}", codec.toJson(Map.of()));
  }

  @Test
  void toJsonKeepsInsertionOrder() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("b", 1);
    map.put("a", "2");

    assertEquals("{\"b\":1,\"a\":\"2\"}", codec.toJson(map));
  }

  @Test
  void toJsonEscapesSpecialCharacters() {
    String json = codec.toJson(Map.of("msg", "Hello \"World\"\nNew\\Line\u0001"));

    assertTrue(json.contains("\\\"World\\\""));
    assertTrue(json.contains("\\n"));
    assertTrue(json.contains("\\\\"));
    assertTrue(json.contains("\\u0001"));
  }

  @Test
  void toJsonWithNullValues() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("key", null);

    assertEquals("{\"key\":null}", codec.toJson(map));
    assertEquals("null", codec.toJson(null));
  }

  @Test
  void toJsonWritesNestedStructures() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("list", List.of(1, "two", false));
    map.put("array", new int[] {3, 4});
    map.put("nested", Map.of("x", 1.5));

    assertEquals("{\"list\":[1,\"two\",false],\"array\":[3,4],\"nested\":{\"x\":1.5}}",
        codec.toJson(map));
  }

  @Test
  void toJsonWritesEnumsAndTemporalsAsStrings() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("color", Color.RED);
    map.put("at", Instant.parse("2015-03-01T12:00:00Z"));

    assertEquals("{\"color\":\"RED\",\"at\":\"2015-03-01T12:00:00Z\"}", codec.toJson(map));
  }

  @Test
  void toJsonWithNullKeyThrows() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(null, "value");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
        codec.toJson(map));
    assertTrue(ex.getMessage().contains("null keys"));
  }

  @Test
  void toJsonRejectsNonFiniteNumbers() {
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(Map.of("x", Double.NaN)));
    assertThrows(IllegalArgumentException.class,
        () -> codec.toJson(Map.of("x", Float.POSITIVE_INFINITY)));
  }

  @Test
  void toJsonRejectsUnknownTypes() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
        codec.toJson(Map.of("x", new Object())));
    assertTrue(ex.getMessage().contains("java.lang.Object"));
  }

  @Test
  void parseObjectWithEmptyJson() {
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void parseObjectWithWhitespace() {
    Map<String, Object> map = codec.parseObject("  {  \"key\"  :  \"value\"  }  ");

    assertEquals("value", map.get("key"));
  }

  @Test
  void parseObjectUnescapesSpecialCharacters() {
    Map<String, Object> map = codec.parseObject("{\"msg\":\"Hello \\\"World\\\"\\nNew\\\\Line \\u00e9\"}");

    assertEquals("Hello \"World\"\nNew\\Line \u00e9", map.get("msg"));
  }

  @Test
  void parseKeepsNullValues() {
    Map<String, Object> map = codec.parseObject("{\"present\":\"value\",\"absent\":null}");

    assertEquals(2, map.size());
    assertTrue(map.containsKey("absent"));
    assertNull(map.get("absent"));
  }

  @Test
  void parseNarrowsNumbers() {
    Map<String, Object> map = codec.parseObject(
        "{\"i\":42,\"l\":9000000000,\"b\":123456789012345678901234567890,\"d\":-1.5e2}");

    assertEquals(42, map.get("i"));
    assertEquals(9_000_000_000L, map.get("l"));
    assertEquals(new BigInteger("123456789012345678901234567890"), map.get("b"));
    assertEquals(-150.0, map.get("d"));
  }

  @Test
  void parseNestedValues() {
    Map<String, Object> map = codec.parseObject("{\"a\":[1,{\"b\":true}],\"c\":{}}");

    assertEquals(List.of(1, Map.of("b", true)), map.get("a"));
    assertEquals(Map.of(), map.get("c"));
  }

  @Test
  void parseObjectRejectsNonObjects() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("\"text\""));
  }

  @Test
  void parseRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parse(null));
    assertThrows(IllegalArgumentException.class, () -> codec.parse(""));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":1"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":1} extra"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":tru}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":\"\\x\"}"));
  }

  @Test
  void parseRejectsExcessiveNesting() {
    String deep = "[".repeat(200) + "]".repeat(200);

    assertThrows(IllegalArgumentException.class, () -> codec.parse(deep));
  }
}
