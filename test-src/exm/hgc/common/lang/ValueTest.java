package exm.hgc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class ValueTest {

  @Test
  public void testMasking() {
    assertEquals(0x34, Value.bits(8, 0x1234).asLong());
    assertEquals(Value.bits(4, 0), Value.bits(4, 16));
    assertEquals(-1L, Value.bits(64, -1).asLong());
    assertEquals("18446744073709551615", Value.bits(64, -1).text());
  }

  @Test
  public void testEqualityIncludesWidth() {
    assertFalse(Value.bits(8, 1).equals(Value.bits(16, 1)));
    assertTrue(Value.bool(true).equals(Value.bits(1, 1)));
  }

  @Test
  public void testZero() {
    Types.Type t = Types.tuple(Types.TOKEN, Types.bits(3),
                               Types.tuple(Types.bits(2)));
    Value z = Value.zero(t);
    assertEquals("(token, 0, (0))", z.text());
    assertEquals(Value.tuple(Arrays.asList(Value.token(), Value.bits(3, 0),
                  Value.tuple(Arrays.asList(Value.bits(2, 0))))), z);
    assertFalse(z.element(1).isTrue());
  }

  @Test
  public void testStrictnessNames() {
    for (ChannelStrictness s: ChannelStrictness.values()) {
      assertEquals(s, ChannelStrictness.fromString(s.text()));
    }
    assertEquals(ChannelStrictness.PROVEN_MUTUALLY_EXCLUSIVE,
                 ChannelStrictness.DEFAULT);
    assertNull(ChannelStrictness.fromString("TOTAL_ORDER"));
  }
}
