package net.qanwp.stats.helper;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.qanwp.stats.exception.InvalidParameterException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ArgsBaseTest {

  public static class SampleArgs extends ArgsBase {
    @Doc(help = "A real valued weight.")
    @Optional
    public double weight = 0.5;

    @Doc(help = "A window length.")
    @Optional
    public int window = 3;

    @Doc(help = "Whether to smooth.")
    @Optional
    public boolean smooth = false;

    public int undocumented = 1;

    @Override
    public void validate() {
      check(window > 0, "window must be positive, got %s", window);
    }
  }

  SampleArgs args;

  @Before
  public void setUp() {
    args = new SampleArgs();
  }

  @Test
  public void testDefaultsWithoutParams() {
    assertTrue(args.apply(null).isEmpty());
    assertEquals(0.5, args.weight, 0.0);
    assertEquals(3, args.window);
  }

  @Test
  public void testApply() {
    List<String> ignored = args.apply(ImmutableMap.of("weight", 2, "window", 7.0,
        "smooth", true, "bogus", 1));
    assertEquals(2.0, args.weight, 0.0);
    assertEquals(7, args.window);
    assertTrue(args.smooth);
    assertEquals(1, ignored.size());
    assertEquals("bogus", ignored.get(0));
  }

  @Test
  public void testUndocumentedFieldIsNotAParameter() {
    List<String> ignored = args.apply(ImmutableMap.of("undocumented", 5));
    assertEquals(1, args.undocumented);
    assertEquals(1, ignored.size());
  }

  @Test(expected = InvalidParameterException.class)
  public void testFractionalInteger() {
    args.apply(ImmutableMap.of("window", 2.5));
  }

  @Test(expected = InvalidParameterException.class)
  public void testWrongType() {
    args.apply(ImmutableMap.of("weight", "heavy"));
  }

  @Test(expected = InvalidParameterException.class)
  public void testNullValue() {
    Map<String, Object> params = new HashMap<>();
    params.put("weight", null);
    args.apply(params);
  }

  @Test(expected = InvalidParameterException.class)
  public void testNonFiniteDouble() {
    args.apply(ImmutableMap.of("weight", Double.NaN));
  }

  @Test(expected = InvalidParameterException.class)
  public void testValidateRunsAfterApply() {
    args.apply(ImmutableMap.of("window", 0));
  }

  @Test
  public void testDescribe() {
    Map<String, String> help = args.describe();
    assertEquals(3, help.size());
    assertEquals("A window length.", help.get("window"));
    assertFalse(help.containsKey("undocumented"));
  }

  @Test
  public void testToString() {
    String text = args.toString();
    assertTrue(text, text.startsWith("SampleArgs{"));
    assertTrue(text, text.contains("window=3"));
  }
}
