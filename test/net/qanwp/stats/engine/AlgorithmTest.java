package net.qanwp.stats.engine;

import net.qanwp.stats.exception.UnknownAlgorithmException;
import org.junit.Test;

import static org.junit.Assert.*;

public class AlgorithmTest {

  @Test
  public void testFromId() {
    for (Algorithm algorithm : Algorithm.values()) {
      assertSame(algorithm, Algorithm.fromId(algorithm.getId()));
    }
    assertSame(Algorithm.ENSEMBLE_BAYESIAN, Algorithm.fromId("ensemble_bayesian"));
  }

  @Test(expected = UnknownAlgorithmException.class)
  public void testIdsAreCaseSensitive() {
    Algorithm.fromId("KALMAN");
  }

  @Test(expected = UnknownAlgorithmException.class)
  public void testNullId() {
    Algorithm.fromId(null);
  }

  @Test
  public void testIds() {
    assertEquals(6, Algorithm.ids().size());
    assertEquals("trend_analysis", Algorithm.ids().get(5));
  }
}
