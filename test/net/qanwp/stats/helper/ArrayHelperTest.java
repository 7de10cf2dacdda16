package net.qanwp.stats.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class ArrayHelperTest {

  @Test
  public void testSortedCopyLeavesInput() {
    double[] input = {3, 1, 2};
    assertArrayEquals(new double[] {1, 2, 3}, ArrayHelper.sortedCopy(input), 0.0);
    assertArrayEquals(new double[] {3, 1, 2}, input, 0.0);
  }

  @Test
  public void testLastAtMost() {
    double[] sorted = {1, 2, 2, 4};
    assertEquals(2, ArrayHelper.lastAtMost(2, sorted));
    assertEquals(3, ArrayHelper.lastAtMost(10, sorted));
    assertEquals(0, ArrayHelper.lastAtMost(0, sorted));
  }

  @Test
  public void testSubtractAndSumOfSquares() {
    double[] diff = ArrayHelper.subtract(new double[] {5, 5}, new double[] {2, 1});
    assertArrayEquals(new double[] {3, 4}, diff, 0.0);
    assertEquals(25, ArrayHelper.sumOfSquares(diff), 0.0);
  }
}
