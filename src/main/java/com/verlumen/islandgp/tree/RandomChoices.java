package com.verlumen.islandgp.tree;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;

/** Random primitives shared by tree generation, variation and selection. */
public final class RandomChoices {
  /** Returns true with probability {@code p}. Each call is independent. */
  public static boolean flip(RandomGenerator random, double p) {
    return random.nextDouble() < p;
  }

  /** Returns a uniformly chosen element of {@code items}. */
  public static <T> T pick(RandomGenerator random, List<T> items) {
    checkArgument(!items.isEmpty(), "Cannot pick from an empty list");
    return items.get(random.nextInt(items.size()));
  }

  /** Returns a uniform integer in {@code [0, bound)}, or 0 when {@code bound} is not positive. */
  public static int below(RandomGenerator random, int bound) {
    return bound <= 0 ? 0 : random.nextInt(bound);
  }

  /** Returns a new list holding the elements of {@code items} in random order. */
  public static <T> List<T> shuffle(RandomGenerator random, List<T> items) {
    List<T> shuffled = new ArrayList<>(items);
    for (int i = shuffled.size() - 1; i > 0; i--) {
      Collections.swap(shuffled, i, random.nextInt(i + 1));
    }
    return shuffled;
  }

  private RandomChoices() {}
}
