package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Immutable set of UTF-16 code units held as sorted, disjoint, non-adjacent ranges.
final class CharSet {

  static final CharSet EMPTY = new CharSet(new int[0]);
  static final CharSet ALL = range(Character.MIN_VALUE, Character.MAX_VALUE);
  static final CharSet DIGIT = range('0', '9');
  static final CharSet WORD = DIGIT.union(range('A', 'Z')).union(range('a', 'z')).union(of('_'));
  static final CharSet LINE_TERMINATOR = of('\n').union(of('\r')).union(range('\u2028', '\u2029'));
  static final CharSet SPACE = range('\t', '\r').union(of(' ')).union(of('\u00A0')).union(of('\u1680'))
      .union(range('\u2000', '\u200A')).union(range('\u2028', '\u2029')).union(of('\u202F'))
      .union(of('\u205F')).union(of('\u3000')).union(of('\uFEFF'));
  static final CharSet DOT = LINE_TERMINATOR.complement();

  /// Flattened `[lo0, hi0, lo1, hi1, ...]`.
  private final int[] ranges;

  private CharSet(int[] ranges) {
    this.ranges = ranges;
  }

  static CharSet of(char c) {
    return range(c, c);
  }

  static CharSet range(char from, char to) {
    if (from > to) {
      throw new IllegalArgumentException("range out of order: " + (int) from + "-" + (int) to);
    }
    return new CharSet(new int[] {from, to});
  }

  boolean isEmpty() {
    return ranges.length == 0;
  }

  boolean isSingle() {
    return ranges.length == 2 && ranges[0] == ranges[1];
  }

  int rangeCount() {
    return ranges.length / 2;
  }

  char low(int index) {
    return (char) ranges[index * 2];
  }

  char high(int index) {
    return (char) ranges[index * 2 + 1];
  }

  CharSet union(CharSet other) {
    List<int[]> all = new ArrayList<>();
    for (int i = 0; i < ranges.length; i += 2) {
      all.add(new int[] {ranges[i], ranges[i + 1]});
    }
    for (int i = 0; i < other.ranges.length; i += 2) {
      all.add(new int[] {other.ranges[i], other.ranges[i + 1]});
    }
    all.sort((a, b) -> Integer.compare(a[0], b[0]));
    List<int[]> merged = new ArrayList<>();
    for (int[] r : all) {
      int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
      if (last != null && r[0] <= last[1] + 1) {
        last[1] = Math.max(last[1], r[1]);
      } else {
        merged.add(new int[] {r[0], r[1]});
      }
    }
    int[] flat = new int[merged.size() * 2];
    for (int i = 0; i < merged.size(); i++) {
      flat[i * 2] = merged.get(i)[0];
      flat[i * 2 + 1] = merged.get(i)[1];
    }
    return new CharSet(flat);
  }

  CharSet complement() {
    List<Integer> out = new ArrayList<>();
    int next = Character.MIN_VALUE;
    for (int i = 0; i < ranges.length; i += 2) {
      if (ranges[i] > next) {
        out.add(next);
        out.add(ranges[i] - 1);
      }
      next = ranges[i + 1] + 1;
    }
    if (next <= Character.MAX_VALUE) {
      out.add(next);
      out.add((int) Character.MAX_VALUE);
    }
    return new CharSet(out.stream().mapToInt(Integer::intValue).toArray());
  }

  boolean contains(char c) {
    for (int i = 0; i < ranges.length; i += 2) {
      if (c >= ranges[i] && c <= ranges[i + 1]) {
        return true;
      }
    }
    return false;
  }

  Automaton toAutomaton() {
    if (ranges.length == 0) {
      return Automaton.makeEmpty();
    }
    List<Automaton> parts = new ArrayList<>();
    for (int i = 0; i < ranges.length; i += 2) {
      parts.add(Automaton.makeCharRange((char) ranges[i], (char) ranges[i + 1]));
    }
    return Automaton.union(parts);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CharSet that && Arrays.equals(ranges, that.ranges);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(ranges);
  }
}
