package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.State;
import dk.brics.automaton.Transition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Writes a regular language back as an anchored ECMA pattern that [PatternCompiler]
/// accepts, by state elimination over the minimal DFA.
final class RegexWriter {

  /// Matches nothing.
  static final String EMPTY_LANGUAGE = "^[^\\s\\S]$";

  private RegexWriter() {}

  sealed interface Rx permits Eps, Chars, Seq, Alt, Star {}

  record Eps() implements Rx {}

  record Chars(CharSet set) implements Rx {}

  record Seq(List<Rx> parts) implements Rx {}

  /// `optional` adds the empty string to the options.
  record Alt(List<Rx> options, boolean optional) implements Rx {}

  record Star(Rx inner) implements Rx {}

  private static final Rx EPS = new Eps();

  static String write(Automaton language) {
    Automaton dfa = language.clone();
    dfa.minimize();
    if (dfa.isEmpty()) {
      return EMPTY_LANGUAGE;
    }
    Rx rx = eliminate(dfa);
    return "^(?:" + render(rx) + ")$";
  }

  private static Rx eliminate(Automaton dfa) {
    List<State> states = new ArrayList<>(live(dfa));
    Map<State, Integer> index = new HashMap<>();
    for (int i = 0; i < states.size(); i++) {
      index.put(states.get(i), i);
    }
    int n = states.size();
    int start = n;
    int end = n + 1;
    Rx[][] edges = new Rx[n + 2][n + 2];
    for (State state : states) {
      int from = index.get(state);
      Map<Integer, CharSet> byTarget = new LinkedHashMap<>();
      for (Transition t : state.getSortedTransitions(false)) {
        Integer to = index.get(t.getDest());
        if (to != null) {
          byTarget.merge(to, CharSet.range(t.getMin(), t.getMax()), CharSet::union);
        }
      }
      byTarget.forEach((to, set) -> edges[from][to] = new Chars(set));
      if (state.isAccept()) {
        edges[from][end] = EPS;
      }
    }
    edges[start][index.get(dfa.getInitialState())] = EPS;

    Set<Integer> remaining = new HashSet<>();
    for (int i = 0; i < n; i++) {
      remaining.add(i);
    }
    while (!remaining.isEmpty()) {
      int k = cheapest(edges, remaining, start, end);
      remaining.remove(k);
      Rx loop = edges[k][k] == null ? EPS : star(edges[k][k]);
      for (int p = 0; p < n + 2; p++) {
        if (p == k || edges[p][k] == null || (p < n && !remaining.contains(p))) {
          continue;
        }
        for (int q = 0; q < n + 2; q++) {
          if (q == k || edges[k][q] == null || (q < n && !remaining.contains(q))) {
            continue;
          }
          Rx path = concat(concat(edges[p][k], loop), edges[k][q]);
          edges[p][q] = alt(edges[p][q], path);
        }
      }
    }
    return edges[start][end];
  }

  /// States from which an accepting state is reachable.
  private static Set<State> live(Automaton dfa) {
    Map<State, List<State>> reverse = new HashMap<>();
    Deque<State> work = new ArrayDeque<>();
    for (State state : dfa.getStates()) {
      for (Transition t : state.getTransitions()) {
        reverse.computeIfAbsent(t.getDest(), s -> new ArrayList<>()).add(state);
      }
      if (state.isAccept()) {
        work.add(state);
      }
    }
    Set<State> live = new HashSet<>(work);
    while (!work.isEmpty()) {
      for (State pred : reverse.getOrDefault(work.removeFirst(), List.of())) {
        if (live.add(pred)) {
          work.add(pred);
        }
      }
    }
    return live;
  }

  private static int cheapest(Rx[][] edges, Set<Integer> remaining, int start, int end) {
    int best = -1;
    long bestCost = Long.MAX_VALUE;
    for (int k : remaining) {
      long in = 0;
      long out = 0;
      for (int o = 0; o < edges.length; o++) {
        if (o == k || (o != start && o != end && !remaining.contains(o))) {
          continue;
        }
        if (edges[o][k] != null) {
          in++;
        }
        if (edges[k][o] != null) {
          out++;
        }
      }
      long cost = in * out;
      if (cost < bestCost || (cost == bestCost && k < best)) {
        best = k;
        bestCost = cost;
      }
    }
    return best;
  }

  static Rx concat(Rx a, Rx b) {
    if (a instanceof Eps) {
      return b;
    }
    if (b instanceof Eps) {
      return a;
    }
    List<Rx> parts = new ArrayList<>();
    addParts(parts, a);
    addParts(parts, b);
    return new Seq(List.copyOf(parts));
  }

  private static void addParts(List<Rx> parts, Rx rx) {
    if (rx instanceof Seq seq) {
      parts.addAll(seq.parts());
    } else {
      parts.add(rx);
    }
  }

  static Rx alt(Rx a, Rx b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    boolean optional = false;
    CharSet chars = CharSet.EMPTY;
    List<Rx> options = new ArrayList<>();
    for (Rx rx : List.of(a, b)) {
      List<Rx> flat = new ArrayList<>();
      if (rx instanceof Alt other) {
        optional |= other.optional();
        flat.addAll(other.options());
      } else {
        flat.add(rx);
      }
      for (Rx option : flat) {
        if (option instanceof Eps) {
          optional = true;
        } else if (option instanceof Chars c) {
          chars = chars.union(c.set());
        } else if (!options.contains(option)) {
          options.add(option);
        }
      }
    }
    if (!chars.isEmpty()) {
      options.add(0, new Chars(chars));
    }
    if (options.isEmpty()) {
      return EPS;
    }
    if (options.size() == 1 && !optional) {
      return options.get(0);
    }
    return new Alt(List.copyOf(options), optional);
  }

  static Rx star(Rx rx) {
    if (rx instanceof Eps || rx instanceof Star) {
      return rx;
    }
    if (rx instanceof Alt alt && alt.optional()) {
      Rx body = alt.options().size() == 1 ? alt.options().get(0) : new Alt(alt.options(), false);
      return star(body);
    }
    return new Star(rx);
  }

  static String render(Rx rx) {
    if (rx instanceof Eps) {
      return "";
    }
    if (rx instanceof Chars chars) {
      return renderChars(chars.set());
    }
    if (rx instanceof Seq seq) {
      StringBuilder sb = new StringBuilder();
      for (Rx part : seq.parts()) {
        sb.append(part instanceof Alt alt && !isOptionalAtom(alt) ? "(?:" + render(part) + ")" : render(part));
      }
      return sb.toString();
    }
    if (rx instanceof Alt alt) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < alt.options().size(); i++) {
        if (i > 0) {
          sb.append('|');
        }
        sb.append(render(alt.options().get(i)));
      }
      if (!alt.optional()) {
        return sb.toString();
      }
      return isAtom(alt.options()) ? sb + "?" : "(?:" + sb + ")?";
    }
    Star star = (Star) rx;
    return (star.inner() instanceof Chars ? render(star.inner()) : "(?:" + render(star.inner()) + ")") + "*";
  }

  private static boolean isOptionalAtom(Alt alt) {
    return alt.optional();
  }

  private static boolean isAtom(List<Rx> options) {
    return options.size() == 1 && options.get(0) instanceof Chars;
  }

  private static String renderChars(CharSet set) {
    if (set.equals(CharSet.DOT)) {
      return ".";
    }
    if (set.equals(CharSet.ALL)) {
      return "[\\s\\S]";
    }
    if (set.equals(CharSet.DIGIT)) {
      return "\\d";
    }
    if (set.equals(CharSet.WORD)) {
      return "\\w";
    }
    if (set.isSingle()) {
      return literal(set.low(0));
    }
    CharSet complement = set.complement();
    if (complement.rangeCount() < set.rangeCount()) {
      return "[^" + classBody(complement) + "]";
    }
    return "[" + classBody(set) + "]";
  }

  private static String classBody(CharSet set) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < set.rangeCount(); i++) {
      char lo = set.low(i);
      char hi = set.high(i);
      sb.append(classChar(lo));
      if (hi == lo + 1) {
        sb.append(classChar(hi));
      } else if (hi > lo) {
        sb.append('-').append(classChar(hi));
      }
    }
    return sb.toString();
  }

  private static String literal(char c) {
    if ("\\^$.|?*+()[]{}/".indexOf(c) >= 0) {
      return "\\" + c;
    }
    return printable(c) ? String.valueOf(c) : unicode(c);
  }

  private static String classChar(char c) {
    if ("\\]^-[".indexOf(c) >= 0) {
      return "\\" + c;
    }
    return printable(c) ? String.valueOf(c) : unicode(c);
  }

  private static boolean printable(char c) {
    return c >= 0x20 && c < 0x7F;
  }

  private static String unicode(char c) {
    return String.format("\\u%04X", (int) c);
  }
}
