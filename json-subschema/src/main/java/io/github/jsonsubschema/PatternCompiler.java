package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;

import java.util.ArrayList;
import java.util.List;

/// Compiles the ECMA-262 subset used by `pattern` and `patternProperties` into
/// dk.brics automata.
///
/// Supported: literals and escapes, `.`, character classes, `\d \w \s` and their
/// negations, capturing, named and non-capturing groups, alternation, greedy and lazy
/// quantifiers, and `^`/`$` at the edges of a top-level alternative.
///
/// JSON Schema patterns search rather than match, so an alternative without `^` may be
/// preceded by anything and one without `$` may be followed by anything.
///
/// Lookaround, backreferences, word boundaries and anchors anywhere else raise
/// [IllegalArgumentException].
final class PatternCompiler {

  private static final int MAX_REPEAT = 1000;

  private final String source;
  private int pos;

  private PatternCompiler(String source) {
    this.source = source;
  }

  /// Language of strings containing a match of `pattern`.
  static Automaton compile(String pattern) {
    PatternCompiler parser = new PatternCompiler(pattern);
    Automaton result = parser.topLevel();
    SubschemaLogging.LOG.finest(() -> "PatternCompiler.compile " + pattern + " states=" + result.getNumberOfStates());
    return result;
  }

  private Automaton topLevel() {
    List<Automaton> branches = new ArrayList<>();
    do {
      boolean anchoredStart = peek('^');
      if (anchoredStart) {
        pos++;
      }
      Automaton body = sequence(true);
      boolean anchoredEnd = peek('$');
      if (anchoredEnd) {
        pos++;
      }
      if (!atEnd() && !peek('|')) {
        throw error("unexpected '" + source.charAt(pos) + "'");
      }
      Automaton branch = body;
      if (!anchoredStart) {
        branch = Automaton.makeAnyString().concatenate(branch);
      }
      if (!anchoredEnd) {
        branch = branch.concatenate(Automaton.makeAnyString());
      }
      branches.add(branch);
    } while (accept('|'));
    return Automaton.union(branches);
  }

  /// Alternation inside a group.
  private Automaton disjunction() {
    List<Automaton> branches = new ArrayList<>();
    do {
      branches.add(sequence(false));
    } while (accept('|'));
    return Automaton.union(branches);
  }

  /// A run of quantified atoms. At top level a `$` ends the run so the caller can check it
  /// is the last thing in its alternative.
  private Automaton sequence(boolean topLevel) {
    Automaton result = Automaton.makeEmptyString();
    while (!atEnd()) {
      char c = source.charAt(pos);
      if (c == '|' || c == ')') {
        break;
      }
      if (c == '$' && topLevel) {
        break;
      }
      if (c == '^' || c == '$') {
        throw error("anchor '" + c + "' is only supported at the start or end of a top-level alternative");
      }
      result = result.concatenate(quantified(atom()));
    }
    return result;
  }

  private Automaton atom() {
    char c = source.charAt(pos++);
    switch (c) {
      case '.':
        return CharSet.DOT.toAutomaton();
      case '[':
        return characterClass().toAutomaton();
      case '(':
        return group();
      case '\\':
        return escapeAtom();
      case '*':
      case '+':
      case '?':
        throw error("nothing to repeat");
      case '{':
        if (quantifierAhead(pos - 1)) {
          throw error("nothing to repeat");
        }
        return Automaton.makeChar(c);
      default:
        return Automaton.makeChar(c);
    }
  }

  private Automaton group() {
    if (accept('?')) {
      if (accept(':')) {
        // non-capturing
      } else if (peek('<') && pos + 1 < source.length() && source.charAt(pos + 1) != '=' && source.charAt(pos + 1) != '!') {
        int close = source.indexOf('>', pos);
        if (close < 0) {
          throw error("unterminated group name");
        }
        pos = close + 1;
      } else {
        throw error("lookaround assertions are not supported");
      }
    }
    Automaton inner = disjunction();
    if (!accept(')')) {
      throw error("missing ')'");
    }
    return inner;
  }

  private Automaton quantified(Automaton atom) {
    if (atEnd()) {
      return atom;
    }
    Automaton result;
    char c = source.charAt(pos);
    if (c == '*') {
      pos++;
      result = atom.repeat();
    } else if (c == '+') {
      pos++;
      result = atom.repeat(1);
    } else if (c == '?') {
      pos++;
      result = atom.optional();
    } else if (c == '{' && quantifierAhead(pos)) {
      pos++;
      int min = number();
      Integer max = min;
      if (accept(',')) {
        max = peek('}') ? null : number();
      }
      expect('}');
      if (max != null && max < min) {
        throw error("numbers out of order in {} quantifier");
      }
      if (min > MAX_REPEAT || (max != null && max > MAX_REPEAT)) {
        throw error("repeat count above " + MAX_REPEAT);
      }
      result = max == null ? atom.repeat(min) : atom.repeat(min, max);
    } else {
      return atom;
    }
    // lazy and greedy quantifiers accept the same language
    accept('?');
    if (!atEnd() && "*+?".indexOf(source.charAt(pos)) >= 0) {
      throw error("nothing to repeat");
    }
    return result;
  }

  /// True when `{` at `at` starts `{n}`, `{n,}` or `{n,m}`; otherwise it is a literal.
  private boolean quantifierAhead(int at) {
    int i = at + 1;
    int digits = 0;
    while (i < source.length() && Character.isDigit(source.charAt(i))) {
      i++;
      digits++;
    }
    if (digits == 0 || i >= source.length()) {
      return false;
    }
    if (source.charAt(i) == '}') {
      return true;
    }
    if (source.charAt(i) != ',') {
      return false;
    }
    i++;
    while (i < source.length() && Character.isDigit(source.charAt(i))) {
      i++;
    }
    return i < source.length() && source.charAt(i) == '}';
  }

  private int number() {
    int start = pos;
    while (!atEnd() && Character.isDigit(source.charAt(pos))) {
      pos++;
    }
    if (start == pos) {
      throw error("expected a number");
    }
    try {
      return Integer.parseInt(source.substring(start, pos));
    } catch (NumberFormatException e) {
      throw error("repeat count too large");
    }
  }

  private Automaton escapeAtom() {
    if (atEnd()) {
      throw error("trailing backslash");
    }
    char c = source.charAt(pos);
    if (c == 'b' || c == 'B') {
      throw error("word boundary assertions are not supported");
    }
    if (c >= '1' && c <= '9') {
      throw error("backreferences are not supported");
    }
    if (c == 'k' && pos + 1 < source.length() && source.charAt(pos + 1) == '<') {
      throw error("backreferences are not supported");
    }
    return escape(false).toAutomaton();
  }

  /// Escape after a backslash, as a set of code units.
  private CharSet escape(boolean inClass) {
    char c = source.charAt(pos++);
    switch (c) {
      case 'd':
        return CharSet.DIGIT;
      case 'D':
        return CharSet.DIGIT.complement();
      case 'w':
        return CharSet.WORD;
      case 'W':
        return CharSet.WORD.complement();
      case 's':
        return CharSet.SPACE;
      case 'S':
        return CharSet.SPACE.complement();
      case 't':
        return CharSet.of('\t');
      case 'n':
        return CharSet.of('\n');
      case 'r':
        return CharSet.of('\r');
      case 'f':
        return CharSet.of('\f');
      case 'v':
        return CharSet.of('\u000B');
      case '0':
        if (!atEnd() && Character.isDigit(source.charAt(pos))) {
          throw error("octal escapes are not supported");
        }
        return CharSet.of('\0');
      case 'b':
        if (inClass) {
          return CharSet.of('\b');
        }
        throw error("word boundary assertions are not supported");
      case 'x':
        return CharSet.of((char) hex(2));
      case 'u':
        return CharSet.of((char) hex(4));
      case 'c':
        if (!atEnd() && Character.isLetter(source.charAt(pos))) {
          return CharSet.of((char) (source.charAt(pos++) % 32));
        }
        throw error("invalid control escape");
      default:
        if (Character.isLetterOrDigit(c)) {
          throw error("unsupported escape '\\" + c + "'");
        }
        return CharSet.of(c);
    }
  }

  private int hex(int digits) {
    if (pos + digits > source.length()) {
      throw error("truncated hex escape");
    }
    String text = source.substring(pos, pos + digits);
    try {
      int value = Integer.parseInt(text, 16);
      pos += digits;
      return value;
    } catch (NumberFormatException e) {
      throw error("invalid hex escape '" + text + "'");
    }
  }

  private CharSet characterClass() {
    boolean negated = accept('^');
    CharSet set = CharSet.EMPTY;
    while (true) {
      if (atEnd()) {
        throw error("unterminated character class");
      }
      char c = source.charAt(pos);
      if (c == ']') {
        pos++;
        break;
      }
      CharSet start = classAtom();
      if (peek('-') && pos + 1 < source.length() && source.charAt(pos + 1) != ']') {
        pos++;
        CharSet end = classAtom();
        if (!start.isSingle() || !end.isSingle()) {
          throw error("character class escape used as a range endpoint");
        }
        set = set.union(CharSet.range(start.low(0), end.low(0)));
      } else {
        set = set.union(start);
      }
    }
    return negated ? set.complement() : set;
  }

  private CharSet classAtom() {
    char c = source.charAt(pos++);
    if (c == '\\') {
      if (atEnd()) {
        throw error("trailing backslash");
      }
      return escape(true);
    }
    return CharSet.of(c);
  }

  private boolean atEnd() {
    return pos >= source.length();
  }

  private boolean peek(char c) {
    return pos < source.length() && source.charAt(pos) == c;
  }

  private boolean accept(char c) {
    if (peek(c)) {
      pos++;
      return true;
    }
    return false;
  }

  private void expect(char c) {
    if (!accept(c)) {
      throw error("expected '" + c + "'");
    }
  }

  private IllegalArgumentException error(String message) {
    return new IllegalArgumentException("regular expression /" + source + "/ at " + pos + ": " + message);
  }
}
