package de.example.js2py;

import java.util.List;
import java.util.Optional;

/**
 * Rewrites a token window of expression code into target spelling: literal
 * keywords, member-call renames, operators, comments, callbacks and (through
 * {@link LiteralReformatter}) object/array literals. Whitespace is kept as is.
 */
public final class ExpressionRewriter {
  private final LiteralReformatter literals;

  public ExpressionRewriter() {
    this.literals = new LiteralReformatter(this);
  }

  public String rewrite(List<Token> t, int from, int to, TranslationContext ctx) {
    StringBuilder sb = new StringBuilder();
    int i = from;
    while (i < to) {
      Token tok = t.get(i);

      FunctionLiteral fn = FunctionLiteral.mayStart(tok) ? FunctionLiteral.parse(t, i, to) : null;
      if (fn != null) {
        sb.append(lambda(t, fn, ctx));
        i = fn.end();
        continue;
      }

      i = switch (tok.kind()) {
        case KEYWORD -> keyword(sb, t, i, to);
        case IDENTIFIER -> {
          sb.append(identifier(t, i, ctx));
          yield i + 1;
        }
        case PUNCTUATION -> punctuation(sb, t, i, ctx);
        case COMMENT -> {
          sb.append(comment(t, i));
          yield i + 1;
        }
        case STRING -> {
          if (tok.text().startsWith("`")) throw new UnsupportedConstructException(UnsupportedCategory.TEMPLATE_LITERAL);
          sb.append(tok.text());
          yield i + 1;
        }
        default -> {
          sb.append(tok.text());
          yield i + 1;
        }
      };
    }
    return sb.toString();
  }

  // =========================================================
  // Token kinds
  // =========================================================
  private int keyword(StringBuilder sb, List<Token> t, int i, int to) {
    String kw = t.get(i).text();

    Optional<String> literal = DialectRules.literalKeyword(kw);
    if (literal.isPresent()) {
      sb.append(literal.get());
      return i + 1;
    }
    if (DialectRules.isDroppedKeyword(kw)) return Tokens.skipSpaces(t, i + 1, to);
    if (kw.equals("function")) throw new UnsupportedConstructException(UnsupportedCategory.CALLBACK_POSITION);
    if (DialectRules.isDeclarationKeyword(kw)) throw new UnsupportedConstructException(UnsupportedCategory.CONTROL_FLOW);

    throw new UnsupportedConstructException(
        DialectRules.unsupportedKeyword(kw).orElse(UnsupportedCategory.KEYWORD));
  }

  /** Applies a member-call rename when the identifier is {@code Receiver.member(}. */
  private String identifier(List<Token> t, int i, TranslationContext ctx) {
    String name = t.get(i).text();

    int dot = Tokens.prev(t, i);
    if (dot < 0 || !t.get(dot).is(".")) return name;
    int receiver = Tokens.prev(t, dot);
    if (receiver < 0 || t.get(receiver).kind() != TokenKind.IDENTIFIER) return name;
    int before = Tokens.prev(t, receiver);
    if (before >= 0 && t.get(before).is(".")) return name;
    int call = Tokens.next(t, i + 1);
    if (call >= t.size() || !t.get(call).is("(")) return name;

    return ctx.rename(t.get(receiver).text(), name);
  }

  private int punctuation(StringBuilder sb, List<Token> t, int i, TranslationContext ctx) {
    Token tok = t.get(i);
    String p = tok.text();

    if (p.equals("{")) {
      int close = Tokens.matching(t, i);
      sb.append(literals.object(t, i, close, ctx));
      return close + 1;
    }
    if (p.equals("[") && isArrayLiteral(t, i)) {
      int close = Tokens.matching(t, i);
      sb.append(literals.array(t, i, close, ctx));
      return close + 1;
    }

    Optional<UnsupportedCategory> unsupported = DialectRules.unsupportedOperator(p);
    if (unsupported.isPresent()) throw new UnsupportedConstructException(unsupported.get());

    Optional<String> word = DialectRules.operator(p);
    if (word.isPresent() && Character.isLetter(word.get().charAt(0))) {
      appendWord(sb, word.get(), i + 1 < t.size() ? t.get(i + 1) : null);
    } else {
      sb.append(word.orElse(p));
    }
    return i + 1;
  }

  private String comment(List<Token> t, int i) {
    Token c = t.get(i);
    if (c.text().startsWith("/*")) {
      int after = Tokens.skipSpaces(t, i + 1, t.size());
      if (after < t.size() && !t.get(after).isNewline()) {
        throw new UnsupportedConstructException(UnsupportedCategory.INLINE_BLOCK_COMMENT);
      }
    }
    return DialectRules.convertComment(c.text());
  }

  // =========================================================
  // Callbacks
  // =========================================================
  private String lambda(List<Token> t, FunctionLiteral fn, TranslationContext ctx) {
    if (!fn.singleReturn()) throw new UnsupportedConstructException(UnsupportedCategory.MULTI_STATEMENT_FUNCTION);
    if (!isSoleHigherOrderArgument(t, fn)) throw new UnsupportedConstructException(UnsupportedCategory.CALLBACK_POSITION);

    String params = fn.params().isEmpty() ? "" : " " + String.join(", ", fn.params());
    StringBuilder sb = new StringBuilder("lambda").append(params).append(": ").append(returned(t, fn, ctx));
    // a comment ends the line, so the closing bracket has to move to the next one
    for (Token c : fn.comments()) sb.append("  ").append(DialectRules.convertComment(c.text())).append('\n');
    return sb.toString();
  }

  /** The returned expression of a single-return function, {@code None} when empty. */
  String returned(List<Token> t, FunctionLiteral fn, TranslationContext ctx) {
    if (fn.returnFrom() >= fn.returnTo()) return "None";
    return rewrite(t, fn.returnFrom(), fn.returnTo(), ctx);
  }

  private boolean isSoleHigherOrderArgument(List<Token> t, FunctionLiteral fn) {
    int open = Tokens.prev(t, fn.start());
    if (open < 0 || !t.get(open).is("(")) return false;
    int close = Tokens.next(t, fn.end());
    if (close >= t.size() || !t.get(close).is(")")) return false;

    int callee = Tokens.prev(t, open);
    if (callee < 0 || t.get(callee).kind() != TokenKind.IDENTIFIER) return false;
    if (!DialectRules.HIGHER_ORDER_CALLS.contains(t.get(callee).text())) return false;
    int dot = Tokens.prev(t, callee);
    return dot >= 0 && t.get(dot).is(".");
  }

  // =========================================================
  // Helpers
  // =========================================================
  /** {@code [} starts an array literal unless it indexes the preceding operand. */
  private boolean isArrayLiteral(List<Token> t, int i) {
    int p = Tokens.prev(t, i);
    if (p < 0) return true;
    Token prev = t.get(p);
    return switch (prev.kind()) {
      case IDENTIFIER, NUMBER, STRING -> false;
      case PUNCTUATION -> !(prev.is(")") || prev.is("]") || prev.is("}"));
      default -> true;
    };
  }

  private void appendWord(StringBuilder sb, String word, Token next) {
    if (sb.length() > 0) {
      char last = sb.charAt(sb.length() - 1);
      if (!Character.isWhitespace(last) && last != '(' && last != '[') sb.append(' ');
    }
    sb.append(word);
    if (next != null && next.kind() != TokenKind.WHITESPACE) sb.append(' ');
  }
}
