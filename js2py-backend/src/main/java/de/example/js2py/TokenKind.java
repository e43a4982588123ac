package de.example.js2py;

public enum TokenKind {
  KEYWORD,
  IDENTIFIER,
  STRING,
  NUMBER,
  PUNCTUATION,
  COMMENT,
  WHITESPACE
}
