package de.example.js2py;

/** Constructs that are recognized but left untranslated and flagged in the output. */
public enum UnsupportedCategory {
  CONTROL_FLOW("control flow statement"),
  LABELED_STATEMENT("labeled statement"),
  MULTI_STATEMENT_FUNCTION("multi-statement function body"),
  CALLBACK_POSITION("function literal outside a map/filter call"),
  FUNCTION_PARAMETERS("non-trivial function parameters"),
  CONDITIONAL_EXPRESSION("conditional expression"),
  UPDATE_OPERATOR("increment/decrement operator"),
  TEMPLATE_LITERAL("template literal"),
  DESTRUCTURING("destructuring declaration"),
  SPREAD("spread syntax"),
  OBJECT_KEY("computed or method object key"),
  SPARSE_ARRAY("sparse array literal"),
  INLINE_BLOCK_COMMENT("inline block comment"),
  KEYWORD("keyword without Python equivalent"),
  OPERATOR("operator without Python equivalent");

  private final String label;

  UnsupportedCategory(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
