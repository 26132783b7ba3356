package com.gentoro.docgen.reflection;

import com.gentoro.docgen.exception.ValidationException;
import java.util.Map;

/**
 * A parsed documentation cross-reference such as {@code T:com.acme.Order} or {@code
 * F:com.acme.Examples.ORDER_JSON}.
 *
 * @param kind member kind prefix
 * @param typeName fully qualified name of the type, or of the member's declaring type
 * @param memberName member name, {@code null} for type references
 */
public record CrefReference(Kind kind, String typeName, String memberName) {

  public enum Kind {
    TYPE('T'),
    FIELD('F'),
    PROPERTY('P'),
    METHOD('M'),
    EVENT('E'),
    NAMESPACE('N');

    private final char prefix;

    Kind(char prefix) {
      this.prefix = prefix;
    }

    public char prefix() {
      return prefix;
    }

    static Kind fromPrefix(char prefix) {
      for (Kind k : values()) {
        if (k.prefix == prefix) return k;
      }
      return null;
    }
  }

  public static CrefReference parse(String cref) {
    if (cref == null || cref.length() < 3 || cref.charAt(1) != ':') {
      throw invalid(cref);
    }
    Kind kind = Kind.fromPrefix(cref.charAt(0));
    if (kind == null) {
      throw invalid(cref);
    }

    String name = cref.substring(2).trim();
    int paren = name.indexOf('(');
    if (paren >= 0) {
      name = name.substring(0, paren);
    }
    if (name.isEmpty()) {
      throw invalid(cref);
    }

    if (kind == Kind.TYPE || kind == Kind.NAMESPACE) {
      return new CrefReference(kind, stripGenericArity(name), null);
    }

    int lastDot = name.lastIndexOf('.');
    if (lastDot <= 0 || lastDot == name.length() - 1) {
      throw invalid(cref);
    }
    return new CrefReference(
        kind, stripGenericArity(name.substring(0, lastDot)), name.substring(lastDot + 1));
  }

  // List`1 -> List
  private static String stripGenericArity(String name) {
    return name.replaceAll("`\\d+", "");
  }

  private static ValidationException invalid(String cref) {
    return new ValidationException(
        "Invalid cross-reference \"%s\"; expected the form <kind>:<qualified name>.".formatted(cref),
        Map.of("cref", String.valueOf(cref)));
  }

  @Override
  public String toString() {
    return kind.prefix() + ":" + (memberName == null ? typeName : typeName + "." + memberName);
  }
}
