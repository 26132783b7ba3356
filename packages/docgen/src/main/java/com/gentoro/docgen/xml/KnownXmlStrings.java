package com.gentoro.docgen.xml;

/** Tag and attribute names recognized in documentation fragments. Matching is case-sensitive. */
public final class KnownXmlStrings {
  private KnownXmlStrings() {}

  public static final String EXAMPLE = "example";
  public static final String SUMMARY = "summary";
  public static final String URL = "url";
  public static final String VALUE = "value";
  public static final String SEE = "see";
  public static final String HEADER = "header";
  public static final String DESCRIPTION = "description";

  public static final String NAME = "name";
  public static final String CREF = "cref";
}
