package com.gentoro.docgen;

import com.gentoro.docgen.exception.DocGenException;

public class DocGenApp {

  private static final org.slf4j.Logger log =
      com.gentoro.docgen.logging.LoggingService.getLogger(DocGenApp.class);

  public static void main(String[] args) {
    try {
      new DocGen(args).run(System.out);
    } catch (DocGenException e) {
      log.error("Documentation generation failed: {}", e.getMessage(), e);
      System.err.println(e.getMessage());
      System.exit(1);
    }
  }
}
