package com.gentoro.docgen.contracts;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

/** Packs the contract classes into a jar so tests can resolve them through an isolated loader. */
public final class ContractAssemblies {
  public static final String JAR_NAME = "docgen-test-contracts.jar";

  private static final List<Class<?>> CONTRACTS =
      List.of(
          Examples.class,
          Examples.Nested.class,
          SampleObject1.class,
          SampleStatus.class,
          SampleRecord.class);

  private ContractAssemblies() {}

  public static Path buildJar(Path directory) throws IOException {
    Path jar = directory.resolve(JAR_NAME);
    try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
      for (Class<?> contract : CONTRACTS) {
        String entry = contract.getName().replace('.', '/') + ".class";
        out.putNextEntry(new JarEntry(entry));
        try (InputStream in = ContractAssemblies.class.getClassLoader().getResourceAsStream(entry)) {
          if (in == null) {
            throw new IOException("Compiled contract class not found: " + entry);
          }
          in.transferTo(out);
        }
        out.closeEntry();
      }
    }
    return jar;
  }
}
