package io.github.randomcodespace.dockerbuild.context;

import java.nio.file.Path;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** What the context archiver should package: a directory plus files injected under fixed names. */
@Getter
@Builder
@ToString
public class BuildContextSpec {
  private final Path contextDirectory;

  @Singular("extraEntry")
  private final Map<String, Path> extraEntries; // archive entry name -> file on disk
}
