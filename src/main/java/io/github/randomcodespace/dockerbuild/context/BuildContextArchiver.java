package io.github.randomcodespace.dockerbuild.context;

import java.io.IOException;
import java.io.InputStream;

/**
 * Packages a build context into the tar stream the daemon expects. Implementations must honour
 * {@link BuildContextSpec#getExtraEntries()} so relocated Dockerfiles end up in the archive.
 */
public interface BuildContextArchiver {

  InputStream archive(BuildContextSpec spec) throws IOException;
}
