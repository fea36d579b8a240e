package io.github.randomcodespace.dockerbuild.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import io.github.randomcodespace.dockerbuild.auth.AuthConfigSet;
import io.github.randomcodespace.dockerbuild.auth.AuthHeaderEncoder;
import io.github.randomcodespace.dockerbuild.auth.RegistryCredential;
import io.github.randomcodespace.dockerbuild.context.BuildContextArchiver;
import io.github.randomcodespace.dockerbuild.context.BuildContextSpec;
import io.github.randomcodespace.dockerbuild.context.DockerfileRelocator;
import io.github.randomcodespace.dockerbuild.context.PathResolver;
import io.github.randomcodespace.dockerbuild.dto.ImageBuildConfig;
import io.github.randomcodespace.dockerbuild.exceptions.AuthEncodingException;
import io.github.randomcodespace.dockerbuild.exceptions.ContainerBuildException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class BuildRequestAssemblerTest {

  @Mock private BuildContextArchiver archiver;

  @TempDir Path tempDir;

  private Path context;
  private AuthConfigSet authConfigs;
  private BuildRequestAssembler assembler;

  @BeforeEach
  void setUp() throws Exception {
    context = Files.createDirectories(tempDir.resolve("context"));
    Files.writeString(context.resolve("Dockerfile"), "FROM busybox\n");
    Files.writeString(tempDir.resolve("Dockerfile.shared"), "FROM alpine\n");

    authConfigs =
        AuthConfigSet.empty()
            .put(
                "https://example.com",
                RegistryCredential.builder()
                    .username("example")
                    .password("example")
                    .email("example@example.com")
                    .build());
    assembler = new BuildRequestAssembler(archiver);
  }

  /** Input stream that remembers whether it was closed. */
  private static class TrackingStream extends ByteArrayInputStream {
    private boolean closed;

    TrackingStream() {
      super(new byte[0]);
    }

    @Override
    public void close() throws IOException {
      closed = true;
      super.close();
    }
  }

  @Test
  void testLocalBuildWithDockerfileInContext() throws Exception {
    InputStream tar = new ByteArrayInputStream(new byte[] {1, 2, 3});
    when(archiver.archive(any())).thenReturn(tar);
    ImageBuildConfig config =
        ImageBuildConfig.builder().contextDirectory(context).dockerfile("Dockerfile").build();

    PreparedBuildRequest request = assembler.assemble(config, authConfigs);

    ArgumentCaptor<BuildContextSpec> spec = ArgumentCaptor.forClass(BuildContextSpec.class);
    verify(archiver).archive(spec.capture());
    assertEquals(context.toAbsolutePath(), spec.getValue().getContextDirectory());
    assertTrue(spec.getValue().getExtraEntries().isEmpty());

    assertSame(tar, request.getBody().orElseThrow());
    assertEquals("Dockerfile", request.getParameter("dockerfile").orElseThrow());
    assertEquals(
        Map.of(
            BuildRequestAssembler.CONTENT_TYPE_HEADER,
            BuildRequestAssembler.TAR_CONTENT_TYPE,
            AuthHeaderEncoder.REGISTRY_CONFIG_HEADER,
            new AuthHeaderEncoder().encode(authConfigs)),
        request.getHeaders());
  }

  @Test
  void testDockerfileOutsideContextIsShippedInsideArchive() throws Exception {
    when(archiver.archive(any())).thenReturn(new ByteArrayInputStream(new byte[0]));
    ImageBuildConfig config =
        ImageBuildConfig.builder()
            .contextDirectory(context)
            .dockerfile("../Dockerfile.shared")
            .build();

    PreparedBuildRequest request = assembler.assemble(config, null);

    String dockerfile = request.getParameter("dockerfile").orElseThrow();
    assertTrue(dockerfile.startsWith(PathResolver.RELOCATED_DOCKERFILE_PREFIX), dockerfile);
    ArgumentCaptor<BuildContextSpec> spec = ArgumentCaptor.forClass(BuildContextSpec.class);
    verify(archiver).archive(spec.capture());
    assertEquals(
        Map.of(dockerfile, tempDir.resolve("Dockerfile.shared").toAbsolutePath()),
        spec.getValue().getExtraEntries());
    assertFalse(request.getHeaders().containsKey(AuthHeaderEncoder.REGISTRY_CONFIG_HEADER));
  }

  @Test
  void testRemoteBuildWithRegistryAuth() {
    ImageBuildConfig config =
        ImageBuildConfig.builder().remote("https://github.com/docker-library/mongo").build();

    PreparedBuildRequest request = assembler.assemble(config, authConfigs);

    verifyNoInteractions(archiver);
    assertTrue(request.getBody().isEmpty());
    assertEquals(
        Map.of(
            "q", List.of("false"),
            "rm", List.of("false"),
            "nocache", List.of("false"),
            "pull", List.of("false"),
            "forcerm", List.of("false"),
            "remote", List.of("https://github.com/docker-library/mongo")),
        request.getParameters());
    assertEquals(
        Map.of(
            AuthHeaderEncoder.REGISTRY_CONFIG_HEADER, new AuthHeaderEncoder().encode(authConfigs)),
        request.getHeaders());
  }

  @Test
  void testBuildOptionsBecomeQueryParameters() throws Exception {
    when(archiver.archive(any())).thenReturn(new ByteArrayInputStream(new byte[0]));
    ImageBuildConfig config =
        ImageBuildConfig.builder()
            .contextDirectory(context)
            .tag("app:1.0")
            .tag("app:latest")
            .buildArg("VERSION", "1.0")
            .label("team", "build")
            .noCache(true)
            .pullParent(true)
            .removeIntermediateContainers(true)
            .build();

    PreparedBuildRequest request = assembler.assemble(config, AuthConfigSet.empty());

    assertEquals(List.of("app:1.0", "app:latest"), request.getParameters().get("t"));
    assertFalse(request.getParameters().containsKey("dockerfile"));
    assertEquals("{\"VERSION\":\"1.0\"}", request.getParameter("buildargs").orElseThrow());
    assertEquals("{\"team\":\"build\"}", request.getParameter("labels").orElseThrow());
    assertEquals(
        "/build?t=app%3A1.0&t=app%3Alatest&q=false&rm=true&nocache=true&pull=true&forcerm=false"
            + "&buildargs=%7B%22VERSION%22%3A%221.0%22%7D&labels=%7B%22team%22%3A%22build%22%7D",
        request.toRequestPath());
  }

  @Test
  void testContextAndRemoteAreMutuallyExclusive() {
    ImageBuildConfig both =
        ImageBuildConfig.builder()
            .contextDirectory(context)
            .remote("https://example.com/x.git")
            .build();
    ImageBuildConfig neither = ImageBuildConfig.builder().build();

    assertThrows(ContainerBuildException.class, () -> assembler.assemble(both, null));
    assertThrows(ContainerBuildException.class, () -> assembler.assemble(neither, null));
    verifyNoInteractions(archiver);
  }

  @Test
  void testArchiveFailureIsReported() throws Exception {
    when(archiver.archive(any())).thenThrow(new IOException("disk full"));
    ImageBuildConfig config = ImageBuildConfig.builder().contextDirectory(context).build();

    ContainerBuildException e =
        assertThrows(ContainerBuildException.class, () -> assembler.assemble(config, authConfigs));
    assertTrue(e.getMessage().contains("disk full"));
  }

  @Test
  void testAuthFailureClosesArchiveAndAborts() throws Exception {
    TrackingStream tar = new TrackingStream();
    when(archiver.archive(any())).thenReturn(tar);
    AuthHeaderEncoder encoder = mock(AuthHeaderEncoder.class);
    when(encoder.attach(anyMap(), any())).thenThrow(new AuthEncodingException("bad credentials"));
    BuildRequestAssembler failing =
        new BuildRequestAssembler(new PathResolver(), new DockerfileRelocator(), archiver, encoder);
    ImageBuildConfig config = ImageBuildConfig.builder().contextDirectory(context).build();

    assertThrows(AuthEncodingException.class, () -> failing.assemble(config, authConfigs));
    assertTrue(tar.closed);
  }
}
