package io.github.randomcodespace.dockerbuild.transport;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.github.dockerjava.transport.DockerHttpClient;
import io.github.randomcodespace.dockerbuild.core.PreparedBuildRequest;
import io.github.randomcodespace.dockerbuild.exceptions.ApiResponseException;
import io.github.randomcodespace.dockerbuild.exceptions.ContainerBuildException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class DockerBuildDispatcherTest {

  @Mock private DockerHttpClient httpClient;
  @Mock private DockerHttpClient.Response response;

  private DockerBuildDispatcher dispatcher;
  private PreparedBuildRequest request;

  @BeforeEach
  void setUp() {
    dispatcher = new DockerBuildDispatcher(httpClient);

    Map<String, List<String>> parameters = new LinkedHashMap<>();
    parameters.put("t", List.of("app:latest"));
    parameters.put("dockerfile", List.of("Dockerfile"));
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/x-tar");
    headers.put("X-Registry-Config", "e30=");
    request =
        PreparedBuildRequest.builder()
            .parameters(parameters)
            .headers(headers)
            .body(new ByteArrayInputStream(new byte[] {1}))
            .build();
  }

  private static InputStream text(String body) {
    return new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void testDispatchPostsToBuildEndpointAndStreamsOutput() throws Exception {
    when(httpClient.execute(any())).thenReturn(response);
    when(response.getStatusCode()).thenReturn(200);
    when(response.getBody())
        .thenReturn(text("{\"stream\":\"Step 1/2\"}\n\n{\"stream\":\"Successfully built\"}\n"));
    List<String> output = new ArrayList<>();

    dispatcher.dispatch(request, output::add);

    ArgumentCaptor<DockerHttpClient.Request> captor =
        ArgumentCaptor.forClass(DockerHttpClient.Request.class);
    verify(httpClient).execute(captor.capture());
    DockerHttpClient.Request sent = captor.getValue();
    assertEquals(DockerHttpClient.Request.Method.POST, sent.method());
    assertEquals("/build?t=app%3Alatest&dockerfile=Dockerfile", sent.path());
    assertEquals("e30=", sent.headers().get("X-Registry-Config"));
    assertEquals("application/x-tar", sent.headers().get("Content-Type"));
    assertEquals(
        List.of("{\"stream\":\"Step 1/2\"}", "{\"stream\":\"Successfully built\"}"), output);
    verify(response).close();
  }

  @Test
  void testDaemonErrorIsRaisedWithStatusCode() {
    when(httpClient.execute(any())).thenReturn(response);
    when(response.getStatusCode()).thenReturn(500);
    when(response.getBody())
        .thenReturn(text("{\"message\":\"Cannot locate specified Dockerfile\"}"));

    ApiResponseException e =
        assertThrows(ApiResponseException.class, () -> dispatcher.dispatch(request, null));

    assertEquals(500, e.getStatusCode());
    assertTrue(e.getMessage().contains("Cannot locate specified Dockerfile"));
  }

  @Test
  void testIoFailureWhileStreamingIsWrapped() {
    InputStream broken =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("connection reset");
          }
        };
    when(httpClient.execute(any())).thenReturn(response);
    when(response.getStatusCode()).thenReturn(200);
    when(response.getBody()).thenReturn(broken);

    ContainerBuildException e =
        assertThrows(ContainerBuildException.class, () -> dispatcher.dispatch(request, null));
    assertTrue(e.getMessage().contains("connection reset"));
  }

  @Test
  void testCloseReleasesHttpClient() throws Exception {
    dispatcher.close();

    verify(httpClient).close();
  }
}
