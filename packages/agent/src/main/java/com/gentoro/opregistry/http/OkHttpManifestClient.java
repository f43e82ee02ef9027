package com.gentoro.opregistry.http;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** {@link ManifestHttpClient} backed by OkHttp. */
public class OkHttpManifestClient implements ManifestHttpClient {
  private final OkHttpClient client;

  public OkHttpManifestClient() {
    this(OkHttpFactory.create());
  }

  public OkHttpManifestClient(OkHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public ManifestHttpResponse get(String url, Map<String, String> headers, Duration timeout)
      throws IOException {
    Request.Builder request = new Request.Builder().url(url).get();
    headers.forEach(request::header);

    OkHttpClient call = client.newBuilder().callTimeout(timeout).build();
    try (Response response = call.newCall(request.build()).execute()) {
      ResponseBody body = response.body();
      return new ManifestHttpResponse(
          response.code(),
          response.header("Content-Type"),
          response.header("ETag"),
          body == null ? "" : body.string());
    }
  }
}
